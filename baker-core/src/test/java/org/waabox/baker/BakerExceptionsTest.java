package org.waabox.baker;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.io.IOException;

import org.junit.jupiter.api.Test;
import org.waabox.baker.datamodel.Distros;

/**
 * Tests for the exceptions thrown by {@link Baker}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class BakerExceptionsTest {

  @Test
  void whenCreatingUnknownCloud_shouldNameTheCloud() {
    final UnknownCloudException e = new UnknownCloudException("Mars");

    assertEquals("Don't have settings for cloud 'Mars'", e.getMessage());
    assertEquals("Mars", e.cloudName());
  }

  @Test
  void whenCreatingSigResolution_givenCause_shouldRetainIt() {
    final IOException cause = new IOException("offline");
    final SigResolutionException e =
        new SigResolutionException("eastus", "gallery lookup failed", cause);

    assertEquals("Can't resolve SIG environment for region 'eastus':"
        + " gallery lookup failed", e.getMessage());
    assertSame(cause, e.getCause());
    assertEquals("eastus", e.region());
  }

  @Test
  void whenCreatingImageNotFound_shouldNameDistroAndRegion() {
    final ImageNotFoundException e = new ImageNotFoundException(
        Distros.AKS_AZURE_LINUX_V2, "uksouth");

    assertEquals("Can't find image for distro 'aks-azurelinux-v2' in region"
        + " 'uksouth'", e.getMessage());
  }

  @Test
  void whenCreating_shouldBeRuntimeExceptions() {
    assertInstanceOf(RuntimeException.class, new BakerException("boom"));
    assertInstanceOf(RuntimeException.class,
        new UnknownCloudException("x"));
  }
}
