package org.waabox.baker.datamodel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link Distros} and {@link Distro}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class DistrosTest {

  @Test
  void whenLookingUp_givenKnownName_shouldReturnConstant() {
    assertSame(Distros.AKS_CBL_MARINER_V2_GEN2,
        Distros.byName("aks-cblmariner-v2-gen2").orElseThrow());
  }

  @Test
  void whenLookingUp_givenUnknownName_shouldReturnEmpty() {
    assertTrue(Distros.byName("aks-unknown").isEmpty());
  }

  @Test
  void whenListing_shouldHaveExactlyThreeCustomizedDistros() {
    final List<Distro> customized = Distros.all().stream()
        .filter(Distro::isCustomized)
        .toList();

    assertEquals(List.of(Distros.CUSTOMIZED_WINDOWS_OS_IMAGE,
        Distros.CUSTOMIZED_IMAGE, Distros.CUSTOMIZED_IMAGE_KATA), customized);
  }

  @Test
  void whenClassifying_givenWindowsDistro_shouldBeWindows() {
    assertTrue(Distros.AKS_WINDOWS_2019_CONTAINERD.isWindows());
    assertTrue(Distros.CUSTOMIZED_WINDOWS_OS_IMAGE.isWindows());
    assertFalse(Distros.AKS_UBUNTU_CONTAINERD_2204.isWindows());
  }

  @Test
  void whenClassifying_givenCustomizedDistro_shouldExposeKind() {
    assertEquals(CustomImageKind.CONFIDENTIAL,
        Distros.CUSTOMIZED_IMAGE_KATA.customImageKind().orElseThrow());
    assertTrue(Distros.AKS_AZURE_LINUX_V2.customImageKind().isEmpty());
  }

  @Test
  void whenPrinting_shouldUseName() {
    assertEquals("aks-ubuntu-containerd-22.04",
        Distros.AKS_UBUNTU_CONTAINERD_2204.toString());
  }
}
