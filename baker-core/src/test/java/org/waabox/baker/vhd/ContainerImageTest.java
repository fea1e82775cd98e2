package org.waabox.baker.vhd;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ContainerImage}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ContainerImageTest {

  @Test
  void whenGettingRepositoryName_givenTaggedUrl_shouldStripTag() {
    final ContainerImage image = new ContainerImage(
        "mcr.microsoft.com/oss/kubernetes/kube-proxy:*", List.of(),
        List.of());

    assertEquals("kube-proxy", image.repositoryName());
  }

  @Test
  void whenGettingRepositoryName_givenUntaggedUrl_shouldReturnLastSegment() {
    final ContainerImage image = new ContainerImage(
        "mcr.microsoft.com/azuremonitor/containerinsights/ciprod", List.of(),
        List.of());

    assertEquals("ciprod", image.repositoryName());
  }

  @Test
  void whenCreating_givenAmd64OnlyVersions_shouldKeepPlainStrings() {
    final List<String> versions = new ArrayList<>(
        List.of("3.1.19", "win-3.1.19"));
    final ContainerImage image = new ContainerImage(
        "mcr.microsoft.com/azuremonitor/containerinsights/ciprod", versions,
        List.of(new ImageVersion("3.1.20", "3.1.19")));

    versions.clear();

    assertEquals(List.of("3.1.19", "win-3.1.19"), image.amd64OnlyVersions());
    assertEquals("3.1.20",
        image.multiArchVersions().get(0).latestVersion());
  }
}
