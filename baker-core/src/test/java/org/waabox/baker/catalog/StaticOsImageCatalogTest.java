package org.waabox.baker.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.waabox.baker.datamodel.CloudSpecConfig;
import org.waabox.baker.datamodel.Distro;
import org.waabox.baker.datamodel.Distros;
import org.waabox.baker.datamodel.OsImageConfig;

/**
 * Tests for {@link StaticOsImageCatalog}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class StaticOsImageCatalogTest {

  private static final OsImageConfig UBUNTU = new OsImageConfig("aks",
      "aks-ubuntu-containerd-2204", "microsoft-aks", "2022.10.03");

  @Test
  void whenLookingUp_givenKnownCloud_shouldReturnItsImages() {
    final StaticOsImageCatalog catalog = StaticOsImageCatalog.builder()
        .image(CloudSpecConfig.AZURE_PUBLIC_CLOUD,
            Distros.AKS_UBUNTU_CONTAINERD_2204, UBUNTU)
        .build();

    final Map<Distro, OsImageConfig> images =
        catalog.forCloud(CloudSpecConfig.AZURE_PUBLIC_CLOUD).orElseThrow();

    assertEquals(Map.of(Distros.AKS_UBUNTU_CONTAINERD_2204, UBUNTU), images);
  }

  @Test
  void whenLookingUp_givenUnknownCloud_shouldReturnEmpty() {
    final StaticOsImageCatalog catalog = StaticOsImageCatalog.builder()
        .cloud(CloudSpecConfig.AZURE_PUBLIC_CLOUD)
        .build();

    assertTrue(catalog.forCloud("Nowhere").isEmpty());
  }

  @Test
  void whenLookingUp_givenDeclaredCloudWithoutImages_shouldReturnEmptyMap() {
    final StaticOsImageCatalog catalog = StaticOsImageCatalog.builder()
        .cloud(CloudSpecConfig.US_SEC_CLOUD)
        .build();

    assertTrue(catalog.forCloud(CloudSpecConfig.US_SEC_CLOUD)
        .orElseThrow().isEmpty());
    assertEquals(Set.of(CloudSpecConfig.US_SEC_CLOUD), catalog.clouds());
  }

  @Test
  void whenBuilt_shouldNotSeeLaterBuilderChanges() {
    final StaticOsImageCatalog.Builder builder = StaticOsImageCatalog
        .builder().cloud(CloudSpecConfig.AZURE_PUBLIC_CLOUD);
    final StaticOsImageCatalog catalog = builder.build();

    builder.image(CloudSpecConfig.AZURE_PUBLIC_CLOUD,
        Distros.AKS_UBUNTU_CONTAINERD_2204, UBUNTU);

    assertTrue(catalog.forCloud(CloudSpecConfig.AZURE_PUBLIC_CLOUD)
        .orElseThrow().isEmpty());
  }

  @Test
  void whenLookingUp_shouldReturnUnmodifiableMap() {
    final StaticOsImageCatalog catalog = StaticOsImageCatalog.builder()
        .cloud(CloudSpecConfig.AZURE_PUBLIC_CLOUD)
        .build();

    assertThrows(UnsupportedOperationException.class,
        () -> catalog.forCloud(CloudSpecConfig.AZURE_PUBLIC_CLOUD)
            .orElseThrow().put(Distros.AKS_UBUNTU_CONTAINERD_2204, UBUNTU));
  }
}
