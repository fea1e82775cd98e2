package org.waabox.baker.catalog.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.waabox.baker.BakerException;
import org.waabox.baker.catalog.SigImageTemplates;
import org.waabox.baker.catalog.StaticOsImageCatalog;
import org.waabox.baker.datamodel.CloudSpecConfig;
import org.waabox.baker.datamodel.Distro;
import org.waabox.baker.datamodel.Distros;
import org.waabox.baker.datamodel.OsFamily;
import org.waabox.baker.datamodel.OsImageConfig;
import org.waabox.baker.datamodel.SigImageConfigTemplate;

/**
 * Tests for {@link JsonCatalogLoader}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class JsonCatalogLoaderTest {

  @TempDir
  Path tempDir;

  @Test
  void whenLoadingOsImages_givenCatalogFile_shouldLoadEveryCloud()
      throws URISyntaxException {
    final StaticOsImageCatalog catalog =
        JsonCatalogLoader.loadOsImageCatalog(resource("os-images.json"));

    assertEquals(Set.of(CloudSpecConfig.AZURE_PUBLIC_CLOUD,
        CloudSpecConfig.AZURE_CHINA_CLOUD), catalog.clouds());

    final Map<Distro, OsImageConfig> images =
        catalog.forCloud(CloudSpecConfig.AZURE_PUBLIC_CLOUD).orElseThrow();
    assertEquals(new OsImageConfig("aks", "aks-ubuntu-containerd-2204",
        "microsoft-aks", "2022.10.03"),
        images.get(Distros.AKS_UBUNTU_CONTAINERD_2204));
    assertEquals("17763.5696.240415",
        images.get(Distros.AKS_WINDOWS_2019_CONTAINERD).imageVersion());
  }

  @Test
  void whenLoadingOsImages_givenUnknownDistro_shouldSkipIt()
      throws URISyntaxException {
    final StaticOsImageCatalog catalog =
        JsonCatalogLoader.loadOsImageCatalog(resource("os-images.json"));

    assertEquals(2, catalog.forCloud(CloudSpecConfig.AZURE_PUBLIC_CLOUD)
        .orElseThrow().size());
    assertTrue(catalog.forCloud(CloudSpecConfig.AZURE_CHINA_CLOUD)
        .orElseThrow().isEmpty());
  }

  @Test
  void whenLoadingTemplates_givenTemplateFile_shouldGroupByFamily()
      throws URISyntaxException {
    final SigImageTemplates templates =
        JsonCatalogLoader.loadSigImageTemplates(resource("sig-images.json"));

    assertEquals(2, templates.forFamily(OsFamily.UBUNTU).size());
    assertEquals(new SigImageConfigTemplate("V2gen2", "202405.20.0"),
        templates.forFamily(OsFamily.CBL_MARINER)
            .get(Distros.AKS_CBL_MARINER_V2_GEN2));
    assertTrue(templates.forFamily(OsFamily.UBUNTU_EDGE_ZONE).isEmpty());
  }

  @Test
  void whenLoadingTemplates_givenUnknownDistro_shouldDefineItInFamily()
      throws URISyntaxException {
    final SigImageTemplates templates =
        JsonCatalogLoader.loadSigImageTemplates(resource("sig-images.json"));

    final Distro defined = Distro.of("aks-azurelinux-v4-gen2",
        OsFamily.AZURE_LINUX);
    assertEquals("V4gen2", templates.forFamily(OsFamily.AZURE_LINUX)
        .get(defined).definition());
  }

  @Test
  void whenLoadingTemplates_givenUnknownFamily_shouldThrow()
      throws IOException {
    final Path file = tempDir.resolve("sig-images.json");
    Files.writeString(file, "{\"SOLARIS\": {}}");

    final BakerException e = assertThrows(BakerException.class,
        () -> JsonCatalogLoader.loadSigImageTemplates(file));

    assertTrue(e.getMessage().contains("SOLARIS"));
  }

  @Test
  void whenLoadingTemplates_givenMissingVersion_shouldThrow()
      throws IOException {
    final Path file = tempDir.resolve("sig-images.json");
    Files.writeString(file,
        "{\"UBUNTU\": {\"aks-ubuntu-containerd-22.04\":"
            + " {\"definition\": \"2204containerd\"}}}");

    final BakerException e = assertThrows(BakerException.class,
        () -> JsonCatalogLoader.loadSigImageTemplates(file));

    assertTrue(e.getMessage().contains("Missing field 'version'"));
    assertTrue(e.getMessage()
        .contains("{\"definition\":\"2204containerd\"}"));
    assertTrue(e.getMessage().endsWith("of file: " + file));
  }

  @Test
  void whenLoadingOsImages_givenMalformedJson_shouldThrow()
      throws IOException {
    final Path file = tempDir.resolve("os-images.json");
    Files.writeString(file, "{\"AzurePublicCloud\": ");

    final BakerException e = assertThrows(BakerException.class,
        () -> JsonCatalogLoader.loadOsImageCatalog(file));

    assertTrue(e.getMessage().contains(file.toString()));
  }

  @Test
  void whenLoadingOsImages_givenArrayRoot_shouldThrow() throws IOException {
    final Path file = tempDir.resolve("os-images.json");
    Files.writeString(file, "[]");

    assertThrows(BakerException.class,
        () -> JsonCatalogLoader.loadOsImageCatalog(file));
  }

  @Test
  void whenLoadingOsImages_givenMissingFile_shouldWrapCause() {
    final BakerException e = assertThrows(BakerException.class,
        () -> JsonCatalogLoader.loadOsImageCatalog(
            tempDir.resolve("missing.json")));

    assertInstanceOf(NoSuchFileException.class, e.getCause());
  }

  /**
   * Resolves a test resource to a path.
   *
   * @param name the resource name
   *
   * @return the path, never null
   *
   * @throws URISyntaxException if the resource URL is invalid
   */
  static Path resource(final String name) throws URISyntaxException {
    return Path.of(JsonCatalogLoaderTest.class.getResource("/" + name)
        .toURI());
  }
}
