package org.waabox.baker.spring;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.waabox.baker.Baker;
import org.waabox.baker.catalog.OsImageCatalog;
import org.waabox.baker.catalog.SigCatalogProvider;
import org.waabox.baker.datamodel.AgentPoolProfile;
import org.waabox.baker.datamodel.CloudSpecConfig;
import org.waabox.baker.datamodel.ContainerService;
import org.waabox.baker.datamodel.Distros;
import org.waabox.baker.datamodel.EnvironmentInfo;
import org.waabox.baker.datamodel.NodeBootstrapping;
import org.waabox.baker.datamodel.NodeBootstrappingConfiguration;
import org.waabox.baker.datamodel.OsFamily;
import org.waabox.baker.datamodel.OsType;
import org.waabox.baker.datamodel.SigAzureEnvironmentSpecConfig;
import org.waabox.baker.datamodel.SigConfig;
import org.waabox.baker.datamodel.SigGalleryConfig;
import org.waabox.baker.datamodel.SigImageConfig;
import org.waabox.baker.metrics.BakerMetrics;
import org.waabox.baker.metrics.NoopBakerMetrics;
import org.waabox.baker.overrides.OverrideStore;
import org.waabox.baker.overrides.k8s.ConfigMapOverrideStore;
import org.waabox.baker.template.TemplateGenerator;
import org.waabox.baker.vhd.CachedOnVhd;

/**
 * Tests for {@link BakerAutoConfiguration}.
 *
 * <p>Uses {@link ApplicationContextRunner} for fast, isolated testing
 * of the auto-configuration without bootstrapping a full Spring Boot
 * application.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class BakerAutoConfigurationTest {

  private static final SigConfig SIG_CONFIG = new SigConfig("tenant",
      "sub-1", Map.of("AKSUbuntu",
          new SigGalleryConfig("AKSUbuntu", "AKS-Ubuntu")));

  /** The runner with the auto-configuration and the catalog files. */
  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(BakerAutoConfiguration.class))
      .withPropertyValues(
          "baker.catalog.os-images=" + resource("os-images.json"),
          "baker.catalog.sig-images=" + resource("sig-images.json"));

  @Test
  void whenContextLoads_givenCatalogFiles_shouldResolveImages() {
    runner.withUserConfiguration(TemplateConfig.class)
        .run(context -> {
          final Baker baker = context.getBean(Baker.class);

          final NodeBootstrapping result = baker.getNodeBootstrapping(
              NodeBootstrappingConfiguration.builder()
                  .agentPoolProfile(new AgentPoolProfile("pool1",
                      "Standard_D2s_v3", OsType.LINUX,
                      Distros.AKS_UBUNTU_CONTAINERD_2204))
                  .containerService(new ContainerService("c1", "eastus"))
                  .cloudSpecConfig(new CloudSpecConfig(
                      CloudSpecConfig.AZURE_PUBLIC_CLOUD))
                  .sigConfig(SIG_CONFIG)
                  .build());

          assertEquals("payload", result.bootPayload());
          assertEquals("2022.10.03", result.osImageConfig().imageVersion());
          assertEquals("202405.20.0", result.sigImageConfig().version());
          assertEquals("AKS-Ubuntu", result.sigImageConfig().resourceGroup());
        });
  }

  @Test
  void whenContextLoads_givenStaticOverrides_shouldApplyThem() {
    runner.withUserConfiguration(TemplateConfig.class)
        .withPropertyValues(
            "baker.overrides[aks-ubuntu-containerd-22.04]=202407.01.0")
        .run(context -> {
          final Baker baker = context.getBean(Baker.class);

          assertEquals("202407.01.0", baker.getLatestSigImageConfig(
              SIG_CONFIG, Distros.AKS_UBUNTU_CONTAINERD_2204,
              EnvironmentInfo.forRegion("eastus")).version());
        });
  }

  @Test
  void whenContextLoads_givenOverrideStoreBean_shouldPreferIt() {
    runner.withUserConfiguration(TemplateConfig.class,
        OverrideStoreConfig.class)
        .withPropertyValues(
            "baker.overrides[aks-ubuntu-containerd-22.04]=static")
        .run(context -> {
          final Baker baker = context.getBean(Baker.class);

          assertEquals("from-bean", baker.getLatestSigImageConfig(
              SIG_CONFIG, Distros.AKS_UBUNTU_CONTAINERD_2204,
              EnvironmentInfo.forRegion("eastus")).version());
        });
  }

  @Test
  void whenContextLoads_givenVhdFiles_shouldPopulateInventories() {
    runner.withUserConfiguration(TemplateConfig.class)
        .withPropertyValues(
            "baker.vhd.manifest=" + resource("manifest.json"),
            "baker.vhd.components=" + resource("components.json"))
        .run(context -> {
          final CachedOnVhd cached =
              context.getBean(Baker.class).getCachedVersionsOnVhd();

          assertTrue(cached.fromManifest().dependency("runc").isPresent());
          assertTrue(cached.fromComponentContainerImages()
              .containsKey("pause"));
          assertTrue(cached.fromComponentDownloadedFiles().isEmpty());
        });
  }

  @Test
  void whenContextLoads_givenOnlyManifest_shouldFail() {
    runner.withUserConfiguration(TemplateConfig.class)
        .withPropertyValues(
            "baker.vhd.manifest=" + resource("manifest.json"))
        .run(context -> assertStartupFailure(context.getStartupFailure(),
            "baker.vhd.components"));
  }

  @Test
  void whenContextLoads_givenNoTemplateGenerator_shouldFail() {
    runner.run(context -> assertStartupFailure(context.getStartupFailure(),
        "Baker requires a TemplateGenerator bean"));
  }

  @Test
  void whenContextLoads_givenTwoOverrideStores_shouldFail() {
    runner.withUserConfiguration(TemplateConfig.class,
        OverrideStoreConfig.class, SecondOverrideStoreConfig.class)
        .run(context -> assertStartupFailure(context.getStartupFailure(),
            "Baker requires at most one OverrideStore bean"));
  }

  @Test
  void whenContextLoads_givenTwoMetricsBeans_shouldFail() {
    runner.withUserConfiguration(TemplateConfig.class, MetricsConfig.class)
        .run(context -> assertStartupFailure(context.getStartupFailure(),
            "Baker requires at most one BakerMetrics bean, but found 2"));
  }

  @Test
  void whenContextLoads_givenCatalogBeans_shouldNotNeedFiles() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(BakerAutoConfiguration.class))
        .withUserConfiguration(TemplateConfig.class, CatalogConfig.class)
        .run(context -> {
          final Baker baker = context.getBean(Baker.class);

          assertEquals("1.0", baker.getLatestSigImageConfig(SIG_CONFIG,
              Distros.AKS_AZURE_LINUX_V2,
              EnvironmentInfo.forRegion("eastus")).version());
        });
  }

  @Test
  void whenContextLoads_givenNoCatalogFile_shouldFail() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(BakerAutoConfiguration.class))
        .withUserConfiguration(TemplateConfig.class)
        .run(context -> assertStartupFailure(context.getStartupFailure(),
            "baker.catalog.os-images"));
  }

  @Test
  void whenContextLoads_givenNoConfigMapName_shouldNotCreateStore() {
    runner.withUserConfiguration(TemplateConfig.class)
        .run(context -> assertTrue(context
            .getBeansOfType(ConfigMapOverrideStore.class).isEmpty()));
  }

  /**
   * Asserts that the context failed to start because of an exception whose
   * message contains the given text.
   *
   * @param failure the startup failure, may be null
   * @param text    the expected message fragment
   */
  private static void assertStartupFailure(final Throwable failure,
      final String text) {
    assertNotNull(failure, "context should have failed to start");
    Throwable cause = failure;
    while (cause != null) {
      if (cause.getMessage() != null && cause.getMessage().contains(text)) {
        return;
      }
      cause = cause.getCause();
    }
    throw new AssertionError("No cause mentions '" + text + "'", failure);
  }

  /**
   * Resolves a test resource to a file system path.
   *
   * @param name the resource name
   *
   * @return the absolute path, never null
   */
  private static String resource(final String name) {
    try {
      return Path.of(BakerAutoConfigurationTest.class
          .getResource("/" + name).toURI()).toString();
    } catch (final URISyntaxException e) {
      throw new IllegalStateException(e);
    }
  }

  /** Provides a template generator rendering fixed values. */
  @Configuration(proxyBeanMethods = false)
  static class TemplateConfig {

    @Bean
    TemplateGenerator templateGenerator() {
      return new TemplateGenerator() {
        @Override
        public String bootPayload(
            final NodeBootstrappingConfiguration config) {
          return "payload";
        }

        @Override
        public String provisioningCommand(
            final NodeBootstrappingConfiguration config) {
          return "command";
        }
      };
    }
  }

  /** Provides an override store bean. */
  @Configuration(proxyBeanMethods = false)
  static class OverrideStoreConfig {

    @Bean
    OverrideStore overrideStore() {
      return entity -> Map.of("aks-ubuntu-containerd-22.04", "from-bean");
    }
  }

  /** Provides a second override store bean. */
  @Configuration(proxyBeanMethods = false)
  static class SecondOverrideStoreConfig {

    @Bean
    OverrideStore secondOverrideStore() {
      return entity -> Map.of();
    }
  }

  /** Provides two metrics beans. */
  @Configuration(proxyBeanMethods = false)
  static class MetricsConfig {

    @Bean
    BakerMetrics bakerMetrics() {
      return new NoopBakerMetrics();
    }

    @Bean
    BakerMetrics otherBakerMetrics() {
      return new NoopBakerMetrics();
    }
  }

  /** Provides in-memory catalogs. */
  @Configuration(proxyBeanMethods = false)
  static class CatalogConfig {

    @Bean
    OsImageCatalog osImageCatalog() {
      return cloudName -> Optional.of(Map.of());
    }

    @Bean
    SigCatalogProvider sigCatalogProvider() {
      return (sigConfig, region) -> SigAzureEnvironmentSpecConfig
          .builder(CloudSpecConfig.AZURE_PUBLIC_CLOUD)
          .image(OsFamily.AZURE_LINUX, Distros.AKS_AZURE_LINUX_V2,
              new SigImageConfig("AKS-AzureLinux", "AKSAzureLinux", "V2",
                  "1.0", "sub-1"))
          .build();
    }
  }
}
