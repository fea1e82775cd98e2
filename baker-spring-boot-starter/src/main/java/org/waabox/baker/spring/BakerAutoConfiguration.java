package org.waabox.baker.spring;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.waabox.baker.Baker;
import org.waabox.baker.catalog.GallerySigCatalogProvider;
import org.waabox.baker.catalog.OsImageCatalog;
import org.waabox.baker.catalog.SigCatalogProvider;
import org.waabox.baker.catalog.json.JsonCatalogLoader;
import org.waabox.baker.catalog.json.JsonVhdInventoryLoader;
import org.waabox.baker.metrics.BakerMetrics;
import org.waabox.baker.overrides.OverrideStore;
import org.waabox.baker.overrides.StaticOverrideStore;
import org.waabox.baker.overrides.k8s.ConfigMapOverrideConfig;
import org.waabox.baker.overrides.k8s.ConfigMapOverrideStore;
import org.waabox.baker.template.TemplateGenerator;
import org.waabox.baker.vhd.VhdInventories;

/**
 * Spring Boot auto-configuration for Baker.
 *
 * <p>Creates a singleton {@link Baker} from the application's
 * {@link TemplateGenerator} bean, which is required, and from optional
 * {@link OsImageCatalog}, {@link SigCatalogProvider}, {@link OverrideStore}
 * and {@link BakerMetrics} beans. A missing catalog bean is loaded from the
 * JSON file named in {@link BakerProperties}. Without an override store
 * bean, the static {@code baker.overrides.*} versions are used.
 *
 * <p>When the Kubernetes override module is on the classpath and
 * {@code baker.config-map.name} is set, a {@link ConfigMapOverrideStore}
 * bean is created and refreshed until the context closes.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@AutoConfiguration
@EnableConfigurationProperties(BakerProperties.class)
public class BakerAutoConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      BakerAutoConfiguration.class);

  /**
   * Creates the VHD inventories, populated from the files named in
   * {@code baker.vhd.*} when both are set.
   *
   * @param properties the configuration properties, never null
   *
   * @return the inventories, never null
   *
   * @throws IllegalStateException if only one of the two files is set
   */
  @Bean
  public VhdInventories bakerVhdInventories(
      final BakerProperties properties) {
    final VhdInventories inventories = new VhdInventories();

    final String manifest = properties.getVhd().getManifest();
    final String components = properties.getVhd().getComponents();

    if (isSet(manifest) && isSet(components)) {
      JsonVhdInventoryLoader.populate(inventories, Path.of(manifest),
          Path.of(components));
    } else if (isSet(manifest) || isSet(components)) {
      throw new IllegalStateException("Baker requires both"
          + " baker.vhd.manifest and baker.vhd.components, or neither");
    } else {
      log.info("No VHD inventory files configured, cached versions are"
          + " not available");
    }
    return inventories;
  }

  /**
   * Creates the singleton {@link Baker} bean.
   *
   * @param properties                 the configuration properties, never
   *                                   null
   * @param templateGeneratorProvider  provider for the required
   *                                   TemplateGenerator bean
   * @param osImageCatalogProvider     provider for an optional
   *                                   OsImageCatalog bean
   * @param sigCatalogProviderProvider provider for an optional
   *                                   SigCatalogProvider bean
   * @param overrideStoreProvider      provider for an optional
   *                                   OverrideStore bean
   * @param metricsProvider            provider for an optional
   *                                   BakerMetrics bean
   * @param vhdInventories             the VHD inventories, never null
   *
   * @return the configured Baker instance, never null
   *
   * @throws IllegalStateException if the template generator is missing, a
   *                               bean type is defined more than once, or
   *                               a catalog has neither a bean nor a file
   */
  @Bean
  public Baker baker(
      final BakerProperties properties,
      final ObjectProvider<TemplateGenerator> templateGeneratorProvider,
      final ObjectProvider<OsImageCatalog> osImageCatalogProvider,
      final ObjectProvider<SigCatalogProvider> sigCatalogProviderProvider,
      final ObjectProvider<OverrideStore> overrideStoreProvider,
      final ObjectProvider<BakerMetrics> metricsProvider,
      final VhdInventories vhdInventories) {

    requireAtMostOne(templateGeneratorProvider, TemplateGenerator.class);
    requireAtMostOne(osImageCatalogProvider, OsImageCatalog.class);
    requireAtMostOne(sigCatalogProviderProvider, SigCatalogProvider.class);
    requireAtMostOne(overrideStoreProvider, OverrideStore.class);
    requireAtMostOne(metricsProvider, BakerMetrics.class);

    final TemplateGenerator templateGenerator =
        templateGeneratorProvider.getIfAvailable();
    if (templateGenerator == null) {
      throw new IllegalStateException(
          "Baker requires a TemplateGenerator bean");
    }

    final Baker.Builder builder = Baker.builder()
        .templateGenerator(templateGenerator)
        .osImageCatalog(osImageCatalogProvider.getIfAvailable(
            () -> loadOsImageCatalog(properties)))
        .sigCatalogProvider(sigCatalogProviderProvider.getIfAvailable(
            () -> loadSigCatalogProvider(properties)))
        .vhdInventories(vhdInventories);

    final OverrideStore overrideStore = overrideStoreProvider.getIfAvailable();
    final Map<String, String> staticOverrides = properties.getOverrides();
    if (overrideStore != null) {
      builder.overrideStore(overrideStore);
      log.info("Baker using custom OverrideStore: {}",
          overrideStore.getClass().getSimpleName());
      if (!staticOverrides.isEmpty()) {
        log.warn("Ignoring {} baker.overrides entries, an OverrideStore"
            + " bean is defined", staticOverrides.size());
      }
    } else if (!staticOverrides.isEmpty()) {
      builder.overrideStore(new StaticOverrideStore(staticOverrides));
      log.info("Baker using {} static image version overrides",
          staticOverrides.size());
    }

    metricsProvider.ifAvailable(metrics -> {
      builder.metrics(metrics);
      log.info("Baker using custom BakerMetrics: {}",
          metrics.getClass().getSimpleName());
    });

    return builder.build();
  }

  /**
   * Loads the legacy catalog from {@code baker.catalog.os-images}.
   *
   * @param properties the configuration properties, never null
   *
   * @return the catalog, never null
   */
  private static OsImageCatalog loadOsImageCatalog(
      final BakerProperties properties) {
    final String file = properties.getCatalog().getOsImages();
    if (!isSet(file)) {
      throw new IllegalStateException("Baker requires an OsImageCatalog"
          + " bean or the baker.catalog.os-images property");
    }
    return JsonCatalogLoader.loadOsImageCatalog(Path.of(file));
  }

  /**
   * Builds the SIG provider from {@code baker.catalog.sig-images}.
   *
   * @param properties the configuration properties, never null
   *
   * @return the provider, never null
   */
  private static SigCatalogProvider loadSigCatalogProvider(
      final BakerProperties properties) {
    final String file = properties.getCatalog().getSigImages();
    if (!isSet(file)) {
      throw new IllegalStateException("Baker requires a SigCatalogProvider"
          + " bean or the baker.catalog.sig-images property");
    }
    return new GallerySigCatalogProvider(
        JsonCatalogLoader.loadSigImageTemplates(Path.of(file)));
  }

  /**
   * Checks that a property has a value.
   *
   * @param value the property value, may be null
   *
   * @return true if the value is neither null nor blank
   */
  private static boolean isSet(final String value) {
    return value != null && !value.isBlank();
  }

  /**
   * Validates that at most one bean of the given type is present in the
   * application context.
   *
   * @param provider the object provider to validate, never null
   * @param type     the bean type for error reporting, never null
   * @param <T>      the bean type
   *
   * @throws IllegalStateException if more than one bean of the given type
   *                               is present
   */
  private <T> void requireAtMostOne(final ObjectProvider<T> provider,
      final Class<T> type) {

    final List<String> beanNames = provider.orderedStream()
        .map(bean -> bean.getClass().getSimpleName())
        .collect(Collectors.toList());

    if (beanNames.size() > 1) {
      throw new IllegalStateException(
          "Baker requires at most one " + type.getSimpleName()
              + " bean, but found " + beanNames.size() + ": "
              + String.join(", ", beanNames));
    }
  }

  /**
   * Creates the {@link ConfigMapOverrideStore} when the Kubernetes module
   * is present and a ConfigMap is named.
   */
  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(ConfigMapOverrideStore.class)
  @ConditionalOnProperty(prefix = "baker.config-map", name = "name")
  static class ConfigMapOverrideStoreConfiguration {

    /**
     * Creates the store, started on creation and stopped with the context.
     *
     * @param properties the configuration properties, never null
     *
     * @return the store, never null
     */
    @Bean(initMethod = "start", destroyMethod = "stop")
    public ConfigMapOverrideStore configMapOverrideStore(
        final BakerProperties properties) {
      final BakerProperties.ConfigMap configMap = properties.getConfigMap();
      log.info("Baker reading image version overrides from ConfigMap"
          + " '{}/{}'", configMap.getNamespace(), configMap.getName());
      return new ConfigMapOverrideStore(ConfigMapOverrideConfig.create(
          configMap.getName(), configMap.getNamespace(),
          configMap.getRefreshInterval()));
    }
  }
}
