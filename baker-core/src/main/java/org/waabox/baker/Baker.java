package org.waabox.baker;

import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.baker.catalog.OsImageCatalog;
import org.waabox.baker.catalog.SigCatalogProvider;
import org.waabox.baker.datamodel.Distro;
import org.waabox.baker.datamodel.EnvironmentInfo;
import org.waabox.baker.datamodel.NodeBootstrapping;
import org.waabox.baker.datamodel.NodeBootstrappingConfiguration;
import org.waabox.baker.datamodel.OsImageConfig;
import org.waabox.baker.datamodel.SigAzureEnvironmentSpecConfig;
import org.waabox.baker.datamodel.SigConfig;
import org.waabox.baker.datamodel.SigImageConfig;
import org.waabox.baker.metrics.BakerMetrics;
import org.waabox.baker.metrics.NoopBakerMetrics;
import org.waabox.baker.overrides.ConfigurationEntity;
import org.waabox.baker.overrides.EnvironmentEntity;
import org.waabox.baker.overrides.NoopOverrideStore;
import org.waabox.baker.overrides.OverrideStore;
import org.waabox.baker.template.TemplateGenerator;
import org.waabox.baker.vhd.CachedOnVhd;
import org.waabox.baker.vhd.VhdCacheValidator;
import org.waabox.baker.vhd.VhdInventories;

/**
 * The main entry point for node image resolution.
 *
 * <p>Baker resolves which image, and which version of it, a node boots
 * from, and assembles the node's provisioning artifact. Resolution looks
 * the node's distro up in the legacy per-cloud catalog and in the Shared
 * Image Gallery catalog of the node's region, then applies version
 * overrides to Linux images.
 *
 * <p>Every operation is synchronous and only reads immutable state, so a
 * single instance can serve concurrent callers. Failures are thrown to the
 * caller right away; nothing is retried.
 *
 * <p>Usage example:
 * <pre>{@code
 * Baker baker = Baker.builder()
 *     .templateGenerator(generator)
 *     .osImageCatalog(osImageCatalog)
 *     .sigCatalogProvider(new GallerySigCatalogProvider(templates))
 *     .overrideStore(configMapOverrideStore)
 *     .vhdInventories(inventories)
 *     .build();
 *
 * NodeBootstrapping artifact = baker.getNodeBootstrapping(config);
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Baker {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(Baker.class);

  /** Renders the boot payload and provisioning command. */
  private final TemplateGenerator templateGenerator;

  /** The legacy per-cloud image catalog. */
  private final OsImageCatalog osImageCatalog;

  /** Builds the SIG catalog of a region. */
  private final SigCatalogProvider sigCatalogProvider;

  /** The source of version overrides. */
  private final OverrideStore overrideStore;

  /** The VHD inventories. */
  private final VhdInventories vhdInventories;

  /** The metrics reporter. */
  private final BakerMetrics metrics;

  /** Finds images and applies overrides. */
  private final ImageResolver imageResolver;

  /** Assembles the VHD inventory snapshot. */
  private final VhdCacheValidator vhdCacheValidator;

  /**
   * Creates a new Baker instance.
   *
   * @param theTemplateGenerator  the template generator, never null
   * @param theOsImageCatalog     the legacy catalog, never null
   * @param theSigCatalogProvider the SIG catalog provider, never null
   * @param theOverrideStore      the override store, never null
   * @param theVhdInventories     the VHD inventories, never null
   * @param theMetrics            the metrics reporter, never null
   */
  private Baker(final TemplateGenerator theTemplateGenerator,
      final OsImageCatalog theOsImageCatalog,
      final SigCatalogProvider theSigCatalogProvider,
      final OverrideStore theOverrideStore,
      final VhdInventories theVhdInventories,
      final BakerMetrics theMetrics) {
    templateGenerator = theTemplateGenerator;
    osImageCatalog = theOsImageCatalog;
    sigCatalogProvider = theSigCatalogProvider;
    overrideStore = theOverrideStore;
    vhdInventories = theVhdInventories;
    metrics = theMetrics;
    imageResolver = new ImageResolver(theOverrideStore, theMetrics);
    vhdCacheValidator = new VhdCacheValidator(theVhdInventories);
  }

  /**
   * Creates a new builder for constructing a Baker instance.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a copy of this instance using another override store.
   *
   * @param theOverrideStore the override store, never null
   *
   * @return the new instance, never null
   */
  public Baker withOverrideStore(final OverrideStore theOverrideStore) {
    Objects.requireNonNull(theOverrideStore,
        "overrideStore must not be null");
    return new Baker(templateGenerator, osImageCatalog, sigCatalogProvider,
        theOverrideStore, vhdInventories, metrics);
  }

  /**
   * Assembles the provisioning artifact of a node.
   *
   * <p>The template generator renders the boot payload and provisioning
   * command first. Customized image distros stop there: their artifact
   * carries no image reference and no catalog is consulted. Every other
   * distro is looked up in the legacy catalog of the node's cloud and in
   * the SIG catalog of the cluster location; finding it in either one is
   * enough. For Linux pools, the SIG image then gets its version
   * override.
   *
   * @param config the node configuration, never null
   *
   * @return the artifact, never null
   *
   * @throws UnknownCloudException  if the legacy catalog does not know the
   *                                cloud
   * @throws SigResolutionException if the SIG catalog cannot be built
   * @throws ImageNotFoundException if neither catalog holds the distro
   */
  public NodeBootstrapping getNodeBootstrapping(
      final NodeBootstrappingConfiguration config) {
    Objects.requireNonNull(config, "config must not be null");

    final String bootPayload = templateGenerator.bootPayload(config);
    final String provisioningCommand =
        templateGenerator.provisioningCommand(config);

    final Distro distro = config.agentPoolProfile().distro();
    if (distro.isCustomized()) {
      log.debug("Distro '{}' is a customized image, skipping catalogs",
          distro);
      return NodeBootstrapping.withoutImage(bootPayload, provisioningCommand);
    }

    final String cloudName = config.cloudSpecConfig().cloudName();
    final String region = config.containerService().location();

    try {
      final Map<Distro, OsImageConfig> cloudImages =
          osImageCatalog.forCloud(cloudName)
              .orElseThrow(() -> new UnknownCloudException(cloudName));
      final OsImageConfig osImageConfig = cloudImages.get(distro);

      final SigAzureEnvironmentSpecConfig environment =
          sigCatalogProvider.resolve(config.sigConfig(), region);

      SigImageConfig sigImageConfig = imageResolver
          .findSigImageConfig(environment, distro)
          .orElse(null);

      if (sigImageConfig == null && osImageConfig == null) {
        throw new ImageNotFoundException(distro, region);
      }

      if (sigImageConfig != null && !config.agentPoolProfile().isWindows()) {
        sigImageConfig = imageResolver.applyOverride(distro, sigImageConfig,
            ConfigurationEntity.from(config));
      }

      metrics.imageResolved(distro.name(), region);

      return new NodeBootstrapping(bootPayload, provisioningCommand,
          osImageConfig, sigImageConfig);

    } catch (final UnknownCloudException | SigResolutionException
        | ImageNotFoundException e) {
      log.warn("Can't bootstrap node of pool '{}' with distro '{}': {}",
          config.agentPoolProfile().name(), distro, e.getMessage());
      metrics.resolutionFailed("getNodeBootstrapping", e);
      throw e;
    }
  }

  /**
   * Returns the latest SIG image of a distro in a region.
   *
   * <p>Non Windows distros get their version override.
   *
   * @param sigConfig   the SIG selector, never null
   * @param distro      the distro, never null
   * @param environment the environment the image is requested for, never
   *                    null
   *
   * @return the image, never null
   *
   * @throws SigResolutionException if the SIG catalog cannot be built
   * @throws ImageNotFoundException if no family holds the distro
   */
  public SigImageConfig getLatestSigImageConfig(final SigConfig sigConfig,
      final Distro distro, final EnvironmentInfo environment) {
    Objects.requireNonNull(sigConfig, "sigConfig must not be null");
    Objects.requireNonNull(distro, "distro must not be null");
    Objects.requireNonNull(environment, "environment must not be null");

    final String region = environment.region();
    try {
      final SigAzureEnvironmentSpecConfig sigEnvironment =
          sigCatalogProvider.resolve(sigConfig, region);

      final SigImageConfig sigImageConfig = imageResolver
          .findSigImageConfig(sigEnvironment, distro)
          .orElseThrow(() -> new ImageNotFoundException(distro, region));

      final SigImageConfig result = imageResolver.applyOverride(distro,
          sigImageConfig, new EnvironmentEntity(environment));

      metrics.imageResolved(distro.name(), region);
      return result;

    } catch (final SigResolutionException | ImageNotFoundException e) {
      log.warn("Can't resolve latest image of distro '{}' in region '{}':"
          + " {}", distro, region, e.getMessage());
      metrics.resolutionFailed("getLatestSigImageConfig", e);
      throw e;
    }
  }

  /**
   * Returns the SIG image of every distro available in a region.
   *
   * <p>Every image outside the Windows family gets its version override.
   *
   * @param sigConfig   the SIG selector, never null
   * @param environment the environment the images are requested for,
   *                    never null
   *
   * @return the images keyed by distro, never null
   *
   * @throws SigResolutionException if the SIG catalog cannot be built
   */
  public Map<Distro, SigImageConfig> getDistroSigImageConfig(
      final SigConfig sigConfig, final EnvironmentInfo environment) {
    Objects.requireNonNull(sigConfig, "sigConfig must not be null");
    Objects.requireNonNull(environment, "environment must not be null");

    final SigAzureEnvironmentSpecConfig sigEnvironment;
    try {
      sigEnvironment = sigCatalogProvider.resolve(sigConfig,
          environment.region());
    } catch (final SigResolutionException e) {
      log.warn("Can't resolve SIG images of region '{}': {}",
          environment.region(), e.getMessage());
      metrics.resolutionFailed("getDistroSigImageConfig", e);
      throw e;
    }

    return imageResolver.allDistros(sigEnvironment,
        new EnvironmentEntity(environment));
  }

  /**
   * Returns the versions cached on the node image.
   *
   * @return the snapshot of the VHD inventories, never null
   *
   * @throws CacheNotInitializedException if an inventory is not populated
   */
  public CachedOnVhd getCachedVersionsOnVhd() {
    return vhdCacheValidator.snapshot();
  }

  /**
   * Builder for {@link Baker}.
   *
   * <p>The template generator, legacy catalog and SIG catalog provider are
   * required. The override store defaults to {@link NoopOverrideStore},
   * the VHD inventories to an empty handle and the metrics to
   * {@link NoopBakerMetrics}.
   */
  public static final class Builder {

    /** The template generator. */
    private TemplateGenerator templateGenerator;

    /** The legacy catalog. */
    private OsImageCatalog osImageCatalog;

    /** The SIG catalog provider. */
    private SigCatalogProvider sigCatalogProvider;

    /** The override store. */
    private OverrideStore overrideStore;

    /** The VHD inventories. */
    private VhdInventories vhdInventories;

    /** The metrics reporter. */
    private BakerMetrics metrics;

    /** Creates a new builder. */
    private Builder() {
    }

    /**
     * Sets the template generator.
     *
     * @param theTemplateGenerator the template generator, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theTemplateGenerator is null
     */
    public Builder templateGenerator(
        final TemplateGenerator theTemplateGenerator) {
      Objects.requireNonNull(theTemplateGenerator,
          "templateGenerator must not be null");
      templateGenerator = theTemplateGenerator;
      return this;
    }

    /**
     * Sets the legacy per-cloud image catalog.
     *
     * @param theOsImageCatalog the catalog, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theOsImageCatalog is null
     */
    public Builder osImageCatalog(final OsImageCatalog theOsImageCatalog) {
      Objects.requireNonNull(theOsImageCatalog,
          "osImageCatalog must not be null");
      osImageCatalog = theOsImageCatalog;
      return this;
    }

    /**
     * Sets the SIG catalog provider.
     *
     * @param theSigCatalogProvider the provider, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theSigCatalogProvider is null
     */
    public Builder sigCatalogProvider(
        final SigCatalogProvider theSigCatalogProvider) {
      Objects.requireNonNull(theSigCatalogProvider,
          "sigCatalogProvider must not be null");
      sigCatalogProvider = theSigCatalogProvider;
      return this;
    }

    /**
     * Sets the source of version overrides.
     *
     * <p>If not set, {@link NoopOverrideStore} is used.
     *
     * @param theOverrideStore the override store, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theOverrideStore is null
     */
    public Builder overrideStore(final OverrideStore theOverrideStore) {
      Objects.requireNonNull(theOverrideStore,
          "overrideStore must not be null");
      overrideStore = theOverrideStore;
      return this;
    }

    /**
     * Sets the VHD inventories.
     *
     * <p>If not set, an empty handle is used and
     * {@link Baker#getCachedVersionsOnVhd()} fails until it is populated.
     *
     * @param theVhdInventories the inventories, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theVhdInventories is null
     */
    public Builder vhdInventories(final VhdInventories theVhdInventories) {
      Objects.requireNonNull(theVhdInventories,
          "vhdInventories must not be null");
      vhdInventories = theVhdInventories;
      return this;
    }

    /**
     * Sets the metrics reporter.
     *
     * <p>If not set, {@link NoopBakerMetrics} is used.
     *
     * @param theMetrics the metrics reporter, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theMetrics is null
     */
    public Builder metrics(final BakerMetrics theMetrics) {
      Objects.requireNonNull(theMetrics, "metrics must not be null");
      metrics = theMetrics;
      return this;
    }

    /**
     * Builds the Baker instance with the configured settings.
     *
     * @return a new Baker instance, never null
     *
     * @throws IllegalStateException if the template generator, legacy
     *                               catalog or SIG provider is missing
     */
    public Baker build() {
      if (templateGenerator == null) {
        throw new IllegalStateException("templateGenerator must be set");
      }
      if (osImageCatalog == null) {
        throw new IllegalStateException("osImageCatalog must be set");
      }
      if (sigCatalogProvider == null) {
        throw new IllegalStateException("sigCatalogProvider must be set");
      }
      final OverrideStore resolvedOverrides = overrideStore != null
          ? overrideStore : new NoopOverrideStore();
      final VhdInventories resolvedInventories = vhdInventories != null
          ? vhdInventories : new VhdInventories();
      final BakerMetrics resolvedMetrics = metrics != null
          ? metrics : new NoopBakerMetrics();

      return new Baker(
          templateGenerator,
          osImageCatalog,
          sigCatalogProvider,
          resolvedOverrides,
          resolvedInventories,
          resolvedMetrics);
    }
  }
}
