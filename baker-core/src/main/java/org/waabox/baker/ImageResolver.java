package org.waabox.baker;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.baker.datamodel.Distro;
import org.waabox.baker.datamodel.OsFamily;
import org.waabox.baker.datamodel.SigAzureEnvironmentSpecConfig;
import org.waabox.baker.datamodel.SigImageConfig;
import org.waabox.baker.metrics.BakerMetrics;
import org.waabox.baker.overrides.OverrideEntity;
import org.waabox.baker.overrides.OverrideStore;

/**
 * Finds the SIG image of a distro and applies version overrides to it.
 *
 * <p>Family sub-catalogs are searched in {@link OsFamily} declaration
 * order: {@code UBUNTU}, {@code CBL_MARINER}, {@code AZURE_LINUX},
 * {@code WINDOWS}, {@code UBUNTU_EDGE_ZONE}. A distro is expected to live
 * in a single family; when it does not, the first family in that order
 * wins.
 *
 * <p>Overrides never change catalog entries: a replaced version is carried
 * by a copy of the catalog entry. Windows images are never overridden.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ImageResolver {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(ImageResolver.class);

  /** The families, in lookup precedence order. */
  private static final List<OsFamily> PRECEDENCE = List.of(OsFamily.values());

  /** The families, in full catalog merge order; later merges overwrite. */
  private static final List<OsFamily> MERGE_ORDER = List.of(
      OsFamily.WINDOWS, OsFamily.CBL_MARINER, OsFamily.AZURE_LINUX,
      OsFamily.UBUNTU, OsFamily.UBUNTU_EDGE_ZONE);

  /** The source of version overrides. */
  private final OverrideStore overrideStore;

  /** The metrics reporter. */
  private final BakerMetrics metrics;

  /**
   * Creates a new resolver.
   *
   * @param theOverrideStore the source of version overrides, never null
   * @param theMetrics       the metrics reporter, never null
   */
  public ImageResolver(final OverrideStore theOverrideStore,
      final BakerMetrics theMetrics) {
    overrideStore = Objects.requireNonNull(theOverrideStore,
        "overrideStore must not be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");
  }

  /**
   * Finds the image of a distro in an environment catalog.
   *
   * @param environment the environment catalog, never null
   * @param distro      the distro, never null
   *
   * @return the catalog entry of the first family holding the distro, or
   *         empty if no family holds it
   */
  public Optional<SigImageConfig> findSigImageConfig(
      final SigAzureEnvironmentSpecConfig environment, final Distro distro) {
    Objects.requireNonNull(environment, "environment must not be null");
    Objects.requireNonNull(distro, "distro must not be null");

    for (final OsFamily family : PRECEDENCE) {
      final SigImageConfig config =
          environment.imageConfigs(family).get(distro);
      if (config != null) {
        return Optional.of(config);
      }
    }
    return Optional.empty();
  }

  /**
   * Applies the version override of a distro, if any.
   *
   * <p>Windows distros are returned unchanged without querying the
   * override store.
   *
   * @param distro the distro the image was resolved for, never null
   * @param config the resolved image, never null
   * @param entity the entity to look overrides up for, never null
   *
   * @return the image with the override version, or {@code config} itself
   *         when there is no override
   */
  public SigImageConfig applyOverride(final Distro distro,
      final SigImageConfig config, final OverrideEntity entity) {
    Objects.requireNonNull(distro, "distro must not be null");
    Objects.requireNonNull(config, "config must not be null");
    Objects.requireNonNull(entity, "entity must not be null");

    if (distro.isWindows()) {
      return config;
    }
    return overridden(distro, config, overridesFor(entity));
  }

  /**
   * Merges every family sub-catalog of an environment into one map.
   *
   * <p>Entries of every sub-catalog but the Windows one get their version
   * override. Sub-catalogs are merged in the order {@code WINDOWS},
   * {@code CBL_MARINER}, {@code AZURE_LINUX}, {@code UBUNTU},
   * {@code UBUNTU_EDGE_ZONE}; when a distro lives in more than one family,
   * the entry of the family merged last is kept.
   *
   * @param environment the environment catalog, never null
   * @param entity      the entity to look overrides up for, never null
   *
   * @return the images keyed by distro, never null
   */
  public Map<Distro, SigImageConfig> allDistros(
      final SigAzureEnvironmentSpecConfig environment,
      final OverrideEntity entity) {
    Objects.requireNonNull(environment, "environment must not be null");
    Objects.requireNonNull(entity, "entity must not be null");

    final Map<String, String> overrides = overridesFor(entity);
    final Map<Distro, SigImageConfig> result = new LinkedHashMap<>();

    for (final OsFamily family : MERGE_ORDER) {
      environment.imageConfigs(family).forEach((distro, config) -> {
        if (family.isWindows()) {
          result.put(distro, config);
        } else {
          result.put(distro, overridden(distro, config, overrides));
        }
      });
    }
    return result;
  }

  /**
   * Queries the override store.
   *
   * @param entity the entity, never null
   *
   * @return the overrides keyed by distro name, never null
   */
  private Map<String, String> overridesFor(final OverrideEntity entity) {
    final Map<String, String> overrides =
        overrideStore.linuxNodeImageVersions(entity);
    return overrides == null ? Map.of() : overrides;
  }

  /**
   * Replaces the version of an image when the distro has an override.
   *
   * @param distro    the distro, never null
   * @param config    the image, never null
   * @param overrides the overrides keyed by distro name, never null
   *
   * @return the overridden copy, or {@code config} itself
   */
  private SigImageConfig overridden(final Distro distro,
      final SigImageConfig config, final Map<String, String> overrides) {
    final String version = overrides.get(distro.name());
    if (version == null) {
      return config;
    }
    log.debug("Overriding image version of distro '{}': {} -> {}",
        distro.name(), config.version(), version);
    metrics.overrideApplied(distro.name(), version);
    return config.withVersion(version);
  }
}
