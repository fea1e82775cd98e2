package org.waabox.baker.datamodel;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The Shared Image Gallery catalog of one region.
 *
 * <p>Holds one {@code Distro -> SigImageConfig} sub-catalog per
 * {@link OsFamily}. Families without images have an empty sub-catalog.
 * Sub-catalogs are not checked against the family of their distros.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SigAzureEnvironmentSpecConfig {

  /** The cloud hosting the region. */
  private final String cloudName;

  /** The sub-catalogs, one per family. */
  private final Map<OsFamily, Map<Distro, SigImageConfig>> imageConfigs;

  /**
   * Creates a new environment catalog.
   *
   * @param theCloudName    the cloud name, never null
   * @param theImageConfigs the sub-catalogs, never null
   */
  private SigAzureEnvironmentSpecConfig(final String theCloudName,
      final Map<OsFamily, Map<Distro, SigImageConfig>> theImageConfigs) {
    cloudName = theCloudName;
    final Map<OsFamily, Map<Distro, SigImageConfig>> copy =
        new EnumMap<>(OsFamily.class);
    for (final OsFamily family : OsFamily.values()) {
      final Map<Distro, SigImageConfig> configs = theImageConfigs.get(family);
      copy.put(family, configs == null
          ? Collections.emptyMap()
          : Collections.unmodifiableMap(new LinkedHashMap<>(configs)));
    }
    imageConfigs = Collections.unmodifiableMap(copy);
  }

  /**
   * Starts a builder for an environment catalog.
   *
   * @param cloudName the cloud hosting the region, never null
   *
   * @return the builder, never null
   */
  public static Builder builder(final String cloudName) {
    return new Builder(cloudName);
  }

  /**
   * Returns the cloud hosting the region.
   *
   * @return the cloud name, never null
   */
  public String cloudName() {
    return cloudName;
  }

  /**
   * Returns the sub-catalog of the given family.
   *
   * @param family the family, never null
   *
   * @return the sub-catalog, never null, unmodifiable
   */
  public Map<Distro, SigImageConfig> imageConfigs(final OsFamily family) {
    Objects.requireNonNull(family, "family must not be null");
    return imageConfigs.get(family);
  }

  @Override
  public boolean equals(final Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof SigAzureEnvironmentSpecConfig)) {
      return false;
    }
    final SigAzureEnvironmentSpecConfig that =
        (SigAzureEnvironmentSpecConfig) other;
    return cloudName.equals(that.cloudName)
        && imageConfigs.equals(that.imageConfigs);
  }

  @Override
  public int hashCode() {
    return Objects.hash(cloudName, imageConfigs);
  }

  @Override
  public String toString() {
    return "SigAzureEnvironmentSpecConfig{cloudName=" + cloudName
        + ", imageConfigs=" + imageConfigs + "}";
  }

  /** Builder for {@link SigAzureEnvironmentSpecConfig}. */
  public static final class Builder {

    /** The cloud name. */
    private final String cloudName;

    /** The sub-catalogs collected so far. */
    private final Map<OsFamily, Map<Distro, SigImageConfig>> imageConfigs =
        new EnumMap<>(OsFamily.class);

    /**
     * Creates a new builder.
     *
     * @param theCloudName the cloud name, never null
     */
    private Builder(final String theCloudName) {
      cloudName = Objects.requireNonNull(theCloudName,
          "cloudName must not be null");
    }

    /**
     * Adds one image to a family sub-catalog.
     *
     * @param family the family, never null
     * @param distro the distro, never null
     * @param config the image reference, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder image(final OsFamily family, final Distro distro,
        final SigImageConfig config) {
      Objects.requireNonNull(family, "family must not be null");
      Objects.requireNonNull(distro, "distro must not be null");
      Objects.requireNonNull(config, "config must not be null");
      imageConfigs.computeIfAbsent(family, f -> new LinkedHashMap<>())
          .put(distro, config);
      return this;
    }

    /**
     * Adds every image of a map to a family sub-catalog.
     *
     * @param family  the family, never null
     * @param configs the images keyed by distro, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder images(final OsFamily family,
        final Map<Distro, SigImageConfig> configs) {
      Objects.requireNonNull(configs, "configs must not be null");
      configs.forEach((distro, config) -> image(family, distro, config));
      return this;
    }

    /**
     * Builds the environment catalog.
     *
     * @return the catalog, never null
     */
    public SigAzureEnvironmentSpecConfig build() {
      return new SigAzureEnvironmentSpecConfig(cloudName, imageConfigs);
    }
  }
}
