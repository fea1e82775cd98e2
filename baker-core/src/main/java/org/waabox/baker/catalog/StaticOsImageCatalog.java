package org.waabox.baker.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.waabox.baker.datamodel.Distro;
import org.waabox.baker.datamodel.OsImageConfig;

/**
 * An {@link OsImageCatalog} held in memory.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class StaticOsImageCatalog implements OsImageCatalog {

  /** The images keyed by cloud name, then by distro. */
  private final Map<String, Map<Distro, OsImageConfig>> imagesByCloud;

  /**
   * Creates a new catalog.
   *
   * @param theImagesByCloud the images keyed by cloud, never null
   */
  private StaticOsImageCatalog(
      final Map<String, Map<Distro, OsImageConfig>> theImagesByCloud) {
    final Map<String, Map<Distro, OsImageConfig>> copy = new LinkedHashMap<>();
    theImagesByCloud.forEach((cloud, images) -> copy.put(cloud,
        Collections.unmodifiableMap(new LinkedHashMap<>(images))));
    imagesByCloud = Collections.unmodifiableMap(copy);
  }

  /**
   * Starts a new catalog builder.
   *
   * @return the builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /** {@inheritDoc} */
  @Override
  public Optional<Map<Distro, OsImageConfig>> forCloud(
      final String cloudName) {
    Objects.requireNonNull(cloudName, "cloudName must not be null");
    return Optional.ofNullable(imagesByCloud.get(cloudName));
  }

  /**
   * Returns the names of every cloud in this catalog.
   *
   * @return the cloud names, never null, unmodifiable
   */
  public Set<String> clouds() {
    return imagesByCloud.keySet();
  }

  /** Builder for {@link StaticOsImageCatalog}. */
  public static final class Builder {

    /** The images collected so far. */
    private final Map<String, Map<Distro, OsImageConfig>> imagesByCloud =
        new LinkedHashMap<>();

    /** Creates a new builder. */
    private Builder() {
    }

    /**
     * Declares a cloud, possibly without images.
     *
     * @param cloudName the cloud name, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder cloud(final String cloudName) {
      Objects.requireNonNull(cloudName, "cloudName must not be null");
      imagesByCloud.computeIfAbsent(cloudName, c -> new LinkedHashMap<>());
      return this;
    }

    /**
     * Adds the image of a distro in a cloud.
     *
     * @param cloudName the cloud name, never null
     * @param distro    the distro, never null
     * @param config    the image reference, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder image(final String cloudName, final Distro distro,
        final OsImageConfig config) {
      Objects.requireNonNull(distro, "distro must not be null");
      Objects.requireNonNull(config, "config must not be null");
      cloud(cloudName);
      imagesByCloud.get(cloudName).put(distro, config);
      return this;
    }

    /**
     * Builds the catalog.
     *
     * @return the catalog, never null
     */
    public StaticOsImageCatalog build() {
      return new StaticOsImageCatalog(imagesByCloud);
    }
  }
}
