package org.waabox.baker.vhd;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The image manifest: the core dependencies baked into a node image.
 *
 * @param dependencies the dependencies keyed by name, never null,
 *                     unmodifiable
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record VhdManifest(Map<String, ManifestDependency> dependencies) {

  /**
   * Creates a new manifest.
   *
   * @throws NullPointerException if dependencies is null
   */
  public VhdManifest {
    dependencies = Map.copyOf(Objects.requireNonNull(dependencies,
        "dependencies must not be null"));
  }

  /**
   * Finds a dependency by name.
   *
   * @param name the dependency name, never null
   *
   * @return the dependency, or empty if not recorded
   */
  public Optional<ManifestDependency> dependency(final String name) {
    Objects.requireNonNull(name, "name must not be null");
    return Optional.ofNullable(dependencies.get(name));
  }
}
