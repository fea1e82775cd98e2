package org.waabox.baker.overrides;

import java.util.Map;
import java.util.Objects;

/**
 * An {@link OverrideStore} returning the same overrides for every entity.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class StaticOverrideStore implements OverrideStore {

  /** The versions keyed by distro name. */
  private final Map<String, String> versions;

  /**
   * Creates a new store.
   *
   * @param theVersions the versions keyed by distro name, never null
   */
  public StaticOverrideStore(final Map<String, String> theVersions) {
    versions = Map.copyOf(Objects.requireNonNull(theVersions,
        "versions must not be null"));
  }

  /** {@inheritDoc} */
  @Override
  public Map<String, String> linuxNodeImageVersions(
      final OverrideEntity entity) {
    Objects.requireNonNull(entity, "entity must not be null");
    return versions;
  }
}
