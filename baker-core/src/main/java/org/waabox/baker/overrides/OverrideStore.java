package org.waabox.baker.overrides;

import java.util.Map;

/**
 * Supplies node image version overrides.
 *
 * <p>Implementations must be safe to call from many threads without
 * external locking.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface OverrideStore {

  /**
   * Returns the Linux node image versions that replace the catalog
   * versions for the given entity.
   *
   * <p>A distro missing from the result has no override.
   *
   * @param entity the entity to resolve overrides for, never null
   *
   * @return the versions keyed by distro name, never null
   */
  Map<String, String> linuxNodeImageVersions(OverrideEntity entity);
}
