package org.waabox.baker.catalog;

import java.util.Map;
import java.util.Optional;

import org.waabox.baker.datamodel.Distro;
import org.waabox.baker.datamodel.OsImageConfig;

/**
 * The legacy per-cloud image catalog.
 *
 * <p>Implementations must be immutable or otherwise safe to read from many
 * threads.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface OsImageCatalog {

  /**
   * Returns the images of a cloud.
   *
   * @param cloudName the cloud name, never null
   *
   * @return the images keyed by distro, or empty if the cloud is unknown
   */
  Optional<Map<Distro, OsImageConfig>> forCloud(String cloudName);
}
