package org.waabox.baker.vhd;

import java.util.Objects;

/**
 * A container image version tracked by the component inventory.
 *
 * @param latestVersion         the latest version, never null
 * @param previousLatestVersion the version before it, never null, may be
 *                              empty
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ImageVersion(String latestVersion,
    String previousLatestVersion) {

  /**
   * Creates a new image version.
   *
   * @throws NullPointerException if any argument is null
   */
  public ImageVersion {
    Objects.requireNonNull(latestVersion, "latestVersion must not be null");
    Objects.requireNonNull(previousLatestVersion,
        "previousLatestVersion must not be null");
  }
}
