package org.waabox.baker.vhd;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One dependency recorded in the image manifest, such as containerd or
 * runc.
 *
 * @param fileName         the package file name pattern, never null
 * @param downloadLocation where the package is downloaded to, never null
 * @param downloadUrl      where the package is downloaded from, never null
 * @param versions         the versions baked in, never null
 * @param pinned           versions pinned per OS release, never null
 * @param edge             the edge version, never null, may be empty
 * @param installed        versions installed per OS release, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ManifestDependency(String fileName, String downloadLocation,
    String downloadUrl, List<String> versions, Map<String, String> pinned,
    String edge, Map<String, String> installed) {

  /**
   * Creates a new manifest dependency.
   *
   * @throws NullPointerException if any argument is null
   */
  public ManifestDependency {
    Objects.requireNonNull(fileName, "fileName must not be null");
    Objects.requireNonNull(downloadLocation,
        "downloadLocation must not be null");
    Objects.requireNonNull(downloadUrl, "downloadUrl must not be null");
    Objects.requireNonNull(edge, "edge must not be null");
    versions = List.copyOf(Objects.requireNonNull(versions,
        "versions must not be null"));
    pinned = Map.copyOf(Objects.requireNonNull(pinned,
        "pinned must not be null"));
    installed = Map.copyOf(Objects.requireNonNull(installed,
        "installed must not be null"));
  }
}
