package org.waabox.baker.vhd;

import java.util.List;
import java.util.Objects;

/**
 * A container image pulled into the node image.
 *
 * @param downloadUrl        the image reference pattern, never null
 * @param amd64OnlyVersions  the plain version strings only pulled on
 *                           amd64, never null
 * @param multiArchVersions  the versions pulled on every architecture,
 *                           never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ContainerImage(String downloadUrl,
    List<String> amd64OnlyVersions,
    List<ImageVersion> multiArchVersions) {

  /**
   * Creates a new container image entry.
   *
   * @throws NullPointerException if any argument is null
   */
  public ContainerImage {
    Objects.requireNonNull(downloadUrl, "downloadUrl must not be null");
    amd64OnlyVersions = List.copyOf(Objects.requireNonNull(
        amd64OnlyVersions, "amd64OnlyVersions must not be null"));
    multiArchVersions = List.copyOf(Objects.requireNonNull(
        multiArchVersions, "multiArchVersions must not be null"));
  }

  /**
   * Returns the repository name of the image, the last path segment of
   * the download URL without its tag.
   *
   * @return the repository name, never null
   */
  public String repositoryName() {
    String name = downloadUrl.substring(downloadUrl.lastIndexOf('/') + 1);
    final int tag = name.indexOf(':');
    if (tag >= 0) {
      name = name.substring(0, tag);
    }
    return name;
  }
}
