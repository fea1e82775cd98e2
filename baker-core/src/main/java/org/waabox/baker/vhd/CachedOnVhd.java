package org.waabox.baker.vhd;

import java.util.Map;
import java.util.Objects;

/**
 * A snapshot of the three VHD inventories.
 *
 * <p>The snapshot references the populated inventories directly; nothing
 * is copied.
 *
 * @param fromManifest                 the image manifest, never null
 * @param fromComponentContainerImages the container images keyed by
 *                                     repository name, never null
 * @param fromComponentDownloadedFiles the downloaded files keyed by file
 *                                     name, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record CachedOnVhd(VhdManifest fromManifest,
    Map<String, ContainerImage> fromComponentContainerImages,
    Map<String, DownloadFile> fromComponentDownloadedFiles) {

  /**
   * Creates a new snapshot.
   *
   * @throws NullPointerException if any argument is null
   */
  public CachedOnVhd {
    Objects.requireNonNull(fromManifest, "fromManifest must not be null");
    Objects.requireNonNull(fromComponentContainerImages,
        "fromComponentContainerImages must not be null");
    Objects.requireNonNull(fromComponentDownloadedFiles,
        "fromComponentDownloadedFiles must not be null");
  }
}
