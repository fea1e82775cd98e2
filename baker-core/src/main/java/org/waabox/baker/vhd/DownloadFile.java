package org.waabox.baker.vhd;

import java.util.List;
import java.util.Objects;

/**
 * A file downloaded into the node image.
 *
 * @param fileName         the file name pattern, never null
 * @param downloadLocation where the file is stored, never null
 * @param downloadUrl      where the file is downloaded from, never null
 * @param versions         the versions downloaded, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record DownloadFile(String fileName, String downloadLocation,
    String downloadUrl, List<String> versions) {

  /**
   * Creates a new downloaded file entry.
   *
   * @throws NullPointerException if any argument is null
   */
  public DownloadFile {
    Objects.requireNonNull(fileName, "fileName must not be null");
    Objects.requireNonNull(downloadLocation,
        "downloadLocation must not be null");
    Objects.requireNonNull(downloadUrl, "downloadUrl must not be null");
    versions = List.copyOf(Objects.requireNonNull(versions,
        "versions must not be null"));
  }
}
