package org.waabox.baker.datamodel;

import java.util.Objects;

/**
 * The OS families a Shared Image Gallery environment is split into.
 *
 * <p>Each family is a separate sub-catalog of an
 * {@link SigAzureEnvironmentSpecConfig}. The declaration order of the
 * constants is the lookup precedence used when a distro is searched across
 * every sub-catalog: the first family holding the distro wins.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum OsFamily {

  /** General purpose Linux images. */
  UBUNTU("AKSUbuntu"),

  /** The first immutable Linux family. */
  CBL_MARINER("AKSCBLMariner"),

  /** The second immutable Linux family. */
  AZURE_LINUX("AKSAzureLinux"),

  /** Windows Server images. */
  WINDOWS("AKSWindows"),

  /** Linux images only published to edge zone regions. */
  UBUNTU_EDGE_ZONE("AKSUbuntuEdgeZone");

  /** The key of the gallery this family is published to. */
  private final String galleryKey;

  /**
   * Creates a family.
   *
   * @param theGalleryKey the gallery key, never null
   */
  OsFamily(final String theGalleryKey) {
    galleryKey = Objects.requireNonNull(theGalleryKey,
        "galleryKey must not be null");
  }

  /**
   * Returns the key under which a {@link SigConfig} declares the gallery
   * holding this family's images.
   *
   * @return the gallery key, never null
   */
  public String galleryKey() {
    return galleryKey;
  }

  /**
   * Returns whether this is the Windows family.
   *
   * @return true for {@link #WINDOWS}
   */
  public boolean isWindows() {
    return this == WINDOWS;
  }
}
