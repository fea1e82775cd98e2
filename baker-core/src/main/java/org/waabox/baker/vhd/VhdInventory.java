package org.waabox.baker.vhd;

/**
 * The inventories recorded while a node image is built.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum VhdInventory {

  /** The versions of the core dependencies, from the image manifest. */
  MANIFEST("manifest"),

  /** The container images pulled into the image. */
  COMPONENT_CONTAINER_IMAGES("component container images"),

  /** The files downloaded into the image. */
  COMPONENT_DOWNLOADED_FILES("component downloaded files");

  /** A human readable description. */
  private final String description;

  /**
   * Creates an inventory constant.
   *
   * @param theDescription the description, never null
   */
  VhdInventory(final String theDescription) {
    description = theDescription;
  }

  /**
   * Returns a human readable description of this inventory.
   *
   * @return the description, never null
   */
  public String description() {
    return description;
  }
}
