package org.waabox.baker.datamodel;

import java.util.Objects;

/**
 * Locates one Shared Image Gallery.
 *
 * @param galleryName   the gallery name, never null
 * @param resourceGroup the resource group holding the gallery, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record SigGalleryConfig(String galleryName, String resourceGroup) {

  /**
   * Creates a new gallery locator.
   *
   * @throws NullPointerException if any argument is null
   */
  public SigGalleryConfig {
    Objects.requireNonNull(galleryName, "galleryName must not be null");
    Objects.requireNonNull(resourceGroup, "resourceGroup must not be null");
  }
}
