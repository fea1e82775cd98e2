package org.waabox.baker.vhd;

import java.util.Map;
import java.util.Objects;

import org.waabox.baker.CacheNotInitializedException;

/**
 * Checks that the VHD inventories are populated and assembles them into
 * one {@link CachedOnVhd} snapshot.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class VhdCacheValidator {

  /** The inventories to validate. */
  private final VhdInventories inventories;

  /**
   * Creates a new validator.
   *
   * @param theInventories the inventories to read, never null
   */
  public VhdCacheValidator(final VhdInventories theInventories) {
    inventories = Objects.requireNonNull(theInventories,
        "inventories must not be null");
  }

  /**
   * Returns a snapshot referencing the three inventories.
   *
   * <p>Inventories are checked in the order manifest, container images,
   * downloaded files; the first missing one is reported.
   *
   * @return the snapshot, never null
   *
   * @throws CacheNotInitializedException if an inventory is not populated
   */
  public CachedOnVhd snapshot() {
    final VhdManifest manifest = inventories.manifest()
        .orElseThrow(() -> new CacheNotInitializedException(
            VhdInventory.MANIFEST));
    final Map<String, ContainerImage> images = inventories.containerImages()
        .orElseThrow(() -> new CacheNotInitializedException(
            VhdInventory.COMPONENT_CONTAINER_IMAGES));
    final Map<String, DownloadFile> files = inventories.downloadedFiles()
        .orElseThrow(() -> new CacheNotInitializedException(
            VhdInventory.COMPONENT_DOWNLOADED_FILES));
    return new CachedOnVhd(manifest, images, files);
  }
}
