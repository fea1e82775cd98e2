package org.waabox.baker.vhd;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the three VHD inventories of a process.
 *
 * <p>Each inventory is populated exactly once, while the process starts and
 * before any request is served, and is read-only afterwards. Populating an
 * inventory twice fails. Handles are independent of each other, so every
 * component (or test) can own its own.
 *
 * <p>This class is thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class VhdInventories {

  /** The image manifest. */
  private final AtomicReference<VhdManifest> manifest =
      new AtomicReference<>();

  /** The container images, keyed by repository name. */
  private final AtomicReference<Map<String, ContainerImage>> containerImages =
      new AtomicReference<>();

  /** The downloaded files, keyed by file name. */
  private final AtomicReference<Map<String, DownloadFile>> downloadedFiles =
      new AtomicReference<>();

  /**
   * Populates the image manifest.
   *
   * @param theManifest the manifest, never null
   *
   * @throws IllegalStateException if the manifest was already populated
   */
  public void populateManifest(final VhdManifest theManifest) {
    Objects.requireNonNull(theManifest, "manifest must not be null");
    setOnce(manifest, theManifest, VhdInventory.MANIFEST);
  }

  /**
   * Populates the container image inventory.
   *
   * @param images the images keyed by repository name, never null
   *
   * @throws IllegalStateException if the inventory was already populated
   */
  public void populateContainerImages(
      final Map<String, ContainerImage> images) {
    Objects.requireNonNull(images, "images must not be null");
    setOnce(containerImages,
        Collections.unmodifiableMap(new LinkedHashMap<>(images)),
        VhdInventory.COMPONENT_CONTAINER_IMAGES);
  }

  /**
   * Populates the downloaded file inventory.
   *
   * @param files the files keyed by file name, never null
   *
   * @throws IllegalStateException if the inventory was already populated
   */
  public void populateDownloadedFiles(final Map<String, DownloadFile> files) {
    Objects.requireNonNull(files, "files must not be null");
    setOnce(downloadedFiles,
        Collections.unmodifiableMap(new LinkedHashMap<>(files)),
        VhdInventory.COMPONENT_DOWNLOADED_FILES);
  }

  /**
   * Returns the image manifest.
   *
   * @return the manifest, or empty if not populated
   */
  public Optional<VhdManifest> manifest() {
    return Optional.ofNullable(manifest.get());
  }

  /**
   * Returns the container image inventory.
   *
   * @return the images, or empty if not populated
   */
  public Optional<Map<String, ContainerImage>> containerImages() {
    return Optional.ofNullable(containerImages.get());
  }

  /**
   * Returns the downloaded file inventory.
   *
   * @return the files, or empty if not populated
   */
  public Optional<Map<String, DownloadFile>> downloadedFiles() {
    return Optional.ofNullable(downloadedFiles.get());
  }

  /**
   * Sets a slot unless it already holds a value.
   *
   * @param slot      the slot, never null
   * @param value     the value, never null
   * @param inventory the inventory the slot holds, never null
   * @param <T>       the slot type
   */
  private static <T> void setOnce(final AtomicReference<T> slot,
      final T value, final VhdInventory inventory) {
    if (!slot.compareAndSet(null, value)) {
      throw new IllegalStateException(
          "The " + inventory.description() + " inventory is already"
              + " populated");
    }
  }
}
