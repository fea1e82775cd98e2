package org.waabox.baker;

import java.util.Objects;

import org.waabox.baker.vhd.VhdInventory;

/**
 * Thrown when one of the VHD inventories was never populated.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CacheNotInitializedException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** The missing inventory. */
  private final VhdInventory inventory;

  /**
   * Creates a new exception for the given inventory.
   *
   * @param theInventory the inventory that is not populated, cannot be
   *                     null.
   */
  public CacheNotInitializedException(final VhdInventory theInventory) {
    super("Cached versions from "
        + Objects.requireNonNull(theInventory, "inventory").description()
        + " are not available");
    inventory = theInventory;
  }

  /**
   * Returns the inventory that is not populated.
   *
   * @return the inventory, never null
   */
  public VhdInventory inventory() {
    return inventory;
  }
}
