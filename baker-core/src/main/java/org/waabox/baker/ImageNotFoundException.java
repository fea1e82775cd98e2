package org.waabox.baker;

import java.util.Objects;

import org.waabox.baker.datamodel.Distro;

/**
 * Thrown when no catalog holds an image for a distro.
 *
 * <p>This signals a genuine gap in the catalogs of a region.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ImageNotFoundException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** The distro that was looked up. */
  private final transient Distro distro;

  /** The region the distro was looked up in. */
  private final String region;

  /**
   * Creates a new exception.
   *
   * @param theDistro the distro that was looked up, cannot be null.
   * @param theRegion the region it was looked up in, cannot be null.
   */
  public ImageNotFoundException(final Distro theDistro,
      final String theRegion) {
    super("Can't find image for distro '"
        + Objects.requireNonNull(theDistro, "distro").name()
        + "' in region '" + Objects.requireNonNull(theRegion, "region")
        + "'");
    distro = theDistro;
    region = theRegion;
  }

  /**
   * Returns the distro that was looked up.
   *
   * @return the distro, never null
   */
  public Distro distro() {
    return distro;
  }

  /**
   * Returns the region the distro was looked up in.
   *
   * @return the region, never null
   */
  public String region() {
    return region;
  }
}
