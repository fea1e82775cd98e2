package org.waabox.baker;

import java.util.Objects;

/**
 * Thrown when a SIG catalog provider cannot build the environment catalog
 * for a selector and region.
 *
 * <p>Resolvers propagate this exception unchanged to their callers.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SigResolutionException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** The region the environment was requested for. */
  private final String region;

  /**
   * Creates a new exception.
   *
   * @param theRegion the region, cannot be null.
   * @param reason    what went wrong, cannot be null.
   */
  public SigResolutionException(final String theRegion,
      final String reason) {
    super("Can't resolve SIG environment for region '"
        + Objects.requireNonNull(theRegion, "region") + "': "
        + Objects.requireNonNull(reason, "reason"));
    region = theRegion;
  }

  /**
   * Creates a new exception with an underlying cause.
   *
   * @param theRegion the region, cannot be null.
   * @param reason    what went wrong, cannot be null.
   * @param cause     the underlying cause, cannot be null.
   */
  public SigResolutionException(final String theRegion, final String reason,
      final Throwable cause) {
    super("Can't resolve SIG environment for region '"
        + Objects.requireNonNull(theRegion, "region") + "': "
        + Objects.requireNonNull(reason, "reason"), cause);
    region = theRegion;
  }

  /**
   * Returns the region the environment was requested for.
   *
   * @return the region, never null
   */
  public String region() {
    return region;
  }
}
