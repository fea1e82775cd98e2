package org.waabox.baker;

import java.util.Objects;

/**
 * Thrown when the legacy image catalog has no entry for a cloud.
 *
 * <p>The request cannot succeed until the cloud name is corrected.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class UnknownCloudException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** The unknown cloud name. */
  private final String cloudName;

  /**
   * Creates a new exception for the given cloud.
   *
   * @param theCloudName the cloud name that was not found, cannot be null.
   */
  public UnknownCloudException(final String theCloudName) {
    super("Don't have settings for cloud '"
        + Objects.requireNonNull(theCloudName, "cloudName") + "'");
    cloudName = theCloudName;
  }

  /**
   * Returns the cloud name that was not found.
   *
   * @return the cloud name, never null
   */
  public String cloudName() {
    return cloudName;
  }
}
