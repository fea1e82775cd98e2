package org.waabox.baker.datamodel;

import java.util.Objects;

/**
 * A Shared Image Gallery image reference.
 *
 * <p>Instances are immutable. Applying a version override produces a copy
 * through {@link #withVersion(String)}, so catalog entries are never
 * changed by a lookup.
 *
 * @param resourceGroup  the resource group holding the gallery, never null
 * @param gallery        the gallery name, never null
 * @param definition     the image definition name, never null
 * @param version        the image version, never null
 * @param subscriptionId the subscription holding the gallery, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record SigImageConfig(String resourceGroup, String gallery,
    String definition, String version, String subscriptionId) {

  /**
   * Creates a new SIG image reference.
   *
   * @throws NullPointerException if any argument is null
   */
  public SigImageConfig {
    Objects.requireNonNull(resourceGroup, "resourceGroup must not be null");
    Objects.requireNonNull(gallery, "gallery must not be null");
    Objects.requireNonNull(definition, "definition must not be null");
    Objects.requireNonNull(version, "version must not be null");
    Objects.requireNonNull(subscriptionId,
        "subscriptionId must not be null");
  }

  /**
   * Returns a copy of this reference pointing at another version.
   *
   * @param newVersion the version to use, never null
   *
   * @return the copy, never null
   */
  public SigImageConfig withVersion(final String newVersion) {
    return new SigImageConfig(resourceGroup, gallery, definition,
        newVersion, subscriptionId);
  }
}
