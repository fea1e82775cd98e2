package org.waabox.baker.datamodel;

import java.util.Objects;

/**
 * The region independent part of a SIG image reference: which image
 * definition, and which version of it, a distro boots from.
 *
 * @param definition the image definition name, never null
 * @param version    the image version, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record SigImageConfigTemplate(String definition, String version) {

  /**
   * Creates a new template.
   *
   * @throws NullPointerException if any argument is null
   */
  public SigImageConfigTemplate {
    Objects.requireNonNull(definition, "definition must not be null");
    Objects.requireNonNull(version, "version must not be null");
  }

  /**
   * Binds this template to a gallery.
   *
   * @param gallery        the gallery holding the definition, never null
   * @param subscriptionId the subscription holding the gallery, never null
   *
   * @return the full image reference, never null
   */
  public SigImageConfig bind(final SigGalleryConfig gallery,
      final String subscriptionId) {
    Objects.requireNonNull(gallery, "gallery must not be null");
    return new SigImageConfig(gallery.resourceGroup(), gallery.galleryName(),
        definition, version, subscriptionId);
  }
}
