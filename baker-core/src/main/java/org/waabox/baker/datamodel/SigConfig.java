package org.waabox.baker.datamodel;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Selects the galleries a SIG environment is built from.
 *
 * @param tenantId       the tenant owning the galleries, never null
 * @param subscriptionId the subscription holding the galleries, never null
 * @param galleries      the galleries keyed by gallery key (see
 *                       {@link OsFamily#galleryKey()}), never null,
 *                       unmodifiable
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record SigConfig(String tenantId, String subscriptionId,
    Map<String, SigGalleryConfig> galleries) {

  /**
   * Creates a new SIG selector.
   *
   * @throws NullPointerException if any argument is null
   */
  public SigConfig {
    Objects.requireNonNull(tenantId, "tenantId must not be null");
    Objects.requireNonNull(subscriptionId,
        "subscriptionId must not be null");
    Objects.requireNonNull(galleries, "galleries must not be null");
    galleries = Map.copyOf(galleries);
  }

  /**
   * Returns the gallery configured for the given family.
   *
   * @param family the family, never null
   *
   * @return the gallery, or empty if none is configured
   */
  public Optional<SigGalleryConfig> galleryFor(final OsFamily family) {
    Objects.requireNonNull(family, "family must not be null");
    return Optional.ofNullable(galleries.get(family.galleryKey()));
  }
}
