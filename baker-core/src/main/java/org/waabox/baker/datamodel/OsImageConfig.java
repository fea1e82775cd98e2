package org.waabox.baker.datamodel;

import java.util.Objects;

/**
 * A legacy marketplace image reference.
 *
 * @param imageOffer     the image offer, never null
 * @param imageSku       the image sku, never null
 * @param imagePublisher the image publisher, never null
 * @param imageVersion   the image version, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record OsImageConfig(String imageOffer, String imageSku,
    String imagePublisher, String imageVersion) {

  /**
   * Creates a new legacy image reference.
   *
   * @throws NullPointerException if any argument is null
   */
  public OsImageConfig {
    Objects.requireNonNull(imageOffer, "imageOffer must not be null");
    Objects.requireNonNull(imageSku, "imageSku must not be null");
    Objects.requireNonNull(imagePublisher,
        "imagePublisher must not be null");
    Objects.requireNonNull(imageVersion, "imageVersion must not be null");
  }
}
