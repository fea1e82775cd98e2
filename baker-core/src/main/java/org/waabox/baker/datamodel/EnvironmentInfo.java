package org.waabox.baker.datamodel;

import java.util.Objects;

/**
 * Describes where a node image is requested for, without carrying a full
 * node configuration.
 *
 * @param subscriptionId the subscription id, never null, may be empty
 * @param tenantId       the tenant id, never null, may be empty
 * @param region         the region, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record EnvironmentInfo(String subscriptionId, String tenantId,
    String region) {

  /**
   * Creates a new environment descriptor.
   *
   * @throws NullPointerException if any argument is null
   */
  public EnvironmentInfo {
    Objects.requireNonNull(subscriptionId,
        "subscriptionId must not be null");
    Objects.requireNonNull(tenantId, "tenantId must not be null");
    Objects.requireNonNull(region, "region must not be null");
  }

  /**
   * Creates an environment descriptor that only names a region.
   *
   * @param region the region, never null
   *
   * @return the descriptor, never null
   */
  public static EnvironmentInfo forRegion(final String region) {
    return new EnvironmentInfo("", "", region);
  }
}
