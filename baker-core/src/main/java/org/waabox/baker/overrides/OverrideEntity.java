package org.waabox.baker.overrides;

import java.util.Map;

/**
 * The key an {@link OverrideStore} resolves overrides for.
 *
 * <p>An entity is built either from a full node configuration
 * ({@link ConfigurationEntity}) or from a bare environment descriptor
 * ({@link EnvironmentEntity}). Both expose the same lookup fields, so a
 * store does not need to know which one it was given.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface OverrideEntity {

  /** The field holding the subscription id. */
  String SUBSCRIPTION_ID = "subscriptionId";

  /** The field holding the tenant id. */
  String TENANT_ID = "tenantId";

  /** The field holding the region. */
  String REGION = "region";

  /**
   * Returns the lookup fields of this entity.
   *
   * @return the fields keyed by name, never null, unmodifiable
   */
  Map<String, String> fields();

  /**
   * Returns the region of this entity.
   *
   * @return the region, never null, may be empty
   */
  default String region() {
    return fields().getOrDefault(REGION, "");
  }
}
