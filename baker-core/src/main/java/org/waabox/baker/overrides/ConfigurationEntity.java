package org.waabox.baker.overrides;

import java.util.Map;
import java.util.Objects;

import org.waabox.baker.datamodel.NodeBootstrappingConfiguration;

/**
 * An {@link OverrideEntity} built from a node configuration.
 *
 * @param subscriptionId the cluster subscription, never null
 * @param tenantId       the cluster tenant, never null
 * @param location       the cluster location, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ConfigurationEntity(String subscriptionId, String tenantId,
    String location) implements OverrideEntity {

  /**
   * Creates a new entity.
   *
   * @throws NullPointerException if any argument is null
   */
  public ConfigurationEntity {
    Objects.requireNonNull(subscriptionId,
        "subscriptionId must not be null");
    Objects.requireNonNull(tenantId, "tenantId must not be null");
    Objects.requireNonNull(location, "location must not be null");
  }

  /**
   * Builds the entity of a node configuration.
   *
   * @param config the configuration, never null
   *
   * @return the entity, never null
   */
  public static ConfigurationEntity from(
      final NodeBootstrappingConfiguration config) {
    Objects.requireNonNull(config, "config must not be null");
    return new ConfigurationEntity(config.subscriptionId(),
        config.tenantId(), config.containerService().location());
  }

  /** {@inheritDoc} */
  @Override
  public Map<String, String> fields() {
    return Map.of(SUBSCRIPTION_ID, subscriptionId, TENANT_ID, tenantId,
        REGION, location);
  }
}
