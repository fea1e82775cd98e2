package org.waabox.baker.overrides;

import java.util.Map;
import java.util.Objects;

import org.waabox.baker.datamodel.EnvironmentInfo;

/**
 * An {@link OverrideEntity} built from an environment descriptor.
 *
 * @param environment the environment, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record EnvironmentEntity(EnvironmentInfo environment)
    implements OverrideEntity {

  /**
   * Creates a new entity.
   *
   * @throws NullPointerException if environment is null
   */
  public EnvironmentEntity {
    Objects.requireNonNull(environment, "environment must not be null");
  }

  /** {@inheritDoc} */
  @Override
  public Map<String, String> fields() {
    return Map.of(SUBSCRIPTION_ID, environment.subscriptionId(),
        TENANT_ID, environment.tenantId(), REGION, environment.region());
  }
}
