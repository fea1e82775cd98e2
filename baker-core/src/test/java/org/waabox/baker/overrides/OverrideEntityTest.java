package org.waabox.baker.overrides;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;

import org.junit.jupiter.api.Test;
import org.waabox.baker.datamodel.EnvironmentInfo;

/**
 * Tests for the {@link OverrideEntity} implementations.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class OverrideEntityTest {

  @Test
  void whenGettingFields_givenConfigurationEntity_shouldUseLocation() {
    final ConfigurationEntity entity =
        new ConfigurationEntity("sub", "tenant", "eastus");

    assertEquals(Map.of("subscriptionId", "sub", "tenantId", "tenant",
        "region", "eastus"), entity.fields());
    assertEquals("eastus", entity.region());
  }

  @Test
  void whenGettingFields_givenEnvironmentEntity_shouldUseEnvironment() {
    final EnvironmentEntity entity = new EnvironmentEntity(
        new EnvironmentInfo("sub", "tenant", "westeurope"));

    assertEquals("westeurope", entity.region());
    assertEquals("sub", entity.fields().get(OverrideEntity.SUBSCRIPTION_ID));
  }

  @Test
  void whenQuerying_givenNoopStore_shouldReturnNoOverrides() {
    assertTrue(new NoopOverrideStore().linuxNodeImageVersions(
        new EnvironmentEntity(EnvironmentInfo.forRegion("eastus")))
        .isEmpty());
  }
}
