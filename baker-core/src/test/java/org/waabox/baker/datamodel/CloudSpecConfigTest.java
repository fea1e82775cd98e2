package org.waabox.baker.datamodel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link CloudSpecConfig}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class CloudSpecConfigTest {

  @Test
  void whenTargetingCloud_givenPublicRegion_shouldReturnPublicCloud() {
    assertEquals(CloudSpecConfig.AZURE_PUBLIC_CLOUD,
        CloudSpecConfig.targetCloudFor("westus2"));
    assertEquals(CloudSpecConfig.AZURE_PUBLIC_CLOUD,
        CloudSpecConfig.targetCloudFor("germanywestcentral"));
  }

  @Test
  void whenTargetingCloud_givenSovereignRegions_shouldReturnTheirClouds() {
    assertEquals(CloudSpecConfig.AZURE_CHINA_CLOUD,
        CloudSpecConfig.targetCloudFor("chinanorth3"));
    assertEquals(CloudSpecConfig.AZURE_US_GOVERNMENT_CLOUD,
        CloudSpecConfig.targetCloudFor("usgovvirginia"));
    assertEquals(CloudSpecConfig.AZURE_US_GOVERNMENT_CLOUD,
        CloudSpecConfig.targetCloudFor("usdodeast"));
    assertEquals(CloudSpecConfig.AZURE_GERMAN_CLOUD,
        CloudSpecConfig.targetCloudFor("germanycentral"));
    assertEquals(CloudSpecConfig.US_NAT_CLOUD,
        CloudSpecConfig.targetCloudFor("usnateast"));
    assertEquals(CloudSpecConfig.US_SEC_CLOUD,
        CloudSpecConfig.targetCloudFor("ussecwest"));
  }

  @Test
  void whenTargetingCloud_givenDisplayName_shouldNormalize() {
    assertEquals(CloudSpecConfig.AZURE_CHINA_CLOUD,
        CloudSpecConfig.targetCloudFor("China East 2"));
  }

  @Test
  void whenCreating_givenBlankName_shouldThrow() {
    assertThrows(IllegalArgumentException.class,
        () -> new CloudSpecConfig(" "));
  }
}
