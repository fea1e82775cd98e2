package org.waabox.baker.datamodel;

import java.util.Locale;
import java.util.Objects;

/**
 * Identifies the cloud a cluster is deployed to.
 *
 * <p>The cloud name selects the legacy image catalog.
 *
 * @param cloudName the cloud name, never null or blank
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record CloudSpecConfig(String cloudName) {

  /** The public cloud. */
  public static final String AZURE_PUBLIC_CLOUD = "AzurePublicCloud";

  /** The China sovereign cloud. */
  public static final String AZURE_CHINA_CLOUD = "AzureChinaCloud";

  /** The US Government cloud. */
  public static final String AZURE_US_GOVERNMENT_CLOUD =
      "AzureUSGovernmentCloud";

  /** The German sovereign cloud. */
  public static final String AZURE_GERMAN_CLOUD = "AzureGermanCloud";

  /** The USNat air gapped cloud. */
  public static final String US_NAT_CLOUD = "USNatCloud";

  /** The USSec air gapped cloud. */
  public static final String US_SEC_CLOUD = "USSecCloud";

  /**
   * Creates a new cloud spec.
   *
   * @throws NullPointerException     if cloudName is null
   * @throws IllegalArgumentException if cloudName is blank
   */
  public CloudSpecConfig {
    Objects.requireNonNull(cloudName, "cloudName must not be null");
    if (cloudName.isBlank()) {
      throw new IllegalArgumentException("cloudName must not be blank");
    }
  }

  /**
   * Returns the name of the cloud hosting the given region.
   *
   * @param region the region name, never null
   *
   * @return the cloud name, never null
   */
  public static String targetCloudFor(final String region) {
    Objects.requireNonNull(region, "region must not be null");
    final String location = region.toLowerCase(Locale.ROOT)
        .replace(" ", "");
    if (location.startsWith("china")) {
      return AZURE_CHINA_CLOUD;
    }
    if (location.startsWith("usgov") || location.startsWith("usdod")) {
      return AZURE_US_GOVERNMENT_CLOUD;
    }
    if (location.equals("germanycentral")
        || location.equals("germanynortheast")) {
      return AZURE_GERMAN_CLOUD;
    }
    if (location.startsWith("usnat")) {
      return US_NAT_CLOUD;
    }
    if (location.startsWith("ussec")) {
      return US_SEC_CLOUD;
    }
    return AZURE_PUBLIC_CLOUD;
  }
}
