package org.waabox.baker.spring;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for Baker, mapped from the {@code baker.*}
 * prefix in application.yml or application.properties.
 *
 * <p>Supports:
 * <ul>
 *   <li>{@code baker.catalog.os-images} - path of the legacy image catalog
 *       JSON file.</li>
 *   <li>{@code baker.catalog.sig-images} - path of the SIG image
 *       definitions JSON file.</li>
 *   <li>{@code baker.vhd.manifest} and {@code baker.vhd.components} -
 *       paths of the node image manifest and components files.</li>
 *   <li>{@code baker.overrides.*} - static distro to version
 *       overrides.</li>
 *   <li>{@code baker.config-map.*} - the ConfigMap holding version
 *       overrides, when the Kubernetes override module is present.</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "baker")
public class BakerProperties {

  /** The catalog files. */
  private final Catalog catalog = new Catalog();

  /** The node image inventory files. */
  private final Vhd vhd = new Vhd();

  /** The ConfigMap override source. */
  private final ConfigMap configMap = new ConfigMap();

  /** Static image versions keyed by distro name. */
  private Map<String, String> overrides = new LinkedHashMap<>();

  /**
   * Returns the catalog files.
   *
   * @return the catalog properties, never null
   */
  public Catalog getCatalog() {
    return catalog;
  }

  /**
   * Returns the node image inventory files.
   *
   * @return the VHD properties, never null
   */
  public Vhd getVhd() {
    return vhd;
  }

  /**
   * Returns the ConfigMap override source.
   *
   * @return the ConfigMap properties, never null
   */
  public ConfigMap getConfigMap() {
    return configMap;
  }

  /**
   * Returns the static image version overrides.
   *
   * @return the versions keyed by distro name, never null
   */
  public Map<String, String> getOverrides() {
    return overrides;
  }

  /**
   * Sets the static image version overrides.
   *
   * @param overrides the versions keyed by distro name, may be null
   */
  public void setOverrides(final Map<String, String> overrides) {
    this.overrides = overrides == null ? new LinkedHashMap<>() : overrides;
  }

  /** The catalog files. */
  public static class Catalog {

    /** Path of the legacy image catalog, null if not configured. */
    private String osImages;

    /** Path of the SIG image definitions, null if not configured. */
    private String sigImages;

    /**
     * Returns the path of the legacy image catalog.
     *
     * @return the path, or null if not configured
     */
    public String getOsImages() {
      return osImages;
    }

    /**
     * Sets the path of the legacy image catalog.
     *
     * @param osImages the path, may be null
     */
    public void setOsImages(final String osImages) {
      this.osImages = osImages;
    }

    /**
     * Returns the path of the SIG image definitions.
     *
     * @return the path, or null if not configured
     */
    public String getSigImages() {
      return sigImages;
    }

    /**
     * Sets the path of the SIG image definitions.
     *
     * @param sigImages the path, may be null
     */
    public void setSigImages(final String sigImages) {
      this.sigImages = sigImages;
    }
  }

  /** The node image inventory files. */
  public static class Vhd {

    /** Path of manifest.json, null if not configured. */
    private String manifest;

    /** Path of components.json, null if not configured. */
    private String components;

    /**
     * Returns the path of the image manifest.
     *
     * @return the path, or null if not configured
     */
    public String getManifest() {
      return manifest;
    }

    /**
     * Sets the path of the image manifest.
     *
     * @param manifest the path, may be null
     */
    public void setManifest(final String manifest) {
      this.manifest = manifest;
    }

    /**
     * Returns the path of the components file.
     *
     * @return the path, or null if not configured
     */
    public String getComponents() {
      return components;
    }

    /**
     * Sets the path of the components file.
     *
     * @param components the path, may be null
     */
    public void setComponents(final String components) {
      this.components = components;
    }
  }

  /** The ConfigMap holding version overrides. */
  public static class ConfigMap {

    /** The ConfigMap name, null disables the ConfigMap store. */
    private String name;

    /** The namespace of the ConfigMap. */
    private String namespace = "default";

    /** How often the ConfigMap is re-read. */
    private Duration refreshInterval = Duration.ofMinutes(1);

    public String getName() {
      return name;
    }

    public void setName(final String name) {
      this.name = name;
    }

    public String getNamespace() {
      return namespace;
    }

    public void setNamespace(final String namespace) {
      this.namespace = namespace;
    }

    public Duration getRefreshInterval() {
      return refreshInterval;
    }

    public void setRefreshInterval(final Duration refreshInterval) {
      this.refreshInterval = refreshInterval;
    }
  }
}
