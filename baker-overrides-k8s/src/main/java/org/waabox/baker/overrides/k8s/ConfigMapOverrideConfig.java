package org.waabox.baker.overrides.k8s;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for the ConfigMap backed override store.
 *
 * <p>Names the ConfigMap holding the version overrides and how often it
 * is re-read. Instances are created via static factory methods and are
 * immutable.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ConfigMapOverrideConfig {

  /** The default Kubernetes namespace. */
  private static final String DEFAULT_NAMESPACE = "default";

  /** The default refresh interval (1 minute). */
  private static final Duration DEFAULT_REFRESH_INTERVAL =
      Duration.ofMinutes(1);

  /** The name of the ConfigMap. */
  private final String configMapName;

  /** The namespace the ConfigMap lives in. */
  private final String namespace;

  /** How often the ConfigMap is re-read. */
  private final Duration refreshInterval;

  /** Private constructor; use static factory methods. */
  private ConfigMapOverrideConfig(final String theConfigMapName,
      final String theNamespace, final Duration theRefreshInterval) {
    configMapName = Objects.requireNonNull(theConfigMapName,
        "configMapName must not be null");
    namespace = Objects.requireNonNull(theNamespace,
        "namespace must not be null");
    refreshInterval = Objects.requireNonNull(theRefreshInterval,
        "refreshInterval must not be null");
    if (refreshInterval.isZero() || refreshInterval.isNegative()) {
      throw new IllegalArgumentException(
          "refreshInterval must be positive, was " + refreshInterval);
    }
  }

  /**
   * Creates a new configuration with all parameters specified.
   *
   * @param theConfigMapName    the name of the ConfigMap, never null
   * @param theNamespace        the Kubernetes namespace, never null
   * @param theRefreshInterval  how often the ConfigMap is re-read, never
   *                            null, positive
   *
   * @return a new {@link ConfigMapOverrideConfig}, never null
   */
  public static ConfigMapOverrideConfig create(final String theConfigMapName,
      final String theNamespace, final Duration theRefreshInterval) {
    return new ConfigMapOverrideConfig(theConfigMapName, theNamespace,
        theRefreshInterval);
  }

  /**
   * Creates a new configuration in the default namespace, refreshed every
   * minute.
   *
   * @param theConfigMapName the name of the ConfigMap, never null
   *
   * @return a new {@link ConfigMapOverrideConfig}, never null
   */
  public static ConfigMapOverrideConfig create(
      final String theConfigMapName) {
    return new ConfigMapOverrideConfig(theConfigMapName, DEFAULT_NAMESPACE,
        DEFAULT_REFRESH_INTERVAL);
  }

  /**
   * Returns the name of the ConfigMap.
   *
   * @return the ConfigMap name, never null
   */
  public String configMapName() {
    return configMapName;
  }

  /**
   * Returns the Kubernetes namespace.
   *
   * @return the namespace, never null
   */
  public String namespace() {
    return namespace;
  }

  /**
   * Returns the refresh interval.
   *
   * @return how often the ConfigMap is re-read, never null
   */
  public Duration refreshInterval() {
    return refreshInterval;
  }
}
