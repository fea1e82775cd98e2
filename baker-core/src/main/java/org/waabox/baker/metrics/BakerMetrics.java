package org.waabox.baker.metrics;

/**
 * An abstraction for recording operational metrics of image resolution.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer, Prometheus, or Datadog. Use {@link NoopBakerMetrics}
 * when metrics collection is not required.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface BakerMetrics {

  /**
   * Records a successful image resolution.
   *
   * @param distro the distro name, never null
   * @param region the region, never null
   */
  void imageResolved(String distro, String region);

  /**
   * Records a version override replacing a catalog version.
   *
   * @param distro  the distro name, never null
   * @param version the override version, never null
   */
  void overrideApplied(String distro, String version);

  /**
   * Records a failed resolution.
   *
   * @param operation the operation that failed, never null
   * @param cause     the throwable that caused the failure, never null
   */
  void resolutionFailed(String operation, Throwable cause);
}
