package org.waabox.baker.metrics;

/**
 * A no-operation implementation of {@link BakerMetrics}.
 *
 * <p>All methods in this class are intentionally empty. Use this
 * implementation when metrics collection is not required or during
 * testing.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopBakerMetrics implements BakerMetrics {

  /** {@inheritDoc} */
  @Override
  public void imageResolved(final String distro, final String region) {
  }

  /** {@inheritDoc} */
  @Override
  public void overrideApplied(final String distro, final String version) {
  }

  /** {@inheritDoc} */
  @Override
  public void resolutionFailed(final String operation,
      final Throwable cause) {
  }
}
