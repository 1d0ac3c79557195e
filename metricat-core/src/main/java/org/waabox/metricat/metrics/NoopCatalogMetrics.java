package org.waabox.metricat.metrics;

/**
 * A no-operation implementation of {@link CatalogMetrics}.
 *
 * <p>All methods in this class are intentionally empty. Use this
 * implementation when metrics collection is not required or during
 * testing.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopCatalogMetrics implements CatalogMetrics {

  /** {@inheritDoc} */
  @Override
  public void metricAdded(final String catalogName, final String key,
      final int version) {
  }

  /** {@inheritDoc} */
  @Override
  public void metricsRemoved(final String catalogName, final int count) {
  }

  /** {@inheritDoc} */
  @Override
  public void queryResolved(final String catalogName, final String queryKey,
      final int matchedCount, final long durationNs) {
  }

  /** {@inheritDoc} */
  @Override
  public void subscriptionChanged(final String catalogName,
      final String entryKey, final int count) {
  }

  /** {@inheritDoc} */
  @Override
  public void operationFailed(final String catalogName,
      final String operation, final Throwable cause) {
  }
}
