package org.waabox.metricat.metrics;

/**
 * An abstraction for recording operational metrics of a metric catalog.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer, Prometheus, or Datadog. Use {@link NoopCatalogMetrics}
 * when metrics collection is not required.
 *
 * <p>Every method is called after the catalog has released its lock, so an
 * implementation may block without stalling other catalog callers.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface CatalogMetrics {

  /**
   * Records a metric registered by a plugin.
   *
   * @param catalogName the name of the catalog, never null
   * @param key         the canonical key of the registered namespace,
   *                    never null
   * @param version     the registered version
   */
  void metricAdded(String catalogName, String key, int version);

  /**
   * Records metric entries removed from the catalog, either explicitly or
   * because their plugin was unloaded.
   *
   * @param catalogName the name of the catalog, never null
   * @param count       the number of entries removed
   */
  void metricsRemoved(String catalogName, int count);

  /**
   * Records a resolved wildcard query.
   *
   * @param catalogName  the name of the catalog, never null
   * @param queryKey     the query key, never null
   * @param matchedCount the number of keys the query matched
   * @param durationNs   the time spent resolving the query, in nanoseconds
   */
  void queryResolved(String catalogName, String queryKey, int matchedCount,
      long durationNs);

  /**
   * Records a change of the subscription count of an entry.
   *
   * @param catalogName the name of the catalog, never null
   * @param entryKey    the key of the entry, {@code <namespace key>/<version>},
   *                    never null
   * @param count       the new subscription count
   */
  void subscriptionChanged(String catalogName, String entryKey, int count);

  /**
   * Records a failed catalog operation.
   *
   * @param catalogName the name of the catalog, never null
   * @param operation   the name of the operation, e.g. "add", never null
   * @param cause       the throwable that caused the failure, never null
   */
  void operationFailed(String catalogName, String operation, Throwable cause);
}
