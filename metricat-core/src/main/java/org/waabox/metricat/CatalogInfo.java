package org.waabox.metricat;

import java.util.Objects;

/**
 * Holds aggregated statistics for a metric catalog.
 *
 * @param catalogName        the catalog name, never null
 * @param keyCount           the number of registered namespaces
 * @param entryCount         the number of registered (namespace, version)
 *                           entries
 * @param cachedQueryCount   the number of wildcard queries currently cached
 * @param totalSubscriptions the sum of the subscription counts of every
 *                           entry
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record CatalogInfo(String catalogName, int keyCount, int entryCount,
    int cachedQueryCount, long totalSubscriptions) {

  /**
   * Creates a new CatalogInfo instance.
   *
   * @param catalogName        the catalog name, never null
   * @param keyCount           the number of registered namespaces
   * @param entryCount         the number of registered entries
   * @param cachedQueryCount   the number of cached queries
   * @param totalSubscriptions the sum of all subscription counts
   *
   * @throws NullPointerException if catalogName is null
   */
  public CatalogInfo {
    Objects.requireNonNull(catalogName, "catalogName must not be null");
  }
}
