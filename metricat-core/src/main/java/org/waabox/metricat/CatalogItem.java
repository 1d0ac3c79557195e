package org.waabox.metricat;

import java.util.List;
import java.util.Objects;

import org.waabox.metricat.namespace.Namespace;

/**
 * One key of a catalog snapshot with the entries registered under it.
 *
 * @param key       the canonical key, never null
 * @param namespace the namespace the key spells, never null
 * @param versions  the entries ordered by version, never null or empty
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record CatalogItem(String key, Namespace namespace,
    List<MetricEntry> versions) {

  /**
   * Creates a new CatalogItem.
   *
   * @param key       the canonical key, never null
   * @param namespace the namespace, never null
   * @param versions  the entries, never null
   */
  public CatalogItem {
    Objects.requireNonNull(key, "key must not be null");
    Objects.requireNonNull(namespace, "namespace must not be null");
    Objects.requireNonNull(versions, "versions must not be null");
    versions = List.copyOf(versions);
  }
}
