package org.waabox.metricat.event;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.waabox.metricat.PluginKey;

/**
 * Describes a change of the set of keys registered in a metric catalog.
 *
 * <p>Events are published after the catalog has released its lock, so
 * consumers such as a cluster membership layer can learn which metrics a
 * node offers without reading the catalog themselves.
 *
 * @param type        what happened, never null
 * @param catalogName the name of the catalog that changed, never null
 * @param keys        the canonical keys affected by the change, never null
 * @param plugin      the plugin that advertised or owned the metrics, may be
 *                    null for explicit removals
 * @param timestamp   the instant at which the change happened, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record CatalogEvent(
    Type type,
    String catalogName,
    List<String> keys,
    PluginKey plugin,
    Instant timestamp
) {

  /**
   * Creates a new CatalogEvent.
   *
   * @param type        what happened, never null
   * @param catalogName the catalog name, never null
   * @param keys        the affected keys, never null
   * @param plugin      the plugin, may be null
   * @param timestamp   the instant of the change, never null
   */
  public CatalogEvent {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(catalogName, "catalogName must not be null");
    Objects.requireNonNull(keys, "keys must not be null");
    Objects.requireNonNull(timestamp, "timestamp must not be null");
    keys = List.copyOf(keys);
  }

  /**
   * Returns the plugin involved in the change.
   *
   * @return the plugin key, if any
   */
  public Optional<PluginKey> pluginKey() {
    return Optional.ofNullable(plugin);
  }

  /** The kind of change. */
  public enum Type {

    /** A plugin registered a metric. */
    ADDED,

    /** A namespace was removed explicitly. */
    REMOVED,

    /** Every metric of an unloaded plugin was removed. */
    PLUGIN_UNLOADED
  }
}
