package org.waabox.metricat;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.waabox.metricat.namespace.Namespace;
import org.waabox.metricat.policy.ConfigPolicyNode;

/**
 * One registered (namespace, version) pair advertised by exactly one
 * plugin.
 *
 * <p>Entries are created by the {@link MetricCatalog} when a plugin
 * advertises a metric and are owned by the catalog. The only mutable state
 * is the subscription count, which the catalog changes while holding its
 * lock; it is volatile so readers holding an entry outside the lock see
 * the latest count.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class MetricEntry {

  /** The metric namespace. */
  private final Namespace namespace;

  /** The resolved version, -1 when neither the metric nor its plugin has one. */
  private final int version;

  /** The plugin that advertised this metric. */
  private final PluginKey plugin;

  /** When the plugin last advertised this metric. */
  private final Instant lastAdvertisedTime;

  /** When this entry was registered. */
  private final Instant timestamp;

  /** The collection rules for this metric. */
  private final ConfigPolicyNode policy;

  /** The configuration already applied to this metric. */
  private final Map<String, Object> config;

  /** Descriptive tags. */
  private final Map<String, String> tags;

  /** Names of the dynamic namespace elements. */
  private final List<MetricLabel> labels;

  /** Where the metric comes from, empty if unknown. */
  private final String source;

  /** Opaque runtime payload, may be null. */
  private final Object data;

  /** The number of active subscriptions, never negative. */
  private volatile int subscriptions;

  /**
   * Creates a new entry.
   *
   * @param definition the advertised metric, never null
   * @param thePlugin  the advertising plugin, never null
   * @param thePolicy  the rules for this metric, never null
   * @param theTimestamp the registration instant, never null
   */
  MetricEntry(final MetricDefinition definition, final PluginKey thePlugin,
      final ConfigPolicyNode thePolicy, final Instant theTimestamp) {
    namespace = definition.namespace();
    if (definition.version() > 0) {
      version = definition.version();
    } else {
      version = thePlugin.version() > 0 ? thePlugin.version() : -1;
    }
    lastAdvertisedTime = definition.lastAdvertisedTime();
    tags = definition.tags();
    labels = definition.labels();
    plugin = Objects.requireNonNull(thePlugin, "plugin must not be null");
    policy = Objects.requireNonNull(thePolicy, "policy must not be null");
    timestamp = Objects.requireNonNull(theTimestamp,
        "timestamp must not be null");
    config = Map.of();
    source = "";
    data = null;
  }

  /**
   * Returns the metric namespace.
   *
   * @return the namespace, never null
   */
  public Namespace namespace() {
    return namespace;
  }

  /**
   * Returns the version of this metric: the explicitly advertised one if
   * any, else the version of the plugin that advertised it.
   *
   * @return the version, -1 if neither is positive
   */
  public int version() {
    return version;
  }

  /**
   * Returns the plugin that advertised this metric.
   *
   * @return the plugin key, never null
   */
  public PluginKey plugin() {
    return plugin;
  }

  /**
   * Returns when the plugin last advertised this metric.
   *
   * @return the instant, never null
   */
  public Instant lastAdvertisedTime() {
    return lastAdvertisedTime;
  }

  /**
   * Returns when this entry was registered in the catalog.
   *
   * @return the instant, never null
   */
  public Instant timestamp() {
    return timestamp;
  }

  /**
   * Returns the collection rules for this metric.
   *
   * @return the policy node, never null
   */
  public ConfigPolicyNode policy() {
    return policy;
  }

  /**
   * Returns the configuration already applied to this metric.
   *
   * @return an unmodifiable map, never null
   */
  public Map<String, Object> config() {
    return config;
  }

  /**
   * Returns the descriptive tags.
   *
   * @return an unmodifiable map, never null
   */
  public Map<String, String> tags() {
    return tags;
  }

  /**
   * Returns the names of the dynamic namespace elements.
   *
   * @return an unmodifiable list, never null
   */
  public List<MetricLabel> labels() {
    return labels;
  }

  /**
   * Returns where the metric comes from.
   *
   * @return the source, empty if unknown, never null
   */
  public String source() {
    return source;
  }

  /**
   * Returns the opaque runtime payload.
   *
   * @return the payload, if any
   */
  public Optional<Object> data() {
    return Optional.ofNullable(data);
  }

  /**
   * Returns the number of active subscriptions.
   *
   * @return the count, never negative
   */
  public int subscriptionCount() {
    return subscriptions;
  }

  /**
   * Returns the key of this entry, {@code <namespace key>/<version>}.
   *
   * @return the key, never null
   */
  public String key() {
    return namespace.key() + "/" + version();
  }

  /**
   * Increments the subscription count. Must be called while holding the
   * catalog lock.
   *
   * @return the new count
   */
  int subscribe() {
    subscriptions = subscriptions + 1;
    return subscriptions;
  }

  /**
   * Decrements the subscription count. Must be called while holding the
   * catalog lock.
   *
   * @return the new count
   *
   * @throws NegativeSubscriptionCountException if the count is already 0
   */
  int unsubscribe() {
    if (subscriptions == 0) {
      throw new NegativeSubscriptionCountException(namespace, version());
    }
    subscriptions = subscriptions - 1;
    return subscriptions;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return "MetricEntry{" + namespace + ", version=" + version()
        + ", plugin=" + plugin + ", subscriptions=" + subscriptions + "}";
  }
}
