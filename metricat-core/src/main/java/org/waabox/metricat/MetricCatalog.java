package org.waabox.metricat;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.metricat.event.CatalogEvent;
import org.waabox.metricat.event.CatalogEventListener;
import org.waabox.metricat.metrics.CatalogMetrics;
import org.waabox.metricat.metrics.NoopCatalogMetrics;
import org.waabox.metricat.namespace.Namespace;
import org.waabox.metricat.namespace.NamespaceValidator;
import org.waabox.metricat.policy.ConfigPolicy;

/**
 * The index of every metric namespace the loaded plugins can produce, at
 * every advertised version.
 *
 * <p>A MetricCatalog keeps three structures in one consistency domain: a
 * prefix tree of {@link MetricEntry entries} keyed by namespace segment,
 * the list of canonical keys with at least one registered version, and a
 * cache of the keys each wildcard query matched. All three are guarded by
 * a single lock; every public operation holds it for its whole critical
 * section, so no caller ever observes a key without its entries or a cached
 * query pointing at a removed key.
 *
 * <p>Input validation and the policy lookup happen before taking the lock.
 * Logging, metrics and {@link CatalogEventListener listeners} are called
 * after releasing it.
 *
 * <p>Instances are created through the fluent {@link Builder}:
 * <pre>{@code
 * MetricCatalog catalog = MetricCatalog.builder()
 *     .named("metrics")
 *     .metrics(new MicrometerCatalogMetrics(registry))
 *     .listener(event -> membership.publish(event))
 *     .build();
 *
 * catalog.add(MetricDefinition.of(Namespace.parse("/intel/mock/foo"), 1),
 *     plugin);
 * MetricEntry latest = catalog.get(Namespace.parse("/intel/mock/foo"), 0);
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class MetricCatalog {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(MetricCatalog.class);

  /** The default catalog name. */
  public static final String DEFAULT_NAME = "metrics";

  /** The name of this catalog. */
  private final String name;

  /** The metrics reporter. */
  private final CatalogMetrics metrics;

  /** The listeners notified of key changes, unmodifiable. */
  private final List<CatalogEventListener> listeners;

  /** The lock guarding the trie, the keys and the query cache. */
  private final ReentrantLock lock = new ReentrantLock();

  /** The registered entries. */
  private final MetricTrie trie = new MetricTrie();

  /** The canonical keys with at least one version, in registration
   * order. */
  private final Set<String> keys = new LinkedHashSet<>();

  /** The keys matched by each wildcard query. */
  private final QueryMatchCache queries = new QueryMatchCache();

  /**
   * Creates a new MetricCatalog.
   *
   * @param theName      the catalog name, never null
   * @param theMetrics   the metrics reporter, never null
   * @param theListeners the event listeners, never null
   */
  private MetricCatalog(final String theName, final CatalogMetrics theMetrics,
      final List<CatalogEventListener> theListeners) {
    name = theName;
    metrics = theMetrics;
    listeners = Collections.unmodifiableList(new ArrayList<>(theListeners));
  }

  /**
   * Creates a new builder for configuring a MetricCatalog.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the name of this catalog.
   *
   * @return the catalog name, never null
   */
  public String name() {
    return name;
  }

  /**
   * Registers a metric advertised by a loaded plugin.
   *
   * <p>The namespace is validated and the collection rules for it are taken
   * from the plugin's config policy. An entry already registered at the
   * same namespace and version is replaced. Every cached wildcard query is
   * re-derived so it sees the new key.
   *
   * @param definition the advertised metric, never null
   * @param plugin     the advertising plugin, never null
   *
   * @return the registered entry, never null
   *
   * @throws InvalidNamespaceException    if the namespace cannot be
   *                                      registered
   * @throws MissingConfigPolicyException if the plugin has no config policy
   */
  public MetricEntry add(final MetricDefinition definition,
      final LoadedPlugin plugin) {
    Objects.requireNonNull(definition, "definition must not be null");
    Objects.requireNonNull(plugin, "plugin must not be null");

    final Namespace namespace = definition.namespace();
    final MetricEntry entry = guarded("add", namespace, () -> {
      NamespaceValidator.validate(namespace);
      final ConfigPolicy policy = plugin.configPolicy();
      if (policy == null) {
        throw new MissingConfigPolicyException(namespace, plugin.key());
      }
      final MetricEntry created = new MetricEntry(definition, plugin.key(),
          policy.get(namespace), Instant.now());
      return locked(() -> {
        trie.add(created);
        keys.add(namespace.key());
        queries.refreshAll(keys);
        return created;
      });
    });

    log.debug("Catalog '{}': registered {} version {} from plugin {}",
        name, namespace, entry.version(), entry.plugin());
    metrics.metricAdded(name, namespace.key(), entry.version());
    publish(CatalogEvent.Type.ADDED, List.of(namespace.key()),
        entry.plugin());
    return entry;
  }

  /**
   * Registers a metric a plugin advertised while being loaded.
   *
   * <p>This is the entry point used by plugin management, one call per
   * advertised metric; it behaves exactly like
   * {@link #add(MetricDefinition, LoadedPlugin)}.
   *
   * @param plugin     the advertising plugin, never null
   * @param definition the advertised metric, never null
   *
   * @return the registered entry, never null
   *
   * @throws InvalidNamespaceException    if the namespace cannot be
   *                                      registered
   * @throws MissingConfigPolicyException if the plugin has no config policy
   */
  public MetricEntry addLoadedMetricType(final LoadedPlugin plugin,
      final MetricDefinition definition) {
    return add(definition, plugin);
  }

  /**
   * Resolves a namespace and version to one entry.
   *
   * <p>A positive version selects exactly that version. Zero or a negative
   * version selects the highest version registered for the namespace.
   *
   * @param namespace the exact namespace, never null
   * @param version   the version, or 0 for the latest
   *
   * @return the entry, never null
   *
   * @throws MetricNotFoundException if nothing matches
   */
  public MetricEntry get(final Namespace namespace, final int version) {
    Objects.requireNonNull(namespace, "namespace must not be null");
    return locked(() -> resolve(namespace, version));
  }

  /**
   * Returns every version registered at exactly the given namespace.
   *
   * @param namespace the exact namespace, never null
   *
   * @return the entries ordered by version, never null or empty
   *
   * @throws MetricNotFoundException if nothing is registered there
   */
  public List<MetricEntry> getVersions(final Namespace namespace) {
    Objects.requireNonNull(namespace, "namespace must not be null");
    return locked(() -> trie.get(namespace));
  }

  /**
   * Returns every entry registered at or below the given namespace.
   *
   * @param namespace the namespace prefix, never null; the root namespace
   *                  returns the whole catalog
   *
   * @return the entries, parents before children, never null
   *
   * @throws MetricNotFoundException if the namespace is not the root and
   *                                 nothing is registered at or below it
   */
  public List<MetricEntry> fetch(final Namespace namespace) {
    Objects.requireNonNull(namespace, "namespace must not be null");
    return locked(() -> trie.fetch(namespace));
  }

  /**
   * Returns the plugin that advertised the given metric.
   *
   * @param namespace the exact namespace, never null
   * @param version   the version, or 0 for the latest
   *
   * @return the plugin key, never null
   *
   * @throws MetricNotFoundException if nothing matches
   */
  public PluginKey getPlugin(final Namespace namespace, final int version) {
    return get(namespace, version).plugin();
  }

  /**
   * Removes every version registered at exactly the given namespace.
   *
   * <p>Entries below the namespace are kept. The key is dropped from the
   * key list and from every cached query.
   *
   * @param namespace the exact namespace, never null
   *
   * @return true if anything was removed
   */
  public boolean remove(final Namespace namespace) {
    Objects.requireNonNull(namespace, "namespace must not be null");
    final String key = namespace.key();
    final int removed = guarded("remove", namespace, () -> locked(() -> {
      final int count = trie.remove(namespace);
      if (count > 0) {
        keys.remove(key);
        queries.purge(key);
      }
      return count;
    }));

    if (removed == 0) {
      log.debug("Catalog '{}': nothing registered at {}", name, namespace);
      return false;
    }
    log.debug("Catalog '{}': removed {} version(s) of {}", name, removed,
        namespace);
    metrics.metricsRemoved(name, removed);
    publish(CatalogEvent.Type.REMOVED, List.of(key), null);
    return true;
  }

  /**
   * Removes every entry advertised by a plugin that has been unloaded.
   *
   * <p>Keys left without any version are dropped and every cached query is
   * re-derived, so queries that only matched the plugin's metrics are
   * dropped too.
   *
   * @param plugin the unloaded plugin, never null
   *
   * @return the number of entries removed
   */
  public int rmUnloadedPluginMetrics(final PluginKey plugin) {
    Objects.requireNonNull(plugin, "plugin must not be null");
    final MetricTrie.Removal removal = guarded("rmUnloadedPluginMetrics",
        Namespace.root(), () -> locked(() -> {
          final MetricTrie.Removal result = trie.deleteByPlugin(plugin);
          keys.removeAll(result.emptiedKeys());
          queries.refreshAll(keys);
          return result;
        }));

    if (removal.entries() == 0) {
      log.debug("Catalog '{}': plugin {} had no metrics registered", name,
          plugin);
      return 0;
    }
    log.info("Catalog '{}': removed {} metric(s) of unloaded plugin {}",
        name, removal.entries(), plugin);
    metrics.metricsRemoved(name, removal.entries());
    publish(CatalogEvent.Type.PLUGIN_UNLOADED,
        new ArrayList<>(removal.emptiedKeys()), plugin);
    return removal.entries();
  }

  /**
   * Adds one subscription to the resolved entry.
   *
   * @param namespace the exact namespace, never null
   * @param version   the version, or 0 for the latest
   *
   * @return the new subscription count
   *
   * @throws MetricNotFoundException if nothing matches
   */
  public int subscribe(final Namespace namespace, final int version) {
    Objects.requireNonNull(namespace, "namespace must not be null");
    final Subscription subscription = guarded("subscribe", namespace,
        () -> locked(() -> {
          final MetricEntry entry = resolve(namespace, version);
          return new Subscription(entry.key(), entry.subscribe());
        }));
    return subscriptionChanged(subscription);
  }

  /**
   * Removes one subscription from the resolved entry.
   *
   * @param namespace the exact namespace, never null
   * @param version   the version, or 0 for the latest
   *
   * @return the new subscription count
   *
   * @throws MetricNotFoundException            if nothing matches
   * @throws NegativeSubscriptionCountException if the entry has no
   *                                            subscriptions; the count is
   *                                            left at 0
   */
  public int unsubscribe(final Namespace namespace, final int version) {
    Objects.requireNonNull(namespace, "namespace must not be null");
    final Subscription subscription = guarded("unsubscribe", namespace,
        () -> locked(() -> {
          final MetricEntry entry = resolve(namespace, version);
          return new Subscription(entry.key(), entry.unsubscribe());
        }));
    return subscriptionChanged(subscription);
  }

  /**
   * Resolves a query namespace, which may hold wildcard or tuple segments,
   * against the registered keys and caches the result under the query's
   * key.
   *
   * <p>Asking again recomputes the matches against the current keys.
   *
   * @param query the query namespace, never null
   *
   * @return the matched namespaces in registration order, never null or
   *         empty
   *
   * @throws MetricNotFoundException if nothing matches
   */
  public List<Namespace> matchQuery(final Namespace query) {
    Objects.requireNonNull(query, "query must not be null");
    final String queryKey = query.key();
    final long start = System.nanoTime();
    final List<String> matched = locked(() -> queries.match(queryKey, keys));
    metrics.queryResolved(name, queryKey, matched.size(),
        System.nanoTime() - start);
    if (matched.isEmpty()) {
      throw new MetricNotFoundException(query);
    }
    return toNamespaces(matched);
  }

  /**
   * Returns the namespaces a query matched when last resolved by
   * {@link #matchQuery(Namespace)}, kept current by every mutation.
   *
   * @param query the query namespace, never null
   *
   * @return the matched namespaces, never null or empty
   *
   * @throws MetricNotFoundException if the query is not cached, either
   *                                 because it was never resolved or
   *                                 because it no longer matches anything
   */
  public List<Namespace> getQueriedNamespaces(final Namespace query) {
    Objects.requireNonNull(query, "query must not be null");
    final List<String> matched = locked(() -> queries.cached(query.key()))
        .orElseThrow(() -> new MetricNotFoundException(query));
    return toNamespaces(matched);
  }

  /**
   * Returns the canonical keys of every registered namespace.
   *
   * @return an unmodifiable snapshot in registration order, never null
   */
  public List<String> keys() {
    return locked(() -> List.copyOf(keys));
  }

  /**
   * Returns every registered namespace with its entries.
   *
   * <p>The result is a snapshot: later changes to the catalog are not
   * reflected in it, and iterating it never touches the catalog.
   *
   * @return an unmodifiable list in registration order, never null
   */
  public List<CatalogItem> items() {
    return locked(() -> {
      final List<CatalogItem> items = new ArrayList<>(keys.size());
      for (final String key : keys) {
        final Namespace namespace = Namespace.fromKey(key);
        items.add(new CatalogItem(key, namespace, trie.get(namespace)));
      }
      return Collections.unmodifiableList(items);
    });
  }

  /**
   * Returns aggregated statistics about this catalog.
   *
   * @return the catalog info, never null
   */
  public CatalogInfo info() {
    return locked(() -> {
      long subscriptions = 0;
      final List<MetricEntry> entries = trie.fetch(Namespace.root());
      for (final MetricEntry entry : entries) {
        subscriptions += entry.subscriptionCount();
      }
      return new CatalogInfo(name, keys.size(), entries.size(),
          queries.size(), subscriptions);
    });
  }

  /**
   * Resolves a namespace and version to one entry. Must be called while
   * holding the lock.
   *
   * @param namespace the exact namespace, never null
   * @param version   the version, or 0 or less for the latest
   *
   * @return the entry, never null
   *
   * @throws MetricNotFoundException if nothing matches
   */
  private MetricEntry resolve(final Namespace namespace, final int version) {
    final List<MetricEntry> entries = trie.lookup(namespace);
    if (version > 0) {
      for (final MetricEntry entry : entries) {
        if (entry.version() == version) {
          return entry;
        }
      }
      throw new MetricNotFoundException(namespace, version);
    }
    if (entries.isEmpty()) {
      throw new MetricNotFoundException(namespace);
    }
    return entries.get(entries.size() - 1);
  }

  /**
   * Runs the action while holding the catalog lock.
   *
   * @param action the action, never null
   * @param <R>    the result type
   *
   * @return the action's result
   */
  private <R> R locked(final Supplier<R> action) {
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Runs a catalog operation, logging and reporting its failure before
   * rethrowing it. The action must release the lock before returning or
   * throwing.
   *
   * @param operation the operation name, never null
   * @param namespace the namespace the operation works on, never null
   * @param action    the operation, never null
   * @param <R>       the result type
   *
   * @return the action's result
   */
  private <R> R guarded(final String operation, final Namespace namespace,
      final Supplier<R> action) {
    try {
      return action.get();
    } catch (final MetricCatalogException e) {
      log.warn("Catalog '{}': {} of {} failed: {}", name, operation,
          namespace, e.getMessage());
      metrics.operationFailed(name, operation, e);
      throw e;
    }
  }

  /**
   * Reports a new subscription count.
   *
   * @param subscription the changed subscription, never null
   *
   * @return the new count
   */
  private int subscriptionChanged(final Subscription subscription) {
    log.debug("Catalog '{}': {} has {} subscription(s)", name,
        subscription.entryKey(), subscription.count());
    metrics.subscriptionChanged(name, subscription.entryKey(),
        subscription.count());
    return subscription.count();
  }

  /**
   * Notifies every listener of a change. A failing listener is logged and
   * does not prevent the others from being notified.
   *
   * @param type        what happened, never null
   * @param changedKeys the affected keys, never null
   * @param plugin      the plugin involved, may be null
   */
  private void publish(final CatalogEvent.Type type,
      final List<String> changedKeys, final PluginKey plugin) {
    if (listeners.isEmpty()) {
      return;
    }
    final CatalogEvent event = new CatalogEvent(type, name, changedKeys,
        plugin, Instant.now());
    for (final CatalogEventListener listener : listeners) {
      try {
        listener.onEvent(event);
      } catch (final RuntimeException e) {
        log.warn("Catalog '{}': listener {} failed on {} event",
            name, listener, type, e);
      }
    }
  }

  /**
   * Turns canonical keys back into namespaces.
   *
   * @param matched the keys, never null
   *
   * @return an unmodifiable list of namespaces, never null
   */
  private static List<Namespace> toNamespaces(final List<String> matched) {
    final List<Namespace> result = new ArrayList<>(matched.size());
    for (final String key : matched) {
      result.add(Namespace.fromKey(key));
    }
    return Collections.unmodifiableList(result);
  }

  /** A subscription count taken under the lock.
   *
   * @param entryKey the key of the entry
   * @param count    the new count
   */
  private record Subscription(String entryKey, int count) {
  }

  /**
   * Builder for creating {@link MetricCatalog} instances.
   *
   * <p>All settings are optional. Defaults are applied at build time:
   * <ul>
   *   <li>name: {@value MetricCatalog#DEFAULT_NAME}</li>
   *   <li>metrics: {@link NoopCatalogMetrics}</li>
   *   <li>listeners: none</li>
   * </ul>
   */
  public static final class Builder {

    /** The optional catalog name. */
    private String name;

    /** The optional metrics reporter. */
    private CatalogMetrics metrics;

    /** The registered listeners. */
    private final List<CatalogEventListener> listeners = new ArrayList<>();

    /** Creates a new builder with default settings. */
    private Builder() {
    }

    /**
     * Sets the catalog name, used in logs, metrics and events.
     *
     * @param theName the name, never null or empty
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException     if theName is null
     * @throws IllegalArgumentException if theName is empty
     */
    public Builder named(final String theName) {
      Objects.requireNonNull(theName, "name must not be null");
      if (theName.isEmpty()) {
        throw new IllegalArgumentException("name must not be empty");
      }
      name = theName;
      return this;
    }

    /**
     * Sets the metrics reporter.
     *
     * @param theMetrics the metrics reporter, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theMetrics is null
     */
    public Builder metrics(final CatalogMetrics theMetrics) {
      Objects.requireNonNull(theMetrics, "metrics must not be null");
      metrics = theMetrics;
      return this;
    }

    /**
     * Adds a listener notified after every change of the catalog keys.
     *
     * @param theListener the listener, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theListener is null
     */
    public Builder listener(final CatalogEventListener theListener) {
      Objects.requireNonNull(theListener, "listener must not be null");
      listeners.add(theListener);
      return this;
    }

    /**
     * Builds the catalog, applying defaults for unset settings.
     *
     * @return a new, empty catalog, never null
     */
    public MetricCatalog build() {
      return new MetricCatalog(
          name != null ? name : DEFAULT_NAME,
          metrics != null ? metrics : new NoopCatalogMetrics(),
          listeners);
    }
  }
}
