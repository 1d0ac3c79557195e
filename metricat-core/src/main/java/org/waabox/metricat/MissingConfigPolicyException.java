package org.waabox.metricat;

import java.util.Objects;

import org.waabox.metricat.namespace.Namespace;

/**
 * Thrown when a plugin advertising a metric has no config policy.
 *
 * <p>Only the offending metric is rejected; other metrics of the same
 * plugin are unaffected.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class MissingConfigPolicyException
    extends MetricCatalogException {

  private static final long serialVersionUID = 1L;

  /** The plugin without a config policy, never null. */
  private final PluginKey plugin;

  /**
   * Creates a new exception.
   *
   * @param namespace the namespace being registered, cannot be null.
   * @param thePlugin the plugin that advertised it, cannot be null.
   */
  public MissingConfigPolicyException(final Namespace namespace,
      final PluginKey thePlugin) {
    super("Config policy is nil for plugin '"
        + Objects.requireNonNull(thePlugin, "plugin")
        + "' advertising " + namespace, namespace);
    plugin = thePlugin;
  }

  /** Returns the plugin that has no config policy.
   *
   * @return the plugin key, never null.
   */
  public PluginKey plugin() {
    return plugin;
  }
}
