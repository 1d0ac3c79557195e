package org.waabox.metricat;

import org.waabox.metricat.policy.ConfigPolicy;

/**
 * A plugin that plugin management has loaded and whose metrics are being
 * added to the catalog.
 *
 * <p>The catalog only reads the plugin while registering its metrics; the
 * entries it creates keep the {@link #key()} and never the plugin itself.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface LoadedPlugin {

  /**
   * Returns the identifier of this plugin.
   *
   * @return the plugin key, never null
   */
  PluginKey key();

  /**
   * Returns the config policy declared by this plugin.
   *
   * @return the config policy, or null if the plugin declared none
   */
  ConfigPolicy configPolicy();

  /**
   * Returns the version of this plugin.
   *
   * @return the plugin version
   */
  default int version() {
    return key().version();
  }
}
