package org.waabox.metricat;

import java.util.Objects;

/**
 * Identifies a loaded plugin by type, name and version.
 *
 * <p>Metric entries keep this key instead of the plugin object so that the
 * catalog never extends a plugin's lifetime: the plugin itself is owned by
 * plugin management, which can resolve the key back to the live plugin.
 *
 * @param type    the plugin type, e.g. "collector", never null or empty
 * @param name    the plugin name, e.g. "mock", never null or empty
 * @param version the plugin version
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record PluginKey(String type, String name, int version) {

  /** The separator used by {@link #toString()} and {@link #parse}. */
  private static final String SEPARATOR = ":";

  /**
   * Creates a new PluginKey.
   *
   * @param type    the plugin type, never null or empty
   * @param name    the plugin name, never null or empty
   * @param version the plugin version
   *
   * @throws NullPointerException     if type or name is null
   * @throws IllegalArgumentException if type or name is empty
   */
  public PluginKey {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(name, "name must not be null");
    if (type.isEmpty() || name.isEmpty()) {
      throw new IllegalArgumentException(
          "type and name must not be empty");
    }
  }

  /**
   * Parses a key in the {@code type:name:version} form produced by
   * {@link #toString()}.
   *
   * @param text the text to parse, never null
   *
   * @return the plugin key, never null
   *
   * @throws IllegalArgumentException if the text is not a plugin key
   */
  public static PluginKey parse(final String text) {
    Objects.requireNonNull(text, "text must not be null");
    final String[] parts = text.split(SEPARATOR, -1);
    if (parts.length != 3) {
      throw new IllegalArgumentException("Not a plugin key: " + text);
    }
    try {
      return new PluginKey(parts[0], parts[1], Integer.parseInt(parts[2]));
    } catch (final NumberFormatException e) {
      throw new IllegalArgumentException("Not a plugin key: " + text, e);
    }
  }

  /**
   * Returns the key as {@code type:name:version}.
   *
   * @return the textual form, never null
   */
  @Override
  public String toString() {
    return type + SEPARATOR + name + SEPARATOR + version;
  }
}
