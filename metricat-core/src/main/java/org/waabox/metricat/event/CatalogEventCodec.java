package org.waabox.metricat.event;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.waabox.metricat.PluginKey;

/**
 * Static utility class for serializing and deserializing
 * {@link CatalogEvent} instances to and from JSON strings.
 *
 * <p>Uses Jackson's tree model ({@link JsonNode}). {@link Instant} values
 * are stored as ISO-8601 strings and the plugin as its
 * {@code type:name:version} text; the {@code plugin} field is omitted when
 * the event has none.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CatalogEventCodec {

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Private constructor to prevent instantiation. */
  private CatalogEventCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Serializes a {@link CatalogEvent} into a JSON string.
   *
   * @param event the event to serialize, never null.
   * @return the JSON representation of the event, never null.
   */
  public static String serialize(final CatalogEvent event) {
    Objects.requireNonNull(event, "event cannot be null");

    final ObjectNode node = MAPPER.createObjectNode();
    node.put("type", event.type().name());
    node.put("catalogName", event.catalogName());
    final ArrayNode keys = node.putArray("keys");
    event.keys().forEach(keys::add);
    if (event.plugin() != null) {
      node.put("plugin", event.plugin().toString());
    }
    node.put("timestamp", event.timestamp().toString());

    return node.toString();
  }

  /**
   * Deserializes a JSON string into a {@link CatalogEvent}.
   *
   * @param json the JSON string to parse, never null.
   * @return the parsed {@link CatalogEvent}, never null.
   * @throws IllegalArgumentException if the JSON is malformed or missing
   *     required fields.
   */
  public static CatalogEvent deserialize(final String json) {
    Objects.requireNonNull(json, "json cannot be null");

    try {
      final JsonNode node = MAPPER.readTree(json);

      final CatalogEvent.Type type = CatalogEvent.Type.valueOf(
          requireField(node, "type").asText());
      final String catalogName = requireField(node, "catalogName").asText();

      final JsonNode keysNode = requireField(node, "keys");
      if (!keysNode.isArray()) {
        throw new IllegalArgumentException(
            "Field keys is not an array in JSON: " + node);
      }
      final List<String> keys = new ArrayList<>();
      keysNode.forEach(key -> keys.add(key.asText()));

      final JsonNode pluginNode = node.get("plugin");
      final PluginKey plugin = pluginNode == null || pluginNode.isNull()
          ? null : PluginKey.parse(pluginNode.asText());

      final Instant timestamp = Instant.parse(
          requireField(node, "timestamp").asText()
      );

      return new CatalogEvent(type, catalogName, keys, plugin, timestamp);
    } catch (final IllegalArgumentException e) {
      throw e;
    } catch (final Exception e) {
      throw new IllegalArgumentException(
          "Failed to deserialize CatalogEvent from JSON: " + json, e
      );
    }
  }

  /** Returns the field node for the given key or throws if missing.
   *
   * @param node the parent JSON node.
   * @param field the field name to look up.
   * @return the field node, never null.
   * @throws IllegalArgumentException if the field is missing.
   */
  private static JsonNode requireField(final JsonNode node,
      final String field) {
    final JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw new IllegalArgumentException(
          "Missing field: " + field + " in JSON: " + node
      );
    }
    return value;
  }
}
