package org.waabox.metricat;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.waabox.metricat.namespace.Namespace;

/**
 * A metric as advertised by a plugin when it is loaded.
 *
 * @param namespace          the metric namespace, never null
 * @param version            the metric version, 0 to use the plugin version
 * @param lastAdvertisedTime when the plugin last advertised the metric,
 *                           never null
 * @param tags               descriptive tags, never null
 * @param labels             names of the dynamic namespace elements, never
 *                           null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record MetricDefinition(Namespace namespace, int version,
    Instant lastAdvertisedTime, Map<String, String> tags,
    List<MetricLabel> labels) {

  /**
   * Creates a new MetricDefinition.
   *
   * @throws NullPointerException     if any reference argument is null
   * @throws IllegalArgumentException if version is negative
   */
  public MetricDefinition {
    Objects.requireNonNull(namespace, "namespace must not be null");
    Objects.requireNonNull(lastAdvertisedTime,
        "lastAdvertisedTime must not be null");
    Objects.requireNonNull(tags, "tags must not be null");
    Objects.requireNonNull(labels, "labels must not be null");
    if (version < 0) {
      throw new IllegalArgumentException(
          "version must not be negative, got: " + version);
    }
    tags = Map.copyOf(tags);
    labels = List.copyOf(labels);
  }

  /**
   * Creates a definition without tags or labels, advertised now.
   *
   * @param namespace the metric namespace, never null
   * @param version   the metric version, 0 to use the plugin version
   *
   * @return the definition, never null
   */
  public static MetricDefinition of(final Namespace namespace,
      final int version) {
    return new MetricDefinition(namespace, version, Instant.now(), Map.of(),
        List.of());
  }
}
