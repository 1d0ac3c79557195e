package org.waabox.metricat;

import java.util.Objects;

/**
 * Names a dynamic element of a metric namespace.
 *
 * @param index the position of the dynamic segment in the namespace
 * @param name  the name of the value carried by that segment, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record MetricLabel(int index, String name) {

  /**
   * Creates a new MetricLabel.
   *
   * @param index the segment position, must not be negative
   * @param name  the label name, never null
   */
  public MetricLabel {
    Objects.requireNonNull(name, "name must not be null");
    if (index < 0) {
      throw new IllegalArgumentException(
          "index must not be negative, got: " + index);
    }
  }
}
