package org.waabox.metricat.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the metric catalog, mapped from the
 * {@code metricat.*} prefix in application.yml or application.properties.
 *
 * <p>Currently supports:
 * <ul>
 *   <li>{@code metricat.name} - the catalog name used in logs, metrics and
 *       events. If not set, {@code metrics} is used.</li>
 *   <li>{@code metricat.log-events} - whether every catalog change is
 *       logged as JSON. Defaults to false.</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "metricat")
public class MetricatProperties {

  /** The catalog name, null means the default name. */
  private String name;

  /** Whether catalog change events are logged. */
  private boolean logEvents = false;

  /**
   * Returns the configured catalog name.
   *
   * @return the catalog name, or null if the default should be used
   */
  public String getName() {
    return name;
  }

  /**
   * Sets the catalog name.
   *
   * @param name the catalog name, may be null
   */
  public void setName(final String name) {
    this.name = name;
  }

  /**
   * Returns whether catalog change events are logged.
   *
   * @return true if a logging listener is registered
   */
  public boolean isLogEvents() {
    return logEvents;
  }

  /**
   * Sets whether catalog change events are logged.
   *
   * @param logEvents true to register a logging listener
   */
  public void setLogEvents(final boolean logEvents) {
    this.logEvents = logEvents;
  }
}
