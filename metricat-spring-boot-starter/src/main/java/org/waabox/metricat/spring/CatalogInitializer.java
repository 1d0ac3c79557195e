package org.waabox.metricat.spring;

import org.waabox.metricat.MetricCatalog;

/**
 * A callback interface for populating the {@link MetricCatalog} during
 * Spring Boot auto-configuration.
 *
 * <p>Implement this interface as a Spring bean to register the metrics of
 * plugins that are already loaded when the application starts. All
 * discovered {@code CatalogInitializer} beans are invoked right after the
 * catalog is created.
 *
 * <p>Example usage:
 * <pre>{@code
 * @Bean
 * CatalogInitializer mockCollector(MockCollectorPlugin plugin) {
 *     return catalog -> plugin.metricTypes()
 *         .forEach(type -> catalog.addLoadedMetricType(plugin, type));
 * }
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface CatalogInitializer {

  /**
   * Registers metrics with the given catalog.
   *
   * @param catalog the catalog to populate, never null
   */
  void initialize(MetricCatalog catalog);
}
