package org.waabox.metricat.example.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import org.waabox.metricat.MetricDefinition;
import org.waabox.metricat.example.domain.MockCollectorPlugin;
import org.waabox.metricat.spring.CatalogInitializer;

/** Spring configuration that populates the metric catalog for the example
 * application.
 *
 * <p>The catalog itself is created by the metricat-spring-boot-starter
 * auto-configuration; this class only contributes a
 * {@link CatalogInitializer} that registers the metrics of the mock
 * collector plugin, once per configured plugin version.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@Configuration
public class MetricatConfig {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      MetricatConfig.class);

  /** Creates the initializer that loads the mock collector plugin.
   *
   * @param versions the plugin versions to load, never null
   *
   * @return the catalog initializer, never null
   */
  @Bean
  public CatalogInitializer mockCollectorInitializer(
      @Value("${example.mock-collector.versions:1,2}")
          final int[] versions) {

    return catalog -> {
      for (final int version : versions) {
        final MockCollectorPlugin plugin = new MockCollectorPlugin(version);
        for (final MetricDefinition type : plugin.metricTypes()) {
          catalog.addLoadedMetricType(plugin, type);
        }
        log.info("Loaded plugin {} into catalog '{}'", plugin.key(),
            catalog.name());
      }
    };
  }
}
