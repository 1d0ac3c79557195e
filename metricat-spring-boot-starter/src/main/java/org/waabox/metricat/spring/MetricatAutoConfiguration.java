package org.waabox.metricat.spring;

import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.waabox.metricat.MetricCatalog;
import org.waabox.metricat.event.CatalogEventListener;
import org.waabox.metricat.metrics.CatalogMetrics;

/**
 * Spring Boot auto-configuration for the metric catalog.
 *
 * <p>This configuration creates the singleton {@link MetricCatalog} shared
 * by every component that registers, resolves or queries metrics, wiring
 * an optional {@link CatalogMetrics} bean and every
 * {@link CatalogEventListener} bean. If no metrics bean is present, the
 * catalog does not record metrics.
 *
 * <p>All {@link CatalogInitializer} beans discovered in the application
 * context are invoked once the catalog is built.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@AutoConfiguration
@EnableConfigurationProperties(MetricatProperties.class)
public class MetricatAutoConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      MetricatAutoConfiguration.class);

  /**
   * Creates the singleton {@link MetricCatalog} bean.
   *
   * @param properties        the configuration properties, never null
   * @param metricsProvider   provider for an optional CatalogMetrics bean
   * @param listenerProvider  provider for the CatalogEventListener beans
   * @param initializers      the catalog initializers, may be empty
   *
   * @return the configured catalog, never null
   */
  @Bean
  @ConditionalOnMissingBean
  public MetricCatalog metricCatalog(
      final MetricatProperties properties,
      final ObjectProvider<CatalogMetrics> metricsProvider,
      final ObjectProvider<CatalogEventListener> listenerProvider,
      final List<CatalogInitializer> initializers) {

    requireAtMostOne(metricsProvider, CatalogMetrics.class);

    final MetricCatalog.Builder builder = MetricCatalog.builder();

    final String name = properties.getName();
    if (name != null && !name.isBlank()) {
      builder.named(name);
      log.info("Metric catalog configured with name: {}", name);
    }

    metricsProvider.ifAvailable(metrics -> {
      builder.metrics(metrics);
      log.info("Metric catalog using custom CatalogMetrics: {}",
          metrics.getClass().getSimpleName());
    });

    listenerProvider.orderedStream().forEach(listener -> {
      builder.listener(listener);
      log.debug("Metric catalog notifying CatalogEventListener: {}",
          listener.getClass().getSimpleName());
    });

    if (properties.isLogEvents()) {
      builder.listener(new LoggingCatalogEventListener());
    }

    final MetricCatalog catalog = builder.build();

    for (final CatalogInitializer initializer : initializers) {
      initializer.initialize(catalog);
      log.debug("Invoked CatalogInitializer: {}",
          initializer.getClass().getSimpleName());
    }

    log.info("Metric catalog '{}' created with {} namespace(s)",
        catalog.name(), catalog.keys().size());

    return catalog;
  }

  /**
   * Validates that at most one bean of the given type is present in the
   * application context.
   *
   * @param provider the object provider to validate, never null
   * @param type     the bean type for error reporting, never null
   * @param <T>      the bean type
   *
   * @throws IllegalStateException if more than one bean of the given type
   *                               is present
   */
  private <T> void requireAtMostOne(final ObjectProvider<T> provider,
      final Class<T> type) {

    final List<String> beanNames = provider.orderedStream()
        .map(bean -> bean.getClass().getSimpleName())
        .collect(Collectors.toList());

    if (beanNames.size() > 1) {
      throw new IllegalStateException(
          "Metric catalog requires at most one " + type.getSimpleName()
              + " bean, but found " + beanNames.size() + ": "
              + String.join(", ", beanNames));
    }
  }
}
