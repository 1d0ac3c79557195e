package org.waabox.metricat.spring;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.NestedExceptionUtils;
import org.waabox.metricat.LoadedPlugin;
import org.waabox.metricat.MetricCatalog;
import org.waabox.metricat.MetricDefinition;
import org.waabox.metricat.PluginKey;
import org.waabox.metricat.event.CatalogEvent;
import org.waabox.metricat.event.CatalogEventListener;
import org.waabox.metricat.metrics.CatalogMetrics;
import org.waabox.metricat.metrics.NoopCatalogMetrics;
import org.waabox.metricat.namespace.Namespace;
import org.waabox.metricat.policy.ConfigPolicy;

/**
 * Tests for {@link MetricatAutoConfiguration}.
 *
 * <p>Uses {@link ApplicationContextRunner} for fast, isolated testing
 * of the auto-configuration without bootstrapping a full Spring Boot
 * application.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ExtendWith(OutputCaptureExtension.class)
class MetricatAutoConfigurationTest {

  /** The application context runner configured with the auto-configuration. */
  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(
          AutoConfigurations.of(MetricatAutoConfiguration.class));

  /** The plugin advertising the test metric. */
  private static final LoadedPlugin PLUGIN = new LoadedPlugin() {
    @Override
    public PluginKey key() {
      return new PluginKey("collector", "test", 1);
    }

    @Override
    public ConfigPolicy configPolicy() {
      return ConfigPolicy.empty();
    }
  };

  @Test
  void whenContextLoads_givenNoInitializers_shouldCreateEmptyCatalog() {
    runner.run(context -> {
      final MetricCatalog catalog = context.getBean(MetricCatalog.class);

      assertNotNull(catalog);
      assertEquals(MetricCatalog.DEFAULT_NAME, catalog.name());
      assertTrue(catalog.keys().isEmpty());
    });
  }

  @Test
  void whenContextLoads_givenCustomName_shouldUseIt() {
    runner.withPropertyValues("metricat.name=inventory")
        .run(context -> assertEquals("inventory",
            context.getBean(MetricCatalog.class).name()));
  }

  @Test
  void whenContextLoads_givenInitializerAndListener_shouldPopulateAndNotify() {
    runner.withUserConfiguration(TestCatalogConfig.class)
        .run(context -> {
          final MetricCatalog catalog = context.getBean(MetricCatalog.class);
          final RecordingListener listener =
              context.getBean(RecordingListener.class);

          assertEquals(List.of("intel.test.foo"), catalog.keys());
          assertEquals(1, listener.events.size());
          assertEquals(CatalogEvent.Type.ADDED,
              listener.events.get(0).type());
        });
  }

  @Test
  void whenContextLoads_givenLogEvents_shouldLogChangesAsJson(
      final CapturedOutput output) {
    runner.withUserConfiguration(TestCatalogConfig.class)
        .withPropertyValues("metricat.log-events=true")
        .run(context -> {
          assertNotNull(context.getBean(MetricCatalog.class));
          assertTrue(output.getOut().contains(
              "\"keys\":[\"intel.test.foo\"]"));
        });
  }

  @Test
  void whenContextLoads_givenTwoMetricsBeans_shouldFail() {
    runner.withUserConfiguration(TwoMetricsConfig.class)
        .run(context -> {
          assertNotNull(context.getStartupFailure());
          assertTrue(NestedExceptionUtils.getMostSpecificCause(
              context.getStartupFailure()).getMessage()
              .contains("at most one CatalogMetrics"));
        });
  }

  @Test
  void whenContextLoads_givenCatalogBean_shouldBackOff() {
    runner.withUserConfiguration(CustomCatalogConfig.class)
        .run(context -> assertEquals("custom",
            context.getBean(MetricCatalog.class).name()));
  }

  /** A listener that records every event. */
  static class RecordingListener implements CatalogEventListener {

    /** The received events. */
    private final List<CatalogEvent> events = new ArrayList<>();

    @Override
    public void onEvent(final CatalogEvent event) {
      events.add(event);
    }
  }

  /**
   * Test configuration registering one metric and a recording listener.
   */
  @Configuration(proxyBeanMethods = false)
  static class TestCatalogConfig {

    @Bean
    CatalogInitializer testInitializer() {
      return catalog -> catalog.addLoadedMetricType(PLUGIN,
          MetricDefinition.of(Namespace.parse("/intel/test/foo"), 1));
    }

    @Bean
    RecordingListener recordingListener() {
      return new RecordingListener();
    }
  }

  /**
   * Test configuration with two conflicting metrics beans.
   */
  @Configuration(proxyBeanMethods = false)
  static class TwoMetricsConfig {

    @Bean
    CatalogMetrics firstMetrics() {
      return new NoopCatalogMetrics();
    }

    @Bean
    CatalogMetrics secondMetrics() {
      return new NoopCatalogMetrics();
    }
  }

  /**
   * Test configuration providing its own catalog.
   */
  @Configuration(proxyBeanMethods = false)
  static class CustomCatalogConfig {

    @Bean
    MetricCatalog customCatalog() {
      return MetricCatalog.builder().named("custom").build();
    }
  }
}
