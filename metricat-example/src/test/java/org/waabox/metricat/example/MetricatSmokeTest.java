package org.waabox.metricat.example;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import org.waabox.metricat.MetricCatalog;
import org.waabox.metricat.example.application.MetricController;
import org.waabox.metricat.example.config.MetricatConfig;
import org.waabox.metricat.spring.MetricatAutoConfiguration;

/** Smoke test verifying the example wiring: the auto-configured catalog is
 * populated by the example's initializer and served by the controller.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class MetricatSmokeTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(
          AutoConfigurations.of(MetricatAutoConfiguration.class))
      .withUserConfiguration(MetricatConfig.class, MetricController.class);

  @Test
  void whenContextLoads_givenDefaultVersions_shouldServeBothVersions() {
    runner.run(context -> {
      final MetricCatalog catalog = context.getBean(MetricCatalog.class);
      assertEquals(6, catalog.info().entryCount());

      final MetricController controller =
          context.getBean(MetricController.class);
      controller.list("/intel/mock", 0)
          .forEach(row -> assertEquals("1,2", row.get("versions")));
    });
  }

  @Test
  void whenContextLoads_givenOneVersion_shouldOnlyLoadIt() {
    runner.withPropertyValues("example.mock-collector.versions=3")
        .run(context -> {
          final MetricCatalog catalog = context.getBean(MetricCatalog.class);
          assertEquals(List.of("intel.mock.foo", "intel.mock.bar",
              "intel.mock.*.baz"), catalog.keys());
          assertTrue(catalog.fetch(catalog.items().get(0).namespace())
              .stream().allMatch(entry -> entry.version() == 3));
        });
  }
}
