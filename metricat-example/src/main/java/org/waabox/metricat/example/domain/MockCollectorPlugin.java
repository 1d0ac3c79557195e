package org.waabox.metricat.example.domain;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.waabox.metricat.LoadedPlugin;
import org.waabox.metricat.MetricDefinition;
import org.waabox.metricat.MetricLabel;
import org.waabox.metricat.PluginKey;
import org.waabox.metricat.namespace.Namespace;
import org.waabox.metricat.policy.ConfigPolicy;
import org.waabox.metricat.policy.ConfigPolicyNode;
import org.waabox.metricat.policy.ConfigRule;
import org.waabox.metricat.policy.RuleType;

/** A collector plugin that is already loaded and advertises three mock
 * metrics under {@code /intel/mock}.
 *
 * <p>The {@code baz} metric has a dynamic element, the host, at position
 * 2 of its namespace. Every metric shares the same collection rules:
 * <ul>
 *   <li>{@code name}: string, defaults to {@code bob}</li>
 *   <li>{@code password}: string, required</li>
 *   <li>{@code portRange}: integer between 9000 and 10000</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class MockCollectorPlugin implements LoadedPlugin {

  /** The prefix every advertised namespace lives under. */
  public static final Namespace PREFIX = Namespace.of("intel", "mock");

  /** The plugin type. */
  private static final String TYPE = "collector";

  /** The plugin name. */
  private static final String NAME = "mock";

  /** The plugin key, never null. */
  private final PluginKey key;

  /** The collection rules, never null. */
  private final ConfigPolicy policy;

  /** When the plugin advertised its metrics, never null. */
  private final Instant advertisedAt;

  /** Creates a new plugin.
   *
   * @param version the plugin version, positive
   */
  public MockCollectorPlugin(final int version) {
    if (version <= 0) {
      throw new IllegalArgumentException(
          "version must be positive, got: " + version);
    }
    key = new PluginKey(TYPE, NAME, version);
    advertisedAt = Instant.now();
    policy = ConfigPolicy.builder()
        .add(PREFIX, ConfigPolicyNode.of(
            ConfigRule.of("name", RuleType.STRING).withDefault("bob"),
            ConfigRule.of("password", RuleType.STRING).asRequired(),
            ConfigRule.of("portRange", RuleType.INTEGER)
                .between(9000, 10000)))
        .build();
  }

  /** {@inheritDoc} */
  @Override
  public PluginKey key() {
    return key;
  }

  /** {@inheritDoc} */
  @Override
  public ConfigPolicy configPolicy() {
    return policy;
  }

  /** Returns the metrics this plugin advertises. Their version is the
   * plugin version.
   *
   * @return the metric definitions, never null
   */
  public List<MetricDefinition> metricTypes() {
    final Map<String, String> tags = Map.of("plugin_running_on", "localhost");
    return List.of(
        new MetricDefinition(Namespace.of("intel", "mock", "foo"), 0,
            advertisedAt, tags, List.of()),
        new MetricDefinition(Namespace.of("intel", "mock", "bar"), 0,
            advertisedAt, tags, List.of()),
        new MetricDefinition(Namespace.of("intel", "mock", "*", "baz"), 0,
            advertisedAt, tags, List.of(new MetricLabel(2, "host"))));
  }
}
