package org.waabox.metricat.policy;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The processing rules that apply to one metric namespace.
 *
 * <p>Rules are kept in declaration order and keyed by name: adding a rule
 * whose name is already present replaces it.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ConfigPolicyNode {

  /** A node without rules. */
  private static final ConfigPolicyNode EMPTY =
      new ConfigPolicyNode(Collections.emptyMap());

  /** The rules keyed by name, in declaration order. */
  private final Map<String, ConfigRule> rules;

  /**
   * Creates a new node.
   *
   * @param theRules the rules keyed by name, already copied
   */
  private ConfigPolicyNode(final Map<String, ConfigRule> theRules) {
    rules = theRules;
  }

  /**
   * Returns a node without rules.
   *
   * @return the empty node, never null
   */
  public static ConfigPolicyNode empty() {
    return EMPTY;
  }

  /**
   * Creates a node with the given rules.
   *
   * @param rules the rules, never null
   *
   * @return the node, never null
   */
  public static ConfigPolicyNode of(final ConfigRule... rules) {
    Objects.requireNonNull(rules, "rules must not be null");
    return EMPTY.merge(List.of(rules));
  }

  /**
   * Returns whether this node has any rule.
   *
   * @return true if at least one rule is declared
   */
  public boolean hasRules() {
    return !rules.isEmpty();
  }

  /**
   * Returns the rules of this node in declaration order.
   *
   * @return an unmodifiable list of rules, never null
   */
  public List<ConfigRule> rules() {
    return List.copyOf(rules.values());
  }

  /**
   * Returns the rule with the given name.
   *
   * @param name the rule name, never null
   *
   * @return the rule, or empty if no such rule exists
   */
  public Optional<ConfigRule> rule(final String name) {
    Objects.requireNonNull(name, "name must not be null");
    return Optional.ofNullable(rules.get(name));
  }

  /**
   * Returns a node holding the rules of this node plus the given ones,
   * the given ones replacing same-named rules of this node.
   *
   * @param others the rules to add, never null
   *
   * @return the merged node, never null
   */
  public ConfigPolicyNode merge(final Collection<ConfigRule> others) {
    Objects.requireNonNull(others, "others must not be null");
    if (others.isEmpty()) {
      return this;
    }
    final Map<String, ConfigRule> merged = new LinkedHashMap<>(rules);
    for (final ConfigRule rule : others) {
      Objects.requireNonNull(rule, "rule must not be null");
      merged.put(rule.name(), rule);
    }
    return new ConfigPolicyNode(Collections.unmodifiableMap(merged));
  }

  /**
   * Applies the rules of this node to the given configuration.
   *
   * <p>Missing values take their rule's default. Values without a rule are
   * kept as given.
   *
   * @param config the configuration to process, never null
   *
   * @return the processed configuration, unmodifiable, never null
   *
   * @throws ConfigPolicyException if a required value is missing, a value
   *                               has the wrong type, or a numeric value is
   *                               out of bounds
   */
  public Map<String, Object> process(final Map<String, Object> config) {
    Objects.requireNonNull(config, "config must not be null");

    final Map<String, Object> result = new LinkedHashMap<>(config);
    final List<String> errors = new ArrayList<>();

    for (final ConfigRule rule : rules.values()) {
      final Object value = config.get(rule.name());
      if (value == null) {
        if (rule.defaultValue() != null) {
          result.put(rule.name(), rule.defaultValue());
        } else if (rule.required()) {
          errors.add("required key missing (" + rule.name() + ")");
        }
      } else {
        rule.check(value).ifPresent(errors::add);
      }
    }

    if (!errors.isEmpty()) {
      throw new ConfigPolicyException(errors);
    }
    return Collections.unmodifiableMap(result);
  }
}
