package org.waabox.metricat.policy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import org.waabox.metricat.namespace.Namespace;

/**
 * Tests for {@link ConfigPolicy}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ConfigPolicyTest {

  @Test
  void whenGetting_givenNestedPrefixes_shouldMergeFromRootDown() {
    final ConfigRule rootName = ConfigRule.of("name", RuleType.STRING)
        .withDefault("root");
    final ConfigRule mockName = ConfigRule.of("name", RuleType.STRING)
        .withDefault("bob");
    final ConfigRule port = ConfigRule.of("port", RuleType.INTEGER);

    final ConfigPolicy policy = ConfigPolicy.builder()
        .add(Namespace.root(), ConfigPolicyNode.of(rootName, port))
        .add(Namespace.parse("/intel/mock"), ConfigPolicyNode.of(mockName))
        .build();

    final ConfigPolicyNode node = policy.get(
        Namespace.parse("/intel/mock/foo"));

    assertEquals(List.of(mockName, port), node.rules());
    assertEquals("bob", node.rule("name").orElseThrow().defaultValue());
    assertEquals(List.of(rootName, port),
        policy.get(Namespace.parse("/intel/other")).rules());
  }

  @Test
  void whenGetting_givenNoMatchingPrefix_shouldReturnEmptyNode() {
    final ConfigPolicy policy = ConfigPolicy.builder()
        .add(Namespace.parse("/intel/mock"),
            ConfigPolicyNode.of(ConfigRule.of("name", RuleType.STRING)))
        .build();

    assertFalse(policy.get(Namespace.parse("/intel/other")).hasRules());
    assertFalse(ConfigPolicy.empty().get(Namespace.root()).hasRules());
  }

  @Test
  void whenAdding_givenSamePrefixTwice_shouldMergeTheNodes() {
    final ConfigPolicy policy = ConfigPolicy.builder()
        .add(Namespace.parse("/intel"),
            ConfigPolicyNode.of(ConfigRule.of("a", RuleType.BOOL)))
        .add(Namespace.parse("/intel"),
            ConfigPolicyNode.of(ConfigRule.of("b", RuleType.FLOAT)))
        .build();

    final ConfigPolicyNode node = policy.get(Namespace.parse("/intel"));

    assertTrue(node.rule("a").isPresent());
    assertTrue(node.rule("b").isPresent());
  }
}
