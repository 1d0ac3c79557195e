package org.waabox.metricat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import org.waabox.metricat.namespace.Namespace;
import org.waabox.metricat.policy.ConfigPolicyNode;

/**
 * Tests for {@link MetricTrie}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class MetricTrieTest {

  private static final PluginKey P = new PluginKey("collector", "p", 1);

  private static final PluginKey Q = new PluginKey("collector", "q", 1);

  private MetricTrie trie;

  @BeforeEach
  void setUp() {
    trie = new MetricTrie();
  }

  @Test
  void whenGetting_givenSeveralVersions_shouldReturnThemOrdered() {
    trie.add(entry("/intel/mock/foo", 2, P));
    trie.add(entry("/intel/mock/foo", 1, P));

    final List<MetricEntry> versions = trie.get(
        Namespace.parse("/intel/mock/foo"));

    assertEquals(2, versions.size());
    assertEquals(1, versions.get(0).version());
    assertEquals(2, versions.get(1).version());
  }

  @Test
  void whenAdding_givenSameVersionTwice_shouldKeepTheLastOne() {
    trie.add(entry("/intel/mock/foo", 1, P));
    final MetricEntry second = entry("/intel/mock/foo", 1, Q);
    trie.add(second);

    final List<MetricEntry> versions = trie.get(
        Namespace.parse("/intel/mock/foo"));

    assertEquals(1, versions.size());
    assertSame(second, versions.get(0));
    assertEquals(1, trie.size());
  }

  @Test
  void whenGetting_givenIntermediateNode_shouldThrow() {
    trie.add(entry("/intel/mock/foo", 1, P));

    assertThrows(MetricNotFoundException.class,
        () -> trie.get(Namespace.parse("/intel/mock")));
    assertTrue(trie.lookup(Namespace.parse("/intel/mock")).isEmpty());
    assertTrue(trie.lookup(Namespace.parse("/intel/nope")).isEmpty());
  }

  @Test
  void whenFetching_givenPrefix_shouldReturnEverythingBelowIt() {
    trie.add(entry("/intel/mock/foo", 1, P));
    trie.add(entry("/intel/mock/foo", 2, P));
    trie.add(entry("/intel/mock/bar", 1, P));
    trie.add(entry("/intel/other/baz", 1, P));

    final List<MetricEntry> fetched = trie.fetch(
        Namespace.parse("/intel/mock"));

    assertEquals(3, fetched.size());
    assertEquals(4, trie.fetch(Namespace.root()).size());
  }

  @Test
  void whenFetching_givenParentAndChild_shouldReturnParentFirst() {
    trie.add(entry("/intel/mock/foo", 1, P));
    trie.add(entry("/intel/mock", 1, P));

    final List<MetricEntry> fetched = trie.fetch(Namespace.parse("/intel"));

    assertEquals(Namespace.parse("/intel/mock"), fetched.get(0).namespace());
    assertEquals(Namespace.parse("/intel/mock/foo"),
        fetched.get(1).namespace());
  }

  @Test
  void whenFetching_givenUnknownPrefix_shouldThrow() {
    trie.add(entry("/intel/mock/foo", 1, P));

    assertThrows(MetricNotFoundException.class,
        () -> trie.fetch(Namespace.parse("/intel/nope")));
  }

  @Test
  void whenFetching_givenRootOfEmptyTree_shouldReturnNothing() {
    assertTrue(trie.fetch(Namespace.root()).isEmpty());
  }

  @Test
  void whenRemoving_givenNamespaceWithChildren_shouldKeepTheChildren() {
    trie.add(entry("/intel/mock", 1, P));
    trie.add(entry("/intel/mock", 2, P));
    trie.add(entry("/intel/mock/foo", 1, P));

    assertEquals(2, trie.remove(Namespace.parse("/intel/mock")));

    assertThrows(MetricNotFoundException.class,
        () -> trie.get(Namespace.parse("/intel/mock")));
    assertEquals(1, trie.get(Namespace.parse("/intel/mock/foo")).size());
  }

  @Test
  void whenRemoving_givenUnknownNamespace_shouldRemoveNothing() {
    trie.add(entry("/intel/mock/foo", 1, P));

    assertEquals(0, trie.remove(Namespace.parse("/intel/nope/foo")));
    assertEquals(1, trie.size());
  }

  @Test
  void whenRemoving_givenLeaf_shouldPruneEmptyParents() {
    trie.add(entry("/intel/mock/foo", 1, P));

    trie.remove(Namespace.parse("/intel/mock/foo"));

    assertThrows(MetricNotFoundException.class,
        () -> trie.fetch(Namespace.parse("/intel")));
    assertEquals(0, trie.size());
  }

  @Test
  void whenDeletingByPlugin_givenSharedNamespaces_shouldOnlyRemoveItsEntries() {
    trie.add(entry("/intel/mock/foo", 1, P));
    trie.add(entry("/intel/mock/foo", 2, Q));
    trie.add(entry("/intel/mock/bar", 1, P));
    trie.add(entry("/intel/other", 1, Q));

    final MetricTrie.Removal removal = trie.deleteByPlugin(P);

    assertEquals(2, removal.entries());
    assertEquals(Set.of("intel.mock.bar"), removal.emptiedKeys());
    assertEquals(2, trie.size());
    assertEquals(Q, trie.get(Namespace.parse("/intel/mock/foo")).get(0)
        .plugin());
    assertThrows(MetricNotFoundException.class,
        () -> trie.get(Namespace.parse("/intel/mock/bar")));
  }

  @Test
  void whenDeletingByPlugin_givenUnknownPlugin_shouldRemoveNothing() {
    trie.add(entry("/intel/mock/foo", 1, P));

    final MetricTrie.Removal removal = trie.deleteByPlugin(
        new PluginKey("collector", "r", 1));

    assertEquals(0, removal.entries());
    assertTrue(removal.emptiedKeys().isEmpty());
  }

  private static MetricEntry entry(final String path, final int version,
      final PluginKey plugin) {
    return new MetricEntry(
        MetricDefinition.of(Namespace.parse(path), version), plugin,
        ConfigPolicyNode.empty(), Instant.now());
  }
}
