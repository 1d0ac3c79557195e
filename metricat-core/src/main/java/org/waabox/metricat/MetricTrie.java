package org.waabox.metricat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;

import org.waabox.metricat.namespace.Namespace;

/**
 * A prefix tree of metric entries keyed by namespace segment.
 *
 * <p>Every path from the root to a node spells a namespace; a node holds the
 * entries registered for its namespace, keyed by version. Nodes left with
 * neither entries nor children are pruned.
 *
 * <p>This class is not thread-safe: every method must be called while
 * holding the owning catalog's lock.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class MetricTrie {

  /** The root node, spelling the root namespace. */
  private final Node root = new Node();

  /**
   * Stores the entry at the node of its namespace, replacing any entry with
   * the same version.
   *
   * @param entry the entry to store, never null
   */
  void add(final MetricEntry entry) {
    Node node = root;
    for (final String segment : entry.namespace()) {
      node = node.children.computeIfAbsent(segment, s -> new Node());
    }
    node.versions.put(entry.version(), entry);
  }

  /**
   * Returns every version registered at exactly the given namespace.
   *
   * @param namespace the namespace, never null
   *
   * @return the entries ordered by version, never null or empty
   *
   * @throws MetricNotFoundException if nothing is registered there
   */
  List<MetricEntry> get(final Namespace namespace) {
    final List<MetricEntry> entries = lookup(namespace);
    if (entries.isEmpty()) {
      throw new MetricNotFoundException(namespace);
    }
    return entries;
  }

  /**
   * Returns every version registered at exactly the given namespace, or
   * nothing.
   *
   * @param namespace the namespace, never null
   *
   * @return the entries ordered by version, never null, may be empty
   */
  List<MetricEntry> lookup(final Namespace namespace) {
    final Node node = find(namespace);
    if (node == null) {
      return List.of();
    }
    return List.copyOf(node.versions.values());
  }

  /**
   * Returns every entry registered at or below the given namespace.
   *
   * @param namespace the namespace prefix, never null; the root namespace
   *                  fetches the whole tree
   *
   * @return the entries, parents before children, never null
   *
   * @throws MetricNotFoundException if the namespace is not the root and
   *                                 nothing is registered at or below it
   */
  List<MetricEntry> fetch(final Namespace namespace) {
    final List<MetricEntry> result = new ArrayList<>();
    final Node node = find(namespace);
    if (node != null) {
      collect(node, result);
    }
    if (result.isEmpty() && !namespace.isRoot()) {
      throw new MetricNotFoundException(namespace);
    }
    return Collections.unmodifiableList(result);
  }

  /**
   * Removes every version registered at exactly the given namespace.
   * Entries below it are kept.
   *
   * @param namespace the namespace, never null
   *
   * @return the number of entries removed
   */
  int remove(final Namespace namespace) {
    return remove(root, namespace.segments(), 0);
  }

  /**
   * Removes every entry advertised by the given plugin, anywhere in the
   * tree.
   *
   * @param plugin the plugin, never null
   *
   * @return what was removed, never null
   */
  Removal deleteByPlugin(final PluginKey plugin) {
    final Set<String> emptied = new LinkedHashSet<>();
    final int removed = deleteByPlugin(root, plugin, new ArrayList<>(),
        emptied);
    return new Removal(removed, Collections.unmodifiableSet(emptied));
  }

  /**
   * Returns the number of entries in the tree.
   *
   * @return the entry count
   */
  int size() {
    return count(root);
  }

  /**
   * Walks down to the node spelling the given namespace.
   *
   * @param namespace the namespace, never null
   *
   * @return the node, or null if the path does not exist
   */
  private Node find(final Namespace namespace) {
    Node node = root;
    for (final String segment : namespace) {
      node = node.children.get(segment);
      if (node == null) {
        return null;
      }
    }
    return node;
  }

  /**
   * Collects the entries of the node and all its descendants.
   *
   * @param node   the node to start at, never null
   * @param result where to add the entries, never null
   */
  private void collect(final Node node, final List<MetricEntry> result) {
    result.addAll(node.versions.values());
    for (final Node child : node.children.values()) {
      collect(child, result);
    }
  }

  /**
   * Removes the entries of the node at the end of the given segments,
   * pruning the nodes left empty on the way back up.
   *
   * @param node     the current node, never null
   * @param segments the full namespace, never null
   * @param depth    the position of the current node in the namespace
   *
   * @return the number of entries removed
   */
  private int remove(final Node node, final List<String> segments,
      final int depth) {
    if (depth == segments.size()) {
      final int removed = node.versions.size();
      node.versions.clear();
      return removed;
    }
    final String segment = segments.get(depth);
    final Node child = node.children.get(segment);
    if (child == null) {
      return 0;
    }
    final int removed = remove(child, segments, depth + 1);
    if (child.isEmpty()) {
      node.children.remove(segment);
    }
    return removed;
  }

  /**
   * Removes the entries of the given plugin from the node and its
   * descendants, pruning the nodes left empty.
   *
   * @param node    the current node, never null
   * @param plugin  the plugin, never null
   * @param path    the segments leading to the current node, never null
   * @param emptied collects the keys left without any version, never null
   *
   * @return the number of entries removed
   */
  private int deleteByPlugin(final Node node, final PluginKey plugin,
      final List<String> path, final Set<String> emptied) {
    int removed = 0;
    if (!node.versions.isEmpty()) {
      final int before = node.versions.size();
      node.versions.values().removeIf(
          entry -> plugin.equals(entry.plugin()));
      removed = before - node.versions.size();
      if (removed > 0 && node.versions.isEmpty()) {
        emptied.add(String.join(Namespace.SEPARATOR, path));
      }
    }

    final Iterator<Map.Entry<String, Node>> children =
        node.children.entrySet().iterator();
    while (children.hasNext()) {
      final Map.Entry<String, Node> child = children.next();
      path.add(child.getKey());
      removed += deleteByPlugin(child.getValue(), plugin, path, emptied);
      path.remove(path.size() - 1);
      if (child.getValue().isEmpty()) {
        children.remove();
      }
    }
    return removed;
  }

  /**
   * Counts the entries stored in the node and all its descendants.
   *
   * @param node the node to start at, never null
   *
   * @return the entry count
   */
  private int count(final Node node) {
    int total = node.versions.size();
    for (final Node child : node.children.values()) {
      total += count(child);
    }
    return total;
  }

  /** What {@link #deleteByPlugin(PluginKey)} removed.
   *
   * @param entries     the number of entries removed
   * @param emptiedKeys the keys of the namespaces left without any version
   */
  record Removal(int entries, Set<String> emptiedKeys) {
  }

  /** A node of the tree. */
  private static final class Node {

    /** The child nodes keyed by segment, in segment order. */
    private final NavigableMap<String, Node> children = new TreeMap<>();

    /** The entries registered at this node, keyed by version. */
    private final NavigableMap<Integer, MetricEntry> versions =
        new TreeMap<>();

    /**
     * Returns whether this node can be pruned.
     *
     * @return true if the node has no entries and no children
     */
    private boolean isEmpty() {
      return versions.isEmpty() && children.isEmpty();
    }
  }
}
