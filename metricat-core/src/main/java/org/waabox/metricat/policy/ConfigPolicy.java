package org.waabox.metricat.policy;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import org.waabox.metricat.namespace.Namespace;

/**
 * The config policy a plugin declares for the metrics it advertises.
 *
 * <p>Policy nodes are registered per namespace prefix. Looking up a metric
 * namespace merges every node on the path from the root down to that
 * namespace, deeper nodes overriding same-named rules of shallower ones.
 * A plugin can thus declare shared rules once at {@code /intel/mock} and
 * add metric specific rules at {@code /intel/mock/foo}.
 *
 * <p>Instances are created through {@link #builder()}. This class is
 * immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ConfigPolicy {

  /** The policy nodes keyed by namespace key. */
  private final Map<String, ConfigPolicyNode> nodes;

  /**
   * Creates a new policy.
   *
   * @param theNodes the nodes keyed by namespace key, already copied
   */
  private ConfigPolicy(final Map<String, ConfigPolicyNode> theNodes) {
    nodes = theNodes;
  }

  /**
   * Returns a policy without rules.
   *
   * @return the empty policy, never null
   */
  public static ConfigPolicy empty() {
    return new ConfigPolicy(Collections.emptyMap());
  }

  /**
   * Creates a new builder.
   *
   * @return the builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the rules that apply to the given namespace.
   *
   * @param namespace the metric namespace, never null
   *
   * @return the merged node, empty if no rule applies, never null
   */
  public ConfigPolicyNode get(final Namespace namespace) {
    Objects.requireNonNull(namespace, "namespace must not be null");
    ConfigPolicyNode result = ConfigPolicyNode.empty();
    for (int depth = 0; depth <= namespace.size(); depth++) {
      final String key = Namespace.of(
          namespace.segments().subList(0, depth)).key();
      final ConfigPolicyNode node = nodes.get(key);
      if (node != null) {
        result = result.merge(node.rules());
      }
    }
    return result;
  }

  /** A builder for {@link ConfigPolicy} instances. */
  public static final class Builder {

    /** The nodes collected so far, keyed by namespace key. */
    private final Map<String, ConfigPolicyNode> nodes = new HashMap<>();

    /** Creates a new builder. */
    private Builder() {
    }

    /**
     * Adds rules at the given namespace prefix, merging with rules already
     * added at the same prefix.
     *
     * @param prefix the namespace prefix, never null
     * @param node   the rules, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder add(final Namespace prefix, final ConfigPolicyNode node) {
      Objects.requireNonNull(prefix, "prefix must not be null");
      Objects.requireNonNull(node, "node must not be null");
      nodes.merge(prefix.key(), node,
          (existing, added) -> existing.merge(added.rules()));
      return this;
    }

    /**
     * Builds the policy.
     *
     * @return the policy, never null
     */
    public ConfigPolicy build() {
      return new ConfigPolicy(Collections.unmodifiableMap(
          new HashMap<>(nodes)));
    }
  }
}
