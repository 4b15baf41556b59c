package io.tasktrack.backend.rollup;

import io.tasktrack.backend.timeentry.EntityKey;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory adjacency map over one subtree, or over a forest of them, with rollup totals computed
 * by a single iterative post-order walk. Each node is visited once; a node reached a second time
 * through malformed parent links is ignored rather than walked again.
 */
final class RollupTree {

  static final Comparator<RollupNode> CHILD_ORDER =
      Comparator.comparing((RollupNode n) -> n.key().type())
          .thenComparing(n -> n.label() != null ? n.label() : "", String.CASE_INSENSITIVE_ORDER)
          .thenComparing(n -> n.key().id());

  // Null for a forest
  private final EntityKey root;
  private final Map<EntityKey, RollupNode> nodes = new LinkedHashMap<>();
  private final Map<EntityKey, List<EntityKey>> children = new HashMap<>();
  private final Map<EntityKey, Long> directUs;
  private final Map<EntityKey, Long> totalUs = new HashMap<>();

  RollupTree(EntityKey root, Collection<RollupNode> subtree, Map<EntityKey, Long> directUs) {
    this(root, directUs);
    index(subtree);
    if (!nodes.containsKey(root)) {
      throw new IllegalArgumentException("Root " + root + " is not part of the subtree");
    }
    linkChildren();
    computeTotals(List.of(root));
  }

  private RollupTree(EntityKey root, Map<EntityKey, Long> directUs) {
    this.root = root;
    this.directUs = directUs;
  }

  /**
   * Totals for every node of a forest. A node whose parent is absent from {@code nodes} heads its
   * own tree. {@link #descendantsPreOrder()} does not apply to a forest.
   */
  static RollupTree forest(Collection<RollupNode> nodes, Map<EntityKey, Long> directUs) {
    var tree = new RollupTree(null, directUs);
    tree.index(nodes);
    tree.linkChildren();
    // Starting from every node also reaches nodes caught in a parent cycle
    tree.computeTotals(List.copyOf(tree.nodes.keySet()));
    return tree;
  }

  int size() {
    return nodes.size();
  }

  long direct(EntityKey key) {
    return directUs.getOrDefault(key, 0L);
  }

  long total(EntityKey key) {
    return totalUs.getOrDefault(key, 0L);
  }

  List<EntityKey> childrenOf(EntityKey key) {
    return children.getOrDefault(key, List.of());
  }

  RollupNode node(EntityKey key) {
    return nodes.get(key);
  }

  /** Every node below the root in display order: parents before children, siblings sorted. */
  List<RollupNode> descendantsPreOrder() {
    List<RollupNode> result = new ArrayList<>();
    Set<EntityKey> visited = new HashSet<>();
    Deque<EntityKey> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      var key = stack.pop();
      if (!visited.add(key)) {
        continue;
      }
      if (!key.equals(root)) {
        result.add(nodes.get(key));
      }
      var kids = childrenOf(key);
      for (int i = kids.size() - 1; i >= 0; i--) {
        stack.push(kids.get(i));
      }
    }
    return result;
  }

  private void index(Collection<RollupNode> subtree) {
    for (var node : subtree) {
      nodes.putIfAbsent(node.key(), node);
    }
  }

  private void linkChildren() {
    Map<EntityKey, List<RollupNode>> grouped = new HashMap<>();
    for (var node : nodes.values()) {
      // The root's own parent lies outside the subtree
      if (node.key().equals(root) || node.parent() == null || !nodes.containsKey(node.parent())) {
        continue;
      }
      grouped.computeIfAbsent(node.parent(), k -> new ArrayList<>()).add(node);
    }
    grouped.forEach(
        (parent, kids) ->
            children.put(parent, kids.stream().sorted(CHILD_ORDER).map(RollupNode::key).toList()));
  }

  private void computeTotals(List<EntityKey> starts) {
    Set<EntityKey> expanded = new HashSet<>();
    Deque<EntityKey> stack = new ArrayDeque<>();
    for (var start : starts) {
      if (!expanded.contains(start)) {
        stack.push(start);
        walk(stack, expanded);
      }
    }
  }

  private void walk(Deque<EntityKey> stack, Set<EntityKey> expanded) {
    while (!stack.isEmpty()) {
      var key = stack.peek();
      if (expanded.add(key)) {
        for (var child : childrenOf(key)) {
          if (!expanded.contains(child)) {
            stack.push(child);
          }
        }
        continue;
      }
      stack.pop();
      if (totalUs.containsKey(key)) {
        continue;
      }
      long total = direct(key);
      for (var child : childrenOf(key)) {
        total += totalUs.getOrDefault(child, 0L);
      }
      totalUs.put(key, total);
    }
  }
}
