package com.verlumen.treeopt.model;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.hash.HashCode;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * One candidate solution: the set of allocated node ids, rooted at a designated start node, plus
 * the effect chosen for every allocated mastery node.
 *
 * <p>Instances are immutable and canonical: nodes and selections are kept sorted, and selections
 * for nodes that are not allocated are dropped on construction. Two allocations with the same
 * root, nodes and selections are equal and share a hash code, which makes them usable as
 * evaluation cache keys.
 */
@AutoValue
public abstract class Allocation {
  public static Allocation of(int root, Set<Integer> nodes, Map<Integer, Integer> selections) {
    checkArgument(nodes.contains(root), "Allocation must contain its root %s", root);
    TreeMap<Integer, Integer> kept = new TreeMap<>();
    selections.forEach(
        (node, effect) -> {
          if (nodes.contains(node)) {
            kept.put(node, effect);
          }
        });
    return new AutoValue_Allocation(
        root, ImmutableSortedSet.copyOf(nodes), ImmutableSortedMap.copyOf(kept));
  }

  public static Allocation of(int root, Set<Integer> nodes) {
    return of(root, nodes, ImmutableSortedMap.of());
  }

  /** The designated start node every allocation must stay connected to. */
  public abstract int root();

  public abstract ImmutableSortedSet<Integer> nodes();

  /** Mastery node id to chosen effect id. Keys are always a subset of {@link #nodes()}. */
  public abstract ImmutableSortedMap<Integer, Integer> masterySelections();

  public int pointCount() {
    return nodes().size();
  }

  public boolean contains(int nodeId) {
    return nodes().contains(nodeId);
  }

  public Allocation withNode(int nodeId) {
    if (contains(nodeId)) {
      return this;
    }
    return of(
        root(),
        ImmutableSortedSet.<Integer>naturalOrder().addAll(nodes()).add(nodeId).build(),
        masterySelections());
  }

  public Allocation withNodes(Set<Integer> added) {
    if (nodes().containsAll(added)) {
      return this;
    }
    return of(
        root(),
        ImmutableSortedSet.<Integer>naturalOrder().addAll(nodes()).addAll(added).build(),
        masterySelections());
  }

  public Allocation withoutNode(int nodeId) {
    checkArgument(nodeId != root(), "Cannot remove root node %s", nodeId);
    if (!contains(nodeId)) {
      return this;
    }
    ImmutableSortedSet.Builder<Integer> remaining = ImmutableSortedSet.naturalOrder();
    for (int node : nodes()) {
      if (node != nodeId) {
        remaining.add(node);
      }
    }
    return of(root(), remaining.build(), masterySelections());
  }

  public Allocation withNodesOnly(Set<Integer> kept) {
    checkArgument(kept.contains(root()), "Cannot drop root node %s", root());
    return of(root(), kept, masterySelections());
  }

  public Allocation withSelection(int masteryNode, int effectId) {
    checkArgument(contains(masteryNode), "Mastery node %s is not allocated", masteryNode);
    TreeMap<Integer, Integer> selections = new TreeMap<>(masterySelections());
    selections.put(masteryNode, effectId);
    return of(root(), nodes(), selections);
  }

  public Allocation withSelections(Map<Integer, Integer> selections) {
    return of(root(), nodes(), selections);
  }

  /** Stable content hash, suitable for logs and cross-process keys. */
  @Memoized
  public HashCode fingerprint() {
    Hasher hasher = Hashing.murmur3_128().newHasher();
    hasher.putInt(root());
    hasher.putInt(nodes().size());
    for (int node : nodes()) {
      hasher.putInt(node);
    }
    for (Map.Entry<Integer, Integer> selection : masterySelections().entrySet()) {
      hasher.putInt(selection.getKey()).putInt(selection.getValue());
    }
    return hasher.hash();
  }

  @Memoized
  @Override
  public abstract int hashCode();
}
