package com.verlumen.treeopt.graph;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.verlumen.treeopt.model.Allocation;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Immutable topology of the search space: adjacency, node metadata and the connectivity and path
 * queries the optimizers run against it.
 */
public interface TreeGraph {
  int nodeCount();

  boolean contains(int nodeId);

  ImmutableSet<Integer> nodeIds();

  /**
   * @throws IllegalArgumentException if the node is unknown
   */
  ImmutableSet<Integer> neighbors(int nodeId);

  /**
   * @throws IllegalArgumentException if the node is unknown
   */
  NodeMetadata metadata(int nodeId);

  /** True when every node in {@code nodes} is reachable from {@code root} inside {@code nodes}. */
  boolean isConnected(Set<Integer> nodes, int root);

  default boolean isConnected(Allocation allocation) {
    return isConnected(allocation.nodes(), allocation.root());
  }

  /** The nodes of {@code nodes} reachable from {@code root} without leaving {@code nodes}. */
  ImmutableSet<Integer> componentOf(Set<Integer> nodes, int root);

  /**
   * Number of edges from the nearest node of {@code from} to {@code to}, or empty when {@code to}
   * is unreachable. Zero when {@code to} is already in {@code from}.
   */
  OptionalInt shortestPathLength(Set<Integer> from, int to);

  /**
   * The nodes that must be added to {@code from} to reach {@code to}, ordered outward and ending
   * with {@code to}. Paths never pass through {@code forbidden}. Empty list when {@code to} is
   * already in {@code from}; empty optional when no path exists.
   */
  Optional<ImmutableList<Integer>> shortestPath(Set<Integer> from, int to, Set<Integer> forbidden);

  /** Nodes adjacent to the allocation that are not yet allocated, in ascending id order. */
  ImmutableSet<Integer> unallocatedNeighbors(Set<Integer> nodes);

  default ImmutableSet<Integer> unallocatedNeighbors(Allocation allocation) {
    return unallocatedNeighbors(allocation.nodes());
  }
}
