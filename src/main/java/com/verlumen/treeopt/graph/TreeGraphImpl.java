package com.verlumen.treeopt.graph;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/** Adjacency-multimap backed {@link TreeGraph}. Built through {@link TreeGraphBuilder}. */
final class TreeGraphImpl implements TreeGraph {
  private final ImmutableMap<Integer, NodeMetadata> metadata;
  private final ImmutableSetMultimap<Integer, Integer> adjacency;

  TreeGraphImpl(
      ImmutableMap<Integer, NodeMetadata> metadata,
      ImmutableSetMultimap<Integer, Integer> adjacency) {
    this.metadata = metadata;
    this.adjacency = adjacency;
  }

  @Override
  public int nodeCount() {
    return metadata.size();
  }

  @Override
  public boolean contains(int nodeId) {
    return metadata.containsKey(nodeId);
  }

  @Override
  public ImmutableSet<Integer> nodeIds() {
    return metadata.keySet();
  }

  @Override
  public ImmutableSet<Integer> neighbors(int nodeId) {
    checkKnown(nodeId);
    return adjacency.get(nodeId);
  }

  @Override
  public NodeMetadata metadata(int nodeId) {
    checkKnown(nodeId);
    return metadata.get(nodeId);
  }

  @Override
  public boolean isConnected(Set<Integer> nodes, int root) {
    if (!nodes.contains(root)) {
      return false;
    }
    return componentOf(nodes, root).size() == nodes.size();
  }

  @Override
  public ImmutableSet<Integer> componentOf(Set<Integer> nodes, int root) {
    if (!nodes.contains(root)) {
      return ImmutableSet.of();
    }
    Set<Integer> visited = new HashSet<>();
    ArrayDeque<Integer> queue = new ArrayDeque<>();
    visited.add(root);
    queue.add(root);
    while (!queue.isEmpty()) {
      int current = queue.poll();
      for (int next : adjacency.get(current)) {
        if (nodes.contains(next) && visited.add(next)) {
          queue.add(next);
        }
      }
    }
    return ImmutableSet.copyOf(visited);
  }

  @Override
  public OptionalInt shortestPathLength(Set<Integer> from, int to) {
    return shortestPath(from, to, ImmutableSet.of())
        .map(path -> OptionalInt.of(path.size()))
        .orElse(OptionalInt.empty());
  }

  @Override
  public Optional<ImmutableList<Integer>> shortestPath(
      Set<Integer> from, int to, Set<Integer> forbidden) {
    checkKnown(to);
    if (from.contains(to)) {
      return Optional.of(ImmutableList.of());
    }
    if (forbidden.contains(to) || from.isEmpty()) {
      return Optional.empty();
    }
    Map<Integer, Integer> parents = new HashMap<>();
    ArrayDeque<Integer> queue = new ArrayDeque<>();
    for (int source : from) {
      queue.add(source);
    }
    while (!queue.isEmpty()) {
      int current = queue.poll();
      for (int next : adjacency.get(current)) {
        if (from.contains(next) || forbidden.contains(next) || parents.containsKey(next)) {
          continue;
        }
        parents.put(next, current);
        if (next == to) {
          return Optional.of(tracePath(parents, from, to));
        }
        queue.add(next);
      }
    }
    return Optional.empty();
  }

  @Override
  public ImmutableSet<Integer> unallocatedNeighbors(Set<Integer> nodes) {
    ImmutableSortedSet.Builder<Integer> frontier = ImmutableSortedSet.naturalOrder();
    for (int node : nodes) {
      for (int next : adjacency.get(node)) {
        if (!nodes.contains(next)) {
          frontier.add(next);
        }
      }
    }
    return frontier.build();
  }

  private static ImmutableList<Integer> tracePath(
      Map<Integer, Integer> parents, Set<Integer> from, int to) {
    ImmutableList.Builder<Integer> reversed = ImmutableList.builder();
    int current = to;
    while (!from.contains(current)) {
      reversed.add(current);
      current = parents.get(current);
    }
    return reversed.build().reverse();
  }

  private void checkKnown(int nodeId) {
    checkArgument(metadata.containsKey(nodeId), "Unknown node %s", nodeId);
  }
}
