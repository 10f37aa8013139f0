package com.verlumen.treeopt.testing;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.verlumen.treeopt.graph.TreeGraph;
import com.verlumen.treeopt.graph.TreeGraphBuilder;
import com.verlumen.treeopt.model.Allocation;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.random.RandomGenerator;

/** Synthetic graphs and allocations for tests. */
public final class TestGraphs {
  /** Nodes 0..n-1 joined in a line. */
  public static TreeGraph chain(int n) {
    TreeGraphBuilder builder = TreeGraphBuilder.create();
    for (int i = 0; i < n; i++) {
      builder.addNode(i);
    }
    for (int i = 1; i < n; i++) {
      builder.addEdge(i - 1, i);
    }
    return builder.build();
  }

  /** A width by height lattice; node {@code y * width + x}. */
  public static TreeGraph grid(int width, int height) {
    TreeGraphBuilder builder = TreeGraphBuilder.create();
    for (int i = 0; i < width * height; i++) {
      builder.addNode(i);
    }
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        int node = y * width + x;
        if (x + 1 < width) {
          builder.addEdge(node, node + 1);
        }
        if (y + 1 < height) {
          builder.addEdge(node, node + width);
        }
      }
    }
    return builder.build();
  }

  /**
   * A connected graph on nodes 0..n-1: a random spanning tree plus {@code extraEdges} random
   * chords. Every seventh node is a mastery with three effects.
   */
  public static TreeGraph random(int n, int extraEdges, RandomGenerator random) {
    TreeGraphBuilder builder = TreeGraphBuilder.create();
    for (int i = 0; i < n; i++) {
      if (i > 0 && i % 7 == 0) {
        builder.addMastery(i, ImmutableList.of(i * 10, i * 10 + 1, i * 10 + 2));
      } else {
        builder.addNode(i);
      }
    }
    for (int i = 1; i < n; i++) {
      builder.addEdge(i, random.nextInt(i));
    }
    for (int i = 0; i < extraEdges; i++) {
      int a = random.nextInt(n);
      int b = random.nextInt(n);
      if (a != b) {
        builder.addEdge(a, b);
      }
    }
    return builder.build();
  }

  /** A connected allocation of {@code size} nodes grown breadth first from {@code root}. */
  public static Allocation breadthFirst(TreeGraph graph, int root, int size) {
    Set<Integer> nodes = new LinkedHashSet<>();
    ArrayDeque<Integer> queue = new ArrayDeque<>();
    nodes.add(root);
    queue.add(root);
    while (!queue.isEmpty() && nodes.size() < size) {
      for (int next : graph.neighbors(queue.poll())) {
        if (nodes.size() < size && nodes.add(next)) {
          queue.add(next);
        }
      }
    }
    return Allocation.of(root, nodes);
  }

  /** A connected allocation of up to {@code size} nodes grown from {@code root} at random. */
  public static Allocation randomWalk(
      TreeGraph graph, int root, int size, RandomGenerator random) {
    Set<Integer> nodes = new LinkedHashSet<>();
    nodes.add(root);
    while (nodes.size() < size) {
      List<Integer> frontier = new ArrayList<>(graph.unallocatedNeighbors(nodes));
      if (frontier.isEmpty()) {
        break;
      }
      nodes.add(frontier.get(random.nextInt(frontier.size())));
    }
    return Allocation.of(root, ImmutableSet.copyOf(nodes));
  }

  private TestGraphs() {}
}
