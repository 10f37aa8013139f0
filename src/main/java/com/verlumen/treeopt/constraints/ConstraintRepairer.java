package com.verlumen.treeopt.constraints;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.common.flogger.FluentLogger;
import com.verlumen.treeopt.graph.Attribute;
import com.verlumen.treeopt.graph.NodeMetadata;
import com.verlumen.treeopt.graph.NodeType;
import com.verlumen.treeopt.graph.TreeGraph;
import com.verlumen.treeopt.model.Allocation;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Moves an allocation inside its constraints by trimming leaves and extending along shortest
 * paths. Protected nodes are never removed, and unallocated protected nodes are never added.
 */
final class ConstraintRepairer {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ConstraintSet constraints;
  private final TreeGraph graph;

  ConstraintRepairer(ConstraintSet constraints) {
    this.constraints = constraints;
    this.graph = constraints.graph();
  }

  Optional<Allocation> repair(Allocation allocation) {
    if (!graph.isConnected(allocation)) {
      return Optional.empty();
    }
    Allocation current = allocation;
    current = trimSockets(current);
    current = trimToMaximum(current);
    current = addSockets(current);
    current = addAttributes(current);
    current = extendToMinimum(current);

    ValidationResult result = constraints.validate(current);
    if (!result.ok()) {
      logger.atFine().log("Repair left violations: %s", result.messages());
      return Optional.empty();
    }
    return Optional.of(current);
  }

  private Allocation trimToMaximum(Allocation allocation) {
    Allocation current = allocation;
    while (constraints.pointBudget().excess(current.pointCount()) > 0) {
      Optional<Integer> leaf = cheapestLeaf(current, node -> true);
      if (leaf.isEmpty()) {
        break;
      }
      current = current.withoutNode(leaf.get());
    }
    return current;
  }

  private Allocation trimSockets(Allocation allocation) {
    Allocation current = allocation;
    while (constraints.socketRequirement().excess(constraints.socketCount(current)) > 0) {
      Optional<Integer> leaf = cheapestLeaf(current, node -> isSocket(node));
      if (leaf.isEmpty()) {
        break;
      }
      current = current.withoutNode(leaf.get());
    }
    return current;
  }

  private Allocation addSockets(Allocation allocation) {
    Allocation current = allocation;
    while (constraints.socketRequirement().deficit(constraints.socketCount(current)) > 0) {
      Optional<ImmutableList<Integer>> path = nearest(current, this::isSocket);
      if (path.isEmpty()) {
        break;
      }
      current = current.withNodes(ImmutableSet.copyOf(path.get()));
    }
    return current;
  }

  private Allocation addAttributes(Allocation allocation) {
    Allocation current = allocation;
    for (Attribute attribute : Attribute.values()) {
      while (constraints.attributeRequirement().deficits(graph, current).containsKey(attribute)) {
        Optional<ImmutableList<Integer>> path =
            nearest(current, node -> graph.metadata(node).attributeBonus(attribute) > 0);
        if (path.isEmpty()) {
          break;
        }
        current = current.withNodes(ImmutableSet.copyOf(path.get()));
      }
    }
    return current;
  }

  private Allocation extendToMinimum(Allocation allocation) {
    Allocation current = allocation;
    Set<Integer> forbidden = forbidden(current);
    while (constraints.pointBudget().deficit(current.pointCount()) > 0) {
      Optional<Integer> next =
          graph.unallocatedNeighbors(current).stream()
              .filter(node -> !forbidden.contains(node))
              .findFirst();
      if (next.isEmpty()) {
        break;
      }
      current = current.withNode(next.get());
    }
    return current;
  }

  /**
   * The allocated leaf whose removal costs the least: non-sockets before sockets, then fewest
   * attribute points, then highest id.
   */
  private Optional<Integer> cheapestLeaf(Allocation allocation, Predicate<Integer> eligible) {
    ImmutableSet<Integer> protectedNodes = constraints.protectedNodes(allocation);
    Comparator<Integer> cost =
        Comparator.<Integer, Boolean>comparing(this::isSocket)
            .thenComparingInt(this::attributePoints)
            .thenComparing(Comparator.<Integer>reverseOrder());
    return allocation.nodes().stream()
        .filter(node -> node != allocation.root())
        .filter(node -> !protectedNodes.contains(node))
        .filter(eligible)
        .filter(node -> isLeaf(allocation, node))
        .min(cost);
  }

  private boolean isLeaf(Allocation allocation, int node) {
    return Sets.intersection(graph.neighbors(node), allocation.nodes()).size() <= 1;
  }

  /** Shortest path, ties broken by target id, to the nearest unallocated node matching. */
  private Optional<ImmutableList<Integer>> nearest(
      Allocation allocation, Predicate<Integer> target) {
    Set<Integer> forbidden = forbidden(allocation);
    Optional<ImmutableList<Integer>> best = Optional.empty();
    for (int node : graph.nodeIds()) {
      if (allocation.contains(node) || forbidden.contains(node) || !target.test(node)) {
        continue;
      }
      Optional<ImmutableList<Integer>> path =
          graph.shortestPath(allocation.nodes(), node, forbidden);
      if (path.isPresent()
          && (best.isEmpty()
              || path.get().size() < best.get().size()
              || (path.get().size() == best.get().size()
                  && node < best.get().get(best.get().size() - 1)))) {
        best = path;
      }
    }
    return best;
  }

  private Set<Integer> forbidden(Allocation allocation) {
    return Sets.difference(constraints.protectedNodes(allocation), allocation.nodes());
  }

  private boolean isSocket(int node) {
    return graph.metadata(node).type() == NodeType.SOCKET;
  }

  private int attributePoints(int node) {
    NodeMetadata metadata = graph.metadata(node);
    int total = 0;
    for (Map.Entry<Attribute, Integer> bonus : metadata.attributeBonuses().entrySet()) {
      total += bonus.getValue();
    }
    return total;
  }
}
