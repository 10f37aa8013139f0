package com.verlumen.treeopt.graph;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.treeopt.model.Allocation;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Restores root connectivity of an allocation that an operator left fragmented.
 *
 * <p>Each orphaned branch is reattached along the shortest path from the retained component when
 * that path is short, and dropped otherwise. Protected nodes are never dropped and never used as
 * path nodes unless already allocated, so a protected orphan that cannot be reached makes the
 * allocation unrepairable.
 */
public final class ConnectivityRepairer {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final int MAX_BRIDGE_LENGTH = 5;

  private final TreeGraph graph;

  @Inject
  ConnectivityRepairer(TreeGraph graph) {
    this.graph = graph;
  }

  public static ConnectivityRepairer create(TreeGraph graph) {
    return new ConnectivityRepairer(graph);
  }

  /**
   * Returns a connected allocation derived from {@code allocation}, or empty when a protected
   * branch cannot be reattached.
   *
   * @param protectedNodes nodes that must be neither removed nor newly added
   */
  public Optional<Allocation> repair(Allocation allocation, Set<Integer> protectedNodes) {
    if (graph.isConnected(allocation)) {
      return Optional.of(allocation);
    }
    Set<Integer> retained = new HashSet<>(graph.componentOf(allocation.nodes(), allocation.root()));
    Set<Integer> orphans = new TreeSet<>(Sets.difference(allocation.nodes(), retained));
    Set<Integer> forbidden = Sets.difference(protectedNodes, allocation.nodes());

    while (!orphans.isEmpty()) {
      int anchor = orphans.iterator().next();
      ImmutableSet<Integer> branch = graph.componentOf(orphans, anchor);
      boolean branchProtected = !Sets.intersection(branch, protectedNodes).isEmpty();
      Optional<ImmutableList<Integer>> bridge = cheapestBridge(retained, branch, forbidden);

      if (bridge.isPresent() && (branchProtected || bridge.get().size() <= MAX_BRIDGE_LENGTH)) {
        retained.addAll(bridge.get());
        retained.addAll(branch);
      } else if (branchProtected) {
        logger.atFine().log("Protected branch at node %d cannot be reattached", anchor);
        return Optional.empty();
      } else {
        logger.atFine().log("Dropping %d orphaned nodes at node %d", branch.size(), anchor);
      }
      orphans.removeAll(branch);
      // A bridge can run through nodes of other orphaned branches.
      orphans.removeAll(retained);
    }
    return Optional.of(allocation.withNodesOnly(retained));
  }

  private Optional<ImmutableList<Integer>> cheapestBridge(
      Set<Integer> retained, Set<Integer> branch, Set<Integer> forbidden) {
    ImmutableSet<Integer> retainedSnapshot = ImmutableSet.copyOf(retained);
    return branch.stream()
        .map(target -> graph.shortestPath(retainedSnapshot, target, forbidden))
        .flatMap(Optional::stream)
        .min(Comparator.<List<Integer>>comparingInt(List::size))
        // The target itself is part of the branch, so only the path leading to it is new.
        .map(path -> path.subList(0, path.size() - 1));
  }
}
