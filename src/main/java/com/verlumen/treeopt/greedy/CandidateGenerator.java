package com.verlumen.treeopt.greedy;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.verlumen.treeopt.constraints.Admission;
import com.verlumen.treeopt.constraints.ConstraintSet;
import com.verlumen.treeopt.constraints.PointBudget;
import com.verlumen.treeopt.graph.NodeMetadata;
import com.verlumen.treeopt.graph.TreeGraph;
import com.verlumen.treeopt.model.Allocation;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.random.RandomGenerator;

/**
 * Proposes the neighbourhood of an allocation: up to K removals of non-protected nodes whose
 * removal keeps the allocation connected, and up to K additions of adjacent nodes, all within the
 * point budget. Candidates the constraints reject are left out.
 */
final class CandidateGenerator {
  record Candidate(Move move, Admission admission) {}

  private final TreeGraph graph;
  private final ConstraintSet constraints;
  private final Random random;

  CandidateGenerator(ConstraintSet constraints, RandomGenerator random) {
    this.graph = constraints.graph();
    this.constraints = constraints;
    this.random = random instanceof Random ? (Random) random : new Random(random.nextLong());
  }

  ImmutableList<Candidate> nodeMoves(Allocation current, GreedyConfig config) {
    ImmutableList.Builder<Candidate> candidates = ImmutableList.builder();
    PointBudget budget = constraints.pointBudget();
    ImmutableSet<Integer> protectedNodes = constraints.protectedNodes(current);

    if (current.pointCount() - 1 >= Math.max(1, budget.min())) {
      List<Integer> removable = new ArrayList<>();
      for (int node : current.nodes()) {
        if (node != current.root()
            && !protectedNodes.contains(node)
            && graph.isConnected(
                Sets.difference(current.nodes(), ImmutableSet.of(node)), current.root())) {
          removable.add(node);
        }
      }
      for (int node : sample(removable, config.candidatesPerKind())) {
        admit(Move.remove(node), current).ifPresent(candidates::add);
      }
    }

    if (config.enableNodeAddition() && current.pointCount() + 1 <= budget.max()) {
      List<Integer> addable = new ArrayList<>();
      for (int node : graph.unallocatedNeighbors(current)) {
        if (!protectedNodes.contains(node)) {
          addable.add(node);
        }
      }
      for (int node : sample(addable, config.candidatesPerKind())) {
        admit(Move.add(node), current).ifPresent(candidates::add);
      }
    }
    return candidates.build();
  }

  /** Every alternative effect of one allocated mastery node. */
  ImmutableList<Candidate> masteryMoves(Allocation current, int masteryNode) {
    NodeMetadata metadata = graph.metadata(masteryNode);
    Integer selected = current.masterySelections().get(masteryNode);
    ImmutableList.Builder<Candidate> candidates = ImmutableList.builder();
    for (int effect : metadata.masteryEffects()) {
      if (selected == null || effect != selected) {
        admit(Move.selectMastery(masteryNode, effect), current).ifPresent(candidates::add);
      }
    }
    return candidates.build();
  }

  private Optional<Candidate> admit(Move move, Allocation current) {
    Allocation next = move.applyTo(current);
    NodeMetadata metadata = graph.metadata(move.node());
    if (move.kind() == MoveKind.ADD_NODE
        && metadata.isMastery()
        && !metadata.masteryEffects().isEmpty()) {
      next = next.withSelection(move.node(), metadata.masteryEffects().get(0));
    }
    return constraints.admit(next).map(admission -> new Candidate(move, admission));
  }

  private List<Integer> sample(List<Integer> nodes, int limit) {
    if (nodes.size() <= limit) {
      return nodes;
    }
    List<Integer> shuffled = new ArrayList<>(nodes);
    Collections.shuffle(shuffled, random);
    List<Integer> sampled = new ArrayList<>(shuffled.subList(0, limit));
    Collections.sort(sampled);
    return sampled;
  }
}
