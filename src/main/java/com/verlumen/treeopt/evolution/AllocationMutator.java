package com.verlumen.treeopt.evolution;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.verlumen.treeopt.constraints.Admission;
import com.verlumen.treeopt.constraints.ConstraintSet;
import com.verlumen.treeopt.graph.NodeMetadata;
import com.verlumen.treeopt.graph.TreeGraph;
import com.verlumen.treeopt.model.Allocation;
import io.jenetics.AbstractAlterer;
import io.jenetics.AltererResult;
import io.jenetics.Phenotype;
import io.jenetics.util.MSeq;
import io.jenetics.util.RandomRegistry;
import io.jenetics.util.Seq;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.random.RandomGenerator;

/**
 * Mutation alterer. Each phenotype is mutated with the alterer's probability by one small random
 * change: allocate an adjacent node, drop a node whose removal keeps the allocation connected, or
 * pick a different effect for a mastery. Protected nodes are never added or removed, and a mutant
 * must pass {@link ConstraintSet#admit}; after {@link #MAX_ATTEMPTS} rejected mutants the
 * phenotype is left unchanged.
 */
public final class AllocationMutator extends AbstractAlterer<AllocationGene, Double> {
  /** Candidates tried per slot before the slot is left unchanged. */
  static final int MAX_ATTEMPTS = 5;

  /** Removal candidates tried before giving up on a removal. */
  private static final int MAX_REMOVAL_ATTEMPTS = 20;

  private final TreeGraph graph;
  private final ConstraintSet constraints;
  private final int minAllocationSize;
  private final boolean mutateMasteries;

  private AllocationMutator(
      ConstraintSet constraints,
      int minAllocationSize,
      boolean mutateMasteries,
      double mutationRate) {
    super(mutationRate);
    this.graph = constraints.graph();
    this.constraints = constraints;
    this.minAllocationSize = minAllocationSize;
    this.mutateMasteries = mutateMasteries;
  }

  public static AllocationMutator create(
      ConstraintSet constraints,
      int minAllocationSize,
      boolean mutateMasteries,
      double mutationRate) {
    return new AllocationMutator(
        constraints, Math.max(1, minAllocationSize), mutateMasteries, mutationRate);
  }

  /**
   * A mutated offspring keeps its id and parents; a mutated copy of an evaluated parent becomes a
   * new descendant of it.
   */
  @Override
  public AltererResult<AllocationGene, Double> alter(
      Seq<Phenotype<AllocationGene, Double>> population, long generation) {
    RandomGenerator random = RandomRegistry.random();
    MSeq<Phenotype<AllocationGene, Double>> altered = MSeq.of(population);
    int alterations = 0;
    for (int i = 0; i < altered.size(); i++) {
      if (random.nextDouble() >= probability()) {
        continue;
      }
      Phenotype<AllocationGene, Double> phenotype = altered.get(i);
      AllocationGene gene = AllocationChromosome.geneOf(phenotype);
      Optional<Allocation> mutant = admittedMutant(gene.allele(), random);
      if (mutant.isEmpty() || mutant.get().equals(gene.allele())) {
        continue;
      }
      AllocationGene mutated =
          phenotype.nonEvaluated()
              ? gene.withAllocation(mutant.get())
              : gene.newInstance(mutant.get());
      altered.set(i, Phenotype.of(AllocationChromosome.genotype(mutated), generation));
      alterations++;
    }
    return new AltererResult<>(altered.toISeq(), alterations);
  }

  private Optional<Allocation> admittedMutant(Allocation allocation, RandomGenerator random) {
    for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
      Optional<Admission> admitted = constraints.admit(mutate(allocation, random));
      if (admitted.isPresent()) {
        return Optional.of(admitted.get().allocation());
      }
    }
    return Optional.empty();
  }

  /**
   * Applies one applicable mutation chosen uniformly among the kinds. Returns the allocation
   * unchanged when no kind applies.
   */
  public Allocation mutate(Allocation allocation, RandomGenerator random) {
    List<MutationKind> kinds = new ArrayList<>(List.of(MutationKind.values()));
    Collections.shuffle(kinds, asRandom(random));
    for (MutationKind kind : kinds) {
      Optional<Allocation> mutated = apply(kind, allocation, random);
      if (mutated.isPresent()) {
        return mutated.get();
      }
    }
    return allocation;
  }

  public Optional<Allocation> apply(
      MutationKind kind, Allocation allocation, RandomGenerator random) {
    switch (kind) {
      case ADD_NODE:
        return addNode(allocation, random);
      case REMOVE_NODE:
        return removeNode(allocation, random);
      case RANDOMIZE_MASTERY:
        return mutateMasteries ? randomizeMastery(allocation, random) : Optional.empty();
    }
    throw new AssertionError(kind);
  }

  private Optional<Allocation> addNode(Allocation allocation, RandomGenerator random) {
    ImmutableSet<Integer> protectedNodes = constraints.protectedNodes(allocation);
    ImmutableList<Integer> frontier =
        graph.unallocatedNeighbors(allocation).stream()
            .filter(node -> !protectedNodes.contains(node))
            .collect(ImmutableList.toImmutableList());
    if (frontier.isEmpty()) {
      return Optional.empty();
    }
    int node = frontier.get(random.nextInt(frontier.size()));
    Allocation added = allocation.withNode(node);
    NodeMetadata metadata = graph.metadata(node);
    if (metadata.isMastery() && !metadata.masteryEffects().isEmpty()) {
      ImmutableList<Integer> effects = metadata.masteryEffects();
      added = added.withSelection(node, effects.get(random.nextInt(effects.size())));
    }
    return Optional.of(added);
  }

  private Optional<Allocation> removeNode(Allocation allocation, RandomGenerator random) {
    if (allocation.pointCount() <= minAllocationSize) {
      return Optional.empty();
    }
    ImmutableSet<Integer> protectedNodes = constraints.protectedNodes(allocation);
    List<Integer> candidates = new ArrayList<>();
    for (int node : allocation.nodes()) {
      if (node != allocation.root() && !protectedNodes.contains(node)) {
        candidates.add(node);
      }
    }
    Collections.shuffle(candidates, asRandom(random));
    int attempts = Math.min(candidates.size(), MAX_REMOVAL_ATTEMPTS);
    for (int i = 0; i < attempts; i++) {
      int node = candidates.get(i);
      Set<Integer> remaining = Sets.difference(allocation.nodes(), ImmutableSet.of(node));
      if (graph.isConnected(remaining, allocation.root())) {
        return Optional.of(allocation.withoutNode(node));
      }
    }
    return Optional.empty();
  }

  private Optional<Allocation> randomizeMastery(Allocation allocation, RandomGenerator random) {
    List<Integer> masteries = new ArrayList<>();
    for (int node : allocation.nodes()) {
      if (graph.metadata(node).isMastery() && graph.metadata(node).masteryEffects().size() > 1) {
        masteries.add(node);
      }
    }
    if (masteries.isEmpty()) {
      return Optional.empty();
    }
    int node = masteries.get(random.nextInt(masteries.size()));
    Integer current = allocation.masterySelections().get(node);
    List<Integer> choices = new ArrayList<>(graph.metadata(node).masteryEffects());
    choices.remove(current);
    return Optional.of(allocation.withSelection(node, choices.get(random.nextInt(choices.size()))));
  }

  /** Collections.shuffle in JDK 17 only accepts java.util.Random. */
  private static Random asRandom(RandomGenerator random) {
    return random instanceof Random ? (Random) random : new Random(random.nextLong());
  }
}
