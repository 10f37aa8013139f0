package com.verlumen.treeopt.evolution;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.verlumen.treeopt.constraints.Admission;
import com.verlumen.treeopt.constraints.ConstraintSet;
import com.verlumen.treeopt.graph.ConnectivityRepairer;
import com.verlumen.treeopt.model.Allocation;
import io.jenetics.Phenotype;
import io.jenetics.Recombinator;
import io.jenetics.util.MSeq;
import io.jenetics.util.RandomRegistry;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.random.RandomGenerator;

/**
 * Crossover that keeps every node both parents share and inherits each node unique to one parent
 * with a fixed probability. Mastery selections come from the fitter parent, falling back to the
 * other parent for masteries only it selected. The offspring is then reconnected with {@link
 * ConnectivityRepairer}, since the union of two connected sets minus some nodes can fall apart.
 *
 * <p>As a recombinator, each phenotype is crossed with a random mate with the crossover rate and
 * replaced by the offspring. An offspring must pass {@link ConstraintSet#admit}; after {@link
 * AllocationMutator#MAX_ATTEMPTS} rejected offspring the phenotype is left unchanged.
 */
public final class UnionCrossover extends Recombinator<AllocationGene, Double> {
  private final ConstraintSet constraints;
  private final ConnectivityRepairer repairer;
  private final double inclusionProbability;

  private UnionCrossover(
      ConstraintSet constraints,
      ConnectivityRepairer repairer,
      double inclusionProbability,
      double crossoverRate) {
    super(crossoverRate, 2);
    this.constraints = constraints;
    this.repairer = repairer;
    this.inclusionProbability = inclusionProbability;
  }

  public static UnionCrossover create(
      ConstraintSet constraints,
      ConnectivityRepairer repairer,
      double inclusionProbability,
      double crossoverRate) {
    checkArgument(
        inclusionProbability >= 0.0 && inclusionProbability <= 1.0,
        "Inclusion probability out of range: %s",
        inclusionProbability);
    return new UnionCrossover(constraints, repairer, inclusionProbability, crossoverRate);
  }

  @Override
  protected int recombine(
      MSeq<Phenotype<AllocationGene, Double>> population, int[] individuals, long generation) {
    Phenotype<AllocationGene, Double> first = population.get(individuals[0]);
    Phenotype<AllocationGene, Double> second = population.get(individuals[1]);
    AllocationGene firstGene = AllocationChromosome.geneOf(first);
    AllocationGene secondGene = AllocationChromosome.geneOf(second);
    boolean firstIsFitter = fitness(first) >= fitness(second);

    RandomGenerator random = RandomRegistry.random();
    Optional<Allocation> child = Optional.empty();
    for (int attempt = 0; attempt < AllocationMutator.MAX_ATTEMPTS && child.isEmpty(); attempt++) {
      child =
          (firstIsFitter
                  ? cross(firstGene.allele(), secondGene.allele(), random)
                  : cross(secondGene.allele(), firstGene.allele(), random))
              .flatMap(constraints::admit)
              .map(Admission::allocation);
    }
    if (child.isEmpty() || child.get().equals(firstGene.allele())) {
      return 0;
    }
    AllocationGene offspring = firstGene.offspring(child.get(), secondGene);
    population.set(
        individuals[0], Phenotype.of(AllocationChromosome.genotype(offspring), generation));
    return 1;
  }

  private static double fitness(Phenotype<AllocationGene, Double> phenotype) {
    return phenotype.isEvaluated() ? phenotype.fitness() : Double.NEGATIVE_INFINITY;
  }

  /**
   * Returns a connected offspring, or empty when repair failed.
   *
   * @param fitter the parent whose mastery selections win
   */
  public Optional<Allocation> cross(Allocation fitter, Allocation other, RandomGenerator random) {
    checkArgument(fitter.root() == other.root(), "Parents have different roots");
    ImmutableSet<Integer> protectedNodes =
        ImmutableSet.<Integer>builder()
            .addAll(Sets.intersection(constraints.protectedNodes(fitter), fitter.nodes()))
            .addAll(Sets.intersection(constraints.protectedNodes(other), other.nodes()))
            .build();

    Set<Integer> nodes = new TreeSet<>(Sets.intersection(fitter.nodes(), other.nodes()));
    nodes.addAll(protectedNodes);
    for (int node : Sets.symmetricDifference(fitter.nodes(), other.nodes())) {
      if (!nodes.contains(node) && random.nextDouble() < inclusionProbability) {
        nodes.add(node);
      }
    }

    Map<Integer, Integer> selections = new TreeMap<>(other.masterySelections());
    selections.putAll(fitter.masterySelections());
    Allocation child = Allocation.of(fitter.root(), nodes, selections);

    Set<Integer> allProtected = Sets.union(protectedNodes, constraints.protectedNodes(child));
    return repairer.repair(child, allProtected);
  }
}
