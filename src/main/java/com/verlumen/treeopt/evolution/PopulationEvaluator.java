package com.verlumen.treeopt.evolution;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.verlumen.treeopt.constraints.ConstraintSet;
import com.verlumen.treeopt.evaluation.EvaluationResult;
import com.verlumen.treeopt.evaluation.Evaluator;
import com.verlumen.treeopt.model.Allocation;
import com.verlumen.treeopt.model.Individual;
import io.jenetics.Phenotype;
import io.jenetics.util.ISeq;
import io.jenetics.util.MSeq;
import io.jenetics.util.Seq;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Engine evaluator that scores every phenotype without a fitness in one concurrent batch.
 * Phenotypes carried over as elites keep their fitness and are not sent again.
 *
 * <p>The scored {@link Individual} behind each evaluated phenotype stays available through {@link
 * #individual} for history and result reporting.
 */
public final class PopulationEvaluator
    implements io.jenetics.engine.Evaluator<AllocationGene, Double> {
  /** Turns an evaluation into the individual's score. */
  public interface Scorer {
    void score(Individual individual, EvaluationResult result, double penalty);
  }

  private final Evaluator evaluator;
  private final ConstraintSet constraints;
  private final FailureMonitor failureMonitor;
  private final Scorer scorer;
  private final Map<Long, Individual> scored = new HashMap<>();

  private PopulationEvaluator(
      Evaluator evaluator,
      ConstraintSet constraints,
      FailureMonitor failureMonitor,
      Scorer scorer) {
    this.evaluator = evaluator;
    this.constraints = constraints;
    this.failureMonitor = failureMonitor;
    this.scorer = scorer;
  }

  public static PopulationEvaluator create(
      Evaluator evaluator,
      ConstraintSet constraints,
      FailureMonitor failureMonitor,
      Scorer scorer) {
    return new PopulationEvaluator(evaluator, constraints, failureMonitor, scorer);
  }

  /**
   * @throws com.verlumen.treeopt.evaluation.EvaluatorUnavailableException when no worker is left
   */
  @Override
  public ISeq<Phenotype<AllocationGene, Double>> eval(
      Seq<Phenotype<AllocationGene, Double>> population) {
    MSeq<Phenotype<AllocationGene, Double>> evaluated = MSeq.of(population);
    List<Integer> pending = new ArrayList<>();
    for (int i = 0; i < population.size(); i++) {
      if (population.get(i).nonEvaluated()) {
        pending.add(i);
      }
    }
    if (pending.isEmpty()) {
      return evaluated.toISeq();
    }

    ImmutableList<Allocation> allocations =
        pending.stream()
            .map(i -> AllocationChromosome.allocationOf(population.get(i)))
            .collect(ImmutableList.toImmutableList());
    ImmutableList<EvaluationResult> results = evaluator.evaluateAll(allocations);
    int failures = 0;
    long generation = 0;
    for (int k = 0; k < pending.size(); k++) {
      Phenotype<AllocationGene, Double> phenotype = population.get(pending.get(k));
      EvaluationResult result = results.get(k);
      if (!result.success()) {
        failures++;
      }
      AllocationGene gene = AllocationChromosome.geneOf(phenotype);
      Individual individual = gene.toIndividual(phenotype.generation());
      scorer.score(individual, result, constraints.penalty(gene.allele()));
      scored.put(gene.id(), individual);
      evaluated.set(pending.get(k), phenotype.withFitness(individual.fitness()));
      generation = Math.max(generation, phenotype.generation());
    }
    failureMonitor.record(Math.toIntExact(generation), pending.size(), failures);
    return evaluated.toISeq();
  }

  /** The scored individual behind an evaluated phenotype. */
  public Individual individual(Phenotype<AllocationGene, Double> phenotype) {
    long id = AllocationChromosome.geneOf(phenotype).id();
    Individual individual = scored.get(id);
    checkState(individual != null, "Gene %s has not been evaluated", id);
    return individual;
  }

  public ImmutableList<Individual> individuals(Seq<Phenotype<AllocationGene, Double>> population) {
    return population.stream().map(this::individual).collect(ImmutableList.toImmutableList());
  }

  /** Forgets the individuals of genes no longer present in {@code population}. */
  public void retain(Seq<Phenotype<AllocationGene, Double>> population) {
    Set<Long> live = new HashSet<>();
    population.forEach(phenotype -> live.add(AllocationChromosome.geneOf(phenotype).id()));
    scored.keySet().retainAll(live);
  }

  public FailureMonitor failureMonitor() {
    return failureMonitor;
  }
}
