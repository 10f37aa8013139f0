package com.verlumen.treeopt.model;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.verlumen.treeopt.evaluation.EvaluationResult;
import java.util.Optional;

/**
 * A member of a population: an {@link Allocation} plus the fitness it scored.
 *
 * <p>Individuals are created by the initializer or by breeding, receive their fitness once, and are
 * carried unchanged into the next generation when they are elites.
 */
public final class Individual {
  private final long id;
  private final Allocation allocation;
  private final int generation;
  private final ImmutableList<Long> parentIds;

  private boolean evaluated;
  private double fitness;
  private double penalty;
  private EvaluationResult evaluation;

  public Individual(long id, Allocation allocation, int generation, ImmutableList<Long> parentIds) {
    this.id = id;
    this.allocation = allocation;
    this.generation = generation;
    this.parentIds = parentIds;
  }

  public long id() {
    return id;
  }

  public Allocation allocation() {
    return allocation;
  }

  /** Generation this individual was created in. */
  public int generation() {
    return generation;
  }

  public ImmutableList<Long> parentIds() {
    return parentIds;
  }

  public boolean isEvaluated() {
    return evaluated;
  }

  public double fitness() {
    checkState(evaluated, "Individual %s has not been evaluated", id);
    return fitness;
  }

  /** Constraint penalty already folded into {@link #fitness()}. */
  public double penalty() {
    return penalty;
  }

  public Optional<EvaluationResult> evaluation() {
    return Optional.ofNullable(evaluation);
  }

  public void assignFitness(double fitness, double penalty, EvaluationResult evaluation) {
    this.fitness = fitness;
    this.penalty = penalty;
    this.evaluation = evaluation;
    this.evaluated = true;
  }

  public boolean evaluationFailed() {
    return evaluation != null && !evaluation.success();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("generation", generation)
        .add("points", allocation.pointCount())
        .add("fitness", evaluated ? fitness : null)
        .toString();
  }
}
