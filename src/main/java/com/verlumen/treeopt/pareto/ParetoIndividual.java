package com.verlumen.treeopt.pareto;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.MoreObjects;
import com.verlumen.treeopt.fitness.ObjectiveVector;
import com.verlumen.treeopt.model.Allocation;
import com.verlumen.treeopt.model.Individual;

/** An individual scored on several objectives, with its front rank and crowding distance. */
public final class ParetoIndividual {
  private final Individual individual;
  private ObjectiveVector objectives;
  private int rank = Integer.MAX_VALUE;
  private double crowdingDistance;

  public ParetoIndividual(Individual individual) {
    this.individual = individual;
  }

  /** An individual whose objective vector is already known. */
  public static ParetoIndividual scored(Individual individual, ObjectiveVector objectives) {
    ParetoIndividual scored = new ParetoIndividual(individual);
    scored.setObjectives(objectives);
    return scored;
  }

  public Individual individual() {
    return individual;
  }

  public Allocation allocation() {
    return individual.allocation();
  }

  public boolean hasObjectives() {
    return objectives != null;
  }

  public ObjectiveVector objectives() {
    checkState(objectives != null, "Individual %s has not been scored", individual.id());
    return objectives;
  }

  void setObjectives(ObjectiveVector objectives) {
    this.objectives = objectives;
  }

  /** Index of the non-dominated front; 0 is the Pareto frontier. */
  public int rank() {
    return rank;
  }

  void setRank(int rank) {
    this.rank = rank;
  }

  public double crowdingDistance() {
    return crowdingDistance;
  }

  void setCrowdingDistance(double crowdingDistance) {
    this.crowdingDistance = crowdingDistance;
  }

  public boolean dominates(ParetoIndividual other) {
    return Dominance.dominates(objectives(), other.objectives());
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", individual.id())
        .add("objectives", objectives == null ? null : objectives.values())
        .add("rank", rank)
        .add("crowding", crowdingDistance)
        .toString();
  }
}
