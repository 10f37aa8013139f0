package com.verlumen.treeopt.pareto;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.math.Stats;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * The non-dominated members of a scored population, with accessors for the extreme point of each
 * objective and a balanced pick.
 */
public final class ParetoFrontier {
  private final ImmutableList<ParetoIndividual> members;

  private ParetoFrontier(ImmutableList<ParetoIndividual> members) {
    this.members = members;
  }

  /** Ranks {@code population} and keeps its first front. Unscored members are ignored. */
  public static ParetoFrontier of(List<ParetoIndividual> population) {
    ImmutableList<ParetoIndividual> scored =
        population.stream()
            .filter(ParetoIndividual::hasObjectives)
            .collect(ImmutableList.toImmutableList());
    if (scored.isEmpty()) {
      return new ParetoFrontier(ImmutableList.of());
    }
    ImmutableList<ParetoIndividual> front = NonDominatedSorter.sort(scored).get(0);
    CrowdingDistance.assign(front);
    return new ParetoFrontier(front);
  }

  public ImmutableList<ParetoIndividual> members() {
    return members;
  }

  public int size() {
    return members.size();
  }

  public boolean isEmpty() {
    return members.isEmpty();
  }

  /** The member scoring highest on objective {@code index}. */
  public Optional<ParetoIndividual> extremePoint(int index) {
    return members.stream()
        .max(Comparator.comparingDouble(member -> member.objectives().get(index)));
  }

  /** One extreme point per objective, in objective order. */
  public ImmutableList<ParetoIndividual> extremePoints() {
    if (members.isEmpty()) {
      return ImmutableList.of();
    }
    int objectives = members.get(0).objectives().size();
    ImmutableList.Builder<ParetoIndividual> extremes = ImmutableList.builder();
    for (int i = 0; i < objectives; i++) {
      extremes.add(extremePoint(i).orElseThrow());
    }
    return extremes.build();
  }

  /**
   * The member whose objectives, each normalized to [0, 1] across the frontier, have the smallest
   * variance. Objectives on which all members agree normalize to 1.
   */
  public Optional<ParetoIndividual> balancedPick() {
    if (members.isEmpty()) {
      return Optional.empty();
    }
    int objectives = members.get(0).objectives().size();
    checkArgument(objectives > 0, "Frontier members have no objectives");
    double[] min = new double[objectives];
    double[] max = new double[objectives];
    for (int i = 0; i < objectives; i++) {
      int objective = i;
      Stats stats = Stats.of(members.stream().mapToDouble(m -> m.objectives().get(objective)));
      min[i] = stats.min();
      max[i] = stats.max();
    }
    ParetoIndividual best = null;
    double bestVariance = Double.POSITIVE_INFINITY;
    for (ParetoIndividual member : members) {
      double[] normalized = new double[objectives];
      for (int i = 0; i < objectives; i++) {
        double range = max[i] - min[i];
        normalized[i] = range > 0.0 ? (member.objectives().get(i) - min[i]) / range : 1.0;
      }
      double variance = objectives == 1 ? 0.0 : Stats.of(normalized).populationVariance();
      if (variance < bestVariance) {
        bestVariance = variance;
        best = member;
      }
    }
    return Optional.ofNullable(best);
  }
}
