package com.verlumen.treeopt.model;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * The individuals of the current generation, together with the best individual seen across all
 * generations and the per-generation fitness history.
 */
public final class Population {
  private static final Comparator<Individual> BY_FITNESS =
      Comparator.comparingDouble(Individual::fitness);

  private final List<Individual> members = new ArrayList<>();
  private final List<GenerationStats> history = new ArrayList<>();
  private Individual bestEver;
  private int generation;

  public ImmutableList<Individual> members() {
    return ImmutableList.copyOf(members);
  }

  public int size() {
    return members.size();
  }

  public int generation() {
    return generation;
  }

  /** Replaces the members with the next generation's individuals. */
  public void advance(List<Individual> next) {
    checkArgument(!next.isEmpty(), "A generation cannot be empty");
    members.clear();
    members.addAll(next);
    generation++;
  }

  public void initialize(List<Individual> initial) {
    checkArgument(!initial.isEmpty(), "A population cannot be empty");
    members.clear();
    members.addAll(initial);
    generation = 0;
  }

  /**
   * Records the statistics of the current, fully evaluated generation and updates the best-ever
   * individual.
   */
  public GenerationStats record() {
    GenerationStats stats = GenerationStats.of(generation, members);
    history.add(stats);
    Individual best = members.stream().max(BY_FITNESS).orElseThrow();
    if (bestEver == null || best.fitness() > bestEver.fitness()) {
      bestEver = best;
    }
    return stats;
  }

  /** Members ordered best first. */
  public ImmutableList<Individual> ranked() {
    return members.stream().sorted(BY_FITNESS.reversed()).collect(ImmutableList.toImmutableList());
  }

  public Optional<Individual> bestEver() {
    return Optional.ofNullable(bestEver);
  }

  public ImmutableList<GenerationStats> history() {
    return ImmutableList.copyOf(history);
  }
}
