package com.verlumen.treeopt.pareto;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * Fast non-dominated sort. Splits a scored population into fronts and records each member's
 * front index as its rank. Pairwise comparison makes this O(M N^2) for M objectives and N
 * individuals, fine for populations of tens.
 */
public final class NonDominatedSorter {
  public static ImmutableList<ImmutableList<ParetoIndividual>> sort(
      List<ParetoIndividual> population) {
    int n = population.size();
    List<List<Integer>> dominatedBy = new ArrayList<>(n);
    int[] dominationCount = new int[n];
    for (int i = 0; i < n; i++) {
      dominatedBy.add(new ArrayList<>());
    }
    for (int i = 0; i < n; i++) {
      for (int j = i + 1; j < n; j++) {
        ParetoIndividual a = population.get(i);
        ParetoIndividual b = population.get(j);
        if (a.dominates(b)) {
          dominatedBy.get(i).add(j);
          dominationCount[j]++;
        } else if (b.dominates(a)) {
          dominatedBy.get(j).add(i);
          dominationCount[i]++;
        }
      }
    }

    ImmutableList.Builder<ImmutableList<ParetoIndividual>> fronts = ImmutableList.builder();
    List<Integer> current = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      if (dominationCount[i] == 0) {
        current.add(i);
      }
    }
    int rank = 0;
    while (!current.isEmpty()) {
      ImmutableList.Builder<ParetoIndividual> front = ImmutableList.builder();
      List<Integer> next = new ArrayList<>();
      for (int i : current) {
        population.get(i).setRank(rank);
        front.add(population.get(i));
        for (int j : dominatedBy.get(i)) {
          if (--dominationCount[j] == 0) {
            next.add(j);
          }
        }
      }
      fronts.add(front.build());
      current = next;
      rank++;
    }
    return fronts.build();
  }

  private NonDominatedSorter() {}
}
