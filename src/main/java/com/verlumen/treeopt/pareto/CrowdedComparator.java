package com.verlumen.treeopt.pareto;

import java.util.Comparator;

/**
 * Orders better individuals after worse ones: a lower front rank wins, and within a front a larger
 * crowding distance wins.
 */
public final class CrowdedComparator implements Comparator<ParetoIndividual> {
  public static final CrowdedComparator INSTANCE = new CrowdedComparator();

  @Override
  public int compare(ParetoIndividual a, ParetoIndividual b) {
    if (a.rank() != b.rank()) {
      return Integer.compare(b.rank(), a.rank());
    }
    return Double.compare(a.crowdingDistance(), b.crowdingDistance());
  }

  private CrowdedComparator() {}
}
