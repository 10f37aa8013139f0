package com.verlumen.treeopt.pareto;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Crowding distance within one front. Per objective, the front is sorted, the two boundary members
 * get infinite distance and every interior member adds the normalized gap between its neighbours.
 */
public final class CrowdingDistance {
  public static void assign(List<ParetoIndividual> front) {
    for (ParetoIndividual member : front) {
      member.setCrowdingDistance(0.0);
    }
    if (front.isEmpty()) {
      return;
    }
    if (front.size() <= 2) {
      front.forEach(member -> member.setCrowdingDistance(Double.POSITIVE_INFINITY));
      return;
    }
    int objectives = front.get(0).objectives().size();
    List<ParetoIndividual> sorted = new ArrayList<>(front);
    for (int m = 0; m < objectives; m++) {
      int objective = m;
      sorted.sort(Comparator.comparingDouble(member -> member.objectives().get(objective)));
      ParetoIndividual lowest = sorted.get(0);
      ParetoIndividual highest = sorted.get(sorted.size() - 1);
      lowest.setCrowdingDistance(Double.POSITIVE_INFINITY);
      highest.setCrowdingDistance(Double.POSITIVE_INFINITY);
      double range = highest.objectives().get(objective) - lowest.objectives().get(objective);
      if (range <= 0.0) {
        continue;
      }
      for (int i = 1; i < sorted.size() - 1; i++) {
        ParetoIndividual member = sorted.get(i);
        double gap =
            sorted.get(i + 1).objectives().get(objective)
                - sorted.get(i - 1).objectives().get(objective);
        member.setCrowdingDistance(member.crowdingDistance() + gap / range);
      }
    }
  }

  private CrowdingDistance() {}
}
