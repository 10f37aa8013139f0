package com.verlumen.treeopt.pareto;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.verlumen.treeopt.fitness.ObjectiveVector;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class DominanceTest {
  @Test
  public void dominates_betterOnEveryObjective() {
    ObjectiveVector a = ObjectiveVector.of(5, 3, 4);
    ObjectiveVector b = ObjectiveVector.of(4, 2, 3);

    assertThat(Dominance.dominates(a, b)).isTrue();
    assertThat(Dominance.dominates(b, a)).isFalse();
  }

  @Test
  public void dominates_tradeOff_neitherDominates() {
    ObjectiveVector a = ObjectiveVector.of(10, 2, 3);
    ObjectiveVector b = ObjectiveVector.of(3, 9, 8);

    assertThat(Dominance.dominates(a, b)).isFalse();
    assertThat(Dominance.dominates(b, a)).isFalse();
  }

  @Test
  public void dominates_equalVectors_neitherDominates() {
    ObjectiveVector a = ObjectiveVector.of(1, 2);

    assertThat(Dominance.dominates(a, ObjectiveVector.of(1, 2))).isFalse();
  }

  @Test
  public void dominates_betterOnOneAndEqualElsewhere() {
    assertThat(Dominance.dominates(ObjectiveVector.of(1, 3), ObjectiveVector.of(1, 2))).isTrue();
  }

  @Test
  public void dominates_differentSizes_throws() {
    assertThrows(
        IllegalArgumentException.class,
        () -> Dominance.dominates(ObjectiveVector.of(1, 2), ObjectiveVector.of(1, 2, 3)));
  }
}
