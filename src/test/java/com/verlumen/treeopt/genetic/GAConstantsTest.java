package com.verlumen.treeopt.genetic;

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class GAConstantsTest {
  @Test
  public void crossoverProbability_isWithinValidRange() {
    assertThat(GAConstants.CROSSOVER_PROBABILITY).isAtLeast(0.0);
    assertThat(GAConstants.CROSSOVER_PROBABILITY).isAtMost(1.0);
  }

  @Test
  public void crossoverProbability_hasExpectedValue() {
    assertThat(GAConstants.CROSSOVER_PROBABILITY).isWithin(0.001).of(0.8);
  }

  @Test
  public void mutationProbability_hasExpectedValue() {
    assertThat(GAConstants.MUTATION_PROBABILITY).isWithin(0.001).of(0.2);
  }

  @Test
  public void unionInclusionProbability_isWithinValidRange() {
    assertThat(GAConstants.UNION_INCLUSION_PROBABILITY).isAtLeast(0.0);
    assertThat(GAConstants.UNION_INCLUSION_PROBABILITY).isAtMost(1.0);
  }

  @Test
  public void defaultPopulationSize_hasExpectedValue() {
    assertThat(GAConstants.DEFAULT_POPULATION_SIZE).isEqualTo(30);
  }

  @Test
  public void defaultMaxGenerations_hasExpectedValue() {
    assertThat(GAConstants.DEFAULT_MAX_GENERATIONS).isEqualTo(50);
  }

  @Test
  public void elitismCount_leavesRoomForOffspring() {
    assertThat(GAConstants.ELITISM_COUNT).isLessThan(GAConstants.DEFAULT_POPULATION_SIZE);
  }

  @Test
  public void populationSize_isSufficientForTournamentSelection() {
    // Tournament selection requires population >= tournament size
    assertThat(GAConstants.DEFAULT_POPULATION_SIZE).isAtLeast(GAConstants.TOURNAMENT_SIZE);
  }

  @Test
  public void convergenceWindow_fitsWithinDefaultGenerations() {
    assertThat(GAConstants.CONVERGENCE_WINDOW).isLessThan(GAConstants.DEFAULT_MAX_GENERATIONS);
  }
}
