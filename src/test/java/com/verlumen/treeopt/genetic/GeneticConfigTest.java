package com.verlumen.treeopt.genetic;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.verlumen.treeopt.fitness.Objective;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class GeneticConfigTest {
  @Test
  public void defaults_useConstants() {
    GeneticConfig config = GeneticConfig.defaults();

    assertThat(config.populationSize()).isEqualTo(GAConstants.DEFAULT_POPULATION_SIZE);
    assertThat(config.elitismCount()).isEqualTo(GAConstants.ELITISM_COUNT);
    assertThat(config.objective()).isEqualTo(Objective.DPS);
    assertThat(config.optimizeMasteries()).isTrue();
  }

  @Test
  public void build_elitismNotBelowPopulation_throws() {
    assertThrows(
        IllegalArgumentException.class,
        () -> GeneticConfig.builder().setPopulationSize(4).setElitismCount(4).build());
  }

  @Test
  public void build_populationOfOne_throws() {
    assertThrows(
        IllegalArgumentException.class,
        () -> GeneticConfig.builder().setPopulationSize(1).setElitismCount(0).build());
  }

  @Test
  public void toBuilder_overridesSingleField() {
    GeneticConfig config = GeneticConfig.defaults().toBuilder().setMaxGenerations(3).build();

    assertThat(config.maxGenerations()).isEqualTo(3);
    assertThat(config.tournamentSize()).isEqualTo(GAConstants.TOURNAMENT_SIZE);
  }
}
