package com.verlumen.treeopt.genetic;

/**
 * Default settings of the genetic and multi-objective optimizers. Kept in one place so both
 * engines start from the same values.
 */
public final class GAConstants {
  public static final double CROSSOVER_PROBABILITY = 0.8;
  public static final int DEFAULT_POPULATION_SIZE = 30;
  public static final int DEFAULT_MAX_GENERATIONS = 50;
  public static final double MUTATION_PROBABILITY = 0.2;
  public static final int TOURNAMENT_SIZE = 3;
  public static final int ELITISM_COUNT = 5;
  public static final double UNION_INCLUSION_PROBABILITY = 0.5;
  public static final int CONVERGENCE_WINDOW = 10;
  public static final double CONVERGENCE_EPSILON = 0.1;
  public static final int MIN_ALLOCATION_SIZE = 1;
  public static final int INITIAL_VARIATION_MAX_CHANGES = 5;

  private GAConstants() {}
}
