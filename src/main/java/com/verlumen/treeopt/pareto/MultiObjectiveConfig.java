package com.verlumen.treeopt.pareto;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.verlumen.treeopt.fitness.Objective;
import com.verlumen.treeopt.genetic.GeneticConfig;

/**
 * Settings of a multi-objective run: the genetic population settings plus the objectives. The
 * scalar objective and elitism count of {@link #genetic()} are not used; survival is decided by
 * front rank and crowding distance.
 */
@AutoValue
public abstract class MultiObjectiveConfig {
  static final ImmutableList<Objective> DEFAULT_OBJECTIVES =
      ImmutableList.of(Objective.DPS, Objective.LIFE, Objective.EHP);

  public static MultiObjectiveConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_MultiObjectiveConfig.Builder()
        .setGenetic(GeneticConfig.defaults())
        .setObjectives(DEFAULT_OBJECTIVES);
  }

  public abstract GeneticConfig genetic();

  public abstract ImmutableList<Objective> objectives();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setGenetic(GeneticConfig genetic);

    public abstract Builder setObjectives(ImmutableList<Objective> objectives);

    abstract MultiObjectiveConfig autoBuild();

    public MultiObjectiveConfig build() {
      MultiObjectiveConfig config = autoBuild();
      checkArgument(
          config.objectives().size() >= 2, "Multi-objective search needs at least two objectives");
      checkArgument(
          config.objectives().stream().distinct().count() == config.objectives().size(),
          "Objectives must be distinct: %s",
          config.objectives());
      return config;
    }
  }
}
