package com.verlumen.treeopt.fitness;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.verlumen.treeopt.evaluation.EvaluationResult;
import java.util.List;

/** Applies one {@link FitnessFunction} per objective to an evaluation. */
public final class ObjectiveVectorFunction {
  private final ImmutableList<FitnessFunction> functions;

  private ObjectiveVectorFunction(ImmutableList<FitnessFunction> functions) {
    this.functions = functions;
  }

  public static ObjectiveVectorFunction create(List<Objective> objectives, Baseline baseline) {
    checkArgument(!objectives.isEmpty(), "At least one objective is required");
    return new ObjectiveVectorFunction(
        objectives.stream()
            .map(objective -> FitnessFunction.create(objective, baseline))
            .collect(ImmutableList.toImmutableList()));
  }

  public ImmutableList<Objective> objectives() {
    return functions.stream()
        .map(FitnessFunction::objective)
        .collect(ImmutableList.toImmutableList());
  }

  public int size() {
    return functions.size();
  }

  /**
   * Scores every objective, subtracting {@code penalty} from each. A failed evaluation scores
   * {@link ObjectiveVector#failed} as a whole.
   */
  public ObjectiveVector vector(EvaluationResult result, double penalty) {
    if (!result.success()) {
      return ObjectiveVector.failed(functions.size());
    }
    ImmutableList.Builder<Double> values = ImmutableList.builder();
    for (FitnessFunction function : functions) {
      values.add(function.penalized(result, penalty));
    }
    return ObjectiveVector.of(values.build());
  }
}
