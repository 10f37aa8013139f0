package com.verlumen.treeopt.fitness;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Doubles;
import java.util.Collections;

/** Objective scores of one allocation, in the order of the run's objectives. Larger is better. */
@AutoValue
public abstract class ObjectiveVector {
  public static ObjectiveVector of(double... values) {
    checkArgument(values.length > 0, "An objective vector needs at least one value");
    return new AutoValue_ObjectiveVector(ImmutableList.copyOf(Doubles.asList(values)));
  }

  public static ObjectiveVector of(ImmutableList<Double> values) {
    checkArgument(!values.isEmpty(), "An objective vector needs at least one value");
    return new AutoValue_ObjectiveVector(values);
  }

  /** Every objective at {@link FitnessFunction#FAILED_FITNESS}. */
  public static ObjectiveVector failed(int size) {
    return of(ImmutableList.copyOf(Collections.nCopies(size, FitnessFunction.FAILED_FITNESS)));
  }

  public abstract ImmutableList<Double> values();

  public int size() {
    return values().size();
  }

  public double get(int objective) {
    return values().get(objective);
  }

  public boolean isFailed() {
    return values().stream().allMatch(FitnessFunction::isFailed);
  }
}
