package com.verlumen.treeopt.evaluation;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/** Typed metric values for one evaluated allocation. Every value is finite. */
@AutoValue
public abstract class EvaluationMetrics {
  public static EvaluationMetrics of(Map<Metric, Double> values) {
    values.forEach(
        (metric, value) ->
            checkArgument(Double.isFinite(value), "Metric %s is not finite: %s", metric, value));
    return new AutoValue_EvaluationMetrics(ImmutableMap.copyOf(values));
  }

  /**
   * Reads the metrics object of a worker response. Unknown keys are ignored.
   *
   * @throws IllegalArgumentException if a known metric is not a finite number
   */
  public static EvaluationMetrics fromJson(JsonObject json) {
    EnumMap<Metric, Double> values = new EnumMap<>(Metric.class);
    for (Map.Entry<String, JsonElement> entry : json.entrySet()) {
      Optional<Metric> metric = Metric.fromWireKey(entry.getKey());
      if (metric.isEmpty()) {
        continue;
      }
      JsonElement element = entry.getValue();
      checkArgument(
          element.isJsonPrimitive() && element.getAsJsonPrimitive().isNumber(),
          "Metric %s is not a number: %s",
          entry.getKey(),
          element);
      values.put(metric.get(), element.getAsDouble());
    }
    return of(values);
  }

  public abstract ImmutableMap<Metric, Double> values();

  public OptionalDouble get(Metric metric) {
    Double value = values().get(metric);
    return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    values().forEach((metric, value) -> json.add(metric.wireKey(), new JsonPrimitive(value)));
    return json;
  }
}
