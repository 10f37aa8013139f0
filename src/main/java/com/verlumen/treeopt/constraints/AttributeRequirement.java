package com.verlumen.treeopt.constraints;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import com.verlumen.treeopt.graph.Attribute;
import com.verlumen.treeopt.graph.TreeGraph;
import com.verlumen.treeopt.model.Allocation;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Minimum attribute totals. An allocation's total for an attribute is the fixed base contribution
 * plus the bonuses of every allocated node.
 */
@AutoValue
public abstract class AttributeRequirement {
  public static AttributeRequirement none() {
    return create(ImmutableMap.of(), ImmutableMap.of());
  }

  public static AttributeRequirement create(
      Map<Attribute, Integer> minimums, Map<Attribute, Integer> baseAttributes) {
    return new AutoValue_AttributeRequirement(
        ImmutableMap.copyOf(minimums), ImmutableMap.copyOf(baseAttributes));
  }

  /** Takes, per attribute, the highest value any of the given requirement maps asks for. */
  public static AttributeRequirement fromRequirements(
      List<? extends Map<Attribute, Integer>> requirements, Map<Attribute, Integer> base) {
    EnumMap<Attribute, Integer> minimums = new EnumMap<>(Attribute.class);
    for (Map<Attribute, Integer> requirement : requirements) {
      requirement.forEach((attribute, value) -> minimums.merge(attribute, value, Math::max));
    }
    return create(minimums, base);
  }

  public abstract ImmutableMap<Attribute, Integer> minimums();

  public abstract ImmutableMap<Attribute, Integer> baseAttributes();

  public int total(TreeGraph graph, Allocation allocation, Attribute attribute) {
    int total = baseAttributes().getOrDefault(attribute, 0);
    for (int node : allocation.nodes()) {
      total += graph.metadata(node).attributeBonus(attribute);
    }
    return total;
  }

  /** Missing points per attribute; attributes that are satisfied are absent. */
  public ImmutableMap<Attribute, Integer> deficits(TreeGraph graph, Allocation allocation) {
    ImmutableMap.Builder<Attribute, Integer> deficits = ImmutableMap.builder();
    for (Map.Entry<Attribute, Integer> minimum : minimums().entrySet()) {
      int missing = minimum.getValue() - total(graph, allocation, minimum.getKey());
      if (missing > 0) {
        deficits.put(minimum.getKey(), missing);
      }
    }
    return deficits.buildOrThrow();
  }
}
