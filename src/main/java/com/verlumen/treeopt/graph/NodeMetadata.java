package com.verlumen.treeopt.graph;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/** Static description of one graph node. */
@AutoValue
public abstract class NodeMetadata {
  public static NodeMetadata of(int id, NodeType type) {
    return builder().setId(id).setName("node-" + id).setType(type).build();
  }

  public static Builder builder() {
    return new AutoValue_NodeMetadata.Builder()
        .setTags(ImmutableSet.of())
        .setAttributeBonuses(ImmutableMap.of())
        .setMasteryEffects(ImmutableList.of());
  }

  public abstract int id();

  public abstract String name();

  public abstract NodeType type();

  public abstract ImmutableSet<String> tags();

  /** Flat attribute points granted when the node is allocated. */
  public abstract ImmutableMap<Attribute, Integer> attributeBonuses();

  /** Effect ids selectable on a mastery node; empty for every other type. */
  public abstract ImmutableList<Integer> masteryEffects();

  public boolean isMastery() {
    return type() == NodeType.MASTERY;
  }

  public int attributeBonus(Attribute attribute) {
    return attributeBonuses().getOrDefault(attribute, 0);
  }

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setId(int id);

    public abstract Builder setName(String name);

    public abstract Builder setType(NodeType type);

    public abstract Builder setTags(ImmutableSet<String> tags);

    public abstract Builder setAttributeBonuses(ImmutableMap<Attribute, Integer> bonuses);

    public abstract Builder setMasteryEffects(ImmutableList<Integer> effects);

    public abstract NodeMetadata build();
  }
}
