package com.verlumen.treeopt.constraints;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.verlumen.treeopt.model.Allocation;

/**
 * Parts of the graph whose state is owned by an external system.
 *
 * <p>Occupied sockets hold an object that must not be vacated while allocated. Atomic subgraphs
 * are externally generated node groups that are never touched member by member.
 */
@AutoValue
public abstract class ProtectedRegions {
  public static ProtectedRegions none() {
    return create(ImmutableSet.of(), ImmutableList.of());
  }

  public static ProtectedRegions create(
      ImmutableSet<Integer> occupiedSockets, ImmutableList<ImmutableSet<Integer>> atomicSubgraphs) {
    return new AutoValue_ProtectedRegions(occupiedSockets, atomicSubgraphs);
  }

  public abstract ImmutableSet<Integer> occupiedSockets();

  public abstract ImmutableList<ImmutableSet<Integer>> atomicSubgraphs();

  /** Allocated occupied sockets plus every atomic subgraph member. */
  public ImmutableSet<Integer> protectedNodes(Allocation allocation) {
    ImmutableSet.Builder<Integer> nodes = ImmutableSet.builder();
    nodes.addAll(Sets.intersection(occupiedSockets(), allocation.nodes()));
    atomicSubgraphs().forEach(nodes::addAll);
    return nodes.build();
  }
}
