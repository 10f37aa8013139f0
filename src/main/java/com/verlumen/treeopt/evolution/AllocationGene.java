package com.verlumen.treeopt.evolution;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.verlumen.treeopt.model.Allocation;
import com.verlumen.treeopt.model.Individual;
import io.jenetics.Gene;
import java.util.Objects;

/**
 * Jenetics gene whose allele is a whole {@link Allocation}. Besides the allele it carries the
 * lineage of the candidate: a run-unique id and the ids of the parents it was bred from.
 *
 * <p>New ids and fresh random genes come from the {@link PopulationInitializer} that created the
 * gene, so that every gene of a run draws from the same seed and id sequence.
 */
public final class AllocationGene implements Gene<Allocation, AllocationGene> {
  private final Allocation allocation;
  private final long id;
  private final ImmutableList<Long> parentIds;
  private final PopulationInitializer origin;

  AllocationGene(
      Allocation allocation,
      long id,
      ImmutableList<Long> parentIds,
      PopulationInitializer origin) {
    this.allocation = checkNotNull(allocation);
    this.id = id;
    this.parentIds = parentIds;
    this.origin = origin;
  }

  @Override
  public Allocation allele() {
    return allocation;
  }

  public long id() {
    return id;
  }

  public ImmutableList<Long> parentIds() {
    return parentIds;
  }

  /** A new random variation of the run's seed. */
  @Override
  public AllocationGene newInstance() {
    return origin.variation();
  }

  /** A descendant of this gene holding {@code allocation}. */
  @Override
  public AllocationGene newInstance(Allocation allocation) {
    return new AllocationGene(allocation, origin.nextId(), ImmutableList.of(id), origin);
  }

  /** Offspring bred from two parents. */
  AllocationGene offspring(Allocation allocation, AllocationGene other) {
    return new AllocationGene(
        allocation, origin.nextId(), ImmutableList.of(id, other.id), origin);
  }

  /** The same candidate with a changed allele; used while an offspring is still being bred. */
  AllocationGene withAllocation(Allocation allocation) {
    return new AllocationGene(allocation, id, parentIds, origin);
  }

  /** Unknown nodes and disconnected allocations are invalid; constraint violations are not. */
  @Override
  public boolean isValid() {
    return origin.isStructurallyValid(allocation);
  }

  /** An unscored individual for this gene, born in {@code generation}. */
  public Individual toIndividual(long generation) {
    return new Individual(id, allocation, Math.toIntExact(generation), parentIds);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof AllocationGene)) {
      return false;
    }
    AllocationGene other = (AllocationGene) obj;
    return id == other.id && allocation.equals(other.allocation);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, allocation);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("points", allocation.pointCount())
        .add("parents", parentIds)
        .toString();
  }
}
