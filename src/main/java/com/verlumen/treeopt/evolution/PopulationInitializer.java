package com.verlumen.treeopt.evolution;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.verlumen.treeopt.constraints.Admission;
import com.verlumen.treeopt.constraints.ConstraintSet;
import com.verlumen.treeopt.model.Allocation;
import io.jenetics.Genotype;
import io.jenetics.util.Factory;
import io.jenetics.util.RandomRegistry;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.random.RandomGenerator;

/**
 * Builds generation zero, the seed itself plus random variations of it, and serves as the
 * genotype factory whenever the engine needs a fresh candidate. Also hands out the run's gene ids.
 */
public final class PopulationInitializer implements Factory<Genotype<AllocationGene>> {
  private final ConstraintSet constraints;
  private final AllocationMutator mutator;
  private final Allocation seed;
  private final int maxChanges;
  private final AtomicLong ids = new AtomicLong();

  private PopulationInitializer(
      ConstraintSet constraints, AllocationMutator mutator, Allocation seed, int maxChanges) {
    this.constraints = constraints;
    this.mutator = mutator;
    this.seed = seed;
    this.maxChanges = maxChanges;
  }

  public static PopulationInitializer create(
      ConstraintSet constraints, AllocationMutator mutator, Allocation seed, int maxChanges) {
    checkArgument(maxChanges >= 1, "At least one change per variation: %s", maxChanges);
    return new PopulationInitializer(constraints, mutator, seed, maxChanges);
  }

  /** The seed gene followed by {@code size - 1} variations. */
  public ImmutableList<AllocationGene> initialize(int size) {
    checkArgument(size >= 1, "Population size must be at least 1: %s", size);
    ImmutableList.Builder<AllocationGene> members = ImmutableList.builder();
    members.add(new AllocationGene(seed, nextId(), ImmutableList.of(), this));
    for (int i = 1; i < size; i++) {
      members.add(variation());
    }
    return members.build();
  }

  /**
   * Applies between one and {@code maxChanges} mutations to the seed. A variation the constraints
   * reject is retried, and replaced by a copy of the seed after {@link
   * AllocationMutator#MAX_ATTEMPTS} tries.
   */
  AllocationGene variation() {
    RandomGenerator random = RandomRegistry.random();
    Optional<Admission> variant = Optional.empty();
    for (int attempt = 0;
        attempt < AllocationMutator.MAX_ATTEMPTS && variant.isEmpty();
        attempt++) {
      Allocation allocation = seed;
      int changes = 1 + random.nextInt(maxChanges);
      for (int change = 0; change < changes; change++) {
        allocation = mutator.mutate(allocation, random);
      }
      variant = constraints.admit(allocation);
    }
    Allocation allocation = variant.map(Admission::allocation).orElse(seed);
    return new AllocationGene(allocation, nextId(), ImmutableList.of(), this);
  }

  @Override
  public Genotype<AllocationGene> newInstance() {
    return AllocationChromosome.genotype(variation());
  }

  long nextId() {
    return ids.incrementAndGet();
  }

  boolean isStructurallyValid(Allocation allocation) {
    return !constraints.validate(allocation).hasStructuralViolation();
  }
}
