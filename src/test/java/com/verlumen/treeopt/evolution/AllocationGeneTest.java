package com.verlumen.treeopt.evolution;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableSet;
import com.verlumen.treeopt.constraints.ConstraintSet;
import com.verlumen.treeopt.graph.TreeGraph;
import com.verlumen.treeopt.model.Allocation;
import com.verlumen.treeopt.testing.TestGraphs;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class AllocationGeneTest {
  private final TreeGraph graph = TestGraphs.chain(6);
  private final ConstraintSet constraints = ConstraintSet.unconstrained(graph);
  private final PopulationInitializer initializer =
      PopulationInitializer.create(
          constraints,
          AllocationMutator.create(constraints, 1, true, 0.1),
          Allocation.of(0, ImmutableSet.of(0, 1, 2)),
          1);

  @Test
  public void newInstance_withAllele_descendsFromThisGene() {
    AllocationGene parent = initializer.initialize(1).get(0);

    AllocationGene child = parent.newInstance(Allocation.of(0, ImmutableSet.of(0, 1)));

    assertThat(child.id()).isNotEqualTo(parent.id());
    assertThat(child.parentIds()).containsExactly(parent.id());
  }

  @Test
  public void offspring_descendsFromBothParents() {
    AllocationGene first = initializer.initialize(1).get(0);
    AllocationGene second = first.newInstance(Allocation.of(0, ImmutableSet.of(0, 1, 2, 3)));

    AllocationGene child = first.offspring(second.allele(), second);

    assertThat(child.parentIds()).containsExactly(first.id(), second.id()).inOrder();
  }

  @Test
  public void isValid_disconnectedAllocation_isInvalid() {
    AllocationGene gene = initializer.initialize(1).get(0);

    assertThat(gene.isValid()).isTrue();
    assertThat(gene.newInstance(Allocation.of(0, ImmutableSet.of(0, 1, 4))).isValid()).isFalse();
  }

  @Test
  public void toIndividual_isUnscoredAndKeepsLineage() {
    AllocationGene gene = initializer.initialize(1).get(0);

    assertThat(gene.toIndividual(2).isEvaluated()).isFalse();
    assertThat(gene.toIndividual(2).generation()).isEqualTo(2);
    assertThat(gene.toIndividual(2).id()).isEqualTo(gene.id());
  }
}
