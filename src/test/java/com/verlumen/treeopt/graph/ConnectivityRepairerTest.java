package com.verlumen.treeopt.graph;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.verlumen.treeopt.model.Allocation;
import com.verlumen.treeopt.testing.TestGraphs;
import java.util.Optional;
import java.util.SplittableRandom;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ConnectivityRepairerTest {
  private final TreeGraph chain = TestGraphs.chain(20);
  private final ConnectivityRepairer repairer = ConnectivityRepairer.create(chain);

  @Test
  public void repair_connectedAllocation_returnsItUnchanged() {
    Allocation allocation = Allocation.of(0, ImmutableSet.of(0, 1, 2));

    assertThat(repairer.repair(allocation, ImmutableSet.of())).hasValue(allocation);
  }

  @Test
  public void repair_shortGap_bridgesIt() {
    // Arrange
    Allocation allocation = Allocation.of(0, ImmutableSet.of(0, 1, 4, 5));

    // Act
    Allocation repaired = repairer.repair(allocation, ImmutableSet.of()).get();

    // Assert
    assertThat(repaired.nodes()).containsExactly(0, 1, 2, 3, 4, 5).inOrder();
  }

  @Test
  public void repair_longGap_dropsUnprotectedBranch() {
    // Arrange
    Allocation allocation = Allocation.of(0, ImmutableSet.of(0, 1, 12, 13));

    // Act
    Allocation repaired = repairer.repair(allocation, ImmutableSet.of()).get();

    // Assert
    assertThat(repaired.nodes()).containsExactly(0, 1);
  }

  @Test
  public void repair_longGap_reattachesProtectedBranch() {
    // Arrange
    Allocation allocation = Allocation.of(0, ImmutableSet.of(0, 1, 12, 13));

    // Act
    Allocation repaired = repairer.repair(allocation, ImmutableSet.of(13)).get();

    // Assert
    assertThat(repaired.nodes()).hasSize(14);
    assertThat(chain.isConnected(repaired)).isTrue();
  }

  @Test
  public void repair_protectedBranchBlockedByForbiddenNode_isEmpty() {
    // Node 7 is protected but unallocated, so no path may run through it.
    Allocation allocation = Allocation.of(0, ImmutableSet.of(0, 1, 9, 10));

    Optional<Allocation> repaired = repairer.repair(allocation, ImmutableSet.of(7, 10));

    assertThat(repaired).isEmpty();
  }

  @Test
  public void repair_randomFragments_alwaysConnectedAndKeepsProtected() {
    SplittableRandom random = new SplittableRandom(42);
    for (int trial = 0; trial < 100; trial++) {
      // Arrange
      TreeGraph graph = TestGraphs.random(120, 40, random);
      ConnectivityRepairer graphRepairer = ConnectivityRepairer.create(graph);
      Allocation connected = TestGraphs.randomWalk(graph, 0, 30, random);
      ImmutableSet<Integer> dropped =
          connected.nodes().stream()
              .filter(node -> node != 0 && random.nextInt(4) == 0)
              .collect(ImmutableSet.toImmutableSet());
      Allocation fragmented =
          connected.withNodesOnly(Sets.difference(connected.nodes(), dropped));
      ImmutableSet<Integer> protectedNodes =
          fragmented.nodes().stream()
              .filter(node -> node != 0 && random.nextInt(10) == 0)
              .collect(ImmutableSet.toImmutableSet());

      // Act
      Optional<Allocation> repaired = graphRepairer.repair(fragmented, protectedNodes);

      // Assert
      if (repaired.isPresent()) {
        assertThat(graph.isConnected(repaired.get())).isTrue();
        assertThat(repaired.get().nodes()).containsAtLeastElementsIn(protectedNodes);
        assertThat(repaired.get().root()).isEqualTo(0);
      }
    }
  }
}
