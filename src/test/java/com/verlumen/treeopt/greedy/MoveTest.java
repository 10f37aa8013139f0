package com.verlumen.treeopt.greedy;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.verlumen.treeopt.model.Allocation;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class MoveTest {
  @Test
  public void tieBreak_prefersFewerPointsThenLowerIds() {
    ImmutableList<Move> moves =
        ImmutableList.of(
            Move.add(2),
            Move.selectMastery(7, 71),
            Move.remove(9),
            Move.add(1),
            Move.selectMastery(7, 70),
            Move.remove(3));

    ImmutableList<Move> sorted = ImmutableList.sortedCopyOf(Move.TIE_BREAK, moves);

    assertThat(sorted)
        .containsExactly(
            Move.remove(3),
            Move.remove(9),
            Move.selectMastery(7, 70),
            Move.selectMastery(7, 71),
            Move.add(1),
            Move.add(2))
        .inOrder();
  }

  @Test
  public void applyTo_changesTheAllocation() {
    Allocation allocation = Allocation.of(0, ImmutableSet.of(0, 1, 7));

    assertThat(Move.add(2).applyTo(allocation).nodes()).containsExactly(0, 1, 2, 7);
    assertThat(Move.remove(1).applyTo(allocation).nodes()).containsExactly(0, 7);
    assertThat(Move.selectMastery(7, 72).applyTo(allocation).masterySelections())
        .containsExactly(7, 72);
  }

  @Test
  public void toString_describesTheMove() {
    assertThat(Move.add(4).toString()).isEqualTo("ADD_NODE 4");
    assertThat(Move.selectMastery(7, 71).toString()).isEqualTo("SELECT_MASTERY 7 -> 71");
  }
}
