package com.verlumen.treeopt.greedy;

import com.google.auto.value.AutoValue;
import com.verlumen.treeopt.model.Allocation;
import java.util.Comparator;

/** A single-node change considered by the local search. */
@AutoValue
public abstract class Move {
  /** Smaller point delta first, then lower node id, then lower effect id. */
  static final Comparator<Move> TIE_BREAK =
      Comparator.comparingInt(Move::pointDelta)
          .thenComparingInt(Move::node)
          .thenComparingInt(Move::effect);

  public static Move add(int node) {
    return new AutoValue_Move(MoveKind.ADD_NODE, node, -1);
  }

  public static Move remove(int node) {
    return new AutoValue_Move(MoveKind.REMOVE_NODE, node, -1);
  }

  public static Move selectMastery(int node, int effect) {
    return new AutoValue_Move(MoveKind.SELECT_MASTERY, node, effect);
  }

  public abstract MoveKind kind();

  public abstract int node();

  /** Chosen mastery effect, or -1 for node moves. */
  public abstract int effect();

  public int pointDelta() {
    return kind().pointDelta();
  }

  public Allocation applyTo(Allocation allocation) {
    switch (kind()) {
      case ADD_NODE:
        return allocation.withNode(node());
      case REMOVE_NODE:
        return allocation.withoutNode(node());
      case SELECT_MASTERY:
        return allocation.withSelection(node(), effect());
    }
    throw new AssertionError(kind());
  }

  @Override
  public final String toString() {
    return kind() == MoveKind.SELECT_MASTERY
        ? String.format("%s %d -> %d", kind(), node(), effect())
        : String.format("%s %d", kind(), node());
  }
}
