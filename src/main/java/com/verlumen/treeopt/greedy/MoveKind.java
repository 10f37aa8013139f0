package com.verlumen.treeopt.greedy;

public enum MoveKind {
  ADD_NODE(1),
  REMOVE_NODE(-1),
  SELECT_MASTERY(0);

  private final int pointDelta;

  MoveKind(int pointDelta) {
    this.pointDelta = pointDelta;
  }

  public int pointDelta() {
    return pointDelta;
  }
}
