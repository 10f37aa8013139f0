package com.verlumen.treeopt.evolution;

public enum MutationKind {
  ADD_NODE,
  REMOVE_NODE,
  RANDOMIZE_MASTERY
}
