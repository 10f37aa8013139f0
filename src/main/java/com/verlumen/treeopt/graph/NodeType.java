package com.verlumen.treeopt.graph;

/** Node classes that the optimizers treat differently. */
public enum NodeType {
  NORMAL,
  NOTABLE,
  KEYSTONE,
  /** Holds an externally owned object such as a jewel. */
  SOCKET,
  /** Carries a selectable effect; see {@link NodeMetadata#masteryEffects()}. */
  MASTERY
}
