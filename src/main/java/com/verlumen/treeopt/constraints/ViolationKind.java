package com.verlumen.treeopt.constraints;

public enum ViolationKind {
  UNKNOWN_NODE,
  DISCONNECTED,
  BUDGET_BELOW_MIN,
  BUDGET_ABOVE_MAX,
  ATTRIBUTE_DEFICIT,
  SOCKETS_BELOW_MIN,
  SOCKETS_ABOVE_MAX
}
