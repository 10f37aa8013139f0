package com.verlumen.treeopt.constraints;

/** What happens to a candidate that violates a budget, attribute or socket constraint. */
public enum ConstraintPolicy {
  /** The candidate is discarded. */
  HARD_REJECT,
  /** The candidate is kept and its fitness is reduced by the violation penalty. */
  SOFT_PENALIZE,
  /** The candidate is repaired; it is discarded when repair fails. */
  REPAIR
}
