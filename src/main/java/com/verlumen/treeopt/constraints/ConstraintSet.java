package com.verlumen.treeopt.constraints;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.verlumen.treeopt.graph.Attribute;
import com.verlumen.treeopt.graph.NodeType;
import com.verlumen.treeopt.graph.TreeGraph;
import com.verlumen.treeopt.model.Allocation;
import java.util.Map;
import java.util.Optional;

/**
 * The constraints a run is held to, together with the protected regions of the graph.
 *
 * <p>Built once per run and shared by every optimizer. {@link #admit} is the single entry point
 * operators use to decide whether, and with which penalty, a candidate joins the search.
 */
public final class ConstraintSet {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final double PENALTY_PER_POINT = 100.0;
  static final double PENALTY_PER_ATTRIBUTE_POINT = 1.0;
  static final double PENALTY_PER_SOCKET = 50.0;

  private final TreeGraph graph;
  private final PointBudget pointBudget;
  private final AttributeRequirement attributeRequirement;
  private final SocketRequirement socketRequirement;
  private final ProtectedRegions protectedRegions;
  private final ConstraintPolicy policy;
  private final ConstraintRepairer repairer;

  private ConstraintSet(Builder builder) {
    this.graph = builder.graph;
    this.pointBudget = builder.pointBudget;
    this.attributeRequirement = builder.attributeRequirement;
    this.socketRequirement = builder.socketRequirement;
    this.protectedRegions = builder.protectedRegions;
    this.policy = builder.policy;
    this.repairer = new ConstraintRepairer(this);
  }

  public static Builder builder(TreeGraph graph) {
    return new Builder(graph);
  }

  /** No budget, attribute or socket limits, nothing protected. */
  public static ConstraintSet unconstrained(TreeGraph graph) {
    return builder(graph).build();
  }

  public TreeGraph graph() {
    return graph;
  }

  public PointBudget pointBudget() {
    return pointBudget;
  }

  public AttributeRequirement attributeRequirement() {
    return attributeRequirement;
  }

  public SocketRequirement socketRequirement() {
    return socketRequirement;
  }

  public ProtectedRegions protectedRegions() {
    return protectedRegions;
  }

  public ConstraintPolicy policy() {
    return policy;
  }

  public ImmutableSet<Integer> protectedNodes(Allocation allocation) {
    return protectedRegions.protectedNodes(allocation);
  }

  public int socketCount(Allocation allocation) {
    int sockets = 0;
    for (int node : allocation.nodes()) {
      if (graph.metadata(node).type() == NodeType.SOCKET) {
        sockets++;
      }
    }
    return sockets;
  }

  public ValidationResult validate(Allocation allocation) {
    ImmutableList.Builder<Violation> violations = ImmutableList.builder();
    ImmutableList<Integer> unknown =
        allocation.nodes().stream()
            .filter(node -> !graph.contains(node))
            .collect(ImmutableList.toImmutableList());
    if (!unknown.isEmpty()) {
      violations.add(
          Violation.create(
              ViolationKind.UNKNOWN_NODE, unknown.size(), "Unknown nodes: " + unknown));
      return ValidationResult.of(violations.build());
    }
    if (!graph.isConnected(allocation)) {
      int reached = graph.componentOf(allocation.nodes(), allocation.root()).size();
      violations.add(
          Violation.create(
              ViolationKind.DISCONNECTED,
              allocation.pointCount() - reached,
              String.format(
                  "%d nodes are not connected to root %d",
                  allocation.pointCount() - reached, allocation.root())));
    }

    int points = allocation.pointCount();
    if (pointBudget.deficit(points) > 0) {
      violations.add(
          Violation.create(
              ViolationKind.BUDGET_BELOW_MIN,
              pointBudget.deficit(points),
              String.format("%d points allocated, minimum is %d", points, pointBudget.min())));
    }
    if (pointBudget.excess(points) > 0) {
      violations.add(
          Violation.create(
              ViolationKind.BUDGET_ABOVE_MAX,
              pointBudget.excess(points),
              String.format("%d points allocated, maximum is %d", points, pointBudget.max())));
    }

    for (Map.Entry<Attribute, Integer> deficit :
        attributeRequirement.deficits(graph, allocation).entrySet()) {
      violations.add(
          Violation.create(
              ViolationKind.ATTRIBUTE_DEFICIT,
              deficit.getValue(),
              String.format("%s is %d points short", deficit.getKey(), deficit.getValue())));
    }

    int sockets = socketCount(allocation);
    if (socketRequirement.deficit(sockets) > 0) {
      violations.add(
          Violation.create(
              ViolationKind.SOCKETS_BELOW_MIN,
              socketRequirement.deficit(sockets),
              String.format(
                  "%d sockets allocated, minimum is %d", sockets, socketRequirement.min())));
    }
    if (socketRequirement.excess(sockets) > 0) {
      violations.add(
          Violation.create(
              ViolationKind.SOCKETS_ABOVE_MAX,
              socketRequirement.excess(sockets),
              String.format(
                  "%d sockets allocated, maximum is %d", sockets, socketRequirement.max())));
    }
    return ValidationResult.of(violations.build());
  }

  /** Fitness penalty for the non-structural violations of {@code allocation}. */
  public double penalty(Allocation allocation) {
    return penalty(validate(allocation).violations());
  }

  static double penalty(ImmutableList<Violation> violations) {
    double penalty = 0.0;
    for (Violation violation : violations) {
      switch (violation.kind()) {
        case BUDGET_BELOW_MIN:
        case BUDGET_ABOVE_MAX:
          penalty += PENALTY_PER_POINT * violation.amount();
          break;
        case ATTRIBUTE_DEFICIT:
          penalty += PENALTY_PER_ATTRIBUTE_POINT * violation.amount();
          break;
        case SOCKETS_BELOW_MIN:
        case SOCKETS_ABOVE_MAX:
          penalty += PENALTY_PER_SOCKET * violation.amount();
          break;
        default:
          break;
      }
    }
    return penalty;
  }

  /**
   * Attempts to bring {@code allocation} within every constraint without touching protected
   * nodes. Empty when the allocation cannot be made valid.
   */
  public Optional<Allocation> repair(Allocation allocation) {
    return repairer.repair(allocation);
  }

  /**
   * Applies the policy to a candidate. Structurally invalid candidates are never admitted; the
   * rest are admitted as-is, admitted with a penalty, or repaired.
   */
  public Optional<Admission> admit(Allocation allocation) {
    ValidationResult result = validate(allocation);
    if (result.ok()) {
      return Optional.of(Admission.create(allocation, 0.0, ImmutableList.of()));
    }
    if (result.hasStructuralViolation()) {
      logger.atFine().log("Rejecting candidate: %s", result.messages());
      return Optional.empty();
    }
    switch (policy) {
      case SOFT_PENALIZE:
        return Optional.of(
            Admission.create(allocation, penalty(result.violations()), result.violations()));
      case REPAIR:
        return repair(allocation)
            .map(repaired -> Admission.create(repaired, 0.0, ImmutableList.of()));
      case HARD_REJECT:
      default:
        return Optional.empty();
    }
  }

  public static final class Builder {
    private final TreeGraph graph;
    private PointBudget pointBudget = PointBudget.unbounded();
    private AttributeRequirement attributeRequirement = AttributeRequirement.none();
    private SocketRequirement socketRequirement = SocketRequirement.none();
    private ProtectedRegions protectedRegions = ProtectedRegions.none();
    private ConstraintPolicy policy = ConstraintPolicy.SOFT_PENALIZE;

    private Builder(TreeGraph graph) {
      this.graph = checkNotNull(graph);
    }

    public Builder setPointBudget(PointBudget pointBudget) {
      this.pointBudget = checkNotNull(pointBudget);
      return this;
    }

    public Builder setAttributeRequirement(AttributeRequirement attributeRequirement) {
      this.attributeRequirement = checkNotNull(attributeRequirement);
      return this;
    }

    public Builder setSocketRequirement(SocketRequirement socketRequirement) {
      this.socketRequirement = checkNotNull(socketRequirement);
      return this;
    }

    public Builder setProtectedRegions(ProtectedRegions protectedRegions) {
      this.protectedRegions = checkNotNull(protectedRegions);
      return this;
    }

    public Builder setPolicy(ConstraintPolicy policy) {
      this.policy = checkNotNull(policy);
      return this;
    }

    public ConstraintSet build() {
      return new ConstraintSet(this);
    }
  }
}
