/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.logical;

import java.util.List;
import java.util.Set;
import org.quantadb.qntql.storage.StorageClassification;

/**
 * Node of the logical operator tree. Nodes are immutable; optimizer rules build new trees. The
 * variant set is closed and consumed through {@link LogicalPlanVisitor}.
 */
public sealed interface LogicalPlan
    permits LogicalScan,
        LogicalFilter,
        LogicalNavigate,
        LogicalAggregate,
        LogicalSort,
        LogicalLimit,
        LogicalProject {

  /** Estimated number of output rows. */
  double cardinality();

  /** Storage engines this subtree reads from. */
  Set<StorageClassification> getEngines();

  List<LogicalPlan> getChildren();

  /** Copy of this node with new children, in {@link #getChildren()} order. */
  LogicalPlan replaceChildren(List<LogicalPlan> children);

  /** Copy of this node with a new cardinality estimate. */
  LogicalPlan withCardinality(double cardinality);

  <R, C> R accept(LogicalPlanVisitor<R, C> visitor, C context);
}
