/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.physical;

import java.util.List;

/**
 * Physical refinement of a logical plan node. The tree mirrors the logical tree one node for one
 * node; engine work hangs off scans and navigations as {@link EngineFragment}s.
 */
public sealed interface PhysicalPlan
    permits PhysicalScan,
        PhysicalFilter,
        PhysicalNavigate,
        PhysicalAggregate,
        PhysicalSort,
        PhysicalLimit,
        PhysicalProject {

  double cardinality();

  ExecutionMode mode();

  /** Whether the node's output is held in full, to feed a key input or as the final result. */
  boolean materialized();

  List<PhysicalPlan> getChildren();

  /** Fragments owned by this node, not including its children's. */
  default List<EngineFragment> getFragments() {
    return List.of();
  }

  /** One-line description used by EXPLAIN. */
  String describe();

  <R, C> R accept(PhysicalPlanVisitor<R, C> visitor, C context);
}
