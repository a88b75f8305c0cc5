/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.physical;

import java.util.List;
import org.quantadb.qntql.analysis.model.AnalyzedHop;
import org.quantadb.qntql.common.utils.StringUtils;

/**
 * Follows one relation attribute from the source subtree to the target record, joining source
 * rows, edges and target rows.
 */
public record PhysicalNavigate(
    PhysicalPlan source,
    PhysicalScan target,
    AnalyzedHop hop,
    EngineFragment traversal,
    JoinAlgorithm algorithm,
    ExecutionMode mode,
    boolean materialized,
    double cardinality)
    implements PhysicalPlan {

  @Override
  public List<PhysicalPlan> getChildren() {
    return List.of(source, target);
  }

  @Override
  public List<EngineFragment> getFragments() {
    return List.of(traversal);
  }

  @Override
  public String describe() {
    return StringUtils.format(
        "Navigate %s -%s-> %s %s %s %s",
        hop.sourceAlias(),
        hop.relation().attribute(),
        hop.targetAlias(),
        traversal.direction(),
        algorithm,
        mode);
  }

  @Override
  public <R, C> R accept(PhysicalPlanVisitor<R, C> visitor, C context) {
    return visitor.visitNavigate(this, context);
  }
}
