/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.logical;

import java.util.List;
import java.util.Set;
import org.quantadb.qntql.storage.StorageClassification;

/**
 * LIMIT and OFFSET.
 *
 * @param limit row limit, null for none
 * @param offset rows to skip, null for none
 */
public record LogicalLimit(
    LogicalPlan child, Integer limit, Integer offset, double cardinality)
    implements LogicalPlan {

  @Override
  public Set<StorageClassification> getEngines() {
    return child.getEngines();
  }

  @Override
  public List<LogicalPlan> getChildren() {
    return List.of(child);
  }

  @Override
  public LogicalPlan replaceChildren(List<LogicalPlan> children) {
    return new LogicalLimit(children.get(0), limit, offset, cardinality);
  }

  @Override
  public LogicalPlan withCardinality(double newCardinality) {
    return new LogicalLimit(child, limit, offset, newCardinality);
  }

  @Override
  public <R, C> R accept(LogicalPlanVisitor<R, C> visitor, C context) {
    return visitor.visitLimit(this, context);
  }
}
