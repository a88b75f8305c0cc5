/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.physical;

import java.util.List;
import org.quantadb.qntql.common.utils.StringUtils;

public record PhysicalLimit(
    PhysicalPlan child,
    Integer limit,
    Integer offset,
    ExecutionMode mode,
    double cardinality)
    implements PhysicalPlan {

  @Override
  public boolean materialized() {
    return false;
  }

  @Override
  public List<PhysicalPlan> getChildren() {
    return List.of(child);
  }

  @Override
  public String describe() {
    return StringUtils.format("Limit %s offset %s", limit, offset);
  }

  @Override
  public <R, C> R accept(PhysicalPlanVisitor<R, C> visitor, C context) {
    return visitor.visitLimit(this, context);
  }
}
