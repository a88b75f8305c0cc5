/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.physical;

import java.util.List;
import java.util.stream.Collectors;
import org.quantadb.qntql.analysis.model.SortKey;
import org.quantadb.qntql.ast.expression.Expressions;

public record PhysicalSort(
    PhysicalPlan child, List<SortKey> keys, boolean pushed, ExecutionMode mode, double cardinality)
    implements PhysicalPlan {

  public PhysicalSort {
    keys = List.copyOf(keys);
  }

  @Override
  public boolean materialized() {
    return !pushed;
  }

  @Override
  public List<PhysicalPlan> getChildren() {
    return List.of(child);
  }

  @Override
  public String describe() {
    return "Sort "
        + keys.stream()
            .map(
                key ->
                    Expressions.describe(key.expression()) + (key.ascending() ? " ASC" : " DESC"))
            .collect(Collectors.joining(", "))
        + (pushed ? " pushed to engine" : "");
  }

  @Override
  public <R, C> R accept(PhysicalPlanVisitor<R, C> visitor, C context) {
    return visitor.visitSort(this, context);
  }
}
