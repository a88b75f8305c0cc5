/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.physical;

import java.util.List;
import java.util.stream.Collectors;
import org.quantadb.qntql.ast.expression.AggregateCall;
import org.quantadb.qntql.ast.expression.Expression;
import org.quantadb.qntql.ast.expression.Expressions;
import org.quantadb.qntql.ast.expression.ResolvedAttribute;
import org.quantadb.qntql.common.utils.StringUtils;

/**
 * Grouping and aggregation.
 *
 * @param pushed whether the engine already returned the groups
 */
public record PhysicalAggregate(
    PhysicalPlan child,
    List<ResolvedAttribute> groupBy,
    List<AggregateCall> aggregates,
    Expression having,
    AggregationStrategy strategy,
    boolean pushed,
    ExecutionMode mode,
    double cardinality)
    implements PhysicalPlan {

  public PhysicalAggregate {
    groupBy = List.copyOf(groupBy);
    aggregates = List.copyOf(aggregates);
  }

  @Override
  public boolean materialized() {
    return strategy == AggregationStrategy.HASH && !pushed;
  }

  @Override
  public List<PhysicalPlan> getChildren() {
    return List.of(child);
  }

  @Override
  public String describe() {
    return StringUtils.format(
        "Aggregate %s by [%s] computing [%s]%s",
        strategy,
        groupBy.stream().map(Expressions::describe).collect(Collectors.joining(", ")),
        aggregates.stream().map(Expressions::describe).collect(Collectors.joining(", ")),
        pushed ? " pushed to engine" : "");
  }

  @Override
  public <R, C> R accept(PhysicalPlanVisitor<R, C> visitor, C context) {
    return visitor.visitAggregate(this, context);
  }
}
