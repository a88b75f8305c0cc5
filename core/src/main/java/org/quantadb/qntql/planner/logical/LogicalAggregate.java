/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.logical;

import java.util.List;
import java.util.Set;
import org.quantadb.qntql.ast.expression.AggregateCall;
import org.quantadb.qntql.ast.expression.Expression;
import org.quantadb.qntql.ast.expression.ResolvedAttribute;
import org.quantadb.qntql.storage.StorageClassification;

/**
 * Grouping with aggregates and an optional HAVING filter.
 *
 * @param pushed computed by the engine of a single-engine scan
 */
public record LogicalAggregate(
    LogicalPlan child,
    List<ResolvedAttribute> groupBy,
    List<AggregateCall> aggregates,
    Expression having,
    boolean pushed,
    double cardinality)
    implements LogicalPlan {

  public LogicalAggregate {
    groupBy = List.copyOf(groupBy);
    aggregates = List.copyOf(aggregates);
  }

  public LogicalAggregate asPushed() {
    return new LogicalAggregate(child, groupBy, aggregates, having, true, cardinality);
  }

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
    return new LogicalAggregate(children.get(0), groupBy, aggregates, having, pushed, cardinality);
  }

  @Override
  public LogicalPlan withCardinality(double newCardinality) {
    return new LogicalAggregate(child, groupBy, aggregates, having, pushed, newCardinality);
  }

  @Override
  public <R, C> R accept(LogicalPlanVisitor<R, C> visitor, C context) {
    return visitor.visitAggregate(this, context);
  }
}
