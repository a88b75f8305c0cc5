/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.logical;

import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.quantadb.qntql.analysis.model.AnalyzedHop;
import org.quantadb.qntql.analysis.model.AnalyzedQuery;
import org.quantadb.qntql.ast.expression.Expression;
import org.quantadb.qntql.ast.expression.Expressions;
import org.quantadb.qntql.catalog.model.RecordSchema;
import org.quantadb.qntql.planner.optimizer.CardinalityEstimator;

/**
 * Builds the unoptimized logical plan of a query: one scan per record in scope chained by
 * navigations, then filter, aggregate, sort, limit and the root projection.
 */
@RequiredArgsConstructor
public class LogicalPlanner {

  private final CardinalityEstimator estimator;

  public LogicalPlan plan(AnalyzedQuery query) {
    LogicalPlan plan = scan(query.scope().getPrimaryAlias(), query.scope().getPrimary());
    for (AnalyzedHop hop : query.navigation()) {
      plan =
          new LogicalNavigate(
              plan, scan(hop.targetAlias(), hop.target()), hop, TraversalDirection.FORWARD, 0);
    }
    if (query.filter() != null) {
      List<FilterPredicate> predicates = new ArrayList<>();
      for (Expression conjunct : Expressions.conjuncts(query.filter())) {
        predicates.add(FilterPredicate.undecided(conjunct));
      }
      plan = new LogicalFilter(plan, predicates, 0);
    }
    if (query.isAggregation()) {
      plan =
          new LogicalAggregate(
              plan, query.groupBy(), query.aggregates(), query.having(), false, 0);
    }
    if (!query.sort().isEmpty()) {
      plan = new LogicalSort(plan, query.sort(), false, 0);
    }
    if (query.limit() != null || query.offset() != null) {
      plan = new LogicalLimit(plan, query.limit(), query.offset(), 0);
    }
    return estimator.annotate(new LogicalProject(plan, query.outputs(), 0));
  }

  private static LogicalScan scan(String alias, RecordSchema record) {
    return new LogicalScan(alias, record, record.getAttributes().keySet(), List.of(), null, 0);
  }
}
