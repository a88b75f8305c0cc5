/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.optimizer;

import java.util.ArrayList;
import java.util.List;
import org.quantadb.qntql.ast.expression.Expressions;
import org.quantadb.qntql.planner.logical.DeferralReason;
import org.quantadb.qntql.planner.logical.FilterPredicate;
import org.quantadb.qntql.planner.logical.LogicalFilter;
import org.quantadb.qntql.planner.logical.LogicalPlan;

/**
 * Flags every predicate still in a filter as client-side, recording why no engine received it.
 */
public class DeferCrossEnginePredicates implements LogicalPlanRule {

  @Override
  public LogicalPlan apply(LogicalPlan plan) {
    return LogicalPlans.transform(
        plan,
        node -> {
          if (!(node instanceof LogicalFilter filter)) {
            return node;
          }
          List<FilterPredicate> deferred = new ArrayList<>();
          for (FilterPredicate predicate : filter.predicates()) {
            deferred.add(
                FilterPredicate.deferred(predicate.expression(), reason(predicate)));
          }
          return new LogicalFilter(filter.child(), deferred, filter.cardinality());
        });
  }

  private static DeferralReason reason(FilterPredicate predicate) {
    if (Expressions.aliases(predicate.expression()).size() > 1) {
      return DeferralReason.MULTI_RECORD;
    }
    if (Expressions.engines(predicate.expression()).size() > 1) {
      return DeferralReason.CROSS_ENGINE;
    }
    return DeferralReason.NOT_PUSHABLE;
  }
}
