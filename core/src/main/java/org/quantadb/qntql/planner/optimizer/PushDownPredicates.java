/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.optimizer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.quantadb.qntql.ast.expression.Expression;
import org.quantadb.qntql.ast.expression.Expressions;
import org.quantadb.qntql.planner.logical.FilterPredicate;
import org.quantadb.qntql.planner.logical.LogicalFilter;
import org.quantadb.qntql.planner.logical.LogicalPlan;
import org.quantadb.qntql.planner.logical.LogicalScan;
import org.quantadb.qntql.storage.StorageClassification;
import org.quantadb.qntql.translator.TranslatorRegistry;

/**
 * Moves every filter conjunct that references one record and one engine, and that the engine's
 * translator can express, into the scan of that record. A filter left without conjuncts is
 * removed.
 */
@RequiredArgsConstructor
public class PushDownPredicates implements LogicalPlanRule {

  private final TranslatorRegistry translators;

  @Override
  public LogicalPlan apply(LogicalPlan plan) {
    return LogicalPlans.transform(
        plan, node -> node instanceof LogicalFilter filter ? push(filter) : node);
  }

  private LogicalPlan push(LogicalFilter filter) {
    Map<String, List<Expression>> pushed = new HashMap<>();
    List<FilterPredicate> remaining = new ArrayList<>();
    for (FilterPredicate predicate : filter.predicates()) {
      Expression expression = predicate.expression();
      if (isPushable(expression)) {
        String alias = Expressions.aliases(expression).iterator().next();
        pushed.computeIfAbsent(alias, key -> new ArrayList<>()).add(expression);
      } else {
        remaining.add(predicate);
      }
    }
    if (pushed.isEmpty()) {
      return filter;
    }
    LogicalPlan child =
        LogicalPlans.transform(
            filter.child(),
            node -> {
              if (node instanceof LogicalScan scan && pushed.containsKey(scan.alias())) {
                List<Expression> predicates = new ArrayList<>(scan.predicates());
                predicates.addAll(pushed.get(scan.alias()));
                return scan.withPredicates(predicates);
              }
              return node;
            });
    return remaining.isEmpty() ? child : new LogicalFilter(child, remaining, filter.cardinality());
  }

  private boolean isPushable(Expression expression) {
    Set<String> aliases = Expressions.aliases(expression);
    Set<StorageClassification> engines = Expressions.engines(expression);
    return aliases.size() == 1
        && engines.size() == 1
        && translators.get(engines.iterator().next()).canPushDown(expression);
  }
}
