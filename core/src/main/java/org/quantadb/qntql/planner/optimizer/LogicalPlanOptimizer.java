/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.optimizer;

import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.quantadb.qntql.planner.logical.LogicalPlan;
import org.quantadb.qntql.translator.TranslatorRegistry;

/**
 * Applies the rewrite rules in a fixed order and refreshes the cardinality estimates after each
 * one.
 */
@Log4j2
public class LogicalPlanOptimizer {

  private final List<LogicalPlanRule> rules;

  private final CardinalityEstimator estimator;

  public LogicalPlanOptimizer(List<LogicalPlanRule> rules, CardinalityEstimator estimator) {
    this.rules = List.copyOf(rules);
    this.estimator = estimator;
  }

  /**
   * Standard pass order: predicate pushdown, projection pruning, navigation ordering, client-side
   * predicate detection, then ordering and aggregation pushdown.
   */
  public static LogicalPlanOptimizer create(
      TranslatorRegistry translators, CardinalityEstimator estimator) {
    return new LogicalPlanOptimizer(
        List.of(
            new PushDownPredicates(translators),
            new PruneProjections(),
            new OrderNavigations(estimator),
            new DeferCrossEnginePredicates(),
            new PushDownOrdering(translators)),
        estimator);
  }

  public LogicalPlan optimize(LogicalPlan plan) {
    LogicalPlan optimized = plan;
    for (LogicalPlanRule rule : rules) {
      optimized = estimator.annotate(rule.apply(optimized));
      log.debug("After {}: {}", rule.getClass().getSimpleName(), optimized);
    }
    return optimized;
  }
}
