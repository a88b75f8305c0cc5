/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.optimizer;

import java.util.List;
import lombok.RequiredArgsConstructor;
import org.quantadb.qntql.analysis.model.SortKey;
import org.quantadb.qntql.ast.expression.AggregateCall;
import org.quantadb.qntql.ast.expression.ResolvedAttribute;
import org.quantadb.qntql.planner.logical.EnginePushdown;
import org.quantadb.qntql.planner.logical.LogicalAggregate;
import org.quantadb.qntql.planner.logical.LogicalLimit;
import org.quantadb.qntql.planner.logical.LogicalPlan;
import org.quantadb.qntql.planner.logical.LogicalProject;
import org.quantadb.qntql.planner.logical.LogicalScan;
import org.quantadb.qntql.planner.logical.LogicalSort;
import org.quantadb.qntql.storage.StorageClassification;
import org.quantadb.qntql.translator.EngineTranslator;
import org.quantadb.qntql.translator.TranslatorRegistry;

/**
 * When the whole query is a single scan served by one engine and nothing is left for the client,
 * hands aggregation and sort to that engine as far as its translator supports them. Operators
 * satisfied this way are marked pushed and skipped by the result assembler. LIMIT and OFFSET stay
 * with the assembler so that the total count covers every matching row.
 */
@RequiredArgsConstructor
public class PushDownOrdering implements LogicalPlanRule {

  private final TranslatorRegistry translators;

  @Override
  public LogicalPlan apply(LogicalPlan plan) {
    if (!(plan instanceof LogicalProject project)) {
      return plan;
    }
    LogicalPlan node = project.child();
    LogicalLimit limit = null;
    LogicalSort sort = null;
    LogicalAggregate aggregate = null;
    if (node instanceof LogicalLimit found) {
      limit = found;
      node = found.child();
    }
    if (node instanceof LogicalSort found) {
      sort = found;
      node = found.child();
    }
    if (node instanceof LogicalAggregate found) {
      aggregate = found;
      node = found.child();
    }
    if (!(node instanceof LogicalScan scan) || scan.getEngines().size() != 1) {
      return plan;
    }
    StorageClassification engine = scan.getEngines().iterator().next();
    EngineTranslator translator = translators.get(engine);

    EnginePushdown.Aggregation aggregation = null;
    if (aggregate != null) {
      if (!translator.supportsAggregation()
          || (aggregate.having() != null && !translator.canPushDown(aggregate.having()))) {
        return plan;
      }
      aggregation =
          new EnginePushdown.Aggregation(
              aggregate.groupBy(), aggregate.aggregates(), aggregate.having());
    }
    boolean sortPushed =
        sort != null && translator.supportsOrdering() && sortable(sort, aggregation != null);
    if (aggregation == null && !sortPushed) {
      return plan;
    }

    LogicalPlan rebuilt =
        scan.withPushdown(new EnginePushdown(sortPushed ? sort.keys() : List.of(), aggregation));
    if (aggregate != null) {
      rebuilt = aggregate.asPushed().replaceChildren(List.of(rebuilt));
    }
    if (sort != null) {
      rebuilt = (sortPushed ? sort.asPushed() : sort).replaceChildren(List.of(rebuilt));
    }
    if (limit != null) {
      rebuilt = limit.replaceChildren(List.of(rebuilt));
    }
    return project.replaceChildren(List.of(rebuilt));
  }

  private static boolean sortable(LogicalSort sort, boolean aggregated) {
    for (SortKey key : sort.keys()) {
      boolean supported =
          key.expression() instanceof ResolvedAttribute
              || (aggregated && key.expression() instanceof AggregateCall);
      if (!supported) {
        return false;
      }
    }
    return true;
  }
}
