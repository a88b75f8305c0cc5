/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.optimizer;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.quantadb.qntql.analysis.model.OutputColumn;
import org.quantadb.qntql.analysis.model.SortKey;
import org.quantadb.qntql.ast.expression.Expression;
import org.quantadb.qntql.ast.expression.Expressions;
import org.quantadb.qntql.ast.expression.ResolvedAttribute;
import org.quantadb.qntql.planner.logical.FilterPredicate;
import org.quantadb.qntql.planner.logical.LogicalAggregate;
import org.quantadb.qntql.planner.logical.LogicalFilter;
import org.quantadb.qntql.planner.logical.LogicalPlan;
import org.quantadb.qntql.planner.logical.LogicalProject;
import org.quantadb.qntql.planner.logical.LogicalScan;
import org.quantadb.qntql.planner.logical.LogicalSort;

/**
 * Narrows every scan to its record key plus the attributes some operator above it reads.
 * Attributes referenced only by pushed predicates are not returned: the engine filters on them.
 */
public class PruneProjections implements LogicalPlanRule {

  @Override
  public LogicalPlan apply(LogicalPlan plan) {
    Map<String, Set<String>> needed = new HashMap<>();
    LogicalPlans.forEach(plan, node -> collect(node, needed));
    return LogicalPlans.transform(
        plan,
        node -> {
          if (node instanceof LogicalScan scan) {
            Set<String> attributes = new LinkedHashSet<>();
            attributes.add(scan.record().getKeyAttribute());
            Set<String> used = needed.getOrDefault(scan.alias(), Set.of());
            scan.record().getAttributes().keySet().stream()
                .filter(used::contains)
                .forEach(attributes::add);
            return scan.withAttributes(attributes);
          }
          return node;
        });
  }

  private static void collect(LogicalPlan node, Map<String, Set<String>> needed) {
    if (node instanceof LogicalProject project) {
      for (OutputColumn output : project.outputs()) {
        add(output.expression(), needed);
      }
    } else if (node instanceof LogicalFilter filter) {
      for (FilterPredicate predicate : filter.predicates()) {
        add(predicate.expression(), needed);
      }
    } else if (node instanceof LogicalAggregate aggregate) {
      aggregate.groupBy().forEach(attribute -> add(attribute, needed));
      aggregate.aggregates().forEach(call -> add(call, needed));
      add(aggregate.having(), needed);
    } else if (node instanceof LogicalSort sort) {
      for (SortKey key : sort.keys()) {
        add(key.expression(), needed);
      }
    }
  }

  private static void add(Expression expression, Map<String, Set<String>> needed) {
    for (ResolvedAttribute attribute : Expressions.attributes(expression)) {
      needed
          .computeIfAbsent(attribute.alias(), alias -> new LinkedHashSet<>())
          .add(attribute.attribute());
    }
  }
}
