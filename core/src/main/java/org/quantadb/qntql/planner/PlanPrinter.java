/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.quantadb.qntql.ast.expression.Expressions;
import org.quantadb.qntql.common.utils.StringUtils;
import org.quantadb.qntql.planner.logical.LogicalAggregate;
import org.quantadb.qntql.planner.logical.LogicalFilter;
import org.quantadb.qntql.planner.logical.LogicalLimit;
import org.quantadb.qntql.planner.logical.LogicalNavigate;
import org.quantadb.qntql.planner.logical.LogicalPlan;
import org.quantadb.qntql.planner.logical.LogicalProject;
import org.quantadb.qntql.planner.logical.LogicalScan;
import org.quantadb.qntql.planner.logical.LogicalSort;
import org.quantadb.qntql.planner.physical.EngineFragment;
import org.quantadb.qntql.planner.physical.PhysicalPlan;

/** Indented text rendering of plans for EXPLAIN. */
public final class PlanPrinter {

  private static final String INDENT = "  ";

  private PlanPrinter() {}

  public static List<String> print(LogicalPlan plan) {
    List<String> lines = new ArrayList<>();
    print(plan, 0, lines);
    return lines;
  }

  public static List<String> print(PhysicalPlan plan) {
    List<String> lines = new ArrayList<>();
    print(plan, 0, lines);
    return lines;
  }

  private static void print(LogicalPlan plan, int depth, List<String> lines) {
    lines.add(
        INDENT.repeat(depth)
            + describe(plan)
            + StringUtils.format(" (rows=%.0f)", plan.cardinality()));
    plan.getChildren().forEach(child -> print(child, depth + 1, lines));
  }

  private static void print(PhysicalPlan plan, int depth, List<String> lines) {
    lines.add(
        INDENT.repeat(depth)
            + plan.describe()
            + StringUtils.format(" (rows=%.0f)", plan.cardinality()));
    for (EngineFragment fragment : plan.getFragments()) {
      lines.add(INDENT.repeat(depth + 1) + "- " + fragment.describe());
    }
    plan.getChildren().forEach(child -> print(child, depth + 1, lines));
  }

  private static String describe(LogicalPlan plan) {
    if (plan instanceof LogicalScan scan) {
      String text =
          "Scan " + scan.alias() + ":" + scan.record().getName() + " " + scan.attributes();
      if (!scan.predicates().isEmpty()) {
        text +=
            " where "
                + scan.predicates().stream()
                    .map(Expressions::describe)
                    .collect(Collectors.joining(" AND "));
      }
      return scan.pushdown() == null ? text : text + " with engine ordering";
    } else if (plan instanceof LogicalFilter filter) {
      return "Filter "
          + filter.predicates().stream()
              .map(
                  predicate ->
                      Expressions.describe(predicate.expression())
                          + (predicate.clientSide() ? " [" + predicate.reason() + "]" : ""))
              .collect(Collectors.joining(" AND "));
    } else if (plan instanceof LogicalNavigate navigate) {
      return "Navigate "
          + navigate.hop().sourceAlias()
          + " -"
          + navigate.hop().relation().attribute()
          + "-> "
          + navigate.hop().targetAlias()
          + " "
          + navigate.direction();
    } else if (plan instanceof LogicalAggregate aggregate) {
      return "Aggregate "
          + aggregate.aggregates().stream()
              .map(Expressions::describe)
              .collect(Collectors.joining(", "))
          + (aggregate.groupBy().isEmpty()
              ? ""
              : " by "
                  + aggregate.groupBy().stream()
                      .map(Expressions::describe)
                      .collect(Collectors.joining(", ")))
          + (aggregate.having() == null
              ? ""
              : " having " + Expressions.describe(aggregate.having()))
          + (aggregate.pushed() ? " [engine]" : "");
    } else if (plan instanceof LogicalSort sort) {
      return "Sort "
          + sort.keys().stream()
              .map(
                  key -> Expressions.describe(key.expression()) + (key.ascending() ? "" : " DESC"))
              .collect(Collectors.joining(", "))
          + (sort.pushed() ? " [engine]" : "");
    } else if (plan instanceof LogicalLimit limit) {
      return "Limit " + limit.limit() + " offset " + limit.offset();
    }
    LogicalProject project = (LogicalProject) plan;
    return "Project "
        + project.outputs().stream()
            .map(output -> Expressions.describe(output.expression()))
            .collect(Collectors.joining(", "));
  }
}
