/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.optimizer;

import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.quantadb.qntql.ast.expression.Expression;
import org.quantadb.qntql.ast.expression.Expressions;
import org.quantadb.qntql.ast.expression.ResolvedAttribute;
import org.quantadb.qntql.catalog.model.RecordSchema;
import org.quantadb.qntql.common.setting.QuantaSettings;
import org.quantadb.qntql.planner.logical.LogicalAggregate;
import org.quantadb.qntql.planner.logical.LogicalFilter;
import org.quantadb.qntql.planner.logical.LogicalLimit;
import org.quantadb.qntql.planner.logical.LogicalNavigate;
import org.quantadb.qntql.planner.logical.LogicalPlan;
import org.quantadb.qntql.planner.logical.LogicalScan;

/**
 * Heuristic row-count estimates. There are no statistics: a scan starts at the configured default
 * size and every pushed predicate multiplies it by the indexed or unindexed selectivity. Estimates
 * are monotone, so filtered and indexed scans always rank cheaper than plain ones.
 */
@RequiredArgsConstructor
public class CardinalityEstimator {

  private final QuantaSettings.Planner settings;

  /** Recomputes the estimate of every node, bottom-up. */
  public LogicalPlan annotate(LogicalPlan plan) {
    List<LogicalPlan> children = new ArrayList<>();
    for (LogicalPlan child : plan.getChildren()) {
      children.add(annotate(child));
    }
    LogicalPlan node = children.isEmpty() ? plan : plan.replaceChildren(children);
    return node.withCardinality(estimate(node));
  }

  /** Estimate of one node from the estimates of its children. */
  public double estimate(LogicalPlan node) {
    if (node instanceof LogicalScan) {
      return estimateScan((LogicalScan) node);
    } else if (node instanceof LogicalFilter) {
      LogicalFilter filter = (LogicalFilter) node;
      return atLeastOne(
          filter.child().cardinality()
              * Math.pow(settings.getUnindexedSelectivity(), filter.predicates().size()));
    } else if (node instanceof LogicalNavigate) {
      LogicalNavigate navigate = (LogicalNavigate) node;
      return atLeastOne(
          Math.min(navigate.source().cardinality(), navigate.target().cardinality())
              * settings.getNavigationFanout());
    } else if (node instanceof LogicalAggregate) {
      LogicalAggregate aggregate = (LogicalAggregate) node;
      return aggregate.groupBy().isEmpty()
          ? 1
          : atLeastOne(aggregate.child().cardinality() * settings.getUnindexedSelectivity());
    } else if (node instanceof LogicalLimit) {
      LogicalLimit limit = (LogicalLimit) node;
      double rows = limit.child().cardinality();
      if (limit.offset() != null) {
        rows = Math.max(0, rows - limit.offset());
      }
      return limit.limit() == null ? rows : Math.min(rows, limit.limit());
    }
    return node.getChildren().get(0).cardinality();
  }

  public double estimateScan(LogicalScan scan) {
    double rows = settings.getDefaultScanRows();
    for (Expression predicate : scan.predicates()) {
      rows *=
          isIndexed(predicate, scan.record())
              ? settings.getIndexedSelectivity()
              : settings.getUnindexedSelectivity();
    }
    return atLeastOne(rows);
  }

  /** A predicate on an indexed attribute or on the record key can use an index. */
  public boolean isIndexed(Expression predicate, RecordSchema record) {
    for (ResolvedAttribute attribute : Expressions.attributes(predicate)) {
      if (attribute.definition().indexed()
          || attribute.attribute().equals(record.getKeyAttribute())) {
        return true;
      }
    }
    return false;
  }

  private static double atLeastOne(double rows) {
    return Math.max(1, rows);
  }
}
