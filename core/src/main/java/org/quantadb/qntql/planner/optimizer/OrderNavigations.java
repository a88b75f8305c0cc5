/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.optimizer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.quantadb.qntql.planner.logical.LogicalNavigate;
import org.quantadb.qntql.planner.logical.LogicalPlan;
import org.quantadb.qntql.planner.logical.LogicalScan;
import org.quantadb.qntql.planner.logical.TraversalDirection;

/**
 * Orders navigation hops and picks their traversal direction.
 *
 * <p>Among the hops whose source is already reachable, the one with the smallest estimated target
 * goes next, so independent hops run cheapest first while dependent hops keep their dependency
 * order. Only the first hop may be traversed in reverse, when its target scan is estimated
 * smaller than the primary scan.
 */
@RequiredArgsConstructor
public class OrderNavigations implements LogicalPlanRule {

  private final CardinalityEstimator estimator;

  @Override
  public LogicalPlan apply(LogicalPlan plan) {
    return LogicalPlans.transform(
        plan,
        node -> {
          if (node instanceof LogicalNavigate navigate && isChainTop(plan, navigate)) {
            return reorder(navigate);
          }
          return node;
        });
  }

  /** Whether no other navigation sits directly above this one. */
  private static boolean isChainTop(LogicalPlan root, LogicalNavigate navigate) {
    List<Boolean> nested = new ArrayList<>();
    LogicalPlans.forEach(
        root,
        node -> {
          if (node instanceof LogicalNavigate parent && parent.source() == navigate) {
            nested.add(true);
          }
        });
    return nested.isEmpty();
  }

  private LogicalPlan reorder(LogicalNavigate top) {
    List<LogicalNavigate> hops = new ArrayList<>();
    LogicalPlan node = top;
    while (node instanceof LogicalNavigate navigate) {
      hops.add(0, navigate);
      node = navigate.source();
    }
    LogicalScan primary = (LogicalScan) node;
    double primaryRows = estimator.estimateScan(primary);

    Set<String> reachable = new HashSet<>();
    reachable.add(primary.alias());
    List<LogicalNavigate> remaining = new ArrayList<>(hops);
    LogicalPlan chain = primary;
    while (!remaining.isEmpty()) {
      LogicalNavigate next = null;
      for (LogicalNavigate candidate : remaining) {
        if (reachable.contains(candidate.hop().sourceAlias())
            && (next == null
                || estimator.estimateScan(candidate.target())
                    < estimator.estimateScan(next.target()))) {
          next = candidate;
        }
      }
      remaining.remove(next);
      reachable.add(next.hop().targetAlias());
      TraversalDirection direction = TraversalDirection.FORWARD;
      if (chain == primary && estimator.estimateScan(next.target()) < primaryRows) {
        direction = TraversalDirection.REVERSE;
      }
      chain = new LogicalNavigate(chain, next.target(), next.hop(), direction, 0);
    }
    return estimator.annotate(chain);
  }
}
