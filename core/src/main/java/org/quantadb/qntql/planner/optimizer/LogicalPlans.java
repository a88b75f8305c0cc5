/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.optimizer;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import org.quantadb.qntql.planner.logical.LogicalPlan;

/** Tree walking helpers for rules. */
final class LogicalPlans {

  private LogicalPlans() {}

  /** Rewrites the tree bottom-up, children first. */
  static LogicalPlan transform(LogicalPlan plan, UnaryOperator<LogicalPlan> rewrite) {
    List<LogicalPlan> children = new ArrayList<>();
    boolean changed = false;
    for (LogicalPlan child : plan.getChildren()) {
      LogicalPlan rewritten = transform(child, rewrite);
      changed |= rewritten != child;
      children.add(rewritten);
    }
    return rewrite.apply(changed ? plan.replaceChildren(children) : plan);
  }

  /** Visits every node, parents before children. */
  static void forEach(LogicalPlan plan, Consumer<LogicalPlan> action) {
    action.accept(plan);
    plan.getChildren().forEach(child -> forEach(child, action));
  }
}
