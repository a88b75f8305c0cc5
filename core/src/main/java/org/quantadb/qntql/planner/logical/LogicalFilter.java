/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.logical;

import java.util.List;
import java.util.Set;
import org.quantadb.qntql.storage.StorageClassification;

/** Conjunctive filter over its child. */
public record LogicalFilter(LogicalPlan child, List<FilterPredicate> predicates, double cardinality)
    implements LogicalPlan {

  public LogicalFilter {
    predicates = List.copyOf(predicates);
  }

  @Override
  public Set<StorageClassification> getEngines() {
    return child.getEngines();
  }

  @Override
  public List<LogicalPlan> getChildren() {
    return List.of(child);
  }

  @Override
  public LogicalPlan replaceChildren(List<LogicalPlan> children) {
    return new LogicalFilter(children.get(0), predicates, cardinality);
  }

  @Override
  public LogicalPlan withCardinality(double newCardinality) {
    return new LogicalFilter(child, predicates, newCardinality);
  }

  @Override
  public <R, C> R accept(LogicalPlanVisitor<R, C> visitor, C context) {
    return visitor.visitFilter(this, context);
  }
}
