/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.logical;

import java.util.List;
import java.util.Set;
import org.quantadb.qntql.analysis.model.SortKey;
import org.quantadb.qntql.storage.StorageClassification;

/** Ordering; {@code pushed} when the engine already returns rows in this order. */
public record LogicalSort(LogicalPlan child, List<SortKey> keys, boolean pushed, double cardinality)
    implements LogicalPlan {

  public LogicalSort {
    keys = List.copyOf(keys);
  }

  public LogicalSort asPushed() {
    return new LogicalSort(child, keys, true, cardinality);
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
    return new LogicalSort(children.get(0), keys, pushed, cardinality);
  }

  @Override
  public LogicalPlan withCardinality(double newCardinality) {
    return new LogicalSort(child, keys, pushed, newCardinality);
  }

  @Override
  public <R, C> R accept(LogicalPlanVisitor<R, C> visitor, C context) {
    return visitor.visitSort(this, context);
  }
}
