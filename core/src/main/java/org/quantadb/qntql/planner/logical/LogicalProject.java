/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.logical;

import java.util.List;
import java.util.Set;
import org.quantadb.qntql.analysis.model.OutputColumn;
import org.quantadb.qntql.storage.StorageClassification;

/** Root of every logical plan: the output columns. */
public record LogicalProject(LogicalPlan child, List<OutputColumn> outputs, double cardinality)
    implements LogicalPlan {

  public LogicalProject {
    outputs = List.copyOf(outputs);
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
    return new LogicalProject(children.get(0), outputs, cardinality);
  }

  @Override
  public LogicalPlan withCardinality(double newCardinality) {
    return new LogicalProject(child, outputs, newCardinality);
  }

  @Override
  public <R, C> R accept(LogicalPlanVisitor<R, C> visitor, C context) {
    return visitor.visitProject(this, context);
  }
}
