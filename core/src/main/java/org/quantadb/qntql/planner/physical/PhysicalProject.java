/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.physical;

import java.util.List;
import java.util.stream.Collectors;
import org.quantadb.qntql.analysis.model.OutputColumn;

/** Root of every physical plan; shapes the response rows. Always materialized. */
public record PhysicalProject(
    PhysicalPlan child, List<OutputColumn> outputs, ExecutionMode mode, double cardinality)
    implements PhysicalPlan {

  public PhysicalProject {
    outputs = List.copyOf(outputs);
  }

  @Override
  public boolean materialized() {
    return true;
  }

  @Override
  public List<PhysicalPlan> getChildren() {
    return List.of(child);
  }

  @Override
  public String describe() {
    return "Project "
        + outputs.stream()
            .map(
                output ->
                    output.group() == null ? output.name() : output.group() + "." + output.name())
            .collect(Collectors.joining(", "));
  }

  @Override
  public <R, C> R accept(PhysicalPlanVisitor<R, C> visitor, C context) {
    return visitor.visitProject(this, context);
  }
}
