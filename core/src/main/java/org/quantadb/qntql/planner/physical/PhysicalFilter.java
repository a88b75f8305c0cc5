/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.physical;

import java.util.List;
import java.util.stream.Collectors;
import org.quantadb.qntql.ast.expression.Expressions;
import org.quantadb.qntql.planner.logical.FilterPredicate;

/** Client-side predicates, evaluated by the result assembler. */
public record PhysicalFilter(
    PhysicalPlan child, List<FilterPredicate> predicates, ExecutionMode mode, double cardinality)
    implements PhysicalPlan {

  public PhysicalFilter {
    predicates = List.copyOf(predicates);
  }

  @Override
  public boolean materialized() {
    return false;
  }

  @Override
  public List<PhysicalPlan> getChildren() {
    return List.of(child);
  }

  @Override
  public String describe() {
    return "Filter client-side "
        + predicates.stream()
            .map(
                predicate ->
                    Expressions.describe(predicate.expression())
                        + " ("
                        + predicate.reason()
                        + ")")
            .collect(Collectors.joining(", "));
  }

  @Override
  public <R, C> R accept(PhysicalPlanVisitor<R, C> visitor, C context) {
    return visitor.visitFilter(this, context);
  }
}
