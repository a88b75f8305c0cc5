/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.logical;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.quantadb.qntql.ast.expression.Expression;
import org.quantadb.qntql.ast.expression.Expressions;
import org.quantadb.qntql.catalog.model.RecordSchema;
import org.quantadb.qntql.storage.StorageClassification;

/**
 * Read of one record in scope.
 *
 * @param alias alias of the record in the query
 * @param attributes attributes the scan must return; the key is always among them
 * @param predicates conjuncts pushed into the owning engines
 * @param pushdown ordering or aggregation done by the engine, null for none
 */
public record LogicalScan(
    String alias,
    RecordSchema record,
    Set<String> attributes,
    List<Expression> predicates,
    EnginePushdown pushdown,
    double cardinality)
    implements LogicalPlan {

  public LogicalScan {
    attributes = Collections.unmodifiableSet(new LinkedHashSet<>(attributes));
    predicates = List.copyOf(predicates);
  }

  /**
   * Engines of the attributes, the key included, plus the engines of pushed predicates. The key
   * engine is always among them.
   */
  @Override
  public Set<StorageClassification> getEngines() {
    Set<StorageClassification> engines = EnumSet.of(record.getKeyEngine());
    for (String attribute : attributes) {
      engines.add(record.getAttributes().get(attribute).type());
    }
    predicates.forEach(predicate -> engines.addAll(Expressions.engines(predicate)));
    return engines;
  }

  public LogicalScan withPredicates(List<Expression> newPredicates) {
    return new LogicalScan(alias, record, attributes, newPredicates, pushdown, cardinality);
  }

  public LogicalScan withAttributes(Set<String> newAttributes) {
    return new LogicalScan(alias, record, newAttributes, predicates, pushdown, cardinality);
  }

  public LogicalScan withPushdown(EnginePushdown newPushdown) {
    return new LogicalScan(alias, record, attributes, predicates, newPushdown, cardinality);
  }

  @Override
  public List<LogicalPlan> getChildren() {
    return List.of();
  }

  @Override
  public LogicalPlan replaceChildren(List<LogicalPlan> children) {
    return this;
  }

  @Override
  public LogicalScan withCardinality(double newCardinality) {
    return new LogicalScan(alias, record, attributes, predicates, pushdown, newCardinality);
  }

  @Override
  public <R, C> R accept(LogicalPlanVisitor<R, C> visitor, C context) {
    return visitor.visitScan(this, context);
  }
}
