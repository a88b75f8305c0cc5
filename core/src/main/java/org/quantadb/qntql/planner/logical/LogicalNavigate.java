/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.logical;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.quantadb.qntql.analysis.model.AnalyzedHop;
import org.quantadb.qntql.storage.StorageClassification;

/**
 * Join of the rows produced so far with the target record of one relation hop.
 *
 * @param source plan producing the rows the hop starts from
 * @param target scan of the hop's target record
 */
public record LogicalNavigate(
    LogicalPlan source,
    LogicalScan target,
    AnalyzedHop hop,
    TraversalDirection direction,
    double cardinality)
    implements LogicalPlan {

  @Override
  public Set<StorageClassification> getEngines() {
    Set<StorageClassification> engines = EnumSet.of(StorageClassification.RELATION);
    engines.addAll(source.getEngines());
    engines.addAll(target.getEngines());
    return engines;
  }

  public LogicalNavigate withDirection(TraversalDirection newDirection) {
    return new LogicalNavigate(source, target, hop, newDirection, cardinality);
  }

  @Override
  public List<LogicalPlan> getChildren() {
    return List.of(source, target);
  }

  @Override
  public LogicalPlan replaceChildren(List<LogicalPlan> children) {
    return new LogicalNavigate(
        children.get(0), (LogicalScan) children.get(1), hop, direction, cardinality);
  }

  @Override
  public LogicalPlan withCardinality(double newCardinality) {
    return new LogicalNavigate(source, target, hop, direction, newCardinality);
  }

  @Override
  public <R, C> R accept(LogicalPlanVisitor<R, C> visitor, C context) {
    return visitor.visitNavigate(this, context);
  }
}
