/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.physical;

import java.util.List;
import java.util.stream.Collectors;
import org.quantadb.qntql.catalog.model.RecordSchema;
import org.quantadb.qntql.common.utils.StringUtils;

/**
 * Reads one record of the query from every engine it touches.
 *
 * @param fragments one scan fragment per engine
 * @param keySources ids of the fragments whose key sets define which records exist: the drivers
 *     when there are any, otherwise the key engine's fragment
 */
public record PhysicalScan(
    String alias,
    RecordSchema record,
    List<EngineFragment> fragments,
    List<String> keySources,
    ExecutionMode mode,
    boolean materialized,
    double cardinality)
    implements PhysicalPlan {

  public PhysicalScan {
    fragments = List.copyOf(fragments);
    keySources = List.copyOf(keySources);
  }

  public PhysicalScan asMaterialized() {
    return new PhysicalScan(alias, record, fragments, keySources, mode, true, cardinality);
  }

  public List<EngineFragment> keySourceFragments() {
    return fragments.stream()
        .filter(fragment -> keySources.contains(fragment.id()))
        .collect(Collectors.toList());
  }

  @Override
  public List<PhysicalPlan> getChildren() {
    return List.of();
  }

  @Override
  public List<EngineFragment> getFragments() {
    return fragments;
  }

  @Override
  public String describe() {
    return StringUtils.format(
        "Scan %s:%s %s%s keys from %s",
        alias, record.getName(), mode, materialized ? " materialized" : "", keySources);
  }

  @Override
  public <R, C> R accept(PhysicalPlanVisitor<R, C> visitor, C context) {
    return visitor.visitScan(this, context);
  }
}
