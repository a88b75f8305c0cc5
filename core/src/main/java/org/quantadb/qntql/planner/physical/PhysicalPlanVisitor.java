/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.physical;

public interface PhysicalPlanVisitor<R, C> {

  R visitScan(PhysicalScan node, C context);

  R visitFilter(PhysicalFilter node, C context);

  R visitNavigate(PhysicalNavigate node, C context);

  R visitAggregate(PhysicalAggregate node, C context);

  R visitSort(PhysicalSort node, C context);

  R visitLimit(PhysicalLimit node, C context);

  R visitProject(PhysicalProject node, C context);
}
