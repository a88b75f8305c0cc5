/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.logical;

public interface LogicalPlanVisitor<R, C> {

  R visitScan(LogicalScan node, C context);

  R visitFilter(LogicalFilter node, C context);

  R visitNavigate(LogicalNavigate node, C context);

  R visitAggregate(LogicalAggregate node, C context);

  R visitSort(LogicalSort node, C context);

  R visitLimit(LogicalLimit node, C context);

  R visitProject(LogicalProject node, C context);
}
