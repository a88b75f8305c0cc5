/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.ast.statement;

import java.util.List;
import org.quantadb.qntql.ast.expression.Expression;

/** {@code NAVIGATE hop, ... [MATCH ...]}; returns every attribute of the last hop's target. */
public record NavigateStatement(
    List<NavigationHop> hops,
    Expression match,
    List<OrderItem> orderBy,
    Integer limit,
    Integer offset)
    implements Statement {

  public NavigateStatement {
    hops = List.copyOf(hops);
    orderBy = List.copyOf(orderBy);
  }

  @Override
  public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
    return visitor.visitNavigate(this, context);
  }
}
