/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.ast.statement;

import java.util.List;
import org.quantadb.qntql.ast.expression.AttributeRef;
import org.quantadb.qntql.ast.expression.Expression;

/**
 * {@code FIND ... [FROM r] [NAVIGATE ...] [MATCH ...] [GROUP BY ...] [HAVING ...] [ORDER BY ...]
 * [LIMIT n] [OFFSET n]}.
 *
 * @param from explicit primary record, null when omitted
 * @param match filter, null when omitted
 * @param having group filter, null when omitted
 * @param limit row limit, null when omitted
 * @param offset rows to skip, null when omitted
 */
public record FindStatement(
    List<Projection> projections,
    String from,
    List<NavigationHop> navigation,
    Expression match,
    List<AttributeRef> groupBy,
    Expression having,
    List<OrderItem> orderBy,
    Integer limit,
    Integer offset)
    implements Statement {

  public FindStatement {
    projections = List.copyOf(projections);
    navigation = List.copyOf(navigation);
    groupBy = List.copyOf(groupBy);
    orderBy = List.copyOf(orderBy);
  }

  @Override
  public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
    return visitor.visitFind(this, context);
  }
}
