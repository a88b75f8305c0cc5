/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.ast.expression;

import java.util.List;

/** {@code operand [NOT] IN (v1, v2, ...)}. */
public record InList(Expression operand, List<Literal> values, boolean negated)
    implements Expression {

  public InList {
    values = List.copyOf(values);
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitInList(this, context);
  }
}
