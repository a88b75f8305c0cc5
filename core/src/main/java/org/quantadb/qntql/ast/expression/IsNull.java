/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.ast.expression;

/** {@code operand IS [NOT] NULL}. */
public record IsNull(Expression operand, boolean negated) implements Expression {

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitIsNull(this, context);
  }
}
