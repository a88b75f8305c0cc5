/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.ast.expression;

/**
 * {@code operand CONTAINS value}: substring match on text, element match on lists and relation
 * keys.
 */
public record Contains(Expression operand, Expression value) implements Expression {

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitContains(this, context);
  }
}
