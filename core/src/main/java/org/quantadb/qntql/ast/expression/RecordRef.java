/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.ast.expression;

/** Whole record in scope, as in {@code COUNT(tasks)}. */
public record RecordRef(String alias, String record) implements Expression {

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitRecordRef(this, context);
  }
}
