/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.ast.statement;

import org.quantadb.qntql.ast.expression.Expression;

/** {@code REMOVE record [MATCH ...]}. */
public record RemoveStatement(String record, Expression match) implements Statement {

  @Override
  public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
    return visitor.visitRemove(this, context);
  }
}
