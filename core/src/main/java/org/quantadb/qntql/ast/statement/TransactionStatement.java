/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.ast.statement;

import java.util.List;

/**
 * {@code BEGIN ... COMMIT|ROLLBACK}.
 *
 * @param commit true to commit at the end, false to roll back
 */
public record TransactionStatement(List<Statement> statements, boolean commit)
    implements Statement {

  public TransactionStatement {
    statements = List.copyOf(statements);
  }

  @Override
  public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
    return visitor.visitTransaction(this, context);
  }
}
