/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.ast.statement;

import java.util.List;
import org.quantadb.qntql.ast.expression.Expression;

/** {@code UPDATE record SET a = v, ... [MATCH ...]}. */
public record UpdateStatement(String record, List<Assignment> assignments, Expression match)
    implements Statement {

  public UpdateStatement {
    assignments = List.copyOf(assignments);
  }

  @Override
  public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
    return visitor.visitUpdate(this, context);
  }
}
