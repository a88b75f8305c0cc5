/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.ast.statement;

import java.util.List;

/** {@code CREATE RECORD name (spec, ...)}. */
public record CreateRecordStatement(String record, List<AttributeSpec> attributes)
    implements Statement {

  public CreateRecordStatement {
    attributes = List.copyOf(attributes);
  }

  @Override
  public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
    return visitor.visitCreateRecord(this, context);
  }
}
