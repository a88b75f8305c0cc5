/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.ast.statement;

import java.util.List;

/** {@code ALTER RECORD name ADD spec, ...}. */
public record AlterRecordStatement(String record, List<AttributeSpec> attributes)
    implements Statement {

  public AlterRecordStatement {
    attributes = List.copyOf(attributes);
  }

  @Override
  public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
    return visitor.visitAlterRecord(this, context);
  }
}
