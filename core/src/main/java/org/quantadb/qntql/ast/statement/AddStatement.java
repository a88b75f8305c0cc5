/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.ast.statement;

import java.util.Map;
import org.quantadb.qntql.parser.Position;

/** {@code ADD record {attr: value, ...}}. */
public record AddStatement(String record, Map<String, Object> values, Position position)
    implements Statement {

  @Override
  public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
    return visitor.visitAdd(this, context);
  }
}
