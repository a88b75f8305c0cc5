/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.ast.statement;

import java.util.Map;
import org.quantadb.qntql.parser.Position;

/** {@code CREATE RELATION record.attribute FROM key TO key [PROPERTIES {...}]}. */
public record CreateRelationStatement(
    String record,
    String attribute,
    Object from,
    Object to,
    Map<String, Object> properties,
    Position position)
    implements Statement {

  @Override
  public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
    return visitor.visitCreateRelation(this, context);
  }
}
