/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.ast.statement;

import org.quantadb.qntql.parser.Position;

/**
 * {@code source -> relation:target [AS alias]}.
 *
 * @param source record name or alias the hop starts from
 * @param relation relation attribute of the source record
 * @param target record the relation points to
 * @param alias alias of the target in the statement, may be null
 */
public record NavigationHop(
    String source, String relation, String target, String alias, Position position) {

  /** Name the target is referred to by. */
  public String targetAlias() {
    return alias == null ? target : alias;
  }
}
