/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.parser;

/** Location of a token in the query text. Line and column are 1-based, offset is 0-based. */
public record Position(int offset, int line, int column) {

  public static final Position UNKNOWN = new Position(-1, 0, 0);

  @Override
  public String toString() {
    return "line " + line + ", column " + column;
  }
}
