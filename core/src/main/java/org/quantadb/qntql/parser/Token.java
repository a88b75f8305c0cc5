/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.parser;

/**
 * One lexical token.
 *
 * @param kind token kind
 * @param lexeme source text of the token; the unescaped content for string literals
 * @param position where the token starts
 */
public record Token(TokenKind kind, String lexeme, Position position) {

  public boolean is(TokenKind other) {
    return kind == other;
  }

  /** Text used in error messages. */
  public String describe() {
    return kind == TokenKind.EOF ? "end of input" : lexeme;
  }
}
