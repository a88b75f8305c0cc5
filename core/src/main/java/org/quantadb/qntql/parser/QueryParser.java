/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.parser;

import org.quantadb.qntql.ast.statement.Statement;

/** Entry point turning query text into an AST. Stateless and thread-safe. */
public class QueryParser {

  /**
   * Lexes and parses one statement.
   *
   * @throws org.quantadb.qntql.exception.LexicalException on a bad character or literal
   * @throws org.quantadb.qntql.exception.SyntaxCheckException when the grammar does not match
   */
  public Statement parse(String query) {
    return new Parser(new Lexer(query).tokenize()).parse();
  }
}
