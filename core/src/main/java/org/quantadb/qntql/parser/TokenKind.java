/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.parser;

import com.google.common.collect.ImmutableMap;
import java.util.Locale;
import java.util.Optional;

/** Kinds of QntQL tokens, grouped by lexical category. */
public enum TokenKind {
  // statement and clause keywords
  FIND(Category.KEYWORD),
  FROM(Category.KEYWORD),
  NAVIGATE(Category.KEYWORD),
  MATCH(Category.KEYWORD),
  GROUP(Category.KEYWORD),
  BY(Category.KEYWORD),
  HAVING(Category.KEYWORD),
  ORDER(Category.KEYWORD),
  ASC(Category.KEYWORD),
  DESC(Category.KEYWORD),
  LIMIT(Category.KEYWORD),
  OFFSET(Category.KEYWORD),
  AS(Category.KEYWORD),
  ADD(Category.KEYWORD),
  UPDATE(Category.KEYWORD),
  SET(Category.KEYWORD),
  REMOVE(Category.KEYWORD),
  CREATE(Category.KEYWORD),
  ALTER(Category.KEYWORD),
  RECORD(Category.KEYWORD),
  TO(Category.KEYWORD),
  PROPERTIES(Category.KEYWORD),
  INDEXED(Category.KEYWORD),
  BEGIN(Category.KEYWORD),
  TRANSACTION(Category.KEYWORD),
  COMMIT(Category.KEYWORD),
  ROLLBACK(Category.KEYWORD),
  EXPLAIN(Category.KEYWORD),
  AND(Category.KEYWORD),
  OR(Category.KEYWORD),
  NOT(Category.KEYWORD),
  IN(Category.KEYWORD),
  CONTAINS(Category.KEYWORD),
  IS(Category.KEYWORD),

  // storage classifications
  SCALAR(Category.CLASSIFICATION),
  DOCUMENT(Category.CLASSIFICATION),
  RELATION(Category.CLASSIFICATION),
  METRIC(Category.CLASSIFICATION),

  IDENTIFIER(Category.IDENTIFIER),

  STRING(Category.LITERAL),
  INTEGER(Category.LITERAL),
  DECIMAL(Category.LITERAL),
  DATETIME(Category.LITERAL),
  TRUE(Category.LITERAL),
  FALSE(Category.LITERAL),
  NULL(Category.LITERAL),

  EQ(Category.OPERATOR),
  NEQ(Category.OPERATOR),
  LT(Category.OPERATOR),
  LTE(Category.OPERATOR),
  GT(Category.OPERATOR),
  GTE(Category.OPERATOR),
  ARROW(Category.OPERATOR),
  STAR(Category.OPERATOR),

  LPAREN(Category.DELIMITER),
  RPAREN(Category.DELIMITER),
  LBRACE(Category.DELIMITER),
  RBRACE(Category.DELIMITER),
  LBRACKET(Category.DELIMITER),
  RBRACKET(Category.DELIMITER),
  COMMA(Category.DELIMITER),
  DOT(Category.DELIMITER),
  COLON(Category.DELIMITER),
  SEMICOLON(Category.DELIMITER),

  EOF(Category.DELIMITER);

  /** Lexical category of a token kind. */
  public enum Category {
    KEYWORD,
    CLASSIFICATION,
    IDENTIFIER,
    LITERAL,
    OPERATOR,
    DELIMITER
  }

  private static final ImmutableMap<String, TokenKind> RESERVED;

  static {
    ImmutableMap.Builder<String, TokenKind> reserved = ImmutableMap.builder();
    for (TokenKind kind : values()) {
      if (kind.category == Category.KEYWORD
          || kind.category == Category.CLASSIFICATION
          || kind == TRUE
          || kind == FALSE
          || kind == NULL) {
        reserved.put(kind.name(), kind);
      }
    }
    RESERVED = reserved.build();
  }

  private final Category category;

  TokenKind(Category category) {
    this.category = category;
  }

  public Category getCategory() {
    return category;
  }

  /** Reserved word for a case-insensitive identifier, if any. */
  public static Optional<TokenKind> reserved(String word) {
    return Optional.ofNullable(RESERVED.get(word.toUpperCase(Locale.ROOT)));
  }
}
