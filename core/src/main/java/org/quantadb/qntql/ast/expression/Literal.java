/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.ast.expression;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Constant value. Values are plain Java objects: {@link String}, {@link Long}, {@link BigDecimal},
 * {@link Boolean}, {@link LocalDate}, {@link Instant}, maps, lists, or null.
 */
public record Literal(Object value, LiteralType type) implements Expression {

  /** Type of a literal value. */
  public enum LiteralType {
    STRING,
    INTEGER,
    DECIMAL,
    BOOLEAN,
    DATE,
    TIMESTAMP,
    OBJECT,
    ARRAY,
    NULL;

    public boolean isNumeric() {
      return this == INTEGER || this == DECIMAL;
    }
  }

  public static final Literal NULL = new Literal(null, LiteralType.NULL);

  /** Literal for a value produced by the parser or read from a row. */
  public static Literal of(Object value) {
    if (value == null) {
      return NULL;
    } else if (value instanceof String) {
      return new Literal(value, LiteralType.STRING);
    } else if (value instanceof Long || value instanceof Integer) {
      return new Literal(((Number) value).longValue(), LiteralType.INTEGER);
    } else if (value instanceof BigDecimal) {
      return new Literal(value, LiteralType.DECIMAL);
    } else if (value instanceof Number) {
      return new Literal(new BigDecimal(value.toString()), LiteralType.DECIMAL);
    } else if (value instanceof Boolean) {
      return new Literal(value, LiteralType.BOOLEAN);
    } else if (value instanceof LocalDate) {
      return new Literal(value, LiteralType.DATE);
    } else if (value instanceof Instant) {
      return new Literal(value, LiteralType.TIMESTAMP);
    } else if (value instanceof Map) {
      return new Literal(value, LiteralType.OBJECT);
    } else if (value instanceof List) {
      return new Literal(value, LiteralType.ARRAY);
    }
    throw new IllegalArgumentException("Unsupported literal value: " + value.getClass());
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitLiteral(this, context);
  }
}
