/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.analysis;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.quantadb.qntql.ast.expression.AggregateCall;
import org.quantadb.qntql.ast.expression.Comparison.Operator;
import org.quantadb.qntql.ast.expression.Expression;
import org.quantadb.qntql.ast.expression.Literal.LiteralType;
import org.quantadb.qntql.ast.expression.Literal;
import org.quantadb.qntql.ast.expression.ResolvedAttribute;
import org.quantadb.qntql.catalog.model.AttributeDefinition;
import org.quantadb.qntql.catalog.model.ScalarType;
import org.quantadb.qntql.common.utils.StringUtils;
import org.quantadb.qntql.exception.TypeMismatchException;
import org.quantadb.qntql.storage.StorageClassification;

/**
 * Checks literals and operators against attribute definitions. Literals compared with DATE and
 * TIMESTAMP attributes are coerced from strings; the coerced literal is returned.
 */
class TypeChecker {

  /** Checks {@code attribute operator literal} and returns the literal to use. */
  Literal checkComparison(ResolvedAttribute attribute, Operator operator, Literal literal) {
    String name = attribute.qualifiedName();
    if (literal.type() == LiteralType.NULL) {
      throw new TypeMismatchException(
          StringUtils.format("Use IS NULL to compare %s with null", name), name);
    }
    AttributeDefinition definition = attribute.definition();
    switch (definition.type()) {
      case DOCUMENT:
        return literal;
      case RELATION:
        if (operator != Operator.EQ && operator != Operator.NEQ) {
          throw mismatch(name, "relation", operator.getSymbol());
        }
        return requireKey(name, literal);
      case METRIC:
        if (!literal.type().isNumeric()) {
          throw mismatch(name, "metric", literal.type().name());
        }
        return literal;
      default:
        if (!attribute.path().isEmpty()) {
          return literal;
        }
        return checkScalar(name, definition.scalarType(), operator, literal);
    }
  }

  /** {@code attribute CONTAINS literal}. */
  Literal checkContains(ResolvedAttribute attribute, Literal literal) {
    String name = attribute.qualifiedName();
    switch (attribute.classification()) {
      case DOCUMENT:
        return literal;
      case RELATION:
        return requireKey(name, literal);
      case SCALAR:
        ScalarType type = attribute.definition().scalarType();
        if ((type == null || type.getFamily() == ScalarType.Family.TEXT)
            && literal.type() == LiteralType.STRING) {
          return literal;
        }
        throw mismatch(name, type == null ? "scalar" : type.name(), "CONTAINS " + literal.type());
      default:
        throw mismatch(name, "metric", "CONTAINS");
    }
  }

  /** Comparison between two attributes. */
  void checkComparable(ResolvedAttribute left, ResolvedAttribute right) {
    ScalarType leftType = left.definition().scalarType();
    ScalarType rightType = right.definition().scalarType();
    if (leftType == null || rightType == null) {
      return;
    }
    boolean compatible =
        leftType.getFamily() == rightType.getFamily()
            || (leftType.isNumeric() && rightType.isNumeric())
            || (leftType.isTemporal() && rightType.isTemporal());
    if (!compatible) {
      throw new TypeMismatchException(
          StringUtils.format(
              "Cannot compare %s (%s) with %s (%s)",
              left.qualifiedName(), leftType, right.qualifiedName(), rightType),
          left.qualifiedName());
    }
  }

  /** Argument of an aggregate function. */
  void checkAggregate(AggregateCall call) {
    Expression argument = call.argument();
    AggregateCall.Function function = call.function();
    if (function == AggregateCall.Function.COUNT) {
      return;
    }
    if (!(argument instanceof ResolvedAttribute)) {
      throw new TypeMismatchException(
          StringUtils.format("%s needs an attribute argument", function), call.canonicalName());
    }
    ResolvedAttribute attribute = (ResolvedAttribute) argument;
    StorageClassification classification = attribute.classification();
    if (classification == StorageClassification.METRIC) {
      return;
    }
    ScalarType type = attribute.definition().scalarType();
    boolean orderable = classification == StorageClassification.SCALAR;
    boolean numeric = orderable && (type == null || type.isNumeric());
    boolean accepted =
        function == AggregateCall.Function.SUM || function == AggregateCall.Function.AVG
            ? numeric
            : orderable;
    if (!accepted) {
      throw mismatch(
          attribute.qualifiedName(),
          type == null ? classification.getEngineName() : type.name(),
          function.name());
    }
  }

  /** Aggregate result compared with a literal in HAVING. */
  void checkAggregateComparison(AggregateCall call, Literal literal) {
    AggregateCall.Function function = call.function();
    if (function == AggregateCall.Function.MIN || function == AggregateCall.Function.MAX) {
      return;
    }
    if (!literal.type().isNumeric()) {
      throw mismatch(call.canonicalName(), "number", literal.type().name());
    }
  }

  /**
   * Converts a value written in ADD, UPDATE or CREATE RELATION to the attribute's type. Relation
   * values become key lists.
   */
  Object coerceValue(String name, AttributeDefinition definition, Object value) {
    if (value == null) {
      return null;
    }
    switch (definition.type()) {
      case DOCUMENT:
        return value;
      case RELATION:
        List<Object> keys = new ArrayList<>();
        if (value instanceof List) {
          for (Object key : (List<?>) value) {
            keys.add(requireKey(name, Literal.of(key)).value());
          }
        } else {
          keys.add(requireKey(name, Literal.of(value)).value());
        }
        return keys;
      case METRIC:
        if (value instanceof Number || value instanceof List || value instanceof Map) {
          return value;
        }
        throw mismatch(name, "metric", Literal.of(value).type().name());
      default:
        if (value instanceof Map || value instanceof List) {
          throw mismatch(name, "scalar", Literal.of(value).type().name());
        }
        return checkScalar(name, definition.scalarType(), Operator.EQ, Literal.of(value)).value();
    }
  }

  private Literal checkScalar(String name, ScalarType type, Operator operator, Literal literal) {
    if (literal.type() == LiteralType.OBJECT || literal.type() == LiteralType.ARRAY) {
      throw mismatch(name, type == null ? "scalar" : type.name(), literal.type().name());
    }
    if (type == null) {
      return literal;
    }
    switch (type.getFamily()) {
      case TEXT:
        if (literal.type() == LiteralType.STRING) {
          return literal;
        }
        break;
      case INTEGRAL:
      case FRACTIONAL:
        if (literal.type().isNumeric()) {
          return literal;
        }
        break;
      case BOOLEAN:
        if (literal.type() == LiteralType.BOOLEAN) {
          if (operator != Operator.EQ && operator != Operator.NEQ) {
            throw mismatch(name, type.name(), operator.getSymbol());
          }
          return literal;
        }
        break;
      case DATE:
        if (literal.type() == LiteralType.DATE) {
          return literal;
        }
        if (literal.type() == LiteralType.STRING) {
          try {
            return Literal.of(LocalDate.parse((String) literal.value()));
          } catch (DateTimeParseException e) {
            throw new TypeMismatchException(
                StringUtils.format("%s is not a valid date for %s", literal.value(), name), name);
          }
        }
        break;
      case TIMESTAMP:
        if (literal.type() == LiteralType.TIMESTAMP) {
          return literal;
        }
        if (literal.type() == LiteralType.DATE) {
          return Literal.of(((LocalDate) literal.value()).atStartOfDay().toInstant(ZoneOffset.UTC));
        }
        if (literal.type() == LiteralType.STRING) {
          return Literal.of(parseTimestamp(name, (String) literal.value()));
        }
        break;
      default:
        break;
    }
    throw mismatch(name, type.name(), literal.type().name());
  }

  private static Instant parseTimestamp(String name, String text) {
    try {
      if (text.length() == 10) {
        return LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC);
      }
      try {
        return OffsetDateTime.parse(text).toInstant();
      } catch (DateTimeParseException e) {
        return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
      }
    } catch (DateTimeParseException e) {
      throw new TypeMismatchException(
          StringUtils.format("%s is not a valid timestamp for %s", text, name), name);
    }
  }

  private static Literal requireKey(String name, Literal literal) {
    if (literal.type() == LiteralType.STRING || literal.type() == LiteralType.INTEGER) {
      return literal;
    }
    if (literal.type() == LiteralType.DECIMAL) {
      BigDecimal decimal = (BigDecimal) literal.value();
      if (decimal.stripTrailingZeros().scale() <= 0) {
        return Literal.of(decimal.longValueExact());
      }
    }
    throw mismatch(name, "record key", literal.type().name());
  }

  private static TypeMismatchException mismatch(String name, String expected, String found) {
    return new TypeMismatchException(
        StringUtils.format("Type mismatch on %s: %s does not accept %s", name, expected, found),
        name);
  }
}
