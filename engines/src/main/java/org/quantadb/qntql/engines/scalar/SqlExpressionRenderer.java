/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.engines.scalar;

import static org.quantadb.qntql.engines.scalar.ScalarTranslator.quote;

import java.util.Locale;
import java.util.stream.Collectors;
import org.quantadb.qntql.ast.expression.AggregateCall;
import org.quantadb.qntql.ast.expression.And;
import org.quantadb.qntql.ast.expression.AttributeRef;
import org.quantadb.qntql.ast.expression.Comparison;
import org.quantadb.qntql.ast.expression.Contains;
import org.quantadb.qntql.ast.expression.ExpressionVisitor;
import org.quantadb.qntql.ast.expression.InList;
import org.quantadb.qntql.ast.expression.IsNull;
import org.quantadb.qntql.ast.expression.Literal;
import org.quantadb.qntql.ast.expression.Not;
import org.quantadb.qntql.ast.expression.Or;
import org.quantadb.qntql.ast.expression.RecordRef;
import org.quantadb.qntql.ast.expression.ResolvedAttribute;
import org.quantadb.qntql.engines.NamedParameters;

/**
 * Renders predicates, HAVING conditions and aggregate calls as PostgreSQL. Literal values become
 * named parameters ({@code :p1}). A negation is rendered as {@code (...) IS NOT TRUE}, so a
 * comparison against NULL counts as false before it is negated.
 */
class SqlExpressionRenderer implements ExpressionVisitor<String, NamedParameters> {

  static final SqlExpressionRenderer INSTANCE = new SqlExpressionRenderer();

  private static final char LIKE_ESCAPE = '\\';

  @Override
  public String visitResolvedAttribute(ResolvedAttribute node, NamedParameters parameters) {
    return quote(node.attribute());
  }

  @Override
  public String visitLiteral(Literal node, NamedParameters parameters) {
    return ":" + parameters.add(node.value());
  }

  @Override
  public String visitComparison(Comparison node, NamedParameters parameters) {
    String operator =
        node.operator() == Comparison.Operator.NEQ ? "<>" : node.operator().getSymbol();
    return node.left().accept(this, parameters)
        + " "
        + operator
        + " "
        + node.right().accept(this, parameters);
  }

  @Override
  public String visitInList(InList node, NamedParameters parameters) {
    return node.operand().accept(this, parameters)
        + (node.negated() ? " NOT IN (" : " IN (")
        + node.values().stream()
            .map(value -> value.accept(this, parameters))
            .collect(Collectors.joining(", "))
        + ")";
  }

  @Override
  public String visitContains(Contains node, NamedParameters parameters) {
    Object needle = ((Literal) node.value()).value();
    String pattern = "%" + escapeLike(String.valueOf(needle)) + "%";
    return node.operand().accept(this, parameters)
        + " LIKE :"
        + parameters.add(pattern)
        + " ESCAPE '"
        + LIKE_ESCAPE
        + "'";
  }

  @Override
  public String visitIsNull(IsNull node, NamedParameters parameters) {
    return node.operand().accept(this, parameters)
        + (node.negated() ? " IS NOT NULL" : " IS NULL");
  }

  @Override
  public String visitAnd(And node, NamedParameters parameters) {
    return "("
        + node.left().accept(this, parameters)
        + " AND "
        + node.right().accept(this, parameters)
        + ")";
  }

  @Override
  public String visitOr(Or node, NamedParameters parameters) {
    return "("
        + node.left().accept(this, parameters)
        + " OR "
        + node.right().accept(this, parameters)
        + ")";
  }

  @Override
  public String visitNot(Not node, NamedParameters parameters) {
    return "(" + node.operand().accept(this, parameters) + ") IS NOT TRUE";
  }

  @Override
  public String visitAggregateCall(AggregateCall node, NamedParameters parameters) {
    String function = node.function().name().toUpperCase(Locale.ROOT);
    if (node.argument() == null || node.argument() instanceof RecordRef) {
      return function + "(*)";
    }
    return function + "(" + node.argument().accept(this, parameters) + ")";
  }

  @Override
  public String visitAttributeRef(AttributeRef node, NamedParameters parameters) {
    throw unsupported(node.dotted());
  }

  @Override
  public String visitRecordRef(RecordRef node, NamedParameters parameters) {
    throw unsupported(node.alias());
  }

  /** Escapes the LIKE wildcards and the escape character itself. */
  static String escapeLike(String value) {
    StringBuilder escaped = new StringBuilder(value.length() + 8);
    for (char c : value.toCharArray()) {
      if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
        escaped.append(LIKE_ESCAPE);
      }
      escaped.append(c);
    }
    return escaped.toString();
  }

  private static IllegalStateException unsupported(String expression) {
    return new IllegalStateException("Cannot render " + expression + " as SQL");
  }
}
