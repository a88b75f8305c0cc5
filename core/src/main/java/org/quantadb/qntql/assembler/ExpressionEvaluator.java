/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.assembler;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import org.quantadb.qntql.ast.expression.AggregateCall;
import org.quantadb.qntql.ast.expression.And;
import org.quantadb.qntql.ast.expression.AttributeRef;
import org.quantadb.qntql.ast.expression.Comparison;
import org.quantadb.qntql.ast.expression.Contains;
import org.quantadb.qntql.ast.expression.Expression;
import org.quantadb.qntql.ast.expression.ExpressionVisitor;
import org.quantadb.qntql.ast.expression.Expressions;
import org.quantadb.qntql.ast.expression.InList;
import org.quantadb.qntql.ast.expression.IsNull;
import org.quantadb.qntql.ast.expression.Literal;
import org.quantadb.qntql.ast.expression.Not;
import org.quantadb.qntql.ast.expression.Or;
import org.quantadb.qntql.ast.expression.RecordRef;
import org.quantadb.qntql.ast.expression.ResolvedAttribute;

/**
 * Evaluates resolved expressions against a {@link Tuple}.
 *
 * <p>A comparison with a null operand is false, as is every comparison the values cannot
 * satisfy; {@code NOT} negates that result. A collection operand (relation keys, document arrays)
 * matches when any element does, except {@code !=}, which requires that no element is equal.
 */
public class ExpressionEvaluator implements ExpressionVisitor<Object, Tuple> {

  public static final ExpressionEvaluator INSTANCE = new ExpressionEvaluator();

  public Object evaluate(Expression expression, Tuple tuple) {
    return expression.accept(this, tuple);
  }

  /** Whether the predicate holds for the tuple. */
  public boolean test(Expression predicate, Tuple tuple) {
    return Boolean.TRUE.equals(evaluate(predicate, tuple));
  }

  @Override
  public Object visitAttributeRef(AttributeRef node, Tuple context) {
    throw new IllegalStateException("Unresolved attribute reaches evaluation: " + node.dotted());
  }

  @Override
  public Object visitResolvedAttribute(ResolvedAttribute node, Tuple context) {
    Map<String, Object> record = context.record(node.alias());
    if (record == null) {
      return null;
    }
    Object value = record.get(node.attribute());
    for (String segment : node.path()) {
      if (!(value instanceof Map)) {
        return null;
      }
      value = ((Map<?, ?>) value).get(segment);
    }
    return value;
  }

  @Override
  public Object visitRecordRef(RecordRef node, Tuple context) {
    return context.record(node.alias());
  }

  @Override
  public Object visitLiteral(Literal node, Tuple context) {
    return node.value();
  }

  @Override
  public Object visitComparison(Comparison node, Tuple context) {
    Object left = node.left().accept(this, context);
    Object right = node.right().accept(this, context);
    if (left == null || right == null) {
      return false;
    }
    Comparison.Operator operator = node.operator();
    if (left instanceof Collection && !(right instanceof Collection)) {
      return matchAny((Collection<?>) left, right, operator);
    }
    if (right instanceof Collection && !(left instanceof Collection)) {
      return matchAny((Collection<?>) right, left, operator.flip());
    }
    return compare(left, right, operator);
  }

  @Override
  public Object visitInList(InList node, Tuple context) {
    Object value = node.operand().accept(this, context);
    if (value == null) {
      return false;
    }
    boolean found = false;
    for (Literal candidate : node.values()) {
      if (value instanceof Collection) {
        found = ((Collection<?>) value).stream().anyMatch(e -> equal(e, candidate.value()));
      } else {
        found = equal(value, candidate.value());
      }
      if (found) {
        break;
      }
    }
    return node.negated() != found;
  }

  @Override
  public Object visitContains(Contains node, Tuple context) {
    Object haystack = node.operand().accept(this, context);
    Object needle = node.value().accept(this, context);
    if (haystack == null || needle == null) {
      return false;
    }
    if (haystack instanceof Collection) {
      return ((Collection<?>) haystack).stream().anyMatch(element -> equal(element, needle));
    }
    if (haystack instanceof Map) {
      return ((Map<?, ?>) haystack).containsKey(String.valueOf(needle));
    }
    return haystack.toString().contains(needle.toString());
  }

  @Override
  public Object visitIsNull(IsNull node, Tuple context) {
    Object value = node.operand().accept(this, context);
    boolean isNull =
        value == null || (value instanceof Collection && ((Collection<?>) value).isEmpty());
    return node.negated() != isNull;
  }

  @Override
  public Object visitAnd(And node, Tuple context) {
    return test(node.left(), context) && test(node.right(), context);
  }

  @Override
  public Object visitOr(Or node, Tuple context) {
    return test(node.left(), context) || test(node.right(), context);
  }

  @Override
  public Object visitNot(Not node, Tuple context) {
    return !test(node.operand(), context);
  }

  @Override
  public Object visitAggregateCall(AggregateCall node, Tuple context) {
    Map<String, Object> aggregates = context.getAggregates();
    if (!aggregates.containsKey(node.canonicalName())) {
      throw new IllegalStateException(
          "Aggregate " + Expressions.describe(node) + " was not computed for this row");
    }
    return aggregates.get(node.canonicalName());
  }

  private static boolean matchAny(
      Collection<?> values, Object operand, Comparison.Operator operator) {
    if (operator == Comparison.Operator.NEQ) {
      return values.stream().noneMatch(value -> equal(value, operand));
    }
    return values.stream()
        .anyMatch(value -> value != null && compare(value, operand, operator));
  }

  private static boolean compare(Object left, Object right, Comparison.Operator operator) {
    switch (operator) {
      case EQ:
        return equal(left, right);
      case NEQ:
        return !equal(left, right);
      default:
        return operator.test(ValueComparator.INSTANCE.compare(left, right));
    }
  }

  private static boolean equal(Object left, Object right) {
    if (left instanceof Map || left instanceof List) {
      return ValueNormalizer.normalizeGeneric(left).equals(ValueNormalizer.normalizeGeneric(right));
    }
    return ValueComparator.equal(left, right);
  }
}
