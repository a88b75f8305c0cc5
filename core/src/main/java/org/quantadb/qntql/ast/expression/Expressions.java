/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.ast.expression;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.quantadb.qntql.storage.StorageClassification;

/** Static helpers over expression trees. */
public final class Expressions {

  private Expressions() {}

  /** Top-level AND operands, left to right. A null expression has none. */
  public static List<Expression> conjuncts(Expression expression) {
    List<Expression> result = new ArrayList<>();
    collectConjuncts(expression, result);
    return result;
  }

  private static void collectConjuncts(Expression expression, List<Expression> result) {
    if (expression == null) {
      return;
    }
    if (expression instanceof And) {
      collectConjuncts(((And) expression).left(), result);
      collectConjuncts(((And) expression).right(), result);
    } else {
      result.add(expression);
    }
  }

  /** Left-deep AND of the given expressions, null when empty. */
  public static Expression conjunction(List<Expression> expressions) {
    Expression result = null;
    for (Expression expression : expressions) {
      result = result == null ? expression : new And(result, expression);
    }
    return result;
  }

  /** Every resolved attribute below the expression, including aggregate arguments. */
  public static List<ResolvedAttribute> attributes(Expression expression) {
    List<ResolvedAttribute> result = new ArrayList<>();
    if (expression != null) {
      expression.accept(
          new AbstractExpressionVisitor<Void, Void>() {
            @Override
            public Void visitResolvedAttribute(ResolvedAttribute node, Void context) {
              result.add(node);
              return null;
            }
          },
          null);
    }
    return result;
  }

  /** Aggregate calls below the expression, in order of appearance. */
  public static List<AggregateCall> aggregates(Expression expression) {
    List<AggregateCall> result = new ArrayList<>();
    if (expression != null) {
      expression.accept(
          new AbstractExpressionVisitor<Void, Void>() {
            @Override
            public Void visitAggregateCall(AggregateCall node, Void context) {
              result.add(node);
              return null;
            }
          },
          null);
    }
    return result;
  }

  /** Record aliases referenced by the expression. */
  public static Set<String> aliases(Expression expression) {
    Set<String> aliases = new LinkedHashSet<>();
    attributes(expression).forEach(attribute -> aliases.add(attribute.alias()));
    if (expression != null) {
      expression.accept(
          new AbstractExpressionVisitor<Void, Void>() {
            @Override
            public Void visitRecordRef(RecordRef node, Void context) {
              aliases.add(node.alias());
              return null;
            }
          },
          null);
    }
    return aliases;
  }

  /** Storage engines owning the attributes the expression references. */
  public static Set<StorageClassification> engines(Expression expression) {
    return attributes(expression).stream()
        .map(ResolvedAttribute::classification)
        .collect(Collectors.toCollection(() -> EnumSet.noneOf(StorageClassification.class)));
  }

  /** Readable rendering used by EXPLAIN and error messages. */
  public static String describe(Expression expression) {
    return expression == null ? "" : expression.accept(new Describer(), null);
  }

  private static class Describer implements ExpressionVisitor<String, Void> {

    @Override
    public String visitAttributeRef(AttributeRef node, Void context) {
      return node.dotted();
    }

    @Override
    public String visitResolvedAttribute(ResolvedAttribute node, Void context) {
      return node.qualifiedName();
    }

    @Override
    public String visitRecordRef(RecordRef node, Void context) {
      return node.alias();
    }

    @Override
    public String visitLiteral(Literal node, Void context) {
      Object value = node.value();
      if (value instanceof String || value instanceof LocalDate || value instanceof Instant) {
        return "\"" + value + "\"";
      }
      return String.valueOf(value);
    }

    @Override
    public String visitComparison(Comparison node, Void context) {
      return node.left().accept(this, context)
          + " "
          + node.operator().getSymbol()
          + " "
          + node.right().accept(this, context);
    }

    @Override
    public String visitInList(InList node, Void context) {
      return node.operand().accept(this, context)
          + (node.negated() ? " NOT IN (" : " IN (")
          + node.values().stream()
              .map(value -> value.accept(this, context))
              .collect(Collectors.joining(", "))
          + ")";
    }

    @Override
    public String visitContains(Contains node, Void context) {
      return node.operand().accept(this, context)
          + " CONTAINS "
          + node.value().accept(this, context);
    }

    @Override
    public String visitIsNull(IsNull node, Void context) {
      return node.operand().accept(this, context) + (node.negated() ? " IS NOT NULL" : " IS NULL");
    }

    @Override
    public String visitAnd(And node, Void context) {
      return "(" + node.left().accept(this, context) + " AND " + node.right().accept(this, context)
          + ")";
    }

    @Override
    public String visitOr(Or node, Void context) {
      return "(" + node.left().accept(this, context) + " OR " + node.right().accept(this, context)
          + ")";
    }

    @Override
    public String visitNot(Not node, Void context) {
      return "NOT " + node.operand().accept(this, context);
    }

    @Override
    public String visitAggregateCall(AggregateCall node, Void context) {
      return node.canonicalName();
    }
  }
}
