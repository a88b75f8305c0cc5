/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.analysis;

import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.quantadb.qntql.analysis.model.RecordScope;
import org.quantadb.qntql.ast.expression.AggregateCall;
import org.quantadb.qntql.ast.expression.And;
import org.quantadb.qntql.ast.expression.AttributeRef;
import org.quantadb.qntql.ast.expression.Comparison;
import org.quantadb.qntql.ast.expression.Contains;
import org.quantadb.qntql.ast.expression.Expression;
import org.quantadb.qntql.ast.expression.ExpressionVisitor;
import org.quantadb.qntql.ast.expression.InList;
import org.quantadb.qntql.ast.expression.IsNull;
import org.quantadb.qntql.ast.expression.Literal;
import org.quantadb.qntql.ast.expression.Not;
import org.quantadb.qntql.ast.expression.Or;
import org.quantadb.qntql.ast.expression.RecordRef;
import org.quantadb.qntql.ast.expression.ResolvedAttribute;
import org.quantadb.qntql.catalog.model.AttributeDefinition;
import org.quantadb.qntql.catalog.model.Bucket;
import org.quantadb.qntql.catalog.model.RecordSchema;
import org.quantadb.qntql.common.utils.StringUtils;
import org.quantadb.qntql.exception.SchemaException;
import org.quantadb.qntql.exception.SyntaxCheckException;
import org.quantadb.qntql.exception.TypeMismatchException;
import org.quantadb.qntql.storage.StorageClassification;

/**
 * Resolves attribute references of one expression against a {@link RecordScope} and type-checks
 * the result.
 *
 * <p>A reference {@code a.b.c} binds to alias {@code a} when {@code a} is in scope, otherwise to
 * attribute {@code a} of the primary record. Segments after the attribute form a document path.
 */
@RequiredArgsConstructor
class ExpressionAnalyzer implements ExpressionVisitor<Expression, RecordScope> {

  private final Bucket bucket;

  private final TypeChecker typeChecker;

  /** Whether aggregate calls may appear. */
  private final boolean aggregatesAllowed;

  Expression analyze(Expression expression, RecordScope scope) {
    return expression == null ? null : expression.accept(this, scope);
  }

  /** Resolves a reference to an attribute; whole-record references are rejected. */
  ResolvedAttribute resolve(AttributeRef reference, RecordScope scope) {
    Expression resolved = visitAttributeRef(reference, scope);
    if (!(resolved instanceof ResolvedAttribute)) {
      throw new SchemaException(
          StringUtils.format("%s names a record, not an attribute", reference.dotted()),
          reference.dotted(),
          null);
    }
    return (ResolvedAttribute) resolved;
  }

  @Override
  public Expression visitAttributeRef(AttributeRef node, RecordScope scope) {
    List<String> parts = node.parts();
    String alias;
    int attributeIndex;
    if (scope.contains(parts.get(0))
        && (parts.size() > 1 || !scope.getPrimary().hasAttribute(parts.get(0)))) {
      if (parts.size() == 1) {
        return new RecordRef(parts.get(0), scope.get(parts.get(0)).getName());
      }
      alias = parts.get(0);
      attributeIndex = 1;
    } else {
      if (parts.size() > 1
          && bucket.getRecord(parts.get(0)).isPresent()
          && !scope.getPrimary().hasAttribute(parts.get(0))) {
        throw new SchemaException(
            StringUtils.format(
                "Record %s is not part of the query; add it with FROM or NAVIGATE", parts.get(0)),
            parts.get(0),
            null);
      }
      alias = scope.getPrimaryAlias();
      attributeIndex = 0;
    }
    RecordSchema schema = scope.get(alias);
    String attribute = parts.get(attributeIndex);
    AttributeDefinition definition =
        schema
            .getAttribute(attribute)
            .orElseThrow(
                () ->
                    new SchemaException(
                        StringUtils.format(
                            "Unknown attribute %s of record %s at %s",
                            attribute, schema.getName(), node.position()),
                        schema.getName(),
                        attribute));
    List<String> path = parts.subList(attributeIndex + 1, parts.size());
    if (!path.isEmpty() && definition.type() != StorageClassification.DOCUMENT) {
      throw new SchemaException(
          StringUtils.format(
              "Nested path %s is only allowed on document attributes, %s.%s is %s",
              node.dotted(), schema.getName(), attribute, definition.type().getEngineName()),
          schema.getName(),
          attribute);
    }
    return new ResolvedAttribute(alias, schema.getName(), attribute, path, definition);
  }

  @Override
  public Expression visitResolvedAttribute(ResolvedAttribute node, RecordScope scope) {
    return node;
  }

  @Override
  public Expression visitRecordRef(RecordRef node, RecordScope scope) {
    return node;
  }

  @Override
  public Expression visitLiteral(Literal node, RecordScope scope) {
    return node;
  }

  @Override
  public Expression visitComparison(Comparison node, RecordScope scope) {
    Comparison comparison =
        new Comparison(
                operand(node.left(), scope), node.operator(), operand(node.right(), scope))
            .normalized();
    Expression left = comparison.left();
    Expression right = comparison.right();
    if (left instanceof AggregateCall && right instanceof ResolvedAttribute) {
      comparison = new Comparison(right, comparison.operator().flip(), left);
      left = comparison.left();
      right = comparison.right();
    }
    if (left instanceof ResolvedAttribute && right instanceof Literal) {
      Literal literal =
          typeChecker.checkComparison(
              (ResolvedAttribute) left, comparison.operator(), (Literal) right);
      return new Comparison(left, comparison.operator(), literal);
    }
    if (left instanceof ResolvedAttribute && right instanceof ResolvedAttribute) {
      typeChecker.checkComparable((ResolvedAttribute) left, (ResolvedAttribute) right);
    } else if (left instanceof Literal && right instanceof AggregateCall) {
      comparison = new Comparison(right, comparison.operator().flip(), left);
      typeChecker.checkAggregateComparison((AggregateCall) right, (Literal) left);
    } else if (left instanceof AggregateCall && right instanceof Literal) {
      typeChecker.checkAggregateComparison((AggregateCall) left, (Literal) right);
    }
    return comparison;
  }

  @Override
  public Expression visitInList(InList node, RecordScope scope) {
    Expression operand = operand(node.operand(), scope);
    if (!(operand instanceof ResolvedAttribute)) {
      return new InList(operand, node.values(), node.negated());
    }
    List<Literal> values = new ArrayList<>();
    for (Literal value : node.values()) {
      values.add(
          typeChecker.checkComparison((ResolvedAttribute) operand, Comparison.Operator.EQ, value));
    }
    return new InList(operand, values, node.negated());
  }

  @Override
  public Expression visitContains(Contains node, RecordScope scope) {
    Expression operand = operand(node.operand(), scope);
    Expression value = operand(node.value(), scope);
    if (operand instanceof ResolvedAttribute && value instanceof Literal) {
      value = typeChecker.checkContains((ResolvedAttribute) operand, (Literal) value);
    } else if (!(operand instanceof ResolvedAttribute)) {
      throw new TypeMismatchException(
          "CONTAINS needs an attribute on its left side", String.valueOf(operand));
    }
    return new Contains(operand, value);
  }

  @Override
  public Expression visitIsNull(IsNull node, RecordScope scope) {
    return new IsNull(operand(node.operand(), scope), node.negated());
  }

  @Override
  public Expression visitAnd(And node, RecordScope scope) {
    return new And(node.left().accept(this, scope), node.right().accept(this, scope));
  }

  @Override
  public Expression visitOr(Or node, RecordScope scope) {
    return new Or(node.left().accept(this, scope), node.right().accept(this, scope));
  }

  @Override
  public Expression visitNot(Not node, RecordScope scope) {
    return new Not(node.operand().accept(this, scope));
  }

  @Override
  public Expression visitAggregateCall(AggregateCall node, RecordScope scope) {
    if (!aggregatesAllowed) {
      throw new SyntaxCheckException(
          node.position(), "Aggregate " + node.canonicalName() + " is not allowed here");
    }
    Expression argument = null;
    if (node.argument() != null) {
      argument = node.argument().accept(this, scope);
    }
    AggregateCall call = new AggregateCall(node.function(), argument, node.position());
    typeChecker.checkAggregate(call);
    return call;
  }

  private Expression operand(Expression operand, RecordScope scope) {
    Expression resolved = operand.accept(this, scope);
    if (resolved instanceof RecordRef) {
      throw new SchemaException(
          StringUtils.format("%s names a record, not an attribute", ((RecordRef) resolved).alias()),
          ((RecordRef) resolved).record(),
          null);
    }
    return resolved;
  }
}
