/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.engines;

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
import org.quantadb.qntql.storage.StorageClassification;

/**
 * Decides whether an engine evaluates a predicate natively. Boolean connectives are pushable when
 * every operand is; leaves are decided by the hooks, which by default accept any operator on an
 * attribute the engine owns compared with a non-null scalar literal.
 */
public abstract class PredicateSupport implements ExpressionVisitor<Boolean, Void> {

  private final StorageClassification classification;

  protected PredicateSupport(StorageClassification classification) {
    this.classification = classification;
  }

  public boolean isPushable(Expression predicate) {
    return predicate != null && predicate.accept(this, null);
  }

  /** Whether the expression is an attribute stored by this engine. */
  protected boolean owns(Expression expression) {
    return expression instanceof ResolvedAttribute
        && ((ResolvedAttribute) expression).classification() == classification;
  }

  protected static boolean isScalarValue(Expression expression) {
    if (!(expression instanceof Literal)) {
      return false;
    }
    Literal.LiteralType type = ((Literal) expression).type();
    return type != Literal.LiteralType.NULL
        && type != Literal.LiteralType.OBJECT
        && type != Literal.LiteralType.ARRAY;
  }

  /** Comparison already normalized so that an attribute, if any, is on the left. */
  protected boolean supportsComparison(Comparison comparison) {
    return owns(comparison.left()) && isScalarValue(comparison.right());
  }

  protected boolean supportsIn(InList in) {
    return owns(in.operand())
        && !in.values().isEmpty()
        && in.values().stream().allMatch(PredicateSupport::isScalarValue);
  }

  protected boolean supportsContains(Contains contains) {
    return owns(contains.operand()) && isScalarValue(contains.value());
  }

  protected boolean supportsIsNull(IsNull isNull) {
    return owns(isNull.operand());
  }

  @Override
  public Boolean visitComparison(Comparison node, Void context) {
    return supportsComparison(node.normalized());
  }

  @Override
  public Boolean visitInList(InList node, Void context) {
    return supportsIn(node);
  }

  @Override
  public Boolean visitContains(Contains node, Void context) {
    return supportsContains(node);
  }

  @Override
  public Boolean visitIsNull(IsNull node, Void context) {
    return supportsIsNull(node);
  }

  @Override
  public Boolean visitAnd(And node, Void context) {
    return node.left().accept(this, context) && node.right().accept(this, context);
  }

  @Override
  public Boolean visitOr(Or node, Void context) {
    return node.left().accept(this, context) && node.right().accept(this, context);
  }

  @Override
  public Boolean visitNot(Not node, Void context) {
    return node.operand().accept(this, context);
  }

  @Override
  public Boolean visitAttributeRef(AttributeRef node, Void context) {
    return false;
  }

  @Override
  public Boolean visitResolvedAttribute(ResolvedAttribute node, Void context) {
    return false;
  }

  @Override
  public Boolean visitRecordRef(RecordRef node, Void context) {
    return false;
  }

  @Override
  public Boolean visitLiteral(Literal node, Void context) {
    return false;
  }

  @Override
  public Boolean visitAggregateCall(AggregateCall node, Void context) {
    return false;
  }
}
