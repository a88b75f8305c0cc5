/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.ast.expression;

/**
 * Visitor that walks every child and returns {@link #defaultResult()} unless a subclass overrides
 * the variant it cares about.
 */
public abstract class AbstractExpressionVisitor<R, C> implements ExpressionVisitor<R, C> {

  protected R defaultResult() {
    return null;
  }

  protected R visitChildren(C context, Expression... children) {
    for (Expression child : children) {
      if (child != null) {
        child.accept(this, context);
      }
    }
    return defaultResult();
  }

  @Override
  public R visitAttributeRef(AttributeRef node, C context) {
    return defaultResult();
  }

  @Override
  public R visitResolvedAttribute(ResolvedAttribute node, C context) {
    return defaultResult();
  }

  @Override
  public R visitRecordRef(RecordRef node, C context) {
    return defaultResult();
  }

  @Override
  public R visitLiteral(Literal node, C context) {
    return defaultResult();
  }

  @Override
  public R visitComparison(Comparison node, C context) {
    return visitChildren(context, node.left(), node.right());
  }

  @Override
  public R visitInList(InList node, C context) {
    return visitChildren(context, node.operand());
  }

  @Override
  public R visitContains(Contains node, C context) {
    return visitChildren(context, node.operand(), node.value());
  }

  @Override
  public R visitIsNull(IsNull node, C context) {
    return visitChildren(context, node.operand());
  }

  @Override
  public R visitAnd(And node, C context) {
    return visitChildren(context, node.left(), node.right());
  }

  @Override
  public R visitOr(Or node, C context) {
    return visitChildren(context, node.left(), node.right());
  }

  @Override
  public R visitNot(Not node, C context) {
    return visitChildren(context, node.operand());
  }

  @Override
  public R visitAggregateCall(AggregateCall node, C context) {
    return visitChildren(context, node.argument());
  }
}
