/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.ast.expression;

/**
 * Visitor over {@link Expression} variants.
 *
 * @param <R> return type
 * @param <C> context type
 */
public interface ExpressionVisitor<R, C> {

  R visitAttributeRef(AttributeRef node, C context);

  R visitResolvedAttribute(ResolvedAttribute node, C context);

  R visitRecordRef(RecordRef node, C context);

  R visitLiteral(Literal node, C context);

  R visitComparison(Comparison node, C context);

  R visitInList(InList node, C context);

  R visitContains(Contains node, C context);

  R visitIsNull(IsNull node, C context);

  R visitAnd(And node, C context);

  R visitOr(Or node, C context);

  R visitNot(Not node, C context);

  R visitAggregateCall(AggregateCall node, C context);
}
