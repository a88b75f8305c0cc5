/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.ast.expression;

/**
 * Expression node. The variant set is closed; consumers handle every variant through {@link
 * ExpressionVisitor}.
 */
public sealed interface Expression
    permits AttributeRef,
        ResolvedAttribute,
        RecordRef,
        Literal,
        Comparison,
        InList,
        Contains,
        IsNull,
        And,
        Or,
        Not,
        AggregateCall {

  <R, C> R accept(ExpressionVisitor<R, C> visitor, C context);
}
