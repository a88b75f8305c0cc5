/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.analysis.model;

/** Statement after name resolution and type checking. */
public sealed interface AnalyzedStatement
    permits AnalyzedQuery,
        AnalyzedAdd,
        AnalyzedUpdate,
        AnalyzedRemove,
        AnalyzedCreateRecord,
        AnalyzedAlterRecord,
        AnalyzedCreateRelation,
        AnalyzedTransaction,
        AnalyzedExplain {

  <R, C> R accept(AnalyzedStatementVisitor<R, C> visitor, C context);
}
