/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.analysis.model;

public interface AnalyzedStatementVisitor<R, C> {

  R visitQuery(AnalyzedQuery node, C context);

  R visitAdd(AnalyzedAdd node, C context);

  R visitUpdate(AnalyzedUpdate node, C context);

  R visitRemove(AnalyzedRemove node, C context);

  R visitCreateRecord(AnalyzedCreateRecord node, C context);

  R visitAlterRecord(AnalyzedAlterRecord node, C context);

  R visitCreateRelation(AnalyzedCreateRelation node, C context);

  R visitTransaction(AnalyzedTransaction node, C context);

  R visitExplain(AnalyzedExplain node, C context);
}
