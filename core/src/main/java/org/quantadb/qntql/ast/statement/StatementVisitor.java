/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.ast.statement;

/**
 * Visitor over {@link Statement} variants.
 *
 * @param <R> return type
 * @param <C> context type
 */
public interface StatementVisitor<R, C> {

  R visitFind(FindStatement node, C context);

  R visitNavigate(NavigateStatement node, C context);

  R visitAdd(AddStatement node, C context);

  R visitUpdate(UpdateStatement node, C context);

  R visitRemove(RemoveStatement node, C context);

  R visitCreateRecord(CreateRecordStatement node, C context);

  R visitAlterRecord(AlterRecordStatement node, C context);

  R visitCreateRelation(CreateRelationStatement node, C context);

  R visitTransaction(TransactionStatement node, C context);

  R visitExplain(ExplainStatement node, C context);
}
