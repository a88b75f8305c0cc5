/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.ast.statement;

/** Root of a parsed QntQL statement. The variant set is closed. */
public sealed interface Statement
    permits FindStatement,
        NavigateStatement,
        AddStatement,
        UpdateStatement,
        RemoveStatement,
        CreateRecordStatement,
        AlterRecordStatement,
        CreateRelationStatement,
        TransactionStatement,
        ExplainStatement {

  <R, C> R accept(StatementVisitor<R, C> visitor, C context);
}
