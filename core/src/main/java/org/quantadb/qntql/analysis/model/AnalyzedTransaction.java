/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.analysis.model;

import java.util.List;

public record AnalyzedTransaction(List<AnalyzedStatement> statements, boolean commit)
    implements AnalyzedStatement {

  public AnalyzedTransaction {
    statements = List.copyOf(statements);
  }

  @Override
  public <R, C> R accept(AnalyzedStatementVisitor<R, C> visitor, C context) {
    return visitor.visitTransaction(this, context);
  }
}
