/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.analysis.model;

public record AnalyzedExplain(AnalyzedQuery query) implements AnalyzedStatement {

  @Override
  public <R, C> R accept(AnalyzedStatementVisitor<R, C> visitor, C context) {
    return visitor.visitExplain(this, context);
  }
}
