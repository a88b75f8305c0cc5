/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.analysis.model;

import org.quantadb.qntql.catalog.model.RecordSchema;

public record AnalyzedCreateRecord(String bucket, RecordSchema schema)
    implements AnalyzedStatement {

  @Override
  public <R, C> R accept(AnalyzedStatementVisitor<R, C> visitor, C context) {
    return visitor.visitCreateRecord(this, context);
  }
}
