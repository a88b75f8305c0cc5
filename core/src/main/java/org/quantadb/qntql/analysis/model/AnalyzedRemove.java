/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.analysis.model;

import org.quantadb.qntql.ast.expression.Expression;
import org.quantadb.qntql.catalog.model.RecordSchema;

/** Deletion of matching records from every engine the record uses. */
public record AnalyzedRemove(String bucket, RecordSchema record, Expression condition)
    implements AnalyzedStatement {

  @Override
  public <R, C> R accept(AnalyzedStatementVisitor<R, C> visitor, C context) {
    return visitor.visitRemove(this, context);
  }
}
