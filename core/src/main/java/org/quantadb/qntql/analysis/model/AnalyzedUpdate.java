/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.analysis.model;

import java.util.Map;
import org.quantadb.qntql.ast.expression.Expression;
import org.quantadb.qntql.catalog.model.RecordSchema;

/**
 * Update of matching records.
 *
 * @param condition resolved MATCH expression, null for every record
 */
public record AnalyzedUpdate(
    String bucket, RecordSchema record, Map<String, Object> values, Expression condition)
    implements AnalyzedStatement {

  @Override
  public <R, C> R accept(AnalyzedStatementVisitor<R, C> visitor, C context) {
    return visitor.visitUpdate(this, context);
  }
}
