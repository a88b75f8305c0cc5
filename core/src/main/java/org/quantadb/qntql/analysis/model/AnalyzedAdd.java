/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.analysis.model;

import java.util.Map;
import org.quantadb.qntql.catalog.model.RecordSchema;

/** Insert of one record; values are coerced to their attribute types. */
public record AnalyzedAdd(String bucket, RecordSchema record, Map<String, Object> values)
    implements AnalyzedStatement {

  public Object key() {
    return values.get(record.getKeyAttribute());
  }

  @Override
  public <R, C> R accept(AnalyzedStatementVisitor<R, C> visitor, C context) {
    return visitor.visitAdd(this, context);
  }
}
