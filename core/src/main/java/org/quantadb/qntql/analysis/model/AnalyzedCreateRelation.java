/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.analysis.model;

import java.util.Map;
import org.quantadb.qntql.catalog.model.RecordSchema;

/** Edge from one record key to a target key along a relation attribute. */
public record AnalyzedCreateRelation(
    String bucket,
    RecordSchema record,
    String attribute,
    Object from,
    Object to,
    Map<String, Object> properties)
    implements AnalyzedStatement {

  @Override
  public <R, C> R accept(AnalyzedStatementVisitor<R, C> visitor, C context) {
    return visitor.visitCreateRelation(this, context);
  }
}
