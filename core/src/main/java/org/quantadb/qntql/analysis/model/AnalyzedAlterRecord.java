/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.analysis.model;

import java.util.Map;
import org.quantadb.qntql.catalog.model.AttributeDefinition;

/** Additive evolution; attributes keep their declaration order. */
public record AnalyzedAlterRecord(
    String bucket, String record, Map<String, AttributeDefinition> additions)
    implements AnalyzedStatement {

  @Override
  public <R, C> R accept(AnalyzedStatementVisitor<R, C> visitor, C context) {
    return visitor.visitAlterRecord(this, context);
  }
}
