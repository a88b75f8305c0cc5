/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.ast.statement;

import org.quantadb.qntql.catalog.model.AttributeDefinition;
import org.quantadb.qntql.parser.Position;
import org.quantadb.qntql.storage.StorageClassification;

/**
 * {@code name: CLASS<hint> [INDEXED]} in a schema statement.
 *
 * @param hint datatype for scalars, target record for relations, unit for metrics
 */
public record AttributeSpec(
    String name,
    StorageClassification classification,
    String hint,
    boolean indexed,
    Position position) {

  public AttributeDefinition toDefinition() {
    switch (classification) {
      case SCALAR:
        return new AttributeDefinition(classification, hint, null, null, indexed);
      case RELATION:
        return new AttributeDefinition(classification, null, hint, null, indexed);
      case METRIC:
        return new AttributeDefinition(classification, null, null, hint, indexed);
      default:
        return new AttributeDefinition(classification, hint, null, null, indexed);
    }
  }
}
