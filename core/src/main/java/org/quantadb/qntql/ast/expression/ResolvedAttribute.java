/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.ast.expression;

import java.util.List;
import org.quantadb.qntql.catalog.model.AttributeDefinition;
import org.quantadb.qntql.storage.StorageClassification;

/**
 * Attribute reference bound to a record in scope. The definition's classification is the routing
 * annotation every later stage uses.
 *
 * @param alias alias of the record in the statement
 * @param record record name
 * @param attribute attribute name
 * @param path nested document path below the attribute, empty otherwise
 * @param definition attribute definition from the schema
 */
public record ResolvedAttribute(
    String alias,
    String record,
    String attribute,
    List<String> path,
    AttributeDefinition definition)
    implements Expression {

  public ResolvedAttribute {
    path = List.copyOf(path);
  }

  public StorageClassification classification() {
    return definition.type();
  }

  /** Attribute name with its document path, e.g. {@code profile.city}. */
  public String column() {
    return path.isEmpty() ? attribute : attribute + "." + String.join(".", path);
  }

  /** {@code alias.attribute[.path]}. */
  public String qualifiedName() {
    return alias + "." + column();
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitResolvedAttribute(this, context);
  }
}
