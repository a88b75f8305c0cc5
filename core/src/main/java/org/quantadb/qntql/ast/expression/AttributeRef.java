/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.ast.expression;

import java.util.List;
import org.quantadb.qntql.parser.Position;

/**
 * Unresolved dotted reference as written, e.g. {@code tasks.profile.city}.
 *
 * @param parts dot-separated segments
 * @param position where the reference starts
 */
public record AttributeRef(List<String> parts, Position position) implements Expression {

  public AttributeRef {
    parts = List.copyOf(parts);
  }

  public String dotted() {
    return String.join(".", parts);
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitAttributeRef(this, context);
  }
}
