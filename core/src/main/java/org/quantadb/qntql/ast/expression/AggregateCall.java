/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.ast.expression;

import java.util.Locale;
import org.quantadb.qntql.exception.SyntaxCheckException;
import org.quantadb.qntql.parser.Position;

/**
 * Aggregate function call.
 *
 * @param function aggregate function
 * @param argument attribute or record reference, null for {@code *}
 * @param position where the call starts
 */
public record AggregateCall(Function function, Expression argument, Position position)
    implements Expression {

  /** Supported aggregate functions. */
  public enum Function {
    COUNT,
    SUM,
    AVG,
    MIN,
    MAX;

    public static boolean isAggregate(String name) {
      for (Function function : values()) {
        if (function.name().equalsIgnoreCase(name)) {
          return true;
        }
      }
      return false;
    }

    public static Function of(String name, Position position) {
      if (!isAggregate(name)) {
        throw new SyntaxCheckException(position, "Unknown aggregate function " + name);
      }
      return valueOf(name.toUpperCase(Locale.ROOT));
    }
  }

  /**
   * Stable name of the aggregate, used as output column and to match HAVING and ORDER BY
   * occurrences, e.g. {@code avg(tasks.cpu)} or {@code count(*)}.
   */
  public String canonicalName() {
    String name = function.name().toLowerCase(Locale.ROOT);
    if (argument == null) {
      return name + "(*)";
    } else if (argument instanceof ResolvedAttribute) {
      return name + "(" + ((ResolvedAttribute) argument).qualifiedName() + ")";
    } else if (argument instanceof RecordRef) {
      return name + "(" + ((RecordRef) argument).alias() + ")";
    } else if (argument instanceof AttributeRef) {
      return name + "(" + ((AttributeRef) argument).dotted() + ")";
    }
    return name + "(" + argument + ")";
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitAggregateCall(this, context);
  }
}
