/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.ast.expression;

/** Binary comparison. */
public record Comparison(Expression left, Operator operator, Expression right)
    implements Expression {

  /** Comparison operators. */
  public enum Operator {
    EQ("="),
    NEQ("!="),
    LT("<"),
    LTE("<="),
    GT(">"),
    GTE(">=");

    private final String symbol;

    Operator(String symbol) {
      this.symbol = symbol;
    }

    public String getSymbol() {
      return symbol;
    }

    /** Operator with operands swapped, so {@code 5 < a} becomes {@code a > 5}. */
    public Operator flip() {
      switch (this) {
        case LT:
          return GT;
        case LTE:
          return GTE;
        case GT:
          return LT;
        case GTE:
          return LTE;
        default:
          return this;
      }
    }

    /** Whether a three-way comparison result satisfies this operator. */
    public boolean test(int compared) {
      switch (this) {
        case EQ:
          return compared == 0;
        case NEQ:
          return compared != 0;
        case LT:
          return compared < 0;
        case LTE:
          return compared <= 0;
        case GT:
          return compared > 0;
        default:
          return compared >= 0;
      }
    }
  }

  /** Copy with the attribute (if any) moved to the left. */
  public Comparison normalized() {
    if (!(left instanceof ResolvedAttribute) && right instanceof ResolvedAttribute) {
      return new Comparison(right, operator.flip(), left);
    }
    return this;
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitComparison(this, context);
  }
}
