/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.logical;

import org.quantadb.qntql.ast.expression.Expression;

/**
 * Conjunct of a filter.
 *
 * @param clientSide evaluated by the result assembler after merge
 * @param reason why it is client-side, null until decided
 */
public record FilterPredicate(Expression expression, boolean clientSide, DeferralReason reason) {

  public static FilterPredicate undecided(Expression expression) {
    return new FilterPredicate(expression, false, null);
  }

  public static FilterPredicate deferred(Expression expression, DeferralReason reason) {
    return new FilterPredicate(expression, true, reason);
  }
}
