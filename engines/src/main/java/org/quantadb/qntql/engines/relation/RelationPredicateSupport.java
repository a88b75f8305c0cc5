/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.engines.relation;

import org.quantadb.qntql.ast.expression.Comparison;
import org.quantadb.qntql.engines.PredicateSupport;
import org.quantadb.qntql.storage.StorageClassification;

/** Equality, membership and existence tests on relation attributes. */
class RelationPredicateSupport extends PredicateSupport {

  RelationPredicateSupport() {
    super(StorageClassification.RELATION);
  }

  @Override
  protected boolean supportsComparison(Comparison comparison) {
    return (comparison.operator() == Comparison.Operator.EQ
            || comparison.operator() == Comparison.Operator.NEQ)
        && super.supportsComparison(comparison);
  }
}
