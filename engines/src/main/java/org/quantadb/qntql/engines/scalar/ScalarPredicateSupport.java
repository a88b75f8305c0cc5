/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.engines.scalar;

import org.quantadb.qntql.ast.expression.Comparison;
import org.quantadb.qntql.ast.expression.ResolvedAttribute;
import org.quantadb.qntql.engines.PredicateSupport;
import org.quantadb.qntql.storage.StorageClassification;

/** Everything on scalar attributes, including attribute-to-attribute comparisons in one record. */
class ScalarPredicateSupport extends PredicateSupport {

  ScalarPredicateSupport() {
    super(StorageClassification.SCALAR);
  }

  @Override
  protected boolean supportsComparison(Comparison comparison) {
    if (owns(comparison.left()) && owns(comparison.right())) {
      return ((ResolvedAttribute) comparison.left())
          .alias()
          .equals(((ResolvedAttribute) comparison.right()).alias());
    }
    return super.supportsComparison(comparison);
  }
}
