/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.engines.document;

import org.quantadb.qntql.engines.PredicateSupport;
import org.quantadb.qntql.storage.StorageClassification;

/** Scalar capabilities without attribute-to-attribute comparison. */
class DocumentPredicateSupport extends PredicateSupport {

  DocumentPredicateSupport() {
    super(StorageClassification.DOCUMENT);
  }
}
