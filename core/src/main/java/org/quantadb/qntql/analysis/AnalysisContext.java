/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.analysis;

import org.quantadb.qntql.catalog.model.Bucket;

/**
 * State of one analysis.
 *
 * @param bucket bucket the statement runs against
 * @param inTransaction whether the statement is nested in BEGIN ... COMMIT
 */
public record AnalysisContext(Bucket bucket, boolean inTransaction) {

  AnalysisContext nested() {
    return new AnalysisContext(bucket, true);
  }
}
