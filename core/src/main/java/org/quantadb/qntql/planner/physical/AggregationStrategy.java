/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.physical;

public enum AggregationStrategy {
  /** Single accumulator per aggregate, no grouping. */
  STREAMING,
  /** Accumulators per group key; materializes the groups. */
  HASH
}
