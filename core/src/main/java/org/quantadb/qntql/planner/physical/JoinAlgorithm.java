/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.physical;

public enum JoinAlgorithm {
  HASH_JOIN,
  NESTED_LOOP
}
