/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.physical;

/** Access path an engine fragment is expected to use. */
public enum ScanAlgorithm {
  /** A pushed predicate references an indexed attribute. */
  INDEX_SCAN,
  /** Lookup by a key set produced upstream. */
  KEY_LOOKUP,
  FULL_SCAN
}
