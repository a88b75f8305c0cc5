/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.physical;

public enum FragmentKind {
  /** Reads attributes of one record from one engine. */
  SCAN,
  /** Follows one relation attribute in the relation engine, returning edges. */
  TRAVERSE
}
