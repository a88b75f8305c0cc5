/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.physical;

/** How the fragments of a physical node are scheduled. */
public enum ExecutionMode {
  /** No fragment waits on upstream keys. */
  PARALLEL,
  /** At least one fragment is keyed on an upstream result. */
  SEQUENTIAL
}
