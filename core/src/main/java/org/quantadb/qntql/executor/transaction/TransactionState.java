/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.executor.transaction;

/**
 * Lifecycle of a cross-engine transaction. ACTIVE moves to PREPARING on commit, then to COMMITTED,
 * or through ABORTING to ROLLED_BACK when a backend refuses to prepare.
 */
public enum TransactionState {
  ACTIVE,
  PREPARING,
  ABORTING,
  ROLLED_BACK,
  COMMITTED;

  public boolean isTerminal() {
    return this == ROLLED_BACK || this == COMMITTED;
  }
}
