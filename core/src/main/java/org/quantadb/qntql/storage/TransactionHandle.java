/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.storage;

/** Backend handle of a sub-transaction, returned by {@link StorageAdapter#beginTransaction}. */
public interface TransactionHandle {

  /** Identifier passed back to the backend as {@code txnId} on reads and writes. */
  String getId();
}
