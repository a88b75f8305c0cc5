/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.executor.transaction;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import lombok.Getter;
import org.quantadb.qntql.storage.StorageClassification;
import org.quantadb.qntql.storage.TransactionHandle;

/** One cross-engine transaction: an id plus a sub-transaction handle per backend. */
public class Transaction {

  @Getter private final String id;

  private final Map<StorageClassification, TransactionHandle> handles;

  @Getter private volatile TransactionState state = TransactionState.ACTIVE;

  private final ReentrantLock lock = new ReentrantLock();

  Transaction(String id, Map<StorageClassification, TransactionHandle> handles) {
    this.id = id;
    this.handles = Collections.unmodifiableMap(new EnumMap<>(handles));
  }

  public Map<StorageClassification, TransactionHandle> getHandles() {
    return handles;
  }

  /** Backend transaction id to pass to the adapter of the given engine. */
  public String handleId(StorageClassification engine) {
    TransactionHandle handle = handles.get(engine);
    return handle == null ? null : handle.getId();
  }

  void setState(TransactionState state) {
    this.state = state;
  }

  ReentrantLock getLock() {
    return lock;
  }
}
