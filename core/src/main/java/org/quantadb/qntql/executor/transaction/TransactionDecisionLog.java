/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.executor.transaction;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Durable record of commit decisions. A transaction whose COMMIT entry has no matching COMPLETED
 * entry was decided but may not have reached every backend.
 */
public interface TransactionDecisionLog {

  void append(TransactionDecision decision);

  /** Every entry, oldest first. */
  List<TransactionDecision> readAll();

  /** COMMIT decisions without a COMPLETED entry. */
  default List<TransactionDecision> inDoubt() {
    Map<String, TransactionDecision> open = new LinkedHashMap<>();
    for (TransactionDecision decision : readAll()) {
      if (decision.outcome() == TransactionDecision.Outcome.COMMIT) {
        open.put(decision.transactionId(), decision);
      } else {
        open.remove(decision.transactionId());
      }
    }
    return new ArrayList<>(open.values());
  }
}
