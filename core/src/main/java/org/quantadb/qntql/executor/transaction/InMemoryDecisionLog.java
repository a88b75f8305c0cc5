/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.executor.transaction;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Decision log that lives as long as the process. */
public class InMemoryDecisionLog implements TransactionDecisionLog {

  private final List<TransactionDecision> decisions = new CopyOnWriteArrayList<>();

  @Override
  public void append(TransactionDecision decision) {
    decisions.add(decision);
  }

  @Override
  public List<TransactionDecision> readAll() {
    return List.copyOf(decisions);
  }
}
