/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.executor.transaction;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Entry of the decision log.
 *
 * @param transactionId coordinator transaction id
 * @param outcome COMMIT once every backend prepared, COMPLETED once every backend committed
 * @param handles backend transaction id per engine name, needed to finish an in-doubt commit
 * @param timestamp epoch milliseconds
 */
public record TransactionDecision(
    @JsonProperty("txn") String transactionId,
    @JsonProperty("outcome") Outcome outcome,
    @JsonProperty("handles") Map<String, String> handles,
    @JsonProperty("ts") long timestamp) {

  public TransactionDecision {
    handles = handles == null ? Map.of() : Map.copyOf(handles);
  }

  public enum Outcome {
    COMMIT,
    COMPLETED
  }
}
