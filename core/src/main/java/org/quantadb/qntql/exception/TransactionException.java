/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.exception;

import lombok.Getter;

/** Begin, prepare or commit failure of a cross-engine transaction. */
@Getter
public class TransactionException extends QueryEngineException {

  private final String transactionId;

  public TransactionException(String transactionId, String message) {
    super(message);
    this.transactionId = transactionId;
  }

  public TransactionException(String transactionId, String message, Throwable cause) {
    super(message, cause);
    this.transactionId = transactionId;
  }
}
