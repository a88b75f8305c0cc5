/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.exception;

import lombok.Getter;

/** Statement exceeded its configured time budget. */
@Getter
public class QueryTimeoutException extends QueryEngineException {

  private final long timeoutMillis;

  public QueryTimeoutException(long timeoutMillis) {
    super("Query exceeded timeout of " + timeoutMillis + " ms");
    this.timeoutMillis = timeoutMillis;
  }
}
