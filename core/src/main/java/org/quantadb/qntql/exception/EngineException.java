/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.exception;

import lombok.Getter;
import org.quantadb.qntql.storage.StorageClassification;

/** Failure raised by, or while talking to, one storage backend. */
@Getter
public class EngineException extends QueryEngineException {

  private final StorageClassification engine;

  public EngineException(StorageClassification engine, String message) {
    super("[" + engine.getEngineName() + "] " + message);
    this.engine = engine;
  }

  public EngineException(StorageClassification engine, String message, Throwable cause) {
    super("[" + engine.getEngineName() + "] " + message, cause);
    this.engine = engine;
  }
}
