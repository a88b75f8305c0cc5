/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.exception;

import lombok.Getter;

/** Unknown or conflicting bucket, record or attribute. */
@Getter
public class SchemaException extends QueryEngineException {

  private final String record;

  private final String attribute;

  public SchemaException(String message) {
    this(message, null, null);
  }

  public SchemaException(String message, String record, String attribute) {
    super(message);
    this.record = record;
    this.attribute = attribute;
  }
}
