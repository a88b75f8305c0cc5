/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.exception;

import lombok.Getter;

/** Operator, literal or function applied to an attribute of an incompatible type. */
@Getter
public class TypeMismatchException extends QueryEngineException {

  private final String attribute;

  public TypeMismatchException(String message, String attribute) {
    super(message);
    this.attribute = attribute;
  }
}
