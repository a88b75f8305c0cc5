/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.catalog.model;

import java.util.Locale;
import org.quantadb.qntql.exception.SchemaException;

/** Datatype hints accepted for scalar attributes. */
public enum ScalarType {
  STRING(Family.TEXT),
  TEXT(Family.TEXT),
  UUID(Family.TEXT),
  INT(Family.INTEGRAL),
  INTEGER(Family.INTEGRAL),
  LONG(Family.INTEGRAL),
  DECIMAL(Family.FRACTIONAL),
  DOUBLE(Family.FRACTIONAL),
  FLOAT(Family.FRACTIONAL),
  BOOLEAN(Family.BOOLEAN),
  DATE(Family.DATE),
  TIMESTAMP(Family.TIMESTAMP);

  /** Groups of hints that compare with the same literals. */
  public enum Family {
    TEXT,
    INTEGRAL,
    FRACTIONAL,
    BOOLEAN,
    DATE,
    TIMESTAMP
  }

  private final Family family;

  ScalarType(Family family) {
    this.family = family;
  }

  public Family getFamily() {
    return family;
  }

  public boolean isNumeric() {
    return family == Family.INTEGRAL || family == Family.FRACTIONAL;
  }

  public boolean isTemporal() {
    return family == Family.DATE || family == Family.TIMESTAMP;
  }

  public static ScalarType fromHint(String hint) {
    try {
      return valueOf(hint.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new SchemaException("Unknown scalar datatype: " + hint);
    }
  }
}
