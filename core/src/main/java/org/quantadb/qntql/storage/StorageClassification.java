/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.storage;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import org.quantadb.qntql.exception.SchemaException;

/**
 * Storage classification of an attribute. Each classification is owned by exactly one backend, so
 * this is the routing key for the whole pipeline.
 */
public enum StorageClassification {

  /** Relational store. */
  SCALAR("scalar"),

  /** Document store. */
  DOCUMENT("document"),

  /** Graph store. */
  RELATION("relation"),

  /** Time-series store. */
  METRIC("metric");

  private final String engineName;

  StorageClassification(String engineName) {
    this.engineName = engineName;
  }

  @JsonValue
  public String getEngineName() {
    return engineName;
  }

  /** Case-insensitive lookup by name, e.g. {@code scalar} or {@code SCALAR}. */
  @JsonCreator
  public static StorageClassification fromName(String name) {
    if (name != null) {
      String normalized = name.toLowerCase(Locale.ROOT);
      for (StorageClassification classification : values()) {
        if (classification.engineName.equals(normalized)) {
          return classification;
        }
      }
    }
    throw new SchemaException("Unknown storage classification: " + name);
  }
}
