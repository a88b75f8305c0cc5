/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.storage;

import java.util.List;

/**
 * Shape of the rows a native query returns, so the result assembler knows how to read them.
 *
 * @param kind rows keyed by record key, relation edges, or bare keys
 * @param keyColumn column holding the record key (the source key for edges)
 * @param columns value columns besides the key
 */
public record RowShape(Kind kind, String keyColumn, List<Column> columns) {

  /** Column of an edge row holding the source record key. */
  public static final String SOURCE_KEY = "source_key";

  /** Column of an edge row holding the relation attribute name. */
  public static final String RELATION = "relation";

  /** Column of an edge row holding the target record key. */
  public static final String TARGET_KEY = "target_key";

  /** Value key of an edge insert holding the edge properties. */
  public static final String PROPERTIES = "properties";

  public RowShape {
    columns = List.copyOf(columns);
  }

  public enum Kind {
    /** One row per record: key column plus attribute columns. */
    ROWS,
    /** One row per relation edge: source key, relation, target key. */
    EDGES,
    /** Only record keys; the fragment exists to filter. */
    KEYS
  }

  /**
   * Expected value column.
   *
   * @param name column name as it appears in each row
   * @param classification owning classification
   * @param datatype datatype hint, may be null
   * @param unit metric unit, may be null
   */
  public record Column(
      String name, StorageClassification classification, String datatype, String unit) {}
}
