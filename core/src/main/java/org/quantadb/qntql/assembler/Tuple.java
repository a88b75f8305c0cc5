/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.assembler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Intermediate row of the assembler: attribute values per record alias, plus aggregate values by
 * canonical name once grouped.
 */
@EqualsAndHashCode
@ToString
public final class Tuple {

  private final Map<String, Map<String, Object>> records;

  private final Map<String, Object> aggregates;

  public Tuple(Map<String, Map<String, Object>> records, Map<String, Object> aggregates) {
    this.records = Collections.unmodifiableMap(new LinkedHashMap<>(records));
    this.aggregates = Collections.unmodifiableMap(new LinkedHashMap<>(aggregates));
  }

  public static Tuple of(String alias, Map<String, Object> values) {
    Map<String, Map<String, Object>> records = new LinkedHashMap<>();
    records.put(alias, Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    return new Tuple(records, Map.of());
  }

  /** Attribute values of a record, null when the alias is not part of this tuple. */
  public Map<String, Object> record(String alias) {
    return records.get(alias);
  }

  public Map<String, Map<String, Object>> getRecords() {
    return records;
  }

  public Map<String, Object> getAggregates() {
    return aggregates;
  }

  /** Tuple holding the records of both. */
  public Tuple join(Tuple other) {
    Map<String, Map<String, Object>> joined = new LinkedHashMap<>(records);
    joined.putAll(other.records);
    return new Tuple(joined, aggregates);
  }

  public Tuple withAggregates(Map<String, Object> values) {
    return new Tuple(records, values);
  }
}
