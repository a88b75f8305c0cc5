/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.analysis.model;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.quantadb.qntql.catalog.model.RecordSchema;

/** Records a query ranges over, by alias, in order of introduction. The first is the primary. */
@EqualsAndHashCode
@ToString
public final class RecordScope {

  private final ImmutableMap<String, RecordSchema> records;

  public RecordScope(Map<String, RecordSchema> records) {
    this.records = ImmutableMap.copyOf(records);
  }

  public String getPrimaryAlias() {
    return records.keySet().iterator().next();
  }

  public RecordSchema getPrimary() {
    return records.get(getPrimaryAlias());
  }

  public Set<String> aliases() {
    return records.keySet();
  }

  public boolean contains(String alias) {
    return records.containsKey(alias);
  }

  public Optional<RecordSchema> find(String alias) {
    return Optional.ofNullable(records.get(alias));
  }

  public RecordSchema get(String alias) {
    RecordSchema schema = records.get(alias);
    if (schema == null) {
      throw new IllegalArgumentException("Alias not in scope: " + alias);
    }
    return schema;
  }

  public Map<String, RecordSchema> getRecords() {
    return records;
  }
}
