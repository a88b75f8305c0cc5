/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.catalog.model;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import lombok.Getter;

/**
 * Top-level namespace owning record schemas. Readers see an immutable snapshot of the records;
 * writers replace the snapshot while holding {@link #getWriteLock()}.
 */
public class Bucket {

  @Getter private final String name;

  @Getter private final ReentrantLock writeLock = new ReentrantLock();

  private volatile ImmutableMap<String, RecordSchema> records = ImmutableMap.of();

  public Bucket(String name) {
    this.name = name;
  }

  public Map<String, RecordSchema> getRecords() {
    return records;
  }

  public Optional<RecordSchema> getRecord(String record) {
    return Optional.ofNullable(records.get(record));
  }

  /** Publishes a new or evolved schema. Caller must hold the write lock. */
  public void putRecord(RecordSchema schema) {
    records =
        ImmutableMap.<String, RecordSchema>builder()
            .putAll(records)
            .put(schema.getName(), schema)
            .buildKeepingLast();
  }

  public BucketInfo info() {
    return new BucketInfo(name, ImmutableList.copyOf(records.keySet()));
  }
}
