/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.Getter;
import org.quantadb.qntql.storage.StorageAdapter;
import org.quantadb.qntql.storage.StorageAdapterRegistry;
import org.quantadb.qntql.storage.StorageClassification;

/** One recording adapter per storage classification, sharing a call journal. */
public class TestBackends {

  @Getter
  private final List<String> journal = new CopyOnWriteArrayList<>();

  private final Map<StorageClassification, RecordingStorageAdapter> adapters =
      new EnumMap<>(StorageClassification.class);

  public TestBackends() {
    for (StorageClassification classification : StorageClassification.values()) {
      adapters.put(classification, new RecordingStorageAdapter(classification, journal));
    }
  }

  public RecordingStorageAdapter get(StorageClassification classification) {
    return adapters.get(classification);
  }

  public RecordingStorageAdapter scalar() {
    return get(StorageClassification.SCALAR);
  }

  public RecordingStorageAdapter document() {
    return get(StorageClassification.DOCUMENT);
  }

  public RecordingStorageAdapter relation() {
    return get(StorageClassification.RELATION);
  }

  public RecordingStorageAdapter metric() {
    return get(StorageClassification.METRIC);
  }

  public StorageAdapterRegistry registry() {
    return new StorageAdapterRegistry(new EnumMap<StorageClassification, StorageAdapter>(adapters));
  }
}
