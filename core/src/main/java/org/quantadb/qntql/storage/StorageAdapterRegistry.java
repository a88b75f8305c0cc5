/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.storage;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import org.quantadb.qntql.exception.EngineException;

/**
 * Dispatch table from storage classification to the adapter that owns it. Built once at bootstrap
 * and immutable afterwards.
 */
public class StorageAdapterRegistry {

  private final Map<StorageClassification, StorageAdapter> adapters;

  public StorageAdapterRegistry(Map<StorageClassification, StorageAdapter> adapters) {
    this.adapters = Collections.unmodifiableMap(new EnumMap<>(adapters));
  }

  /**
   * Adapter for a classification.
   *
   * @throws EngineException if no backend is registered for it
   */
  public StorageAdapter get(StorageClassification classification) {
    StorageAdapter adapter = adapters.get(classification);
    if (adapter == null) {
      throw new EngineException(classification, "No storage adapter registered");
    }
    return adapter;
  }

  /** Registered adapters in classification order. */
  public Map<StorageClassification, StorageAdapter> getAdapters() {
    return adapters;
  }
}
