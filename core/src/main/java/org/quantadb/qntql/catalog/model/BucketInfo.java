/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.catalog.model;

import java.util.List;

/** Summary of a bucket returned by schema management calls. */
public record BucketInfo(String name, List<String> records) {

  public BucketInfo {
    records = List.copyOf(records);
  }
}
