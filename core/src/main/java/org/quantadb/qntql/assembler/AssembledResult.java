/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.assembler;

import java.util.List;
import java.util.Map;

/**
 * Response rows with what pagination metadata needs.
 *
 * @param rows one nested map per result row: values grouped under their record alias, aggregates
 *     at the top level
 * @param totalCount rows before offset and limit
 * @param limit requested limit, null when absent
 * @param offset requested offset, null when absent
 */
public record AssembledResult(
    List<Map<String, Object>> rows, long totalCount, Integer limit, Integer offset) {

  public AssembledResult {
    rows = List.copyOf(rows);
  }

  /** 1-based page number derived from offset and limit. */
  public int page() {
    if (limit == null || limit <= 0) {
      return 1;
    }
    return (offset == null ? 0 : offset) / limit + 1;
  }

  public int pageSize() {
    return limit == null ? rows.size() : limit;
  }
}
