/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.executor;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Record key comparison across engines that return keys as different Java types. */
public final class KeySets {

  private KeySets() {}

  /**
   * Canonical form of a key: integral numbers become {@link Long}, other numbers {@link
   * BigDecimal} without trailing zeros, anything else its own value.
   */
  public static Object normalize(Object key) {
    if (key instanceof Integer || key instanceof Short || key instanceof Byte) {
      return ((Number) key).longValue();
    }
    if (key instanceof BigInteger bigInteger && bigInteger.bitLength() < 64) {
      return bigInteger.longValue();
    }
    if (key instanceof BigDecimal decimal) {
      BigDecimal stripped = decimal.stripTrailingZeros();
      return stripped.scale() <= 0 && stripped.precision() - stripped.scale() < 19
          ? (Object) stripped.longValueExact()
          : stripped;
    }
    if (key instanceof Double || key instanceof Float) {
      return normalize(new BigDecimal(key.toString()));
    }
    return key;
  }

  /** Distinct non-null keys of the given column, in row order. */
  public static Set<Object> keys(List<Map<String, Object>> rows, String column) {
    Set<Object> keys = new LinkedHashSet<>();
    for (Map<String, Object> row : rows) {
      Object key = row.get(column);
      if (key != null) {
        keys.add(normalize(key));
      }
    }
    return keys;
  }

  /** Keys present in every set, in the order of the first. */
  public static Set<Object> intersection(List<Set<Object>> sets) {
    if (sets.isEmpty()) {
      return new LinkedHashSet<>();
    }
    Set<Object> result = new LinkedHashSet<>(sets.get(0));
    for (int i = 1; i < sets.size(); i++) {
      result.retainAll(sets.get(i));
    }
    return result;
  }
}
