/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.assembler;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Comparator;
import org.quantadb.qntql.executor.KeySets;

/**
 * Total order over normalized values: numbers by magnitude whatever their Java type, dates and
 * instants on one time line, other comparables naturally, anything else by string form. Nulls
 * sort last.
 */
public final class ValueComparator implements Comparator<Object> {

  public static final ValueComparator INSTANCE = new ValueComparator();

  private ValueComparator() {}

  @Override
  @SuppressWarnings("unchecked")
  public int compare(Object left, Object right) {
    if (left == null || right == null) {
      return left == right ? 0 : left == null ? 1 : -1;
    }
    if (left instanceof Number && right instanceof Number) {
      return ValueNormalizer.toBigDecimal(left).compareTo(ValueNormalizer.toBigDecimal(right));
    }
    if (isTemporal(left) && isTemporal(right)) {
      return toInstant(left).compareTo(toInstant(right));
    }
    if (left instanceof Comparable && left.getClass().isInstance(right)) {
      return ((Comparable<Object>) left).compareTo(right);
    }
    return left.toString().compareTo(right.toString());
  }

  /** Equality consistent with {@link #compare}, so {@code 1}, {@code 1L} and {@code 1.0} match. */
  public static boolean equal(Object left, Object right) {
    if (left == null || right == null) {
      return false;
    }
    if (KeySets.normalize(left).equals(KeySets.normalize(right))) {
      return true;
    }
    boolean comparable =
        (left instanceof Number && right instanceof Number)
            || (isTemporal(left) && isTemporal(right));
    return comparable && INSTANCE.compare(left, right) == 0;
  }

  private static boolean isTemporal(Object value) {
    return value instanceof LocalDate || value instanceof Instant;
  }

  private static Instant toInstant(Object value) {
    return value instanceof LocalDate
        ? ((LocalDate) value).atStartOfDay(ZoneOffset.UTC).toInstant()
        : (Instant) value;
  }
}
