/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.assembler;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import org.quantadb.qntql.ast.expression.AggregateCall;
import org.quantadb.qntql.ast.expression.RecordRef;

/**
 * Computes aggregate calls over the tuples of one group.
 *
 * <p>COUNT of {@code *} or of a record counts tuples; COUNT of an attribute counts non-null
 * values. SUM is a {@link Long} when every value is integral and a {@link BigDecimal} otherwise.
 * AVG is a {@link Double}. SUM, AVG, MIN and MAX of no values are null.
 */
public final class Aggregator {

  private Aggregator() {}

  public static Object compute(AggregateCall call, List<Tuple> group) {
    if (call.argument() == null) {
      return (long) group.size();
    }
    if (call.argument() instanceof RecordRef record) {
      return group.stream().filter(tuple -> tuple.record(record.alias()) != null).count();
    }
    List<Object> values = new ArrayList<>();
    for (Tuple tuple : group) {
      Object value = ExpressionEvaluator.INSTANCE.evaluate(call.argument(), tuple);
      if (value != null) {
        values.add(value);
      }
    }
    switch (call.function()) {
      case COUNT:
        return (long) values.size();
      case SUM:
        return sum(values);
      case AVG:
        if (values.isEmpty()) {
          return null;
        }
        return ValueNormalizer.toBigDecimal(sum(values))
            .divide(BigDecimal.valueOf(values.size()), MathContext.DECIMAL64)
            .doubleValue();
      case MIN:
        return values.stream().min(ValueComparator.INSTANCE).orElse(null);
      case MAX:
        return values.stream().max(ValueComparator.INSTANCE).orElse(null);
      default:
        throw new IllegalStateException("Unsupported aggregate " + call.function());
    }
  }

  private static Object sum(List<Object> values) {
    if (values.isEmpty()) {
      return null;
    }
    boolean integral = values.stream().allMatch(value -> value instanceof Long);
    if (integral) {
      return values.stream().mapToLong(value -> (Long) value).sum();
    }
    BigDecimal total = BigDecimal.ZERO;
    for (Object value : values) {
      if (!(value instanceof Number)) {
        throw new IllegalStateException("SUM over non-numeric value " + value);
      }
      total = total.add(ValueNormalizer.toBigDecimal(value));
    }
    return total;
  }
}
