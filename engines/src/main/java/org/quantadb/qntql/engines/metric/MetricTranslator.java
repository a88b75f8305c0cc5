/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.engines.metric;

import java.util.List;
import java.util.stream.Collectors;
import org.quantadb.qntql.ast.expression.Comparison;
import org.quantadb.qntql.ast.expression.Contains;
import org.quantadb.qntql.ast.expression.Expression;
import org.quantadb.qntql.ast.expression.InList;
import org.quantadb.qntql.ast.expression.IsNull;
import org.quantadb.qntql.catalog.model.RecordSchema;
import org.quantadb.qntql.engines.AbstractEngineTranslator;
import org.quantadb.qntql.engines.NamedParameters;
import org.quantadb.qntql.engines.PredicateSupport;
import org.quantadb.qntql.planner.physical.EngineFragment;
import org.quantadb.qntql.storage.NativeQuery;
import org.quantadb.qntql.storage.StorageClassification;

/**
 * Translates metric fragments into Flux. A record is a measurement, its key a tag and each metric
 * attribute a field; the latest sample of every field is returned, one row per record key.
 *
 * <p>No predicate is pushed: metric conditions are always evaluated on the returned samples.
 */
public class MetricTranslator extends AbstractEngineTranslator {

  public MetricTranslator() {
    super(StorageClassification.METRIC, new NothingPushable());
  }

  @Override
  protected NativeQuery translateScan(EngineFragment fragment, String bucket) {
    RecordSchema record = fragment.record();
    String key = record.getKeyAttribute();
    NamedParameters parameters = new NamedParameters();
    StringBuilder flux =
        new StringBuilder("from(bucket: ")
            .append(string(bucket))
            .append(")\n  |> range(start: 0)\n  |> filter(fn: (r) => r._measurement == ")
            .append(string(record.getName()))
            .append(')');
    if (!fragment.attributes().isEmpty()) {
      flux.append("\n  |> filter(fn: (r) => ")
          .append(
              fragment.attributes().stream()
                  .map(field -> "r._field == " + string(field))
                  .collect(Collectors.joining(" or ")))
          .append(')');
    }
    if (fragment.isKeyed()) {
      flux.append("\n  |> filter(fn: ")
          .append(keyPredicate(key, parameters.declare(fragment.keyInput().parameter())))
          .append(')');
    }
    flux.append("\n  |> last()")
        .append("\n  |> pivot(rowKey: [")
        .append(string(key))
        .append("], columnKey: [\"_field\"], valueColumn: \"_value\")")
        .append("\n  |> keep(columns: [")
        .append(
            selectedColumns(fragment).stream()
                .map(MetricTranslator::string)
                .collect(Collectors.joining(", ")))
        .append("])");
    return new NativeQuery(
        StorageClassification.METRIC,
        fragment.id(),
        flux.toString(),
        parameters.build(),
        rowShape(fragment));
  }

  @Override
  protected NativeQuery writeCondition(String bucket, RecordSchema record, Expression condition) {
    throw new IllegalStateException("Metric conditions are never pushed");
  }

  /** Flux predicate function selecting the series of the given record keys. */
  @Override
  public NativeQuery translateKeyCondition(String bucket, RecordSchema record, List<Object> keys) {
    NamedParameters parameters = new NamedParameters();
    String text = keyPredicate(record.getKeyAttribute(), parameters.declare(NativeQuery.KEYS));
    return new NativeQuery(
            StorageClassification.METRIC, null, text, parameters.build(), keyShape(record))
        .bind(NativeQuery.KEYS, List.copyOf(keys));
  }

  private static String keyPredicate(String key, String parameter) {
    return "(r) => contains(value: r[" + string(key) + "], set: params." + parameter + ")";
  }

  /** Flux string literal. */
  static String string(String value) {
    return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
  }

  private static class NothingPushable extends PredicateSupport {

    NothingPushable() {
      super(StorageClassification.METRIC);
    }

    @Override
    protected boolean supportsComparison(Comparison comparison) {
      return false;
    }

    @Override
    protected boolean supportsIn(InList in) {
      return false;
    }

    @Override
    protected boolean supportsContains(Contains contains) {
      return false;
    }

    @Override
    protected boolean supportsIsNull(IsNull isNull) {
      return false;
    }
  }
}
