/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.engines.scalar;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.quantadb.qntql.analysis.model.SortKey;
import org.quantadb.qntql.ast.expression.AggregateCall;
import org.quantadb.qntql.ast.expression.Expression;
import org.quantadb.qntql.ast.expression.ResolvedAttribute;
import org.quantadb.qntql.catalog.model.AttributeDefinition;
import org.quantadb.qntql.catalog.model.RecordSchema;
import org.quantadb.qntql.engines.AbstractEngineTranslator;
import org.quantadb.qntql.engines.NamedParameters;
import org.quantadb.qntql.planner.logical.EnginePushdown;
import org.quantadb.qntql.planner.physical.EngineFragment;
import org.quantadb.qntql.storage.NativeQuery;
import org.quantadb.qntql.storage.RowShape;
import org.quantadb.qntql.storage.StorageClassification;

/**
 * Translates scalar fragments into PostgreSQL. Each bucket is a schema and each record a table
 * whose columns are the record key and its scalar attributes.
 *
 * <pre>
 * SELECT "id", "name" FROM "shop"."users" WHERE "id" = ANY(:keys) AND "age" &gt; :p1
 * </pre>
 */
public class ScalarTranslator extends AbstractEngineTranslator {

  public ScalarTranslator() {
    super(StorageClassification.SCALAR, new ScalarPredicateSupport());
  }

  @Override
  public boolean supportsAggregation() {
    return true;
  }

  @Override
  public boolean supportsOrdering() {
    return true;
  }

  @Override
  protected NativeQuery translateScan(EngineFragment fragment, String bucket) {
    RecordSchema record = fragment.record();
    NamedParameters parameters = new NamedParameters();
    EnginePushdown pushdown = fragment.pushdown();
    EnginePushdown.Aggregation aggregation = pushdown == null ? null : pushdown.aggregation();

    StringBuilder sql = new StringBuilder("SELECT ");
    RowShape shape;
    if (aggregation != null) {
      List<String> items = new ArrayList<>();
      List<RowShape.Column> columns = new ArrayList<>();
      for (ResolvedAttribute group : aggregation.groupBy()) {
        items.add(quote(group.attribute()));
        AttributeDefinition definition = group.definition();
        columns.add(
            new RowShape.Column(
                group.attribute(), definition.type(), definition.datatype(), null));
      }
      for (AggregateCall call : aggregation.aggregates()) {
        items.add(
            call.accept(SqlExpressionRenderer.INSTANCE, parameters)
                + " AS "
                + quote(call.canonicalName()));
        columns.add(
            new RowShape.Column(call.canonicalName(), StorageClassification.SCALAR, null, null));
      }
      sql.append(String.join(", ", items));
      shape = new RowShape(RowShape.Kind.ROWS, null, columns);
    } else {
      sql.append(
          selectedColumns(fragment).stream()
              .map(ScalarTranslator::quote)
              .collect(Collectors.joining(", ")));
      shape = rowShape(fragment);
    }
    sql.append(" FROM ").append(table(bucket, record));

    List<String> conditions = new ArrayList<>();
    if (fragment.isKeyed()) {
      conditions.add(keyCondition(record, parameters.declare(fragment.keyInput().parameter())));
    }
    for (Expression predicate : fragment.predicates()) {
      conditions.add(predicate.accept(SqlExpressionRenderer.INSTANCE, parameters));
    }
    if (!conditions.isEmpty()) {
      sql.append(" WHERE ").append(String.join(" AND ", conditions));
    }

    if (aggregation != null) {
      if (!aggregation.groupBy().isEmpty()) {
        sql.append(" GROUP BY ")
            .append(
                aggregation.groupBy().stream()
                    .map(group -> quote(group.attribute()))
                    .collect(Collectors.joining(", ")));
      }
      if (aggregation.having() != null) {
        sql.append(" HAVING ")
            .append(aggregation.having().accept(SqlExpressionRenderer.INSTANCE, parameters));
      }
    }
    if (pushdown != null) {
      appendOrdering(sql, pushdown);
    }
    return new NativeQuery(
        StorageClassification.SCALAR, fragment.id(), sql.toString(), parameters.build(), shape);
  }

  private static void appendOrdering(StringBuilder sql, EnginePushdown pushdown) {
    if (!pushdown.sort().isEmpty()) {
      List<String> keys = new ArrayList<>();
      for (SortKey key : pushdown.sort()) {
        String column =
            key.expression() instanceof AggregateCall
                ? quote(((AggregateCall) key.expression()).canonicalName())
                : quote(((ResolvedAttribute) key.expression()).attribute());
        keys.add(column + (key.ascending() ? " ASC" : " DESC") + " NULLS LAST");
      }
      sql.append(" ORDER BY ").append(String.join(", ", keys));
    }
  }

  /** Renders a WHERE condition for UPDATE and DELETE. */
  @Override
  protected NativeQuery writeCondition(String bucket, RecordSchema record, Expression condition) {
    NamedParameters parameters = new NamedParameters();
    String text = condition.accept(SqlExpressionRenderer.INSTANCE, parameters);
    return new NativeQuery(
        StorageClassification.SCALAR, null, text, parameters.build(), keyShape(record));
  }

  @Override
  public NativeQuery translateKeyCondition(String bucket, RecordSchema record, List<Object> keys) {
    NamedParameters parameters = new NamedParameters();
    String text = keyCondition(record, parameters.declare(NativeQuery.KEYS));
    return new NativeQuery(
            StorageClassification.SCALAR, null, text, parameters.build(), keyShape(record))
        .bind(NativeQuery.KEYS, List.copyOf(keys));
  }

  private static String keyCondition(RecordSchema record, String parameter) {
    return quote(record.getKeyAttribute()) + " = ANY(:" + parameter + ")";
  }

  static String table(String bucket, RecordSchema record) {
    return quote(bucket) + "." + quote(record.getName());
  }

  /** Double-quoted PostgreSQL identifier. */
  static String quote(String identifier) {
    return '"' + identifier.replace("\"", "\"\"") + '"';
  }
}
