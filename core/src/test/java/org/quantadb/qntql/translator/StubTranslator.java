/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */


package org.quantadb.qntql.translator;

import java.util.List;
import java.util.function.Predicate;
import org.quantadb.qntql.ast.expression.Expression;
import org.quantadb.qntql.catalog.model.RecordSchema;
import org.quantadb.qntql.planner.physical.EngineFragment;
import org.quantadb.qntql.storage.NativeQuery;
import org.quantadb.qntql.storage.QueryParameter;
import org.quantadb.qntql.storage.RowShape;
import org.quantadb.qntql.storage.StorageClassification;

/**
 * Translator for planner and executor tests. The native text is the fragment description, so
 * assertions can read what the planner asked for.
 */
public class StubTranslator implements EngineTranslator {

  private final StorageClassification classification;

  private final Predicate<Expression> pushable;

  private final boolean ordering;

  private final boolean aggregation;

  public StubTranslator(
      StorageClassification classification,
      Predicate<Expression> pushable,
      boolean ordering,
      boolean aggregation) {
    this.classification = classification;
    this.pushable = pushable;
    this.ordering = ordering;
    this.aggregation = aggregation;
  }

  /**
   * Registry where scalar pushes everything and orders, document and relation push everything,
   * metric pushes nothing.
   */
  public static TranslatorRegistry registry() {
    return new TranslatorRegistry(
        List.of(
            new StubTranslator(StorageClassification.SCALAR, e -> true, true, true),
            new StubTranslator(StorageClassification.DOCUMENT, e -> true, false, false),
            new StubTranslator(StorageClassification.RELATION, e -> true, false, false),
            new StubTranslator(StorageClassification.METRIC, e -> false, false, false)));
  }

  @Override
  public StorageClassification getClassification() {
    return classification;
  }

  @Override
  public boolean canPushDown(Expression predicate) {
    return pushable.test(predicate);
  }

  @Override
  public boolean supportsAggregation() {
    return aggregation;
  }

  @Override
  public boolean supportsOrdering() {
    return ordering;
  }

  @Override
  public NativeQuery translate(EngineFragment fragment, String bucket) {
    return new NativeQuery(
        classification,
        fragment.id(),
        fragment.describe(),
        fragment.isKeyed()
            ? List.of(new QueryParameter(fragment.keyInput().parameter(), null))
            : List.of(),
        new RowShape(RowShape.Kind.ROWS, fragment.outputKeyColumn(), List.of()));
  }

  @Override
  public NativeQuery translateCondition(
      String bucket, RecordSchema record, Expression condition) {
    return new NativeQuery(
        classification, "", "condition", List.of(), keyShape(record));
  }

  @Override
  public NativeQuery translateKeyCondition(
      String bucket, RecordSchema record, List<Object> keys) {
    return new NativeQuery(
        classification,
        "",
        "keys",
        List.of(new QueryParameter(NativeQuery.KEYS, keys)),
        keyShape(record));
  }

  private static RowShape keyShape(RecordSchema record) {
    return new RowShape(RowShape.Kind.KEYS, record.getKeyAttribute(), List.of());
  }
}
