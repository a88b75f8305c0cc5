/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.engines;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.quantadb.qntql.ast.expression.Expression;
import org.quantadb.qntql.ast.expression.Expressions;
import org.quantadb.qntql.catalog.model.AttributeDefinition;
import org.quantadb.qntql.catalog.model.RecordSchema;
import org.quantadb.qntql.planner.physical.EngineFragment;
import org.quantadb.qntql.planner.physical.FragmentKind;
import org.quantadb.qntql.storage.NativeQuery;
import org.quantadb.qntql.storage.RowShape;
import org.quantadb.qntql.storage.StorageClassification;
import org.quantadb.qntql.translator.EngineTranslator;

/**
 * Common part of the engine translators: predicate checks before translation, row shapes and
 * logging of the produced query.
 */
@Log4j2
public abstract class AbstractEngineTranslator implements EngineTranslator {

  @Getter private final StorageClassification classification;

  private final PredicateSupport predicateSupport;

  protected AbstractEngineTranslator(
      StorageClassification classification, PredicateSupport predicateSupport) {
    this.classification = classification;
    this.predicateSupport = predicateSupport;
  }

  @Override
  public boolean canPushDown(Expression predicate) {
    return predicateSupport.isPushable(predicate);
  }

  @Override
  public NativeQuery translate(EngineFragment fragment, String bucket) {
    if (fragment.engine() != classification) {
      throw new IllegalStateException(
          "Fragment " + fragment.id() + " belongs to " + fragment.engine().getEngineName());
    }
    fragment.predicates().forEach(this::checkPushable);
    NativeQuery query =
        fragment.kind() == FragmentKind.TRAVERSE
            ? translateTraversal(fragment, bucket)
            : translateScan(fragment, bucket);
    log.debug("[{}] {} => {}", classification.getEngineName(), fragment.id(), query.getText());
    return query;
  }

  @Override
  public NativeQuery translateCondition(String bucket, RecordSchema record, Expression condition) {
    checkPushable(condition);
    return writeCondition(bucket, record, condition);
  }

  protected abstract NativeQuery translateScan(EngineFragment fragment, String bucket);

  protected NativeQuery translateTraversal(EngineFragment fragment, String bucket) {
    throw new IllegalStateException(
        classification.getEngineName() + " engine cannot traverse relations");
  }

  protected abstract NativeQuery writeCondition(
      String bucket, RecordSchema record, Expression condition);

  protected void checkPushable(Expression predicate) {
    if (!canPushDown(predicate)) {
      throw new IllegalStateException(
          "Predicate not supported by the "
              + classification.getEngineName()
              + " engine: "
              + Expressions.describe(predicate));
    }
  }

  /** Row shape of a scan: the record key plus every requested attribute. */
  protected RowShape rowShape(EngineFragment fragment) {
    RecordSchema record = fragment.record();
    List<RowShape.Column> columns = new ArrayList<>();
    for (String attribute : fragment.attributes()) {
      AttributeDefinition definition = record.getAttributes().get(attribute);
      columns.add(
          new RowShape.Column(
              attribute, definition.type(), definition.datatype(), definition.unit()));
    }
    return new RowShape(RowShape.Kind.ROWS, record.getKeyAttribute(), columns);
  }

  /** Attributes a scan returns, key first. */
  protected static List<String> selectedColumns(EngineFragment fragment) {
    List<String> columns = new ArrayList<>();
    columns.add(fragment.record().getKeyAttribute());
    for (String attribute : fragment.attributes()) {
      if (!columns.contains(attribute)) {
        columns.add(attribute);
      }
    }
    return columns;
  }

  protected static RowShape keyShape(RecordSchema record) {
    return new RowShape(RowShape.Kind.KEYS, record.getKeyAttribute(), List.of());
  }
}
