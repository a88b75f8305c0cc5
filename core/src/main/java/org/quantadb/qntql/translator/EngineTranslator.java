/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.translator;

import java.util.List;
import org.quantadb.qntql.ast.expression.Expression;
import org.quantadb.qntql.catalog.model.RecordSchema;
import org.quantadb.qntql.planner.physical.EngineFragment;
import org.quantadb.qntql.storage.NativeQuery;
import org.quantadb.qntql.storage.StorageClassification;

/**
 * Turns engine fragments into native queries for one storage classification.
 *
 * <p>Implementations are stateless and deterministic: the same fragment always yields the same
 * native query. A predicate the translator reports non-pushable through {@link #canPushDown} is
 * never handed to it; receiving one anyway is a programming error.
 */
public interface EngineTranslator {

  StorageClassification getClassification();

  /** Whether the engine can evaluate the predicate natively. */
  boolean canPushDown(Expression predicate);

  /** Whether the engine can group and aggregate. */
  default boolean supportsAggregation() {
    return false;
  }

  /** Whether the engine can sort its rows. */
  default boolean supportsOrdering() {
    return false;
  }

  /**
   * Translates a read fragment.
   *
   * @throws IllegalStateException if the fragment carries a predicate the engine cannot express
   */
  NativeQuery translate(EngineFragment fragment, String bucket);

  /** Native condition for UPDATE or REMOVE built from a pushable predicate. */
  NativeQuery translateCondition(String bucket, RecordSchema record, Expression condition);

  /** Native condition matching the given record keys. */
  NativeQuery translateKeyCondition(String bucket, RecordSchema record, List<Object> keys);
}
