/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.assembler;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Function;
import org.quantadb.qntql.analysis.model.SortKey;
import org.quantadb.qntql.executor.KeySets;
import org.quantadb.qntql.planner.physical.JoinAlgorithm;

/**
 * Join algorithms used to combine record rows, relation edges and navigation targets, plus
 * client-side sorting. All methods are static.
 *
 * <p>Keys are compared in {@link KeySets#normalize normalized} form. NULL keys never match.
 */
public final class HashJoinExecutor {

  private HashJoinExecutor() {}

  /** Join type needed by the assembler. */
  public enum JoinType {
    INNER,
    LEFT
  }

  /** Runs the join with the algorithm the physical planner picked. */
  public static <L, R, T> List<T> join(
      JoinAlgorithm algorithm,
      List<L> leftRows,
      Function<L, Object> leftKey,
      List<R> rightRows,
      Function<R, Object> rightKey,
      JoinType joinType,
      BiFunction<L, R, T> combine) {
    return algorithm == JoinAlgorithm.HASH_JOIN
        ? performHashJoin(leftRows, leftKey, rightRows, rightKey, joinType, combine)
        : performNestedLoopJoin(leftRows, leftKey, rightRows, rightKey, joinType, combine);
  }

  /**
   * Builds a hash table on the right side and probes it with the left side. For a LEFT join an
   * unmatched left row is combined with null.
   */
  public static <L, R, T> List<T> performHashJoin(
      List<L> leftRows,
      Function<L, Object> leftKey,
      List<R> rightRows,
      Function<R, Object> rightKey,
      JoinType joinType,
      BiFunction<L, R, T> combine) {
    Map<Object, List<R>> hashTable = buildHashTable(rightRows, rightKey);
    List<T> result = new ArrayList<>();
    for (L leftRow : leftRows) {
      Object key = KeySets.normalize(leftKey.apply(leftRow));
      List<R> matches = key == null ? null : hashTable.get(key);
      if (matches != null && !matches.isEmpty()) {
        for (R rightRow : matches) {
          result.add(combine.apply(leftRow, rightRow));
        }
      } else if (joinType == JoinType.LEFT) {
        result.add(combine.apply(leftRow, null));
      }
    }
    return result;
  }

  /** Compares every pair; for small inputs, where building a table does not pay off. */
  public static <L, R, T> List<T> performNestedLoopJoin(
      List<L> leftRows,
      Function<L, Object> leftKey,
      List<R> rightRows,
      Function<R, Object> rightKey,
      JoinType joinType,
      BiFunction<L, R, T> combine) {
    List<T> result = new ArrayList<>();
    for (L leftRow : leftRows) {
      Object key = KeySets.normalize(leftKey.apply(leftRow));
      boolean matched = false;
      if (key != null) {
        for (R rightRow : rightRows) {
          if (key.equals(KeySets.normalize(rightKey.apply(rightRow)))) {
            result.add(combine.apply(leftRow, rightRow));
            matched = true;
          }
        }
      }
      if (!matched && joinType == JoinType.LEFT) {
        result.add(combine.apply(leftRow, null));
      }
    }
    return result;
  }

  /** Rows grouped by normalized key. Rows with null keys are excluded. */
  static <R> Map<Object, List<R>> buildHashTable(List<R> rows, Function<R, Object> keyFunction) {
    Map<Object, List<R>> hashTable = new HashMap<>();
    for (R row : rows) {
      Object key = KeySets.normalize(keyFunction.apply(row));
      if (key != null) {
        hashTable.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
      }
    }
    return hashTable;
  }

  /**
   * Sorts tuples by the sort keys. Nulls sort last in both directions. The sort is stable, so
   * tuples equal on every key keep their input order.
   */
  public static void sortRows(List<Tuple> rows, List<SortKey> sortKeys) {
    if (sortKeys.isEmpty() || rows.size() <= 1) {
      return;
    }
    Comparator<Tuple> comparator =
        (row1, row2) -> {
          for (SortKey key : sortKeys) {
            Object v1 = ExpressionEvaluator.INSTANCE.evaluate(key.expression(), row1);
            Object v2 = ExpressionEvaluator.INSTANCE.evaluate(key.expression(), row2);
            if (v1 == null && v2 == null) {
              continue;
            }
            if (v1 == null) {
              return 1;
            }
            if (v2 == null) {
              return -1;
            }
            int cmp = ValueComparator.INSTANCE.compare(v1, v2);
            if (cmp != 0) {
              return key.ascending() ? cmp : -cmp;
            }
          }
          return 0;
        };
    rows.sort(comparator);
  }
}
