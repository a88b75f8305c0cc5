/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.executor;

import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Getter;
import lombok.ToString;
import org.quantadb.qntql.exception.EngineException;
import org.quantadb.qntql.planner.physical.EngineFragment;
import org.quantadb.qntql.storage.NativeQuery;

/** Rows one fragment returned, or the error that stopped it. */
@Getter
@ToString(exclude = "rows")
public final class FragmentResult {

  private final EngineFragment fragment;

  /** Query as sent, key parameters bound. */
  private final NativeQuery query;

  private final List<Map<String, Object>> rows;

  private final EngineException error;

  private final long elapsedMillis;

  private FragmentResult(
      EngineFragment fragment,
      NativeQuery query,
      List<Map<String, Object>> rows,
      EngineException error,
      long elapsedMillis) {
    this.fragment = fragment;
    this.query = query;
    this.rows = rows;
    this.error = error;
    this.elapsedMillis = elapsedMillis;
  }

  public static FragmentResult success(
      EngineFragment fragment, NativeQuery query, List<Map<String, Object>> rows, long elapsed) {
    return new FragmentResult(fragment, query, List.copyOf(rows), null, elapsed);
  }

  /** Result of a keyed fragment whose upstream produced no keys; the backend is not called. */
  public static FragmentResult empty(EngineFragment fragment, NativeQuery query) {
    return new FragmentResult(fragment, query, List.of(), null, 0);
  }

  public static FragmentResult failed(
      EngineFragment fragment, NativeQuery query, EngineException error) {
    return new FragmentResult(fragment, query, List.of(), error, 0);
  }

  /** Fragment not run because an upstream fragment failed. */
  public static FragmentResult skipped(
      EngineFragment fragment, NativeQuery query, FragmentResult upstream) {
    return failed(
        fragment,
        query,
        new EngineException(
            fragment.engine(),
            "Fragment "
                + fragment.id()
                + " skipped: upstream fragment "
                + upstream.getFragment().id()
                + " failed"));
  }

  public boolean isFailed() {
    return error != null;
  }

  /** Keys this fragment hands downstream. */
  public Set<Object> keys() {
    return KeySets.keys(rows, fragment.outputKeyColumn());
  }
}
