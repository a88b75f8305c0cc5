/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.physical;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.ToString;
import org.quantadb.qntql.planner.logical.LogicalPlan;
import org.quantadb.qntql.storage.NativeQuery;

/**
 * Physical plan ready to run: the operator tree, its fragments in dependency order and the native
 * query of each fragment.
 */
@Getter
@ToString
public class ExecutablePlan {

  private final String bucket;

  private final LogicalPlan logicalPlan;

  private final PhysicalPlan root;

  /** Every fragment appears after the fragments its key input reads from. */
  private final List<EngineFragment> fragments;

  private final Map<String, NativeQuery> queries;

  public ExecutablePlan(
      String bucket,
      LogicalPlan logicalPlan,
      PhysicalPlan root,
      List<EngineFragment> fragments,
      Map<String, NativeQuery> queries) {
    this.bucket = bucket;
    this.logicalPlan = logicalPlan;
    this.root = root;
    this.fragments = ImmutableList.copyOf(fragments);
    this.queries = ImmutableMap.copyOf(queries);
  }

  public EngineFragment getFragment(String id) {
    return fragments.stream()
        .filter(fragment -> fragment.id().equals(id))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown fragment " + id));
  }

  public NativeQuery getQuery(String fragmentId) {
    NativeQuery query = queries.get(fragmentId);
    if (query == null) {
      throw new IllegalArgumentException("No native query for fragment " + fragmentId);
    }
    return query;
  }
}
