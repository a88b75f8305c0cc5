/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.executor;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import org.quantadb.qntql.planner.physical.ExecutablePlan;
import org.quantadb.qntql.storage.StorageClassification;

/** Fragment results of one executed plan, with per-engine statistics and warnings. */
@Getter
public class ExecutionResult {

  private final ExecutablePlan plan;

  private final Map<String, FragmentResult> results;

  private final Map<StorageClassification, EngineStatistics> statistics;

  private final List<String> warnings;

  public ExecutionResult(ExecutablePlan plan, Map<String, FragmentResult> results) {
    this.plan = plan;
    this.results = ImmutableMap.copyOf(results);
    Map<StorageClassification, EngineStatistics> statistics =
        new EnumMap<>(StorageClassification.class);
    List<String> warnings = new ArrayList<>();
    for (FragmentResult result : results.values()) {
      statistics.merge(
          result.getFragment().engine(),
          EngineStatistics.EMPTY.add(result),
          (left, right) ->
              new EngineStatistics(
                  left.unitsScanned() + right.unitsScanned(),
                  left.executionTimeMs() + right.executionTimeMs(),
                  left.error() != null ? left.error() : right.error()));
      if (result.isFailed()) {
        warnings.add(result.getError().getMessage());
      }
    }
    this.statistics = Collections.unmodifiableMap(statistics);
    this.warnings = List.copyOf(warnings);
  }

  public FragmentResult get(String fragmentId) {
    FragmentResult result = results.get(fragmentId);
    if (result == null) {
      throw new IllegalArgumentException("No result for fragment " + fragmentId);
    }
    return result;
  }

  public boolean isPartial() {
    return !warnings.isEmpty();
  }
}
