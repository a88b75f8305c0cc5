/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.executor;

/**
 * Work one engine did for a statement.
 *
 * @param unitsScanned rows returned by the engine
 * @param executionTimeMs time spent in the engine's fragments, summed
 * @param error first failure message, null when every fragment succeeded
 */
public record EngineStatistics(long unitsScanned, long executionTimeMs, String error) {

  public static final EngineStatistics EMPTY = new EngineStatistics(0, 0, null);

  public EngineStatistics add(FragmentResult result) {
    return new EngineStatistics(
        unitsScanned + result.getRows().size(),
        executionTimeMs + result.getElapsedMillis(),
        error != null || !result.isFailed() ? error : result.getError().getMessage());
  }

  public EngineStatistics add(long units, long elapsedMillis) {
    return new EngineStatistics(unitsScanned + units, executionTimeMs + elapsedMillis, error);
  }
}
