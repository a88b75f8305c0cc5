/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.quantadb.qntql.executor.EngineStatistics;

/**
 * Per-engine section of a response.
 *
 * @param unitsScanned rows read from, or records written to, the engine
 * @param executionTimeMs time spent in the engine
 * @param error failure message of a partial result
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EngineReport(
    @JsonProperty("units_scanned") long unitsScanned,
    @JsonProperty("execution_time_ms") long executionTimeMs,
    @JsonProperty("error") String error) {

  public static EngineReport of(EngineStatistics statistics) {
    return new EngineReport(
        statistics.unitsScanned(), statistics.executionTimeMs(), statistics.error());
  }
}
