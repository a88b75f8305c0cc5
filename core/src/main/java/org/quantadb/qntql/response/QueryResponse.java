/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;
import org.quantadb.qntql.storage.StorageClassification;

/** Structured response of one statement. */
@Getter
@Builder
@EqualsAndHashCode
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryResponse {

  /** One nested map per row, values grouped under their record alias. */
  @Singular("row")
  @JsonProperty("data")
  private final List<Map<String, Object>> data;

  @JsonProperty("metadata")
  private final ResponseMetadata metadata;

  /** Engines the statement touched, keyed by engine name. */
  @Singular("engine")
  @JsonProperty("engines")
  private final Map<String, EngineReport> engines;

  public EngineReport engine(StorageClassification engine) {
    return engines.get(engine.getEngineName());
  }
}
