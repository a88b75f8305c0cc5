/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder(toBuilder = true)
@EqualsAndHashCode
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResponseMetadata {

  @JsonProperty("total_count")
  private final long totalCount;

  @JsonProperty("returned_count")
  private final long returnedCount;

  @JsonProperty("page")
  private final int page;

  @JsonProperty("page_size")
  private final int pageSize;

  @JsonProperty("execution_time_ms")
  private final long executionTimeMs;

  /** Failed fragments of a partial result; absent when every fragment succeeded. */
  @JsonProperty("warnings")
  private final List<String> warnings;

  /** Records written by ADD, UPDATE, REMOVE and CREATE RELATION. */
  @JsonProperty("affected_count")
  private final Long affectedCount;

  @JsonProperty("transaction_id")
  private final String transactionId;

  /** Outcome of a BEGIN ... COMMIT or ROLLBACK block. */
  @JsonProperty("transaction_state")
  private final String transactionState;
}
