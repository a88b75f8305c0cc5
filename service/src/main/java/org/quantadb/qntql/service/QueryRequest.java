/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One statement submitted against a bucket. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueryRequest {

  @JsonProperty(value = "bucket", required = true)
  private String bucket;

  @JsonProperty(value = "query", required = true)
  private String query;

  /** Client-held transaction the statement joins. */
  @JsonProperty("transaction_id")
  private String transactionId;

  /** Null falls back to the configured default. */
  @JsonProperty("allow_partial_results")
  private Boolean allowPartialResults;

  public static QueryRequest of(String bucket, String query) {
    return new QueryRequest(bucket, query, null, null);
  }
}
