/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.service.error;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.quantadb.qntql.exception.EngineException;
import org.quantadb.qntql.exception.QueryTimeoutException;
import org.quantadb.qntql.exception.SchemaException;
import org.quantadb.qntql.exception.TransactionException;
import org.quantadb.qntql.storage.StorageClassification;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ErrorMessageTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void schema_error_is_a_client_error() throws Exception {
    SchemaException exception = new SchemaException("Unknown record tasks");

    JsonNode json = objectMapper.readTree(ErrorMessage.of(exception).toJson(objectMapper));

    assertTrue(ErrorMessage.isClientError(exception));
    assertEquals(400, json.get("status").asInt());
    assertEquals("SchemaException", json.get("error").get("type").asText());
    assertEquals("Invalid Query", json.get("error").get("reason").asText());
  }

  @Test
  void engine_error_names_the_engine() throws Exception {
    EngineException exception =
        new EngineException(StorageClassification.METRIC, "connection refused");

    JsonNode json = objectMapper.readTree(ErrorMessage.of(exception).toJson(objectMapper));

    assertFalse(ErrorMessage.isClientError(exception));
    assertEquals(503, json.get("status").asInt());
    assertEquals("metric", json.get("error").get("engine").asText());
  }

  @Test
  void transaction_error_is_a_conflict() {
    ErrorMessage message = ErrorMessage.of(new TransactionException("txn-1", "prepare failed"));

    assertEquals(409, message.getStatus());
    assertEquals("txn-1", message.getError().get("transaction_id"));
  }

  @Test
  void timeout_maps_to_gateway_timeout() {
    assertEquals(504, ErrorMessage.of(new QueryTimeoutException(100L)).getStatus());
  }
}
