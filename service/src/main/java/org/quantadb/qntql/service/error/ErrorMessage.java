/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.service.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import org.quantadb.qntql.exception.EngineException;
import org.quantadb.qntql.exception.LexicalException;
import org.quantadb.qntql.exception.QueryTimeoutException;
import org.quantadb.qntql.exception.SchemaException;
import org.quantadb.qntql.exception.SyntaxCheckException;
import org.quantadb.qntql.exception.TransactionException;
import org.quantadb.qntql.exception.TypeMismatchException;

/** Error document returned in place of a response. */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorMessage {

  public static final int BAD_REQUEST = 400;

  public static final int CONFLICT = 409;

  public static final int SERVICE_UNAVAILABLE = 503;

  public static final int GATEWAY_TIMEOUT = 504;

  @JsonProperty("status")
  private final int status;

  @JsonProperty("error")
  private final Map<String, Object> error;

  private ErrorMessage(int status, Map<String, Object> error) {
    this.status = status;
    this.error = error;
  }

  public static ErrorMessage of(Exception exception) {
    Map<String, Object> error = new LinkedHashMap<>();
    error.put("type", exception.getClass().getSimpleName());
    error.put("reason", reason(exception));
    error.put("details", exception.getMessage());
    if (exception instanceof EngineException) {
      error.put("engine", ((EngineException) exception).getEngine().getEngineName());
    }
    if (exception instanceof TransactionException) {
      error.put("transaction_id", ((TransactionException) exception).getTransactionId());
    }
    return new ErrorMessage(status(exception), error);
  }

  /** Front-end failures are the client's; backend failures are not. */
  public static boolean isClientError(Exception exception) {
    return exception instanceof LexicalException
        || exception instanceof SyntaxCheckException
        || exception instanceof SchemaException
        || exception instanceof TypeMismatchException
        || exception instanceof IllegalArgumentException;
  }

  private static int status(Exception exception) {
    if (isClientError(exception)) {
      return BAD_REQUEST;
    } else if (exception instanceof TransactionException) {
      return CONFLICT;
    } else if (exception instanceof QueryTimeoutException) {
      return GATEWAY_TIMEOUT;
    }
    return SERVICE_UNAVAILABLE;
  }

  private static String reason(Exception exception) {
    if (isClientError(exception)) {
      return "Invalid Query";
    } else if (exception instanceof TransactionException) {
      return "Transaction Failed";
    } else if (exception instanceof QueryTimeoutException) {
      return "Query Timed Out";
    }
    return "Backend Failure";
  }

  public String toJson(ObjectMapper objectMapper) {
    try {
      return objectMapper.writeValueAsString(this);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to render error message", e);
    }
  }
}
