/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.quantadb.qntql.analysis.Analyzer;
import org.quantadb.qntql.analysis.model.AnalyzedStatement;
import org.quantadb.qntql.ast.statement.Statement;
import org.quantadb.qntql.common.setting.QuantaSettings;
import org.quantadb.qntql.exception.QueryEngineException;
import org.quantadb.qntql.executor.StatementExecutor;
import org.quantadb.qntql.executor.transaction.Transaction;
import org.quantadb.qntql.executor.transaction.TransactionDecision;
import org.quantadb.qntql.executor.transaction.TransactionManager;
import org.quantadb.qntql.parser.QueryParser;
import org.quantadb.qntql.response.QueryResponse;
import org.quantadb.qntql.service.error.ErrorMessage;

/**
 * QntQL entry point: parses, analyzes and executes one statement per request. Lexing, parsing and
 * analysis complete before any backend is called.
 */
@Log4j2
@RequiredArgsConstructor
public class QntQLService {

  private final QueryParser parser;

  private final Analyzer analyzer;

  private final StatementExecutor executor;

  private final TransactionManager transactionManager;

  private final QuantaSettings.Execution settings;

  private final ObjectMapper objectMapper;

  /**
   * Executes a request.
   *
   * @throws QueryEngineException on any parse, analysis, engine, transaction or timeout failure
   * @throws IllegalArgumentException if the bucket or query is missing
   */
  public QueryResponse execute(QueryRequest request) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(request.getBucket()), "bucket is required");
    Preconditions.checkArgument(!Strings.isNullOrEmpty(request.getQuery()), "query is required");
    Transaction transaction =
        request.getTransactionId() == null
            ? null
            : transactionManager.get(request.getTransactionId());

    Statement statement = parser.parse(request.getQuery());
    AnalyzedStatement analyzed =
        analyzer.analyze(statement, request.getBucket(), transaction != null);
    boolean allowPartialResults =
        request.getAllowPartialResults() == null
            ? settings.isAllowPartialResults()
            : request.getAllowPartialResults();

    QueryResponse response = executor.execute(analyzed, transaction, allowPartialResults);
    log.debug(
        "Executed statement on bucket {} in {} ms",
        request.getBucket(),
        response.getMetadata().getExecutionTimeMs());
    return response;
  }

  /**
   * Executes a JSON request and returns the JSON response, or an error document when the request
   * fails.
   */
  public String execute(String requestJson) {
    try {
      QueryRequest request = objectMapper.readValue(requestJson, QueryRequest.class);
      return objectMapper.writeValueAsString(execute(request));
    } catch (JsonProcessingException e) {
      log.warn("Malformed query request", e);
      return ErrorMessage.of(new IllegalArgumentException("Malformed request: " + e.getMessage()))
          .toJson(objectMapper);
    } catch (QueryEngineException | IllegalArgumentException e) {
      log.error("Error happened during query handling", e);
      return ErrorMessage.of(e).toJson(objectMapper);
    }
  }

  /** Opens a client-held transaction and returns its id. */
  public String beginTransaction() {
    return transactionManager.begin().getId();
  }

  public void commit(String transactionId) {
    transactionManager.commit(transactionId);
  }

  public void rollback(String transactionId) {
    transactionManager.rollback(transactionId);
  }

  /** Transactions whose commit was decided but not confirmed by every backend. */
  public List<TransactionDecision> getInDoubtTransactions() {
    return transactionManager.getInDoubtTransactions();
  }
}
