/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */


package org.quantadb.qntql.executor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.util.concurrent.MoreExecutors;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.quantadb.qntql.WorkSchema;
import org.quantadb.qntql.exception.EngineException;
import org.quantadb.qntql.exception.QueryTimeoutException;
import org.quantadb.qntql.executor.transaction.Transaction;
import org.quantadb.qntql.executor.transaction.TransactionManager;
import org.quantadb.qntql.planner.physical.ExecutablePlan;
import org.quantadb.qntql.storage.NativeQuery;
import org.quantadb.qntql.storage.StorageAdapter;
import org.quantadb.qntql.storage.StorageAdapterRegistry;
import org.quantadb.qntql.storage.StorageClassification;

@ExtendWith(MockitoExtension.class)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ExecutionCoordinatorTest {

  private static final String FILTERED =
      "FIND tasks.title FROM tasks MATCH tasks.details.labels.team = 'core'";

  @Mock private StorageAdapter scalar;

  @Mock private StorageAdapter document;

  @Mock private TransactionManager transactionManager;

  @Mock private Transaction transaction;

  private final WorkSchema schema = new WorkSchema();

  private ExecutionCoordinator coordinator;

  @BeforeEach
  void setUp() {
    coordinator = coordinator(5_000);
  }

  @AfterEach
  void tearDown() {
    coordinator.close();
  }

  @Test
  void keyed_fragment_receives_the_driver_keys() {
    when(document.select(eq("work"), eq("tasks"), any(), any(), any()))
        .thenReturn(List.of(Map.of("id", "t2"), Map.of("id", "t3")));
    when(scalar.select(eq("work"), eq("tasks"), any(), any(), any()))
        .thenReturn(List.of(Map.of("id", "t2", "title", "Ship")));

    ExecutionResult result = coordinator.execute(schema.plan(FILTERED), null, false);

    ArgumentCaptor<NativeQuery> query = ArgumentCaptor.forClass(NativeQuery.class);
    verify(scalar)
        .select(eq("work"), eq("tasks"), eq(List.of("id", "title")), query.capture(), any());
    assertEquals(List.of("t2", "t3"), query.getValue().parameter(NativeQuery.KEYS).orElseThrow());
    assertEquals(1, result.get("f2").getRows().size());
    assertFalse(result.isPartial());
  }

  @Test
  void fragment_without_keys_is_not_sent() {
    when(document.select(any(), any(), any(), any(), any())).thenReturn(List.of());

    ExecutionResult result = coordinator.execute(schema.plan(FILTERED), null, false);

    verify(scalar, never()).select(any(), any(), any(), any(), any());
    assertTrue(result.get("f2").getRows().isEmpty());
    assertEquals(
        List.of(), result.get("f2").getQuery().parameter(NativeQuery.KEYS).orElseThrow());
  }

  @Test
  void backend_failure_fails_the_statement() {
    when(document.select(any(), any(), any(), any(), any()))
        .thenThrow(new IllegalStateException("connection refused"));

    EngineException e =
        assertThrows(
            EngineException.class, () -> coordinator.execute(schema.plan(FILTERED), null, false));

    assertEquals(StorageClassification.DOCUMENT, e.getEngine());
    assertTrue(e.getMessage().contains("connection refused"));
  }

  @Test
  void partial_results_report_failed_and_skipped_fragments() {
    when(document.select(any(), any(), any(), any(), any()))
        .thenThrow(new IllegalStateException("connection refused"));

    ExecutionResult result = coordinator.execute(schema.plan(FILTERED), null, true);

    assertTrue(result.isPartial());
    assertTrue(result.get("f1").isFailed());
    assertTrue(result.get("f2").isFailed());
    assertTrue(result.get("f2").getError().getMessage().contains("skipped"));
    assertEquals(2, result.getWarnings().size());
    assertNotNull(result.getStatistics().get(StorageClassification.DOCUMENT).error());
  }

  @Test
  void partial_results_are_ignored_inside_a_transaction() {
    when(transaction.handleId(StorageClassification.DOCUMENT)).thenReturn("mongo-1");
    when(document.select(any(), any(), any(), any(), eq("mongo-1")))
        .thenThrow(new IllegalStateException("write conflict"));

    assertThrows(
        EngineException.class,
        () -> coordinator.execute(schema.plan(FILTERED), transaction, true));
  }

  @Test
  void timeout_cancels_the_statement_and_rolls_back() {
    coordinator.close();
    coordinator = coordinator(50);
    when(transaction.getId()).thenReturn("txn-1");
    when(transaction.handleId(any())).thenReturn("h");
    when(scalar.select(any(), any(), any(), any(), any()))
        .thenAnswer(
            invocation -> {
              Thread.sleep(5_000);
              return List.of();
            });
    ExecutablePlan plan = schema.plan("FIND tasks.title FROM tasks");

    QueryTimeoutException e =
        assertThrows(
            QueryTimeoutException.class, () -> coordinator.execute(plan, transaction, false));

    assertEquals(50, e.getTimeoutMillis());
    verify(transactionManager).rollback("txn-1");
  }

  @Test
  void write_wraps_backend_failures_with_the_engine() {
    RuntimeException cause = new IllegalArgumentException("duplicate key");

    EngineException e =
        assertThrows(
            EngineException.class,
            () ->
                coordinator.write(
                    StorageClassification.SCALAR,
                    null,
                    "insert tasks",
                    adapter -> {
                      throw cause;
                    }));

    assertEquals(StorageClassification.SCALAR, e.getEngine());
    assertSame(cause, e.getCause());
    long count = coordinator.write(StorageClassification.SCALAR, null, "count", adapter -> 3L);
    assertEquals(3L, count);
  }

  private ExecutionCoordinator coordinator(long timeoutMillis) {
    return new ExecutionCoordinator(
        new StorageAdapterRegistry(
            Map.of(
                StorageClassification.SCALAR, scalar,
                StorageClassification.DOCUMENT, document)),
        transactionManager,
        MoreExecutors.listeningDecorator(Executors.newFixedThreadPool(4)),
        timeoutMillis);
  }
}
