/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.executor;

import com.google.common.base.Stopwatch;
import com.google.common.base.Throwables;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import lombok.extern.log4j.Log4j2;
import org.quantadb.qntql.common.setting.QuantaSettings;
import org.quantadb.qntql.exception.EngineException;
import org.quantadb.qntql.exception.QueryEngineException;
import org.quantadb.qntql.exception.QueryTimeoutException;
import org.quantadb.qntql.exception.TransactionException;
import org.quantadb.qntql.executor.transaction.Transaction;
import org.quantadb.qntql.executor.transaction.TransactionManager;
import org.quantadb.qntql.planner.physical.EngineFragment;
import org.quantadb.qntql.planner.physical.ExecutablePlan;
import org.quantadb.qntql.storage.NativeQuery;
import org.quantadb.qntql.storage.StorageAdapter;
import org.quantadb.qntql.storage.StorageAdapterRegistry;
import org.quantadb.qntql.storage.StorageClassification;

/**
 * Runs the fragments of a plan against the storage adapters on a bounded worker pool.
 *
 * <ol>
 *   <li>Unkeyed fragments are submitted at once and run concurrently
 *   <li>A keyed fragment is chained on its upstream fragments and starts once they finish, with the
 *       intersection of their keys bound into its key parameter
 *   <li>A keyed fragment receiving no keys is not sent to its backend
 *   <li>The whole statement waits at most the configured timeout; on expiry every task is
 *       cancelled with interruption and an open transaction is rolled back
 * </ol>
 */
@Log4j2
public class ExecutionCoordinator implements AutoCloseable {

  private final StorageAdapterRegistry adapters;

  private final TransactionManager transactionManager;

  private final ListeningExecutorService executor;

  private final long timeoutMillis;

  public ExecutionCoordinator(
      StorageAdapterRegistry adapters,
      TransactionManager transactionManager,
      QuantaSettings.Execution settings) {
    this(
        adapters,
        transactionManager,
        MoreExecutors.listeningDecorator(
            Executors.newFixedThreadPool(
                settings.getWorkerThreads(),
                new ThreadFactoryBuilder()
                    .setNameFormat("qntql-worker-%d")
                    .setDaemon(true)
                    .build())),
        settings.getQueryTimeoutMs());
  }

  public ExecutionCoordinator(
      StorageAdapterRegistry adapters,
      TransactionManager transactionManager,
      ListeningExecutorService executor,
      long timeoutMillis) {
    this.adapters = adapters;
    this.transactionManager = transactionManager;
    this.executor = executor;
    this.timeoutMillis = timeoutMillis;
  }

  /**
   * Executes every fragment of the plan.
   *
   * @param transaction open transaction whose handles the reads use, or null
   * @param allowPartialResults report failed fragments instead of failing; ignored inside a
   *     transaction
   * @throws EngineException if a fragment fails and partial results are not allowed
   * @throws QueryTimeoutException if the plan does not finish within the timeout
   */
  public ExecutionResult execute(
      ExecutablePlan plan, Transaction transaction, boolean allowPartialResults) {
    boolean partial = allowPartialResults && transaction == null;
    Map<String, ListenableFuture<FragmentResult>> futures = new LinkedHashMap<>();
    for (EngineFragment fragment : plan.getFragments()) {
      NativeQuery query = plan.getQuery(fragment.id());
      ListenableFuture<FragmentResult> future;
      if (!fragment.isKeyed()) {
        future = executor.submit(() -> select(plan.getBucket(), fragment, query, transaction));
      } else {
        List<ListenableFuture<FragmentResult>> upstream = new ArrayList<>();
        fragment.keyInput().upstream().forEach(id -> upstream.add(futures.get(id)));
        future =
            Futures.transformAsync(
                Futures.allAsList(upstream),
                results -> keyed(plan.getBucket(), fragment, query, results, transaction),
                MoreExecutors.directExecutor());
      }
      if (partial) {
        future =
            Futures.catching(
                future,
                EngineException.class,
                e -> {
                  log.warn("Fragment {} failed, continuing with partial results", fragment.id(), e);
                  return FragmentResult.failed(fragment, query, e);
                },
                MoreExecutors.directExecutor());
      }
      futures.put(fragment.id(), future);
    }

    List<FragmentResult> results = await(futures.values(), transaction);
    Map<String, FragmentResult> byId = new LinkedHashMap<>();
    results.forEach(result -> byId.put(result.getFragment().id(), result));
    return new ExecutionResult(plan, byId);
  }

  /**
   * Runs one write call on the worker pool under the statement timeout.
   *
   * @throws EngineException if the adapter fails
   * @throws QueryTimeoutException if the call does not finish in time
   */
  public <T> T write(
      StorageClassification engine,
      Transaction transaction,
      String description,
      Function<StorageAdapter, T> operation) {
    ListenableFuture<T> future =
        executor.submit(
            () -> {
              log.debug("[{}] {}", engine.getEngineName(), description);
              try {
                return operation.apply(adapters.get(engine));
              } catch (EngineException e) {
                throw e;
              } catch (RuntimeException e) {
                throw new EngineException(engine, description + " failed: " + e.getMessage(), e);
              }
            });
    return await(List.of(future), transaction).get(0);
  }

  private ListenableFuture<FragmentResult> keyed(
      String bucket,
      EngineFragment fragment,
      NativeQuery query,
      List<FragmentResult> upstream,
      Transaction transaction) {
    Optional<FragmentResult> failed =
        upstream.stream().filter(FragmentResult::isFailed).findFirst();
    if (failed.isPresent()) {
      return Futures.immediateFuture(FragmentResult.skipped(fragment, query, failed.get()));
    }
    List<Set<Object>> keySets = new ArrayList<>();
    upstream.forEach(result -> keySets.add(result.keys()));
    List<Object> keys = new ArrayList<>(KeySets.intersection(keySets));
    NativeQuery bound = query.bind(fragment.keyInput().parameter(), keys);
    if (keys.isEmpty()) {
      log.debug("Fragment {} received no keys, skipping backend call", fragment.id());
      return Futures.immediateFuture(FragmentResult.empty(fragment, bound));
    }
    return executor.submit(() -> select(bucket, fragment, bound, transaction));
  }

  private FragmentResult select(
      String bucket, EngineFragment fragment, NativeQuery query, Transaction transaction) {
    StorageClassification engine = fragment.engine();
    String txnId = transaction == null ? null : transaction.handleId(engine);
    log.debug("[{}] {} {}", engine.getEngineName(), fragment.id(), query.getText());
    Stopwatch stopwatch = Stopwatch.createStarted();
    try {
      List<Map<String, Object>> rows =
          adapters
              .get(engine)
              .select(bucket, fragment.record().getName(), fragment.attributes(), query, txnId);
      return FragmentResult.success(
          fragment,
          query,
          rows == null ? List.of() : rows,
          stopwatch.elapsed(TimeUnit.MILLISECONDS));
    } catch (EngineException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new EngineException(
          engine, "Fragment " + fragment.id() + " failed: " + e.getMessage(), e);
    }
  }

  private <T> List<T> await(
      Collection<ListenableFuture<T>> futures, Transaction transaction) {
    ListenableFuture<List<T>> all = Futures.allAsList(futures);
    try {
      return all.get(timeoutMillis, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      cancel(futures);
      QueryTimeoutException timeout = new QueryTimeoutException(timeoutMillis);
      if (transaction != null) {
        log.warn("Statement timed out, rolling back transaction {}", transaction.getId());
        try {
          transactionManager.rollback(transaction.getId());
        } catch (TransactionException rollbackFailure) {
          timeout.addSuppressed(rollbackFailure);
        }
      }
      throw timeout;
    } catch (ExecutionException e) {
      cancel(futures);
      Throwable cause = e.getCause();
      Throwables.throwIfInstanceOf(cause, QueryEngineException.class);
      Throwables.throwIfUnchecked(cause);
      throw new IllegalStateException("Fragment execution failed", cause);
    } catch (InterruptedException e) {
      cancel(futures);
      Thread.currentThread().interrupt();
      throw new QueryEngineException("Interrupted while waiting for backends", e);
    }
  }

  private static <T> void cancel(Collection<ListenableFuture<T>> futures) {
    futures.forEach(future -> future.cancel(true));
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }
}
