/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.executor.transaction;

import com.google.common.annotations.VisibleForTesting;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import lombok.extern.log4j.Log4j2;
import org.quantadb.qntql.exception.TransactionException;
import org.quantadb.qntql.storage.StorageAdapter;
import org.quantadb.qntql.storage.StorageAdapterRegistry;
import org.quantadb.qntql.storage.StorageClassification;
import org.quantadb.qntql.storage.TransactionHandle;

/**
 * Coordinator-side two-phase commit across every registered backend.
 *
 * <p>{@link #commit} asks every backend to prepare. If one refuses, every backend is rolled back
 * and the commit fails. Otherwise the decision is written to the {@link TransactionDecisionLog}
 * before any backend commits, so a crash between the two phases leaves an in-doubt entry naming
 * the backend handles to finish.
 */
@Log4j2
public class TransactionManager {

  private final StorageAdapterRegistry adapters;

  private final TransactionDecisionLog decisionLog;

  private final Map<String, Transaction> active = new ConcurrentHashMap<>();

  public TransactionManager(StorageAdapterRegistry adapters, TransactionDecisionLog decisionLog) {
    this.adapters = adapters;
    this.decisionLog = decisionLog;
    List<TransactionDecision> inDoubt = decisionLog.inDoubt();
    if (!inDoubt.isEmpty()) {
      log.warn("{} transaction(s) decided but not confirmed complete: {}", inDoubt.size(), inDoubt);
    }
  }

  /**
   * Opens a sub-transaction on every registered backend.
   *
   * @throws TransactionException if a backend fails to open one; those already opened are rolled
   *     back
   */
  public Transaction begin() {
    String id = UUID.randomUUID().toString();
    Map<StorageClassification, TransactionHandle> handles =
        new EnumMap<>(StorageClassification.class);
    for (Map.Entry<StorageClassification, StorageAdapter> entry :
        adapters.getAdapters().entrySet()) {
      try {
        handles.put(entry.getKey(), entry.getValue().beginTransaction());
      } catch (RuntimeException e) {
        TransactionException failure =
            new TransactionException(
                id,
                "Failed to begin transaction on " + entry.getKey().getEngineName(),
                e);
        rollbackHandles(id, handles, failure);
        throw failure;
      }
    }
    Transaction transaction = new Transaction(id, handles);
    active.put(id, transaction);
    log.info("Began transaction {} on {}", id, handles.keySet());
    return transaction;
  }

  /**
   * Two-phase commit.
   *
   * @throws TransactionException if the id is unknown, or if a backend failed to prepare, in which
   *     case every backend has been rolled back and the cause is the triggering failure
   */
  public void commit(String id) {
    Transaction transaction = get(id);
    withLock(
        transaction,
        () -> {
          checkActive(transaction);
          transaction.setState(TransactionState.PREPARING);
          try {
            forEachHandle(transaction, StorageAdapter::prepareCommit);
            decisionLog.append(decision(transaction, TransactionDecision.Outcome.COMMIT));
          } catch (RuntimeException e) {
            abort(transaction, e);
          }

          RuntimeException incomplete = null;
          for (Map.Entry<StorageClassification, TransactionHandle> entry :
              transaction.getHandles().entrySet()) {
            try {
              adapters.get(entry.getKey()).commit(entry.getValue());
            } catch (RuntimeException e) {
              log.error(
                  "Commit of transaction {} failed on {} after the commit decision",
                  id,
                  entry.getKey().getEngineName(),
                  e);
              if (incomplete == null) {
                incomplete = e;
              } else {
                incomplete.addSuppressed(e);
              }
            }
          }
          active.remove(id);
          if (incomplete != null) {
            throw new TransactionException(
                id, "Transaction " + id + " is in doubt: not every backend committed", incomplete);
          }
          decisionLog.append(decision(transaction, TransactionDecision.Outcome.COMPLETED));
          transaction.setState(TransactionState.COMMITTED);
          log.info("Committed transaction {}", id);
          return null;
        });
  }

  /**
   * Rolls back every backend whatever the current state and forgets the transaction.
   *
   * @throws TransactionException if the id is unknown or a backend failed to roll back
   */
  public void rollback(String id) {
    Transaction transaction = get(id);
    withLock(
        transaction,
        () -> {
          TransactionException failure =
              new TransactionException(id, "Rollback of transaction " + id + " failed");
          rollbackHandles(id, transaction.getHandles(), failure);
          transaction.setState(TransactionState.ROLLED_BACK);
          active.remove(id);
          log.info("Rolled back transaction {}", id);
          if (failure.getSuppressed().length > 0) {
            throw failure;
          }
          return null;
        });
  }

  /**
   * Runs work that uses the transaction's handles. Statements of one transaction run one at a
   * time.
   */
  public <T> T withLock(Transaction transaction, Supplier<T> work) {
    transaction.getLock().lock();
    try {
      return work.get();
    } finally {
      transaction.getLock().unlock();
    }
  }

  /**
   * Active transaction by id.
   *
   * @throws TransactionException if no such transaction is active
   */
  public Transaction get(String id) {
    return find(id)
        .orElseThrow(() -> new TransactionException(id, "Unknown transaction: " + id));
  }

  public Optional<Transaction> find(String id) {
    return id == null ? Optional.empty() : Optional.ofNullable(active.get(id));
  }

  public Collection<Transaction> getActiveTransactions() {
    return Collections.unmodifiableCollection(active.values());
  }

  /** Transactions decided COMMIT whose completion was never recorded. */
  public List<TransactionDecision> getInDoubtTransactions() {
    return decisionLog.inDoubt();
  }

  @VisibleForTesting
  TransactionDecisionLog getDecisionLog() {
    return decisionLog;
  }

  private static void checkActive(Transaction transaction) {
    if (transaction.getState() != TransactionState.ACTIVE) {
      throw new TransactionException(
          transaction.getId(),
          "Transaction " + transaction.getId() + " is " + transaction.getState());
    }
  }

  private void abort(Transaction transaction, RuntimeException cause) {
    String id = transaction.getId();
    log.error("Prepare of transaction {} failed, rolling back", id, cause);
    transaction.setState(TransactionState.ABORTING);
    TransactionException failure =
        new TransactionException(
            id, "Transaction " + id + " aborted: " + cause.getMessage(), cause);
    rollbackHandles(id, transaction.getHandles(), failure);
    transaction.setState(TransactionState.ROLLED_BACK);
    active.remove(id);
    throw failure;
  }

  /** Rolls back every handle; failures are attached to {@code failure} as suppressed. */
  private void rollbackHandles(
      String id,
      Map<StorageClassification, TransactionHandle> handles,
      TransactionException failure) {
    for (Map.Entry<StorageClassification, TransactionHandle> entry : handles.entrySet()) {
      try {
        adapters.get(entry.getKey()).rollback(entry.getValue());
      } catch (RuntimeException e) {
        log.warn(
            "Rollback of transaction {} failed on {}", id, entry.getKey().getEngineName(), e);
        failure.addSuppressed(e);
      }
    }
  }

  private void forEachHandle(Transaction transaction, HandleAction action) {
    for (Map.Entry<StorageClassification, TransactionHandle> entry :
        transaction.getHandles().entrySet()) {
      action.apply(adapters.get(entry.getKey()), entry.getValue());
    }
  }

  private static TransactionDecision decision(
      Transaction transaction, TransactionDecision.Outcome outcome) {
    Map<String, String> handles = new TreeMap<>();
    transaction
        .getHandles()
        .forEach((engine, handle) -> handles.put(engine.getEngineName(), handle.getId()));
    return new TransactionDecision(
        transaction.getId(), outcome, handles, System.currentTimeMillis());
  }

  @FunctionalInterface
  private interface HandleAction {
    void apply(StorageAdapter adapter, TransactionHandle handle);
  }
}
