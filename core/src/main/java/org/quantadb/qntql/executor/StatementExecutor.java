/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.executor;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import lombok.extern.log4j.Log4j2;
import org.quantadb.qntql.analysis.model.AnalyzedAdd;
import org.quantadb.qntql.analysis.model.AnalyzedAlterRecord;
import org.quantadb.qntql.analysis.model.AnalyzedCreateRecord;
import org.quantadb.qntql.analysis.model.AnalyzedCreateRelation;
import org.quantadb.qntql.analysis.model.AnalyzedExplain;
import org.quantadb.qntql.analysis.model.AnalyzedQuery;
import org.quantadb.qntql.analysis.model.AnalyzedRemove;
import org.quantadb.qntql.analysis.model.AnalyzedStatement;
import org.quantadb.qntql.analysis.model.AnalyzedStatementVisitor;
import org.quantadb.qntql.analysis.model.AnalyzedTransaction;
import org.quantadb.qntql.analysis.model.AnalyzedUpdate;
import org.quantadb.qntql.analysis.model.OutputColumn;
import org.quantadb.qntql.analysis.model.RecordScope;
import org.quantadb.qntql.assembler.AssembledResult;
import org.quantadb.qntql.assembler.ResultAssembler;
import org.quantadb.qntql.ast.expression.Expression;
import org.quantadb.qntql.ast.expression.Expressions;
import org.quantadb.qntql.ast.expression.ResolvedAttribute;
import org.quantadb.qntql.catalog.SchemaRegistry;
import org.quantadb.qntql.catalog.model.RecordSchema;
import org.quantadb.qntql.common.setting.QuantaSettings;
import org.quantadb.qntql.exception.EngineException;
import org.quantadb.qntql.exception.TransactionException;
import org.quantadb.qntql.executor.transaction.Transaction;
import org.quantadb.qntql.executor.transaction.TransactionManager;
import org.quantadb.qntql.planner.PlanPrinter;
import org.quantadb.qntql.planner.logical.LogicalPlan;
import org.quantadb.qntql.planner.logical.LogicalPlanner;
import org.quantadb.qntql.planner.optimizer.CardinalityEstimator;
import org.quantadb.qntql.planner.optimizer.LogicalPlanOptimizer;
import org.quantadb.qntql.planner.physical.EngineFragment;
import org.quantadb.qntql.planner.physical.ExecutablePlan;
import org.quantadb.qntql.planner.physical.PhysicalPlanner;
import org.quantadb.qntql.response.EngineReport;
import org.quantadb.qntql.response.QueryResponse;
import org.quantadb.qntql.response.ResponseMetadata;
import org.quantadb.qntql.storage.NativeQuery;
import org.quantadb.qntql.storage.QueryParameter;
import org.quantadb.qntql.storage.RowShape;
import org.quantadb.qntql.storage.StorageClassification;
import org.quantadb.qntql.translator.EngineTranslator;
import org.quantadb.qntql.translator.TranslatorRegistry;

/**
 * Executes analyzed statements.
 *
 * <p>Reads go through the logical planner, the optimizer, the physical planner, the coordinator
 * and the assembler. Writes are split per engine and sent through the coordinator, inside an
 * implicit transaction when they touch more than one engine. Schema statements go to the registry.
 */
@Log4j2
public class StatementExecutor
    implements AnalyzedStatementVisitor<QueryResponse, StatementExecutor.Session> {

  private final SchemaRegistry schemaRegistry;

  private final TranslatorRegistry translators;

  private final ExecutionCoordinator coordinator;

  private final TransactionManager transactionManager;

  private final LogicalPlanner logicalPlanner;

  private final LogicalPlanOptimizer optimizer;

  private final PhysicalPlanner physicalPlanner;

  private final ResultAssembler assembler;

  private final boolean implicitTransactions;

  public StatementExecutor(
      SchemaRegistry schemaRegistry,
      TranslatorRegistry translators,
      ExecutionCoordinator coordinator,
      TransactionManager transactionManager,
      QuantaSettings settings) {
    CardinalityEstimator estimator = new CardinalityEstimator(settings.getPlanner());
    this.schemaRegistry = schemaRegistry;
    this.translators = translators;
    this.coordinator = coordinator;
    this.transactionManager = transactionManager;
    this.logicalPlanner = new LogicalPlanner(estimator);
    this.optimizer = LogicalPlanOptimizer.create(translators, estimator);
    this.physicalPlanner = new PhysicalPlanner(translators, estimator, settings.getPlanner());
    this.assembler = new ResultAssembler();
    this.implicitTransactions = settings.getExecution().isImplicitTransactions();
  }

  /**
   * Executes one statement.
   *
   * @param transaction client-held transaction the statement joins, or null
   * @param allowPartialResults report failed read fragments instead of failing
   */
  public QueryResponse execute(
      AnalyzedStatement statement, Transaction transaction, boolean allowPartialResults) {
    Session session = new Session(transaction, allowPartialResults);
    if (transaction == null) {
      return statement.accept(this, session);
    }
    return transactionManager.withLock(
        transaction,
        () -> {
          try {
            return statement.accept(this, session);
          } catch (EngineException e) {
            abort(transaction, e);
            throw e;
          }
        });
  }

  /** Plans a read without running it. */
  public ExecutablePlan plan(AnalyzedQuery query) {
    LogicalPlan logical = optimizer.optimize(logicalPlanner.plan(query));
    return physicalPlanner.plan(query.bucket(), logical);
  }

  @Override
  public QueryResponse visitQuery(AnalyzedQuery node, Session session) {
    ExecutablePlan plan = plan(node);
    ExecutionResult result =
        coordinator.execute(plan, session.transaction, session.allowPartialResults);
    AssembledResult assembled = assembler.assemble(result);
    result.getStatistics().forEach(session::merge);
    return session
        .response(assembled.rows())
        .metadata(
            session
                .metadata()
                .totalCount(assembled.totalCount())
                .returnedCount(assembled.rows().size())
                .page(assembled.page())
                .pageSize(assembled.pageSize())
                .warnings(result.isPartial() ? result.getWarnings() : null)
                .build())
        .build();
  }

  @Override
  public QueryResponse visitAdd(AnalyzedAdd node, Session session) {
    RecordSchema record = node.record();
    String keyAttribute = record.getKeyAttribute();
    Map<StorageClassification, Map<String, Object>> writes =
        new EnumMap<>(StorageClassification.class);
    writes.put(record.getKeyEngine(), new LinkedHashMap<>());
    node.values()
        .forEach(
            (attribute, value) ->
                writes
                    .computeIfAbsent(
                        record.getAttribute(attribute).orElseThrow().type(),
                        engine -> new LinkedHashMap<>())
                    .put(attribute, value));
    writes.values().forEach(values -> values.putIfAbsent(keyAttribute, node.key()));

    return writing(
        session,
        writes.keySet(),
        txn -> {
          for (Map.Entry<StorageClassification, Map<String, Object>> write : writes.entrySet()) {
            StorageClassification engine = write.getKey();
            long start = System.nanoTime();
            coordinator.write(
                engine,
                txn,
                "insert into " + record.getName(),
                adapter -> {
                  adapter.insert(
                      node.bucket(), record.getName(), write.getValue(), handleId(txn, engine));
                  return null;
                });
            session.written(engine, 1, start);
          }
          return 1L;
        });
  }

  @Override
  public QueryResponse visitUpdate(AnalyzedUpdate node, Session session) {
    RecordSchema record = node.record();
    Map<StorageClassification, Map<String, Object>> writes =
        new EnumMap<>(StorageClassification.class);
    node.values()
        .forEach(
            (attribute, value) ->
                writes
                    .computeIfAbsent(
                        record.getAttribute(attribute).orElseThrow().type(),
                        engine -> new LinkedHashMap<>())
                    .put(attribute, value));

    return writing(
        session,
        writes.keySet(),
        txn -> {
          Map<StorageClassification, NativeQuery> conditions =
              conditions(node.bucket(), record, node.condition(), writes.keySet(), txn);
          long affected = 0;
          for (Map.Entry<StorageClassification, Map<String, Object>> write : writes.entrySet()) {
            StorageClassification engine = write.getKey();
            if (isEmptyMatch(node.condition(), conditions, engine)) {
              continue;
            }
            long start = System.nanoTime();
            long count =
                coordinator.write(
                    engine,
                    txn,
                    "update " + record.getName(),
                    adapter ->
                        adapter.update(
                            node.bucket(),
                            record.getName(),
                            write.getValue(),
                            conditions.get(engine),
                            handleId(txn, engine)));
            session.written(engine, count, start);
            affected = Math.max(affected, count);
          }
          return affected;
        });
  }

  @Override
  public QueryResponse visitRemove(AnalyzedRemove node, Session session) {
    RecordSchema record = node.record();
    Set<StorageClassification> engines = record.getEngines();
    return writing(
        session,
        engines,
        txn -> {
          Map<StorageClassification, NativeQuery> conditions =
              conditions(node.bucket(), record, node.condition(), engines, txn);
          long affected = 0;
          for (StorageClassification engine : engines) {
            if (isEmptyMatch(node.condition(), conditions, engine)) {
              continue;
            }
            long start = System.nanoTime();
            long count =
                coordinator.write(
                    engine,
                    txn,
                    "remove from " + record.getName(),
                    adapter ->
                        adapter.delete(
                            node.bucket(),
                            record.getName(),
                            conditions.get(engine),
                            handleId(txn, engine)));
            session.written(engine, count, start);
            affected = Math.max(affected, count);
          }
          return affected;
        });
  }

  @Override
  public QueryResponse visitCreateRelation(AnalyzedCreateRelation node, Session session) {
    RecordSchema record = node.record();
    Map<String, Object> values = new LinkedHashMap<>();
    values.put(record.getKeyAttribute(), node.from());
    values.put(node.attribute(), node.to());
    if (node.properties() != null && !node.properties().isEmpty()) {
      values.put(RowShape.PROPERTIES, node.properties());
    }
    StorageClassification engine = StorageClassification.RELATION;
    return writing(
        session,
        EnumSet.of(engine),
        txn -> {
          long start = System.nanoTime();
          coordinator.write(
              engine,
              txn,
              "create relation " + record.getName() + "." + node.attribute(),
              adapter -> {
                adapter.insert(node.bucket(), record.getName(), values, handleId(txn, engine));
                return null;
              });
          session.written(engine, 1, start);
          return 1L;
        });
  }

  @Override
  public QueryResponse visitCreateRecord(AnalyzedCreateRecord node, Session session) {
    RecordSchema created = schemaRegistry.createRecord(node.bucket(), node.schema());
    return schemaResponse(created, session);
  }

  @Override
  public QueryResponse visitAlterRecord(AnalyzedAlterRecord node, Session session) {
    RecordSchema altered =
        schemaRegistry.addAttributes(node.bucket(), node.record(), node.additions());
    return schemaResponse(altered, session);
  }

  @Override
  public QueryResponse visitTransaction(AnalyzedTransaction node, Session session) {
    Transaction transaction = transactionManager.begin();
    Session nested = new Session(transaction, false);
    List<Map<String, Object>> results = new ArrayList<>();
    try {
      for (AnalyzedStatement statement : node.statements()) {
        QueryResponse response = statement.accept(this, nested);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("statement", results.size() + 1);
        result.put("data", response.getData());
        if (response.getMetadata().getAffectedCount() != null) {
          result.put("affected_count", response.getMetadata().getAffectedCount());
        }
        results.add(result);
      }
    } catch (RuntimeException e) {
      abort(transaction, e);
      throw e;
    }
    if (node.commit()) {
      transactionManager.commit(transaction.getId());
    } else {
      transactionManager.rollback(transaction.getId());
    }
    nested.statistics.forEach(session::merge);
    return session
        .response(results)
        .metadata(
            session
                .metadata()
                .totalCount(results.size())
                .returnedCount(results.size())
                .pageSize(results.size())
                .transactionId(transaction.getId())
                .transactionState(transaction.getState().name())
                .build())
        .build();
  }

  @Override
  public QueryResponse visitExplain(AnalyzedExplain node, Session session) {
    ExecutablePlan plan = plan(node.query());
    List<Map<String, Object>> queries = new ArrayList<>();
    for (EngineFragment fragment : plan.getFragments()) {
      NativeQuery query = plan.getQuery(fragment.id());
      Map<String, Object> parameters = new LinkedHashMap<>();
      for (QueryParameter parameter : query.getParameters()) {
        parameters.put(parameter.name(), parameter.value());
      }
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("fragment", fragment.id());
      entry.put("engine", fragment.engine().getEngineName());
      entry.put("query", query.getText());
      entry.put("parameters", parameters);
      queries.add(entry);
    }
    Map<String, Object> explain = new LinkedHashMap<>();
    explain.put("logical", PlanPrinter.print(plan.getLogicalPlan()));
    explain.put("physical", PlanPrinter.print(plan.getRoot()));
    explain.put("native_queries", queries);
    return session
        .response(List.of(explain))
        .metadata(session.metadata().totalCount(1).returnedCount(1).pageSize(1).build())
        .build();
  }

  /**
   * Runs a write, inside an implicit transaction when it spans several engines and the statement
   * has none of its own.
   */
  private QueryResponse writing(
      Session session, Set<StorageClassification> engines, WriteOperation operation) {
    long affected;
    if (session.transaction == null && implicitTransactions && engines.size() > 1) {
      Transaction transaction = transactionManager.begin();
      log.debug("Implicit transaction {} for write on {}", transaction.getId(), engines);
      try {
        affected = operation.apply(transaction);
      } catch (RuntimeException e) {
        abort(transaction, e);
        throw e;
      }
      transactionManager.commit(transaction.getId());
    } else {
      affected = operation.apply(session.transaction);
    }
    return session
        .response(List.of())
        .metadata(session.metadata().totalCount(affected).affectedCount(affected).build())
        .build();
  }

  /**
   * Native condition per engine. A condition the engine evaluates itself is translated directly.
   * Otherwise the matching keys are resolved once through the read pipeline, before any engine is
   * written, and turned into a key condition.
   */
  private Map<StorageClassification, NativeQuery> conditions(
      String bucket,
      RecordSchema record,
      Expression condition,
      Set<StorageClassification> engines,
      Transaction transaction) {
    Map<StorageClassification, NativeQuery> conditions =
        new EnumMap<>(StorageClassification.class);
    if (condition == null) {
      return conditions;
    }
    List<Object> keys = null;
    for (StorageClassification engine : engines) {
      EngineTranslator translator = translators.get(engine);
      if (Expressions.engines(condition).equals(EnumSet.of(engine))
          && translator.canPushDown(condition)) {
        conditions.put(engine, translator.translateCondition(bucket, record, condition));
        continue;
      }
      if (keys == null) {
        keys = resolveKeys(bucket, record, condition, transaction);
      }
      if (!keys.isEmpty()) {
        conditions.put(engine, translator.translateKeyCondition(bucket, record, keys));
      }
    }
    return conditions;
  }

  @VisibleForTesting
  List<Object> resolveKeys(
      String bucket, RecordSchema record, Expression condition, Transaction transaction) {
    String alias = record.getName();
    String keyAttribute = record.getKeyAttribute();
    ResolvedAttribute key =
        new ResolvedAttribute(
            alias, alias, keyAttribute, List.of(), record.getAttribute(keyAttribute).orElseThrow());
    AnalyzedQuery query =
        new AnalyzedQuery(
            bucket,
            new RecordScope(Map.of(alias, record)),
            List.of(new OutputColumn(alias, keyAttribute, key)),
            List.of(),
            condition,
            List.of(),
            List.of(),
            null,
            List.of(),
            null,
            null);
    AssembledResult matched =
        assembler.assemble(coordinator.execute(plan(query), transaction, false));
    List<Object> keys = new ArrayList<>();
    for (Map<String, Object> row : matched.rows()) {
      Object group = row.get(alias);
      if (group instanceof Map<?, ?> values && values.get(keyAttribute) != null) {
        keys.add(values.get(keyAttribute));
      }
    }
    log.debug(
        "Condition {} matched {} {} records", Expressions.describe(condition), keys.size(), alias);
    return keys;
  }

  /** A condition that resolved to no keys matches nothing on the engine. */
  private static boolean isEmptyMatch(
      Expression condition,
      Map<StorageClassification, NativeQuery> conditions,
      StorageClassification engine) {
    return condition != null && !conditions.containsKey(engine);
  }

  private void abort(Transaction transaction, RuntimeException failure) {
    if (transactionManager.find(transaction.getId()).isEmpty()) {
      return;
    }
    log.warn("Rolling back transaction {} after failure", transaction.getId(), failure);
    try {
      transactionManager.rollback(transaction.getId());
    } catch (TransactionException rollbackFailure) {
      failure.addSuppressed(rollbackFailure);
    }
  }

  private static String handleId(Transaction transaction, StorageClassification engine) {
    return transaction == null ? null : transaction.handleId(engine);
  }

  private QueryResponse schemaResponse(RecordSchema schema, Session session) {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put("record", schema.getName());
    row.put("attributes", schema.getAttributes());
    return session
        .response(List.of(row))
        .metadata(session.metadata().totalCount(1).returnedCount(1).pageSize(1).build())
        .build();
  }

  @FunctionalInterface
  private interface WriteOperation {
    /** Returns the number of records affected. */
    long apply(Transaction transaction);
  }

  /** State of one statement execution. */
  static final class Session {

    private final Transaction transaction;

    private final boolean allowPartialResults;

    private final Stopwatch stopwatch = Stopwatch.createStarted();

    private final Map<StorageClassification, EngineStatistics> statistics =
        new EnumMap<>(StorageClassification.class);

    Session(Transaction transaction, boolean allowPartialResults) {
      this.transaction = transaction;
      this.allowPartialResults = allowPartialResults;
    }

    void merge(StorageClassification engine, EngineStatistics engineStatistics) {
      statistics.merge(
          engine,
          engineStatistics,
          (left, right) ->
              new EngineStatistics(
                  left.unitsScanned() + right.unitsScanned(),
                  left.executionTimeMs() + right.executionTimeMs(),
                  left.error() != null ? left.error() : right.error()));
    }

    void written(StorageClassification engine, long count, long startNanos) {
      merge(
          engine,
          EngineStatistics.EMPTY.add(
              count, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos)));
    }

    QueryResponse.QueryResponseBuilder response(List<Map<String, Object>> rows) {
      QueryResponse.QueryResponseBuilder builder = QueryResponse.builder().data(rows);
      statistics.forEach(
          (engine, engineStatistics) ->
              builder.engine(engine.getEngineName(), EngineReport.of(engineStatistics)));
      return builder;
    }

    ResponseMetadata.ResponseMetadataBuilder metadata() {
      ResponseMetadata.ResponseMetadataBuilder builder =
          ResponseMetadata.builder()
              .page(1)
              .executionTimeMs(stopwatch.elapsed(TimeUnit.MILLISECONDS));
      if (transaction != null) {
        builder.transactionId(transaction.getId());
      }
      return builder;
    }
  }
}
