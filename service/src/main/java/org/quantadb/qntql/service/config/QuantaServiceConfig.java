/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.service.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import java.nio.file.Paths;
import org.quantadb.qntql.analysis.Analyzer;
import org.quantadb.qntql.catalog.DefaultSchemaRegistry;
import org.quantadb.qntql.catalog.SchemaRegistry;
import org.quantadb.qntql.common.setting.QuantaSettings;
import org.quantadb.qntql.engines.EngineTranslators;
import org.quantadb.qntql.executor.ExecutionCoordinator;
import org.quantadb.qntql.executor.StatementExecutor;
import org.quantadb.qntql.executor.transaction.FileDecisionLog;
import org.quantadb.qntql.executor.transaction.InMemoryDecisionLog;
import org.quantadb.qntql.executor.transaction.TransactionDecisionLog;
import org.quantadb.qntql.executor.transaction.TransactionManager;
import org.quantadb.qntql.parser.QueryParser;
import org.quantadb.qntql.service.QntQLService;
import org.quantadb.qntql.service.schema.AdapterSchemaProvisioner;
import org.quantadb.qntql.service.schema.SchemaService;
import org.quantadb.qntql.storage.StorageAdapterRegistry;
import org.quantadb.qntql.translator.TranslatorRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the query engine. The storage adapters and settings are registered by the caller before
 * this configuration is refreshed.
 */
@Configuration
public class QuantaServiceConfig {

  @Autowired
  private StorageAdapterRegistry storageAdapterRegistry;

  @Autowired
  private QuantaSettings settings;

  @Bean
  public ObjectMapper objectMapper() {
    return new ObjectMapper();
  }

  @Bean
  public SchemaRegistry schemaRegistry() {
    return new DefaultSchemaRegistry(new AdapterSchemaProvisioner(storageAdapterRegistry));
  }

  @Bean
  public TranslatorRegistry translatorRegistry(ObjectMapper objectMapper) {
    return EngineTranslators.registry(objectMapper);
  }

  /**
   * Decision log Bean. Without a configured path decisions do not survive a restart.
   *
   * @return TransactionDecisionLog.
   */
  @Bean
  public TransactionDecisionLog transactionDecisionLog() {
    String path = settings.getTransaction().getDecisionLog();
    return Strings.isNullOrEmpty(path)
        ? new InMemoryDecisionLog()
        : new FileDecisionLog(Paths.get(path));
  }

  @Bean
  public TransactionManager transactionManager(TransactionDecisionLog decisionLog) {
    return new TransactionManager(storageAdapterRegistry, decisionLog);
  }

  @Bean(destroyMethod = "close")
  public ExecutionCoordinator executionCoordinator(TransactionManager transactionManager) {
    return new ExecutionCoordinator(
        storageAdapterRegistry, transactionManager, settings.getExecution());
  }

  @Bean
  public StatementExecutor statementExecutor(
      SchemaRegistry schemaRegistry,
      TranslatorRegistry translatorRegistry,
      ExecutionCoordinator executionCoordinator,
      TransactionManager transactionManager) {
    return new StatementExecutor(
        schemaRegistry, translatorRegistry, executionCoordinator, transactionManager, settings);
  }

  @Bean
  public SchemaService schemaService(SchemaRegistry schemaRegistry) {
    SchemaService schemaService = new SchemaService(schemaRegistry);
    schemaService.preload(settings.getSchema().getPreload());
    return schemaService;
  }

  @Bean
  public QntQLService qntqlService(
      SchemaRegistry schemaRegistry,
      StatementExecutor statementExecutor,
      TransactionManager transactionManager,
      ObjectMapper objectMapper) {
    return new QntQLService(
        new QueryParser(),
        new Analyzer(schemaRegistry),
        statementExecutor,
        transactionManager,
        settings.getExecution(),
        objectMapper);
  }
}
