/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.service;

import org.quantadb.qntql.common.setting.QuantaSettings;
import org.quantadb.qntql.service.config.QuantaServiceConfig;
import org.quantadb.qntql.service.schema.SchemaService;
import org.quantadb.qntql.storage.StorageAdapterRegistry;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

/** A running engine over one set of storage adapters. Closing it stops the worker pool. */
public class QuantaDB implements AutoCloseable {

  public static final String SETTINGS_RESOURCE = "quantadb.yml";

  private final AnnotationConfigApplicationContext context;

  private QuantaDB(AnnotationConfigApplicationContext context) {
    this.context = context;
  }

  /** Starts with settings from {@value #SETTINGS_RESOURCE} on the classpath. */
  public static QuantaDB start(StorageAdapterRegistry adapters) {
    return start(adapters, QuantaSettings.fromClasspath(SETTINGS_RESOURCE));
  }

  public static QuantaDB start(StorageAdapterRegistry adapters, QuantaSettings settings) {
    AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext();
    context.registerBean(StorageAdapterRegistry.class, () -> adapters);
    context.registerBean(QuantaSettings.class, () -> settings);
    context.register(QuantaServiceConfig.class);
    context.refresh();
    return new QuantaDB(context);
  }

  public QntQLService queryService() {
    return context.getBean(QntQLService.class);
  }

  public SchemaService schemaService() {
    return context.getBean(SchemaService.class);
  }

  @Override
  public void close() {
    context.close();
  }
}
