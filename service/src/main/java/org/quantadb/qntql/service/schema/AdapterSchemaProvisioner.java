/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.service.schema;

import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.quantadb.qntql.catalog.SchemaProvisioner;
import org.quantadb.qntql.catalog.model.AttributeDefinition;
import org.quantadb.qntql.storage.StorageAdapterRegistry;

/** Provisions each attribute in the backend that owns its storage classification. */
@Log4j2
@RequiredArgsConstructor
public class AdapterSchemaProvisioner implements SchemaProvisioner {

  private final StorageAdapterRegistry adapters;

  @Override
  public void provision(
      String bucket, String record, String attribute, AttributeDefinition definition) {
    log.info(
        "Provisioning {} attribute {}.{}.{}",
        definition.type().getEngineName(),
        bucket,
        record,
        attribute);
    adapters.get(definition.type()).provisionAttribute(bucket, record, attribute, definition);
  }
}
