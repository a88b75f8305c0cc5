/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.catalog;

import org.quantadb.qntql.catalog.model.AttributeDefinition;

/** Creates backend storage for a newly declared attribute. Called under the bucket write lock. */
@FunctionalInterface
public interface SchemaProvisioner {

  void provision(String bucket, String record, String attribute, AttributeDefinition definition);
}
