/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.catalog;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.quantadb.qntql.catalog.model.AttributeDefinition;
import org.quantadb.qntql.catalog.model.Bucket;
import org.quantadb.qntql.catalog.model.BucketInfo;
import org.quantadb.qntql.catalog.model.RecordSchema;

/** Process-wide catalog of buckets and their record schemas. */
public interface SchemaRegistry {

  /**
   * Creates an empty bucket.
   *
   * @throws org.quantadb.qntql.exception.SchemaException if the bucket exists
   */
  BucketInfo createBucket(String name);

  Optional<Bucket> findBucket(String name);

  /**
   * Returns a bucket.
   *
   * @throws org.quantadb.qntql.exception.SchemaException if the bucket does not exist
   */
  Bucket getBucket(String name);

  List<BucketInfo> listBuckets();

  /** Removes a bucket together with its record schemas. */
  void dropBucket(String name);

  /**
   * Registers a record schema, provisioning every attribute in its backend first.
   *
   * @throws org.quantadb.qntql.exception.SchemaException if the record exists, or an attribute is
   *     invalid
   */
  RecordSchema createRecord(String bucket, RecordSchema schema);

  /** Additive schema evolution, provisioning only the new attributes. */
  RecordSchema addAttributes(
      String bucket, String record, Map<String, AttributeDefinition> attributes);

  /**
   * Returns a record schema.
   *
   * @throws org.quantadb.qntql.exception.SchemaException if bucket or record is unknown
   */
  RecordSchema getRecord(String bucket, String record);
}
