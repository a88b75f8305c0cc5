/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.catalog;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.quantadb.qntql.catalog.model.AttributeDefinition;
import org.quantadb.qntql.catalog.model.Bucket;
import org.quantadb.qntql.catalog.model.BucketInfo;
import org.quantadb.qntql.catalog.model.RecordSchema;
import org.quantadb.qntql.common.utils.StringUtils;
import org.quantadb.qntql.exception.SchemaException;
import org.quantadb.qntql.storage.StorageClassification;

/**
 * Default implementation of {@link SchemaRegistry}. It is per-jvm single instance.
 *
 * <p>Lookups never lock: each {@link Bucket} publishes an immutable snapshot of its records. Schema
 * writes to one bucket are serialized by the bucket's write lock, and the {@link
 * SchemaProvisioner} runs while the lock is held, so a record can never be provisioned twice by
 * racing creations. Writes to different buckets proceed independently.
 */
@Log4j2
@RequiredArgsConstructor
public class DefaultSchemaRegistry implements SchemaRegistry {

  private static final String NAME_REGEX = "[A-Za-z_][A-Za-z0-9_]*";

  private final ConcurrentHashMap<String, Bucket> buckets = new ConcurrentHashMap<>();

  private final SchemaProvisioner provisioner;

  @Override
  public BucketInfo createBucket(String name) {
    validateName(name, "Bucket");
    Bucket bucket = new Bucket(name);
    if (buckets.putIfAbsent(name, bucket) != null) {
      throw new SchemaException(StringUtils.format("Bucket %s already exists", name));
    }
    log.info("Created bucket {}", name);
    return bucket.info();
  }

  @Override
  public Optional<Bucket> findBucket(String name) {
    return name == null ? Optional.empty() : Optional.ofNullable(buckets.get(name));
  }

  @Override
  public Bucket getBucket(String name) {
    return findBucket(name)
        .orElseThrow(
            () -> new SchemaException(StringUtils.format("Bucket %s does not exist", name)));
  }

  @Override
  public List<BucketInfo> listBuckets() {
    return buckets.values().stream()
        .map(Bucket::info)
        .sorted(Comparator.comparing(BucketInfo::name))
        .collect(Collectors.toList());
  }

  @Override
  public void dropBucket(String name) {
    Bucket bucket = getBucket(name);
    bucket.getWriteLock().lock();
    try {
      buckets.remove(name, bucket);
    } finally {
      bucket.getWriteLock().unlock();
    }
    log.info("Dropped bucket {} with {} record(s)", name, bucket.getRecords().size());
  }

  @Override
  public RecordSchema createRecord(String bucketName, RecordSchema schema) {
    Bucket bucket = getBucket(bucketName);
    validateName(schema.getName(), "Record");
    bucket.getWriteLock().lock();
    try {
      if (bucket.getRecord(schema.getName()).isPresent()) {
        throw new SchemaException(
            StringUtils.format(
                "Record %s already exists in bucket %s", schema.getName(), bucketName),
            schema.getName(),
            null);
      }
      schema.getAttributes().forEach((name, def) -> validateAttribute(bucket, schema, name, def));
      schema
          .getAttributes()
          .forEach(
              (name, definition) ->
                  provisioner.provision(bucketName, schema.getName(), name, definition));
      bucket.putRecord(schema);
    } finally {
      bucket.getWriteLock().unlock();
    }
    log.info(
        "Created record {}.{} on engines {}", bucketName, schema.getName(), schema.getEngines());
    return schema;
  }

  @Override
  public RecordSchema addAttributes(
      String bucketName, String record, Map<String, AttributeDefinition> attributes) {
    Preconditions.checkArgument(!attributes.isEmpty(), "No attributes to add to %s", record);
    Bucket bucket = getBucket(bucketName);
    bucket.getWriteLock().lock();
    try {
      RecordSchema current = getRecord(bucketName, record);
      RecordSchema evolved = current.withAttributes(attributes);
      if (!evolved.getKeyAttribute().equals(current.getKeyAttribute())) {
        throw new SchemaException(
            StringUtils.format(
                "Adding %s would change the key of record %s", RecordSchema.ID, record),
            record,
            RecordSchema.ID);
      }
      attributes.forEach(
          (name, definition) -> validateAttribute(bucket, evolved, name, definition));
      attributes.forEach(
          (name, definition) -> provisioner.provision(bucketName, record, name, definition));
      bucket.putRecord(evolved);
      log.info("Added attributes {} to record {}.{}", attributes.keySet(), bucketName, record);
      return evolved;
    } finally {
      bucket.getWriteLock().unlock();
    }
  }

  @Override
  public RecordSchema getRecord(String bucketName, String record) {
    return getBucket(bucketName)
        .getRecord(record)
        .orElseThrow(
            () ->
                new SchemaException(
                    StringUtils.format(
                        "Record %s does not exist in bucket %s", record, bucketName),
                    record,
                    null));
  }

  private void validateAttribute(
      Bucket bucket, RecordSchema schema, String name, AttributeDefinition definition) {
    validateName(name, "Attribute");
    switch (definition.type()) {
      case SCALAR:
        if (definition.datatype() != null) {
          definition.scalarType();
        }
        break;
      case RELATION:
        String target = definition.target();
        if (Strings.isNullOrEmpty(target)) {
          throw new SchemaException(
              StringUtils.format(
                  "Relation attribute %s.%s needs a target record", schema.getName(), name),
              schema.getName(),
              name);
        }
        if (!target.equals(schema.getName()) && bucket.getRecord(target).isEmpty()) {
          throw new SchemaException(
              StringUtils.format(
                  "Relation attribute %s.%s targets unknown record %s",
                  schema.getName(), name, target),
              schema.getName(),
              name);
        }
        break;
      default:
        break;
    }
    if (name.equals(schema.getKeyAttribute())
        && definition.type() != StorageClassification.SCALAR
        && definition.type() != StorageClassification.DOCUMENT) {
      throw new SchemaException(
          StringUtils.format(
              "Key attribute %s.%s must be scalar or document", schema.getName(), name),
          schema.getName(),
          name);
    }
  }

  private static void validateName(String name, String kind) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(name), "%s name is required", kind);
    if (!name.matches(NAME_REGEX)) {
      throw new SchemaException(
          StringUtils.format(
              "%s name %s contains illegal characters. Allowed characters: a-zA-Z0-9_",
              kind, name));
    }
  }
}
