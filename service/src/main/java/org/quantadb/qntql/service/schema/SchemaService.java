/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.service.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.quantadb.qntql.catalog.SchemaRegistry;
import org.quantadb.qntql.catalog.model.AttributeDefinition;
import org.quantadb.qntql.catalog.model.Bucket;
import org.quantadb.qntql.catalog.model.BucketInfo;
import org.quantadb.qntql.catalog.model.RecordSchema;

/** Schema administration outside QntQL statements, plus start-up preloading. */
@Log4j2
@RequiredArgsConstructor
public class SchemaService {

  private final SchemaRegistry schemaRegistry;

  public BucketInfo createBucket(String name) {
    return schemaRegistry.createBucket(name);
  }

  public List<BucketInfo> listBuckets() {
    return schemaRegistry.listBuckets();
  }

  public void dropBucket(String name) {
    schemaRegistry.dropBucket(name);
  }

  public RecordSchema createRecord(String bucket, RecordDefinition definition) {
    return schemaRegistry.createRecord(bucket, definition.toSchema());
  }

  public RecordSchema getRecord(String bucket, String record) {
    return schemaRegistry.getRecord(bucket, record);
  }

  public RecordSchema addAttribute(
      String bucket, String record, String attribute, AttributeDefinition definition) {
    return schemaRegistry.addAttributes(bucket, record, ImmutableMap.of(attribute, definition));
  }

  /**
   * Loads bucket schemas from a classpath resource, or from a file when no such resource exists.
   * Buckets, records and attributes that are already registered are left as they are.
   *
   * @param location resource name or file path, empty to skip preloading
   */
  public void preload(String location) {
    if (Strings.isNullOrEmpty(location)) {
      return;
    }
    try (InputStream in = open(location)) {
      ObjectMapper objectMapper = new ObjectMapper(new YAMLFactory());
      objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
      preload(objectMapper.readValue(in, SchemaDocument.class));
      log.info("Preloaded schemas from {}", location);
    } catch (IOException e) {
      throw new IllegalArgumentException("Failed to preload schemas from " + location, e);
    }
  }

  private void preload(SchemaDocument document) {
    for (Map.Entry<String, LinkedHashMap<String, LinkedHashMap<String, AttributeDefinition>>>
        bucket : document.getBuckets().entrySet()) {
      String bucketName = bucket.getKey();
      Bucket existing = schemaRegistry.findBucket(bucketName).orElse(null);
      if (existing == null) {
        schemaRegistry.createBucket(bucketName);
      }
      for (Map.Entry<String, LinkedHashMap<String, AttributeDefinition>> record :
          bucket.getValue().entrySet()) {
        RecordSchema current =
            existing == null ? null : existing.getRecord(record.getKey()).orElse(null);
        if (current == null) {
          createRecord(bucketName, new RecordDefinition(record.getKey(), record.getValue()));
          continue;
        }
        Map<String, AttributeDefinition> missing = new LinkedHashMap<>(record.getValue());
        missing.keySet().removeIf(current::hasAttribute);
        if (!missing.isEmpty()) {
          schemaRegistry.addAttributes(bucketName, record.getKey(), missing);
        }
      }
    }
  }

  private InputStream open(String location) throws IOException {
    InputStream resource = SchemaService.class.getClassLoader().getResourceAsStream(location);
    if (resource != null) {
      return resource;
    }
    Path path = Paths.get(location);
    if (!Files.exists(path)) {
      throw new IllegalArgumentException("Schema preload " + location + " does not exist");
    }
    return Files.newInputStream(path);
  }

  /** Preload file layout: bucket, then record, then attribute definitions. */
  @Data
  @JsonIgnoreProperties(ignoreUnknown = true)
  static class SchemaDocument {
    @JsonProperty("buckets")
    private LinkedHashMap<String, LinkedHashMap<String, LinkedHashMap<String, AttributeDefinition>>>
        buckets = new LinkedHashMap<>();
  }
}
