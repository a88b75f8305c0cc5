/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.quantadb.qntql.catalog.model.AttributeDefinition;
import org.quantadb.qntql.catalog.model.BucketInfo;
import org.quantadb.qntql.catalog.model.RecordSchema;
import org.quantadb.qntql.exception.SchemaException;
import org.quantadb.qntql.storage.StorageClassification;

@ExtendWith(MockitoExtension.class)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class DefaultSchemaRegistryTest {

  private static final String BUCKET = "shop";

  @Mock private SchemaProvisioner provisioner;

  private DefaultSchemaRegistry registry;

  @BeforeEach
  void setUp() {
    registry = new DefaultSchemaRegistry(provisioner);
    registry.createBucket(BUCKET);
  }

  @Test
  void buckets_are_listed_by_name() {
    registry.createBucket("archive");
    registry.createRecord(BUCKET, users());

    List<BucketInfo> buckets = registry.listBuckets();

    assertEquals(2, buckets.size());
    assertEquals("archive", buckets.get(0).name());
    assertEquals(new BucketInfo(BUCKET, List.of("users")), buckets.get(1));
  }

  @Test
  void duplicate_bucket_is_rejected() {
    SchemaException e = assertThrows(SchemaException.class, () -> registry.createBucket(BUCKET));

    assertEquals("Bucket shop already exists", e.getMessage());
  }

  @Test
  void names_are_validated() {
    assertThrows(SchemaException.class, () -> registry.createBucket("my-bucket"));
    assertThrows(IllegalArgumentException.class, () -> registry.createBucket(""));
    assertThrows(
        SchemaException.class,
        () ->
            registry.createRecord(
                BUCKET,
                RecordSchema.builder("bad name")
                    .attribute("id", AttributeDefinition.scalar("string"))
                    .build()));
  }

  @Test
  void create_record_provisions_every_attribute_in_order() {
    RecordSchema users = registry.createRecord(BUCKET, users());

    InOrder order = inOrder(provisioner);
    order.verify(provisioner).provision(BUCKET, "users", "id", users.getAttributes().get("id"));
    order
        .verify(provisioner)
        .provision(BUCKET, "users", "profile", users.getAttributes().get("profile"));
    order
        .verify(provisioner)
        .provision(BUCKET, "users", "friends", users.getAttributes().get("friends"));
    order
        .verify(provisioner)
        .provision(BUCKET, "users", "heart_rate", users.getAttributes().get("heart_rate"));
    assertEquals(users, registry.getRecord(BUCKET, "users"));
  }

  @Test
  void duplicate_record_is_not_provisioned_again() {
    registry.createRecord(BUCKET, users());

    SchemaException e =
        assertThrows(SchemaException.class, () -> registry.createRecord(BUCKET, users()));

    assertEquals("users", e.getRecord());
    verify(provisioner, times(4)).provision(eq(BUCKET), eq("users"), anyString(), any());
  }

  @Test
  void relation_to_unknown_record_is_rejected_before_provisioning() {
    RecordSchema orders =
        RecordSchema.builder("orders")
            .attribute("id", AttributeDefinition.scalar("string"))
            .attribute("buyer", AttributeDefinition.relation("customers"))
            .build();

    SchemaException e =
        assertThrows(SchemaException.class, () -> registry.createRecord(BUCKET, orders));

    assertEquals("buyer", e.getAttribute());
    verifyNoInteractions(provisioner);
    assertTrue(registry.getBucket(BUCKET).getRecord("orders").isEmpty());
  }

  @Test
  void unknown_scalar_datatype_is_rejected() {
    RecordSchema items =
        RecordSchema.builder("items").attribute("id", AttributeDefinition.scalar("blob")).build();

    SchemaException e =
        assertThrows(SchemaException.class, () -> registry.createRecord(BUCKET, items));

    assertEquals("Unknown scalar datatype: blob", e.getMessage());
  }

  @Test
  void key_attribute_must_be_scalar_or_document() {
    RecordSchema nodes =
        RecordSchema.builder("nodes")
            .attribute("parent", AttributeDefinition.relation("nodes"))
            .attribute("name", AttributeDefinition.scalar("string"))
            .build();

    SchemaException e =
        assertThrows(SchemaException.class, () -> registry.createRecord(BUCKET, nodes));

    assertEquals("Key attribute nodes.parent must be scalar or document", e.getMessage());
  }

  @Test
  void add_attributes_provisions_only_new_ones() {
    registry.createRecord(BUCKET, users());
    AttributeDefinition age = AttributeDefinition.scalar("int");

    RecordSchema evolved = registry.addAttributes(BUCKET, "users", Map.of("age", age));

    verify(provisioner).provision(BUCKET, "users", "age", age);
    verify(provisioner, times(5)).provision(eq(BUCKET), eq("users"), anyString(), any());
    assertEquals(5, evolved.getAttributes().size());
    assertEquals(evolved, registry.getRecord(BUCKET, "users"));
  }

  @Test
  void existing_attribute_cannot_be_added_again() {
    registry.createRecord(BUCKET, users());

    SchemaException e =
        assertThrows(
            SchemaException.class,
            () ->
                registry.addAttributes(
                    BUCKET, "users", Map.of("profile", AttributeDefinition.document())));

    assertEquals("profile", e.getAttribute());
    verify(provisioner, never())
        .provision(BUCKET, "users", "profile", AttributeDefinition.document());
  }

  @Test
  void adding_id_to_a_record_without_one_would_change_its_key() {
    registry.createRecord(
        BUCKET,
        RecordSchema.builder("events")
            .attribute("code", AttributeDefinition.scalar("string"))
            .build());

    SchemaException e =
        assertThrows(
            SchemaException.class,
            () ->
                registry.addAttributes(
                    BUCKET, "events", Map.of("id", AttributeDefinition.scalar("string"))));

    assertEquals("id", e.getAttribute());
    assertEquals("code", registry.getRecord(BUCKET, "events").getKeyAttribute());
  }

  @Test
  void failed_provisioning_leaves_the_record_unregistered() {
    doThrow(new IllegalStateException("backend down"))
        .when(provisioner)
        .provision(eq(BUCKET), eq("users"), eq("friends"), any());

    assertThrows(IllegalStateException.class, () -> registry.createRecord(BUCKET, users()));

    assertTrue(registry.getBucket(BUCKET).getRecord("users").isEmpty());
  }

  @Test
  void drop_bucket_removes_its_records() {
    registry.createRecord(BUCKET, users());

    registry.dropBucket(BUCKET);

    assertFalse(registry.findBucket(BUCKET).isPresent());
    SchemaException e =
        assertThrows(SchemaException.class, () -> registry.getRecord(BUCKET, "users"));
    assertEquals("Bucket shop does not exist", e.getMessage());
  }

  @Test
  void unknown_record_is_reported() {
    SchemaException e =
        assertThrows(SchemaException.class, () -> registry.getRecord(BUCKET, "ghosts"));

    assertEquals("Record ghosts does not exist in bucket shop", e.getMessage());
    assertEquals("ghosts", e.getRecord());
  }

  @Test
  void racing_creations_provision_a_record_once() throws Exception {
    int threads = 8;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<Boolean>> results = new ArrayList<>();
    try {
      for (int i = 0; i < threads; i++) {
        results.add(
            executor.submit(
                () -> {
                  start.await();
                  try {
                    registry.createRecord(BUCKET, users());
                    return true;
                  } catch (SchemaException e) {
                    return false;
                  }
                }));
      }
      start.countDown();
      int created = 0;
      for (Future<Boolean> result : results) {
        if (result.get(10, TimeUnit.SECONDS)) {
          created++;
        }
      }
      assertEquals(1, created);
    } finally {
      executor.shutdownNow();
    }
    verify(provisioner, times(4)).provision(eq(BUCKET), eq("users"), anyString(), any());
  }

  @Test
  void record_schema_groups_attributes_by_engine() {
    RecordSchema users = users();

    assertEquals("id", users.getKeyAttribute());
    assertEquals(StorageClassification.SCALAR, users.getKeyEngine());
    assertEquals(List.of("friends"), users.attributesOf(StorageClassification.RELATION));
    assertEquals(4, users.getEngines().size());
  }

  private static RecordSchema users() {
    return RecordSchema.builder("users")
        .attribute("id", AttributeDefinition.scalar("string").withIndexed())
        .attribute("profile", AttributeDefinition.document())
        .attribute("friends", AttributeDefinition.relation("users"))
        .attribute("heart_rate", AttributeDefinition.metric("bpm"))
        .build();
  }
}
