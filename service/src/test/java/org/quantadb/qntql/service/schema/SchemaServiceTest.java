/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.service.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.quantadb.qntql.catalog.DefaultSchemaRegistry;
import org.quantadb.qntql.catalog.model.AttributeDefinition;
import org.quantadb.qntql.catalog.model.RecordSchema;
import org.quantadb.qntql.exception.SchemaException;
import org.quantadb.qntql.storage.StorageAdapter;
import org.quantadb.qntql.storage.StorageAdapterRegistry;
import org.quantadb.qntql.storage.StorageClassification;

@ExtendWith(MockitoExtension.class)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SchemaServiceTest {

  @Mock
  private StorageAdapter scalar;

  @Mock
  private StorageAdapter document;

  @Mock
  private StorageAdapter relation;

  @Mock
  private StorageAdapter metric;

  private SchemaService schemaService;

  @BeforeEach
  void setUp() {
    StorageAdapterRegistry adapters =
        new StorageAdapterRegistry(
            ImmutableMap.of(
                StorageClassification.SCALAR, scalar,
                StorageClassification.DOCUMENT, document,
                StorageClassification.RELATION, relation,
                StorageClassification.METRIC, metric));
    schemaService =
        new SchemaService(new DefaultSchemaRegistry(new AdapterSchemaProvisioner(adapters)));
  }

  @Test
  void preload_registers_buckets_records_and_provisions_attributes() {
    schemaService.preload("shop-schema.yml");

    RecordSchema customer = schemaService.getRecord("shop", "customer");
    assertEquals(
        List.of("id", "name", "age", "profile", "friends", "orders", "heart_rate"),
        List.copyOf(customer.getAttributes().keySet()));
    assertTrue(customer.getAttributes().get("id").indexed());
    assertEquals("order", customer.getAttributes().get("orders").target());
    verify(scalar, times(6)).provisionAttribute(eq("shop"), anyString(), anyString(), any());
    verify(document).provisionAttribute(eq("shop"), eq("customer"), eq("profile"), any());
    verify(relation, times(2)).provisionAttribute(eq("shop"), eq("customer"), anyString(), any());
    verify(metric).provisionAttribute(eq("shop"), eq("customer"), eq("heart_rate"), any());
  }

  @Test
  void preload_twice_leaves_existing_schemas_alone() {
    schemaService.preload("shop-schema.yml");
    schemaService.preload("shop-schema.yml");

    assertEquals(1, schemaService.listBuckets().size());
    verify(scalar, times(6)).provisionAttribute(eq("shop"), anyString(), anyString(), any());
  }

  @Test
  void preload_adds_only_missing_attributes_to_existing_record() {
    schemaService.createBucket("shop");
    LinkedHashMap<String, AttributeDefinition> attributes = new LinkedHashMap<>();
    attributes.put("id", AttributeDefinition.scalar("string"));
    schemaService.createRecord("shop", new RecordDefinition("order", attributes));

    schemaService.preload("shop-schema.yml");

    RecordSchema order = schemaService.getRecord("shop", "order");
    assertEquals(List.of("id", "total", "status"), List.copyOf(order.getAttributes().keySet()));
    verify(scalar, times(1)).provisionAttribute("shop", "order", "id", attributes.get("id"));
  }

  @Test
  void empty_preload_location_is_ignored() {
    schemaService.preload("");

    assertTrue(schemaService.listBuckets().isEmpty());
  }

  @Test
  void missing_preload_source_fails() {
    assertThrows(
        IllegalArgumentException.class, () -> schemaService.preload("no-such-schema.yml"));
  }

  @Test
  void add_attribute_provisions_only_the_new_attribute() {
    schemaService.createBucket("shop");
    LinkedHashMap<String, AttributeDefinition> attributes = new LinkedHashMap<>();
    attributes.put("id", AttributeDefinition.scalar("uuid"));
    schemaService.createRecord("shop", new RecordDefinition("users", attributes));

    RecordSchema users =
        schemaService.addAttribute("shop", "users", "last_seen", AttributeDefinition.metric("ms"));

    assertTrue(users.hasAttribute("last_seen"));
    verify(metric).provisionAttribute(eq("shop"), eq("users"), eq("last_seen"), any());
    verify(document, never()).provisionAttribute(anyString(), anyString(), anyString(), any());
  }

  @Test
  void duplicate_attribute_is_rejected() {
    schemaService.createBucket("shop");
    Map<String, AttributeDefinition> id = Map.of("id", AttributeDefinition.scalar("uuid"));
    schemaService.createRecord("shop", new RecordDefinition("users", new LinkedHashMap<>(id)));

    assertThrows(
        SchemaException.class,
        () -> schemaService.addAttribute("shop", "users", "id", AttributeDefinition.document()));
  }
}
