/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.catalog.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.quantadb.qntql.exception.SchemaException;
import org.quantadb.qntql.storage.StorageClassification;

/**
 * Schema of one record: name plus attributes in declaration order. Immutable; evolution produces a
 * new instance through {@link #withAttributes}.
 */
@EqualsAndHashCode
@ToString
public final class RecordSchema {

  /** Preferred name of the key attribute. */
  public static final String ID = "id";

  private final String name;

  private final ImmutableMap<String, AttributeDefinition> attributes;

  private RecordSchema(String name, ImmutableMap<String, AttributeDefinition> attributes) {
    this.name = name;
    this.attributes = attributes;
  }

  @JsonProperty("record")
  public String getName() {
    return name;
  }

  @JsonProperty("attributes")
  public Map<String, AttributeDefinition> getAttributes() {
    return attributes;
  }

  public Optional<AttributeDefinition> getAttribute(String attribute) {
    return Optional.ofNullable(attributes.get(attribute));
  }

  public boolean hasAttribute(String attribute) {
    return attributes.containsKey(attribute);
  }

  /** Key attribute: {@code id} when declared, otherwise the first declared attribute. */
  @JsonIgnore
  public String getKeyAttribute() {
    return attributes.containsKey(ID) ? ID : attributes.keySet().iterator().next();
  }

  /** Engine holding the key attribute. */
  @JsonIgnore
  public StorageClassification getKeyEngine() {
    return attributes.get(getKeyAttribute()).type();
  }

  /** Engines storing at least one attribute of this record. */
  @JsonIgnore
  public Set<StorageClassification> getEngines() {
    Set<StorageClassification> engines = EnumSet.noneOf(StorageClassification.class);
    attributes.values().forEach(definition -> engines.add(definition.type()));
    return engines;
  }

  /** Names of the attributes stored by the given engine, in declaration order. */
  public List<String> attributesOf(StorageClassification engine) {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    attributes.forEach(
        (attribute, definition) -> {
          if (definition.type() == engine) {
            names.add(attribute);
          }
        });
    return names.build();
  }

  /**
   * Returns a copy extended with the given attributes.
   *
   * @throws SchemaException if one of them is already declared
   */
  public RecordSchema withAttributes(Map<String, AttributeDefinition> additions) {
    Builder builder = builder(name);
    attributes.forEach(builder::attribute);
    additions.forEach(builder::attribute);
    return builder.build();
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  /** Builder rejecting duplicate attribute names. */
  public static class Builder {
    private final String name;
    private final Map<String, AttributeDefinition> attributes = new LinkedHashMap<>();

    private Builder(String name) {
      Preconditions.checkArgument(!Strings.isNullOrEmpty(name), "Record name is required");
      this.name = name;
    }

    public Builder attribute(String attribute, AttributeDefinition definition) {
      Preconditions.checkArgument(
          !Strings.isNullOrEmpty(attribute), "Attribute name is required in record %s", name);
      if (definition == null || definition.type() == null) {
        throw new SchemaException(
            "Attribute " + attribute + " of record " + name + " has no storage classification",
            name,
            attribute);
      }
      if (attributes.putIfAbsent(attribute, definition) != null) {
        throw new SchemaException(
            "Duplicate attribute " + attribute + " in record " + name, name, attribute);
      }
      return this;
    }

    public RecordSchema build() {
      if (attributes.isEmpty()) {
        throw new SchemaException("Record " + name + " declares no attributes", name, null);
      }
      return new RecordSchema(name, ImmutableMap.copyOf(attributes));
    }
  }
}
