/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.catalog.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.quantadb.qntql.storage.StorageClassification;

/**
 * Definition of one attribute of a record. The classification decides which backend stores the
 * attribute.
 *
 * @param type owning storage classification
 * @param datatype scalar datatype hint, may be null
 * @param target target record of a relation attribute
 * @param unit unit of a metric attribute, may be null
 * @param indexed whether the backend keeps an index on the attribute
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AttributeDefinition(
    @JsonProperty("type") StorageClassification type,
    @JsonProperty("datatype") String datatype,
    @JsonProperty("target") String target,
    @JsonProperty("unit") String unit,
    @JsonProperty("indexed") boolean indexed) {

  public static AttributeDefinition scalar(String datatype) {
    return new AttributeDefinition(StorageClassification.SCALAR, datatype, null, null, false);
  }

  public static AttributeDefinition document() {
    return new AttributeDefinition(StorageClassification.DOCUMENT, null, null, null, false);
  }

  public static AttributeDefinition relation(String target) {
    return new AttributeDefinition(StorageClassification.RELATION, null, target, null, false);
  }

  public static AttributeDefinition metric(String unit) {
    return new AttributeDefinition(StorageClassification.METRIC, null, null, unit, false);
  }

  public AttributeDefinition withIndexed() {
    return new AttributeDefinition(type, datatype, target, unit, true);
  }

  /** Scalar datatype, or null for non-scalar attributes and scalars without a hint. */
  @JsonIgnore
  public ScalarType scalarType() {
    return type == StorageClassification.SCALAR && datatype != null
        ? ScalarType.fromHint(datatype)
        : null;
  }
}
