/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.service.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.quantadb.qntql.catalog.model.AttributeDefinition;
import org.quantadb.qntql.catalog.model.RecordSchema;

/** Record schema as clients submit it. Attribute order is kept. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RecordDefinition {

  @JsonProperty(value = "record", required = true)
  private String record;

  @JsonProperty(value = "attributes", required = true)
  private LinkedHashMap<String, AttributeDefinition> attributes = new LinkedHashMap<>();

  public RecordSchema toSchema() {
    RecordSchema.Builder builder = RecordSchema.builder(record);
    for (Map.Entry<String, AttributeDefinition> entry : attributes.entrySet()) {
      builder.attribute(entry.getKey(), entry.getValue());
    }
    return builder.build();
  }
}
