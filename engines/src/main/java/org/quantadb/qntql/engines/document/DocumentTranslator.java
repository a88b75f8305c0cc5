/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.engines.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import org.quantadb.qntql.ast.expression.Expression;
import org.quantadb.qntql.catalog.model.RecordSchema;
import org.quantadb.qntql.engines.AbstractEngineTranslator;
import org.quantadb.qntql.engines.NamedParameters;
import org.quantadb.qntql.planner.physical.EngineFragment;
import org.quantadb.qntql.storage.NativeQuery;
import org.quantadb.qntql.storage.StorageClassification;

/**
 * Translates document fragments into MongoDB {@code find} commands, one collection per record and
 * one database per bucket. A key set bound at run time appears in the filter as a
 * {@code {"$param": "<name>"}} placeholder.
 *
 * <pre>
 * {"find":"users","$db":"shop","filter":{"profile.city":"Oslo"},"projection":{"id":1,"_id":0}}
 * </pre>
 *
 * <p>Ordering is not pushed: MongoDB sorts missing values first, while results sort them last.
 */
public class DocumentTranslator extends AbstractEngineTranslator {

  /** Placeholder key for a parameter bound at run time. */
  public static final String PARAM = "$param";

  private final ObjectMapper objectMapper;

  private final DocumentFilterRenderer renderer;

  public DocumentTranslator() {
    this(new ObjectMapper());
  }

  public DocumentTranslator(ObjectMapper objectMapper) {
    super(StorageClassification.DOCUMENT, new DocumentPredicateSupport());
    this.objectMapper = objectMapper;
    this.renderer = new DocumentFilterRenderer(objectMapper);
  }

  @Override
  protected NativeQuery translateScan(EngineFragment fragment, String bucket) {
    RecordSchema record = fragment.record();
    NamedParameters parameters = new NamedParameters();
    List<ObjectNode> filters = new ArrayList<>();
    if (fragment.isKeyed()) {
      filters.add(keyFilter(record, parameters.declare(fragment.keyInput().parameter())));
    }
    for (Expression predicate : fragment.predicates()) {
      filters.add(renderer.render(predicate));
    }

    ObjectNode command = objectMapper.createObjectNode();
    command.put("find", record.getName());
    command.put("$db", bucket);
    command.set("filter", DocumentFilterRenderer.and(filters));
    ObjectNode projection = command.putObject("projection");
    selectedColumns(fragment).forEach(column -> projection.put(column, 1));
    projection.put("_id", 0);
    return new NativeQuery(
        StorageClassification.DOCUMENT,
        fragment.id(),
        write(command),
        parameters.build(),
        rowShape(fragment));
  }

  /** Filter document for updateMany and deleteMany. */
  @Override
  protected NativeQuery writeCondition(String bucket, RecordSchema record, Expression condition) {
    return new NativeQuery(
        StorageClassification.DOCUMENT,
        null,
        write(renderer.render(condition)),
        List.of(),
        keyShape(record));
  }

  @Override
  public NativeQuery translateKeyCondition(String bucket, RecordSchema record, List<Object> keys) {
    NamedParameters parameters = new NamedParameters();
    ObjectNode filter = keyFilter(record, parameters.declare(NativeQuery.KEYS));
    return new NativeQuery(
            StorageClassification.DOCUMENT,
            null,
            write(filter),
            parameters.build(),
            keyShape(record))
        .bind(NativeQuery.KEYS, List.copyOf(keys));
  }

  private ObjectNode keyFilter(RecordSchema record, String parameter) {
    ObjectNode filter = objectMapper.createObjectNode();
    filter.putObject(record.getKeyAttribute()).putObject("$in").put(PARAM, parameter);
    return filter;
  }

  private String write(ObjectNode node) {
    try {
      return objectMapper.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to render document query", e);
    }
  }
}
