/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.engines;

import java.util.List;
import org.quantadb.qntql.ast.expression.Comparison;
import org.quantadb.qntql.ast.expression.Expression;
import org.quantadb.qntql.ast.expression.Literal;
import org.quantadb.qntql.ast.expression.ResolvedAttribute;
import org.quantadb.qntql.catalog.model.AttributeDefinition;
import org.quantadb.qntql.catalog.model.RecordSchema;
import org.quantadb.qntql.planner.logical.TraversalDirection;
import org.quantadb.qntql.planner.physical.EngineFragment;
import org.quantadb.qntql.planner.physical.FragmentKind;
import org.quantadb.qntql.planner.physical.KeyInput;
import org.quantadb.qntql.planner.physical.ScanAlgorithm;
import org.quantadb.qntql.storage.NativeQuery;
import org.quantadb.qntql.storage.StorageClassification;

/** Record schemas and plan fragments shared by the translator tests. */
public final class TranslatorFixtures {

  public static final String BUCKET = "work";

  public static final RecordSchema TASKS =
      RecordSchema.builder("tasks")
          .attribute("id", AttributeDefinition.scalar("string"))
          .attribute("title", AttributeDefinition.scalar("string"))
          .attribute("status", AttributeDefinition.scalar("string"))
          .attribute("priority", AttributeDefinition.scalar("int"))
          .attribute("due_date", AttributeDefinition.scalar("date"))
          .attribute("details", AttributeDefinition.document())
          .attribute("assignees", AttributeDefinition.relation("users"))
          .attribute("blocked_by", AttributeDefinition.relation("tasks"))
          .attribute("cpu", AttributeDefinition.metric("percent"))
          .attribute("memory", AttributeDefinition.metric("bytes"))
          .build();

  private TranslatorFixtures() {}

  public static ResolvedAttribute attribute(String name, String... path) {
    return new ResolvedAttribute(
        "tasks", "tasks", name, List.of(path), TASKS.getAttributes().get(name));
  }

  public static Comparison compare(String name, Comparison.Operator operator, Object value) {
    return new Comparison(attribute(name), operator, Literal.of(value));
  }

  public static EngineFragment scan(
      StorageClassification engine, List<String> attributes, Expression... predicates) {
    return EngineFragment.builder()
        .id("f1")
        .alias("tasks")
        .record(TASKS)
        .engine(engine)
        .kind(FragmentKind.SCAN)
        .attributes(attributes)
        .predicates(List.of(predicates))
        .algorithm(ScanAlgorithm.FULL_SCAN)
        .build();
  }

  public static EngineFragment keyed(EngineFragment fragment) {
    return fragment.toBuilder()
        .id("f2")
        .keyInput(new KeyInput(List.of("f1"), NativeQuery.KEYS))
        .algorithm(ScanAlgorithm.KEY_LOOKUP)
        .build();
  }

  public static EngineFragment traversal(String relation, TraversalDirection direction) {
    return EngineFragment.builder()
        .id("f2")
        .alias("tasks")
        .record(TASKS)
        .engine(StorageClassification.RELATION)
        .kind(FragmentKind.TRAVERSE)
        .attributes(List.of(relation))
        .algorithm(ScanAlgorithm.KEY_LOOKUP)
        .keyInput(
            new KeyInput(
                List.of("f1"),
                direction == TraversalDirection.FORWARD
                    ? NativeQuery.SOURCE_KEYS
                    : NativeQuery.TARGET_KEYS))
        .targetRecord(TASKS.getAttributes().get(relation).target())
        .direction(direction)
        .build();
  }
}
