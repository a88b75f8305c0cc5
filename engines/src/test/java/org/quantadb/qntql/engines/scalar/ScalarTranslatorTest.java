/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.engines.scalar;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.quantadb.qntql.engines.TranslatorFixtures.BUCKET;
import static org.quantadb.qntql.engines.TranslatorFixtures.TASKS;
import static org.quantadb.qntql.engines.TranslatorFixtures.attribute;
import static org.quantadb.qntql.engines.TranslatorFixtures.compare;
import static org.quantadb.qntql.engines.TranslatorFixtures.keyed;
import static org.quantadb.qntql.engines.TranslatorFixtures.scan;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.quantadb.qntql.analysis.model.SortKey;
import org.quantadb.qntql.ast.expression.AggregateCall;
import org.quantadb.qntql.ast.expression.And;
import org.quantadb.qntql.ast.expression.Comparison;
import org.quantadb.qntql.ast.expression.Contains;
import org.quantadb.qntql.ast.expression.InList;
import org.quantadb.qntql.ast.expression.IsNull;
import org.quantadb.qntql.ast.expression.Literal;
import org.quantadb.qntql.ast.expression.Not;
import org.quantadb.qntql.ast.expression.Or;
import org.quantadb.qntql.ast.expression.RecordRef;
import org.quantadb.qntql.parser.Position;
import org.quantadb.qntql.planner.logical.EnginePushdown;
import org.quantadb.qntql.planner.physical.EngineFragment;
import org.quantadb.qntql.storage.NativeQuery;
import org.quantadb.qntql.storage.QueryParameter;
import org.quantadb.qntql.storage.RowShape;
import org.quantadb.qntql.storage.StorageClassification;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ScalarTranslatorTest {

  private final ScalarTranslator translator = new ScalarTranslator();

  @Test
  void scan_selects_key_and_attributes_from_bucket_table() {
    NativeQuery query =
        translator.translate(
            scan(StorageClassification.SCALAR, List.of("title", "status")), BUCKET);

    assertEquals("SELECT \"id\", \"title\", \"status\" FROM \"work\".\"tasks\"", query.getText());
    assertTrue(query.getParameters().isEmpty());
    assertEquals(RowShape.Kind.ROWS, query.getShape().kind());
    assertEquals("id", query.getShape().keyColumn());
    assertEquals("f1", query.getFragmentId());
  }

  @Test
  void predicates_become_named_parameters() {
    NativeQuery query =
        translator.translate(
            scan(
                StorageClassification.SCALAR,
                List.of("title"),
                compare("status", Comparison.Operator.EQ, "pending"),
                compare("due_date", Comparison.Operator.LT, LocalDate.of(2025, 6, 1))),
            BUCKET);

    assertEquals(
        "SELECT \"id\", \"title\" FROM \"work\".\"tasks\" "
            + "WHERE \"status\" = :p1 AND \"due_date\" < :p2",
        query.getText());
    assertEquals(
        List.of(
            new QueryParameter("p1", "pending"),
            new QueryParameter("p2", LocalDate.of(2025, 6, 1))),
        query.getParameters());
  }

  @Test
  void literal_on_the_left_is_kept_in_place() {
    NativeQuery query =
        translator.translate(
            scan(
                StorageClassification.SCALAR,
                List.of(),
                new Comparison(Literal.of(3L), Comparison.Operator.LT, attribute("priority"))),
            BUCKET);

    assertTrue(query.getText().endsWith("WHERE :p1 < \"priority\""), query.getText());
  }

  @Test
  void boolean_operators_keep_null_semantics() {
    NativeQuery query =
        translator.translate(
            scan(
                StorageClassification.SCALAR,
                List.of(),
                new Or(
                    new Not(compare("status", Comparison.Operator.NEQ, "done")),
                    new And(
                        new IsNull(attribute("title"), false),
                        new InList(
                            attribute("priority"),
                            List.of(Literal.of(1L), Literal.of(2L)),
                            true)))),
            BUCKET);

    assertTrue(
        query.getText()
            .endsWith(
                "WHERE ((\"status\" <> :p1) IS NOT TRUE OR "
                    + "(\"title\" IS NULL AND \"priority\" NOT IN (:p2, :p3)))"),
        query.getText());
  }

  @Test
  void contains_escapes_like_wildcards() {
    NativeQuery query =
        translator.translate(
            scan(
                StorageClassification.SCALAR,
                List.of(),
                new Contains(attribute("title"), Literal.of("50%_off"))),
            BUCKET);

    assertTrue(query.getText().endsWith("\"title\" LIKE :p1 ESCAPE '\\'"), query.getText());
    assertEquals("%50\\%\\_off%", query.parameter("p1").orElseThrow());
  }

  @Test
  void keyed_scan_declares_unbound_key_parameter() {
    NativeQuery query =
        translator.translate(keyed(scan(StorageClassification.SCALAR, List.of("title"))), BUCKET);

    assertTrue(query.getText().endsWith("WHERE \"id\" = ANY(:keys)"), query.getText());
    assertTrue(query.hasParameter(NativeQuery.KEYS));
    assertNull(query.parameter(NativeQuery.KEYS).orElse(null));
  }

  @Test
  void pushed_sort_is_rendered_without_paging() {
    EngineFragment fragment =
        scan(StorageClassification.SCALAR, List.of("title")).toBuilder()
            .pushdown(
                new EnginePushdown(List.of(new SortKey(attribute("due_date"), false)), null))
            .build();

    NativeQuery query = translator.translate(fragment, BUCKET);

    assertTrue(
        query.getText().endsWith("ORDER BY \"due_date\" DESC NULLS LAST"),
        query.getText());
  }

  @Test
  void pushed_aggregation_groups_in_the_engine() {
    AggregateCall count =
        new AggregateCall(
            AggregateCall.Function.COUNT, new RecordRef("tasks", "tasks"), Position.UNKNOWN);
    AggregateCall maxPriority =
        new AggregateCall(AggregateCall.Function.MAX, attribute("priority"), Position.UNKNOWN);
    EngineFragment fragment =
        scan(StorageClassification.SCALAR, List.of("status", "priority")).toBuilder()
            .pushdown(
                new EnginePushdown(
                    List.of(new SortKey(count, false)),
                    new EnginePushdown.Aggregation(
                        List.of(attribute("status")), List.of(count, maxPriority), null)))
            .build();

    NativeQuery query = translator.translate(fragment, BUCKET);

    assertEquals(
        "SELECT \"status\", COUNT(*) AS \"count(tasks)\", "
            + "MAX(\"priority\") AS \"max(tasks.priority)\" FROM \"work\".\"tasks\" "
            + "GROUP BY \"status\" ORDER BY \"count(tasks)\" DESC NULLS LAST",
        query.getText());
    assertEquals(
        List.of("status", "count(tasks)", "max(tasks.priority)"),
        query.getShape().columns().stream()
            .map(RowShape.Column::name)
            .collect(Collectors.toList()));
  }

  @Test
  void capabilities() {
    assertTrue(translator.supportsAggregation());
    assertTrue(translator.supportsOrdering());
    assertTrue(translator.canPushDown(compare("status", Comparison.Operator.EQ, "x")));
    assertTrue(
        translator.canPushDown(
            new Comparison(attribute("title"), Comparison.Operator.EQ, attribute("status"))));
    assertFalse(translator.canPushDown(compare("cpu", Comparison.Operator.GT, 50L)));
    assertFalse(translator.canPushDown(compare("status", Comparison.Operator.EQ, Map.of())));
  }

  @Test
  void predicate_of_another_engine_is_rejected() {
    EngineFragment fragment =
        scan(
            StorageClassification.SCALAR,
            List.of("title"),
            compare("cpu", Comparison.Operator.GT, 50L));

    assertThrows(IllegalStateException.class, () -> translator.translate(fragment, BUCKET));
  }

  @Test
  void write_conditions() {
    NativeQuery condition =
        translator.translateCondition(
            BUCKET, TASKS, compare("status", Comparison.Operator.EQ, "done"));
    NativeQuery keys = translator.translateKeyCondition(BUCKET, TASKS, List.of("t1", "t2"));

    assertEquals("\"status\" = :p1", condition.getText());
    assertNull(condition.getFragmentId());
    assertEquals(RowShape.Kind.KEYS, condition.getShape().kind());
    assertEquals("\"id\" = ANY(:keys)", keys.getText());
    assertEquals(List.of("t1", "t2"), keys.parameter(NativeQuery.KEYS).orElseThrow());
  }

  @Test
  void identifiers_are_quoted() {
    assertEquals("\"odd\"\"name\"", ScalarTranslator.quote("odd\"name"));
  }
}
