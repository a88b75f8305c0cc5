/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */


package org.quantadb.qntql.assembler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.quantadb.qntql.WorkSchema;
import org.quantadb.qntql.exception.EngineException;
import org.quantadb.qntql.executor.ExecutionResult;
import org.quantadb.qntql.executor.FragmentResult;
import org.quantadb.qntql.planner.physical.EngineFragment;
import org.quantadb.qntql.planner.physical.ExecutablePlan;
import org.quantadb.qntql.storage.RowShape;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ResultAssemblerTest {

  private final WorkSchema schema = new WorkSchema();

  private final ResultAssembler assembler = new ResultAssembler();

  @Test
  void engines_are_joined_on_the_record_key() {
    ExecutablePlan plan = schema.plan("FIND tasks.title, tasks.effort FROM tasks");

    AssembledResult result =
        assemble(
            plan,
            Map.of(
                "f1",
                List.of(row("id", "t1", "title", "Write docs"), row("id", "t2", "title", "Ship")),
                "f2",
                List.of(
                    row(
                        "id",
                        "t1",
                        "effort",
                        List.of(
                            row("_time", "2025-03-02T00:00:00Z", "_value", 5),
                            row("_time", "2025-03-01T00:00:00Z", "_value", 2))))),
            Set.of());

    assertEquals(2, result.rows().size());
    assertEquals(record("title", "Write docs", "effort", 5.0), tasks(result, 0));
    assertEquals(record("title", "Ship", "effort", null), tasks(result, 1));
    assertEquals(2, result.totalCount());
  }

  @Test
  void driver_keys_restrict_the_other_engines() {
    ExecutablePlan plan =
        schema.plan("FIND tasks.title FROM tasks MATCH tasks.details.labels.team = 'core'");

    AssembledResult result =
        assemble(
            plan,
            Map.of(
                "f1", List.of(row("id", "t2")),
                "f2",
                List.of(row("id", "t1", "title", "Stale"), row("id", "t2", "title", "Ship"))),
            Set.of());

    assertEquals(1, result.rows().size());
    assertEquals(record("title", "Ship"), tasks(result, 0));
  }

  @Test
  void engine_sorted_rows_are_paged_after_counting_every_match() {
    ExecutablePlan plan =
        schema.plan("FIND tasks.title FROM tasks ORDER BY tasks.title LIMIT 2 OFFSET 1");

    AssembledResult result =
        assemble(
            plan,
            Map.of(
                "f1",
                List.of(
                    row("id", "t1", "title", "A"),
                    row("id", "t2", "title", "B"),
                    row("id", "t3", "title", "C"),
                    row("id", "t4", "title", "D"))),
            Set.of());

    assertEquals(2, result.rows().size());
    assertEquals(record("title", "B"), tasks(result, 0));
    assertEquals(record("title", "C"), tasks(result, 1));
    assertEquals(4, result.totalCount());
  }

  @Test
  void largest_limit_with_an_offset_returns_the_remaining_rows() {
    ExecutablePlan plan = schema.plan("FIND tasks.title FROM tasks LIMIT 2147483647 OFFSET 1");

    AssembledResult result =
        assemble(
            plan,
            Map.of(
                "f1",
                List.of(
                    row("id", "t1", "title", "A"),
                    row("id", "t2", "title", "B"),
                    row("id", "t3", "title", "C"))),
            Set.of());

    assertEquals(2, result.rows().size());
    assertEquals(record("title", "B"), tasks(result, 0));
    assertEquals(3, result.totalCount());
  }

  @Test
  void client_side_filter_runs_before_sort_and_limit() {
    ExecutablePlan plan =
        schema.plan(
            "FIND tasks.title FROM tasks MATCH tasks.effort > 3"
                + " ORDER BY tasks.title DESC LIMIT 1");

    AssembledResult result =
        assemble(
            plan,
            Map.of(
                "f1",
                List.of(
                    row("id", "t1", "title", "A"),
                    row("id", "t2", "title", "B"),
                    row("id", "t3", "title", "C")),
                "f2",
                List.of(
                    row("id", "t1", "effort", 5),
                    row("id", "t2", "effort", 1),
                    row("id", "t3", "effort", 4))),
            Set.of());

    assertEquals(1, result.rows().size());
    assertEquals(record("title", "C"), tasks(result, 0));
    assertEquals(2, result.totalCount());
    assertEquals(1, result.pageSize());
  }

  @Test
  void navigation_pairs_sources_with_their_targets() {
    ExecutablePlan plan =
        schema.plan(
            "FIND tasks.title, u.username FROM tasks NAVIGATE tasks->assignees:users AS u"
                + " MATCH tasks.status = 'open'");

    AssembledResult result =
        assemble(
            plan,
            Map.of(
                "f1", List.of(row("id", "t1", "title", "A"), row("id", "t2", "title", "B")),
                "f2",
                List.of(edge("t1", "u1"), edge("t1", "u2"), edge("t2", "u1"), edge("t9", "u2")),
                "f3",
                List.of(row("id", "u1", "username", "ann"), row("id", "u2", "username", "bob"))),
            Set.of());

    List<String> pairs = new ArrayList<>();
    for (Map<String, Object> row : result.rows()) {
      Map<?, ?> task = (Map<?, ?>) row.get("tasks");
      Map<?, ?> user = (Map<?, ?>) row.get("u");
      pairs.add(task.get("title") + "/" + user.get("username"));
    }
    assertEquals(List.of("A/ann", "A/bob", "B/ann"), pairs);
  }

  @Test
  void relation_attribute_lists_target_keys() {
    ExecutablePlan plan = schema.plan("FIND tasks.title, tasks.assignees FROM tasks");

    AssembledResult result =
        assemble(
            plan,
            Map.of(
                "f1", List.of(row("id", "t1", "title", "A"), row("id", "t2", "title", "B")),
                "f2", List.of(edge("t1", "u1"), edge("t1", "u2"))),
            Set.of());

    assertEquals(List.of("u1", "u2"), tasks(result, 0).get("assignees"));
    assertEquals(List.of(), tasks(result, 1).get("assignees"));
  }

  @Test
  void engine_groups_are_read_as_returned() {
    ExecutablePlan plan =
        schema.plan("FIND tasks.status, count(*) AS n FROM tasks GROUP BY tasks.status");

    AssembledResult result =
        assemble(
            plan,
            Map.of(
                "f1",
                List.of(
                    row("status", "open", "count(*)", 2), row("status", "done", "count(*)", 1))),
            Set.of());

    assertEquals(2, result.rows().size());
    assertEquals(2L, result.rows().get(0).get("n"));
    assertEquals(record("status", "open"), tasks(result, 0));
  }

  @Test
  void client_side_grouping_computes_aggregates() {
    ExecutablePlan plan =
        schema.plan(
            "FIND tasks.status, avg(tasks.effort), count(*) FROM tasks GROUP BY tasks.status"
                + " ORDER BY tasks.status");

    AssembledResult result =
        assemble(
            plan,
            Map.of(
                "f1",
                List.of(
                    row("id", "t1", "status", "open"),
                    row("id", "t2", "status", "open"),
                    row("id", "t3", "status", "done")),
                "f2",
                List.of(
                    row("id", "t1", "effort", 2),
                    row("id", "t2", "effort", 4),
                    row("id", "t3", "effort", 1))),
            Set.of());

    assertEquals(2, result.rows().size());
    assertEquals(record("status", "done"), tasks(result, 0));
    assertEquals(1.0, result.rows().get(0).get("avg(tasks.effort)"));
    assertEquals(3.0, result.rows().get(1).get("avg(tasks.effort)"));
    assertEquals(2L, result.rows().get(1).get("count(*)"));
  }

  @Test
  void global_aggregate_over_no_rows_yields_one_row() {
    ExecutablePlan plan = schema.plan("FIND count(*) FROM tasks MATCH tasks.effort > 100");

    AssembledResult result =
        assemble(
            plan,
            Map.of("f1", List.of(row("id", "t1")), "f2", List.of(row("id", "t1", "effort", 2))),
            Set.of());

    assertEquals(List.of(Map.of("count(*)", 0L)), result.rows());
  }

  @Test
  void failed_engine_leaves_its_attributes_null() {
    ExecutablePlan plan = schema.plan("FIND tasks.title, tasks.effort FROM tasks");

    AssembledResult result =
        assemble(
            plan,
            Map.of("f1", List.of(row("id", "t1", "title", "A")), "f2", List.of()),
            Set.of("f2"));

    assertEquals(record("title", "A", "effort", null), tasks(result, 0));
  }

  @Test
  void temporal_values_are_rendered_as_iso_strings() {
    ExecutablePlan plan = schema.plan("FIND tasks.due_date, tasks.created FROM tasks");

    AssembledResult result =
        assemble(
            plan,
            Map.of(
                "f1",
                List.of(
                    row("id", "t1", "due_date", "2025-03-01", "created", "2025-03-01 10:15:00"))),
            Set.of());

    assertEquals(
        record("due_date", "2025-03-01", "created", "2025-03-01T10:15:00Z"), tasks(result, 0));
    assertTrue(result.rows().get(0).containsKey("tasks"));
  }

  @Test
  void page_is_derived_from_offset_and_limit() {
    assertEquals(3, new AssembledResult(List.of(), 0, 10, 20).page());
    assertEquals(1, new AssembledResult(List.of(), 0, null, 20).page());
    assertNull(new AssembledResult(List.of(), 0, null, null).limit());
  }

  private AssembledResult assemble(
      ExecutablePlan plan, Map<String, List<Map<String, Object>>> rows, Set<String> failed) {
    Map<String, FragmentResult> results = new LinkedHashMap<>();
    for (EngineFragment fragment : plan.getFragments()) {
      String id = fragment.id();
      results.put(
          id,
          failed.contains(id)
              ? FragmentResult.failed(
                  fragment,
                  plan.getQuery(id),
                  new EngineException(fragment.engine(), "backend unavailable"))
              : FragmentResult.success(
                  fragment, plan.getQuery(id), rows.getOrDefault(id, List.of()), 1));
    }
    return assembler.assemble(new ExecutionResult(plan, results));
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> tasks(AssembledResult result, int index) {
    return (Map<String, Object>) result.rows().get(index).get("tasks");
  }

  private static Map<String, Object> edge(String source, String target) {
    return row(
        RowShape.SOURCE_KEY, source, RowShape.RELATION, "assignees", RowShape.TARGET_KEY, target);
  }

  private static Map<String, Object> row(Object... keyValues) {
    Map<String, Object> row = new HashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      row.put((String) keyValues[i], keyValues[i + 1]);
    }
    return row;
  }

  private static Map<String, Object> record(Object... keyValues) {
    Map<String, Object> record = new LinkedHashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      record.put((String) keyValues[i], keyValues[i + 1]);
    }
    return record;
  }
}
