/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.quantadb.qntql.common.setting.QuantaSettings;
import org.quantadb.qntql.exception.QueryTimeoutException;
import org.quantadb.qntql.exception.SchemaException;
import org.quantadb.qntql.exception.SyntaxCheckException;
import org.quantadb.qntql.exception.TransactionException;
import org.quantadb.qntql.response.QueryResponse;
import org.quantadb.qntql.storage.NativeQuery;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class QntQLServiceTest {

  private static final String BUCKET = "work";

  private TestBackends backends;

  private QuantaDB quantaDB;

  private QntQLService service;

  @BeforeEach
  void setUp() {
    backends = new TestBackends();
    QuantaSettings settings = QuantaSettings.defaults();
    settings.getExecution().setQueryTimeoutMs(2_000L);
    quantaDB = QuantaDB.start(backends.registry(), settings);
    service = quantaDB.queryService();
    quantaDB.schemaService().createBucket(BUCKET);
  }

  @AfterEach
  void tearDown() {
    quantaDB.close();
  }

  @Test
  void create_record_provisions_each_attribute_in_its_own_backend_once() {
    QueryResponse response =
        execute(
            "CREATE RECORD users (id: SCALAR<UUID>, profile: DOCUMENT, "
                + "friends: RELATION<users>, login_times: METRIC<COUNT>)");

    assertEquals(List.of("provisionAttribute users.id"), backends.scalar().getCalls());
    assertEquals(List.of("provisionAttribute users.profile"), backends.document().getCalls());
    assertEquals(List.of("provisionAttribute users.friends"), backends.relation().getCalls());
    assertEquals(List.of("provisionAttribute users.login_times"), backends.metric().getCalls());
    assertEquals("users", response.getData().get(0).get("record"));
  }

  @Test
  void multi_hop_find_runs_three_native_queries_in_dependency_order() {
    createWorkSchema();
    List<Map<String, Object>> tasks = new ArrayList<>();
    for (int i = 12; i >= 1; i--) {
      tasks.add(
          ImmutableMap.of(
              "id", "t" + i,
              "title", String.format("task-%02d", i),
              "status", "pending",
              "due_date", LocalDate.of(2025, 5, i)));
      backends.relation().link("tasks", "t" + i, "assignees", "u" + (i % 3));
    }
    backends.scalar().respond("FROM \"work\".\"tasks\"", tasks);
    for (int i = 0; i < 3; i++) {
      backends.scalar().put("users", ImmutableMap.of("id", "u" + i, "username", "user" + i));
    }

    QueryResponse response =
        execute(
            "FIND tasks.title, tasks.status, users.username "
                + "NAVIGATE tasks -> assignees:users "
                + "MATCH tasks.status = \"pending\" AND tasks.due_date < \"2025-06-01\" "
                + "ORDER BY tasks.due_date ASC LIMIT 10");

    assertEquals(2, backends.scalar().getQueries().size());
    assertEquals(1, backends.relation().getQueries().size());
    assertTrue(backends.document().getQueries().isEmpty());
    assertTrue(backends.metric().getQueries().isEmpty());

    List<String> journal = backends.getJournal();
    int tasksScan = journal.indexOf("scalar select tasks");
    int traversal = journal.indexOf("relation select tasks");
    int usersLookup = journal.indexOf("scalar select users");
    assertTrue(tasksScan >= 0 && tasksScan < traversal && traversal < usersLookup);

    List<Map<String, Object>> rows = response.getData();
    assertEquals(10, rows.size());
    for (int i = 0; i < rows.size(); i++) {
      Map<?, ?> task = (Map<?, ?>) rows.get(i).get("tasks");
      Map<?, ?> user = (Map<?, ?>) rows.get(i).get("users");
      assertEquals(String.format("task-%02d", i + 1), task.get("title"));
      assertEquals("pending", task.get("status"));
      assertEquals("user" + ((i + 1) % 3), user.get("username"));
    }
    assertEquals(12L, response.getMetadata().getTotalCount());
    assertEquals(10L, response.getMetadata().getReturnedCount());
  }

  @Test
  void aggregation_across_scalar_and_metric_engines_is_computed_after_merge() {
    createWorkSchema();
    for (int i = 1; i <= 8; i++) {
      String project = i <= 6 ? "apollo" : "zeus";
      backends.scalar().put("tasks", ImmutableMap.of("id", "t" + i, "project", project));
      backends.metric().put("tasks", ImmutableMap.of("id", "t" + i, "effort", (double) i));
    }

    QueryResponse response =
        execute(
            "FIND tasks.project, AVG(tasks.effort) AS avg_effort, COUNT(tasks) AS task_count "
                + "GROUP BY tasks.project HAVING COUNT(tasks) > 5");

    for (NativeQuery query : backends.scalar().getQueries()) {
      assertFalse(query.getText().contains("GROUP BY"), query.getText());
    }
    assertEquals(1, response.getData().size());
    Map<String, Object> row = response.getData().get(0);
    assertEquals("apollo", ((Map<?, ?>) row.get("tasks")).get("project"));
    assertEquals(3.5, ((Number) row.get("avg_effort")).doubleValue(), 1e-9);
    assertEquals(6L, ((Number) row.get("task_count")).longValue());
  }

  @Test
  void aggregation_over_a_navigation_joins_relation_and_metric_before_having() {
    createWorkSchema();
    for (int i = 1; i <= 8; i++) {
      String project = i <= 6 ? "apollo" : "zeus";
      backends.scalar().put("tasks", ImmutableMap.of("id", "t" + i, "project", project));
      backends.metric().put("tasks", ImmutableMap.of("id", "t" + i, "effort", (double) i));
      backends.relation().link("tasks", "t" + i, "assignees", "u" + (i % 3));
    }
    for (int i = 0; i < 3; i++) {
      backends.scalar().put("users", ImmutableMap.of("id", "u" + i, "username", "user" + i));
    }

    QueryResponse response =
        execute(
            "FIND tasks.project, AVG(tasks.effort) AS avg_effort, COUNT(tasks) AS task_count "
                + "NAVIGATE tasks -> assignees:users "
                + "GROUP BY tasks.project HAVING COUNT(tasks) > 5");

    assertFalse(backends.relation().getQueries().isEmpty());
    assertFalse(backends.metric().getQueries().isEmpty());
    for (NativeQuery query : backends.scalar().getQueries()) {
      assertFalse(query.getText().contains("GROUP BY"), query.getText());
    }
    assertEquals(1, response.getData().size());
    Map<String, Object> row = response.getData().get(0);
    assertEquals("apollo", ((Map<?, ?>) row.get("tasks")).get("project"));
    assertEquals(3.5, ((Number) row.get("avg_effort")).doubleValue(), 1e-9);
    assertEquals(6L, ((Number) row.get("task_count")).longValue());
  }

  @Test
  void total_count_covers_every_match_when_the_engine_sorts() {
    createWorkSchema();
    List<Map<String, Object>> users = new ArrayList<>();
    for (int i = 0; i < 50; i++) {
      users.add(ImmutableMap.of("id", "u" + i, "username", String.format("user-%02d", i)));
    }
    backends.scalar().respond("FROM \"work\".\"users\"", users);

    QueryResponse response =
        execute("FIND users.username ORDER BY users.username LIMIT 10 OFFSET 5");

    String sql = backends.scalar().getQueries().get(0).getText();
    assertTrue(sql.contains("ORDER BY"), sql);
    assertFalse(sql.contains("LIMIT"), sql);
    assertEquals(50L, response.getMetadata().getTotalCount());
    assertEquals(10L, response.getMetadata().getReturnedCount());
    Map<?, ?> first = (Map<?, ?>) response.getData().get(0).get("users");
    assertEquals("user-05", first.get("username"));
  }

  @Test
  void largest_limit_with_an_offset_does_not_overflow() {
    createWorkSchema();
    for (int i = 0; i < 3; i++) {
      backends.scalar().put("users", ImmutableMap.of("id", "u" + i, "username", "user" + i));
    }

    QueryResponse response = execute("FIND users.username LIMIT 2147483647 OFFSET 1");

    assertEquals(2, response.getData().size());
    assertEquals(3L, response.getMetadata().getTotalCount());
    assertEquals(2L, response.getMetadata().getReturnedCount());
  }

  @Test
  void duplicate_attribute_is_rejected_before_any_backend_is_provisioned() {
    assertThrows(
        SchemaException.class,
        () -> execute("CREATE RECORD x (a: SCALAR<STRING>, a: DOCUMENT)"));

    assertTrue(backends.getJournal().isEmpty(), backends.getJournal().toString());
  }

  @Test
  void single_engine_filter_is_left_to_the_engine() {
    createWorkSchema();
    // The engine owns the predicate, so whatever it returns is trusted.
    backends
        .scalar()
        .respond(
            "FROM \"work\".\"tasks\"",
            List.of(ImmutableMap.of("id", "t1", "title", "Ship", "status", "pending")));

    QueryResponse response = execute("FIND tasks.title MATCH tasks.status = \"done\"");

    String sql = backends.scalar().getQueries().get(0).getText();
    assertTrue(sql.contains("\"status\" = :p1"), sql);
    assertEquals(1, response.getData().size());
    assertEquals("Ship", ((Map<?, ?>) response.getData().get(0).get("tasks")).get("title"));
  }

  @Test
  void filter_spanning_two_engines_is_applied_after_merge() {
    createWorkSchema();
    backends.scalar().put("tasks", ImmutableMap.of("id", "t1", "title", "a", "status", "done"));
    backends.scalar().put("tasks", ImmutableMap.of("id", "t2", "title", "b", "status", "open"));
    backends.scalar().put("tasks", ImmutableMap.of("id", "t3", "title", "c", "status", "open"));
    backends.metric().put("tasks", ImmutableMap.of("id", "t1", "effort", 1.0));
    backends.metric().put("tasks", ImmutableMap.of("id", "t2", "effort", 5.0));
    backends.metric().put("tasks", ImmutableMap.of("id", "t3", "effort", 2.0));

    QueryResponse response =
        execute(
            "FIND tasks.title MATCH tasks.status = \"done\" OR tasks.effort > 3 "
                + "ORDER BY tasks.title");

    String sql = backends.scalar().getQueries().get(0).getText();
    assertFalse(sql.contains("WHERE"), sql);
    String flux = backends.metric().getQueries().get(0).getText();
    assertFalse(flux.contains("> 3"), flux);
    assertEquals(2, response.getData().size());
    assertEquals("a", ((Map<?, ?>) response.getData().get(0).get("tasks")).get("title"));
    assertEquals("b", ((Map<?, ?>) response.getData().get(1).get("tasks")).get("title"));
  }

  @Test
  void add_routes_each_attribute_to_its_backend_only() {
    createWorkSchema();

    QueryResponse response =
        execute(
            "ADD users {id: \"u1\", username: \"ada\", profile: {city: \"London\"}, "
                + "login_times: 3}");

    assertEquals(1L, response.getMetadata().getAffectedCount());
    assertEquals(Set.of("id", "username"), backends.scalar().getInserts().get(0).keySet());
    assertEquals(Set.of("id", "profile"), backends.document().getInserts().get(0).keySet());
    assertEquals(Set.of("id", "login_times"), backends.metric().getInserts().get(0).keySet());
    assertTrue(backends.relation().getInserts().isEmpty());
    assertEquals(1, backends.metric().count("commit"));
  }

  @Test
  void find_on_document_attribute_does_not_call_relation_or_metric_backends() {
    createWorkSchema();
    backends.scalar().put("users", ImmutableMap.of("id", "u1", "username", "ada"));
    backends
        .document()
        .put("users", ImmutableMap.of("id", "u1", "profile", ImmutableMap.of("city", "London")));

    QueryResponse response = execute("FIND users.profile");

    assertEquals(1, backends.document().getQueries().size());
    assertTrue(backends.document().getQueries().get(0).getText().contains("\"find\":\"users\""));
    assertTrue(backends.relation().getQueries().isEmpty());
    assertTrue(backends.metric().getQueries().isEmpty());
    Map<?, ?> user = (Map<?, ?>) response.getData().get(0).get("users");
    assertEquals(Map.of("city", "London"), user.get("profile"));
  }

  @Test
  void failed_prepare_rolls_back_every_sub_transaction() {
    createWorkSchema();
    backends.metric().failOn("prepareCommit");

    assertThrows(
        TransactionException.class,
        () ->
            execute(
                "ADD tasks {id: \"t100\", title: \"Deploy\", assignees: [\"u1\"], effort: 2.5}"));

    for (RecordingStorageAdapter adapter :
        List.of(backends.scalar(), backends.relation(), backends.metric())) {
      assertEquals(1, adapter.count("rollback"), adapter.getClassification().getEngineName());
      assertEquals(0, adapter.count("commit"), adapter.getClassification().getEngineName());
    }
    assertTrue(service.getInDoubtTransactions().isEmpty());
  }

  @Test
  void transaction_block_commits_once_for_all_statements() {
    createWorkSchema();

    QueryResponse response =
        execute(
            "BEGIN TRANSACTION; "
                + "ADD users {id: \"u1\", username: \"ada\"}; "
                + "ADD tasks {id: \"t1\", title: \"Ship\", assignees: [\"u1\"]}; "
                + "COMMIT");

    assertEquals(2, response.getData().size());
    assertEquals("COMMITTED", response.getMetadata().getTransactionState());
    assertNotNull(response.getMetadata().getTransactionId());
    assertEquals(1, backends.scalar().count("prepareCommit"));
    assertEquals(1, backends.scalar().count("commit"));
    assertEquals(2, backends.scalar().count("insert"));
    assertEquals(List.of("u1"), backends.relation().getInserts().get(0).get("assignees"));
  }

  @Test
  void client_held_transaction_spans_requests() {
    createWorkSchema();
    String transactionId = service.beginTransaction();

    QueryRequest request =
        new QueryRequest(BUCKET, "ADD users {id: \"u1\", username: \"ada\"}", transactionId, null);
    service.execute(request);
    assertEquals(0, backends.scalar().count("commit"));

    service.commit(transactionId);
    assertEquals(1, backends.scalar().count("prepareCommit"));
    assertEquals(1, backends.scalar().count("commit"));
    assertThrows(TransactionException.class, () -> service.commit(transactionId));
  }

  @Test
  void slow_backend_times_out_the_statement() {
    quantaDB.close();
    QuantaSettings settings = QuantaSettings.defaults();
    settings.getExecution().setQueryTimeoutMs(200L);
    quantaDB = QuantaDB.start(backends.registry(), settings);
    service = quantaDB.queryService();
    quantaDB.schemaService().createBucket(BUCKET);
    createWorkSchema();
    backends.scalar().delaySelects(5_000L);

    assertThrows(QueryTimeoutException.class, () -> execute("FIND tasks.title"));
  }

  @Test
  void malformed_query_fails_before_any_backend_call() {
    createWorkSchema();
    int calls = backends.getJournal().size();

    assertThrows(SyntaxCheckException.class, () -> execute("FIND tasks.title MATCH"));
    assertEquals(calls, backends.getJournal().size());
  }

  @Test
  void json_request_failure_is_rendered_as_error_document() throws Exception {
    String json =
        service.execute("{\"bucket\": \"work\", \"query\": \"FIND users.name MATCH\"}");

    JsonNode error = new ObjectMapper().readTree(json);
    assertEquals(400, error.get("status").asInt());
    assertEquals("SyntaxCheckException", error.get("error").get("type").asText());
  }

  @Test
  void json_request_returns_rows() throws Exception {
    createWorkSchema();
    backends.scalar().put("users", ImmutableMap.of("id", "u1", "username", "ada"));

    String json =
        service.execute("{\"bucket\": \"work\", \"query\": \"FIND users.username\"}");

    JsonNode response = new ObjectMapper().readTree(json);
    assertEquals("ada", response.get("data").get(0).get("users").get("username").asText());
    assertEquals(1, response.get("metadata").get("returned_count").asInt());
  }

  @Test
  void explain_returns_native_queries_without_running_them() {
    createWorkSchema();

    QueryResponse response = execute("EXPLAIN FIND tasks.title MATCH tasks.status = \"open\"");

    Map<String, Object> explain = response.getData().get(0);
    List<?> queries = (List<?>) explain.get("native_queries");
    assertEquals(1, queries.size());
    assertEquals("scalar", ((Map<?, ?>) queries.get(0)).get("engine"));
    assertTrue(backends.scalar().getQueries().isEmpty());
  }

  private void createWorkSchema() {
    execute(
        "CREATE RECORD users (id: SCALAR<STRING>, username: SCALAR<STRING>, "
            + "profile: DOCUMENT, login_times: METRIC<COUNT>)");
    execute(
        "CREATE RECORD tasks (id: SCALAR<STRING>, title: SCALAR<STRING>, "
            + "status: SCALAR<STRING>, due_date: SCALAR<DATE>, project: SCALAR<STRING>, "
            + "assignees: RELATION<users>, effort: METRIC<HOURS>)");
  }

  private QueryResponse execute(String query) {
    return service.execute(QueryRequest.of(BUCKET, query));
  }
}
