/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */


package org.quantadb.qntql.planner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.quantadb.qntql.WorkSchema;
import org.quantadb.qntql.analysis.model.AnalyzedQuery;
import org.quantadb.qntql.ast.expression.ResolvedAttribute;
import org.quantadb.qntql.common.setting.QuantaSettings;
import org.quantadb.qntql.planner.logical.DeferralReason;
import org.quantadb.qntql.planner.logical.FilterPredicate;
import org.quantadb.qntql.planner.logical.LogicalAggregate;
import org.quantadb.qntql.planner.logical.LogicalFilter;
import org.quantadb.qntql.planner.logical.LogicalLimit;
import org.quantadb.qntql.planner.logical.LogicalNavigate;
import org.quantadb.qntql.planner.logical.LogicalPlan;
import org.quantadb.qntql.planner.logical.LogicalPlanner;
import org.quantadb.qntql.planner.logical.LogicalProject;
import org.quantadb.qntql.planner.logical.LogicalScan;
import org.quantadb.qntql.planner.logical.LogicalSort;
import org.quantadb.qntql.planner.logical.TraversalDirection;
import org.quantadb.qntql.planner.optimizer.CardinalityEstimator;
import org.quantadb.qntql.planner.optimizer.LogicalPlanOptimizer;
import org.quantadb.qntql.translator.StubTranslator;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class LogicalPlanOptimizerTest {

  private final WorkSchema schema = new WorkSchema();

  private final CardinalityEstimator estimator =
      new CardinalityEstimator(QuantaSettings.defaults().getPlanner());

  private final LogicalPlanner planner = new LogicalPlanner(estimator);

  private final LogicalPlanOptimizer optimizer =
      LogicalPlanOptimizer.create(StubTranslator.registry(), estimator);

  @Test
  void unoptimized_plan_stacks_operators_over_the_scan() {
    LogicalPlan plan =
        planner.plan(
            query(
                "FIND tasks.status, count(*) FROM tasks MATCH tasks.priority > 2"
                    + " GROUP BY tasks.status ORDER BY tasks.status LIMIT 3"));

    LogicalProject project = assertInstanceOf(LogicalProject.class, plan);
    LogicalLimit limit = assertInstanceOf(LogicalLimit.class, project.child());
    LogicalSort sort = assertInstanceOf(LogicalSort.class, limit.child());
    LogicalAggregate aggregate = assertInstanceOf(LogicalAggregate.class, sort.child());
    LogicalFilter filter = assertInstanceOf(LogicalFilter.class, aggregate.child());
    LogicalScan scan = assertInstanceOf(LogicalScan.class, filter.child());
    assertEquals(schema.record("tasks").getAttributes().keySet(), scan.attributes());
    assertFalse(filter.predicates().get(0).clientSide());
    assertEquals(3.0, plan.cardinality());
  }

  @Test
  void single_engine_predicates_move_into_the_scan() {
    LogicalPlan plan = optimize("FIND tasks.title FROM tasks MATCH tasks.status = 'open'");

    LogicalScan scan = assertInstanceOf(LogicalScan.class, child(plan));
    assertEquals(1, scan.predicates().size());
    assertEquals(Set.of("id", "title"), scan.attributes());
    assertEquals(2500.0, scan.cardinality());
  }

  @Test
  void indexed_predicates_are_estimated_as_selective() {
    LogicalPlan plan = optimize("FIND tasks.title FROM tasks MATCH tasks.id = 't1'");

    assertEquals(100.0, assertInstanceOf(LogicalScan.class, child(plan)).cardinality());
  }

  @Test
  void predicates_the_engine_cannot_evaluate_stay_client_side() {
    LogicalPlan plan =
        optimize("FIND tasks.title FROM tasks MATCH tasks.status = 'open' AND tasks.effort > 3");

    LogicalFilter filter = assertInstanceOf(LogicalFilter.class, child(plan));
    FilterPredicate predicate = filter.predicates().get(0);
    assertEquals(1, filter.predicates().size());
    assertTrue(predicate.clientSide());
    assertEquals(DeferralReason.NOT_PUSHABLE, predicate.reason());
    LogicalScan scan = assertInstanceOf(LogicalScan.class, filter.child());
    assertEquals(1, scan.predicates().size());
    assertEquals(Set.of("id", "title", "effort"), scan.attributes());
  }

  @Test
  void disjunction_across_engines_is_deferred() {
    LogicalPlan plan =
        optimize("FIND tasks.title FROM tasks MATCH tasks.status = 'open' OR tasks.effort > 3");

    LogicalFilter filter = assertInstanceOf(LogicalFilter.class, child(plan));
    assertEquals(DeferralReason.CROSS_ENGINE, filter.predicates().get(0).reason());
    assertTrue(assertInstanceOf(LogicalScan.class, filter.child()).predicates().isEmpty());
  }

  @Test
  void comparison_between_records_is_deferred() {
    LogicalPlan plan =
        optimize(
            "FIND tasks.title FROM tasks NAVIGATE tasks->assignees:users AS u"
                + " MATCH u.age > tasks.priority");

    LogicalFilter filter = assertInstanceOf(LogicalFilter.class, child(plan));
    assertEquals(DeferralReason.MULTI_RECORD, filter.predicates().get(0).reason());
  }

  @Test
  void selective_navigation_target_is_traversed_in_reverse() {
    LogicalPlan plan =
        optimize(
            "FIND tasks.title, u.username FROM tasks NAVIGATE tasks->assignees:users AS u"
                + " MATCH u.username = 'ann'");

    LogicalNavigate navigate = assertInstanceOf(LogicalNavigate.class, child(plan));
    assertEquals(TraversalDirection.REVERSE, navigate.direction());
    assertEquals(1, navigate.target().predicates().size());
    assertEquals(Set.of("id", "username"), navigate.target().attributes());
    assertEquals(Set.of("id", "title"), ((LogicalScan) navigate.source()).attributes());
  }

  @Test
  void unfiltered_navigation_stays_forward() {
    LogicalPlan plan =
        optimize("FIND tasks.title, u.username FROM tasks NAVIGATE tasks->assignees:users AS u");

    LogicalNavigate navigate = assertInstanceOf(LogicalNavigate.class, child(plan));
    assertEquals(TraversalDirection.FORWARD, navigate.direction());
    assertEquals(30_000.0, navigate.cardinality());
  }

  @Test
  void independent_hops_run_cheapest_target_first() {
    LogicalPlan plan =
        optimize(
            "FIND tasks.title FROM tasks"
                + " NAVIGATE tasks->blocked_by:tasks AS b, tasks->assignees:users AS u"
                + " MATCH u.id = 'u1'");

    LogicalNavigate top = assertInstanceOf(LogicalNavigate.class, child(plan));
    LogicalNavigate first = assertInstanceOf(LogicalNavigate.class, top.source());
    assertEquals("u", first.hop().targetAlias());
    assertEquals(TraversalDirection.REVERSE, first.direction());
    assertEquals("b", top.hop().targetAlias());
    assertEquals(TraversalDirection.FORWARD, top.direction());
  }

  @Test
  void dependent_hops_keep_their_order() {
    LogicalPlan plan =
        optimize(
            "FIND tasks.title FROM tasks"
                + " NAVIGATE tasks->blocked_by:tasks AS b, b->assignees:users AS u"
                + " MATCH u.id = 'u1'");

    LogicalNavigate top = assertInstanceOf(LogicalNavigate.class, child(plan));
    LogicalNavigate first = assertInstanceOf(LogicalNavigate.class, top.source());
    assertEquals("b", first.hop().targetAlias());
    assertEquals("u", top.hop().targetAlias());
    assertEquals(TraversalDirection.FORWARD, top.direction());
  }

  @Test
  void ordering_is_pushed_to_an_ordering_engine_and_paging_is_not() {
    LogicalPlan plan =
        optimize("FIND tasks.title FROM tasks ORDER BY tasks.priority DESC LIMIT 10");

    LogicalLimit limit = assertInstanceOf(LogicalLimit.class, child(plan));
    LogicalSort sort = assertInstanceOf(LogicalSort.class, limit.child());
    LogicalScan scan = assertInstanceOf(LogicalScan.class, sort.child());
    assertTrue(sort.pushed());
    assertEquals(Integer.valueOf(10), limit.limit());
    assertEquals(1, scan.pushdown().sort().size());
    assertFalse(scan.pushdown().sort().get(0).ascending());
    assertNull(scan.pushdown().aggregation());
  }

  @Test
  void ordering_over_several_engines_stays_client_side() {
    LogicalPlan plan =
        optimize("FIND tasks.title, tasks.effort FROM tasks ORDER BY tasks.title LIMIT 5");

    LogicalLimit limit = assertInstanceOf(LogicalLimit.class, child(plan));
    LogicalSort sort = assertInstanceOf(LogicalSort.class, limit.child());
    assertEquals(Integer.valueOf(5), limit.limit());
    assertFalse(sort.pushed());
    assertNull(assertInstanceOf(LogicalScan.class, sort.child()).pushdown());
  }

  @Test
  void grouping_is_pushed_with_its_having_clause() {
    LogicalPlan plan =
        optimize(
            "FIND tasks.status, count(*) AS n FROM tasks GROUP BY tasks.status"
                + " HAVING count(*) > 1");

    LogicalAggregate aggregate = assertInstanceOf(LogicalAggregate.class, child(plan));
    assertTrue(aggregate.pushed());
    LogicalScan scan = assertInstanceOf(LogicalScan.class, aggregate.child());
    assertNotNull(scan.pushdown().aggregation().having());
    assertEquals(List.of("status"), attributeNames(scan.pushdown().aggregation().groupBy()));
  }

  @Test
  void global_aggregate_yields_a_single_row() {
    LogicalPlan plan = optimize("FIND count(*) FROM tasks");

    assertEquals(1.0, plan.cardinality());
  }

  private LogicalPlan optimize(String text) {
    return optimizer.optimize(planner.plan(query(text)));
  }

  private AnalyzedQuery query(String text) {
    return assertInstanceOf(AnalyzedQuery.class, schema.analyze(text));
  }

  private static LogicalPlan child(LogicalPlan plan) {
    return assertInstanceOf(LogicalProject.class, plan).child();
  }

  private static List<String> attributeNames(List<ResolvedAttribute> attributes) {
    return attributes.stream().map(ResolvedAttribute::attribute).collect(Collectors.toList());
  }
}
