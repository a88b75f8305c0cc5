/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.physical;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.quantadb.qntql.ast.expression.Expression;
import org.quantadb.qntql.ast.expression.Expressions;
import org.quantadb.qntql.catalog.model.RecordSchema;
import org.quantadb.qntql.common.setting.QuantaSettings;
import org.quantadb.qntql.planner.logical.LogicalAggregate;
import org.quantadb.qntql.planner.logical.LogicalFilter;
import org.quantadb.qntql.planner.logical.LogicalLimit;
import org.quantadb.qntql.planner.logical.LogicalNavigate;
import org.quantadb.qntql.planner.logical.LogicalPlan;
import org.quantadb.qntql.planner.logical.LogicalPlanVisitor;
import org.quantadb.qntql.planner.logical.LogicalProject;
import org.quantadb.qntql.planner.logical.LogicalScan;
import org.quantadb.qntql.planner.logical.LogicalSort;
import org.quantadb.qntql.planner.logical.TraversalDirection;
import org.quantadb.qntql.planner.optimizer.CardinalityEstimator;
import org.quantadb.qntql.storage.NativeQuery;
import org.quantadb.qntql.storage.StorageClassification;
import org.quantadb.qntql.translator.TranslatorRegistry;

/**
 * Turns an optimized logical plan into engine fragments, picks the algorithms and execution modes,
 * and translates every fragment into its native query.
 *
 * <p>Scan fragments: one per engine the scan touches. Fragments with pushed predicates drive. An
 * unkeyed scan runs its drivers in parallel and keys the remaining fragments on the first driver;
 * a scan reached through a navigation keys every fragment on the traversal. A traversal is keyed
 * on the key sources of the scan it starts from.
 */
@Log4j2
@RequiredArgsConstructor
public class PhysicalPlanner {

  private final TranslatorRegistry translators;

  private final CardinalityEstimator estimator;

  private final QuantaSettings.Planner settings;

  public ExecutablePlan plan(String bucket, LogicalPlan logicalPlan) {
    Context context = new Context(feedingAliases(logicalPlan));
    PhysicalPlan root = logicalPlan.accept(new Builder(), context);

    Map<String, NativeQuery> queries = new LinkedHashMap<>();
    for (EngineFragment fragment : context.fragments) {
      NativeQuery query = translators.get(fragment.engine()).translate(fragment, bucket);
      log.debug("Fragment {} -> {}", fragment.describe(), query.getText());
      queries.put(fragment.id(), query);
    }
    return new ExecutablePlan(bucket, logicalPlan, root, context.fragments, queries);
  }

  /** Aliases whose scan output feeds a traversal. */
  private static Set<String> feedingAliases(LogicalPlan plan) {
    Set<String> aliases = new HashSet<>();
    collectFeeding(plan, aliases);
    return aliases;
  }

  private static void collectFeeding(LogicalPlan plan, Set<String> aliases) {
    if (plan instanceof LogicalNavigate navigate) {
      aliases.add(
          navigate.direction() == TraversalDirection.FORWARD
              ? navigate.hop().sourceAlias()
              : navigate.hop().targetAlias());
    }
    plan.getChildren().forEach(child -> collectFeeding(child, aliases));
  }

  private static final class Context {
    private final Set<String> feedingAliases;
    private final List<EngineFragment> fragments = new ArrayList<>();
    private final Map<String, PhysicalScan> scans = new HashMap<>();

    private Context(Set<String> feedingAliases) {
      this.feedingAliases = feedingAliases;
    }

    private String nextId() {
      return "f" + (fragments.size() + 1);
    }

    private EngineFragment add(EngineFragment fragment) {
      EngineFragment numbered = fragment.toBuilder().id(nextId()).build();
      fragments.add(numbered);
      return numbered;
    }
  }

  private class Builder implements LogicalPlanVisitor<PhysicalPlan, Context> {

    @Override
    public PhysicalPlan visitScan(LogicalScan node, Context context) {
      return scan(node, null, context);
    }

    @Override
    public PhysicalPlan visitFilter(LogicalFilter node, Context context) {
      PhysicalPlan child = node.child().accept(this, context);
      return new PhysicalFilter(child, node.predicates(), child.mode(), node.cardinality());
    }

    @Override
    public PhysicalPlan visitNavigate(LogicalNavigate node, Context context) {
      JoinAlgorithm algorithm =
          Math.max(node.source().cardinality(), node.target().cardinality())
                  > settings.getHashJoinThreshold()
              ? JoinAlgorithm.HASH_JOIN
              : JoinAlgorithm.NESTED_LOOP;

      if (node.direction() == TraversalDirection.REVERSE) {
        LogicalScan primary = (LogicalScan) node.source();
        PhysicalScan target = scan(node.target(), null, context);
        EngineFragment traversal =
            context.add(traversal(node, primary.record(), target, NativeQuery.TARGET_KEYS));
        PhysicalScan source =
            scan(
                primary,
                new KeyInput(List.of(traversal.id()), NativeQuery.KEYS),
                context);
        return new PhysicalNavigate(
            source,
            target,
            node.hop(),
            traversal,
            algorithm,
            ExecutionMode.SEQUENTIAL,
            true,
            node.cardinality());
      }

      PhysicalPlan source = node.source().accept(this, context);
      PhysicalScan from = context.scans.get(node.hop().sourceAlias());
      EngineFragment traversal =
          context.add(traversal(node, from.record(), from, NativeQuery.SOURCE_KEYS));
      PhysicalScan target =
          scan(node.target(), new KeyInput(List.of(traversal.id()), NativeQuery.KEYS), context);
      return new PhysicalNavigate(
          source,
          target,
          node.hop(),
          traversal,
          algorithm,
          ExecutionMode.SEQUENTIAL,
          true,
          node.cardinality());
    }

    @Override
    public PhysicalPlan visitAggregate(LogicalAggregate node, Context context) {
      PhysicalPlan child = node.child().accept(this, context);
      return new PhysicalAggregate(
          child,
          node.groupBy(),
          node.aggregates(),
          node.having(),
          node.groupBy().isEmpty() ? AggregationStrategy.STREAMING : AggregationStrategy.HASH,
          node.pushed(),
          child.mode(),
          node.cardinality());
    }

    @Override
    public PhysicalPlan visitSort(LogicalSort node, Context context) {
      PhysicalPlan child = node.child().accept(this, context);
      return new PhysicalSort(child, node.keys(), node.pushed(), child.mode(), node.cardinality());
    }

    @Override
    public PhysicalPlan visitLimit(LogicalLimit node, Context context) {
      PhysicalPlan child = node.child().accept(this, context);
      return new PhysicalLimit(
          child, node.limit(), node.offset(), child.mode(), node.cardinality());
    }

    @Override
    public PhysicalPlan visitProject(LogicalProject node, Context context) {
      PhysicalPlan child = node.child().accept(this, context);
      return new PhysicalProject(child, node.outputs(), child.mode(), node.cardinality());
    }
  }

  private EngineFragment traversal(
      LogicalNavigate node, RecordSchema source, PhysicalScan keyedOn, String parameter) {
    return EngineFragment.builder()
        .alias(node.hop().sourceAlias())
        .record(source)
        .engine(StorageClassification.RELATION)
        .kind(FragmentKind.TRAVERSE)
        .attributes(List.of(node.hop().relation().attribute()))
        .algorithm(ScanAlgorithm.KEY_LOOKUP)
        .keyInput(new KeyInput(keyedOn.keySources(), parameter))
        .targetRecord(node.hop().target().getName())
        .direction(node.direction())
        .build();
  }

  private PhysicalScan scan(LogicalScan node, KeyInput external, Context context) {
    RecordSchema record = node.record();
    Map<StorageClassification, List<Expression>> predicates =
        new EnumMap<>(StorageClassification.class);
    for (Expression predicate : node.predicates()) {
      predicates
          .computeIfAbsent(Expressions.engines(predicate).iterator().next(), e -> new ArrayList<>())
          .add(predicate);
    }
    Set<StorageClassification> engines = node.getEngines();
    boolean single = engines.size() == 1;

    List<EngineFragment> fragments = new ArrayList<>();
    List<String> drivers = new ArrayList<>();
    for (StorageClassification engine : engines) {
      if (predicates.containsKey(engine)) {
        EngineFragment driver =
            context.add(fragment(node, engine, predicates.get(engine), external, single));
        fragments.add(driver);
        drivers.add(driver.id());
      }
    }
    KeyInput followers =
        external != null || drivers.isEmpty()
            ? external
            : new KeyInput(List.of(drivers.get(0)), NativeQuery.KEYS);
    String base = null;
    for (StorageClassification engine : engines) {
      if (!predicates.containsKey(engine)) {
        EngineFragment fragment = context.add(fragment(node, engine, List.of(), followers, single));
        fragments.add(fragment);
        if (engine == record.getKeyEngine()) {
          base = fragment.id();
        }
      }
    }
    List<String> keySources = drivers.isEmpty() ? List.of(base) : drivers;

    boolean keyed = fragments.stream().anyMatch(EngineFragment::isKeyed);
    PhysicalScan scan =
        new PhysicalScan(
            node.alias(),
            record,
            fragments,
            keySources,
            keyed ? ExecutionMode.SEQUENTIAL : ExecutionMode.PARALLEL,
            context.feedingAliases.contains(node.alias()),
            node.cardinality());
    context.scans.put(node.alias(), scan);
    return scan;
  }

  private EngineFragment fragment(
      LogicalScan node,
      StorageClassification engine,
      List<Expression> predicates,
      KeyInput keyInput,
      boolean single) {
    List<String> attributes = new ArrayList<>();
    for (String attribute : node.record().attributesOf(engine)) {
      if (node.attributes().contains(attribute)) {
        attributes.add(attribute);
      }
    }
    ScanAlgorithm algorithm = ScanAlgorithm.FULL_SCAN;
    if (predicates.stream().anyMatch(p -> estimator.isIndexed(p, node.record()))) {
      algorithm = ScanAlgorithm.INDEX_SCAN;
    } else if (keyInput != null) {
      algorithm = ScanAlgorithm.KEY_LOOKUP;
    }
    return EngineFragment.builder()
        .alias(node.alias())
        .record(node.record())
        .engine(engine)
        .kind(FragmentKind.SCAN)
        .attributes(attributes)
        .predicates(predicates)
        .algorithm(algorithm)
        .keyInput(keyInput)
        .pushdown(single ? node.pushdown() : null)
        .build();
  }
}
