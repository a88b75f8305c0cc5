/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.assembler;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.log4j.Log4j2;
import org.quantadb.qntql.analysis.model.OutputColumn;
import org.quantadb.qntql.ast.expression.AggregateCall;
import org.quantadb.qntql.ast.expression.ResolvedAttribute;
import org.quantadb.qntql.catalog.model.RecordSchema;
import org.quantadb.qntql.executor.ExecutionResult;
import org.quantadb.qntql.executor.FragmentResult;
import org.quantadb.qntql.executor.KeySets;
import org.quantadb.qntql.planner.logical.FilterPredicate;
import org.quantadb.qntql.planner.physical.EngineFragment;
import org.quantadb.qntql.planner.physical.PhysicalAggregate;
import org.quantadb.qntql.planner.physical.PhysicalFilter;
import org.quantadb.qntql.planner.physical.PhysicalLimit;
import org.quantadb.qntql.planner.physical.PhysicalNavigate;
import org.quantadb.qntql.planner.physical.PhysicalPlan;
import org.quantadb.qntql.planner.physical.PhysicalPlanVisitor;
import org.quantadb.qntql.planner.physical.PhysicalProject;
import org.quantadb.qntql.planner.physical.PhysicalScan;
import org.quantadb.qntql.planner.physical.PhysicalSort;
import org.quantadb.qntql.storage.RowShape;
import org.quantadb.qntql.storage.StorageClassification;

/**
 * Builds the response rows from fragment results by walking the physical plan.
 *
 * <ul>
 *   <li>Scan: keys are the intersection of the key-source fragments; the other fragments are left
 *       joined on the key, relation edges become lists of target keys
 *   <li>Navigate: source rows join edges on the source key, edges join target rows on the target
 *       key
 *   <li>Filter: only client-side predicates are evaluated; pushed predicates already ran in their
 *       engine
 *   <li>Aggregate, Sort, Limit: skipped when an engine already did the work
 * </ul>
 */
@Log4j2
public class ResultAssembler {

  public AssembledResult assemble(ExecutionResult result) {
    Context context = new Context(result);
    PhysicalPlan root = result.getPlan().getRoot();
    List<Tuple> tuples = root.accept(new Builder(), context);

    List<Map<String, Object>> rows = new ArrayList<>();
    PhysicalProject project = (PhysicalProject) root;
    for (Tuple tuple : tuples) {
      rows.add(project(project.outputs(), tuple));
    }
    long total = context.totalCount == null ? rows.size() : context.totalCount;
    return new AssembledResult(rows, total, context.limit, context.offset);
  }

  private static Map<String, Object> project(List<OutputColumn> outputs, Tuple tuple) {
    Map<String, Object> row = new LinkedHashMap<>();
    for (OutputColumn output : outputs) {
      Object value =
          ValueNormalizer.render(
              ExpressionEvaluator.INSTANCE.evaluate(output.expression(), tuple));
      if (output.group() == null) {
        row.put(output.name(), value);
      } else {
        @SuppressWarnings("unchecked")
        Map<String, Object> group =
            (Map<String, Object>) row.computeIfAbsent(output.group(), g -> new LinkedHashMap<>());
        group.put(output.name(), value);
      }
    }
    return row;
  }

  private static final class Context {
    private final ExecutionResult result;
    private Long totalCount;
    private Integer limit;
    private Integer offset;

    private Context(ExecutionResult result) {
      this.result = result;
    }
  }

  private static class Builder implements PhysicalPlanVisitor<List<Tuple>, Context> {

    @Override
    public List<Tuple> visitScan(PhysicalScan node, Context context) {
      RecordSchema record = node.record();
      List<Set<Object>> keySets = new ArrayList<>();
      for (EngineFragment fragment : node.keySourceFragments()) {
        FragmentResult source = context.result.get(fragment.id());
        if (source.isFailed()) {
          return new ArrayList<>();
        }
        keySets.add(source.keys());
      }
      Map<Object, Map<String, Object>> records = new LinkedHashMap<>();
      for (Object key : KeySets.intersection(keySets)) {
        records.put(key, new LinkedHashMap<>());
      }

      for (EngineFragment fragment : node.fragments()) {
        FragmentResult fragmentResult = context.result.get(fragment.id());
        if (fragmentResult.isFailed()) {
          records
              .values()
              .forEach(values -> fragment.attributes().forEach(a -> values.put(a, null)));
        } else if (fragment.engine() == StorageClassification.RELATION) {
          foldEdges(fragment, fragmentResult.getRows(), records);
        } else {
          Map<Object, Map<String, Object>> byKey = new LinkedHashMap<>();
          for (Map<String, Object> row : fragmentResult.getRows()) {
            byKey.putIfAbsent(KeySets.normalize(row.get(fragment.outputKeyColumn())), row);
          }
          records.forEach(
              (key, values) -> {
                Map<String, Object> row = byKey.get(key);
                for (String attribute : fragment.attributes()) {
                  values.put(
                      attribute,
                      row == null
                          ? null
                          : ValueNormalizer.normalize(
                              row.get(attribute), record.getAttributes().get(attribute)));
                }
              });
        }
      }

      List<Tuple> tuples = new ArrayList<>();
      String keyAttribute = record.getKeyAttribute();
      records.forEach(
          (key, values) -> {
            Map<String, Object> ordered = new LinkedHashMap<>();
            for (String attribute : record.getAttributes().keySet()) {
              if (values.containsKey(attribute)) {
                ordered.put(attribute, values.get(attribute));
              }
            }
            if (ordered.get(keyAttribute) == null) {
              ordered.put(keyAttribute, key);
            }
            tuples.add(Tuple.of(node.alias(), ordered));
          });
      return tuples;
    }

    private static void foldEdges(
        EngineFragment fragment,
        List<Map<String, Object>> edges,
        Map<Object, Map<String, Object>> records) {
      records
          .values()
          .forEach(
              values -> fragment.attributes().forEach(a -> values.put(a, new ArrayList<>())));
      for (Map<String, Object> edge : edges) {
        Map<String, Object> values = records.get(KeySets.normalize(edge.get(RowShape.SOURCE_KEY)));
        Object relation = edge.get(RowShape.RELATION);
        if (values != null && relation != null && fragment.attributes().contains(relation)) {
          @SuppressWarnings("unchecked")
          List<Object> targets = (List<Object>) values.get(relation.toString());
          targets.add(ValueNormalizer.normalizeGeneric(edge.get(RowShape.TARGET_KEY)));
        }
      }
    }

    @Override
    public List<Tuple> visitNavigate(PhysicalNavigate node, Context context) {
      List<Tuple> sources = node.source().accept(this, context);
      List<Tuple> targets = node.target().accept(this, context);
      FragmentResult traversal = context.result.get(node.traversal().id());
      List<Map<String, Object>> edges =
          traversal.isFailed() ? List.of() : traversal.getRows();

      String sourceAlias = node.hop().sourceAlias();
      String sourceKey = node.traversal().record().getKeyAttribute();
      String targetAlias = node.hop().targetAlias();
      String targetKey = node.target().record().getKeyAttribute();

      List<Map.Entry<Tuple, Object>> reached =
          HashJoinExecutor.join(
              node.algorithm(),
              sources,
              tuple -> tuple.record(sourceAlias).get(sourceKey),
              edges,
              edge -> edge.get(RowShape.SOURCE_KEY),
              HashJoinExecutor.JoinType.INNER,
              (tuple, edge) ->
                  new AbstractMap.SimpleImmutableEntry<>(tuple, edge.get(RowShape.TARGET_KEY)));
      return HashJoinExecutor.join(
          node.algorithm(),
          reached,
          Map.Entry::getValue,
          targets,
          tuple -> tuple.record(targetAlias).get(targetKey),
          HashJoinExecutor.JoinType.INNER,
          (entry, target) -> entry.getKey().join(target));
    }

    @Override
    public List<Tuple> visitFilter(PhysicalFilter node, Context context) {
      List<Tuple> tuples = node.child().accept(this, context);
      List<Tuple> kept = new ArrayList<>();
      for (Tuple tuple : tuples) {
        boolean matches = true;
        for (FilterPredicate predicate : node.predicates()) {
          if (predicate.clientSide()
              && !ExpressionEvaluator.INSTANCE.test(predicate.expression(), tuple)) {
            matches = false;
            break;
          }
        }
        if (matches) {
          kept.add(tuple);
        }
      }
      log.debug("Client-side filter kept {} of {} rows", kept.size(), tuples.size());
      return kept;
    }

    @Override
    public List<Tuple> visitAggregate(PhysicalAggregate node, Context context) {
      if (node.pushed()) {
        return engineGroups(node, (PhysicalScan) node.child(), context);
      }
      List<Tuple> tuples = node.child().accept(this, context);
      Map<List<Object>, List<Tuple>> groups = new LinkedHashMap<>();
      for (Tuple tuple : tuples) {
        List<Object> key = new ArrayList<>();
        for (ResolvedAttribute attribute : node.groupBy()) {
          key.add(KeySets.normalize(ExpressionEvaluator.INSTANCE.evaluate(attribute, tuple)));
        }
        groups.computeIfAbsent(key, k -> new ArrayList<>()).add(tuple);
      }
      if (groups.isEmpty() && node.groupBy().isEmpty()) {
        groups.put(List.of(), List.of());
      }

      List<Tuple> result = new ArrayList<>();
      for (List<Tuple> group : groups.values()) {
        Map<String, Object> aggregates = new LinkedHashMap<>();
        for (AggregateCall call : node.aggregates()) {
          aggregates.put(call.canonicalName(), Aggregator.compute(call, group));
        }
        Tuple representative =
            group.isEmpty() ? new Tuple(Map.of(), Map.of()) : group.get(0);
        Tuple grouped = representative.withAggregates(aggregates);
        if (node.having() == null || ExpressionEvaluator.INSTANCE.test(node.having(), grouped)) {
          result.add(grouped);
        }
      }
      return result;
    }

    /** Groups computed by the engine: one row per group, aggregates under their canonical name. */
    private static List<Tuple> engineGroups(
        PhysicalAggregate node, PhysicalScan scan, Context context) {
      FragmentResult fragmentResult = context.result.get(scan.fragments().get(0).id());
      if (fragmentResult.isFailed()) {
        return new ArrayList<>();
      }
      List<Tuple> result = new ArrayList<>();
      for (Map<String, Object> row : fragmentResult.getRows()) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (ResolvedAttribute attribute : node.groupBy()) {
          values.put(
              attribute.attribute(),
              ValueNormalizer.normalize(row.get(attribute.attribute()), attribute.definition()));
        }
        Map<String, Object> aggregates = new LinkedHashMap<>();
        for (AggregateCall call : node.aggregates()) {
          aggregates.put(
              call.canonicalName(),
              ValueNormalizer.normalizeGeneric(row.get(call.canonicalName())));
        }
        Map<String, Map<String, Object>> records =
            values.isEmpty() ? Map.of() : Collections.singletonMap(scan.alias(), values);
        result.add(new Tuple(records, aggregates));
      }
      return result;
    }

    @Override
    public List<Tuple> visitSort(PhysicalSort node, Context context) {
      List<Tuple> tuples = new ArrayList<>(node.child().accept(this, context));
      if (!node.pushed()) {
        HashJoinExecutor.sortRows(tuples, node.keys());
      }
      return tuples;
    }

    @Override
    public List<Tuple> visitLimit(PhysicalLimit node, Context context) {
      List<Tuple> tuples = node.child().accept(this, context);
      context.limit = node.limit();
      context.offset = node.offset();
      context.totalCount = (long) tuples.size();
      int from = node.offset() == null ? 0 : Math.min(node.offset(), tuples.size());
      int to =
          node.limit() == null
              ? tuples.size()
              : (int) Math.min(tuples.size(), (long) from + node.limit());
      return new ArrayList<>(tuples.subList(from, to));
    }

    @Override
    public List<Tuple> visitProject(PhysicalProject node, Context context) {
      return node.child().accept(this, context);
    }
  }
}
