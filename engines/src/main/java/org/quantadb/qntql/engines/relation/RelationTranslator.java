/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.engines.relation;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.quantadb.qntql.ast.expression.Expression;
import org.quantadb.qntql.catalog.model.RecordSchema;
import org.quantadb.qntql.engines.AbstractEngineTranslator;
import org.quantadb.qntql.engines.NamedParameters;
import org.quantadb.qntql.planner.logical.TraversalDirection;
import org.quantadb.qntql.planner.physical.EngineFragment;
import org.quantadb.qntql.storage.NativeQuery;
import org.quantadb.qntql.storage.RowShape;
import org.quantadb.qntql.storage.StorageClassification;

/**
 * Translates relation fragments into Cypher. Every record is a node labelled with the record name
 * and holding its key in {@link #NODE_KEY}; every relation attribute is a relationship type. All
 * queries return edge rows.
 *
 * <pre>
 * MATCH (s:`users`)-[r:`works_on`]-&gt;(t:`projects`) WHERE s._key IN $sourceKeys
 * RETURN s._key AS source_key, type(r) AS relation, t._key AS target_key
 * </pre>
 */
public class RelationTranslator extends AbstractEngineTranslator {

  /** Node property holding the record key. */
  public static final String NODE_KEY = "_key";

  private static final String NODE = "n";

  public RelationTranslator() {
    super(StorageClassification.RELATION, new RelationPredicateSupport());
  }

  /**
   * Scan of a record's relation attributes. Nodes matching the predicates are returned even when
   * they have no edges, with a null relation, so they still contribute their key.
   */
  @Override
  protected NativeQuery translateScan(EngineFragment fragment, String bucket) {
    RecordSchema record = fragment.record();
    NamedParameters parameters = new NamedParameters();
    StringBuilder cypher =
        new StringBuilder("MATCH (").append(NODE).append(':').append(label(record.getName()));
    cypher.append(')');

    List<String> conditions = new ArrayList<>();
    if (fragment.isKeyed()) {
      conditions.add(
          NODE + "." + NODE_KEY + " IN $" + parameters.declare(fragment.keyInput().parameter()));
    }
    CypherExpressionRenderer renderer = new CypherExpressionRenderer(NODE);
    for (Expression predicate : fragment.predicates()) {
      conditions.add(predicate.accept(renderer, parameters));
    }
    if (!conditions.isEmpty()) {
      cypher.append(" WHERE ").append(String.join(" AND ", conditions));
    }

    if (fragment.attributes().isEmpty()) {
      cypher
          .append(" RETURN ")
          .append(NODE)
          .append('.')
          .append(NODE_KEY)
          .append(" AS ")
          .append(RowShape.SOURCE_KEY)
          .append(", null AS ")
          .append(RowShape.RELATION)
          .append(", null AS ")
          .append(RowShape.TARGET_KEY);
    } else {
      cypher
          .append(" OPTIONAL MATCH (")
          .append(NODE)
          .append(")-[r:")
          .append(
              fragment.attributes().stream()
                  .map(RelationTranslator::label)
                  .collect(Collectors.joining("|")))
          .append("]->(m)")
          .append(edgeReturn(NODE, "m"));
    }
    return new NativeQuery(
        StorageClassification.RELATION,
        fragment.id(),
        cypher.toString(),
        parameters.build(),
        edgeShape());
  }

  /** Follows one relation attribute from the keyed side of the hop. */
  @Override
  protected NativeQuery translateTraversal(EngineFragment fragment, String bucket) {
    NamedParameters parameters = new NamedParameters();
    StringBuilder cypher =
        new StringBuilder("MATCH (s:")
            .append(label(fragment.record().getName()))
            .append(")-[r:")
            .append(label(fragment.relation()))
            .append("]->(t:")
            .append(label(fragment.targetRecord()))
            .append(')');

    List<String> conditions = new ArrayList<>();
    if (fragment.isKeyed()) {
      String side = fragment.direction() == TraversalDirection.REVERSE ? "t" : "s";
      conditions.add(
          side + "." + NODE_KEY + " IN $" + parameters.declare(fragment.keyInput().parameter()));
    }
    CypherExpressionRenderer renderer = new CypherExpressionRenderer("s");
    for (Expression predicate : fragment.predicates()) {
      conditions.add(predicate.accept(renderer, parameters));
    }
    if (!conditions.isEmpty()) {
      cypher.append(" WHERE ").append(String.join(" AND ", conditions));
    }
    cypher.append(edgeReturn("s", "t"));
    return new NativeQuery(
        StorageClassification.RELATION,
        fragment.id(),
        cypher.toString(),
        parameters.build(),
        edgeShape());
  }

  /** Condition on the node variable {@code n}, for MATCH ... WHERE ... SET and DETACH DELETE. */
  @Override
  protected NativeQuery writeCondition(String bucket, RecordSchema record, Expression condition) {
    NamedParameters parameters = new NamedParameters();
    String text = condition.accept(new CypherExpressionRenderer(NODE), parameters);
    return new NativeQuery(
        StorageClassification.RELATION, null, text, parameters.build(), keyShape(record));
  }

  @Override
  public NativeQuery translateKeyCondition(String bucket, RecordSchema record, List<Object> keys) {
    NamedParameters parameters = new NamedParameters();
    String text = NODE + "." + NODE_KEY + " IN $" + parameters.declare(NativeQuery.KEYS);
    return new NativeQuery(
            StorageClassification.RELATION, null, text, parameters.build(), keyShape(record))
        .bind(NativeQuery.KEYS, List.copyOf(keys));
  }

  private static String edgeReturn(String source, String target) {
    return " RETURN "
        + source
        + "."
        + NODE_KEY
        + " AS "
        + RowShape.SOURCE_KEY
        + ", type(r) AS "
        + RowShape.RELATION
        + ", "
        + target
        + "."
        + NODE_KEY
        + " AS "
        + RowShape.TARGET_KEY;
  }

  private static RowShape edgeShape() {
    return new RowShape(
        RowShape.Kind.EDGES,
        RowShape.SOURCE_KEY,
        List.of(
            new RowShape.Column(RowShape.RELATION, StorageClassification.RELATION, null, null),
            new RowShape.Column(RowShape.TARGET_KEY, StorageClassification.RELATION, null, null)));
  }

  /** Backtick-quoted label or relationship type. */
  static String label(String name) {
    return '`' + name.replace("`", "``") + '`';
  }
}
