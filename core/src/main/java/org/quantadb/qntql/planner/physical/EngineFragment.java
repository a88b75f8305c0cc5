/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.physical;

import java.util.List;
import lombok.Builder;
import org.quantadb.qntql.ast.expression.Expression;
import org.quantadb.qntql.catalog.model.RecordSchema;
import org.quantadb.qntql.planner.logical.EnginePushdown;
import org.quantadb.qntql.planner.logical.TraversalDirection;
import org.quantadb.qntql.storage.RowShape;
import org.quantadb.qntql.storage.StorageClassification;

/**
 * Unit of work sent to one engine, translated into exactly one native query.
 *
 * @param id fragment id, unique within the plan and assigned in dependency order
 * @param alias alias of the record the fragment reads
 * @param record record schema
 * @param engine engine executing the fragment
 * @param kind scan or traversal
 * @param attributes attributes to return (scan) or the relation followed (traverse)
 * @param predicates conjuncts the engine must apply
 * @param algorithm expected access path
 * @param keyInput upstream key set, null for an unkeyed fragment
 * @param pushdown ordering or aggregation done by the engine, null for none
 * @param targetRecord target record of a traversal
 * @param direction traversal direction
 */
@Builder(toBuilder = true)
public record EngineFragment(
    String id,
    String alias,
    RecordSchema record,
    StorageClassification engine,
    FragmentKind kind,
    List<String> attributes,
    List<Expression> predicates,
    ScanAlgorithm algorithm,
    KeyInput keyInput,
    EnginePushdown pushdown,
    String targetRecord,
    TraversalDirection direction) {

  public EngineFragment {
    attributes = attributes == null ? List.of() : List.copyOf(attributes);
    predicates = predicates == null ? List.of() : List.copyOf(predicates);
  }

  /** Fragments with predicates restrict the record's key set. */
  public boolean isDriver() {
    return !predicates.isEmpty();
  }

  public boolean isKeyed() {
    return keyInput != null;
  }

  /**
   * Column of this fragment's rows that downstream fragments read keys from: the record key for
   * row and key scans, the source key for relation scans, and the key at the far end of a
   * traversal.
   */
  public String outputKeyColumn() {
    if (kind == FragmentKind.TRAVERSE) {
      return direction == TraversalDirection.FORWARD ? RowShape.TARGET_KEY : RowShape.SOURCE_KEY;
    }
    return engine == StorageClassification.RELATION
        ? RowShape.SOURCE_KEY
        : record.getKeyAttribute();
  }

  /** Relation attribute a traversal follows. */
  public String relation() {
    return attributes.get(0);
  }

  public String describe() {
    StringBuilder text =
        new StringBuilder(id)
            .append(' ')
            .append(kind)
            .append(' ')
            .append(engine.getEngineName())
            .append(' ')
            .append(alias);
    if (kind == FragmentKind.TRAVERSE) {
      text.append(" -").append(relation()).append("-> ").append(targetRecord);
      text.append(' ').append(direction);
    } else {
      text.append(' ').append(attributes).append(' ').append(algorithm);
    }
    if (keyInput != null) {
      text.append(" keyed by ").append(keyInput.upstream());
    }
    return text.toString();
  }
}
