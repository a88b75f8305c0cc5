/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.logical;

import java.util.List;
import org.quantadb.qntql.analysis.model.SortKey;
import org.quantadb.qntql.ast.expression.AggregateCall;
import org.quantadb.qntql.ast.expression.Expression;
import org.quantadb.qntql.ast.expression.ResolvedAttribute;

/**
 * Ordering and aggregation an engine performs for a single-engine scan. Paging always stays with
 * the result assembler, which needs the full row count.
 *
 * @param sort sort keys, empty for none
 * @param aggregation grouping the engine computes, null for none
 */
public record EnginePushdown(List<SortKey> sort, Aggregation aggregation) {

  public EnginePushdown {
    sort = List.copyOf(sort);
  }

  /** Grouping computed by the engine. */
  public record Aggregation(
      List<ResolvedAttribute> groupBy, List<AggregateCall> aggregates, Expression having) {

    public Aggregation {
      groupBy = List.copyOf(groupBy);
      aggregates = List.copyOf(aggregates);
    }
  }
}
