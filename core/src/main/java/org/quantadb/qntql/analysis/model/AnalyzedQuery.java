/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.analysis.model;

import java.util.List;
import org.quantadb.qntql.ast.expression.AggregateCall;
import org.quantadb.qntql.ast.expression.Expression;
import org.quantadb.qntql.ast.expression.ResolvedAttribute;

/**
 * Read query over one or more records.
 *
 * @param filter resolved MATCH expression, null when absent
 * @param aggregates distinct aggregate calls used by outputs, HAVING and ORDER BY
 * @param having resolved HAVING expression, null when absent
 */
public record AnalyzedQuery(
    String bucket,
    RecordScope scope,
    List<OutputColumn> outputs,
    List<AnalyzedHop> navigation,
    Expression filter,
    List<ResolvedAttribute> groupBy,
    List<AggregateCall> aggregates,
    Expression having,
    List<SortKey> sort,
    Integer limit,
    Integer offset)
    implements AnalyzedStatement {

  public AnalyzedQuery {
    outputs = List.copyOf(outputs);
    navigation = List.copyOf(navigation);
    groupBy = List.copyOf(groupBy);
    aggregates = List.copyOf(aggregates);
    sort = List.copyOf(sort);
  }

  public boolean isAggregation() {
    return !groupBy.isEmpty() || !aggregates.isEmpty();
  }

  @Override
  public <R, C> R accept(AnalyzedStatementVisitor<R, C> visitor, C context) {
    return visitor.visitQuery(this, context);
  }
}
