/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.engines.relation;

import static org.quantadb.qntql.engines.relation.RelationTranslator.NODE_KEY;
import static org.quantadb.qntql.engines.relation.RelationTranslator.label;

import java.util.ArrayList;
import java.util.List;
import org.quantadb.qntql.ast.expression.AggregateCall;
import org.quantadb.qntql.ast.expression.And;
import org.quantadb.qntql.ast.expression.AttributeRef;
import org.quantadb.qntql.ast.expression.Comparison;
import org.quantadb.qntql.ast.expression.Contains;
import org.quantadb.qntql.ast.expression.Expression;
import org.quantadb.qntql.ast.expression.ExpressionVisitor;
import org.quantadb.qntql.ast.expression.InList;
import org.quantadb.qntql.ast.expression.IsNull;
import org.quantadb.qntql.ast.expression.Literal;
import org.quantadb.qntql.ast.expression.Not;
import org.quantadb.qntql.ast.expression.Or;
import org.quantadb.qntql.ast.expression.RecordRef;
import org.quantadb.qntql.ast.expression.ResolvedAttribute;
import org.quantadb.qntql.engines.NamedParameters;

/**
 * Renders predicates on relation attributes as existential subqueries over the outgoing edges of
 * the node bound to {@code variable}. A relation value is the list of target keys, so equality and
 * CONTAINS test for one matching edge, and inequality for none.
 */
class CypherExpressionRenderer implements ExpressionVisitor<String, NamedParameters> {

  private final String variable;

  CypherExpressionRenderer(String variable) {
    this.variable = variable;
  }

  @Override
  public String visitComparison(Comparison node, NamedParameters parameters) {
    Comparison comparison = node.normalized();
    String exists =
        edgeTo(comparison.left(), "= $" + parameters.add(((Literal) comparison.right()).value()));
    return comparison.operator() == Comparison.Operator.NEQ ? "NOT " + exists : exists;
  }

  @Override
  public String visitInList(InList node, NamedParameters parameters) {
    List<Object> values = new ArrayList<>();
    node.values().forEach(value -> values.add(value.value()));
    String exists = edgeTo(node.operand(), "IN $" + parameters.add(values));
    return node.negated() ? "NOT " + exists : exists;
  }

  @Override
  public String visitContains(Contains node, NamedParameters parameters) {
    return edgeTo(node.operand(), "= $" + parameters.add(((Literal) node.value()).value()));
  }

  @Override
  public String visitIsNull(IsNull node, NamedParameters parameters) {
    String exists =
        "EXISTS { MATCH (" + variable + ")-[:" + label(relation(node.operand())) + "]->() }";
    return node.negated() ? exists : "NOT " + exists;
  }

  @Override
  public String visitAnd(And node, NamedParameters parameters) {
    return "("
        + node.left().accept(this, parameters)
        + " AND "
        + node.right().accept(this, parameters)
        + ")";
  }

  @Override
  public String visitOr(Or node, NamedParameters parameters) {
    return "("
        + node.left().accept(this, parameters)
        + " OR "
        + node.right().accept(this, parameters)
        + ")";
  }

  @Override
  public String visitNot(Not node, NamedParameters parameters) {
    return "NOT (" + node.operand().accept(this, parameters) + ")";
  }

  @Override
  public String visitResolvedAttribute(ResolvedAttribute node, NamedParameters parameters) {
    throw unsupported(node.qualifiedName());
  }

  @Override
  public String visitLiteral(Literal node, NamedParameters parameters) {
    throw unsupported(String.valueOf(node.value()));
  }

  @Override
  public String visitAttributeRef(AttributeRef node, NamedParameters parameters) {
    throw unsupported(node.dotted());
  }

  @Override
  public String visitRecordRef(RecordRef node, NamedParameters parameters) {
    throw unsupported(node.alias());
  }

  @Override
  public String visitAggregateCall(AggregateCall node, NamedParameters parameters) {
    throw unsupported(node.canonicalName());
  }

  private String edgeTo(Expression relation, String targetCondition) {
    return "EXISTS { MATCH ("
        + variable
        + ")-[:"
        + label(relation(relation))
        + "]->(x) WHERE x."
        + NODE_KEY
        + " "
        + targetCondition
        + " }";
  }

  private static String relation(Expression expression) {
    return ((ResolvedAttribute) expression).attribute();
  }

  private static IllegalStateException unsupported(String expression) {
    return new IllegalStateException("Cannot render " + expression + " as Cypher");
  }
}
