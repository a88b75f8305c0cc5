/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.engines.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.regex.Pattern;
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

/**
 * Renders predicates as MongoDB query filters. Nested document paths become dotted field names.
 *
 * <p>MongoDB matches missing fields with {@code $ne}, {@code $nin} and {@code $nor}. The first
 * two are paired with an explicit {@code $ne: null} so a missing value never satisfies a
 * comparison, while {@code $nor} keeps its native meaning for negation.
 */
class DocumentFilterRenderer implements ExpressionVisitor<ObjectNode, Void> {

  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  private final ObjectMapper objectMapper;

  DocumentFilterRenderer(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  ObjectNode render(Expression predicate) {
    return predicate.accept(this, null);
  }

  /** Conjunction of filters; a single filter is returned unwrapped. */
  static ObjectNode and(List<ObjectNode> filters) {
    if (filters.isEmpty()) {
      return NODES.objectNode();
    }
    if (filters.size() == 1) {
      return filters.get(0);
    }
    ObjectNode and = NODES.objectNode();
    ArrayNode operands = and.putArray("$and");
    filters.forEach(operands::add);
    return and;
  }

  @Override
  public ObjectNode visitComparison(Comparison node, Void context) {
    Comparison comparison = node.normalized();
    String field = field(comparison.left());
    JsonNode value = value(((Literal) comparison.right()).value());
    switch (comparison.operator()) {
      case EQ:
        return match(field, value);
      case NEQ:
        return and(
            List.of(
                match(field, operator("$ne", value)),
                match(field, operator("$ne", NODES.nullNode()))));
      case LT:
        return match(field, operator("$lt", value));
      case LTE:
        return match(field, operator("$lte", value));
      case GT:
        return match(field, operator("$gt", value));
      default:
        return match(field, operator("$gte", value));
    }
  }

  @Override
  public ObjectNode visitInList(InList node, Void context) {
    String field = field(node.operand());
    ArrayNode values = NODES.arrayNode();
    node.values().forEach(value -> values.add(value(value.value())));
    if (!node.negated()) {
      return match(field, operator("$in", values));
    }
    return and(
        List.of(
            match(field, operator("$nin", values)),
            match(field, operator("$ne", NODES.nullNode()))));
  }

  @Override
  public ObjectNode visitContains(Contains node, Void context) {
    String field = field(node.operand());
    Object needle = ((Literal) node.value()).value();
    if (!(needle instanceof String)) {
      return match(field, value(needle));
    }
    String text = (String) needle;
    ObjectNode or = NODES.objectNode();
    ArrayNode operands = or.putArray("$or");
    operands.add(match(field, operator("$regex", NODES.textNode(Pattern.quote(text)))));
    operands.add(match(field, NODES.textNode(text)));
    if (!text.isEmpty() && !text.contains(".") && !text.startsWith("$")) {
      operands.add(match(field + "." + text, operator("$exists", NODES.booleanNode(true))));
    }
    return or;
  }

  @Override
  public ObjectNode visitIsNull(IsNull node, Void context) {
    String field = field(node.operand());
    ObjectNode isNull = NODES.objectNode();
    ArrayNode operands = isNull.putArray("$or");
    operands.add(match(field, NODES.nullNode()));
    operands.add(match(field, operator("$size", NODES.numberNode(0))));
    return node.negated() ? nor(isNull) : isNull;
  }

  @Override
  public ObjectNode visitAnd(And node, Void context) {
    return and(List.of(node.left().accept(this, context), node.right().accept(this, context)));
  }

  @Override
  public ObjectNode visitOr(Or node, Void context) {
    ObjectNode or = NODES.objectNode();
    or.putArray("$or")
        .add(node.left().accept(this, context))
        .add(node.right().accept(this, context));
    return or;
  }

  @Override
  public ObjectNode visitNot(Not node, Void context) {
    return nor(node.operand().accept(this, context));
  }

  @Override
  public ObjectNode visitResolvedAttribute(ResolvedAttribute node, Void context) {
    throw unsupported(node.qualifiedName());
  }

  @Override
  public ObjectNode visitLiteral(Literal node, Void context) {
    throw unsupported(String.valueOf(node.value()));
  }

  @Override
  public ObjectNode visitAttributeRef(AttributeRef node, Void context) {
    throw unsupported(node.dotted());
  }

  @Override
  public ObjectNode visitRecordRef(RecordRef node, Void context) {
    throw unsupported(node.alias());
  }

  @Override
  public ObjectNode visitAggregateCall(AggregateCall node, Void context) {
    throw unsupported(node.canonicalName());
  }

  /** Extended JSON for temporal values, plain JSON for everything else. */
  JsonNode value(Object value) {
    if (value instanceof Instant) {
      return NODES.objectNode().put("$date", value.toString());
    }
    if (value instanceof LocalDate) {
      return NODES.textNode(value.toString());
    }
    return objectMapper.valueToTree(value);
  }

  private static String field(Expression expression) {
    return ((ResolvedAttribute) expression).column();
  }

  private static ObjectNode match(String field, JsonNode condition) {
    ObjectNode match = NODES.objectNode();
    match.set(field, condition);
    return match;
  }

  private static ObjectNode operator(String operator, JsonNode value) {
    ObjectNode node = NODES.objectNode();
    node.set(operator, value);
    return node;
  }

  private static ObjectNode nor(ObjectNode filter) {
    ObjectNode nor = NODES.objectNode();
    nor.putArray("$nor").add(filter);
    return nor;
  }

  private static IllegalStateException unsupported(String expression) {
    return new IllegalStateException("Cannot render " + expression + " as a document filter");
  }
}
