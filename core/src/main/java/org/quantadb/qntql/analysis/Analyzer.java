/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.analysis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.quantadb.qntql.analysis.model.AnalyzedAdd;
import org.quantadb.qntql.analysis.model.AnalyzedAlterRecord;
import org.quantadb.qntql.analysis.model.AnalyzedCreateRecord;
import org.quantadb.qntql.analysis.model.AnalyzedCreateRelation;
import org.quantadb.qntql.analysis.model.AnalyzedExplain;
import org.quantadb.qntql.analysis.model.AnalyzedHop;
import org.quantadb.qntql.analysis.model.AnalyzedQuery;
import org.quantadb.qntql.analysis.model.AnalyzedRemove;
import org.quantadb.qntql.analysis.model.AnalyzedStatement;
import org.quantadb.qntql.analysis.model.AnalyzedTransaction;
import org.quantadb.qntql.analysis.model.AnalyzedUpdate;
import org.quantadb.qntql.analysis.model.OutputColumn;
import org.quantadb.qntql.analysis.model.RecordScope;
import org.quantadb.qntql.analysis.model.SortKey;
import org.quantadb.qntql.ast.expression.AggregateCall;
import org.quantadb.qntql.ast.expression.AttributeRef;
import org.quantadb.qntql.ast.expression.Expression;
import org.quantadb.qntql.ast.expression.Expressions;
import org.quantadb.qntql.ast.expression.ResolvedAttribute;
import org.quantadb.qntql.ast.statement.AddStatement;
import org.quantadb.qntql.ast.statement.AlterRecordStatement;
import org.quantadb.qntql.ast.statement.Assignment;
import org.quantadb.qntql.ast.statement.AttributeSpec;
import org.quantadb.qntql.ast.statement.CreateRecordStatement;
import org.quantadb.qntql.ast.statement.CreateRelationStatement;
import org.quantadb.qntql.ast.statement.ExplainStatement;
import org.quantadb.qntql.ast.statement.FindStatement;
import org.quantadb.qntql.ast.statement.NavigateStatement;
import org.quantadb.qntql.ast.statement.NavigationHop;
import org.quantadb.qntql.ast.statement.OrderItem;
import org.quantadb.qntql.ast.statement.Projection;
import org.quantadb.qntql.ast.statement.RemoveStatement;
import org.quantadb.qntql.ast.statement.Statement;
import org.quantadb.qntql.ast.statement.StatementVisitor;
import org.quantadb.qntql.ast.statement.TransactionStatement;
import org.quantadb.qntql.ast.statement.UpdateStatement;
import org.quantadb.qntql.catalog.SchemaRegistry;
import org.quantadb.qntql.catalog.model.AttributeDefinition;
import org.quantadb.qntql.catalog.model.Bucket;
import org.quantadb.qntql.catalog.model.RecordSchema;
import org.quantadb.qntql.common.utils.StringUtils;
import org.quantadb.qntql.exception.SchemaException;
import org.quantadb.qntql.storage.StorageClassification;

/**
 * Analyzes a parsed statement against the {@link SchemaRegistry}: builds the record scope,
 * resolves every attribute reference to its definition, type-checks literals and aggregates, and
 * resolves navigation hops along declared relation attributes.
 *
 * <p>The classification on each {@link ResolvedAttribute} is the only routing decision made in
 * the pipeline; later stages read it and never consult the schema for routing.
 */
@RequiredArgsConstructor
public class Analyzer implements StatementVisitor<AnalyzedStatement, AnalysisContext> {

  private final SchemaRegistry schemaRegistry;

  private final TypeChecker typeChecker = new TypeChecker();

  /**
   * Analyzes a statement for the given bucket.
   *
   * @throws SchemaException on unknown names
   * @throws org.quantadb.qntql.exception.TypeMismatchException on type errors
   */
  public AnalyzedStatement analyze(Statement statement, String bucket) {
    return analyze(statement, bucket, false);
  }

  /**
   * Analyzes a statement that may join a client-held transaction.
   *
   * @param inTransaction whether the statement runs inside an open transaction
   */
  public AnalyzedStatement analyze(Statement statement, String bucket, boolean inTransaction) {
    return statement.accept(
        this, new AnalysisContext(schemaRegistry.getBucket(bucket), inTransaction));
  }

  @Override
  public AnalyzedStatement visitFind(FindStatement node, AnalysisContext context) {
    Bucket bucket = context.bucket();
    Map<String, RecordSchema> records = new LinkedHashMap<>();
    String primary = primaryRecord(node, bucket);
    records.put(primary, record(bucket, primary));
    List<AnalyzedHop> hops = navigation(node.navigation(), records, bucket);
    RecordScope scope = new RecordScope(records);

    ExpressionAnalyzer attributes = new ExpressionAnalyzer(bucket, typeChecker, false);
    ExpressionAnalyzer aggregates = new ExpressionAnalyzer(bucket, typeChecker, true);

    List<OutputColumn> outputs = new ArrayList<>();
    for (Projection projection : node.projections()) {
      Expression expression = projection.expression();
      if (expression instanceof AggregateCall) {
        AggregateCall call = (AggregateCall) aggregates.analyze(expression, scope);
        outputs.add(
            new OutputColumn(
                null,
                projection.alias() == null ? call.canonicalName() : projection.alias(),
                call));
        continue;
      }
      Expression resolved = attributes.visitAttributeRef((AttributeRef) expression, scope);
      if (projection.allAttributes() || !(resolved instanceof ResolvedAttribute)) {
        String alias =
            resolved instanceof ResolvedAttribute
                ? aliasOf((AttributeRef) expression, scope)
                : ((AttributeRef) expression).parts().get(0);
        outputs.addAll(allAttributes(alias, scope.get(alias)));
      } else {
        ResolvedAttribute attribute = (ResolvedAttribute) resolved;
        outputs.add(
            projection.alias() == null
                ? new OutputColumn(attribute.alias(), attribute.column(), attribute)
                : new OutputColumn(null, projection.alias(), attribute));
      }
    }

    Expression filter = attributes.analyze(node.match(), scope);
    List<ResolvedAttribute> groupBy = new ArrayList<>();
    for (AttributeRef reference : node.groupBy()) {
      groupBy.add(attributes.resolve(reference, scope));
    }
    Expression having = aggregates.analyze(node.having(), scope);
    List<SortKey> sort = sortKeys(node.orderBy(), outputs, scope, aggregates);

    List<AggregateCall> calls = new ArrayList<>();
    outputs.forEach(output -> collectAggregates(output.expression(), calls));
    collectAggregates(having, calls);
    sort.forEach(key -> collectAggregates(key.expression(), calls));

    if (!groupBy.isEmpty() || !calls.isEmpty()) {
      checkGrouped(outputs, groupBy, having, sort);
    } else if (having != null) {
      throw new SchemaException("HAVING needs GROUP BY or an aggregate projection");
    }
    return new AnalyzedQuery(
        bucket.getName(),
        scope,
        outputs,
        hops,
        filter,
        groupBy,
        calls,
        having,
        sort,
        node.limit(),
        node.offset());
  }

  @Override
  public AnalyzedStatement visitNavigate(NavigateStatement node, AnalysisContext context) {
    Bucket bucket = context.bucket();
    String primary = node.hops().get(0).source();
    Map<String, RecordSchema> records = new LinkedHashMap<>();
    records.put(primary, record(bucket, primary));
    List<AnalyzedHop> hops = navigation(node.hops(), records, bucket);
    RecordScope scope = new RecordScope(records);
    AnalyzedHop last = hops.get(hops.size() - 1);
    ExpressionAnalyzer attributes = new ExpressionAnalyzer(bucket, typeChecker, false);
    Expression filter = attributes.analyze(node.match(), scope);
    List<SortKey> sort = new ArrayList<>();
    for (OrderItem item : node.orderBy()) {
      ResolvedAttribute key = attributes.resolve((AttributeRef) item.expression(), scope);
      sort.add(new SortKey(key, item.ascending()));
    }
    return new AnalyzedQuery(
        bucket.getName(),
        scope,
        allAttributes(last.targetAlias(), last.target()),
        hops,
        filter,
        List.of(),
        List.of(),
        null,
        sort,
        node.limit(),
        node.offset());
  }

  @Override
  public AnalyzedStatement visitAdd(AddStatement node, AnalysisContext context) {
    RecordSchema schema = record(context.bucket(), node.record());
    Map<String, Object> values = new LinkedHashMap<>();
    node.values()
        .forEach(
            (attribute, value) ->
                values.put(attribute, coerce(schema, attribute, value)));
    String key = schema.getKeyAttribute();
    if (values.get(key) == null) {
      throw new SchemaException(
          StringUtils.format("ADD %s needs a value for key attribute %s", schema.getName(), key),
          schema.getName(),
          key);
    }
    return new AnalyzedAdd(context.bucket().getName(), schema, values);
  }

  @Override
  public AnalyzedStatement visitUpdate(UpdateStatement node, AnalysisContext context) {
    RecordSchema schema = record(context.bucket(), node.record());
    Map<String, Object> values = new LinkedHashMap<>();
    for (Assignment assignment : node.assignments()) {
      if (assignment.attribute().equals(schema.getKeyAttribute())) {
        throw new SchemaException(
            StringUtils.format(
                "Key attribute %s of %s cannot be updated",
                assignment.attribute(),
                schema.getName()),
            schema.getName(),
            assignment.attribute());
      }
      values.put(
          assignment.attribute(), coerce(schema, assignment.attribute(), assignment.value()));
    }
    return new AnalyzedUpdate(
        context.bucket().getName(), schema, values, condition(context, schema, node.match()));
  }

  @Override
  public AnalyzedStatement visitRemove(RemoveStatement node, AnalysisContext context) {
    RecordSchema schema = record(context.bucket(), node.record());
    return new AnalyzedRemove(
        context.bucket().getName(), schema, condition(context, schema, node.match()));
  }

  @Override
  public AnalyzedStatement visitCreateRecord(CreateRecordStatement node, AnalysisContext context) {
    requireOutsideTransaction(context, "CREATE RECORD");
    Bucket bucket = context.bucket();
    if (bucket.getRecord(node.record()).isPresent()) {
      throw new SchemaException(
          StringUtils.format(
              "Record %s already exists in bucket %s", node.record(), bucket.getName()),
          node.record(),
          null);
    }
    RecordSchema.Builder builder = RecordSchema.builder(node.record());
    for (AttributeSpec spec : node.attributes()) {
      builder.attribute(spec.name(), definition(bucket, node.record(), spec));
    }
    return new AnalyzedCreateRecord(bucket.getName(), builder.build());
  }

  @Override
  public AnalyzedStatement visitAlterRecord(AlterRecordStatement node, AnalysisContext context) {
    requireOutsideTransaction(context, "ALTER RECORD");
    Bucket bucket = context.bucket();
    RecordSchema schema = record(bucket, node.record());
    Map<String, AttributeDefinition> additions = new LinkedHashMap<>();
    for (AttributeSpec spec : node.attributes()) {
      additions.put(spec.name(), definition(bucket, node.record(), spec));
    }
    // duplicate check against the declared attributes
    schema.withAttributes(additions);
    return new AnalyzedAlterRecord(bucket.getName(), node.record(), additions);
  }

  @Override
  public AnalyzedStatement visitCreateRelation(
      CreateRelationStatement node, AnalysisContext context) {
    RecordSchema schema = record(context.bucket(), node.record());
    AttributeDefinition definition = attribute(schema, node.attribute());
    if (definition.type() != StorageClassification.RELATION) {
      throw new SchemaException(
          StringUtils.format(
              "%s.%s is not a relation attribute", schema.getName(), node.attribute()),
          schema.getName(),
          node.attribute());
    }
    String name = schema.getName() + "." + node.attribute();
    Object from = single(typeChecker.coerceValue(name, definition, node.from()));
    Object to = single(typeChecker.coerceValue(name, definition, node.to()));
    if (from == null || to == null) {
      throw new SchemaException(
          "CREATE RELATION needs both keys", schema.getName(), node.attribute());
    }
    return new AnalyzedCreateRelation(
        context.bucket().getName(), schema, node.attribute(), from, to, node.properties());
  }

  @Override
  public AnalyzedStatement visitTransaction(TransactionStatement node, AnalysisContext context) {
    requireOutsideTransaction(context, "BEGIN");
    List<AnalyzedStatement> statements = new ArrayList<>();
    for (Statement statement : node.statements()) {
      statements.add(statement.accept(this, context.nested()));
    }
    return new AnalyzedTransaction(statements, node.commit());
  }

  @Override
  public AnalyzedStatement visitExplain(ExplainStatement node, AnalysisContext context) {
    requireOutsideTransaction(context, "EXPLAIN");
    return new AnalyzedExplain((AnalyzedQuery) node.query().accept(this, context));
  }

  private String primaryRecord(FindStatement node, Bucket bucket) {
    if (node.from() != null) {
      return node.from();
    }
    if (!node.navigation().isEmpty()) {
      return node.navigation().get(0).source();
    }
    for (Projection projection : node.projections()) {
      Expression expression = projection.expression();
      if (expression instanceof AggregateCall) {
        expression = ((AggregateCall) expression).argument();
      }
      if (expression instanceof AttributeRef) {
        String first = ((AttributeRef) expression).parts().get(0);
        if (bucket.getRecord(first).isPresent()) {
          return first;
        }
      }
    }
    throw new SchemaException("Cannot tell which record to query; qualify attributes or use FROM");
  }

  private List<AnalyzedHop> navigation(
      List<NavigationHop> navigation, Map<String, RecordSchema> records, Bucket bucket) {
    List<AnalyzedHop> hops = new ArrayList<>();
    for (NavigationHop hop : navigation) {
      RecordSchema source = records.get(hop.source());
      if (source == null) {
        throw new SchemaException(
            StringUtils.format(
                "Navigation at %s starts from %s, which is not in the query",
                hop.position(), hop.source()),
            hop.source(),
            null);
      }
      AttributeDefinition relation = attribute(source, hop.relation());
      if (relation.type() != StorageClassification.RELATION) {
        throw new SchemaException(
            StringUtils.format(
                "Cannot navigate %s.%s: it is a %s attribute",
                source.getName(), hop.relation(), relation.type().getEngineName()),
            source.getName(),
            hop.relation());
      }
      if (!relation.target().equals(hop.target())) {
        throw new SchemaException(
            StringUtils.format(
                "%s.%s points to %s, not %s",
                source.getName(), hop.relation(), relation.target(), hop.target()),
            source.getName(),
            hop.relation());
      }
      String alias = hop.targetAlias();
      if (records.containsKey(alias)) {
        throw new SchemaException(
            StringUtils.format(
                "Alias %s is already used in the query; name the target with AS", alias),
            hop.target(),
            null);
      }
      RecordSchema target = record(bucket, hop.target());
      records.put(alias, target);
      hops.add(
          new AnalyzedHop(
              hop.source(),
              new ResolvedAttribute(
                  hop.source(), source.getName(), hop.relation(), List.of(), relation),
              alias,
              target));
    }
    return hops;
  }

  private List<SortKey> sortKeys(
      List<OrderItem> items,
      List<OutputColumn> outputs,
      RecordScope scope,
      ExpressionAnalyzer analyzer) {
    List<SortKey> keys = new ArrayList<>();
    for (OrderItem item : items) {
      Expression expression = item.expression();
      if (expression instanceof AttributeRef && ((AttributeRef) expression).parts().size() == 1) {
        String name = ((AttributeRef) expression).parts().get(0);
        Optional<OutputColumn> named =
            outputs.stream()
                .filter(output -> output.group() == null && output.name().equals(name))
                .findFirst();
        if (named.isPresent()) {
          keys.add(new SortKey(named.get().expression(), item.ascending()));
          continue;
        }
      }
      Expression resolved =
          expression instanceof AttributeRef
              ? analyzer.resolve((AttributeRef) expression, scope)
              : analyzer.analyze(expression, scope);
      keys.add(new SortKey(resolved, item.ascending()));
    }
    return keys;
  }

  private static void checkGrouped(
      List<OutputColumn> outputs,
      List<ResolvedAttribute> groupBy,
      Expression having,
      List<SortKey> sort) {
    List<Expression> plain = new ArrayList<>();
    outputs.stream()
        .map(OutputColumn::expression)
        .filter(ResolvedAttribute.class::isInstance)
        .forEach(plain::add);
    sort.stream()
        .map(SortKey::expression)
        .filter(ResolvedAttribute.class::isInstance)
        .forEach(plain::add);
    List<ResolvedAttribute> inHaving = new ArrayList<>(Expressions.attributes(having));
    Expressions.aggregates(having)
        .forEach(call -> inHaving.removeAll(Expressions.attributes(call)));
    plain.addAll(inHaving);
    for (Expression expression : plain) {
      ResolvedAttribute attribute = (ResolvedAttribute) expression;
      boolean grouped =
          groupBy.stream()
              .anyMatch(key -> key.qualifiedName().equals(attribute.qualifiedName()));
      if (!grouped) {
        throw new SchemaException(
            StringUtils.format(
                "%s must appear in GROUP BY or inside an aggregate", attribute.qualifiedName()),
            attribute.record(),
            attribute.attribute());
      }
    }
  }

  private static void collectAggregates(Expression expression, List<AggregateCall> calls) {
    for (AggregateCall call : Expressions.aggregates(expression)) {
      if (calls.stream().noneMatch(known -> known.canonicalName().equals(call.canonicalName()))) {
        calls.add(call);
      }
    }
  }

  private static List<OutputColumn> allAttributes(String alias, RecordSchema schema) {
    List<OutputColumn> outputs = new ArrayList<>();
    schema
        .getAttributes()
        .forEach(
            (name, definition) ->
                outputs.add(
                    new OutputColumn(
                        alias,
                        name,
                        new ResolvedAttribute(
                            alias, schema.getName(), name, List.of(), definition))));
    return outputs;
  }

  private static String aliasOf(AttributeRef reference, RecordScope scope) {
    String first = reference.parts().get(0);
    return scope.contains(first) ? first : scope.getPrimaryAlias();
  }

  private Expression condition(AnalysisContext context, RecordSchema schema, Expression match) {
    RecordScope scope = new RecordScope(Map.of(schema.getName(), schema));
    return new ExpressionAnalyzer(context.bucket(), typeChecker, false).analyze(match, scope);
  }

  private Object coerce(RecordSchema schema, String attribute, Object value) {
    return typeChecker.coerceValue(
        schema.getName() + "." + attribute, attribute(schema, attribute), value);
  }

  private AttributeDefinition definition(Bucket bucket, String record, AttributeSpec spec) {
    AttributeDefinition definition = spec.toDefinition();
    if (definition.type() == StorageClassification.SCALAR && definition.datatype() != null) {
      definition.scalarType();
    }
    if (definition.type() == StorageClassification.RELATION) {
      if (definition.target() == null) {
        throw new SchemaException(
            StringUtils.format(
                "Relation attribute %s.%s needs a target: RELATION<record>", record, spec.name()),
            record,
            spec.name());
      }
      if (!definition.target().equals(record) && bucket.getRecord(definition.target()).isEmpty()) {
        throw new SchemaException(
            StringUtils.format(
                "Relation attribute %s.%s targets unknown record %s",
                record, spec.name(), definition.target()),
            record,
            spec.name());
      }
    }
    return definition;
  }

  private static RecordSchema record(Bucket bucket, String record) {
    return bucket
        .getRecord(record)
        .orElseThrow(
            () ->
                new SchemaException(
                    StringUtils.format(
                        "Record %s does not exist in bucket %s", record, bucket.getName()),
                    record,
                    null));
  }

  private static AttributeDefinition attribute(RecordSchema schema, String attribute) {
    return schema
        .getAttribute(attribute)
        .orElseThrow(
            () ->
                new SchemaException(
                    StringUtils.format(
                        "Unknown attribute %s of record %s", attribute, schema.getName()),
                    schema.getName(),
                    attribute));
  }

  private static Object single(Object keys) {
    return keys instanceof List && ((List<?>) keys).size() == 1 ? ((List<?>) keys).get(0) : null;
  }

  private static void requireOutsideTransaction(AnalysisContext context, String statement) {
    if (context.inTransaction()) {
      throw new SchemaException(statement + " is not allowed inside a transaction");
    }
  }
}
