/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.parser;

import static org.quantadb.qntql.parser.TokenKind.AND;
import static org.quantadb.qntql.parser.TokenKind.ARROW;
import static org.quantadb.qntql.parser.TokenKind.AS;
import static org.quantadb.qntql.parser.TokenKind.ASC;
import static org.quantadb.qntql.parser.TokenKind.BEGIN;
import static org.quantadb.qntql.parser.TokenKind.BY;
import static org.quantadb.qntql.parser.TokenKind.COLON;
import static org.quantadb.qntql.parser.TokenKind.COMMA;
import static org.quantadb.qntql.parser.TokenKind.COMMIT;
import static org.quantadb.qntql.parser.TokenKind.CONTAINS;
import static org.quantadb.qntql.parser.TokenKind.DESC;
import static org.quantadb.qntql.parser.TokenKind.DOT;
import static org.quantadb.qntql.parser.TokenKind.EOF;
import static org.quantadb.qntql.parser.TokenKind.EQ;
import static org.quantadb.qntql.parser.TokenKind.FROM;
import static org.quantadb.qntql.parser.TokenKind.GROUP;
import static org.quantadb.qntql.parser.TokenKind.GT;
import static org.quantadb.qntql.parser.TokenKind.HAVING;
import static org.quantadb.qntql.parser.TokenKind.IN;
import static org.quantadb.qntql.parser.TokenKind.INDEXED;
import static org.quantadb.qntql.parser.TokenKind.IS;
import static org.quantadb.qntql.parser.TokenKind.LBRACE;
import static org.quantadb.qntql.parser.TokenKind.LBRACKET;
import static org.quantadb.qntql.parser.TokenKind.LIMIT;
import static org.quantadb.qntql.parser.TokenKind.LPAREN;
import static org.quantadb.qntql.parser.TokenKind.LT;
import static org.quantadb.qntql.parser.TokenKind.MATCH;
import static org.quantadb.qntql.parser.TokenKind.NAVIGATE;
import static org.quantadb.qntql.parser.TokenKind.NOT;
import static org.quantadb.qntql.parser.TokenKind.NULL;
import static org.quantadb.qntql.parser.TokenKind.OFFSET;
import static org.quantadb.qntql.parser.TokenKind.OR;
import static org.quantadb.qntql.parser.TokenKind.ORDER;
import static org.quantadb.qntql.parser.TokenKind.PROPERTIES;
import static org.quantadb.qntql.parser.TokenKind.RBRACE;
import static org.quantadb.qntql.parser.TokenKind.RBRACKET;
import static org.quantadb.qntql.parser.TokenKind.RECORD;
import static org.quantadb.qntql.parser.TokenKind.RELATION;
import static org.quantadb.qntql.parser.TokenKind.ROLLBACK;
import static org.quantadb.qntql.parser.TokenKind.RPAREN;
import static org.quantadb.qntql.parser.TokenKind.SEMICOLON;
import static org.quantadb.qntql.parser.TokenKind.SET;
import static org.quantadb.qntql.parser.TokenKind.STAR;
import static org.quantadb.qntql.parser.TokenKind.TO;
import static org.quantadb.qntql.parser.TokenKind.TRANSACTION;

import com.google.common.collect.ImmutableSet;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.quantadb.qntql.ast.expression.AggregateCall;
import org.quantadb.qntql.ast.expression.And;
import org.quantadb.qntql.ast.expression.AttributeRef;
import org.quantadb.qntql.ast.expression.Comparison.Operator;
import org.quantadb.qntql.ast.expression.Comparison;
import org.quantadb.qntql.ast.expression.Contains;
import org.quantadb.qntql.ast.expression.Expression;
import org.quantadb.qntql.ast.expression.InList;
import org.quantadb.qntql.ast.expression.IsNull;
import org.quantadb.qntql.ast.expression.Literal;
import org.quantadb.qntql.ast.expression.Not;
import org.quantadb.qntql.ast.expression.Or;
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
import org.quantadb.qntql.ast.statement.TransactionStatement;
import org.quantadb.qntql.ast.statement.UpdateStatement;
import org.quantadb.qntql.exception.SyntaxCheckException;
import org.quantadb.qntql.storage.StorageClassification;

/**
 * Recursive descent parser for one QntQL statement. Operator precedence, lowest first: {@code OR},
 * {@code AND}, {@code NOT}, comparison. Keywords are case-insensitive; {@code &&}, {@code ||} and
 * {@code !} are accepted for {@code AND}, {@code OR} and {@code NOT}.
 */
public class Parser {

  private static final Set<TokenKind> COMPARISON_OPERATORS =
      EnumSet.of(EQ, TokenKind.NEQ, LT, TokenKind.LTE, GT, TokenKind.GTE);

  private final List<Token> tokens;

  private int current;

  public Parser(List<Token> tokens) {
    this.tokens = tokens;
  }

  /** Parses exactly one statement, optionally followed by a semicolon. */
  public Statement parse() {
    current = 0;
    Statement statement = statement();
    accept(SEMICOLON);
    expect(EOF);
    return statement;
  }

  private Statement statement() {
    Token token = peek();
    switch (token.kind()) {
      case EXPLAIN:
        advance();
        if (!check(TokenKind.FIND) && !check(NAVIGATE)) {
          throw unexpected(ImmutableSet.of("FIND", "NAVIGATE"));
        }
        return new ExplainStatement(statement());
      case FIND:
        return find();
      case NAVIGATE:
        return navigate();
      case ADD:
        return add();
      case UPDATE:
        return update();
      case REMOVE:
        return remove();
      case CREATE:
        return create();
      case ALTER:
        return alter();
      case BEGIN:
        return transaction();
      default:
        throw unexpected(
            ImmutableSet.of(
                "FIND", "NAVIGATE", "ADD", "UPDATE", "REMOVE", "CREATE", "ALTER", "BEGIN",
                "EXPLAIN"));
    }
  }

  private FindStatement find() {
    expect(TokenKind.FIND);
    List<Projection> projections = new ArrayList<>();
    do {
      projections.add(projection());
    } while (accept(COMMA));
    String from = accept(FROM) ? name() : null;
    List<NavigationHop> hops = accept(NAVIGATE) ? hops() : List.of();
    Expression match = accept(MATCH) ? expression() : null;
    List<AttributeRef> groupBy = new ArrayList<>();
    if (accept(GROUP)) {
      expect(BY);
      do {
        groupBy.add(reference());
      } while (accept(COMMA));
    }
    Expression having = accept(HAVING) ? expression() : null;
    List<OrderItem> orderBy = orderBy();
    Integer limit = accept(LIMIT) ? count() : null;
    Integer offset = accept(OFFSET) ? count() : null;
    return new FindStatement(
        projections, from, hops, match, groupBy, having, orderBy, limit, offset);
  }

  private NavigateStatement navigate() {
    expect(NAVIGATE);
    List<NavigationHop> hops = hops();
    Expression match = accept(MATCH) ? expression() : null;
    List<OrderItem> orderBy = orderBy();
    Integer limit = accept(LIMIT) ? count() : null;
    Integer offset = accept(OFFSET) ? count() : null;
    return new NavigateStatement(hops, match, orderBy, limit, offset);
  }

  private List<NavigationHop> hops() {
    List<NavigationHop> hops = new ArrayList<>();
    do {
      Position position = peek().position();
      String source = name();
      expect(ARROW);
      String relation = name();
      expect(COLON);
      String target = name();
      String alias = accept(AS) ? name() : null;
      hops.add(new NavigationHop(source, relation, target, alias, position));
    } while (accept(COMMA));
    return hops;
  }

  private Projection projection() {
    if (isAggregateAhead()) {
      AggregateCall aggregate = aggregate();
      return new Projection(aggregate, false, accept(AS) ? name() : null);
    }
    Position position = peek().position();
    List<String> parts = new ArrayList<>();
    parts.add(name());
    boolean all = false;
    while (check(DOT)) {
      advance();
      if (accept(STAR)) {
        all = true;
        break;
      }
      parts.add(memberName());
    }
    AttributeRef reference = new AttributeRef(parts, position);
    String alias = !all && accept(AS) ? name() : null;
    return new Projection(reference, all, alias);
  }

  private List<OrderItem> orderBy() {
    List<OrderItem> items = new ArrayList<>();
    if (accept(ORDER)) {
      expect(BY);
      do {
        Expression key = isAggregateAhead() ? aggregate() : reference();
        boolean ascending = true;
        if (accept(DESC)) {
          ascending = false;
        } else {
          accept(ASC);
        }
        items.add(new OrderItem(key, ascending));
      } while (accept(COMMA));
    }
    return items;
  }

  private AddStatement add() {
    expect(TokenKind.ADD);
    String record = name();
    Position position = peek().position();
    return new AddStatement(record, object(), position);
  }

  private UpdateStatement update() {
    expect(TokenKind.UPDATE);
    String record = name();
    expect(SET);
    List<Assignment> assignments = new ArrayList<>();
    do {
      Position position = peek().position();
      String attribute = name();
      expect(EQ);
      assignments.add(new Assignment(attribute, value(), position));
    } while (accept(COMMA));
    Expression match = accept(MATCH) ? expression() : null;
    return new UpdateStatement(record, assignments, match);
  }

  private RemoveStatement remove() {
    expect(TokenKind.REMOVE);
    String record = name();
    Expression match = accept(MATCH) ? expression() : null;
    return new RemoveStatement(record, match);
  }

  private Statement create() {
    expect(TokenKind.CREATE);
    if (accept(RECORD)) {
      String record = name();
      expect(LPAREN);
      List<AttributeSpec> specs = new ArrayList<>();
      do {
        specs.add(attributeSpec());
      } while (accept(COMMA));
      expect(RPAREN);
      return new CreateRecordStatement(record, specs);
    }
    if (accept(RELATION)) {
      Position position = peek().position();
      String record = name();
      expect(DOT);
      String attribute = memberName();
      expect(FROM);
      Object from = value();
      expect(TO);
      Object to = value();
      Map<String, Object> properties = accept(PROPERTIES) ? object() : Map.of();
      return new CreateRelationStatement(record, attribute, from, to, properties, position);
    }
    throw unexpected(ImmutableSet.of("RECORD", "RELATION"));
  }

  private AlterRecordStatement alter() {
    expect(TokenKind.ALTER);
    expect(RECORD);
    String record = name();
    expect(TokenKind.ADD);
    List<AttributeSpec> specs = new ArrayList<>();
    do {
      specs.add(attributeSpec());
    } while (accept(COMMA));
    return new AlterRecordStatement(record, specs);
  }

  private AttributeSpec attributeSpec() {
    Position position = peek().position();
    String name = name();
    expect(COLON);
    Token classToken = peek();
    if (classToken.kind().getCategory() != TokenKind.Category.CLASSIFICATION) {
      throw unexpected(ImmutableSet.of("SCALAR", "DOCUMENT", "RELATION", "METRIC"));
    }
    advance();
    StorageClassification classification = StorageClassification.fromName(classToken.lexeme());
    String hint = null;
    if (accept(LT)) {
      hint = memberName();
      expect(GT);
    }
    boolean indexed = accept(INDEXED);
    return new AttributeSpec(name, classification, hint, indexed, position);
  }

  private TransactionStatement transaction() {
    expect(BEGIN);
    accept(TRANSACTION);
    accept(SEMICOLON);
    List<Statement> statements = new ArrayList<>();
    while (!check(COMMIT) && !check(ROLLBACK)) {
      if (check(BEGIN)) {
        throw new SyntaxCheckException(peek().position(), "Transactions cannot be nested");
      }
      if (check(EOF)) {
        throw unexpected(ImmutableSet.of("COMMIT", "ROLLBACK"));
      }
      statements.add(statement());
      if (!accept(SEMICOLON) && !check(COMMIT) && !check(ROLLBACK)) {
        throw unexpected(ImmutableSet.of(";", "COMMIT", "ROLLBACK"));
      }
    }
    boolean commit = advance().is(COMMIT);
    accept(TRANSACTION);
    return new TransactionStatement(statements, commit);
  }

  private Expression expression() {
    Expression left = conjunction();
    while (accept(OR)) {
      left = new Or(left, conjunction());
    }
    return left;
  }

  private Expression conjunction() {
    Expression left = negation();
    while (accept(AND)) {
      left = new And(left, negation());
    }
    return left;
  }

  private Expression negation() {
    if (accept(NOT)) {
      return new Not(negation());
    }
    return comparison();
  }

  private Expression comparison() {
    if (accept(LPAREN)) {
      Expression inner = expression();
      expect(RPAREN);
      return inner;
    }
    Expression left = operand();
    Token token = peek();
    if (COMPARISON_OPERATORS.contains(token.kind())) {
      advance();
      return new Comparison(left, operator(token.kind()), operand());
    }
    if (check(NOT) && peekAt(1).is(IN)) {
      advance();
      advance();
      return new InList(left, literalList(), true);
    }
    if (accept(IN)) {
      return new InList(left, literalList(), false);
    }
    if (accept(CONTAINS)) {
      return new Contains(left, operand());
    }
    if (accept(IS)) {
      boolean negated = accept(NOT);
      expect(NULL);
      return new IsNull(left, negated);
    }
    if (left instanceof AttributeRef) {
      return new Comparison(left, Operator.EQ, Literal.of(Boolean.TRUE));
    }
    throw unexpected(ImmutableSet.of("=", "!=", "<", "<=", ">", ">=", "IN", "CONTAINS", "IS"));
  }

  private Expression operand() {
    if (isAggregateAhead()) {
      return aggregate();
    }
    Token token = peek();
    if (token.is(TokenKind.IDENTIFIER)
        || token.kind().getCategory() == TokenKind.Category.CLASSIFICATION) {
      return reference();
    }
    return Literal.of(value());
  }

  private List<Literal> literalList() {
    expect(LPAREN);
    List<Literal> values = new ArrayList<>();
    do {
      values.add(Literal.of(value()));
    } while (accept(COMMA));
    expect(RPAREN);
    return values;
  }

  private AggregateCall aggregate() {
    Token function = advance();
    expect(LPAREN);
    Expression argument = accept(STAR) ? null : reference();
    expect(RPAREN);
    return new AggregateCall(
        AggregateCall.Function.of(function.lexeme(), function.position()),
        argument,
        function.position());
  }

  private AttributeRef reference() {
    Position position = peek().position();
    List<String> parts = new ArrayList<>();
    parts.add(name());
    while (accept(DOT)) {
      parts.add(memberName());
    }
    return new AttributeRef(parts, position);
  }

  /** Literal value: scalar, date-time, object or array. */
  private Object value() {
    Token token = peek();
    switch (token.kind()) {
      case STRING:
        advance();
        return token.lexeme();
      case INTEGER:
        advance();
        try {
          return Long.parseLong(token.lexeme());
        } catch (NumberFormatException e) {
          return new BigDecimal(token.lexeme());
        }
      case DECIMAL:
        advance();
        return new BigDecimal(token.lexeme());
      case TRUE:
        advance();
        return Boolean.TRUE;
      case FALSE:
        advance();
        return Boolean.FALSE;
      case NULL:
        advance();
        return null;
      case DATETIME:
        advance();
        return dateTime(token);
      case LBRACE:
        return object();
      case LBRACKET:
        return array();
      default:
        throw unexpected(ImmutableSet.of("literal value"));
    }
  }

  private Map<String, Object> object() {
    expect(LBRACE);
    Map<String, Object> object = new LinkedHashMap<>();
    if (!check(RBRACE)) {
      do {
        Token keyToken = peek();
        String key = keyToken.is(TokenKind.STRING) ? advance().lexeme() : memberName();
        if (object.containsKey(key)) {
          throw new SyntaxCheckException(keyToken.position(), "Duplicate key " + key);
        }
        expect(COLON);
        object.put(key, value());
      } while (accept(COMMA));
    }
    expect(RBRACE);
    return Collections.unmodifiableMap(object);
  }

  private List<Object> array() {
    expect(LBRACKET);
    List<Object> values = new ArrayList<>();
    if (!check(RBRACKET)) {
      do {
        values.add(value());
      } while (accept(COMMA));
    }
    expect(RBRACKET);
    return Collections.unmodifiableList(values);
  }

  private static Object dateTime(Token token) {
    String text = token.lexeme();
    try {
      if (text.length() == 10) {
        return LocalDate.parse(text);
      }
      if (text.endsWith("Z") || text.lastIndexOf('+') > 10 || text.lastIndexOf('-') > 10) {
        return OffsetDateTime.parse(text).toInstant();
      }
      return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException e) {
      throw new SyntaxCheckException(token.position(), "Invalid date-time literal " + text);
    }
  }

  private Integer count() {
    Token token = expect(TokenKind.INTEGER);
    int value;
    try {
      value = Integer.parseInt(token.lexeme());
    } catch (NumberFormatException e) {
      throw new SyntaxCheckException(token.position(), "Count out of range: " + token.lexeme());
    }
    if (value < 0) {
      throw new SyntaxCheckException(token.position(), "Count must not be negative");
    }
    return value;
  }

  private static Operator operator(TokenKind kind) {
    switch (kind) {
      case EQ:
        return Operator.EQ;
      case NEQ:
        return Operator.NEQ;
      case LT:
        return Operator.LT;
      case LTE:
        return Operator.LTE;
      case GT:
        return Operator.GT;
      default:
        return Operator.GTE;
    }
  }

  private boolean isAggregateAhead() {
    return peek().is(TokenKind.IDENTIFIER)
        && AggregateCall.Function.isAggregate(peek().lexeme())
        && peekAt(1).is(LPAREN);
  }

  /** Record, attribute or alias name. Classification words are allowed as names. */
  private String name() {
    Token token = peek();
    if (token.is(TokenKind.IDENTIFIER)
        || token.kind().getCategory() == TokenKind.Category.CLASSIFICATION) {
      return advance().lexeme();
    }
    throw unexpected(ImmutableSet.of("identifier"));
  }

  /** Name after a dot or in a hint, where reserved words are unambiguous. */
  private String memberName() {
    Token token = peek();
    TokenKind.Category category = token.kind().getCategory();
    if (token.is(TokenKind.IDENTIFIER)
        || category == TokenKind.Category.KEYWORD
        || category == TokenKind.Category.CLASSIFICATION
        || token.is(TokenKind.TRUE)
        || token.is(TokenKind.FALSE)
        || token.is(NULL)) {
      return advance().lexeme();
    }
    throw unexpected(ImmutableSet.of("identifier"));
  }

  private Token expect(TokenKind kind) {
    if (!check(kind)) {
      throw unexpected(ImmutableSet.of(describe(kind)));
    }
    return advance();
  }

  private boolean accept(TokenKind kind) {
    if (check(kind)) {
      advance();
      return true;
    }
    return false;
  }

  private boolean check(TokenKind kind) {
    return peek().is(kind);
  }

  private Token peek() {
    return tokens.get(current);
  }

  private Token peekAt(int ahead) {
    return tokens.get(Math.min(current + ahead, tokens.size() - 1));
  }

  private Token advance() {
    Token token = tokens.get(current);
    if (!token.is(EOF)) {
      current++;
    }
    return token;
  }

  private SyntaxCheckException unexpected(Set<String> expected) {
    Token token = peek();
    return new SyntaxCheckException(token.position(), expected, token.describe());
  }

  private static String describe(TokenKind kind) {
    switch (kind) {
      case EOF:
        return "end of input";
      case IDENTIFIER:
        return "identifier";
      case INTEGER:
        return "integer";
      case ARROW:
        return "->";
      case COLON:
        return ":";
      case COMMA:
        return ",";
      case DOT:
        return ".";
      case SEMICOLON:
        return ";";
      case EQ:
        return "=";
      case GT:
        return ">";
      case LPAREN:
        return "(";
      case RPAREN:
        return ")";
      case LBRACE:
        return "{";
      case RBRACE:
        return "}";
      case LBRACKET:
        return "[";
      case RBRACKET:
        return "]";
      default:
        return kind.name();
    }
  }
}
