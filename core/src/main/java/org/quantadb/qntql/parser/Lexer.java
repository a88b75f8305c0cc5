/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.parser;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.quantadb.qntql.exception.LexicalException;

/**
 * Splits QntQL text into tokens. Whitespace, {@code --} line comments and {@code /* *\/} block
 * comments are dropped. The token list always ends with {@link TokenKind#EOF}.
 *
 * <p>Every call to {@link #tokenize()} scans the text from the start.
 */
public class Lexer {

  private final String text;

  private int offset;
  private int line;
  private int column;

  public Lexer(String text) {
    this.text = text == null ? "" : text;
  }

  public List<Token> tokenize() {
    offset = 0;
    line = 1;
    column = 1;
    ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    while (true) {
      skipTrivia();
      if (atEnd()) {
        tokens.add(new Token(TokenKind.EOF, "", position()));
        return tokens.build();
      }
      tokens.add(next());
    }
  }

  private Token next() {
    Position start = position();
    char c = peek(0);
    if (Character.isLetter(c) || c == '_') {
      return word(start);
    }
    if (Character.isDigit(c)) {
      return number(start, offset);
    }
    if (c == '"' || c == '\'') {
      return string(start, c);
    }
    switch (c) {
      case '-':
        if (peek(1) == '>') {
          return symbol(start, TokenKind.ARROW, 2);
        }
        if (Character.isDigit(peek(1))) {
          int begin = offset;
          advance();
          return number(start, begin);
        }
        throw new LexicalException(start, c, "Unexpected character");
      case '=':
        return symbol(start, TokenKind.EQ, peek(1) == '=' ? 2 : 1);
      case '!':
        return peek(1) == '=' ? symbol(start, TokenKind.NEQ, 2) : symbol(start, TokenKind.NOT, 1);
      case '<':
        if (peek(1) == '=') {
          return symbol(start, TokenKind.LTE, 2);
        }
        return peek(1) == '>' ? symbol(start, TokenKind.NEQ, 2) : symbol(start, TokenKind.LT, 1);
      case '>':
        return peek(1) == '=' ? symbol(start, TokenKind.GTE, 2) : symbol(start, TokenKind.GT, 1);
      case '&':
        if (peek(1) == '&') {
          return symbol(start, TokenKind.AND, 2);
        }
        throw new LexicalException(start, c, "Unexpected character");
      case '|':
        if (peek(1) == '|') {
          return symbol(start, TokenKind.OR, 2);
        }
        throw new LexicalException(start, c, "Unexpected character");
      case '*':
        return symbol(start, TokenKind.STAR, 1);
      case '(':
        return symbol(start, TokenKind.LPAREN, 1);
      case ')':
        return symbol(start, TokenKind.RPAREN, 1);
      case '{':
        return symbol(start, TokenKind.LBRACE, 1);
      case '}':
        return symbol(start, TokenKind.RBRACE, 1);
      case '[':
        return symbol(start, TokenKind.LBRACKET, 1);
      case ']':
        return symbol(start, TokenKind.RBRACKET, 1);
      case ',':
        return symbol(start, TokenKind.COMMA, 1);
      case '.':
        return symbol(start, TokenKind.DOT, 1);
      case ':':
        return symbol(start, TokenKind.COLON, 1);
      case ';':
        return symbol(start, TokenKind.SEMICOLON, 1);
      default:
        throw new LexicalException(start, c, "Unexpected character");
    }
  }

  private Token symbol(Position start, TokenKind kind, int length) {
    int begin = offset;
    for (int i = 0; i < length; i++) {
      advance();
    }
    return new Token(kind, text.substring(begin, offset), start);
  }

  private Token word(Position start) {
    int begin = offset;
    while (!atEnd() && (Character.isLetterOrDigit(peek(0)) || peek(0) == '_')) {
      advance();
    }
    String word = text.substring(begin, offset);
    return new Token(TokenKind.reserved(word).orElse(TokenKind.IDENTIFIER), word, start);
  }

  /** Number or date-time literal; {@code begin} includes a leading minus sign. */
  private Token number(Position start, int begin) {
    if (begin == offset && isDateAhead()) {
      return dateTime(start);
    }
    boolean decimal = false;
    digits();
    if (peek(0) == '.' && Character.isDigit(peek(1))) {
      decimal = true;
      advance();
      digits();
    }
    if ((peek(0) == 'e' || peek(0) == 'E')
        && (Character.isDigit(peek(1))
            || ((peek(1) == '+' || peek(1) == '-') && Character.isDigit(peek(2))))) {
      decimal = true;
      advance();
      advance();
      digits();
    }
    return new Token(
        decimal ? TokenKind.DECIMAL : TokenKind.INTEGER, text.substring(begin, offset), start);
  }

  /** yyyy-MM-dd[THH:mm[:ss[.fraction]]][Z|+HH:mm|-HH:mm] */
  private Token dateTime(Position start) {
    int begin = offset;
    for (int i = 0; i < 10; i++) {
      advance();
    }
    if (peek(0) == 'T' && isDigits(1, 2) && peek(3) == ':' && isDigits(4, 2)) {
      for (int i = 0; i < 6; i++) {
        advance();
      }
      if (peek(0) == ':' && isDigits(1, 2)) {
        advance();
        advance();
        advance();
        if (peek(0) == '.' && Character.isDigit(peek(1))) {
          advance();
          digits();
        }
      }
      if (peek(0) == 'Z') {
        advance();
      } else if ((peek(0) == '+' || peek(0) == '-')
          && isDigits(1, 2)
          && peek(3) == ':'
          && isDigits(4, 2)) {
        for (int i = 0; i < 6; i++) {
          advance();
        }
      }
    }
    return new Token(TokenKind.DATETIME, text.substring(begin, offset), start);
  }

  private boolean isDateAhead() {
    return isDigits(0, 4)
        && peek(4) == '-'
        && isDigits(5, 2)
        && peek(7) == '-'
        && isDigits(8, 2)
        && !Character.isDigit(peek(10));
  }

  private boolean isDigits(int from, int count) {
    for (int i = from; i < from + count; i++) {
      if (!Character.isDigit(peek(i))) {
        return false;
      }
    }
    return true;
  }

  private void digits() {
    while (Character.isDigit(peek(0))) {
      advance();
    }
  }

  private Token string(Position start, char quote) {
    advance();
    StringBuilder value = new StringBuilder();
    while (true) {
      if (atEnd()) {
        throw new LexicalException(start, quote, "Unterminated string literal starting with");
      }
      char c = advance();
      if (c == quote) {
        return new Token(TokenKind.STRING, value.toString(), start);
      }
      if (c == '\\') {
        if (atEnd()) {
          throw new LexicalException(start, quote, "Unterminated string literal starting with");
        }
        char escaped = advance();
        switch (escaped) {
          case 'n':
            value.append('\n');
            break;
          case 't':
            value.append('\t');
            break;
          case 'r':
            value.append('\r');
            break;
          default:
            value.append(escaped);
        }
      } else {
        value.append(c);
      }
    }
  }

  private void skipTrivia() {
    while (!atEnd()) {
      char c = peek(0);
      if (Character.isWhitespace(c)) {
        advance();
      } else if (c == '-' && peek(1) == '-') {
        while (!atEnd() && peek(0) != '\n') {
          advance();
        }
      } else if (c == '/' && peek(1) == '*') {
        Position start = position();
        advance();
        advance();
        while (!(peek(0) == '*' && peek(1) == '/')) {
          if (atEnd()) {
            throw new LexicalException(start, '/', "Unterminated block comment starting with");
          }
          advance();
        }
        advance();
        advance();
      } else {
        return;
      }
    }
  }

  private char peek(int ahead) {
    int index = offset + ahead;
    return index < text.length() ? text.charAt(index) : '\0';
  }

  private char advance() {
    char c = text.charAt(offset++);
    if (c == '\n') {
      line++;
      column = 1;
    } else {
      column++;
    }
    return c;
  }

  private boolean atEnd() {
    return offset >= text.length();
  }

  private Position position() {
    return new Position(offset, line, column);
  }
}
