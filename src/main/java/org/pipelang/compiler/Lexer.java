/*
 * Copyright 2025 The Pipelang Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.pipelang.compiler;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.FormatMethod;
import org.pipelang.compiler.CompileError.Kind;
import org.pipelang.util.StringUtil;

/**
 * Converts pipelang source text into a flat list of tokens.
 *
 * <p>Lexing is all-or-nothing: the first illegal construct throws a {@link LexError} carrying its
 * position. A successful result always ends with a single {@link TokenType#EOF} token.
 *
 * <p>Identifiers may contain hyphens, but a hyphen followed by {@code >} is left for the {@code ->}
 * operator, so {@code a->b} lexes as {@code a}, {@code ->}, {@code b}. This is an extension: a
 * lexer that folds every hyphen into the name would read {@code a-} and then reject the {@code >}.
 */
public final class Lexer {

  private final String source;
  private final ImmutableList.Builder<Token> tokens = ImmutableList.builder();

  /** The index in {@link #source} of the next character to be read. */
  private int pos;

  /** The 1-based line and column of the character at {@link #pos}. */
  private int line = 1;

  private int column = 1;

  private Lexer(String source) {
    this.source = source;
  }

  /** Returns the tokens of {@code source}, terminated by an EOF token. */
  public static ImmutableList<Token> tokenize(String source) {
    return new Lexer(source).run();
  }

  private ImmutableList<Token> run() {
    for (; ; ) {
      skipWhitespaceAndComments();
      if (atEnd()) {
        break;
      }
      char c = peek(0);
      if (isDigit(c)) {
        readNumber();
      } else if (c == '"' || c == '\'') {
        readString(c);
      } else if (Character.isLetter(c) || c == '_') {
        readIdentifier();
      } else if (c == '-' && Character.isLetter(peek(1))) {
        // A hyphenated name like "-foo"; "-" is otherwise only the start of "->".
        readIdentifier();
      } else {
        readOperator();
      }
    }
    tokens.add(new Token(TokenType.EOF, null, line, column));
    return tokens.build();
  }

  private boolean atEnd() {
    return pos >= source.length();
  }

  /** Returns the character {@code offset} positions ahead, or NUL if that is past the end. */
  private char peek(int offset) {
    int i = pos + offset;
    return (i < source.length()) ? source.charAt(i) : '\0';
  }

  private char advance() {
    char c = source.charAt(pos++);
    if (c == '\n') {
      line++;
      column = 1;
    } else {
      column++;
    }
    return c;
  }

  private void skipWhitespaceAndComments() {
    while (!atEnd()) {
      char c = peek(0);
      if (c == ' ' || c == '\t' || c == '\n' || c == '\r') {
        advance();
      } else if (c == '#') {
        while (!atEnd() && peek(0) != '\n') {
          advance();
        }
      } else {
        return;
      }
    }
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  /** Numbers are a run of digits and dots; there are no signed literals. */
  private void readNumber() {
    int startLine = line;
    int startColumn = column;
    int start = pos;
    while (!atEnd() && (isDigit(peek(0)) || peek(0) == '.')) {
      advance();
    }
    String text = source.substring(start, pos);
    Object value;
    try {
      value = (text.indexOf('.') >= 0) ? (Object) Double.parseDouble(text) : Long.parseLong(text);
    } catch (NumberFormatException e) {
      throw error(Kind.INVALID_NUMBER, startLine, startColumn, "Invalid number: %s", text);
    }
    tokens.add(new Token(TokenType.NUMBER, value, startLine, startColumn));
  }

  private void readString(char quote) {
    int startLine = line;
    int startColumn = column;
    advance();
    int start = pos;
    for (; ; ) {
      if (atEnd()) {
        throw error(Kind.UNTERMINATED_STRING, startLine, startColumn, "Unterminated string");
      }
      char c = advance();
      if (c == quote) {
        break;
      } else if (c == '\\' && !atEnd()) {
        // The escaped character never ends the string.
        advance();
      }
    }
    String body = source.substring(start, pos - 1);
    tokens.add(new Token(TokenType.STRING, StringUtil.unescape(body), startLine, startColumn));
  }

  /**
   * Identifiers are letters, digits, underscores and hyphens. A hyphen that begins a {@code ->}
   * ends the identifier, so that {@code a->b} is three tokens.
   */
  private void readIdentifier() {
    int startLine = line;
    int startColumn = column;
    int start = pos;
    while (!atEnd()) {
      char c = peek(0);
      if (Character.isLetterOrDigit(c) || c == '_' || (c == '-' && peek(1) != '>')) {
        advance();
      } else {
        break;
      }
    }
    String text = source.substring(start, pos);
    TokenType type = TokenType.KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER);
    tokens.add(new Token(type, text, startLine, startColumn));
  }

  private void readOperator() {
    int startLine = line;
    int startColumn = column;
    TokenType type = null;
    if (pos + 1 < source.length()) {
      type = TokenType.TWO_CHAR_OPERATORS.get(source.substring(pos, pos + 2));
    }
    if (type == null) {
      type = TokenType.ONE_CHAR_OPERATORS.get(String.valueOf(peek(0)));
    }
    if (type == null) {
      throw error(
          Kind.UNEXPECTED_CHARACTER, startLine, startColumn, "Unexpected character: %s", peek(0));
    }
    for (int i = 0; i < type.text.length(); i++) {
      advance();
    }
    tokens.add(new Token(type, type.text, startLine, startColumn));
  }

  @FormatMethod
  private static LexError error(
      Kind kind, int line, int column, String fmt, Object... fmtArgs) {
    return new LexError(kind, String.format(fmt, fmtArgs), line, column);
  }
}
