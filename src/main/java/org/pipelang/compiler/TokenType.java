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

import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * The kinds of token produced by the {@link Lexer}.
 *
 * <p>Operators and delimiters know their source text, which the lexer uses to recognize them
 * (two-character operators are tried before single-character ones).
 */
public enum TokenType {
  // Pipe operators
  SYNC_PIPE("->"),
  ASYNC_PIPE("~>"),
  BLOCKING_PIPE("=>"),
  PARALLEL("&>"),
  MERGE("+>"),
  CHOICE("|"),

  // Delimiters
  LEFT_PAREN("("),
  RIGHT_PAREN(")"),
  LEFT_SQUARE("["),
  RIGHT_SQUARE("]"),
  LEFT_CURLY("{"),
  RIGHT_CURLY("}"),
  COMMA(","),
  COLON(":"),
  AT("@"),
  EQUALS("="),

  // Keywords
  KEYWORD_WITH("with"),
  KEYWORD_PIPELINE("pipeline"),

  IDENTIFIER(null),
  NUMBER(null),
  STRING(null),
  EOF(null);

  /** The fixed source text of this token type, or null for identifiers, literals and EOF. */
  final @Nullable String text;

  TokenType(@Nullable String text) {
    this.text = text;
  }

  /** Maps each two-character operator's text to its TokenType. */
  static final ImmutableMap<String, TokenType> TWO_CHAR_OPERATORS = withTextLength(2);

  /** Maps each single-character operator or delimiter's text to its TokenType. */
  static final ImmutableMap<String, TokenType> ONE_CHAR_OPERATORS = withTextLength(1);

  /** Maps each reserved word to its keyword TokenType. */
  static final ImmutableMap<String, TokenType> KEYWORDS =
      ImmutableMap.of(KEYWORD_WITH.text, KEYWORD_WITH, KEYWORD_PIPELINE.text, KEYWORD_PIPELINE);

  private static ImmutableMap<String, TokenType> withTextLength(int length) {
    return Arrays.stream(values())
        .filter(t -> t.text != null && t.text.length() == length && !t.name().startsWith("KEYWORD"))
        .collect(ImmutableMap.toImmutableMap(t -> t.text, Function.identity()));
  }

  /** Returns true if this is one of the three pipe operators accepted between pipe operands. */
  boolean isPipe() {
    return this == SYNC_PIPE || this == ASYNC_PIPE || this == BLOCKING_PIPE;
  }

  /** Returns a short description of this token type for use in error messages. */
  String describe() {
    return (text != null) ? "'" + text + "'" : name();
  }
}
