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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.pipelang.compiler.Ast.Node;
import org.pipelang.compiler.CompileError.Kind;

/**
 * A recursive-descent parser from tokens to an {@link Ast.Program}.
 *
 * <p>Binding strength, loosest to tightest:
 *
 * <pre>
 *   program  := ('pipeline' IDENTIFIER '=' merge)* merge?
 *   merge    := choice ('+>' choice)?
 *   choice   := parallel ('|' parallel)*
 *   parallel := pipe ('&amp;>' pipe)*
 *   pipe     := primary (('->' | '~>' | '=>') primary)*
 *   primary  := '[' NUMBER ']' '->' primary
 *             | '{' merge '}'
 *             | '(' merge ')'
 *             | name ('@' NUMBER 's'?)?
 *   name     := IDENTIFIER (('with' params?) | params)?
 *   params   := '(' (param (',' param)* ','?)? ')'
 *   param    := (IDENTIFIER ':')? value
 * </pre>
 *
 * <p>Each {@code parseX} method returns null (without consuming anything) if the current token
 * cannot start an X; the caller decides whether that is an error.
 */
public final class Parser {

  private final List<Token> tokens;
  private int pos;

  private Parser(List<Token> tokens) {
    Preconditions.checkArgument(
        !tokens.isEmpty() && tokens.get(tokens.size() - 1).type() == TokenType.EOF,
        "Token list must end with EOF");
    this.tokens = tokens;
  }

  /** Parses a complete program; every token except the final EOF must be consumed. */
  public static Ast.Program parse(List<Token> tokens) {
    return new Parser(tokens).parseProgram();
  }

  private Token current() {
    return tokens.get(pos);
  }

  private boolean at(TokenType type) {
    return current().type() == type;
  }

  /** Returns the token {@code offset} positions ahead; never moves past the EOF token. */
  private Token peek(int offset) {
    return tokens.get(Math.min(pos + offset, tokens.size() - 1));
  }

  @CanIgnoreReturnValue
  private Token advance() {
    Token result = current();
    if (pos < tokens.size() - 1) {
      pos++;
    }
    return result;
  }

  @CanIgnoreReturnValue
  private Token expect(TokenType type) {
    if (!at(type)) {
      throw error(
          Kind.EXPECTED_TOKEN, "Expected %s, got %s", type.describe(), current().type().describe());
    }
    return advance();
  }

  private Ast.Program parseProgram() {
    ImmutableList.Builder<Ast.PipelineDef> definitions = ImmutableList.builder();
    while (at(TokenType.KEYWORD_PIPELINE)) {
      definitions.add(parseDefinition());
    }
    Node main = null;
    if (!at(TokenType.EOF)) {
      main = parseMerge();
      if (main == null || !at(TokenType.EOF)) {
        throw error(Kind.TRAILING_INPUT, "Unexpected token: %s", current().value());
      }
    }
    return new Ast.Program(definitions.build(), main);
  }

  private Ast.PipelineDef parseDefinition() {
    expect(TokenType.KEYWORD_PIPELINE);
    if (!at(TokenType.IDENTIFIER)) {
      throw error(Kind.EXPECTED_TOKEN, "Expected pipeline name after 'pipeline'");
    }
    String name = advance().text();
    if (!at(TokenType.EQUALS)) {
      throw error(Kind.EXPECTED_TOKEN, "Expected '=' after pipeline name");
    }
    advance();
    Node expr = parseMerge();
    if (expr == null) {
      throw error(Kind.EXPECTED_EXPRESSION, "Expected pipeline expression after '='");
    }
    return new Ast.PipelineDef(name, expr);
  }

  /**
   * Only a single input is collected before the {@code +>}, so the result always has exactly one
   * input; a second {@code +>} is left for the caller (and is usually reported as trailing input).
   */
  private @Nullable Node parseMerge() {
    Node left = parseChoice();
    if (left == null || !at(TokenType.MERGE)) {
      return left;
    }
    advance();
    Node output = parseChoice();
    if (output == null) {
      throw error(Kind.EXPECTED_EXPRESSION, "Expected expression after merge operator");
    }
    return new Ast.Merge(ImmutableList.of(left), output);
  }

  private @Nullable Node parseChoice() {
    Node left = parseParallel();
    if (left == null || !at(TokenType.CHOICE)) {
      return left;
    }
    ImmutableList.Builder<Node> options = ImmutableList.<Node>builder().add(left);
    while (at(TokenType.CHOICE)) {
      advance();
      Node right = parseParallel();
      if (right == null) {
        throw error(Kind.EXPECTED_EXPRESSION, "Expected expression after choice operator");
      }
      options.add(right);
    }
    return new Ast.Choice(options.build());
  }

  private @Nullable Node parseParallel() {
    Node left = parsePipe();
    if (left == null || !at(TokenType.PARALLEL)) {
      return left;
    }
    ImmutableList.Builder<Node> branches = ImmutableList.<Node>builder().add(left);
    while (at(TokenType.PARALLEL)) {
      advance();
      Node right = parsePipe();
      if (right == null) {
        throw error(Kind.EXPECTED_EXPRESSION, "Expected expression after parallel operator");
      }
      branches.add(right);
    }
    return new Ast.Parallel(branches.build());
  }

  private @Nullable Node parsePipe() {
    Node left = parsePrimary();
    if (left == null) {
      return null;
    }
    while (current().type().isPipe()) {
      Ast.PipeMode mode = Ast.PipeMode.of(advance().type());
      Node right = parsePrimary();
      if (right == null) {
        throw error(Kind.EXPECTED_EXPRESSION, "Expected expression after pipe operator");
      }
      left = new Ast.Pipe(left, right, mode);
    }
    return left;
  }

  private @Nullable Node parsePrimary() {
    switch (current().type()) {
      case LEFT_SQUARE:
        return parseBufferedPrefix();
      case LEFT_CURLY:
        {
          advance();
          Node inner = parseMerge();
          if (inner == null) {
            throw error(Kind.EXPECTED_EXPRESSION, "Expected pipeline inside loop");
          }
          expect(TokenType.RIGHT_CURLY);
          return new Ast.Loop(inner);
        }
      case LEFT_PAREN:
        {
          advance();
          Node inner = parseMerge();
          if (inner == null) {
            throw error(Kind.EXPECTED_EXPRESSION, "Expected pipeline inside parentheses");
          }
          expect(TokenType.RIGHT_PAREN);
          return new Ast.Group(inner);
        }
      case IDENTIFIER:
        {
          Node node = parseName();
          if (at(TokenType.AT)) {
            advance();
            node = new Ast.TimedPipe(node, parseDuration());
          }
          return node;
        }
      default:
        return null;
    }
  }

  /**
   * Parses {@code [n]-> primary}. The buffer size is checked but not kept: only the right-hand side
   * is returned, and the pipe it belongs to is whatever encloses this primary.
   */
  private Node parseBufferedPrefix() {
    expect(TokenType.LEFT_SQUARE);
    if (!at(TokenType.NUMBER)) {
      throw error(Kind.EXPECTED_TOKEN, "Expected number for buffer size");
    }
    advance();
    expect(TokenType.RIGHT_SQUARE);
    if (!at(TokenType.SYNC_PIPE)) {
      throw error(Kind.EXPECTED_TOKEN, "Expected -> after buffer specification");
    }
    advance();
    Node right = parsePrimary();
    if (right == null) {
      throw error(Kind.EXPECTED_EXPRESSION, "Expected expression after buffered pipe");
    }
    return right;
  }

  /**
   * A name with a parameter clause is a Function; a bare name is a PipelineRef, which the compiler
   * resolves to either a definition or a parameterless stage.
   */
  private Node parseName() {
    String name = expect(TokenType.IDENTIFIER).text();
    if (at(TokenType.KEYWORD_WITH)) {
      advance();
      // "with" with no parenthesized list is allowed and means no parameters.
      ImmutableMap<String, Object> params =
          at(TokenType.LEFT_PAREN) ? parseParameterList() : ImmutableMap.of();
      return new Ast.Function(name, params);
    } else if (at(TokenType.LEFT_PAREN)) {
      return new Ast.Function(name, parseParameterList());
    }
    return new Ast.PipelineRef(name);
  }

  private ImmutableMap<String, Object> parseParameterList() {
    expect(TokenType.LEFT_PAREN);
    // A repeated key keeps its last value.
    Map<String, Object> params = new LinkedHashMap<>();
    int positional = 0;
    while (!at(TokenType.RIGHT_PAREN)) {
      if (at(TokenType.IDENTIFIER) && peek(1).type() == TokenType.COLON) {
        String key = advance().text();
        advance();
        params.put(key, parseValue());
      } else {
        params.put("arg" + positional++, parseValue());
      }
      if (at(TokenType.COMMA)) {
        advance();
      } else if (!at(TokenType.RIGHT_PAREN)) {
        throw error(
            Kind.EXPECTED_TOKEN,
            "Expected ',' or ')', got %s",
            current().type().describe());
      }
    }
    advance();
    return ImmutableMap.copyOf(params);
  }

  private Object parseValue() {
    Token token = current();
    switch (token.type()) {
      case NUMBER:
      case STRING:
      case IDENTIFIER:
        advance();
        return token.value();
      default:
        throw error(Kind.EXPECTED_VALUE, "Expected value, got %s", token.type().describe());
    }
  }

  /** Parses the number after an {@code @}, with an optional {@code s} suffix. */
  private double parseDuration() {
    if (!at(TokenType.NUMBER)) {
      throw error(Kind.EXPECTED_TOKEN, "Expected number for duration");
    }
    double duration = ((Number) advance().value()).doubleValue();
    if (at(TokenType.IDENTIFIER) && current().text().equals("s")) {
      advance();
    }
    return duration;
  }

  /** Returns a new ParseError positioned at the current token. */
  @FormatMethod
  private ParseError error(Kind kind, String fmt, Object... fmtArgs) {
    return new ParseError(kind, String.format(fmt, fmtArgs), current());
  }
}
