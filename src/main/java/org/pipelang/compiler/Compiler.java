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

/** Entry points for turning pipelang source text into tokens and ASTs. */
public final class Compiler {

  // Static methods only
  private Compiler() {}

  /**
   * Returns the tokens of a pipelang program, ending with an EOF token.
   *
   * @throws LexError at the first illegal construct
   */
  public static ImmutableList<Token> tokenize(String source) {
    return Lexer.tokenize(source);
  }

  /**
   * Parses a pipelang program.
   *
   * <p>A valid program consists of zero or more {@code pipeline NAME = expr} definitions followed
   * by an optional main expression; nothing may follow the main expression.
   *
   * @throws LexError if the source cannot be tokenized
   * @throws ParseError if the tokens do not form a program
   */
  public static Ast.Program parse(String source) {
    return Parser.parse(Lexer.tokenize(source));
  }
}
