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

import org.jspecify.annotations.Nullable;

/**
 * A single token, with its 1-based source position.
 *
 * <p>{@code value} is a String for identifiers, keywords, strings and operators, a Long or Double
 * for numbers, and null for {@link TokenType#EOF}.
 */
public record Token(TokenType type, @Nullable Object value, int line, int column) {

  /** Returns the value of an IDENTIFIER, keyword or STRING token. */
  String text() {
    return (String) value;
  }

  @Override
  public String toString() {
    return String.format("Token(%s, %s, %s,%s)", type, value, line, column);
  }
}
