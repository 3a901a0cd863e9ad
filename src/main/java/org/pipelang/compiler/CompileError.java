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
 * All pipelang language errors detected before execution (while lexing, parsing, or compiling a
 * program into a graph) throw a CompileError.
 *
 * <p>Lexing and parsing errors use the {@link LexError} and {@link ParseError} subclasses and are
 * always positioned; an unknown stage is reported with a plain CompileError and no position.
 */
public class CompileError extends RuntimeException {

  /** Identifies what went wrong, independent of the wording of the message. */
  public enum Kind {
    UNTERMINATED_STRING,
    UNEXPECTED_CHARACTER,
    INVALID_NUMBER,
    EXPECTED_TOKEN,
    EXPECTED_EXPRESSION,
    EXPECTED_VALUE,
    TRAILING_INPUT,
    UNKNOWN_STAGE
  }

  public final Kind kind;
  public final String msg;

  /** The 1-based line of the error, or 0 if the error has no source position. */
  public final int lineNum;

  /** The 1-based column of the error, or 0 if the error has no source position. */
  public final int charPositionInLine;

  /** For UNKNOWN_STAGE errors, the name that could not be found. */
  private final @Nullable String stageName;

  public CompileError(Kind kind, String msg, int lineNum, int charPositionInLine) {
    this(kind, msg, lineNum, charPositionInLine, null);
  }

  private CompileError(
      Kind kind, String msg, int lineNum, int charPositionInLine, @Nullable String stageName) {
    super(msg);
    this.kind = kind;
    this.msg = msg;
    this.lineNum = lineNum;
    this.charPositionInLine = charPositionInLine;
    this.stageName = stageName;
  }

  /** Returns a new "Unknown stage '%s'" CompileError. */
  public static CompileError unknownStage(String name) {
    return new CompileError(
        Kind.UNKNOWN_STAGE, String.format("Unknown stage '%s'", name), 0, 0, name);
  }

  /** Returns true if this error carries a source position. */
  public boolean hasPosition() {
    return lineNum > 0;
  }

  /** Returns the name of the unknown stage if this is an UNKNOWN_STAGE error, otherwise null. */
  public @Nullable String stageName() {
    return stageName;
  }

  @Override
  public String getMessage() {
    return hasPosition() ? String.format("%s (%s:%s)", msg, lineNum, charPositionInLine) : msg;
  }
}
