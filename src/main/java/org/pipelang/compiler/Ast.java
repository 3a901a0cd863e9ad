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
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.pipelang.util.StringUtil;

/**
 * The Ast class is a namespace for the node types produced by the {@link Parser}.
 *
 * <p>The set of node types is closed: every consumer handles them through a {@link Visitor}, which
 * has one method per type. Nodes are immutable records, so two parses of the same text produce
 * equal trees.
 */
public final class Ast {

  // Just a namespace for the node types.
  private Ast() {}

  /** The flavor of a pipe between two expressions. */
  public enum PipeMode {
    SYNC("->"),
    ASYNC("~>"),
    BLOCKING("=>"),
    BUFFERED("->");

    /** The operator as it appears in source (a BUFFERED pipe is written {@code [n]->}). */
    public final String operator;

    PipeMode(String operator) {
      this.operator = operator;
    }

    static PipeMode of(TokenType type) {
      return switch (type) {
        case SYNC_PIPE -> SYNC;
        case ASYNC_PIPE -> ASYNC;
        case BLOCKING_PIPE -> BLOCKING;
        default -> throw new IllegalArgumentException(type.toString());
      };
    }
  }

  /** Implemented by every AST node type. */
  public interface Node {
    <R> R accept(Visitor<R> visitor);
  }

  /** Has one method for each AST node type. */
  public interface Visitor<R> {
    R visitFunction(Function node);

    R visitPipe(Pipe node);

    R visitParallel(Parallel node);

    R visitMerge(Merge node);

    R visitChoice(Choice node);

    R visitGroup(Group node);

    R visitLoop(Loop node);

    R visitPipelineDef(PipelineDef node);

    R visitPipelineRef(PipelineRef node);

    R visitTimedPipe(TimedPipe node);

    R visitProgram(Program node);
  }

  /**
   * A stage invocation with a (possibly empty) parameter clause, e.g. {@code blur with (sigma:
   * 2.0)}. Positional parameters are keyed {@code arg0}, {@code arg1}, ...
   */
  public record Function(String name, ImmutableMap<String, Object> params) implements Node {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitFunction(this);
    }

    @Override
    public String toString() {
      if (params.isEmpty()) {
        return "Function(" + name + ")";
      }
      String paramsString =
          params.entrySet().stream()
              .map(e -> e.getKey() + "=" + formatValue(e.getValue()))
              .collect(Collectors.joining(", "));
      return "Function(" + name + ", params={" + paramsString + "})";
    }
  }

  /**
   * {@code left -> right}, {@code left ~> right} or {@code left => right}; {@code bufferSize} is
   * non-null only for BUFFERED pipes.
   */
  public record Pipe(Node left, Node right, PipeMode mode, @Nullable Integer bufferSize)
      implements Node {
    public Pipe(Node left, Node right, PipeMode mode) {
      this(left, right, mode, null);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitPipe(this);
    }

    @Override
    public String toString() {
      String op = (mode == PipeMode.BUFFERED) ? "[" + bufferSize + "]->" : mode.operator;
      return "Pipeline(" + left + " " + op + " " + right + ")";
    }
  }

  /** {@code a &> b &> ...}; always has at least two branches. */
  public record Parallel(ImmutableList<Node> branches) implements Node {
    public Parallel {
      Preconditions.checkArgument(branches.size() >= 2);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitParallel(this);
    }

    @Override
    public String toString() {
      return "Parallel(" + join(branches, " &> ") + ")";
    }
  }

  /** {@code input +> output}. The parser currently only ever produces a single input. */
  public record Merge(ImmutableList<Node> inputs, Node output) implements Node {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitMerge(this);
    }

    @Override
    public String toString() {
      return "Merge([" + join(inputs, ", ") + "] +> " + output + ")";
    }
  }

  /** {@code a | b | ...}; always has at least two options. */
  public record Choice(ImmutableList<Node> options) implements Node {
    public Choice {
      Preconditions.checkArgument(options.size() >= 2);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitChoice(this);
    }

    @Override
    public String toString() {
      return "Choice(" + join(options, " | ") + ")";
    }
  }

  /** {@code ( inner )} */
  public record Group(Node inner) implements Node {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitGroup(this);
    }

    @Override
    public String toString() {
      return "Group(" + inner + ")";
    }
  }

  /** <code>{ inner }</code> */
  public record Loop(Node inner) implements Node {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitLoop(this);
    }

    @Override
    public String toString() {
      return "Loop({" + inner + "})";
    }
  }

  /** {@code pipeline name = expr} */
  public record PipelineDef(String name, Node expr) implements Node {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitPipelineDef(this);
    }

    @Override
    public String toString() {
      return "PipelineDef(" + name + " = " + expr + ")";
    }
  }

  /**
   * A bare name, which refers to a pipeline definition if there is one with that name and is
   * otherwise a parameterless stage.
   */
  public record PipelineRef(String name) implements Node {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitPipelineRef(this);
    }

    @Override
    public String toString() {
      return "PipelineRef(" + name + ")";
    }
  }

  /** {@code inner @ 5s} */
  public record TimedPipe(Node inner, double durationSeconds) implements Node {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitTimedPipe(this);
    }

    @Override
    public String toString() {
      return "Timed(" + inner + " @ " + durationSeconds + "s)";
    }
  }

  /** The root of every parse: zero or more definitions followed by an optional main expression. */
  public record Program(ImmutableList<PipelineDef> definitions, @Nullable Node main)
      implements Node {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitProgram(this);
    }

    @Override
    public String toString() {
      if (definitions.isEmpty()) {
        return "Program(" + main + ")";
      } else if (main == null) {
        return "Program([" + join(definitions, ", ") + "])";
      }
      return "Program([" + join(definitions, ", ") + "], main=" + main + ")";
    }
  }

  private static String join(ImmutableList<? extends Node> nodes, String separator) {
    return nodes.stream().map(Node::toString).collect(Collectors.joining(separator));
  }

  private static String formatValue(Object value) {
    return (value instanceof String s) ? StringUtil.escape(s) : value.toString();
  }
}
