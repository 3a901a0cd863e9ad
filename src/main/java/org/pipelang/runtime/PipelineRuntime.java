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
package org.pipelang.runtime;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jspecify.annotations.Nullable;
import org.pipelang.Dataflow.Copier;
import org.pipelang.Dataflow.Pump;
import org.pipelang.Dataflow.Stage;
import org.pipelang.Dataflow.StageRegistry;
import org.pipelang.compiler.Ast;
import org.pipelang.compiler.CompileError;
import org.pipelang.compiler.Compiler;

/**
 * Compiles pipelang programs into Pipelines, and optionally runs them.
 *
 * <p>Compiling a Program maps each function reference to a new ExecutionNode. Every expression
 * compiles to its result nodes (one for a single stage, one per branch for a parallel, the right
 * side's for a pipe), and a pipe connects each result node on its left to each result node on its
 * right with a new queue. A stage that ends up with no input queue sees end of stream at once. Named pipeline definitions are expanded
 * afresh at every reference, so two references to the same name produce independent nodes.
 *
 * <p>A PipelineRuntime can be reused, but compilations are serialized; the state of the most
 * recent compilation (e.g. {@link #timingInfo}) is kept until the next one.
 */
public final class PipelineRuntime<T> {

  private static final Logger logger = LogManager.getLogger(PipelineRuntime.class);

  /** The name of the stage used for merge nodes, if one is registered. */
  public static final String MERGE_STAGE = "merge";

  private final StageRegistry<T> registry;
  private final Copier<T> copier;
  private final EngineOptions options;

  private final Stage<T> defaultMerge = Stage.processor(MERGE_STAGE, (item, params) -> item);

  @GuardedBy("this")
  private CompileState state;

  /** Creates a PipelineRuntime configured from the {@code pipelang.*} system properties. */
  public PipelineRuntime(StageRegistry<T> registry, Copier<T> copier) {
    this(registry, copier, EngineOptions.fromSystemProperties());
  }

  public PipelineRuntime(StageRegistry<T> registry, Copier<T> copier, EngineOptions options) {
    this.registry = registry;
    this.copier = copier;
    this.options = options;
    this.state = new CompileState(ImmutableMap.of());
  }

  public EngineOptions options() {
    return options;
  }

  /**
   * Builds a Pipeline from {@code program}. The Pipeline has not been started.
   *
   * @throws CompileError if the program refers to a stage that is not in the registry
   */
  public synchronized Pipeline<T> compile(Ast.Program program) {
    Map<String, Ast.Node> definitions = new LinkedHashMap<>();
    for (Ast.PipelineDef def : program.definitions()) {
      definitions.put(def.name(), def.expr());
    }
    state = new CompileState(definitions);
    program.accept(state);
    logger.debug(
        "Compiled {} nodes, {} connections",
        state.pipeline.size(),
        state.pipeline.connections().size());
    return state.pipeline;
  }

  /**
   * Parses and compiles {@code source}.
   *
   * @throws CompileError if the source is not a valid program, or refers to an unknown stage
   */
  public Pipeline<T> compile(String source) {
    return compile(Compiler.parse(source));
  }

  /**
   * Returns the durations given with {@code @} in the most recently compiled program, keyed by the
   * id of the node each timed expression compiled to.
   */
  public synchronized ImmutableMap<String, Double> timingInfo() {
    return ImmutableMap.copyOf(state.timing);
  }

  /**
   * Compiles and starts {@code program}, then waits for it to complete, calling {@code pump} on
   * this thread between checks. The pipeline is stopped early if {@code pump} returns {@code
   * Boolean.FALSE} or this thread is interrupted (in which case the interrupt status is restored).
   * Every node's thread has exited by the time this method returns.
   *
   * @return the pipeline that was run
   */
  public Pipeline<T> execute(Ast.Program program, Pump pump) {
    Pipeline<T> pipeline = compile(program);
    pipeline.start();
    try {
      while (pipeline.isAlive()) {
        if (Boolean.FALSE.equals(callPump(pump))) {
          logger.info("Pump requested quit");
          pipeline.stop();
          break;
        }
        Thread.sleep(options.pumpIntervalMillis());
      }
    } catch (InterruptedException e) {
      logger.info("Interrupted, stopping pipeline");
      Thread.currentThread().interrupt();
      pipeline.stop();
    } finally {
      pipeline.awaitCompletionUninterruptibly();
    }
    return pipeline;
  }

  /** Equivalent to {@code execute(program, Pump.NONE)}. */
  public Pipeline<T> execute(Ast.Program program) {
    return execute(program, Pump.NONE);
  }

  private static @Nullable Boolean callPump(Pump pump) {
    try {
      return pump.pump();
    } catch (RuntimeException e) {
      logger.error("Error in pump", e);
      return null;
    }
  }

  /** Returns one line per connection of {@code pipeline}, e.g. {@code "source_1 -> sink_2"}. */
  public static String describe(Pipeline<?> pipeline) {
    StringBuilder sb = new StringBuilder();
    for (Pipeline.Connection<?> connection : pipeline.connections()) {
      sb.append(connection).append('\n');
    }
    return sb.toString();
  }

  /** The state of a single compilation. */
  private class CompileState implements Ast.Visitor<ImmutableList<ExecutionNode<T>>> {
    final Pipeline<T> pipeline = new Pipeline<>(options);
    final Map<String, Ast.Node> definitions;
    final Map<String, Double> timing = new LinkedHashMap<>();

    /** The names of the definitions currently being expanded. */
    final Set<String> expanding = new HashSet<>();

    int counter;

    CompileState(Map<String, Ast.Node> definitions) {
      this.definitions = definitions;
    }

    private ExecutionNode<T> newNode(Stage<T> stage, ImmutableMap<String, Object> params) {
      String id = stage.name() + "_" + (++counter);
      ExecutionNode<T> node =
          new ExecutionNode<>(id, stage, params, copier, options.pollTimeoutMillis());
      pipeline.addNode(node);
      return node;
    }

    /** Connects every one of {@code sources} to every one of {@code targets}. */
    private void connectAll(
        ImmutableList<ExecutionNode<T>> sources, ImmutableList<ExecutionNode<T>> targets) {
      for (ExecutionNode<T> source : sources) {
        for (ExecutionNode<T> target : targets) {
          pipeline.connect(source, target);
        }
      }
    }

    @Override
    public ImmutableList<ExecutionNode<T>> visitFunction(Ast.Function node) {
      Stage<T> stage =
          registry.lookup(node.name()).orElseThrow(() -> CompileError.unknownStage(node.name()));
      return ImmutableList.of(newNode(stage, node.params()));
    }

    @Override
    public ImmutableList<ExecutionNode<T>> visitPipe(Ast.Pipe node) {
      ImmutableList<ExecutionNode<T>> left = node.left().accept(this);
      ImmutableList<ExecutionNode<T>> right = node.right().accept(this);
      connectAll(left, right);
      return right;
    }

    @Override
    public ImmutableList<ExecutionNode<T>> visitParallel(Ast.Parallel node) {
      ImmutableList.Builder<ExecutionNode<T>> result = ImmutableList.builder();
      for (Ast.Node branch : node.branches()) {
        result.addAll(branch.accept(this));
      }
      return result.build();
    }

    @Override
    public ImmutableList<ExecutionNode<T>> visitMerge(Ast.Merge node) {
      Stage<T> stage = registry.lookup(MERGE_STAGE).orElse(defaultMerge);
      ImmutableList<ExecutionNode<T>> merge = ImmutableList.of(newNode(stage, ImmutableMap.of()));
      for (Ast.Node input : node.inputs()) {
        connectAll(input.accept(this), merge);
      }
      ImmutableList<ExecutionNode<T>> output = node.output().accept(this);
      connectAll(merge, output);
      return output;
    }

    @Override
    public ImmutableList<ExecutionNode<T>> visitChoice(Ast.Choice node) {
      // Only the first option is ever run.
      return node.options().get(0).accept(this);
    }

    @Override
    public ImmutableList<ExecutionNode<T>> visitGroup(Ast.Group node) {
      return node.inner().accept(this);
    }

    @Override
    public ImmutableList<ExecutionNode<T>> visitLoop(Ast.Loop node) {
      // Every node already loops until end of stream.
      return node.inner().accept(this);
    }

    @Override
    public ImmutableList<ExecutionNode<T>> visitPipelineDef(Ast.PipelineDef node) {
      throw new IllegalStateException("Definitions are not expressions: " + node.name());
    }

    @Override
    public ImmutableList<ExecutionNode<T>> visitPipelineRef(Ast.PipelineRef node) {
      String name = node.name();
      Ast.Node expr = definitions.get(name);
      if (expr == null || expanding.contains(name)) {
        // Either a stage with no parameters, or a definition that refers to itself.
        return visitFunction(new Ast.Function(name, ImmutableMap.of()));
      }
      expanding.add(name);
      try {
        return expr.accept(this);
      } finally {
        expanding.remove(name);
      }
    }

    @Override
    public ImmutableList<ExecutionNode<T>> visitTimedPipe(Ast.TimedPipe node) {
      ImmutableList<ExecutionNode<T>> result = node.inner().accept(this);
      for (ExecutionNode<T> n : result) {
        timing.put(n.id(), node.durationSeconds());
      }
      return result;
    }

    @Override
    public ImmutableList<ExecutionNode<T>> visitProgram(Ast.Program node) {
      Ast.Node main = node.main();
      return (main == null) ? ImmutableList.of() : main.accept(this);
    }
  }
}
