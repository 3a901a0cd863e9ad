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

package org.pipelang;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.jspecify.annotations.Nullable;

/**
 * The Dataflow class is just a namespace for the interfaces through which the runtime talks to the
 * outside world: the stages it binds into execution nodes, the registry it finds them in, the
 * copier it uses for fan-out, and the pump that {@code execute()} drives on the calling thread.
 *
 * <p>Payloads are opaque values of type {@code T}; nothing here (or in the runtime) looks inside
 * them.
 */
public class Dataflow {

  // Just a namespace for the contained interfaces.
  private Dataflow() {}

  /** The role of a stage, fixed when the stage is created. */
  public enum Role {
    /** Ignores its input; called repeatedly to produce payloads until it returns null. */
    SOURCE,

    /** Transforms each input payload; a null result drops the payload. */
    PROCESSOR,

    /** Consumes each input payload; returning {@code false} asks the node to stop. */
    SINK
  }

  /** The callable of a {@link Role#SOURCE} stage. */
  @FunctionalInterface
  public interface SourceFunction<T> {
    /** Returns the next payload, or null at end of stream. */
    @Nullable T produce(Map<String, Object> params) throws Exception;
  }

  /** The callable of a {@link Role#PROCESSOR} stage. */
  @FunctionalInterface
  public interface ProcessorFunction<T> {
    /** Returns the transformed payload, or null to drop it. */
    @Nullable T process(T input, Map<String, Object> params) throws Exception;
  }

  /** The callable of a {@link Role#SINK} stage. */
  @FunctionalInterface
  public interface SinkFunction<T> {
    /**
     * Consumes a payload. Returning {@code Boolean.FALSE} asks the enclosing node to stop; null and
     * {@code Boolean.TRUE} are both treated as "keep going".
     */
    @Nullable Boolean consume(T input, Map<String, Object> params) throws Exception;
  }

  /**
   * A Stage is a named capability that the compiler binds into an execution node. It is a tagged
   * variant: exactly one of the three callables is present, as indicated by {@link #role}.
   */
  public static final class Stage<T> {
    private final String name;
    private final Role role;
    private final Object callable;
    private final String description;
    private final ImmutableMap<String, String> paramDocs;

    private Stage(
        String name,
        Role role,
        Object callable,
        String description,
        Map<String, String> paramDocs) {
      Preconditions.checkArgument(!name.isEmpty(), "Stage name must not be empty");
      this.name = name;
      this.role = role;
      this.callable = Preconditions.checkNotNull(callable);
      this.description = description;
      this.paramDocs = ImmutableMap.copyOf(paramDocs);
    }

    public static <T> Stage<T> source(String name, SourceFunction<T> fn) {
      return source(name, fn, "", ImmutableMap.of());
    }

    public static <T> Stage<T> source(
        String name, SourceFunction<T> fn, String description, Map<String, String> paramDocs) {
      return new Stage<>(name, Role.SOURCE, fn, description, paramDocs);
    }

    public static <T> Stage<T> processor(String name, ProcessorFunction<T> fn) {
      return processor(name, fn, "", ImmutableMap.of());
    }

    public static <T> Stage<T> processor(
        String name, ProcessorFunction<T> fn, String description, Map<String, String> paramDocs) {
      return new Stage<>(name, Role.PROCESSOR, fn, description, paramDocs);
    }

    public static <T> Stage<T> sink(String name, SinkFunction<T> fn) {
      return sink(name, fn, "", ImmutableMap.of());
    }

    public static <T> Stage<T> sink(
        String name, SinkFunction<T> fn, String description, Map<String, String> paramDocs) {
      return new Stage<>(name, Role.SINK, fn, description, paramDocs);
    }

    /** Returns a Stage with the same role and callable but a different name. */
    public Stage<T> renamed(String newName) {
      return new Stage<>(newName, role, callable, description, paramDocs);
    }

    public String name() {
      return name;
    }

    public Role role() {
      return role;
    }

    public boolean isSource() {
      return role == Role.SOURCE;
    }

    public boolean isSink() {
      return role == Role.SINK;
    }

    public String description() {
      return description;
    }

    /** Maps each documented parameter name to a short description of it. */
    public ImmutableMap<String, String> paramDocs() {
      return paramDocs;
    }

    @SuppressWarnings("unchecked")
    public SourceFunction<T> asSource() {
      Preconditions.checkState(role == Role.SOURCE, "%s is not a source", name);
      return (SourceFunction<T>) callable;
    }

    @SuppressWarnings("unchecked")
    public ProcessorFunction<T> asProcessor() {
      Preconditions.checkState(role == Role.PROCESSOR, "%s is not a processor", name);
      return (ProcessorFunction<T>) callable;
    }

    @SuppressWarnings("unchecked")
    public SinkFunction<T> asSink() {
      Preconditions.checkState(role == Role.SINK, "%s is not a sink", name);
      return (SinkFunction<T>) callable;
    }

    @Override
    public String toString() {
      return name + ":" + role;
    }
  }

  /** A StageRegistry maps stage names to Stages. */
  public interface StageRegistry<T> {
    /** Returns the stage with the given name, or an empty Optional if there is none. */
    Optional<Stage<T>> lookup(String name);

    /** Returns the names of all registered stages. */
    Iterable<String> names();
  }

  /**
   * A Copier makes an independent copy of a payload. It is used whenever a node forwards a payload
   * to more than one output queue, so that sibling consumers never share a mutable value.
   */
  @FunctionalInterface
  public interface Copier<T> {
    T copy(T payload);

    /** Returns a Copier that returns its argument; only appropriate for immutable payloads. */
    static <T> Copier<T> identity() {
      return payload -> payload;
    }

    static <T> Copier<T> of(UnaryOperator<T> fn) {
      return fn::apply;
    }
  }

  /**
   * A Pump is called periodically on the thread that called {@code execute()}, for stages that
   * need work done on a particular thread (e.g. on-screen rendering).
   */
  @FunctionalInterface
  public interface Pump {
    /** Returns {@code Boolean.FALSE} to request that execution stop; anything else continues. */
    @Nullable Boolean pump();

    /** A Pump that does nothing. */
    Pump NONE = () -> null;
  }
}
