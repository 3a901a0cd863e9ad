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

import com.google.common.collect.ImmutableSortedSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.pipelang.Dataflow.Stage;
import org.pipelang.Dataflow.StageRegistry;

/**
 * A mutable StageRegistry. Registering a stage with the same name as an existing one replaces it.
 */
public final class StageLibrary<T> implements StageRegistry<T> {

  @GuardedBy("this")
  private final Map<String, Stage<T>> stages = new TreeMap<>();

  /** Adds {@code stage}, replacing any stage previously registered under the same name. */
  @CanIgnoreReturnValue
  public synchronized StageLibrary<T> register(Stage<T> stage) {
    stages.put(stage.name(), stage);
    return this;
  }

  /**
   * Registers the stage currently named {@code name} under the additional name {@code alias}.
   *
   * @throws IllegalArgumentException if there is no stage named {@code name}
   */
  @CanIgnoreReturnValue
  public synchronized StageLibrary<T> alias(String alias, String name) {
    Stage<T> stage = stages.get(name);
    if (stage == null) {
      throw new IllegalArgumentException("No stage named " + name);
    }
    stages.put(alias, stage.renamed(alias));
    return this;
  }

  @Override
  public synchronized Optional<Stage<T>> lookup(String name) {
    return Optional.ofNullable(stages.get(name));
  }

  /** Returns the registered names in sorted order. */
  @Override
  public synchronized ImmutableSortedSet<String> names() {
    return ImmutableSortedSet.copyOf(stages.keySet());
  }

  /**
   * Returns a listing of the registered stages, one per line, each followed by its documented
   * parameters, e.g.
   *
   * <pre>
   * blur (PROCESSOR): Apply Gaussian blur
   *     kernel_size: blur kernel size
   * </pre>
   */
  public synchronized String describe() {
    StringBuilder sb = new StringBuilder();
    for (Stage<T> stage : stages.values()) {
      sb.append(stage.name()).append(" (").append(stage.role()).append(")");
      if (!stage.description().isEmpty()) {
        sb.append(": ").append(stage.description());
      }
      sb.append('\n');
      stage
          .paramDocs()
          .forEach((k, v) -> sb.append("    ").append(k).append(": ").append(v).append('\n'));
    }
    return sb.toString();
  }
}
