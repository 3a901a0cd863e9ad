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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A compiled graph of ExecutionNodes and the queues that connect them.
 *
 * <p>A Pipeline is single-use: {@link #start} may only be called once. After that it runs until
 * every node has exited, either naturally (sources exhausted and end of stream propagated) or
 * because {@link #stop} was called. Each node runs on its own thread, so the number of threads is
 * the number of nodes.
 */
public final class Pipeline<T> {

  private static final Logger logger = LogManager.getLogger(Pipeline.class);

  /** An edge of the graph: {@code queue} carries items from {@code source} to {@code target}. */
  public record Connection<T>(
      ExecutionNode<T> source, ExecutionNode<T> target, BoundedQueue<T> queue) {
    @Override
    public String toString() {
      return source.id() + " -> " + target.id();
    }
  }

  private final EngineOptions options;
  private final List<ExecutionNode<T>> nodes = new ArrayList<>();
  private final List<Connection<T>> connections = new ArrayList<>();
  private volatile boolean started;

  Pipeline(EngineOptions options) {
    this.options = options;
  }

  void addNode(ExecutionNode<T> node) {
    Preconditions.checkState(!started);
    nodes.add(node);
  }

  /** Creates a new queue from {@code source} to {@code target}. */
  void connect(ExecutionNode<T> source, ExecutionNode<T> target) {
    Preconditions.checkState(!started);
    BoundedQueue<T> queue = new BoundedQueue<>(options.queueCapacity());
    source.addOutput(queue);
    target.addInput(queue);
    connections.add(new Connection<>(source, target, queue));
  }

  /** Returns the nodes of this Pipeline, in the order they were created by the compiler. */
  public ImmutableList<ExecutionNode<T>> nodes() {
    return ImmutableList.copyOf(nodes);
  }

  /** Returns the connections of this Pipeline, in the order they were made by the compiler. */
  public ImmutableList<Connection<T>> connections() {
    return ImmutableList.copyOf(connections);
  }

  /** Returns the number of nodes. */
  public int size() {
    return nodes.size();
  }

  /** Starts a thread for each node. */
  public void start() {
    Preconditions.checkState(!started, "A Pipeline can only be started once");
    started = true;
    logger.debug("Starting pipeline with {} nodes", nodes.size());
    for (ExecutionNode<T> node : nodes) {
      node.start();
    }
  }

  /**
   * Asks every node to stop, then waits a bounded time for each node's thread to exit.
   *
   * <p>Nodes notice a stop request at their next loop iteration or queue timeout; a source that is
   * blocked inside its stage function can't notice until that call returns, and will be left
   * running (its thread is a daemon, so it won't keep the JVM alive).
   */
  public void stop() {
    for (ExecutionNode<T> node : nodes) {
      node.requestStop();
    }
    for (ExecutionNode<T> node : nodes) {
      if (!node.joinUninterruptibly(options.stopJoinMillis())) {
        logger.warn("{} did not stop within {}ms", node.id(), options.stopJoinMillis());
      }
    }
  }

  /** Waits, with no time limit, until every node's thread has exited. */
  public void awaitCompletion() throws InterruptedException {
    for (ExecutionNode<T> node : nodes) {
      node.join();
    }
  }

  /** Like {@link #awaitCompletion}, but keeps waiting if the calling thread is interrupted. */
  public void awaitCompletionUninterruptibly() {
    for (ExecutionNode<T> node : nodes) {
      node.joinUninterruptibly();
    }
  }

  /** Returns true while any node's thread is still running. */
  public boolean isAlive() {
    return nodes.stream().anyMatch(ExecutionNode::isAlive);
  }

  @Override
  public String toString() {
    return "Pipeline" + connections;
  }
}
