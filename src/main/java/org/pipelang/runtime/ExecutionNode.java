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
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.Uninterruptibles;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jspecify.annotations.Nullable;
import org.pipelang.Dataflow.Copier;
import org.pipelang.Dataflow.Role;
import org.pipelang.Dataflow.Stage;
import org.pipelang.runtime.BoundedQueue.ClosedException;
import org.pipelang.runtime.BoundedQueue.TimeoutException;

/**
 * One vertex of a compiled pipeline: a Stage bound to its parameters, the queues it reads from and
 * writes to, and the thread that runs it.
 *
 * <p>The loop run by the thread depends on the stage's role:
 *
 * <ul>
 *   <li>A SOURCE calls its function until it returns null or the node is stopped, forwarding each
 *       result.
 *   <li>A PROCESSOR reads its inputs until end of stream, forwarding each non-null result of its
 *       function (a null result drops the item).
 *   <li>A SINK reads its inputs until end of stream; if its function returns {@code false} the node
 *       stops itself.
 * </ul>
 *
 * <p>However the loop exits (end of stream, a stop request, or an exception from the stage) every
 * output queue is closed exactly once, so that shutdown always propagates downstream. Input queues
 * are closed too, so that a producer blocked on a full queue is released; a node whose outputs have
 * all been closed by their consumers stops. Exceptions are logged and recorded (see {@link
 * #failure}) but never propagate beyond the node.
 */
public final class ExecutionNode<T> {

  private static final Logger logger = LogManager.getLogger(ExecutionNode.class);

  private final String id;
  private final Stage<T> stage;
  private final ImmutableMap<String, Object> params;
  private final Copier<T> copier;
  private final long pollTimeoutMillis;

  /** Inbound queues, in the order they were connected. Only modified before {@link #start}. */
  private final List<BoundedQueue<T>> inputs = new ArrayList<>();

  /** Outbound queues, in the order they were connected. Only modified before {@link #start}. */
  private final List<BoundedQueue<T>> outputs = new ArrayList<>();

  /** The inputs that have not yet returned end of stream; only accessed by the node's thread. */
  private List<BoundedQueue<T>> openInputs;

  /** The outputs whose consumers are still reading; only accessed by the node's thread. */
  private List<BoundedQueue<T>> openOutputs;

  /** Where the next fan-in read starts; only accessed by the node's thread. */
  private int nextInput;

  private volatile boolean running;
  private volatile @Nullable Thread thread;
  private volatile @Nullable Exception failure;

  ExecutionNode(
      String id,
      Stage<T> stage,
      ImmutableMap<String, Object> params,
      Copier<T> copier,
      long pollTimeoutMillis) {
    this.id = id;
    this.stage = stage;
    this.params = params;
    this.copier = copier;
    this.pollTimeoutMillis = pollTimeoutMillis;
  }

  /** A unique (within its Pipeline) identifier, {@code stageName_n}. */
  public String id() {
    return id;
  }

  public Stage<T> stage() {
    return stage;
  }

  public Role role() {
    return stage.role();
  }

  public ImmutableMap<String, Object> params() {
    return params;
  }

  public ImmutableList<BoundedQueue<T>> inputs() {
    return ImmutableList.copyOf(inputs);
  }

  public ImmutableList<BoundedQueue<T>> outputs() {
    return ImmutableList.copyOf(outputs);
  }

  /** True from {@link #start} until the node's loop exits or {@link #requestStop} is called. */
  public boolean isRunning() {
    return running;
  }

  /** Returns true if this node's thread has been started and has not yet exited. */
  public boolean isAlive() {
    Thread t = thread;
    return t != null && t.isAlive();
  }

  /** The exception that terminated this node's loop, or null if there was none. */
  public @Nullable Exception failure() {
    return failure;
  }

  void addInput(BoundedQueue<T> queue) {
    Preconditions.checkState(thread == null, "Cannot connect a started node");
    inputs.add(queue);
  }

  void addOutput(BoundedQueue<T> queue) {
    Preconditions.checkState(thread == null, "Cannot connect a started node");
    outputs.add(queue);
  }

  /** Starts this node's thread; a node can only be started once. */
  void start() {
    Preconditions.checkState(thread == null, "%s already started", id);
    // Set before the thread starts so that a stop request can never be lost.
    running = true;
    Thread t = new Thread(this::run, "node-" + id);
    t.setDaemon(true);
    thread = t;
    t.start();
  }

  /** Asks the node to stop; it will notice at its next loop iteration or queue timeout. */
  void requestStop() {
    running = false;
  }

  /**
   * Waits up to {@code millis} for this node's thread to exit, even if interrupted; returns true if
   * it has exited (or was never started).
   */
  boolean joinUninterruptibly(long millis) {
    Thread t = thread;
    if (t == null) {
      return true;
    }
    Uninterruptibles.joinUninterruptibly(t, millis, TimeUnit.MILLISECONDS);
    return !t.isAlive();
  }

  /** Waits with no time limit for this node's thread to exit. */
  void join() throws InterruptedException {
    Thread t = thread;
    if (t != null) {
      t.join();
    }
  }

  /** Like {@link #join()}, but keeps waiting if the calling thread is interrupted. */
  void joinUninterruptibly() {
    Thread t = thread;
    if (t != null) {
      Uninterruptibles.joinUninterruptibly(t);
    }
  }

  /** The body of this node's thread. */
  void run() {
    openInputs = new ArrayList<>(inputs);
    openOutputs = new ArrayList<>(outputs);
    logger.debug("{} started ({}, {} in, {} out)", id, role(), inputs.size(), outputs.size());
    try {
      switch (role()) {
        case SOURCE -> runSource();
        case PROCESSOR -> runProcessor();
        case SINK -> runSink();
      }
    } catch (InterruptedException e) {
      logger.debug("{} interrupted", id);
      Thread.currentThread().interrupt();
    } catch (Exception e) {
      failure = e;
      logger.error("Error in node {}", id, e);
    } finally {
      running = false;
      for (BoundedQueue<T> queue : outputs) {
        queue.close();
      }
      for (BoundedQueue<T> queue : inputs) {
        queue.close();
      }
      logger.debug("{} exited", id);
    }
  }

  private void runSource() throws Exception {
    while (running) {
      T item = stage.asSource().produce(params);
      if (item == null) {
        break;
      }
      forward(item);
    }
  }

  private void runProcessor() throws Exception {
    while (running) {
      T item;
      try {
        item = nextInput();
      } catch (TimeoutException e) {
        continue;
      }
      if (item == null) {
        break;
      }
      T result = stage.asProcessor().process(item, params);
      if (result != null) {
        forward(result);
      }
    }
  }

  private void runSink() throws Exception {
    while (running) {
      T item;
      try {
        item = nextInput();
      } catch (TimeoutException e) {
        continue;
      }
      if (item == null) {
        break;
      }
      Boolean result = stage.asSink().consume(item, params);
      if (Boolean.FALSE.equals(result)) {
        logger.info("{} requested stop", id);
        running = false;
      }
    }
  }

  /**
   * Returns the next input item, or null once every input has reached end of stream (a node with no
   * inputs is immediately at end of stream). With more than one input, the inputs are read in
   * rotation so that none of them is starved.
   *
   * @throws TimeoutException if nothing arrived within the poll timeout
   */
  private @Nullable T nextInput() throws TimeoutException, InterruptedException {
    if (openInputs.size() == 1) {
      T item = openInputs.get(0).get(pollTimeoutMillis, TimeUnit.MILLISECONDS);
      if (item == null) {
        openInputs.clear();
      }
      return item;
    }
    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(pollTimeoutMillis);
    while (!openInputs.isEmpty()) {
      long slice = Math.max(1, pollTimeoutMillis / (4L * openInputs.size()));
      nextInput %= openInputs.size();
      BoundedQueue<T> queue = openInputs.get(nextInput);
      try {
        T item = queue.get(slice, TimeUnit.MILLISECONDS);
        if (item != null) {
          nextInput++;
          return item;
        }
        openInputs.remove(nextInput);
      } catch (TimeoutException e) {
        nextInput++;
        if (System.nanoTime() - deadline > 0) {
          throw e;
        }
      }
    }
    return null;
  }

  /**
   * Sends {@code item} to every open output, copying it for each if there is more than one. A full
   * output blocks this node until there is room or the node is stopped.
   */
  private void forward(T item) throws InterruptedException {
    if (openOutputs.size() == 1) {
      send(openOutputs.get(0), item);
    } else {
      for (BoundedQueue<T> queue : ImmutableList.copyOf(openOutputs)) {
        send(queue, copier.copy(item));
      }
    }
  }

  private void send(BoundedQueue<T> queue, T item) throws InterruptedException {
    try {
      boolean sent = false;
      while (!sent && running) {
        sent = queue.offer(item, pollTimeoutMillis, TimeUnit.MILLISECONDS);
      }
    } catch (ClosedException e) {
      // The consumer has exited.
      openOutputs.remove(queue);
      if (openOutputs.isEmpty()) {
        logger.debug("{} has no remaining consumers", id);
        running = false;
      }
    }
  }

  @Override
  public String toString() {
    return id;
  }
}
