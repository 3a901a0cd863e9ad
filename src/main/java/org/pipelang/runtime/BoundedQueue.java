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
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.util.ArrayDeque;
import java.util.concurrent.TimeUnit;
import org.jspecify.annotations.Nullable;

/**
 * A bounded FIFO channel from one producer node to one consumer node, which can be closed by the
 * producer to signal end of stream.
 *
 * <p>Once closed a BoundedQueue accepts no more items, but the consumer still receives every item
 * that was queued before the close. After the last of those, {@link #get} returns null (the
 * terminal marker) on every call. Null is therefore never a valid item.
 */
public final class BoundedQueue<T> {

  /** Thrown when {@link #put} or {@link #get} cannot complete before its deadline. */
  public static final class TimeoutException extends Exception {
    TimeoutException(String msg) {
      super(msg);
    }
  }

  /** Thrown when {@link #put} is called on (or is waiting on) a closed queue. */
  public static final class ClosedException extends Exception {
    ClosedException() {
      super("Queue is closed");
    }
  }

  private final int capacity;

  @GuardedBy("this")
  private final ArrayDeque<T> items;

  @GuardedBy("this")
  private boolean closed;

  public BoundedQueue(int capacity) {
    Preconditions.checkArgument(capacity > 0, "capacity must be positive: %s", capacity);
    this.capacity = capacity;
    this.items = new ArrayDeque<>(capacity);
  }

  public int capacity() {
    return capacity;
  }

  /**
   * Appends {@code item}, waiting while the queue is full.
   *
   * @throws TimeoutException if there is still no room after {@code timeout}
   * @throws ClosedException if the queue is closed before the item could be added
   */
  public void put(T item, long timeout, TimeUnit unit)
      throws TimeoutException, ClosedException, InterruptedException {
    if (!offer(item, timeout, unit)) {
      throw new TimeoutException("Queue put timed out");
    }
  }

  /**
   * Like {@link #put}, but returns false instead of throwing TimeoutException.
   *
   * @throws ClosedException if the queue is closed before the item could be added
   */
  public synchronized boolean offer(T item, long timeout, TimeUnit unit)
      throws ClosedException, InterruptedException {
    Preconditions.checkNotNull(item);
    long deadline = System.nanoTime() + unit.toNanos(timeout);
    for (; ; ) {
      if (closed) {
        throw new ClosedException();
      }
      if (items.size() < capacity) {
        break;
      }
      long remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        return false;
      }
      TimeUnit.NANOSECONDS.timedWait(this, remaining);
    }
    items.addLast(item);
    notifyAll();
    return true;
  }

  /**
   * Removes and returns the oldest item, waiting while the queue is empty and open. Returns null if
   * the queue is closed and has been drained.
   *
   * @throws TimeoutException if the queue is still empty and open after {@code timeout}
   */
  public synchronized @Nullable T get(long timeout, TimeUnit unit)
      throws TimeoutException, InterruptedException {
    long deadline = System.nanoTime() + unit.toNanos(timeout);
    while (items.isEmpty()) {
      if (closed) {
        return null;
      }
      long remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        throw new TimeoutException("Queue get timed out");
      }
      TimeUnit.NANOSECONDS.timedWait(this, remaining);
    }
    T result = items.removeFirst();
    notifyAll();
    return result;
  }

  /** Closes this queue and wakes every waiting thread. Closing a closed queue does nothing. */
  public synchronized void close() {
    if (!closed) {
      closed = true;
      notifyAll();
    }
  }

  public synchronized boolean isClosed() {
    return closed;
  }

  /** Returns the number of items currently queued. */
  public synchronized int size() {
    return items.size();
  }

  @Override
  public synchronized String toString() {
    return String.format("BoundedQueue(%s/%s%s)", items.size(), capacity, closed ? ", closed" : "");
  }
}
