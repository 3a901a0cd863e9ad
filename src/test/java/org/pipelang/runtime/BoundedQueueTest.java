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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.pipelang.runtime.BoundedQueue.ClosedException;
import org.pipelang.runtime.BoundedQueue.TimeoutException;

@RunWith(JUnit4.class)
public class BoundedQueueTest {

  @Test
  public void fifo() throws Exception {
    BoundedQueue<String> queue = new BoundedQueue<>(3);
    queue.put("a", 10, TimeUnit.MILLISECONDS);
    queue.put("b", 10, TimeUnit.MILLISECONDS);
    queue.put("c", 10, TimeUnit.MILLISECONDS);
    assertThat(queue.size()).isEqualTo(3);
    assertThat(queue.get(10, TimeUnit.MILLISECONDS)).isEqualTo("a");
    assertThat(queue.get(10, TimeUnit.MILLISECONDS)).isEqualTo("b");
    assertThat(queue.get(10, TimeUnit.MILLISECONDS)).isEqualTo("c");
    assertThat(queue.size()).isEqualTo(0);
  }

  @Test
  public void putTimesOutWhenFull() throws Exception {
    BoundedQueue<String> queue = new BoundedQueue<>(1);
    queue.put("a", 10, TimeUnit.MILLISECONDS);
    assertThrows(TimeoutException.class, () -> queue.put("b", 20, TimeUnit.MILLISECONDS));
    assertThat(queue.offer("b", 20, TimeUnit.MILLISECONDS)).isFalse();
    assertThat(queue.size()).isEqualTo(1);
  }

  @Test
  public void getTimesOutWhenEmpty() {
    BoundedQueue<String> queue = new BoundedQueue<>(1);
    assertThrows(TimeoutException.class, () -> queue.get(20, TimeUnit.MILLISECONDS));
  }

  @Test
  public void closedQueueDrainsThenReturnsNull() throws Exception {
    BoundedQueue<String> queue = new BoundedQueue<>(2);
    queue.put("a", 10, TimeUnit.MILLISECONDS);
    queue.close();
    assertThat(queue.isClosed()).isTrue();
    assertThat(queue.get(10, TimeUnit.MILLISECONDS)).isEqualTo("a");
    assertThat(queue.get(10, TimeUnit.MILLISECONDS)).isNull();
    assertThat(queue.get(10, TimeUnit.MILLISECONDS)).isNull();
  }

  @Test
  public void putAfterClose() {
    BoundedQueue<String> queue = new BoundedQueue<>(2);
    queue.close();
    queue.close();
    assertThrows(ClosedException.class, () -> queue.put("a", 10, TimeUnit.MILLISECONDS));
  }

  @Test
  public void nullIsNotAnItem() {
    BoundedQueue<String> queue = new BoundedQueue<>(2);
    assertThrows(NullPointerException.class, () -> queue.put(null, 10, TimeUnit.MILLISECONDS));
  }

  @Test
  public void capacityMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> new BoundedQueue<String>(0));
  }

  @Test
  public void closeWakesBlockedGet() throws Exception {
    BoundedQueue<String> queue = new BoundedQueue<>(1);
    AtomicReference<Object> result = new AtomicReference<>("unset");
    CountDownLatch done = new CountDownLatch(1);
    Thread consumer =
        new Thread(
            () -> {
              try {
                result.set(queue.get(10, TimeUnit.SECONDS));
              } catch (Exception e) {
                result.set(e);
              }
              done.countDown();
            });
    consumer.start();
    Thread.sleep(50);
    queue.close();
    assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
    assertThat(result.get()).isNull();
  }

  @Test
  public void closeWakesBlockedPut() throws Exception {
    BoundedQueue<String> queue = new BoundedQueue<>(1);
    queue.put("a", 10, TimeUnit.MILLISECONDS);
    AtomicReference<Object> result = new AtomicReference<>();
    CountDownLatch done = new CountDownLatch(1);
    Thread producer =
        new Thread(
            () -> {
              try {
                queue.put("b", 10, TimeUnit.SECONDS);
                result.set("added");
              } catch (Exception e) {
                result.set(e);
              }
              done.countDown();
            });
    producer.start();
    Thread.sleep(50);
    queue.close();
    assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
    assertThat(result.get()).isInstanceOf(ClosedException.class);
  }

  @Test
  public void getMakesRoomForBlockedPut() throws Exception {
    BoundedQueue<Integer> queue = new BoundedQueue<>(1);
    Thread producer =
        new Thread(
            () -> {
              try {
                for (int i = 0; i < 5; i++) {
                  queue.put(i, 10, TimeUnit.SECONDS);
                }
                queue.close();
              } catch (Exception e) {
                throw new AssertionError(e);
              }
            });
    producer.start();
    for (int i = 0; i < 5; i++) {
      assertThat(queue.get(10, TimeUnit.SECONDS)).isEqualTo(i);
    }
    assertThat(queue.get(10, TimeUnit.SECONDS)).isNull();
    producer.join();
  }

  @Test
  public void toStringShowsState() throws Exception {
    BoundedQueue<String> queue = new BoundedQueue<>(4);
    queue.put("a", 10, TimeUnit.MILLISECONDS);
    assertThat(queue.toString()).isEqualTo("BoundedQueue(1/4)");
    queue.close();
    assertThat(queue.toString()).isEqualTo("BoundedQueue(1/4, closed)");
  }
}
