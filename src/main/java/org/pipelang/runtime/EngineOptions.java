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
import com.google.common.primitives.Ints;
import java.util.Properties;

/**
 * Tuning for compiled pipelines.
 *
 * @param queueCapacity the capacity of every queue created by the compiler
 * @param pollTimeoutMillis how long a node waits on a queue before re-checking whether it has been
 *     asked to stop
 * @param stopJoinMillis how long {@link Pipeline#stop} waits for each node's thread to exit
 * @param pumpIntervalMillis how often {@link PipelineRuntime#execute} checks on the pipeline and
 *     calls the pump
 */
public record EngineOptions(
    int queueCapacity, long pollTimeoutMillis, long stopJoinMillis, long pumpIntervalMillis) {

  static final String PREFIX = "pipelang.";

  private static final EngineOptions DEFAULTS = new EngineOptions(10, 1000, 2000, 100);

  public EngineOptions {
    Preconditions.checkArgument(queueCapacity > 0, "queueCapacity must be positive");
    Preconditions.checkArgument(pollTimeoutMillis > 0, "pollTimeoutMillis must be positive");
    Preconditions.checkArgument(stopJoinMillis > 0, "stopJoinMillis must be positive");
    Preconditions.checkArgument(pumpIntervalMillis > 0, "pumpIntervalMillis must be positive");
  }

  public static EngineOptions defaults() {
    return DEFAULTS;
  }

  /**
   * Returns the defaults, overridden by any of {@code pipelang.queueCapacity}, {@code
   * pipelang.pollTimeoutMillis}, {@code pipelang.stopJoinMillis} and {@code
   * pipelang.pumpIntervalMillis} that are set as system properties.
   */
  public static EngineOptions fromSystemProperties() {
    return fromProperties(System.getProperties());
  }

  /** Like {@link #fromSystemProperties}, but reads the given Properties. */
  public static EngineOptions fromProperties(Properties props) {
    return new EngineOptions(
        Ints.checkedCast(longProperty(props, "queueCapacity", DEFAULTS.queueCapacity)),
        longProperty(props, "pollTimeoutMillis", DEFAULTS.pollTimeoutMillis),
        longProperty(props, "stopJoinMillis", DEFAULTS.stopJoinMillis),
        longProperty(props, "pumpIntervalMillis", DEFAULTS.pumpIntervalMillis));
  }

  private static long longProperty(Properties props, String name, long defaultValue) {
    String value = props.getProperty(PREFIX + name);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          String.format("Bad value for %s%s: '%s'", PREFIX, name, value), e);
    }
  }

  public EngineOptions withQueueCapacity(int queueCapacity) {
    return new EngineOptions(queueCapacity, pollTimeoutMillis, stopJoinMillis, pumpIntervalMillis);
  }

  public EngineOptions withPollTimeoutMillis(long pollTimeoutMillis) {
    return new EngineOptions(queueCapacity, pollTimeoutMillis, stopJoinMillis, pumpIntervalMillis);
  }

  public EngineOptions withStopJoinMillis(long stopJoinMillis) {
    return new EngineOptions(queueCapacity, pollTimeoutMillis, stopJoinMillis, pumpIntervalMillis);
  }

  public EngineOptions withPumpIntervalMillis(long pumpIntervalMillis) {
    return new EngineOptions(queueCapacity, pollTimeoutMillis, stopJoinMillis, pumpIntervalMillis);
  }
}
