/*
 * Copyright 2025 Google LLC
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
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package dev.agentmemory.telemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;

/**
 * MemoryTelemetry provides metrics for the session and context stores.
 *
 * <p>
 * This class tracks:
 * <ul>
 * <li>Stored entries that could not be decoded and were skipped</li>
 * <li>Lock acquisition outcomes</li>
 * <li>Time spent waiting for session locks</li>
 * </ul>
 *
 * <p>
 * Metrics go to the globally registered OpenTelemetry instance; without one
 * they are no-ops.
 */
public class MemoryTelemetry {

  private static final Logger logger = LoggerFactory.getLogger(MemoryTelemetry.class);
  private static final String METER_NAME = "agent_memory";

  private static final String METRIC_CORRUPT_ENTRIES = "agent_memory/store/corrupt_entries";
  private static final String METRIC_LOCK_ACQUISITIONS = "agent_memory/lock/acquisitions";
  private static final String METRIC_LOCK_WAIT = "agent_memory/lock/wait";

  /** Lock was taken on the first attempt. */
  public static final String LOCK_ACQUIRED = "acquired";
  /** Lock was taken after at least one retry. */
  public static final String LOCK_CONTENDED = "contended";
  /** Every attempt failed. */
  public static final String LOCK_EXHAUSTED = "exhausted";

  private final LongCounter corruptEntryCounter;
  private final LongCounter lockAcquisitionCounter;
  private final LongHistogram lockWaitHistogram;

  private static MemoryTelemetry instance;

  /**
   * Gets the singleton instance of MemoryTelemetry.
   *
   * @return the MemoryTelemetry instance
   */
  public static synchronized MemoryTelemetry getInstance() {
    if (instance == null) {
      instance = new MemoryTelemetry();
    }
    return instance;
  }

  private MemoryTelemetry() {
    Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

    corruptEntryCounter = meter.counterBuilder(METRIC_CORRUPT_ENTRIES)
        .setDescription("Counts stored entries skipped because they could not be decoded.").setUnit("1").build();

    lockAcquisitionCounter = meter.counterBuilder(METRIC_LOCK_ACQUISITIONS)
        .setDescription("Counts session lock acquisition attempts by outcome.").setUnit("1").build();

    lockWaitHistogram = meter.histogramBuilder(METRIC_LOCK_WAIT)
        .setDescription("Time spent waiting for a session lock.").setUnit("ms").ofLongs().build();

    logger.debug("MemoryTelemetry initialized with OpenTelemetry metrics");
  }

  /**
   * Records a stored entry that could not be decoded.
   *
   * @param family
   *            the key family, e.g. {@code messages} or {@code context}
   */
  public void recordCorruptEntry(String family) {
    corruptEntryCounter.add(1, Attributes.builder().put("family", family).build());
  }

  /**
   * Records the outcome of a lock acquisition.
   *
   * @param status
   *            one of {@link #LOCK_ACQUIRED}, {@link #LOCK_CONTENDED} or
   *            {@link #LOCK_EXHAUSTED}
   * @param attempts
   *            the number of attempts made
   * @param waitMs
   *            the time spent from the first attempt to the outcome
   */
  public void recordLockAcquisition(String status, int attempts, long waitMs) {
    Attributes attrs = Attributes.builder().put("status", status).build();
    lockAcquisitionCounter.add(1, attrs);
    lockWaitHistogram.record(waitMs, attrs.toBuilder().put("attempts", attempts).build());
  }
}
