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

package dev.agentmemory.context;

import java.time.Duration;

/**
 * Configuration for a {@link DistributedLock}.
 *
 * <p>
 * A failed first attempt is retried up to {@code retries} times, waiting
 * {@code backoffBase * n} before the n-th retry.
 */
public class LockOptions {

  public static final String DEFAULT_PREFIX = "session_lock";
  public static final Duration DEFAULT_HOLD_TIMEOUT = Duration.ofSeconds(30);
  public static final int DEFAULT_RETRIES = 5;
  public static final Duration DEFAULT_BACKOFF_BASE = Duration.ofMillis(500);

  private final String prefix;
  private final Duration holdTimeout;
  private final int retries;
  private final Duration backoffBase;

  private LockOptions(Builder builder) {
    this.prefix = builder.prefix;
    this.holdTimeout = builder.holdTimeout;
    this.retries = builder.retries;
    this.backoffBase = builder.backoffBase;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static LockOptions defaults() {
    return builder().build();
  }

  public String getPrefix() {
    return prefix;
  }

  /**
   * Returns how long a lock survives if its holder never releases it.
   *
   * @return the lock's own TTL
   */
  public Duration getHoldTimeout() {
    return holdTimeout;
  }

  public int getRetries() {
    return retries;
  }

  public Duration getBackoffBase() {
    return backoffBase;
  }

  /**
   * Returns the wait before the given retry.
   *
   * @param retry
   *            the retry number, starting at 1
   * @return the backoff delay
   */
  public Duration backoffFor(int retry) {
    return backoffBase.multipliedBy(retry);
  }

  /**
   * Builder for LockOptions.
   */
  public static class Builder {
    private String prefix = DEFAULT_PREFIX;
    private Duration holdTimeout = DEFAULT_HOLD_TIMEOUT;
    private int retries = DEFAULT_RETRIES;
    private Duration backoffBase = DEFAULT_BACKOFF_BASE;

    public Builder prefix(String prefix) {
      if (prefix == null || prefix.isEmpty()) {
        throw new IllegalArgumentException("key prefix must not be empty");
      }
      this.prefix = prefix;
      return this;
    }

    public Builder holdTimeout(Duration holdTimeout) {
      if (holdTimeout == null || holdTimeout.isZero() || holdTimeout.isNegative()) {
        throw new IllegalArgumentException("holdTimeout must be positive");
      }
      this.holdTimeout = holdTimeout;
      return this;
    }

    public Builder retries(int retries) {
      if (retries < 0) {
        throw new IllegalArgumentException("retries must not be negative: " + retries);
      }
      this.retries = retries;
      return this;
    }

    public Builder backoffBase(Duration backoffBase) {
      if (backoffBase == null || backoffBase.isNegative()) {
        throw new IllegalArgumentException("backoffBase must not be negative");
      }
      this.backoffBase = backoffBase;
      return this;
    }

    public LockOptions build() {
      return new LockOptions(this);
    }
  }
}
