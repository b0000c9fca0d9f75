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
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.agentmemory.core.store.KeyValueStore;
import dev.agentmemory.core.store.StoreKeys;
import dev.agentmemory.telemetry.MemoryTelemetry;

/**
 * DistributedLock grants exclusive per-session access across processes that
 * share a {@link KeyValueStore}.
 *
 * <p>
 * A lock is the key {@code <prefix>:<id>}, created only if absent and with its
 * own expiry so that a crashed holder cannot block a session for longer than
 * the hold timeout. Each acquisition writes a random token; release deletes
 * the key only while it still holds that token.
 *
 * <p>
 * Acquisition retries with linear backoff and then fails with
 * {@link LockNotAcquiredException}.
 */
public class DistributedLock {

  private static final Logger logger = LoggerFactory.getLogger(DistributedLock.class);

  /** Waits between acquisition attempts. */
  @FunctionalInterface
  interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }

  private static final Sleeper THREAD_SLEEPER = duration -> Thread.sleep(duration.toMillis());

  private final KeyValueStore store;
  private final LockOptions options;
  private final Sleeper sleeper;

  /**
   * Creates a DistributedLock with default options.
   *
   * @param store
   *            the backing store
   */
  public DistributedLock(KeyValueStore store) {
    this(store, LockOptions.defaults());
  }

  /**
   * Creates a DistributedLock.
   *
   * @param store
   *            the backing store
   * @param options
   *            prefix, hold timeout and retry policy
   */
  public DistributedLock(KeyValueStore store, LockOptions options) {
    this(store, options, THREAD_SLEEPER);
  }

  DistributedLock(KeyValueStore store, LockOptions options, Sleeper sleeper) {
    this.store = store;
    this.options = options;
    this.sleeper = sleeper;
  }

  /**
   * Acquires the lock of a session, retrying with linear backoff.
   *
   * @param sessionId
   *            the session id
   * @return the held lock, to be closed by the caller
   * @throws LockNotAcquiredException
   *             if every attempt failed or the thread was interrupted while
   *             waiting
   */
  public LockHandle acquire(String sessionId) throws LockNotAcquiredException {
    String key = lockKey(sessionId);
    String token = UUID.randomUUID().toString();
    long startNanos = System.nanoTime();

    int attempts = 1;
    boolean acquired = store.setIfAbsent(key, token, options.getHoldTimeout());
    while (!acquired && attempts <= options.getRetries()) {
      Duration delay = options.backoffFor(attempts);
      logger.debug("Lock for session {} is held, retrying in {} ms", sessionId, delay.toMillis());
      try {
        sleeper.sleep(delay);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        MemoryTelemetry.getInstance().recordLockAcquisition(MemoryTelemetry.LOCK_EXHAUSTED, attempts,
            elapsedMillis(startNanos));
        throw new LockNotAcquiredException(sessionId, attempts, e);
      }
      attempts++;
      acquired = store.setIfAbsent(key, token, options.getHoldTimeout());
    }

    long waitMs = elapsedMillis(startNanos);
    if (!acquired) {
      logger.warn("Giving up on lock for session {} after {} attempts ({} ms)", sessionId, attempts, waitMs);
      MemoryTelemetry.getInstance().recordLockAcquisition(MemoryTelemetry.LOCK_EXHAUSTED, attempts, waitMs);
      throw new LockNotAcquiredException(sessionId, attempts);
    }

    MemoryTelemetry.getInstance().recordLockAcquisition(
        attempts == 1 ? MemoryTelemetry.LOCK_ACQUIRED : MemoryTelemetry.LOCK_CONTENDED, attempts, waitMs);
    logger.debug("Acquired lock for session {} after {} attempts", sessionId, attempts);
    return new LockHandle(store, sessionId, key, token);
  }

  /**
   * Makes a single attempt to acquire the lock of a session.
   *
   * @param sessionId
   *            the session id
   * @return the held lock, or empty if another holder has it
   */
  public Optional<LockHandle> tryAcquire(String sessionId) {
    String key = lockKey(sessionId);
    String token = UUID.randomUUID().toString();
    if (store.setIfAbsent(key, token, options.getHoldTimeout())) {
      return Optional.of(new LockHandle(store, sessionId, key, token));
    }
    return Optional.empty();
  }

  /**
   * Returns whether anyone currently holds the lock of a session.
   *
   * @param sessionId
   *            the session id
   * @return true if the lock key exists
   */
  public boolean isLocked(String sessionId) {
    return store.exists(lockKey(sessionId));
  }

  public LockOptions getOptions() {
    return options;
  }

  private String lockKey(String sessionId) {
    return StoreKeys.key(options.getPrefix(), sessionId);
  }

  private static long elapsedMillis(long startNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }
}
