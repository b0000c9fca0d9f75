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
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ContextCoordinator runs read-modify-write units of work on a session's
 * context while holding the session's {@link DistributedLock}.
 *
 * <p>
 * A unit of work loads the context (creating the default when absent), runs
 * the caller's logic and, only if that logic returns normally, writes the
 * context back. The lock is released on every exit path. Lock exhaustion
 * surfaces as {@link LockNotAcquiredException}; exceptions thrown by the
 * caller's logic propagate unchanged.
 *
 * @param <T>
 *            the context record type
 */
public class ContextCoordinator<T> {

  private static final Logger logger = LoggerFactory.getLogger(ContextCoordinator.class);

  private final ContextStore<T> contexts;
  private final DistributedLock lock;

  /**
   * Creates a ContextCoordinator.
   *
   * @param contexts
   *            the context store
   * @param lock
   *            the session lock, sharing the context store's backend
   */
  public ContextCoordinator(ContextStore<T> contexts, DistributedLock lock) {
    this.contexts = contexts;
    this.lock = lock;
  }

  /**
   * Acquires the session lock and loads the context. The caller must close
   * the returned lease and call {@link ContextLease#save()} to persist changes.
   *
   * @param sessionId
   *            the session id
   * @param defaultContext
   *            supplies the context when none is stored
   * @return the open lease
   * @throws LockNotAcquiredException
   *             if the lock could not be taken
   */
  public ContextLease<T> open(String sessionId, Supplier<? extends T> defaultContext) {
    return open(sessionId, defaultContext, null);
  }

  /**
   * Acquires the session lock and loads the context.
   *
   * @param sessionId
   *            the session id
   * @param defaultContext
   *            supplies the context when none is stored
   * @param ttl
   *            the TTL for writes, or null for the store's default
   * @return the open lease
   * @throws LockNotAcquiredException
   *             if the lock could not be taken
   */
  public ContextLease<T> open(String sessionId, Supplier<? extends T> defaultContext, Duration ttl) {
    LockHandle handle = lock.acquire(sessionId);
    try {
      T context = contexts.getOrCreate(sessionId, defaultContext, ttl);
      return new ContextLease<>(contexts, handle, context, ttl);
    } catch (RuntimeException e) {
      releaseQuietly(handle, e);
      throw e;
    }
  }

  /**
   * Runs {@code work} on the session's context under the lock and persists the
   * context if {@code work} returns normally.
   *
   * @param sessionId
   *            the session id
   * @param defaultContext
   *            supplies the context when none is stored
   * @param work
   *            the unit of work; may mutate the context in place
   * @param <R>
   *            the result type
   * @return the result of {@code work}
   * @throws LockNotAcquiredException
   *             if the lock could not be taken
   */
  public <R> R execute(String sessionId, Supplier<? extends T> defaultContext, Function<? super T, ? extends R> work) {
    return execute(sessionId, defaultContext, null, work);
  }

  /**
   * Runs {@code work} on the session's context under the lock and persists the
   * context with the given TTL if {@code work} returns normally.
   *
   * @param sessionId
   *            the session id
   * @param defaultContext
   *            supplies the context when none is stored
   * @param ttl
   *            the TTL for writes, or null for the store's default
   * @param work
   *            the unit of work; may mutate the context in place
   * @param <R>
   *            the result type
   * @return the result of {@code work}
   * @throws LockNotAcquiredException
   *             if the lock could not be taken
   */
  public <R> R execute(String sessionId, Supplier<? extends T> defaultContext, Duration ttl,
      Function<? super T, ? extends R> work) {
    try (ContextLease<T> lease = open(sessionId, defaultContext, ttl)) {
      R result = work.apply(lease.getContext());
      lease.save();
      return result;
    }
  }

  /**
   * Runs {@code work} on the session's context under the lock and persists it
   * if {@code work} returns normally.
   *
   * @param sessionId
   *            the session id
   * @param defaultContext
   *            supplies the context when none is stored
   * @param work
   *            mutates the context in place
   * @return the persisted context
   */
  public T update(String sessionId, Supplier<? extends T> defaultContext, Consumer<? super T> work) {
    return execute(sessionId, defaultContext, null, context -> {
      work.accept(context);
      return context;
    });
  }

  /**
   * Runs {@code work} without taking the session lock. Two concurrent callers
   * can overwrite each other's changes; only use this when a single writer per
   * session is guaranteed elsewhere.
   *
   * @param sessionId
   *            the session id
   * @param defaultContext
   *            supplies the context when none is stored
   * @param work
   *            the unit of work; may mutate the context in place
   * @param <R>
   *            the result type
   * @return the result of {@code work}
   */
  public <R> R unsafeExecuteWithoutLock(String sessionId, Supplier<? extends T> defaultContext,
      Function<? super T, ? extends R> work) {
    T context = contexts.getOrCreate(sessionId, defaultContext, null);
    R result = work.apply(context);
    contexts.put(sessionId, context);
    return result;
  }

  public ContextStore<T> getContextStore() {
    return contexts;
  }

  public DistributedLock getLock() {
    return lock;
  }

  private static void releaseQuietly(LockHandle handle, RuntimeException failure) {
    try {
      handle.release();
    } catch (RuntimeException releaseFailure) {
      logger.warn("Failed to release lock for session {}", handle.getSessionId(), releaseFailure);
      failure.addSuppressed(releaseFailure);
    }
  }
}
