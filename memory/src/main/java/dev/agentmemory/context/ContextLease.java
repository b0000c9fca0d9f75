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
 * ContextLease gives exclusive access to one session's context while the
 * session lock is held. Changes are persisted by {@link #save()}; closing the
 * lease releases the lock without saving.
 *
 * <pre>{@code
 * try (ContextLease<SupportContext> lease = coordinator.open(sessionId, defaults)) {
 *   lease.getContext().addNote("refund issued");
 *   lease.save();
 * }
 * }</pre>
 *
 * @param <T>
 *            the context record type
 */
public class ContextLease<T> implements AutoCloseable {

  private final ContextStore<T> contexts;
  private final LockHandle lock;
  private final Duration ttl;
  private T context;

  ContextLease(ContextStore<T> contexts, LockHandle lock, T context, Duration ttl) {
    this.contexts = contexts;
    this.lock = lock;
    this.context = context;
    this.ttl = ttl;
  }

  public String getSessionId() {
    return lock.getSessionId();
  }

  /**
   * Returns the context loaded or created when the lease was opened.
   *
   * @return the context
   */
  public T getContext() {
    return context;
  }

  /**
   * Replaces the in-memory context. The store is not touched until
   * {@link #save()}.
   *
   * @param context
   *            the new context
   */
  public void setContext(T context) {
    this.context = context;
  }

  /**
   * Writes the current context to the store.
   *
   * @throws IllegalStateException
   *             if the lease was already closed
   * @throws ContextValidationException
   *             if the context is invalid
   */
  public void save() {
    if (lock.isReleased()) {
      throw new IllegalStateException("Lease for session " + getSessionId() + " is closed");
    }
    contexts.put(getSessionId(), context, ttl);
  }

  public boolean isClosed() {
    return lock.isReleased();
  }

  @Override
  public void close() {
    lock.release();
  }
}
