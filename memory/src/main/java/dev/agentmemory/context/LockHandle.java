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

import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.agentmemory.core.store.KeyValueStore;

/**
 * A held session lock. Closing it releases the lock; further closes do
 * nothing.
 */
public final class LockHandle implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(LockHandle.class);

  private final KeyValueStore store;
  private final String sessionId;
  private final String key;
  private final String token;
  private final AtomicBoolean released = new AtomicBoolean(false);

  LockHandle(KeyValueStore store, String sessionId, String key, String token) {
    this.store = store;
    this.sessionId = sessionId;
    this.key = key;
    this.token = token;
  }

  public String getSessionId() {
    return sessionId;
  }

  String getToken() {
    return token;
  }

  /**
   * Releases the lock if this handle still owns it. A lock that expired and
   * was taken by someone else is left alone.
   *
   * @return true if the lock key was deleted by this call
   */
  public boolean release() {
    if (!released.compareAndSet(false, true)) {
      return false;
    }
    boolean deleted = store.compareAndDelete(key, token);
    if (!deleted) {
      logger.warn("Lock for session {} expired before it was released", sessionId);
    }
    return deleted;
  }

  public boolean isReleased() {
    return released.get();
  }

  @Override
  public void close() {
    release();
  }
}
