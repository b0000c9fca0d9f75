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

package dev.agentmemory.session;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * ConversationLog is the conversation history of a single session, as handed
 * to an agent loop for one run. It holds no state of its own: every call goes
 * to the {@link ConversationLogStore} that created it.
 */
public class ConversationLog {

  private final ConversationLogStore store;
  private final String sessionId;
  private final Duration ttl;

  ConversationLog(ConversationLogStore store, String sessionId, Duration ttl) {
    if (sessionId == null || sessionId.isEmpty()) {
      throw new IllegalArgumentException("sessionId must not be empty");
    }
    this.store = store;
    this.sessionId = sessionId;
    this.ttl = ttl;
  }

  /**
   * Gets the session ID.
   *
   * @return the session id
   */
  public String getSessionId() {
    return sessionId;
  }

  /**
   * Gets the time-to-live override applied to writes.
   *
   * @return the TTL override, or null when the store's expiries apply
   */
  public Duration getTtl() {
    return ttl;
  }

  /**
   * Appends items to the log.
   *
   * @param items
   *            the items, oldest first
   * @see ConversationLogStore#append(String, List)
   */
  public void append(List<? extends Map<String, ?>> items) {
    store.append(sessionId, items, ttl);
  }

  /**
   * Reads the whole log.
   *
   * @return the items, oldest first
   */
  public List<Map<String, Object>> read() {
    return store.read(sessionId);
  }

  /**
   * Reads the latest {@code limit} items.
   *
   * @param limit
   *            the size of the recency window
   * @return the items, oldest first
   */
  public List<Map<String, Object>> read(int limit) {
    return store.read(sessionId, limit);
  }

  /**
   * Removes and returns the most recent item.
   *
   * @return the item, if one was removed and decoded
   */
  public Optional<Map<String, Object>> popLast() {
    return popLastEntry().getItem();
  }

  /**
   * Removes the most recent item and reports what was removed.
   *
   * @return the outcome
   */
  public PoppedItem popLastEntry() {
    return store.popLastEntry(sessionId, ttl);
  }

  /**
   * Refreshes the metadata timestamp and expiries.
   */
  public void touch() {
    store.touch(sessionId, ttl);
  }

  /**
   * Deletes the log and its metadata.
   */
  public void clear() {
    store.clear(sessionId);
  }

  /**
   * Returns the number of stored entries.
   *
   * @return the physical length of the log
   */
  public long size() {
    return store.size(sessionId);
  }

  /**
   * Reads the session metadata.
   *
   * @return the metadata, empty if never created or expired
   */
  public Optional<SessionMetadata> getSessionInfo() {
    return store.getSessionInfo(sessionId);
  }
}
