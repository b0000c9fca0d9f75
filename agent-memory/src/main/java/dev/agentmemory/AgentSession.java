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

package dev.agentmemory;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import dev.agentmemory.session.ConversationLog;

/**
 * AgentSession binds a session id, user id and TTL for the length of one
 * request. It hands the conversation log to the agent loop and keeps the
 * context it loaded so the request can change and save it.
 *
 * <p>
 * The loaded context is not shared with other handles and is not kept in
 * sync with the store; call {@link #refreshContext()} to reload it.
 *
 * @param <T>
 *            the context record type
 */
public class AgentSession<T> {

  private final UnifiedSessionManager<T> manager;
  private final String sessionId;
  private final String userId;
  private final Duration ttl;
  private ConversationLog conversationLog;
  private T context;

  AgentSession(UnifiedSessionManager<T> manager, String sessionId, String userId, Duration ttl) {
    this.manager = manager;
    this.sessionId = sessionId;
    this.userId = userId;
    this.ttl = ttl;
  }

  public String getSessionId() {
    return sessionId;
  }

  public String getUserId() {
    return userId;
  }

  public Duration getTtl() {
    return ttl;
  }

  /**
   * Returns the session's conversation log.
   *
   * @return the conversation log
   */
  public ConversationLog getConversationLog() {
    if (conversationLog == null) {
      conversationLog = manager.conversationLog(sessionId, ttl);
    }
    return conversationLog;
  }

  /**
   * Returns the context, loading or creating it on first use.
   *
   * @return the context
   */
  public T getContext() {
    if (context == null) {
      context = manager.getOrCreateContext(sessionId, userId, ttl);
    }
    return context;
  }

  /**
   * Reloads the context from the store, creating it if it has disappeared.
   *
   * @return the reloaded context
   */
  public T refreshContext() {
    context = manager.getOrCreateContext(sessionId, userId, ttl);
    return context;
  }

  /**
   * Saves the loaded context. Does nothing if no context was loaded.
   */
  public void saveContext() {
    if (context != null) {
      manager.saveContext(sessionId, context, ttl);
    }
  }

  /**
   * Saves {@code replacement} and keeps it as the loaded context.
   *
   * @param replacement
   *            the new context
   */
  public void saveContext(T replacement) {
    manager.saveContext(sessionId, replacement, ttl);
    context = replacement;
  }

  /**
   * Replaces individual fields of the stored context and keeps the result as
   * the loaded context.
   *
   * @param fieldUpdates
   *            new values keyed by serialized field name
   * @return the merged context, empty if the session has none
   */
  public Optional<T> patchContext(Map<String, ?> fieldUpdates) {
    Optional<T> merged = manager.patchContext(sessionId, fieldUpdates, ttl);
    merged.ifPresent(value -> context = value);
    return merged;
  }

  /**
   * Runs {@code work} on the stored context under the session lock. The
   * loaded context is replaced by the one {@code work} saw.
   *
   * @param work
   *            the unit of work
   * @param <R>
   *            the result type
   * @return the result of {@code work}
   */
  public <R> R withContext(Function<? super T, ? extends R> work) {
    return manager.getCoordinator().execute(sessionId, () -> manager.newContext(sessionId, userId), ttl,
        locked -> {
          R result = work.apply(locked);
          context = locked;
          return result;
        });
  }

  public SessionOverview overview() {
    return manager.overview(sessionId);
  }

  /**
   * Deletes the session's log, metadata and context and forgets the loaded
   * context.
   *
   * @return which parts existed
   */
  public SessionDeletion deleteEverything() {
    context = null;
    return manager.deleteEverything(sessionId);
  }
}
