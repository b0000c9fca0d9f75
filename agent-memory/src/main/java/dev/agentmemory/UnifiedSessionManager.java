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
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.agentmemory.context.ContextCodec;
import dev.agentmemory.context.ContextCoordinator;
import dev.agentmemory.context.ContextFactory;
import dev.agentmemory.context.ContextStore;
import dev.agentmemory.context.DistributedLock;
import dev.agentmemory.context.JsonContextCodec;
import dev.agentmemory.core.store.KeyValueStore;
import dev.agentmemory.session.ConversationLog;
import dev.agentmemory.session.ConversationLogStore;
import dev.agentmemory.session.SessionMetadata;

/**
 * UnifiedSessionManager is the main entry point for agent memory. It manages
 * the conversation log and the typed context of every session on one shared
 * {@link KeyValueStore}.
 *
 * <p>
 * The convenience methods here do not lock. Use
 * {@link #withContext(String, String, Function)} or {@link #getCoordinator()}
 * when several workers may change the same session's context at once.
 *
 * <pre>{@code
 * UnifiedSessionManager<SupportContext> memory = UnifiedSessionManager.builder(SupportContext.class)
 *     .store(new RedisKeyValueStore(RedisStoreOptions.builder().build()))
 *     .contextFactory((sessionId, userId) -> new SupportContext(sessionId, userId, CustomerTier.STANDARD))
 *     .build();
 * }</pre>
 *
 * @param <T>
 *            the context record type
 */
public class UnifiedSessionManager<T> implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(UnifiedSessionManager.class);

  private final KeyValueStore store;
  private final AgentMemoryOptions options;
  private final ConversationLogStore conversations;
  private final ContextStore<T> contexts;
  private final ContextCoordinator<T> coordinator;
  private final ContextFactory<T> contextFactory;
  private final Function<? super T, Map<String, Object>> summarizer;

  private UnifiedSessionManager(Builder<T> builder) {
    this.store = builder.store;
    this.options = builder.options;
    this.contextFactory = builder.contextFactory;
    this.conversations = new ConversationLogStore(store, options.toConversationLogOptions());
    this.contexts = new ContextStore<>(store, builder.codec, options.toContextStoreOptions());
    this.coordinator = new ContextCoordinator<>(contexts, new DistributedLock(store, options.toLockOptions()));
    this.summarizer = builder.summarizer != null ? builder.summarizer : builder.codec::toMap;
    logger.info("Agent memory initialized (context ttl: {})", options.getContextTtl());
  }

  /**
   * Creates a builder whose records are stored as JSON and validated against a
   * schema inferred from {@code contextClass}.
   *
   * @param contextClass
   *            the context record class
   * @param <T>
   *            the context record type
   * @return a new builder
   */
  public static <T> Builder<T> builder(Class<T> contextClass) {
    return new Builder<>(JsonContextCodec.of(contextClass));
  }

  /**
   * Creates a builder using a custom codec.
   *
   * @param codec
   *            the context codec
   * @param <T>
   *            the context record type
   * @return a new builder
   */
  public static <T> Builder<T> builder(ContextCodec<T> codec) {
    return new Builder<>(codec);
  }

  /**
   * Returns the conversation log of a session.
   *
   * @param sessionId
   *            the session id
   * @return the conversation log
   */
  public ConversationLog conversationLog(String sessionId) {
    return conversations.session(sessionId);
  }

  /**
   * Returns the conversation log of a session with a TTL override.
   *
   * @param sessionId
   *            the session id
   * @param ttl
   *            the TTL for writes, or null for the configured expiries
   * @return the conversation log
   */
  public ConversationLog conversationLog(String sessionId, Duration ttl) {
    return conversations.session(sessionId, ttl);
  }

  /**
   * Reads a session's context.
   *
   * @param sessionId
   *            the session id
   * @return the context, empty if missing, expired or undecodable
   */
  public Optional<T> getContext(String sessionId) {
    return contexts.get(sessionId);
  }

  /**
   * Returns the session's context, creating it from the context factory when
   * absent. An existing context has its expiry refreshed.
   *
   * <p>
   * This is not atomic: two first-time callers may each store their own
   * default and the later write wins.
   *
   * @param sessionId
   *            the session id
   * @param userId
   *            the user id passed to the context factory
   * @return the context
   */
  public T getOrCreateContext(String sessionId, String userId) {
    return getOrCreateContext(sessionId, userId, null);
  }

  /**
   * Returns the session's context, creating it from the context factory when
   * absent. An existing context has its expiry refreshed.
   *
   * @param sessionId
   *            the session id
   * @param userId
   *            the user id passed to the context factory
   * @param ttl
   *            the TTL, or null for the configured one
   * @return the context
   */
  public T getOrCreateContext(String sessionId, String userId, Duration ttl) {
    Optional<T> existing = contexts.get(sessionId);
    if (existing.isPresent()) {
      contexts.extendTtl(sessionId, ttl);
      return existing.get();
    }
    T created = newContext(sessionId, userId);
    contexts.put(sessionId, created, ttl);
    return created;
  }

  public void saveContext(String sessionId, T context) {
    contexts.put(sessionId, context);
  }

  /**
   * Writes a session's context, replacing any previous one.
   *
   * @param sessionId
   *            the session id
   * @param context
   *            the context
   * @param ttl
   *            the TTL, or null for the configured one
   */
  public void saveContext(String sessionId, T context, Duration ttl) {
    contexts.put(sessionId, context, ttl);
  }

  public Optional<T> patchContext(String sessionId, Map<String, ?> fieldUpdates) {
    return contexts.patch(sessionId, fieldUpdates);
  }

  /**
   * Replaces individual fields of a session's context.
   *
   * @param sessionId
   *            the session id
   * @param fieldUpdates
   *            new values keyed by serialized field name
   * @param ttl
   *            the TTL, or null for the configured one
   * @return the merged context, empty if the session has none
   */
  public Optional<T> patchContext(String sessionId, Map<String, ?> fieldUpdates, Duration ttl) {
    return contexts.patch(sessionId, fieldUpdates, ttl);
  }

  /**
   * Runs {@code work} on a session's context under the session lock and saves
   * the context if {@code work} returns normally.
   *
   * @param sessionId
   *            the session id
   * @param userId
   *            the user id passed to the context factory
   * @param work
   *            the unit of work
   * @param <R>
   *            the result type
   * @return the result of {@code work}
   * @throws dev.agentmemory.context.LockNotAcquiredException
   *             if the session stays locked by another worker
   */
  public <R> R withContext(String sessionId, String userId, Function<? super T, ? extends R> work) {
    return coordinator.execute(sessionId, () -> newContext(sessionId, userId), work);
  }

  T newContext(String sessionId, String userId) {
    return contextFactory.create(sessionId, userId);
  }

  /**
   * Deletes a session's log, metadata and context.
   *
   * @param sessionId
   *            the session id
   * @return which parts existed
   */
  public SessionDeletion deleteEverything(String sessionId) {
    boolean messagesDeleted = conversations.deleteSession(sessionId);
    boolean contextDeleted = contexts.delete(sessionId);
    logger.info("Deleted session {} (messages: {}, context: {})", sessionId, messagesDeleted, contextDeleted);
    return new SessionDeletion(messagesDeleted, contextDeleted);
  }

  /**
   * Summarizes one session.
   *
   * @param sessionId
   *            the session id
   * @return the overview
   */
  public SessionOverview overview(String sessionId) {
    SessionMetadata info = conversations.getSessionInfo(sessionId).orElse(null);
    Map<String, Object> summary = contexts.get(sessionId).map(summarizer).orElse(null);
    return new SessionOverview(sessionId, info, conversations.size(sessionId), summary);
  }

  /**
   * Lists every session that has a log, a context or both.
   *
   * @return the session listing
   */
  public SessionListing listAllSessions() {
    Set<String> withMessages = new TreeSet<>(conversations.listSessions());
    Set<String> withContexts = contexts.listActive();
    Set<String> all = new TreeSet<>(withMessages);
    all.addAll(withContexts);
    return new SessionListing(List.copyOf(all), withMessages.size(), withContexts.size());
  }

  /**
   * Reports expired context records. Expired logs and metadata are reclaimed
   * by the store and need no cleanup.
   *
   * @return the cleanup report
   */
  public CleanupReport cleanupExpired() {
    return new CleanupReport(contexts.sweepExpired());
  }

  /**
   * Opens a handle for one request on a session.
   *
   * @param sessionId
   *            the session id
   * @param userId
   *            the user id
   * @return the session handle
   */
  public AgentSession<T> session(String sessionId, String userId) {
    return new AgentSession<>(this, sessionId, userId, null);
  }

  /**
   * Opens a handle for one request on a session with a TTL override.
   *
   * @param sessionId
   *            the session id
   * @param userId
   *            the user id
   * @param ttl
   *            the TTL for every write, or null for the configured ones
   * @return the session handle
   */
  public AgentSession<T> session(String sessionId, String userId, Duration ttl) {
    return new AgentSession<>(this, sessionId, userId, ttl);
  }

  public ConversationLogStore getConversationLogStore() {
    return conversations;
  }

  public ContextStore<T> getContextStore() {
    return contexts;
  }

  /**
   * Returns the coordinator for lock-guarded context updates.
   *
   * @return the coordinator
   */
  public ContextCoordinator<T> getCoordinator() {
    return coordinator;
  }

  public AgentMemoryOptions getOptions() {
    return options;
  }

  /**
   * Closes the underlying store.
   */
  @Override
  public void close() {
    store.close();
    logger.info("Agent memory closed");
  }

  /**
   * Builder for UnifiedSessionManager.
   *
   * @param <T>
   *            the context record type
   */
  public static class Builder<T> {
    private final ContextCodec<T> codec;
    private KeyValueStore store;
    private AgentMemoryOptions options;
    private ContextFactory<T> contextFactory;
    private Function<? super T, Map<String, Object>> summarizer;

    Builder(ContextCodec<T> codec) {
      this.codec = codec;
    }

    public Builder<T> store(KeyValueStore store) {
      this.store = store;
      return this;
    }

    public Builder<T> options(AgentMemoryOptions options) {
      this.options = options;
      return this;
    }

    public Builder<T> contextFactory(ContextFactory<T> contextFactory) {
      this.contextFactory = contextFactory;
      return this;
    }

    /**
     * Sets how contexts are summarized in overviews. Defaults to the record's
     * JSON form.
     *
     * @param summarizer
     *            the summarizer
     * @return this builder
     */
    public Builder<T> summarizer(Function<? super T, Map<String, Object>> summarizer) {
      this.summarizer = summarizer;
      return this;
    }

    public UnifiedSessionManager<T> build() {
      if (store == null) {
        throw new IllegalStateException("store is required");
      }
      if (contextFactory == null) {
        throw new IllegalStateException("contextFactory is required");
      }
      if (options == null) {
        options = AgentMemoryOptions.builder().build();
      }
      return new UnifiedSessionManager<>(this);
    }
  }
}
