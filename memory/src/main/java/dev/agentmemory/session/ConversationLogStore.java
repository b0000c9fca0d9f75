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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.agentmemory.core.AgentMemoryException;
import dev.agentmemory.core.JsonUtils;
import dev.agentmemory.core.store.KeyValueStore;
import dev.agentmemory.core.store.StoreBatch;
import dev.agentmemory.core.store.StoreKeys;
import dev.agentmemory.telemetry.MemoryTelemetry;

/**
 * ConversationLogStore keeps the ordered conversation history of every session
 * in a {@link KeyValueStore}.
 *
 * <p>
 * Each session owns two keys: a list of JSON-encoded items under
 * {@code <messagesPrefix>:<id>} (oldest first) and a metadata hash under
 * {@code <sessionPrefix>:<id>}. Appends write the items, create the metadata if
 * it is missing, bump {@code updated_at} and refresh both expiries in a single
 * atomic batch.
 *
 * <p>
 * Items are opaque JSON objects. Entries that cannot be decoded are skipped on
 * read and never raise; {@link #size(String)} still counts them.
 *
 * <p>
 * Concurrent appends to the same session each land contiguously, but their
 * relative order is not defined. Use a
 * {@link dev.agentmemory.context.ContextCoordinator} when turns must be
 * serialized.
 */
public class ConversationLogStore {

  private static final Logger logger = LoggerFactory.getLogger(ConversationLogStore.class);
  private static final String FAMILY = "messages";

  private final KeyValueStore store;
  private final ConversationLogOptions options;

  /**
   * Creates a ConversationLogStore with default options.
   *
   * @param store
   *            the backing store
   */
  public ConversationLogStore(KeyValueStore store) {
    this(store, ConversationLogOptions.defaults());
  }

  /**
   * Creates a ConversationLogStore.
   *
   * @param store
   *            the backing store
   * @param options
   *            key prefixes, expiries and clock
   */
  public ConversationLogStore(KeyValueStore store, ConversationLogOptions options) {
    this.store = store;
    this.options = options;
  }

  /**
   * Returns a handle bound to one session using the configured expiries.
   *
   * @param sessionId
   *            the session id
   * @return the session's conversation log
   */
  public ConversationLog session(String sessionId) {
    return new ConversationLog(this, sessionId, null);
  }

  /**
   * Returns a handle bound to one session whose writes use the given
   * time-to-live for both the log and its metadata.
   *
   * @param sessionId
   *            the session id
   * @param ttl
   *            the TTL override, or null to use the configured expiries
   * @return the session's conversation log
   */
  public ConversationLog session(String sessionId, Duration ttl) {
    return new ConversationLog(this, sessionId, ttl);
  }

  /**
   * Appends items to the end of a session's log, preserving their order. An
   * empty list is a no-op and creates nothing.
   *
   * @param sessionId
   *            the session id
   * @param items
   *            the items to append, oldest first
   */
  public void append(String sessionId, List<? extends Map<String, ?>> items) {
    append(sessionId, items, null);
  }

  void append(String sessionId, List<? extends Map<String, ?>> items, Duration ttlOverride) {
    if (items == null || items.isEmpty()) {
      return;
    }
    List<String> serialized = new ArrayList<>(items.size());
    for (Map<String, ?> item : items) {
      if (item == null) {
        throw new IllegalArgumentException("Conversation items must not be null");
      }
      serialized.add(JsonUtils.toJson(item));
    }

    String messagesKey = messagesKey(sessionId);
    store.atomically(batch -> {
      batch.listPushRight(messagesKey, serialized);
      writeMetadata(batch, sessionId, ttlOverride);
    });
    logger.debug("Appended {} items to session {}", serialized.size(), sessionId);
  }

  /**
   * Reads the full log of a session, oldest first.
   *
   * @param sessionId
   *            the session id
   * @return the decodable items, empty if the session has no log
   */
  public List<Map<String, Object>> read(String sessionId) {
    return decodeAll(sessionId, store.listRange(messagesKey(sessionId), 0, -1));
  }

  /**
   * Reads the most recent items of a session, oldest first. Undecodable entries
   * inside the window are dropped, so fewer than {@code limit} items may be
   * returned.
   *
   * @param sessionId
   *            the session id
   * @param limit
   *            the size of the recency window
   * @return up to {@code limit} of the latest items in conversation order
   */
  public List<Map<String, Object>> read(String sessionId, int limit) {
    if (limit < 0) {
      throw new IllegalArgumentException("limit must not be negative: " + limit);
    }
    if (limit == 0) {
      return Collections.emptyList();
    }
    return decodeAll(sessionId, store.listRange(messagesKey(sessionId), -limit, -1));
  }

  /**
   * Removes and returns the most recent item. An empty result means either the
   * log was empty or the removed entry could not be decoded; use
   * {@link #popLastEntry(String)} to tell the two apart.
   *
   * @param sessionId
   *            the session id
   * @return the removed item, if one was decoded
   */
  public Optional<Map<String, Object>> popLast(String sessionId) {
    return popLastEntry(sessionId).getItem();
  }

  /**
   * Removes the most recent item and reports what was removed.
   *
   * @param sessionId
   *            the session id
   * @return the outcome of the removal
   */
  public PoppedItem popLastEntry(String sessionId) {
    return popLastEntry(sessionId, null);
  }

  PoppedItem popLastEntry(String sessionId, Duration ttlOverride) {
    String raw = store.listPopRight(messagesKey(sessionId));
    if (raw == null) {
      return PoppedItem.empty();
    }
    refreshMetadata(sessionId, ttlOverride);

    Map<String, Object> item = decode(sessionId, raw);
    return item == null ? PoppedItem.discarded() : PoppedItem.popped(item);
  }

  /**
   * Refreshes {@code updated_at} and both expiries without changing the log.
   * Creates the metadata if it does not exist.
   *
   * @param sessionId
   *            the session id
   */
  public void touch(String sessionId) {
    touch(sessionId, null);
  }

  void touch(String sessionId, Duration ttlOverride) {
    store.atomically(batch -> writeMetadata(batch, sessionId, ttlOverride));
  }

  /**
   * Deletes a session's log and metadata. Idempotent.
   *
   * @param sessionId
   *            the session id
   */
  public void clear(String sessionId) {
    store.delete(sessionKey(sessionId), messagesKey(sessionId));
  }

  /**
   * Returns the number of stored entries, including undecodable ones.
   *
   * @param sessionId
   *            the session id
   * @return the physical length of the log
   */
  public long size(String sessionId) {
    return store.listLength(messagesKey(sessionId));
  }

  /**
   * Reads a session's metadata.
   *
   * @param sessionId
   *            the session id
   * @return the metadata, empty if never created or expired
   */
  public Optional<SessionMetadata> getSessionInfo(String sessionId) {
    return Optional.ofNullable(SessionMetadata.fromHash(store.hashGetAll(sessionKey(sessionId))));
  }

  /**
   * Lists the ids of all sessions that have a log or metadata.
   *
   * @return the session ids, sorted
   */
  public List<String> listSessions() {
    return listSessions(null);
  }

  /**
   * Lists the ids of sessions with a log or metadata whose id matches a glob
   * pattern. The two families may expire at different times, so both are
   * scanned.
   *
   * @param idPattern
   *            a glob over session ids, or null for all
   * @return the session ids, sorted
   */
  public List<String> listSessions(String idPattern) {
    Set<String> ids = new TreeSet<>();
    for (String prefix : List.of(options.getSessionPrefix(), options.getMessagesPrefix())) {
      for (String key : store.scanKeys(StoreKeys.pattern(prefix, idPattern))) {
        ids.add(StoreKeys.sessionId(prefix, key));
      }
    }
    return new ArrayList<>(ids);
  }

  /**
   * Deletes a session's log and metadata.
   *
   * @param sessionId
   *            the session id
   * @return true if either key existed
   */
  public boolean deleteSession(String sessionId) {
    long deleted = store.delete(sessionKey(sessionId), messagesKey(sessionId));
    if (deleted > 0) {
      logger.info("Deleted conversation log for session {}", sessionId);
    }
    return deleted > 0;
  }

  /**
   * Returns the options this store was created with.
   *
   * @return the options
   */
  public ConversationLogOptions getOptions() {
    return options;
  }

  String sessionKey(String sessionId) {
    return StoreKeys.key(options.getSessionPrefix(), sessionId);
  }

  String messagesKey(String sessionId) {
    return StoreKeys.key(options.getMessagesPrefix(), sessionId);
  }

  private void writeMetadata(StoreBatch batch, String sessionId, Duration ttlOverride) {
    String sessionKey = sessionKey(sessionId);
    String now = SessionMetadata.formatSeconds(options.getClock().millis());
    batch.hashPutIfAbsent(sessionKey, SessionMetadata.FIELD_SESSION_ID, sessionId)
        .hashPutIfAbsent(sessionKey, SessionMetadata.FIELD_CREATED_AT, now)
        .hashPut(sessionKey, Map.of(SessionMetadata.FIELD_UPDATED_AT, now));

    Duration metadataTtl = ttlOverride != null ? ttlOverride : options.getMetadataTtl();
    Duration messagesTtl = ttlOverride != null ? ttlOverride : options.getMessagesTtl();
    if (metadataTtl != null) {
      batch.expire(sessionKey, metadataTtl);
    }
    if (messagesTtl != null) {
      batch.expire(messagesKey(sessionId), messagesTtl);
    }
  }

  // Never recreates metadata removed by a concurrent clear.
  private void refreshMetadata(String sessionId, Duration ttlOverride) {
    String sessionKey = sessionKey(sessionId);
    String now = SessionMetadata.formatSeconds(options.getClock().millis());
    if (!store.hashPutIfExists(sessionKey, Map.of(SessionMetadata.FIELD_UPDATED_AT, now))) {
      return;
    }
    Duration metadataTtl = ttlOverride != null ? ttlOverride : options.getMetadataTtl();
    Duration messagesTtl = ttlOverride != null ? ttlOverride : options.getMessagesTtl();
    store.atomically(batch -> {
      if (metadataTtl != null) {
        batch.expire(sessionKey, metadataTtl);
      }
      if (messagesTtl != null) {
        batch.expire(messagesKey(sessionId), messagesTtl);
      }
    });
  }

  private List<Map<String, Object>> decodeAll(String sessionId, List<String> raw) {
    List<Map<String, Object>> items = new ArrayList<>(raw.size());
    for (String entry : raw) {
      Map<String, Object> item = decode(sessionId, entry);
      if (item != null) {
        items.add(item);
      }
    }
    return items;
  }

  private Map<String, Object> decode(String sessionId, String raw) {
    try {
      return JsonUtils.toMap(raw);
    } catch (AgentMemoryException e) {
      logger.warn("Skipping undecodable conversation item in session {}: {}", sessionId, e.getMessage());
      MemoryTelemetry.getInstance().recordCorruptEntry(FAMILY);
      return null;
    }
  }
}
