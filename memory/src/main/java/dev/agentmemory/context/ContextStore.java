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
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.agentmemory.core.AgentMemoryException;
import dev.agentmemory.core.store.KeyValueStore;
import dev.agentmemory.core.store.StoreKeys;
import dev.agentmemory.telemetry.MemoryTelemetry;

/**
 * ContextStore keeps one typed context record per session under
 * {@code <prefix>:<id>}. Records are always written and read whole.
 *
 * <p>
 * Reads never fail on missing, expired or undecodable records; all three are
 * reported as absent. Store failures are propagated.
 *
 * <p>
 * {@link #getOrCreate} and {@link #patch} are read-then-write sequences and
 * are not atomic against other writers. Wrap them in a
 * {@link ContextCoordinator} when concurrent callers share a session.
 *
 * @param <T>
 *            the context record type
 */
public class ContextStore<T> {

  private static final Logger logger = LoggerFactory.getLogger(ContextStore.class);
  private static final String FAMILY = "context";

  private final KeyValueStore store;
  private final ContextCodec<T> codec;
  private final ContextStoreOptions options;

  /**
   * Creates a ContextStore with default options.
   *
   * @param store
   *            the backing store
   * @param codec
   *            the record codec
   */
  public ContextStore(KeyValueStore store, ContextCodec<T> codec) {
    this(store, codec, ContextStoreOptions.defaults());
  }

  /**
   * Creates a ContextStore.
   *
   * @param store
   *            the backing store
   * @param codec
   *            the record codec
   * @param options
   *            key prefix and default TTL
   */
  public ContextStore(KeyValueStore store, ContextCodec<T> codec, ContextStoreOptions options) {
    this.store = store;
    this.codec = codec;
    this.options = options;
  }

  /**
   * Reads a session's context.
   *
   * @param sessionId
   *            the session id
   * @return the record, empty if missing, expired or undecodable
   */
  public Optional<T> get(String sessionId) {
    String data = store.get(key(sessionId));
    if (data == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(codec.deserialize(data));
    } catch (AgentMemoryException e) {
      logger.warn("Treating undecodable context of session {} as absent: {}", sessionId, e.getMessage());
      MemoryTelemetry.getInstance().recordCorruptEntry(FAMILY);
      return Optional.empty();
    }
  }

  /**
   * Writes a record with the default TTL, replacing any previous one.
   *
   * @param sessionId
   *            the session id
   * @param record
   *            the record
   * @throws ContextValidationException
   *             if the record is invalid
   */
  public void put(String sessionId, T record) {
    put(sessionId, record, null);
  }

  /**
   * Writes a record, replacing any previous one.
   *
   * @param sessionId
   *            the session id
   * @param record
   *            the record
   * @param ttl
   *            the TTL, or null for the configured default
   * @throws ContextValidationException
   *             if the record is invalid
   */
  public void put(String sessionId, T record, Duration ttl) {
    String data = codec.serialize(record);
    store.set(key(sessionId), data, resolve(ttl));
    logger.debug("Stored context for session {}", sessionId);
  }

  /**
   * Returns the stored record, or stores and returns {@code defaultRecord} if
   * there is none.
   *
   * @param sessionId
   *            the session id
   * @param defaultRecord
   *            the record to store when absent
   * @return the stored or newly created record
   */
  public T getOrCreate(String sessionId, T defaultRecord) {
    return getOrCreate(sessionId, () -> defaultRecord, null);
  }

  /**
   * Returns the stored record, or stores and returns {@code defaultRecord} if
   * there is none.
   *
   * @param sessionId
   *            the session id
   * @param defaultRecord
   *            the record to store when absent
   * @param ttl
   *            the TTL of a newly created record, or null for the default
   * @return the stored or newly created record
   */
  public T getOrCreate(String sessionId, T defaultRecord, Duration ttl) {
    return getOrCreate(sessionId, () -> defaultRecord, ttl);
  }

  /**
   * Returns the stored record, or creates, stores and returns a default one.
   * The supplier is only called when no record exists.
   *
   * @param sessionId
   *            the session id
   * @param defaultRecord
   *            supplies the record to store when absent
   * @param ttl
   *            the TTL of a newly created record, or null for the default
   * @return the stored or newly created record
   */
  public T getOrCreate(String sessionId, Supplier<? extends T> defaultRecord, Duration ttl) {
    Optional<T> existing = get(sessionId);
    if (existing.isPresent()) {
      return existing.get();
    }
    T created = defaultRecord.get();
    put(sessionId, created, ttl);
    logger.debug("Created context for session {}", sessionId);
    return created;
  }

  /**
   * Replaces individual fields of an existing record.
   *
   * @param sessionId
   *            the session id
   * @param fieldUpdates
   *            new values keyed by serialized field name
   * @return the merged record, empty if the session has no record
   * @throws ContextValidationException
   *             if the merged record is invalid, in which case the stored
   *             record is unchanged
   */
  public Optional<T> patch(String sessionId, Map<String, ?> fieldUpdates) {
    return patch(sessionId, fieldUpdates, null);
  }

  /**
   * Replaces individual fields of an existing record.
   *
   * @param sessionId
   *            the session id
   * @param fieldUpdates
   *            new values keyed by serialized field name
   * @param ttl
   *            the TTL of the rewritten record, or null for the default
   * @return the merged record, empty if the session has no record
   * @throws ContextValidationException
   *             if the merged record is invalid, in which case the stored
   *             record is unchanged
   */
  public Optional<T> patch(String sessionId, Map<String, ?> fieldUpdates, Duration ttl) {
    if (fieldUpdates == null) {
      throw new IllegalArgumentException("fieldUpdates must not be null");
    }
    Optional<T> current = get(sessionId);
    if (current.isEmpty()) {
      return Optional.empty();
    }
    T merged = codec.applyFieldUpdates(current.get(), fieldUpdates);
    put(sessionId, merged, ttl);
    return Optional.of(merged);
  }

  /**
   * Deletes a session's record.
   *
   * @param sessionId
   *            the session id
   * @return true if a record existed
   */
  public boolean delete(String sessionId) {
    return store.delete(key(sessionId)) > 0;
  }

  /**
   * Resets the expiry of a record to the default TTL.
   *
   * @param sessionId
   *            the session id
   * @return true if the record exists
   */
  public boolean extendTtl(String sessionId) {
    return extendTtl(sessionId, null);
  }

  /**
   * Resets the expiry of a record. When neither {@code ttl} nor a default is
   * configured the record's expiry is left as it is.
   *
   * @param sessionId
   *            the session id
   * @param ttl
   *            the new TTL, or null for the default
   * @return true if the record exists
   */
  public boolean extendTtl(String sessionId, Duration ttl) {
    Duration effective = resolve(ttl);
    if (effective == null) {
      return store.exists(key(sessionId));
    }
    return store.expire(key(sessionId), effective);
  }

  /**
   * Returns whether a session has a stored record, decodable or not.
   *
   * @param sessionId
   *            the session id
   * @return true if the key exists
   */
  public boolean exists(String sessionId) {
    return store.exists(key(sessionId));
  }

  /**
   * Lists the ids of sessions that currently have a record. The result is a
   * snapshot and may include records that expire while it is read.
   *
   * @return the session ids
   */
  public Set<String> listActive() {
    return listActive(null);
  }

  /**
   * Lists the ids of sessions matching a glob that currently have a record.
   *
   * @param idPattern
   *            a glob over session ids, or null for all
   * @return the session ids, sorted
   */
  public Set<String> listActive(String idPattern) {
    Set<String> ids = new TreeSet<>();
    for (String key : store.scanKeys(StoreKeys.pattern(options.getPrefix(), idPattern))) {
      ids.add(StoreKeys.sessionId(options.getPrefix(), key));
    }
    return ids;
  }

  /**
   * Counts records that were listed by a scan but had already expired when
   * their TTL was checked. The store reclaims expired keys itself, so this is
   * an approximate metric and deletes nothing.
   *
   * @return the number of keys seen as missing after the scan
   */
  public int sweepExpired() {
    int expired = 0;
    for (String key : store.scanKeys(StoreKeys.pattern(options.getPrefix(), null))) {
      if (store.ttlSeconds(key) == KeyValueStore.TTL_MISSING) {
        expired++;
      }
    }
    if (expired > 0) {
      logger.debug("Observed {} expired context records", expired);
    }
    return expired;
  }

  public ContextCodec<T> getCodec() {
    return codec;
  }

  public ContextStoreOptions getOptions() {
    return options;
  }

  private String key(String sessionId) {
    return StoreKeys.key(options.getPrefix(), sessionId);
  }

  private Duration resolve(Duration ttl) {
    return ttl != null ? ttl : options.getTtl();
  }
}
