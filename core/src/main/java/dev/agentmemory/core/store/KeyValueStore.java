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

package dev.agentmemory.core.store;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * KeyValueStore is the remote store every session component is built on.
 *
 * <p>
 * Each method is atomic for the key it touches. Implementations are
 * long-lived, thread-safe objects: open one at startup, share it between all
 * components and call {@link #close()} at shutdown. All session state lives in
 * the store, so any number of processes may share one.
 *
 * <p>
 * Missing or expired keys are reported as absent values (null, empty
 * collections, {@code false}); connectivity problems are reported as
 * {@link StoreException} and timeouts as {@link StoreTimeoutException}.
 *
 * <p>
 * A {@code null} time-to-live means "no expiry".
 */
public interface KeyValueStore extends AutoCloseable {

  /** Value returned by {@link #ttlSeconds(String)} for a missing key. */
  long TTL_MISSING = -2;

  /** Value returned by {@link #ttlSeconds(String)} for a key without expiry. */
  long TTL_NONE = -1;

  /**
   * Checks whether a key exists.
   *
   * @param key
   *            the key
   * @return true if the key exists and has not expired
   */
  boolean exists(String key);

  /**
   * Reads a string value.
   *
   * @param key
   *            the key
   * @return the value, or null if absent
   */
  String get(String key);

  /**
   * Writes a string value, replacing any previous value and expiry.
   *
   * @param key
   *            the key
   * @param value
   *            the value
   * @param ttl
   *            the time-to-live, or null for no expiry
   */
  void set(String key, String value, Duration ttl);

  /**
   * Writes a string value only if the key is absent.
   *
   * @param key
   *            the key
   * @param value
   *            the value
   * @param ttl
   *            the time-to-live of the new key, or null for no expiry
   * @return true if the value was written
   */
  boolean setIfAbsent(String key, String value, Duration ttl);

  /**
   * Deletes a key only if it currently holds the expected value.
   *
   * @param key
   *            the key
   * @param expectedValue
   *            the value the key must hold
   * @return true if the key was deleted
   */
  boolean compareAndDelete(String key, String expectedValue);

  /**
   * Reads all fields of a hash.
   *
   * @param key
   *            the hash key
   * @return the fields, empty if the hash is absent
   */
  Map<String, String> hashGetAll(String key);

  /**
   * Writes hash fields only if the hash already exists. The existence check
   * and the write are one step, so a concurrent delete is never undone.
   *
   * @param key
   *            the hash key
   * @param fields
   *            the fields to write
   * @return true if the hash existed and was updated
   */
  boolean hashPutIfExists(String key, Map<String, String> fields);

  /**
   * Appends values to the tail of a list, creating it if needed.
   *
   * @param key
   *            the list key
   * @param values
   *            the values, in order
   * @return the length of the list after the push
   */
  long listPushRight(String key, List<String> values);

  /**
   * Reads a range of a list. Indexes follow the usual convention where
   * negative values count from the tail ({@code -1} is the last element) and
   * both ends are inclusive.
   *
   * @param key
   *            the list key
   * @param start
   *            the first index
   * @param end
   *            the last index
   * @return the elements in list order, empty if the list is absent
   */
  List<String> listRange(String key, long start, long end);

  /**
   * Removes and returns the last element of a list.
   *
   * @param key
   *            the list key
   * @return the removed element, or null if the list is absent or empty
   */
  String listPopRight(String key);

  /**
   * Returns the length of a list.
   *
   * @param key
   *            the list key
   * @return the number of elements, 0 if the list is absent
   */
  long listLength(String key);

  /**
   * Deletes keys.
   *
   * @param keys
   *            the keys to delete
   * @return the number of keys that existed and were removed
   */
  long delete(String... keys);

  /**
   * Sets the time-to-live of an existing key.
   *
   * @param key
   *            the key
   * @param ttl
   *            the new time-to-live
   * @return true if the key existed and its expiry was set
   */
  boolean expire(String key, Duration ttl);

  /**
   * Returns the remaining time-to-live of a key in seconds.
   *
   * @param key
   *            the key
   * @return the remaining seconds, {@link #TTL_NONE} if the key never expires,
   *         or {@link #TTL_MISSING} if it does not exist
   */
  long ttlSeconds(String key);

  /**
   * Lists the keys matching a glob pattern ({@code *}, {@code ?} and
   * {@code [...]} are supported). The result is a point-in-time view that may
   * miss or include keys changing concurrently.
   *
   * @param pattern
   *            the glob pattern
   * @return the matching keys
   */
  Set<String> scanKeys(String pattern);

  /**
   * Applies a group of writes as one atomic unit. The operations queued on the
   * batch are executed together after {@code operations} returns.
   *
   * @param operations
   *            a callback queuing writes on the batch
   */
  void atomically(Consumer<StoreBatch> operations);

  /**
   * Releases the connections held by this store.
   */
  @Override
  void close();
}
