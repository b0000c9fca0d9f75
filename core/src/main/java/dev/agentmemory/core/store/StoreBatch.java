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

/**
 * StoreBatch queues writes that {@link KeyValueStore#atomically} applies as
 * one unit. Nothing is written until the batch is executed, and no reads are
 * available inside a batch.
 */
public interface StoreBatch {

  /**
   * Sets hash fields, overwriting existing values.
   *
   * @param key
   *            the hash key
   * @param fields
   *            the fields to set
   * @return this batch
   */
  StoreBatch hashPut(String key, Map<String, String> fields);

  /**
   * Sets a hash field only if it is not already present.
   *
   * @param key
   *            the hash key
   * @param field
   *            the field name
   * @param value
   *            the field value
   * @return this batch
   */
  StoreBatch hashPutIfAbsent(String key, String field, String value);

  /**
   * Appends values to the tail of a list.
   *
   * @param key
   *            the list key
   * @param values
   *            the values, in order
   * @return this batch
   */
  StoreBatch listPushRight(String key, List<String> values);

  /**
   * Sets the time-to-live of a key if it exists when the batch runs.
   *
   * @param key
   *            the key
   * @param ttl
   *            the time-to-live
   * @return this batch
   */
  StoreBatch expire(String key, Duration ttl);
}
