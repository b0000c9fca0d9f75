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

import java.util.Map;

import dev.agentmemory.core.AgentMemoryException;

/**
 * ContextCodec converts context records to and from their stored text form and
 * checks them against the record's schema.
 *
 * @param <T>
 *            the context record type
 */
public interface ContextCodec<T> {

  /**
   * Encodes a record after validating it.
   *
   * @param record
   *            the record
   * @return the stored form
   * @throws ContextValidationException
   *             if the record does not match the schema
   */
  String serialize(T record) throws ContextValidationException;

  /**
   * Decodes a stored record.
   *
   * @param data
   *            the stored form
   * @return the record
   * @throws AgentMemoryException
   *             if the data cannot be decoded into a valid record
   */
  T deserialize(String data) throws AgentMemoryException;

  /**
   * Checks a record against the schema.
   *
   * @param record
   *            the record
   * @throws ContextValidationException
   *             if the record does not match the schema
   */
  void validate(T record) throws ContextValidationException;

  /**
   * Returns a copy of {@code record} with the given fields replaced. The input
   * record is not modified.
   *
   * @param record
   *            the current record
   * @param fieldUpdates
   *            new values keyed by serialized field name
   * @return the merged record
   * @throws ContextValidationException
   *             if a field is unknown, a value cannot be converted or the
   *             merged record is invalid
   */
  T applyFieldUpdates(T record, Map<String, ?> fieldUpdates) throws ContextValidationException;

  /**
   * Returns the record as a JSON-style map, used for overviews.
   *
   * @param record
   *            the record
   * @return the record's fields keyed by serialized name
   */
  Map<String, Object> toMap(T record);
}
