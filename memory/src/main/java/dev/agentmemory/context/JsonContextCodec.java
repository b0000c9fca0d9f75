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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import dev.agentmemory.core.AgentMemoryException;
import dev.agentmemory.core.JsonUtils;
import dev.agentmemory.core.SchemaUtils;

/**
 * JsonContextCodec stores context records as JSON, using Jackson for binding
 * and a JSON Schema inferred from the record class for validation.
 *
 * <p>
 * Fields annotated with {@code @JsonProperty(required = true)} must be present
 * and non-null. Field updates may only name properties the schema declares.
 *
 * @param <T>
 *            the context record type
 */
public class JsonContextCodec<T> implements ContextCodec<T> {

  private final Class<T> recordClass;
  private final JsonNode schema;

  /**
   * Creates a codec for the given record class.
   *
   * @param recordClass
   *            the record class, bindable by Jackson
   */
  public JsonContextCodec(Class<T> recordClass) {
    this.recordClass = recordClass;
    this.schema = SchemaUtils.inferSchema(recordClass);
  }

  /**
   * Creates a codec for the given record class.
   *
   * @param recordClass
   *            the record class
   * @param <T>
   *            the record type
   * @return the codec
   */
  public static <T> JsonContextCodec<T> of(Class<T> recordClass) {
    return new JsonContextCodec<>(recordClass);
  }

  @Override
  public String serialize(T record) {
    JsonNode node = toNode(record);
    check(node);
    return JsonUtils.toJson(node);
  }

  @Override
  public T deserialize(String data) {
    JsonNode node = JsonUtils.parseJson(data);
    check(node);
    return JsonUtils.fromJsonNode(node, recordClass);
  }

  @Override
  public void validate(T record) {
    check(toNode(record));
  }

  @Override
  public T applyFieldUpdates(T record, Map<String, ?> fieldUpdates) {
    if (fieldUpdates == null) {
      throw new IllegalArgumentException("fieldUpdates must not be null");
    }
    JsonNode current = toNode(record);
    if (!current.isObject()) {
      throw new ContextValidationException("Context record is not a JSON object",
          List.of("expected object but found " + current.getNodeType()));
    }
    ObjectNode merged = ((ObjectNode) current).deepCopy();

    JsonNode properties = schema.get("properties");
    List<String> rejected = new ArrayList<>();
    for (Map.Entry<String, ?> update : fieldUpdates.entrySet()) {
      if (properties != null && !properties.has(update.getKey())) {
        rejected.add("unknown field: " + update.getKey());
        continue;
      }
      try {
        merged.set(update.getKey(), JsonUtils.toJsonNode(update.getValue()));
      } catch (IllegalArgumentException e) {
        rejected.add("unconvertible value for field " + update.getKey() + ": " + e.getMessage());
      }
    }
    if (!rejected.isEmpty()) {
      throw new ContextValidationException("Invalid field update for " + recordClass.getSimpleName(), rejected);
    }

    check(merged);
    return JsonUtils.fromJsonNode(merged, recordClass);
  }

  @Override
  public Map<String, Object> toMap(T record) {
    return JsonUtils.toMap(record);
  }

  /**
   * Returns the schema records are validated against.
   *
   * @return the JSON schema
   */
  public JsonNode getSchema() {
    return schema;
  }

  public Class<T> getRecordClass() {
    return recordClass;
  }

  private JsonNode toNode(T record) {
    if (record == null) {
      throw new IllegalArgumentException("context record must not be null");
    }
    try {
      return JsonUtils.toJsonNode(record);
    } catch (IllegalArgumentException e) {
      throw new AgentMemoryException("Failed to serialize " + recordClass.getSimpleName() + ": " + e.getMessage(), e);
    }
  }

  private void check(JsonNode node) {
    List<String> violations = SchemaUtils.validate(schema, node);
    if (!violations.isEmpty()) {
      throw new ContextValidationException("Invalid " + recordClass.getSimpleName(), violations);
    }
  }
}
