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

package dev.agentmemory.core;

import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JsonUtils provides the JSON serialization used for every value written to
 * the store: conversation items, context records and overview payloads.
 */
public final class JsonUtils {

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
  };

  private static final ObjectMapper objectMapper;

  static {
    objectMapper = new ObjectMapper();
    objectMapper.registerModule(new JavaTimeModule());
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    objectMapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    objectMapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
  }

  private JsonUtils() {
    // Utility class
  }

  /**
   * Returns the shared ObjectMapper instance.
   *
   * @return the ObjectMapper
   */
  public static ObjectMapper getObjectMapper() {
    return objectMapper;
  }

  /**
   * Converts an object to JSON string.
   *
   * @param value
   *            the object to convert
   * @return the JSON string
   * @throws AgentMemoryException
   *             if serialization fails
   */
  public static String toJson(Object value) throws AgentMemoryException {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new AgentMemoryException("Failed to serialize to JSON: " + e.getMessage(), e);
    }
  }

  /**
   * Converts an object to a JsonNode.
   *
   * @param value
   *            the object to convert
   * @return the JsonNode
   */
  public static JsonNode toJsonNode(Object value) {
    return objectMapper.valueToTree(value);
  }

  /**
   * Parses a JSON object string to a map.
   *
   * @param json
   *            the JSON string, which must hold an object
   * @return the parsed map
   * @throws AgentMemoryException
   *             if parsing fails or the JSON is not an object
   */
  public static Map<String, Object> toMap(String json) throws AgentMemoryException {
    try {
      Map<String, Object> map = objectMapper.readValue(json, MAP_TYPE);
      if (map == null) {
        throw new AgentMemoryException("Failed to parse JSON: expected an object but found null");
      }
      return map;
    } catch (JsonProcessingException e) {
      throw new AgentMemoryException("Failed to parse JSON: " + e.getMessage(), e);
    }
  }

  /**
   * Converts an object to its JSON object form as a map.
   *
   * @param value
   *            the object to convert
   * @return the map of JSON properties
   * @throws AgentMemoryException
   *             if conversion fails
   */
  public static Map<String, Object> toMap(Object value) throws AgentMemoryException {
    try {
      return objectMapper.convertValue(value, MAP_TYPE);
    } catch (IllegalArgumentException e) {
      throw new AgentMemoryException("Failed to convert object to map: " + e.getMessage(), e);
    }
  }

  /**
   * Converts a JsonNode to the specified type.
   *
   * @param node
   *            the JsonNode
   * @param clazz
   *            the target class
   * @param <T>
   *            the target type
   * @return the converted object
   * @throws AgentMemoryException
   *             if conversion fails
   */
  public static <T> T fromJsonNode(JsonNode node, Class<T> clazz) throws AgentMemoryException {
    try {
      return objectMapper.treeToValue(node, clazz);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new AgentMemoryException("Failed to convert JsonNode: " + e.getMessage(), e);
    }
  }

  /**
   * Parses a JSON string to a JsonNode.
   *
   * @param json
   *            the JSON string
   * @return the JsonNode
   * @throws AgentMemoryException
   *             if parsing fails
   */
  public static JsonNode parseJson(String json) throws AgentMemoryException {
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new AgentMemoryException("Failed to parse JSON: " + e.getMessage(), e);
    }
  }
}
