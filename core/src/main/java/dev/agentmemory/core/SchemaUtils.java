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

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.github.victools.jsonschema.generator.*;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;

/**
 * SchemaUtils provides utilities for JSON Schema generation and validation.
 *
 * <p>
 * Schemas are inferred from Java classes. A field is required (and
 * non-nullable) when it is annotated with {@code @JsonProperty(required =
 * true)}; every other field accepts {@code null}. Property names honor
 * {@code @JsonProperty} so the schema matches what Jackson writes.
 */
public final class SchemaUtils {

  private static final SchemaGenerator schemaGenerator;
  private static final JsonSchemaFactory schemaFactory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);

  static {
    SchemaGeneratorConfigBuilder configBuilder = new SchemaGeneratorConfigBuilder(SchemaVersion.DRAFT_7,
        OptionPreset.PLAIN_JSON);

    configBuilder.with(Option.FLATTENED_ENUMS);
    configBuilder.forFields().withRequiredCheck(SchemaUtils::isRequired)
        .withNullableCheck(field -> !isRequired(field) && !field.getType().getErasedType().isPrimitive())
        .withPropertyNameOverrideResolver(SchemaUtils::jsonName);

    SchemaGeneratorConfig config = configBuilder.build();
    schemaGenerator = new SchemaGenerator(config);
  }

  private SchemaUtils() {
    // Utility class
  }

  /**
   * Generates a JSON Schema for the given class.
   *
   * @param clazz
   *            the class to generate schema for
   * @return the JSON schema
   * @throws AgentMemoryException
   *             if the class cannot be described by a schema
   */
  public static JsonNode inferSchema(Class<?> clazz) throws AgentMemoryException {
    if (clazz == null || clazz == Void.class || clazz == void.class) {
      throw new AgentMemoryException("Cannot infer a schema without a record class");
    }

    try {
      return schemaGenerator.generateSchema(clazz);
    } catch (RuntimeException e) {
      throw new AgentMemoryException("Failed to infer schema for " + clazz.getName() + ": " + e.getMessage(), e);
    }
  }

  /**
   * Validates a JSON instance against a schema.
   *
   * @param schema
   *            the JSON schema
   * @param instance
   *            the JSON value to validate
   * @return the violation messages, empty when the instance is valid
   */
  public static List<String> validate(JsonNode schema, JsonNode instance) {
    JsonSchema jsonSchema = schemaFactory.getSchema(schema);
    Set<ValidationMessage> errors = jsonSchema.validate(instance);
    return errors.stream().map(ValidationMessage::getMessage).sorted().collect(Collectors.toList());
  }

  private static boolean isRequired(FieldScope field) {
    JsonProperty property = field.getAnnotationConsideringFieldAndGetter(JsonProperty.class);
    return property != null && property.required();
  }

  private static String jsonName(FieldScope field) {
    JsonProperty property = field.getAnnotationConsideringFieldAndGetter(JsonProperty.class);
    if (property != null && !property.value().isEmpty()) {
      return property.value();
    }
    return null;
  }
}
