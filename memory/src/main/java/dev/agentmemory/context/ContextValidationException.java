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

import java.util.List;

import dev.agentmemory.core.AgentMemoryException;

/**
 * Thrown when a context record does not match its schema. A record that fails
 * validation is never written.
 */
public class ContextValidationException extends AgentMemoryException {

  /** Error code reported by {@link #getErrorCode()}. */
  public static final String ERROR_CODE = "CONTEXT_INVALID";

  private final List<String> violations;

  /**
   * Creates a new ContextValidationException.
   *
   * @param message
   *            the error message
   * @param violations
   *            the schema violations, one message each
   */
  public ContextValidationException(String message, List<String> violations) {
    super(message + ": " + String.join("; ", violations), null, ERROR_CODE, List.copyOf(violations));
    this.violations = List.copyOf(violations);
  }

  /**
   * Returns the schema violations.
   *
   * @return the violation messages
   */
  public List<String> getViolations() {
    return violations;
  }
}
