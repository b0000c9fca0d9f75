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

/**
 * AgentMemoryException is the base exception for all agent memory errors. It
 * carries an error code so that callers at an API boundary can map failures to
 * their own responses without parsing messages.
 */
public class AgentMemoryException extends RuntimeException {

  private final String errorCode;
  private final Object details;

  /**
   * Creates a new AgentMemoryException.
   *
   * @param message
   *            the error message
   */
  public AgentMemoryException(String message) {
    this(message, null, null, null);
  }

  /**
   * Creates a new AgentMemoryException with a cause.
   *
   * @param message
   *            the error message
   * @param cause
   *            the underlying cause
   */
  public AgentMemoryException(String message, Throwable cause) {
    this(message, cause, null, null);
  }

  /**
   * Creates a new AgentMemoryException with full details.
   *
   * @param message
   *            the error message
   * @param cause
   *            the underlying cause
   * @param errorCode
   *            the error code
   * @param details
   *            additional error details
   */
  public AgentMemoryException(String message, Throwable cause, String errorCode, Object details) {
    super(message, cause);
    this.errorCode = errorCode;
    this.details = details;
  }

  /**
   * Returns the error code.
   *
   * @return the error code, or null if not set
   */
  public String getErrorCode() {
    return errorCode;
  }

  /**
   * Returns additional error details.
   *
   * @return the error details, or null if not set
   */
  public Object getDetails() {
    return details;
  }
}
