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

import dev.agentmemory.core.AgentMemoryException;

/**
 * Thrown when the backing store cannot be reached or rejects a command. These
 * failures are transient from the caller's point of view; nothing in this
 * library retries them.
 */
public class StoreException extends AgentMemoryException {

  /** Error code for an unavailable store. */
  public static final String STORE_UNAVAILABLE = "STORE_UNAVAILABLE";

  /**
   * Creates a new StoreException.
   *
   * @param message
   *            the error message
   * @param cause
   *            the underlying client failure
   */
  public StoreException(String message, Throwable cause) {
    this(message, cause, STORE_UNAVAILABLE);
  }

  /**
   * Creates a new StoreException with an explicit error code.
   *
   * @param message
   *            the error message
   * @param cause
   *            the underlying client failure
   * @param errorCode
   *            the error code
   */
  protected StoreException(String message, Throwable cause, String errorCode) {
    super(message, cause, errorCode, null);
  }
}
