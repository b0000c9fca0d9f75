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

/**
 * Thrown when a store call does not complete within the configured network
 * timeout. A timed-out read never means the key is absent.
 */
public class StoreTimeoutException extends StoreException {

  /** Error code for a timed-out store call. */
  public static final String STORE_TIMEOUT = "STORE_TIMEOUT";

  /**
   * Creates a new StoreTimeoutException.
   *
   * @param message
   *            the error message
   * @param cause
   *            the underlying client failure
   */
  public StoreTimeoutException(String message, Throwable cause) {
    super(message, cause, STORE_TIMEOUT);
  }
}
