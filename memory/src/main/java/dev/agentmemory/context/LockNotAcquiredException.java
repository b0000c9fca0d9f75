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
 * Thrown when a session lock could not be taken within the configured
 * retries. The session is busy; the caller may try again later.
 */
public class LockNotAcquiredException extends AgentMemoryException {

  /** Error code reported by {@link #getErrorCode()}. */
  public static final String ERROR_CODE = "LOCK_NOT_ACQUIRED";

  private final String sessionId;
  private final int attempts;

  public LockNotAcquiredException(String sessionId, int attempts) {
    this(sessionId, attempts, null);
  }

  public LockNotAcquiredException(String sessionId, int attempts, Throwable cause) {
    super("Could not acquire lock for session " + sessionId + " after " + attempts + " attempts", cause, ERROR_CODE,
        Map.of("sessionId", sessionId, "attempts", attempts));
    this.sessionId = sessionId;
    this.attempts = attempts;
  }

  public String getSessionId() {
    return sessionId;
  }

  public int getAttempts() {
    return attempts;
  }
}
