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

package dev.agentmemory;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Counts of the sessions known to the store.
 */
public class SessionListing {

  @JsonProperty("session_ids")
  private final List<String> sessionIds;

  @JsonProperty("sessions_with_messages")
  private final int sessionsWithMessages;

  @JsonProperty("sessions_with_contexts")
  private final int sessionsWithContexts;

  public SessionListing(List<String> sessionIds, int sessionsWithMessages, int sessionsWithContexts) {
    this.sessionIds = List.copyOf(sessionIds);
    this.sessionsWithMessages = sessionsWithMessages;
    this.sessionsWithContexts = sessionsWithContexts;
  }

  /**
   * Returns every session id with a log, a context or both.
   *
   * @return the ids, sorted
   */
  public List<String> getSessionIds() {
    return sessionIds;
  }

  @JsonProperty("total_sessions")
  public int getTotalSessions() {
    return sessionIds.size();
  }

  public int getSessionsWithMessages() {
    return sessionsWithMessages;
  }

  public int getSessionsWithContexts() {
    return sessionsWithContexts;
  }
}
