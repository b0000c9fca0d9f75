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

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import dev.agentmemory.session.SessionMetadata;

/**
 * A snapshot of one session: its metadata, a summary of its context and
 * whether each part is present.
 */
public class SessionOverview {

  @JsonProperty("session_id")
  private final String sessionId;

  @JsonProperty("session_info")
  private final SessionMetadata sessionInfo;

  @JsonProperty("message_count")
  private final long messageCount;

  @JsonProperty("context")
  private final Map<String, Object> context;

  public SessionOverview(String sessionId, SessionMetadata sessionInfo, long messageCount,
      Map<String, Object> context) {
    this.sessionId = sessionId;
    this.sessionInfo = sessionInfo;
    this.messageCount = messageCount;
    this.context = context;
  }

  public String getSessionId() {
    return sessionId;
  }

  /**
   * Returns the conversation metadata.
   *
   * @return the metadata, or null if the session has none
   */
  public SessionMetadata getSessionInfo() {
    return sessionInfo;
  }

  /**
   * Returns the number of stored conversation entries.
   *
   * @return the physical log length
   */
  public long getMessageCount() {
    return messageCount;
  }

  /**
   * Returns the context summary.
   *
   * @return the summary, or null if the session has no readable context
   */
  public Map<String, Object> getContext() {
    return context;
  }

  @JsonProperty("has_messages")
  public boolean hasMessages() {
    return sessionInfo != null;
  }

  @JsonProperty("has_context")
  public boolean hasContext() {
    return context != null;
  }
}
