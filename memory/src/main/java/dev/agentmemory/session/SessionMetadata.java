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

package dev.agentmemory.session;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * SessionMetadata is the small record kept next to a conversation log. It is
 * created on the first write to the log; {@code createdAt} never changes after
 * that and {@code updatedAt} is rewritten on every append, pop or touch.
 *
 * <p>
 * Timestamps are fractional seconds since the epoch, stored as decimal strings
 * in a hash.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionMetadata {

  static final String FIELD_SESSION_ID = "session_id";
  static final String FIELD_CREATED_AT = "created_at";
  static final String FIELD_UPDATED_AT = "updated_at";

  @JsonProperty(FIELD_SESSION_ID)
  private final String sessionId;

  @JsonProperty(FIELD_CREATED_AT)
  private final Double createdAt;

  @JsonProperty(FIELD_UPDATED_AT)
  private final Double updatedAt;

  /**
   * Creates a new SessionMetadata.
   *
   * @param sessionId
   *            the session id
   * @param createdAt
   *            creation time in epoch seconds, or null if unknown
   * @param updatedAt
   *            last update time in epoch seconds, or null if unknown
   */
  public SessionMetadata(String sessionId, Double createdAt, Double updatedAt) {
    this.sessionId = sessionId;
    this.createdAt = createdAt;
    this.updatedAt = updatedAt;
  }

  /**
   * Reads metadata from its stored hash form.
   *
   * @param hash
   *            the stored fields
   * @return the metadata, or null if the hash is empty
   */
  static SessionMetadata fromHash(Map<String, String> hash) {
    if (hash == null || hash.isEmpty()) {
      return null;
    }
    return new SessionMetadata(hash.get(FIELD_SESSION_ID), parseSeconds(hash.get(FIELD_CREATED_AT)),
        parseSeconds(hash.get(FIELD_UPDATED_AT)));
  }

  /**
   * Formats epoch milliseconds as the stored fractional-seconds string, in
   * plain decimal notation such as {@code 1792238400.123}.
   *
   * @param epochMillis
   *            the time in milliseconds
   * @return the decimal seconds
   */
  static String formatSeconds(long epochMillis) {
    return BigDecimal.valueOf(epochMillis, 3).toPlainString();
  }

  private static Double parseSeconds(String value) {
    if (value == null) {
      return null;
    }
    try {
      return Double.valueOf(value);
    } catch (NumberFormatException e) {
      return null;
    }
  }

  public String getSessionId() {
    return sessionId;
  }

  public Double getCreatedAt() {
    return createdAt;
  }

  public Double getUpdatedAt() {
    return updatedAt;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SessionMetadata)) {
      return false;
    }
    SessionMetadata that = (SessionMetadata) o;
    return Objects.equals(sessionId, that.sessionId) && Objects.equals(createdAt, that.createdAt)
        && Objects.equals(updatedAt, that.updatedAt);
  }

  @Override
  public int hashCode() {
    return Objects.hash(sessionId, createdAt, updatedAt);
  }

  @Override
  public String toString() {
    return "SessionMetadata{sessionId=" + sessionId + ", createdAt=" + createdAt + ", updatedAt=" + updatedAt + "}";
  }
}
