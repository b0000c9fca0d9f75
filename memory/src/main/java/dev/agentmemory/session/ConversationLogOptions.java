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

import java.time.Clock;
import java.time.Duration;

/**
 * Configuration for a {@link ConversationLogStore}.
 *
 * <p>
 * The log and its metadata expire independently. Each falls back to the
 * shared {@code ttl} when no family-specific value is set; a {@code null}
 * result means the keys never expire.
 */
public class ConversationLogOptions {

  /** Default prefix for session metadata keys. */
  public static final String DEFAULT_SESSION_PREFIX = "agent_session";
  /** Default prefix for message list keys. */
  public static final String DEFAULT_MESSAGES_PREFIX = "agent_messages";

  private final String sessionPrefix;
  private final String messagesPrefix;
  private final Duration ttl;
  private final Duration messagesTtl;
  private final Duration metadataTtl;
  private final Clock clock;

  private ConversationLogOptions(Builder builder) {
    this.sessionPrefix = builder.sessionPrefix;
    this.messagesPrefix = builder.messagesPrefix;
    this.ttl = builder.ttl;
    this.messagesTtl = builder.messagesTtl;
    this.metadataTtl = builder.metadataTtl;
    this.clock = builder.clock;
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns options with every default applied.
   *
   * @return default options
   */
  public static ConversationLogOptions defaults() {
    return builder().build();
  }

  public String getSessionPrefix() {
    return sessionPrefix;
  }

  public String getMessagesPrefix() {
    return messagesPrefix;
  }

  /**
   * Returns the shared time-to-live.
   *
   * @return the shared TTL, or null for no expiry
   */
  public Duration getTtl() {
    return ttl;
  }

  /**
   * Returns the effective time-to-live of message lists.
   *
   * @return the TTL, or null for no expiry
   */
  public Duration getMessagesTtl() {
    return messagesTtl != null ? messagesTtl : ttl;
  }

  /**
   * Returns the effective time-to-live of metadata hashes.
   *
   * @return the TTL, or null for no expiry
   */
  public Duration getMetadataTtl() {
    return metadataTtl != null ? metadataTtl : ttl;
  }

  /**
   * Returns the clock used for metadata timestamps.
   *
   * @return the clock
   */
  public Clock getClock() {
    return clock;
  }

  /**
   * Builder for ConversationLogOptions.
   */
  public static class Builder {
    private String sessionPrefix = DEFAULT_SESSION_PREFIX;
    private String messagesPrefix = DEFAULT_MESSAGES_PREFIX;
    private Duration ttl;
    private Duration messagesTtl;
    private Duration metadataTtl;
    private Clock clock = Clock.systemUTC();

    public Builder sessionPrefix(String sessionPrefix) {
      this.sessionPrefix = requirePrefix(sessionPrefix);
      return this;
    }

    public Builder messagesPrefix(String messagesPrefix) {
      this.messagesPrefix = requirePrefix(messagesPrefix);
      return this;
    }

    public Builder ttl(Duration ttl) {
      this.ttl = ttl;
      return this;
    }

    public Builder messagesTtl(Duration messagesTtl) {
      this.messagesTtl = messagesTtl;
      return this;
    }

    public Builder metadataTtl(Duration metadataTtl) {
      this.metadataTtl = metadataTtl;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public ConversationLogOptions build() {
      if (sessionPrefix.equals(messagesPrefix)) {
        throw new IllegalStateException("session and messages prefixes must differ: " + sessionPrefix);
      }
      return new ConversationLogOptions(this);
    }

    private static String requirePrefix(String prefix) {
      if (prefix == null || prefix.isEmpty()) {
        throw new IllegalArgumentException("key prefix must not be empty");
      }
      return prefix;
    }
  }
}
