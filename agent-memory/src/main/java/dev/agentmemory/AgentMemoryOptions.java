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

import java.time.Clock;
import java.time.Duration;

import dev.agentmemory.context.ContextStoreOptions;
import dev.agentmemory.context.LockOptions;
import dev.agentmemory.session.ConversationLogOptions;

/**
 * AgentMemoryOptions contains configuration options for a
 * {@link UnifiedSessionManager}.
 *
 * <p>
 * The default TTL is read from {@code AGENT_MEMORY_DEFAULT_TTL_SECONDS} and
 * falls back to one hour; a value of zero or less means keys never expire.
 * The messages, metadata and context families use the default TTL unless a
 * family-specific one is set.
 */
public class AgentMemoryOptions {

  static final String ENV_DEFAULT_TTL_SECONDS = "AGENT_MEMORY_DEFAULT_TTL_SECONDS";
  static final Duration FALLBACK_TTL = Duration.ofHours(1);

  private final String sessionPrefix;
  private final String messagesPrefix;
  private final String contextPrefix;
  private final String lockPrefix;
  private final Duration defaultTtl;
  private final Duration messagesTtl;
  private final Duration metadataTtl;
  private final Duration contextTtl;
  private final Duration lockHoldTimeout;
  private final int lockRetries;
  private final Duration lockBackoffBase;
  private final Clock clock;

  private AgentMemoryOptions(Builder builder) {
    this.sessionPrefix = builder.sessionPrefix;
    this.messagesPrefix = builder.messagesPrefix;
    this.contextPrefix = builder.contextPrefix;
    this.lockPrefix = builder.lockPrefix;
    this.defaultTtl = builder.defaultTtl;
    this.messagesTtl = builder.messagesTtl;
    this.metadataTtl = builder.metadataTtl;
    this.contextTtl = builder.contextTtl;
    this.lockHoldTimeout = builder.lockHoldTimeout;
    this.lockRetries = builder.lockRetries;
    this.lockBackoffBase = builder.lockBackoffBase;
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

  public String getSessionPrefix() {
    return sessionPrefix;
  }

  public String getMessagesPrefix() {
    return messagesPrefix;
  }

  public String getContextPrefix() {
    return contextPrefix;
  }

  public String getLockPrefix() {
    return lockPrefix;
  }

  /**
   * Returns the TTL shared by every key family.
   *
   * @return the default TTL, or null for no expiry
   */
  public Duration getDefaultTtl() {
    return defaultTtl;
  }

  public Duration getContextTtl() {
    return contextTtl != null ? contextTtl : defaultTtl;
  }

  public Duration getLockHoldTimeout() {
    return lockHoldTimeout;
  }

  public int getLockRetries() {
    return lockRetries;
  }

  public Duration getLockBackoffBase() {
    return lockBackoffBase;
  }

  public Clock getClock() {
    return clock;
  }

  /**
   * Returns the options of the conversation log store.
   *
   * @return the conversation log options
   */
  public ConversationLogOptions toConversationLogOptions() {
    return ConversationLogOptions.builder().sessionPrefix(sessionPrefix).messagesPrefix(messagesPrefix)
        .ttl(defaultTtl).messagesTtl(messagesTtl).metadataTtl(metadataTtl).clock(clock).build();
  }

  /**
   * Returns the options of the context store.
   *
   * @return the context store options
   */
  public ContextStoreOptions toContextStoreOptions() {
    return ContextStoreOptions.builder().prefix(contextPrefix).ttl(getContextTtl()).build();
  }

  /**
   * Returns the options of the session lock.
   *
   * @return the lock options
   */
  public LockOptions toLockOptions() {
    return LockOptions.builder().prefix(lockPrefix).holdTimeout(lockHoldTimeout).retries(lockRetries)
        .backoffBase(lockBackoffBase).build();
  }

  /**
   * Builder for AgentMemoryOptions.
   */
  public static class Builder {
    private String sessionPrefix = ConversationLogOptions.DEFAULT_SESSION_PREFIX;
    private String messagesPrefix = ConversationLogOptions.DEFAULT_MESSAGES_PREFIX;
    private String contextPrefix = ContextStoreOptions.DEFAULT_PREFIX;
    private String lockPrefix = LockOptions.DEFAULT_PREFIX;
    private Duration defaultTtl = parseTtl(System.getenv(ENV_DEFAULT_TTL_SECONDS));
    private Duration messagesTtl;
    private Duration metadataTtl;
    private Duration contextTtl;
    private Duration lockHoldTimeout = LockOptions.DEFAULT_HOLD_TIMEOUT;
    private int lockRetries = LockOptions.DEFAULT_RETRIES;
    private Duration lockBackoffBase = LockOptions.DEFAULT_BACKOFF_BASE;
    private Clock clock = Clock.systemUTC();

    static Duration parseTtl(String seconds) {
      if (seconds != null) {
        try {
          long value = Long.parseLong(seconds.trim());
          return value > 0 ? Duration.ofSeconds(value) : null;
        } catch (NumberFormatException e) {
          // fall through to default
        }
      }
      return FALLBACK_TTL;
    }

    public Builder sessionPrefix(String sessionPrefix) {
      this.sessionPrefix = sessionPrefix;
      return this;
    }

    public Builder messagesPrefix(String messagesPrefix) {
      this.messagesPrefix = messagesPrefix;
      return this;
    }

    public Builder contextPrefix(String contextPrefix) {
      this.contextPrefix = contextPrefix;
      return this;
    }

    public Builder lockPrefix(String lockPrefix) {
      this.lockPrefix = lockPrefix;
      return this;
    }

    /**
     * Sets the TTL shared by every key family.
     *
     * @param defaultTtl
     *            the TTL, or null for no expiry
     * @return this builder
     */
    public Builder defaultTtl(Duration defaultTtl) {
      this.defaultTtl = defaultTtl;
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

    public Builder contextTtl(Duration contextTtl) {
      this.contextTtl = contextTtl;
      return this;
    }

    public Builder lockHoldTimeout(Duration lockHoldTimeout) {
      this.lockHoldTimeout = lockHoldTimeout;
      return this;
    }

    public Builder lockRetries(int lockRetries) {
      this.lockRetries = lockRetries;
      return this;
    }

    public Builder lockBackoffBase(Duration lockBackoffBase) {
      this.lockBackoffBase = lockBackoffBase;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public AgentMemoryOptions build() {
      AgentMemoryOptions options = new AgentMemoryOptions(this);
      options.toConversationLogOptions();
      options.toContextStoreOptions();
      options.toLockOptions();
      return options;
    }
  }
}
