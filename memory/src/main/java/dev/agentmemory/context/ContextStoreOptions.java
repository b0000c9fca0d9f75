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

import java.time.Duration;

/**
 * Configuration for a {@link ContextStore}.
 */
public class ContextStoreOptions {

  /** Default prefix for context keys. */
  public static final String DEFAULT_PREFIX = "agent_context";
  /** Default time-to-live for context records. */
  public static final Duration DEFAULT_TTL = Duration.ofHours(1);

  private final String prefix;
  private final Duration ttl;

  private ContextStoreOptions(Builder builder) {
    this.prefix = builder.prefix;
    this.ttl = builder.ttl;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static ContextStoreOptions defaults() {
    return builder().build();
  }

  public String getPrefix() {
    return prefix;
  }

  /**
   * Returns the default time-to-live applied to writes.
   *
   * @return the TTL, or null if records never expire
   */
  public Duration getTtl() {
    return ttl;
  }

  /**
   * Builder for ContextStoreOptions.
   */
  public static class Builder {
    private String prefix = DEFAULT_PREFIX;
    private Duration ttl = DEFAULT_TTL;

    public Builder prefix(String prefix) {
      if (prefix == null || prefix.isEmpty()) {
        throw new IllegalArgumentException("key prefix must not be empty");
      }
      this.prefix = prefix;
      return this;
    }

    /**
     * Sets the default time-to-live.
     *
     * @param ttl
     *            the TTL, or null for no expiry
     * @return this builder
     */
    public Builder ttl(Duration ttl) {
      this.ttl = ttl;
      return this;
    }

    public Builder noExpiry() {
      return ttl(null);
    }

    public ContextStoreOptions build() {
      return new ContextStoreOptions(this);
    }
  }
}
