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

package dev.agentmemory.plugins.redis;

import java.time.Duration;

/**
 * Connection settings for a {@link RedisKeyValueStore}.
 *
 * <p>
 * Defaults are read from the environment:
 * <ul>
 * <li>{@code AGENT_MEMORY_REDIS_URL}, default {@code redis://localhost:6379}</li>
 * <li>{@code AGENT_MEMORY_REDIS_DB}, default {@code 0}</li>
 * <li>{@code AGENT_MEMORY_REDIS_MAX_CONNECTIONS}, default {@code 20}</li>
 * <li>{@code AGENT_MEMORY_REDIS_TIMEOUT_MS}, default {@code 2000}</li>
 * </ul>
 * A database index in the URL path takes precedence over the database option.
 */
public class RedisStoreOptions {

  public static final String DEFAULT_URL = "redis://localhost:6379";
  public static final int DEFAULT_DATABASE = 0;
  public static final int DEFAULT_MAX_CONNECTIONS = 20;
  public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(2000);

  private final String url;
  private final int database;
  private final int maxConnections;
  private final Duration timeout;

  private RedisStoreOptions(Builder builder) {
    this.url = builder.url;
    this.database = builder.database;
    this.maxConnections = builder.maxConnections;
    this.timeout = builder.timeout;
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
   * Gets the Redis URL.
   *
   * @return the URL, e.g. {@code redis://:secret@cache:6379/2}
   */
  public String getUrl() {
    return url;
  }

  /**
   * Gets the database index used when the URL names none.
   *
   * @return the database index
   */
  public int getDatabase() {
    return database;
  }

  /**
   * Gets the connection pool size.
   *
   * @return the maximum number of pooled connections
   */
  public int getMaxConnections() {
    return maxConnections;
  }

  /**
   * Gets the connect and socket timeout. A call exceeding it fails with a
   * {@link dev.agentmemory.core.store.StoreTimeoutException}.
   *
   * @return the timeout
   */
  public Duration getTimeout() {
    return timeout;
  }

  /**
   * Builder for RedisStoreOptions.
   */
  public static class Builder {
    private String url = envOrDefault("AGENT_MEMORY_REDIS_URL", DEFAULT_URL);
    private int database = intFromEnv("AGENT_MEMORY_REDIS_DB", DEFAULT_DATABASE);
    private int maxConnections = intFromEnv("AGENT_MEMORY_REDIS_MAX_CONNECTIONS", DEFAULT_MAX_CONNECTIONS);
    private Duration timeout = Duration
        .ofMillis(intFromEnv("AGENT_MEMORY_REDIS_TIMEOUT_MS", (int) DEFAULT_TIMEOUT.toMillis()));

    private static String envOrDefault(String name, String fallback) {
      String value = System.getenv(name);
      return value != null && !value.isEmpty() ? value : fallback;
    }

    private static int intFromEnv(String name, int fallback) {
      String value = System.getenv(name);
      if (value != null) {
        try {
          return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
          // fall through to default
        }
      }
      return fallback;
    }

    public Builder url(String url) {
      this.url = url;
      return this;
    }

    public Builder database(int database) {
      this.database = database;
      return this;
    }

    public Builder maxConnections(int maxConnections) {
      this.maxConnections = maxConnections;
      return this;
    }

    public Builder timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    public RedisStoreOptions build() {
      if (url == null || url.isEmpty()) {
        throw new IllegalStateException("url is required");
      }
      if (database < 0) {
        throw new IllegalStateException("database must not be negative: " + database);
      }
      if (maxConnections < 1) {
        throw new IllegalStateException("maxConnections must be at least 1: " + maxConnections);
      }
      if (timeout == null || timeout.isNegative() || timeout.isZero()) {
        throw new IllegalStateException("timeout must be positive");
      }
      return new RedisStoreOptions(this);
    }
  }
}
