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
 * Derives store keys from a family prefix and a session id, as
 * {@code prefix:sessionId}.
 */
public final class StoreKeys {

  /** Separator between a key prefix and a session id. */
  public static final String SEPARATOR = ":";

  private StoreKeys() {
    // Utility class
  }

  /**
   * Builds the key for a session within a key family.
   *
   * @param prefix
   *            the key family prefix
   * @param sessionId
   *            the session id
   * @return the derived key
   */
  public static String key(String prefix, String sessionId) {
    if (sessionId == null || sessionId.isEmpty()) {
      throw new IllegalArgumentException("sessionId must not be empty");
    }
    return prefix + SEPARATOR + sessionId;
  }

  /**
   * Builds the scan pattern matching session ids of a key family.
   *
   * @param prefix
   *            the key family prefix
   * @param idPattern
   *            a glob over session ids, or null for all
   * @return the key pattern
   */
  public static String pattern(String prefix, String idPattern) {
    return prefix + SEPARATOR + (idPattern == null || idPattern.isEmpty() ? "*" : idPattern);
  }

  /**
   * Strips the family prefix from a key.
   *
   * @param prefix
   *            the key family prefix
   * @param key
   *            a key produced by {@link #key(String, String)}
   * @return the session id
   */
  public static String sessionId(String prefix, String key) {
    return key.substring(prefix.length() + SEPARATOR.length());
  }
}
