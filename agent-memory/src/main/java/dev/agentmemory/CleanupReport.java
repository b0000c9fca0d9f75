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

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of {@link UnifiedSessionManager#cleanupExpired()}.
 */
public class CleanupReport {

  @JsonProperty("expired_contexts")
  private final int expiredContexts;

  public CleanupReport(int expiredContexts) {
    this.expiredContexts = expiredContexts;
  }

  /**
   * Returns the number of context keys observed as expired. The figure is
   * approximate since the store reclaims expired keys on its own.
   *
   * @return the expired context count
   */
  public int getExpiredContexts() {
    return expiredContexts;
  }
}
