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

/**
 * Builds the default context for a session that has none yet.
 *
 * @param <T>
 *            the context record type
 */
@FunctionalInterface
public interface ContextFactory<T> {

  /**
   * Creates a fresh context.
   *
   * @param sessionId
   *            the session id
   * @param userId
   *            the user the session belongs to
   * @return the default context
   */
  T create(String sessionId, String userId);
}
