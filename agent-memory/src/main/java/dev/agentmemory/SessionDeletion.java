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
 * Reports which parts of a session existed when it was deleted.
 */
public class SessionDeletion {

  @JsonProperty("messages_deleted")
  private final boolean messagesDeleted;

  @JsonProperty("context_deleted")
  private final boolean contextDeleted;

  public SessionDeletion(boolean messagesDeleted, boolean contextDeleted) {
    this.messagesDeleted = messagesDeleted;
    this.contextDeleted = contextDeleted;
  }

  /**
   * Returns whether the conversation log or its metadata existed.
   *
   * @return true if message data was deleted
   */
  public boolean isMessagesDeleted() {
    return messagesDeleted;
  }

  public boolean isContextDeleted() {
    return contextDeleted;
  }

  @Override
  public String toString() {
    return "SessionDeletion{messagesDeleted=" + messagesDeleted + ", contextDeleted=" + contextDeleted + "}";
  }
}
