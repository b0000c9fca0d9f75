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

import java.util.Map;
import java.util.Optional;

/**
 * PoppedItem is the outcome of removing the most recent conversation item.
 *
 * <p>
 * A stored entry that cannot be decoded is still removed; it is reported as
 * {@link Status#DISCARDED_CORRUPT} so callers can tell it apart from an empty
 * log.
 */
public final class PoppedItem {

  /** What happened to the last slot of the log. */
  public enum Status {
    /** An item was removed and decoded. */
    POPPED,
    /** The log was empty or absent; nothing was removed. */
    EMPTY,
    /** An entry was removed but could not be decoded. */
    DISCARDED_CORRUPT
  }

  private static final PoppedItem EMPTY = new PoppedItem(Status.EMPTY, null);
  private static final PoppedItem DISCARDED = new PoppedItem(Status.DISCARDED_CORRUPT, null);

  private final Status status;
  private final Map<String, Object> item;

  private PoppedItem(Status status, Map<String, Object> item) {
    this.status = status;
    this.item = item;
  }

  static PoppedItem popped(Map<String, Object> item) {
    return new PoppedItem(Status.POPPED, item);
  }

  static PoppedItem empty() {
    return EMPTY;
  }

  static PoppedItem discarded() {
    return DISCARDED;
  }

  public Status getStatus() {
    return status;
  }

  /**
   * Returns the removed item.
   *
   * @return the item, empty unless the status is {@link Status#POPPED}
   */
  public Optional<Map<String, Object>> getItem() {
    return Optional.ofNullable(item);
  }

  /**
   * Returns whether an entry was physically removed from the log.
   *
   * @return true for {@link Status#POPPED} and {@link Status#DISCARDED_CORRUPT}
   */
  public boolean isRemoved() {
    return status != Status.EMPTY;
  }

  @Override
  public String toString() {
    return "PoppedItem{status=" + status + ", item=" + item + "}";
  }
}
