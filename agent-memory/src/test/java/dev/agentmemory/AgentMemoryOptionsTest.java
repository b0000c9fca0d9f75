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

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import dev.agentmemory.context.LockOptions;
import dev.agentmemory.session.ConversationLogOptions;

/** Unit tests for AgentMemoryOptions. */
class AgentMemoryOptionsTest {

  @Test
  void testParseTtl() {
    assertEquals(Duration.ofSeconds(120), AgentMemoryOptions.Builder.parseTtl("120"));
    assertNull(AgentMemoryOptions.Builder.parseTtl("0"));
    assertNull(AgentMemoryOptions.Builder.parseTtl("-5"));
    assertEquals(AgentMemoryOptions.FALLBACK_TTL, AgentMemoryOptions.Builder.parseTtl(null));
    assertEquals(AgentMemoryOptions.FALLBACK_TTL, AgentMemoryOptions.Builder.parseTtl("soon"));
  }

  @Test
  void testFamilyTtlsFallBackToDefault() {
    AgentMemoryOptions options = AgentMemoryOptions.builder().defaultTtl(Duration.ofMinutes(30))
        .messagesTtl(Duration.ofMinutes(5)).build();

    ConversationLogOptions log = options.toConversationLogOptions();
    assertEquals(Duration.ofMinutes(5), log.getMessagesTtl());
    assertEquals(Duration.ofMinutes(30), log.getMetadataTtl());
    assertEquals(Duration.ofMinutes(30), options.toContextStoreOptions().getTtl());
  }

  @Test
  void testNoExpiry() {
    AgentMemoryOptions options = AgentMemoryOptions.builder().defaultTtl(null).build();

    assertNull(options.toConversationLogOptions().getMessagesTtl());
    assertNull(options.toContextStoreOptions().getTtl());
  }

  @Test
  void testPrefixesAndLock() {
    AgentMemoryOptions options = AgentMemoryOptions.builder().contextPrefix("ctx").lockPrefix("lk").lockRetries(2)
        .lockBackoffBase(Duration.ofMillis(50)).build();

    assertEquals("ctx", options.toContextStoreOptions().getPrefix());
    LockOptions lock = options.toLockOptions();
    assertEquals("lk", lock.getPrefix());
    assertEquals(2, lock.getRetries());
    assertEquals(Duration.ofSeconds(30), lock.getHoldTimeout());
    assertEquals(Duration.ofMillis(100), lock.backoffFor(2));
  }

  @Test
  void testInvalidConfigurationFailsAtBuild() {
    assertThrows(IllegalArgumentException.class, () -> AgentMemoryOptions.builder().lockRetries(-1).build());
    assertThrows(IllegalStateException.class,
        () -> AgentMemoryOptions.builder().sessionPrefix("same").messagesPrefix("same").build());
  }
}
