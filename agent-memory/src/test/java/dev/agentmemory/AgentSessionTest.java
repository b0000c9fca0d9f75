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
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import dev.agentmemory.core.store.InMemoryKeyValueStore;

/** Unit tests for AgentSession. */
class AgentSessionTest {

  private InMemoryKeyValueStore kv;
  private UnifiedSessionManager<SupportTicket> memory;

  @BeforeEach
  void setUp() {
    kv = new InMemoryKeyValueStore();
    memory = UnifiedSessionManager.builder(SupportTicket.class).store(kv)
        .options(AgentMemoryOptions.builder().defaultTtl(Duration.ofHours(1)).build())
        .contextFactory((sessionId, userId) -> new SupportTicket(sessionId, userId, "standard")).build();
  }

  @Test
  void testContextIsLoadedOncePerHandle() {
    AgentSession<SupportTicket> session = memory.session("s1", "u1");

    SupportTicket first = session.getContext();
    memory.patchContext("s1", Map.of("tier", "gold"));

    assertSame(first, session.getContext());
    assertEquals("standard", session.getContext().getTier());
    assertEquals("gold", session.refreshContext().getTier());
  }

  @Test
  void testSaveLoadedContext() {
    AgentSession<SupportTicket> session = memory.session("s1", "u1");
    session.getContext().addNote("first message");

    session.saveContext();

    assertEquals(List.of("first message"), memory.getContext("s1").orElseThrow().getNotes());
  }

  @Test
  void testSaveWithoutLoadedContextDoesNothing() {
    memory.session("s1", "u1").saveContext();

    assertTrue(memory.getContext("s1").isEmpty());
  }

  @Test
  void testSaveReplacement() {
    AgentSession<SupportTicket> session = memory.session("s1", "u1");
    SupportTicket replacement = new SupportTicket("s1", "u1", "premium");

    session.saveContext(replacement);

    assertSame(replacement, session.getContext());
    assertEquals("premium", memory.getContext("s1").orElseThrow().getTier());
  }

  @Test
  void testPatchUpdatesLoadedContext() {
    AgentSession<SupportTicket> session = memory.session("s1", "u1");
    session.getContext();

    session.patchContext(Map.of("tier", "gold"));

    assertEquals("gold", session.getContext().getTier());
  }

  @Test
  void testTtlOverrideAppliesToEveryWrite() {
    AgentSession<SupportTicket> session = memory.session("s1", "u1", Duration.ofMinutes(10));

    session.getConversationLog().append(List.of(Map.of("role", "user", "content", "hi")));
    session.getContext();

    assertEquals(600, kv.ttlSeconds("agent_messages:s1"));
    assertEquals(600, kv.ttlSeconds("agent_session:s1"));
    assertEquals(600, kv.ttlSeconds("agent_context:s1"));
  }

  @Test
  void testWithContextKeepsLockedCopy() {
    AgentSession<SupportTicket> session = memory.session("s1", "u1");

    session.withContext(ticket -> {
      ticket.addNote("escalated");
      return null;
    });

    assertEquals(List.of("escalated"), session.getContext().getNotes());
    assertEquals(List.of("escalated"), memory.getContext("s1").orElseThrow().getNotes());
  }

  @Test
  void testOverviewAndDelete() {
    AgentSession<SupportTicket> session = memory.session("s1", "u1");
    session.getConversationLog().append(List.of(Map.of("role", "user", "content", "hi")));
    session.getContext();

    assertTrue(session.overview().hasContext());

    SessionDeletion deletion = session.deleteEverything();

    assertTrue(deletion.isMessagesDeleted());
    assertTrue(deletion.isContextDeleted());
    assertFalse(session.overview().hasMessages());
  }
}
