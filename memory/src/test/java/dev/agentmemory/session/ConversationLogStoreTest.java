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

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import dev.agentmemory.core.store.InMemoryKeyValueStore;
import dev.agentmemory.core.store.KeyValueStore;
import dev.agentmemory.testing.MutableClock;

/** Unit tests for ConversationLogStore. */
class ConversationLogStoreTest {

  private static final Map<String, Object> HI = Map.of("role", "user", "content", "hi");
  private static final Map<String, Object> HELLO = Map.of("role", "assistant", "content", "hello");

  private MutableClock clock;
  private InMemoryKeyValueStore kv;
  private ConversationLogStore logs;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2025-06-01T00:00:00Z"));
    kv = new InMemoryKeyValueStore(clock);
    logs = new ConversationLogStore(kv,
        ConversationLogOptions.builder().ttl(Duration.ofHours(1)).clock(clock).build());
  }

  @Test
  void testAppendThenReadPreservesOrder() {
    logs.append("s1", List.of(HI, HELLO));
    logs.append("s1", List.of(Map.of("role", "user", "content", "bye")));

    List<Map<String, Object>> items = logs.read("s1");

    assertEquals(3, items.size());
    assertEquals(HI, items.get(0));
    assertEquals(HELLO, items.get(1));
    assertEquals("bye", items.get(2).get("content"));
  }

  @Test
  void testConversationRoundTrip() {
    logs.append("s1", List.of(HI, HELLO));

    assertEquals(List.of(HELLO), logs.read("s1", 1));
    assertEquals(HELLO, logs.popLast("s1").orElseThrow());
    assertEquals(List.of(HI), logs.read("s1"));
  }

  @Test
  void testReadWithLimitReturnsLatestInOrder() {
    for (int i = 0; i < 5; i++) {
      logs.append("s1", List.of(Map.of("n", i)));
    }

    List<Map<String, Object>> window = logs.read("s1", 2);

    assertEquals(2, window.size());
    assertEquals(3, window.get(0).get("n"));
    assertEquals(4, window.get(1).get("n"));
    assertEquals(5, logs.read("s1", 50).size());
  }

  @Test
  void testReadWithZeroLimitReturnsNothing() {
    logs.append("s1", List.of(HI));

    assertTrue(logs.read("s1", 0).isEmpty());
  }

  @Test
  void testReadWithNegativeLimitIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> logs.read("s1", -1));
  }

  @Test
  void testReadUnknownSessionIsEmpty() {
    assertTrue(logs.read("nobody").isEmpty());
    assertEquals(0, logs.size("nobody"));
    assertTrue(logs.getSessionInfo("nobody").isEmpty());
  }

  @Test
  void testAppendEmptyListCreatesNothing() {
    logs.append("s1", List.of());

    assertEquals(0, kv.size());
    assertTrue(logs.getSessionInfo("s1").isEmpty());
  }

  @Test
  void testAppendRejectsNullItem() {
    List<Map<String, Object>> items = new java.util.ArrayList<>();
    items.add(HI);
    items.add(null);

    assertThrows(IllegalArgumentException.class, () -> logs.append("s1", items));
    assertEquals(0, logs.size("s1"));
  }

  @Test
  void testPopLastOnEmptyLog() {
    PoppedItem popped = logs.popLastEntry("s1");

    assertEquals(PoppedItem.Status.EMPTY, popped.getStatus());
    assertFalse(popped.isRemoved());
    assertTrue(logs.popLast("s1").isEmpty());
    assertTrue(logs.getSessionInfo("s1").isEmpty());
  }

  @Test
  void testPopLastDrainsNewestFirst() {
    logs.append("s1", List.of(HI, HELLO));

    assertEquals(HELLO, logs.popLast("s1").orElseThrow());
    assertEquals(HI, logs.popLast("s1").orElseThrow());
    assertTrue(logs.popLast("s1").isEmpty());
  }

  @Test
  void testUndecodableEntriesAreSkippedButCounted() {
    logs.append("s1", List.of(HI));
    kv.listPushRight("agent_messages:s1", List.of("{not json", "[1,2]"));
    logs.append("s1", List.of(HELLO));

    assertEquals(List.of(HI, HELLO), logs.read("s1"));
    assertEquals(4, logs.size("s1"));
    assertEquals(List.of(HELLO), logs.read("s1", 2));
  }

  @Test
  void testPopOfUndecodableEntryIsReported() {
    logs.append("s1", List.of(HI));
    kv.listPushRight("agent_messages:s1", List.of("garbage"));

    PoppedItem popped = logs.popLastEntry("s1");

    assertEquals(PoppedItem.Status.DISCARDED_CORRUPT, popped.getStatus());
    assertTrue(popped.isRemoved());
    assertTrue(popped.getItem().isEmpty());
    assertEquals(1, logs.size("s1"));
  }

  @Test
  void testMetadataCreatedOnFirstAppend() {
    logs.append("s1", List.of(HI));

    SessionMetadata info = logs.getSessionInfo("s1").orElseThrow();
    assertEquals("s1", info.getSessionId());
    assertEquals(Instant.parse("2025-06-01T00:00:00Z").getEpochSecond(), info.getCreatedAt(), 0.001);
    assertEquals(info.getCreatedAt(), info.getUpdatedAt(), 0.001);
  }

  @Test
  void testCreatedAtNeverChangesAfterCreation() {
    logs.append("s1", List.of(HI));
    double createdAt = logs.getSessionInfo("s1").orElseThrow().getCreatedAt();

    clock.advance(Duration.ofSeconds(5));
    logs.append("s1", List.of(HELLO));
    clock.advance(Duration.ofSeconds(5));
    logs.popLast("s1");

    SessionMetadata info = logs.getSessionInfo("s1").orElseThrow();
    assertEquals(createdAt, info.getCreatedAt(), 0.001);
    assertEquals(createdAt + 10, info.getUpdatedAt(), 0.001);
  }

  @Test
  void testTouchBumpsUpdatedAtOnly() {
    logs.append("s1", List.of(HI));
    clock.advance(Duration.ofMillis(2500));

    logs.touch("s1");

    SessionMetadata info = logs.getSessionInfo("s1").orElseThrow();
    assertEquals(2.5, info.getUpdatedAt() - info.getCreatedAt(), 0.001);
    assertEquals(1, logs.size("s1"));
  }

  @Test
  void testLogAndMetadataExpireTogether() {
    logs.append("s1", List.of(HI));
    assertEquals(3600, kv.ttlSeconds("agent_messages:s1"));
    assertEquals(3600, kv.ttlSeconds("agent_session:s1"));

    clock.advance(Duration.ofHours(1).plusSeconds(1));

    assertTrue(logs.read("s1").isEmpty());
    assertTrue(logs.getSessionInfo("s1").isEmpty());
  }

  @Test
  void testAppendRefreshesExpiry() {
    logs.append("s1", List.of(HI));
    clock.advance(Duration.ofMinutes(50));
    logs.append("s1", List.of(HELLO));
    clock.advance(Duration.ofMinutes(50));

    assertEquals(2, logs.read("s1").size());
  }

  @Test
  void testSeparateExpiriesPerFamily() {
    ConversationLogStore split = new ConversationLogStore(kv, ConversationLogOptions.builder()
        .messagesTtl(Duration.ofMinutes(10)).metadataTtl(Duration.ofDays(1)).clock(clock).build());

    split.append("s1", List.of(HI));

    assertEquals(600, kv.ttlSeconds("agent_messages:s1"));
    assertEquals(86400, kv.ttlSeconds("agent_session:s1"));
  }

  @Test
  void testNoExpiryWhenTtlIsUnset() {
    ConversationLogStore durable = new ConversationLogStore(kv,
        ConversationLogOptions.builder().clock(clock).build());

    durable.append("s1", List.of(HI));

    assertEquals(KeyValueStore.TTL_NONE, kv.ttlSeconds("agent_messages:s1"));
    assertEquals(KeyValueStore.TTL_NONE, kv.ttlSeconds("agent_session:s1"));
  }

  @Test
  void testSessionHandleAppliesTtlOverride() {
    ConversationLog log = logs.session("s1", Duration.ofSeconds(90));

    log.append(List.of(HI));

    assertEquals(90, kv.ttlSeconds("agent_messages:s1"));
    assertEquals(90, kv.ttlSeconds("agent_session:s1"));
    assertEquals(List.of(HI), log.read());
    assertEquals("s1", log.getSessionId());
  }

  @Test
  void testSessionHandleRejectsEmptyId() {
    assertThrows(IllegalArgumentException.class, () -> logs.session(""));
  }

  @Test
  void testClearRemovesLogAndMetadata() {
    logs.append("s1", List.of(HI));

    logs.clear("s1");
    logs.clear("s1");

    assertEquals(0, kv.size());
  }

  @Test
  void testSessionsAreIsolated() {
    logs.append("s1", List.of(HI));
    logs.append("s2", List.of(HELLO));

    logs.clear("s1");

    assertTrue(logs.read("s1").isEmpty());
    assertEquals(List.of(HELLO), logs.read("s2"));
  }

  @Test
  void testListSessionsByPattern() {
    logs.append("alpha-1", List.of(HI));
    logs.append("alpha-2", List.of(HI));
    logs.append("beta-1", List.of(HI));

    assertEquals(List.of("alpha-1", "alpha-2", "beta-1"), logs.listSessions());
    assertEquals(List.of("alpha-1", "alpha-2"), logs.listSessions("alpha-*"));
  }

  @Test
  void testDeleteSessionReportsWhetherAnythingExisted() {
    logs.append("s1", List.of(HI));

    assertTrue(logs.deleteSession("s1"));
    assertFalse(logs.deleteSession("s1"));
  }

  @Test
  void testTimestampsAreStoredAsPlainDecimals() {
    clock.advance(Duration.ofMillis(123));

    logs.append("s1", List.of(HI));

    Map<String, String> hash = kv.hashGetAll("agent_session:s1");
    assertEquals("1748736000.123", hash.get("created_at"));
    assertEquals("1748736000.123", hash.get("updated_at"));
    assertEquals(1748736000.123, logs.getSessionInfo("s1").orElseThrow().getCreatedAt(), 0.0001);
  }

  @Test
  void testListSessionsIncludesLogsWhoseMetadataExpired() {
    ConversationLogStore split = new ConversationLogStore(kv, ConversationLogOptions.builder()
        .messagesTtl(Duration.ofHours(1)).metadataTtl(Duration.ofSeconds(10)).clock(clock).build());
    split.append("s1", List.of(HI));

    clock.advance(Duration.ofSeconds(20));

    assertTrue(split.getSessionInfo("s1").isEmpty());
    assertEquals(1, split.size("s1"));
    assertEquals(List.of("s1"), split.listSessions());
  }

  @Test
  void testPopDoesNotRecreateMetadataRemovedByConcurrentClear() {
    InMemoryKeyValueStore racing = new InMemoryKeyValueStore(clock) {
      @Override
      public synchronized String listPopRight(String key) {
        String popped = super.listPopRight(key);
        delete("agent_session:s1", "agent_messages:s1");
        return popped;
      }
    };
    ConversationLogStore racingLogs = new ConversationLogStore(racing,
        ConversationLogOptions.builder().ttl(Duration.ofHours(1)).clock(clock).build());
    racingLogs.append("s1", List.of(HI, HELLO));

    assertEquals(HELLO, racingLogs.popLast("s1").orElseThrow());

    assertTrue(racingLogs.getSessionInfo("s1").isEmpty());
    assertEquals(0, racing.size());
  }

  @Test
  void testPopRefreshesUpdatedAtAndExpiry() {
    logs.append("s1", List.of(HI, HELLO));
    clock.advance(Duration.ofMinutes(30));

    logs.popLast("s1");

    SessionMetadata info = logs.getSessionInfo("s1").orElseThrow();
    assertEquals(1800, info.getUpdatedAt() - info.getCreatedAt(), 0.001);
    assertEquals(3600, kv.ttlSeconds("agent_session:s1"));
    assertEquals(3600, kv.ttlSeconds("agent_messages:s1"));
  }
}
