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

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import dev.agentmemory.core.store.InMemoryKeyValueStore;
import dev.agentmemory.core.store.KeyValueStore;
import dev.agentmemory.testing.MutableClock;

/** Unit tests for ContextStore. */
class ContextStoreTest {

  private MutableClock clock;
  private InMemoryKeyValueStore kv;
  private ContextStore<TicketContext> contexts;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2025-06-01T00:00:00Z"));
    kv = new InMemoryKeyValueStore(clock);
    contexts = new ContextStore<>(kv, JsonContextCodec.of(TicketContext.class));
  }

  @Test
  void testGetMissingIsEmpty() {
    assertTrue(contexts.get("s1").isEmpty());
  }

  @Test
  void testPutThenGet() {
    TicketContext record = new TicketContext("s1", "u1", "standard");

    contexts.put("s1", record);

    assertEquals(record, contexts.get("s1").orElseThrow());
    assertEquals(3600, kv.ttlSeconds("agent_context:s1"));
  }

  @Test
  void testPutOverwrites() {
    contexts.put("s1", new TicketContext("s1", "u1", "standard"));
    contexts.put("s1", new TicketContext("s1", "u1", "premium"));

    assertEquals("premium", contexts.get("s1").orElseThrow().getTier());
  }

  @Test
  void testPutWithTtlOverride() {
    contexts.put("s1", new TicketContext("s1", "u1", "standard"), Duration.ofMinutes(2));

    assertEquals(120, kv.ttlSeconds("agent_context:s1"));
  }

  @Test
  void testPutWithoutDefaultTtlNeverExpires() {
    ContextStore<TicketContext> durable = new ContextStore<>(kv, JsonContextCodec.of(TicketContext.class),
        ContextStoreOptions.builder().noExpiry().build());

    durable.put("s1", new TicketContext("s1", "u1", "standard"));

    assertEquals(KeyValueStore.TTL_NONE, kv.ttlSeconds("agent_context:s1"));
  }

  @Test
  void testPutInvalidRecordWritesNothing() {
    assertThrows(ContextValidationException.class, () -> contexts.put("s1", new TicketContext(null, "u1", "x")));
    assertFalse(kv.exists("agent_context:s1"));
  }

  @Test
  void testRecordExpires() {
    contexts.put("s1", new TicketContext("s1", "u1", "standard"), Duration.ofSeconds(1));

    clock.advance(Duration.ofMillis(1500));

    assertTrue(contexts.get("s1").isEmpty());
    assertFalse(contexts.exists("s1"));
  }

  @Test
  void testUndecodableRecordReadsAsAbsent() {
    kv.set("agent_context:s1", "not json at all", null);

    assertTrue(contexts.get("s1").isEmpty());
    assertTrue(contexts.exists("s1"));
  }

  @Test
  void testGetOrCreateKeepsFirstStoredValue() {
    TicketContext first = contexts.getOrCreate("s2", new TicketContext("s2", "u1", "standard"));
    TicketContext second = contexts.getOrCreate("s2", new TicketContext("s2", "u1", "premium"));

    assertEquals("standard", first.getTier());
    assertEquals("standard", second.getTier());
    assertEquals("standard", contexts.get("s2").orElseThrow().getTier());
  }

  @Test
  void testGetOrCreateOnlyBuildsDefaultWhenAbsent() {
    contexts.put("s1", new TicketContext("s1", "u1", "standard"));

    TicketContext result = contexts.getOrCreate("s1", () -> fail("default must not be built"), null);

    assertEquals("standard", result.getTier());
  }

  @Test
  void testPatchMissingRecordCreatesNothing() {
    Optional<TicketContext> patched = contexts.patch("s1", Map.of("tier", "premium"));

    assertTrue(patched.isEmpty());
    assertFalse(contexts.exists("s1"));
  }

  @Test
  void testPatchChangesOnlyNamedField() {
    TicketContext original = new TicketContext("s1", "u1", "standard");
    original.addNote("first contact");
    contexts.put("s1", original);

    TicketContext patched = contexts.patch("s1", Map.of("tier", "premium")).orElseThrow();

    assertEquals("premium", patched.getTier());
    assertEquals(original.getNotes(), patched.getNotes());
    assertEquals(original.getUserId(), patched.getUserId());
    assertEquals(patched, contexts.get("s1").orElseThrow());
  }

  @Test
  void testPatchWithTtlOverride() {
    contexts.put("s1", new TicketContext("s1", "u1", "standard"));

    contexts.patch("s1", Map.of("escalated", true), Duration.ofSeconds(30));

    assertEquals(30, kv.ttlSeconds("agent_context:s1"));
  }

  @Test
  void testInvalidPatchLeavesStoredRecordUntouched() {
    TicketContext original = new TicketContext("s1", "u1", "standard");
    contexts.put("s1", original);

    assertThrows(ContextValidationException.class, () -> contexts.patch("s1", Map.of("escalated", "soon")));

    assertEquals(original, contexts.get("s1").orElseThrow());
  }

  @Test
  void testPatchRejectsNullUpdates() {
    contexts.put("s1", new TicketContext("s1", "u1", "standard"));

    assertThrows(IllegalArgumentException.class, () -> contexts.patch("s1", null));
    assertEquals("standard", contexts.get("s1").orElseThrow().getTier());
  }

  @Test
  void testUnconvertiblePatchValueLeavesStoredRecordUntouched() {
    TicketContext original = new TicketContext("s1", "u1", "standard");
    contexts.put("s1", original);

    assertThrows(ContextValidationException.class,
        () -> contexts.patch("s1", Map.of("notes", new JsonContextCodecTest.Unreadable())));

    assertEquals(original, contexts.get("s1").orElseThrow());
  }

  @Test
  void testDeleteReportsExistence() {
    contexts.put("s1", new TicketContext("s1", "u1", "standard"));

    assertTrue(contexts.delete("s1"));
    assertFalse(contexts.delete("s1"));
  }

  @Test
  void testExtendTtl() {
    contexts.put("s1", new TicketContext("s1", "u1", "standard"), Duration.ofSeconds(10));

    assertTrue(contexts.extendTtl("s1"));
    assertEquals(3600, kv.ttlSeconds("agent_context:s1"));
    assertTrue(contexts.extendTtl("s1", Duration.ofSeconds(45)));
    assertEquals(45, kv.ttlSeconds("agent_context:s1"));
    assertFalse(contexts.extendTtl("missing"));
  }

  @Test
  void testListActive() {
    contexts.put("a", new TicketContext("a", "u1", "standard"));
    contexts.put("b", new TicketContext("b", "u1", "standard"), Duration.ofSeconds(1));
    kv.set("agent_session:c", "unrelated", null);

    assertEquals(Set.of("a", "b"), contexts.listActive());

    clock.advance(Duration.ofSeconds(2));

    assertEquals(Set.of("a"), contexts.listActive());
    assertEquals(Set.of(), contexts.listActive("z*"));
  }

  @Test
  void testSweepExpiredSeesNothingWhenStoreReclaimsOnScan() {
    contexts.put("a", new TicketContext("a", "u1", "standard"), Duration.ofSeconds(1));
    contexts.put("b", new TicketContext("b", "u1", "standard"));
    clock.advance(Duration.ofSeconds(2));

    assertEquals(0, contexts.sweepExpired());
  }
}
