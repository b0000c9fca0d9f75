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
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import dev.agentmemory.core.store.InMemoryKeyValueStore;

/** Unit tests for ContextCoordinator. */
class ContextCoordinatorTest {

  private static final Supplier<TicketContext> DEFAULTS = () -> new TicketContext("s1", "u1", "standard");

  private InMemoryKeyValueStore kv;
  private ContextStore<TicketContext> contexts;
  private List<Duration> sleeps;
  private ContextCoordinator<TicketContext> coordinator;

  @BeforeEach
  void setUp() {
    kv = new InMemoryKeyValueStore();
    contexts = new ContextStore<>(kv, JsonContextCodec.of(TicketContext.class));
    sleeps = new ArrayList<>();
    coordinator = new ContextCoordinator<>(contexts, new DistributedLock(kv, LockOptions.defaults(), sleeps::add));
  }

  @Test
  void testExecuteCreatesMutatesAndPersists() {
    String result = coordinator.execute("s1", DEFAULTS, context -> {
      context.addNote("asked about refund");
      return context.getTier();
    });

    assertEquals("standard", result);
    assertEquals(List.of("asked about refund"), contexts.get("s1").orElseThrow().getNotes());
    assertFalse(kv.exists("session_lock:s1"));
  }

  @Test
  void testExecuteUsesExistingContext() {
    contexts.put("s1", new TicketContext("s1", "u1", "premium"));

    String tier = coordinator.execute("s1", DEFAULTS, TicketContext::getTier);

    assertEquals("premium", tier);
  }

  @Test
  void testExecuteWithTtl() {
    coordinator.execute("s1", DEFAULTS, Duration.ofMinutes(5), TicketContext::getTier);

    assertEquals(300, kv.ttlSeconds("agent_context:s1"));
  }

  @Test
  void testUpdateReturnsPersistedContext() {
    TicketContext updated = coordinator.update("s1", DEFAULTS, context -> context.setEscalated(true));

    assertTrue(updated.isEscalated());
    assertTrue(contexts.get("s1").orElseThrow().isEscalated());
  }

  @Test
  void testFailedWorkReleasesLockAndDiscardsChanges() {
    contexts.put("s1", new TicketContext("s1", "u1", "standard"));

    IllegalStateException e = assertThrows(IllegalStateException.class,
        () -> coordinator.execute("s1", DEFAULTS, context -> {
          context.setTier("premium");
          throw new IllegalStateException("tool call failed");
        }));

    assertEquals("tool call failed", e.getMessage());
    assertFalse(kv.exists("session_lock:s1"));
    assertEquals("standard", contexts.get("s1").orElseThrow().getTier());
  }

  @Test
  void testInvalidContextIsNotPersisted() {
    contexts.put("s1", new TicketContext("s1", "u1", "standard"));

    try (ContextLease<TicketContext> lease = coordinator.open("s1", DEFAULTS)) {
      lease.setContext(new TicketContext(null, "u1", "premium"));
      assertThrows(ContextValidationException.class, lease::save);
    }

    assertFalse(kv.exists("session_lock:s1"));
    assertEquals("standard", contexts.get("s1").orElseThrow().getTier());
  }

  @Test
  void testBusySessionFailsWithDistinctException() {
    kv.set("session_lock:s1", "other-worker", Duration.ofSeconds(30));
    AtomicInteger runs = new AtomicInteger();

    LockNotAcquiredException e = assertThrows(LockNotAcquiredException.class,
        () -> coordinator.execute("s1", DEFAULTS, context -> runs.incrementAndGet()));

    assertEquals("s1", e.getSessionId());
    assertEquals(0, runs.get());
    assertEquals(5, sleeps.size());
    assertEquals("other-worker", kv.get("session_lock:s1"));
    assertFalse(contexts.exists("s1"));
  }

  @Test
  void testLeaseSavesOnlyWhenAsked() {
    try (ContextLease<TicketContext> lease = coordinator.open("s1", DEFAULTS)) {
      assertTrue(kv.exists("session_lock:s1"));
      lease.getContext().addNote("draft");
    }

    assertTrue(contexts.get("s1").orElseThrow().getNotes().isEmpty());
    assertFalse(kv.exists("session_lock:s1"));
  }

  @Test
  void testLeaseSaveAfterCloseIsRejected() {
    ContextLease<TicketContext> lease = coordinator.open("s1", DEFAULTS);
    lease.setContext(new TicketContext("s1", "u1", "premium"));
    lease.save();
    lease.close();

    assertTrue(lease.isClosed());
    assertThrows(IllegalStateException.class, lease::save);
    assertEquals("premium", contexts.get("s1").orElseThrow().getTier());
  }

  @Test
  void testUnsafeExecuteSkipsLock() {
    kv.set("session_lock:s1", "other-worker", null);

    coordinator.unsafeExecuteWithoutLock("s1", DEFAULTS, context -> {
      context.addNote("no lock");
      return null;
    });

    assertEquals(List.of("no lock"), contexts.get("s1").orElseThrow().getNotes());
    assertTrue(sleeps.isEmpty());
  }

  @Test
  void testConcurrentExecutionsAreSerialized() throws Exception {
    ContextCoordinator<TicketContext> shared = new ContextCoordinator<>(contexts,
        new DistributedLock(kv, LockOptions.builder().backoffBase(Duration.ofMillis(5)).retries(100).build()));
    AtomicInteger inside = new AtomicInteger();
    AtomicInteger maxInside = new AtomicInteger();
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < 4; i++) {
        String note = "worker-" + i;
        futures.add(executor.submit(() -> {
          start.await();
          return shared.update("s1", DEFAULTS, context -> {
            maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
            try {
              Thread.sleep(20);
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            }
            context.addNote(note);
            inside.decrementAndGet();
          });
        }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    assertEquals(1, maxInside.get());
    assertEquals(4, contexts.get("s1").orElseThrow().getNotes().size());
    assertFalse(kv.exists("session_lock:s1"));
  }
}
