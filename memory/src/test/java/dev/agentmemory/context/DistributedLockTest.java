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
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import dev.agentmemory.core.store.InMemoryKeyValueStore;
import dev.agentmemory.testing.MutableClock;

/** Unit tests for DistributedLock. */
class DistributedLockTest {

  private MutableClock clock;
  private InMemoryKeyValueStore kv;
  private List<Duration> sleeps;
  private DistributedLock lock;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2025-06-01T00:00:00Z"));
    kv = new InMemoryKeyValueStore(clock);
    sleeps = new ArrayList<>();
    lock = new DistributedLock(kv, LockOptions.defaults(), sleeps::add);
  }

  @Test
  void testAcquireFreeLock() {
    try (LockHandle handle = lock.acquire("s1")) {
      assertEquals("s1", handle.getSessionId());
      assertTrue(lock.isLocked("s1"));
      assertEquals(30, kv.ttlSeconds("session_lock:s1"));
      assertEquals(handle.getToken(), kv.get("session_lock:s1"));
    }
    assertFalse(lock.isLocked("s1"));
    assertTrue(sleeps.isEmpty());
  }

  @Test
  void testExhaustedRetriesUseLinearBackoff() {
    kv.set("session_lock:s1", "someone-else", Duration.ofSeconds(30));

    LockNotAcquiredException e = assertThrows(LockNotAcquiredException.class, () -> lock.acquire("s1"));

    assertEquals("s1", e.getSessionId());
    assertEquals(6, e.getAttempts());
    assertEquals(LockNotAcquiredException.ERROR_CODE, e.getErrorCode());
    assertEquals(List.of(Duration.ofMillis(500), Duration.ofMillis(1000), Duration.ofMillis(1500),
        Duration.ofMillis(2000), Duration.ofMillis(2500)), sleeps);
    assertEquals("someone-else", kv.get("session_lock:s1"));
  }

  @Test
  void testAcquireSucceedsOnceHolderLetsGo() {
    kv.set("session_lock:s1", "someone-else", null);
    DistributedLock patient = new DistributedLock(kv, LockOptions.defaults(), delay -> {
      sleeps.add(delay);
      if (sleeps.size() == 2) {
        kv.delete("session_lock:s1");
      }
    });

    try (LockHandle handle = patient.acquire("s1")) {
      assertEquals(handle.getToken(), kv.get("session_lock:s1"));
    }
    assertEquals(2, sleeps.size());
  }

  @Test
  void testZeroRetriesFailsImmediately() {
    DistributedLock impatient = new DistributedLock(kv, LockOptions.builder().retries(0).build(), sleeps::add);
    kv.set("session_lock:s1", "x", null);

    LockNotAcquiredException e = assertThrows(LockNotAcquiredException.class, () -> impatient.acquire("s1"));

    assertEquals(1, e.getAttempts());
    assertTrue(sleeps.isEmpty());
  }

  @Test
  void testInterruptedWaitFailsAndKeepsInterruptFlag() {
    kv.set("session_lock:s1", "x", null);
    DistributedLock interrupted = new DistributedLock(kv, LockOptions.defaults(), delay -> {
      throw new InterruptedException("shutdown");
    });

    try {
      LockNotAcquiredException e = assertThrows(LockNotAcquiredException.class, () -> interrupted.acquire("s1"));
      assertTrue(e.getCause() instanceof InterruptedException);
      assertTrue(Thread.currentThread().isInterrupted());
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  void testLocksArePerSession() {
    try (LockHandle first = lock.acquire("s1"); LockHandle second = lock.acquire("s2")) {
      assertTrue(lock.isLocked("s1"));
      assertTrue(lock.isLocked("s2"));
    }
    assertTrue(sleeps.isEmpty());
  }

  @Test
  void testReleaseIsIdempotent() {
    LockHandle handle = lock.acquire("s1");

    assertTrue(handle.release());
    assertFalse(handle.release());
    assertTrue(handle.isReleased());
  }

  @Test
  void testExpiredLockIsNotReleasedFromNewHolder() {
    DistributedLock shortLived = new DistributedLock(kv,
        LockOptions.builder().holdTimeout(Duration.ofSeconds(1)).build(), sleeps::add);
    LockHandle stale = shortLived.acquire("s1");

    clock.advance(Duration.ofSeconds(2));
    LockHandle current = shortLived.acquire("s1");

    assertFalse(stale.release());
    assertTrue(shortLived.isLocked("s1"));
    assertEquals(current.getToken(), kv.get("session_lock:s1"));
    assertTrue(current.release());
  }

  @Test
  void testTryAcquireMakesOneAttempt() {
    LockHandle held = lock.tryAcquire("s1").orElseThrow();

    assertTrue(lock.tryAcquire("s1").isEmpty());
    held.close();
    assertTrue(lock.tryAcquire("s1").isPresent());
    assertTrue(sleeps.isEmpty());
  }

  @Test
  void testBackoffForRetry() {
    LockOptions options = LockOptions.builder().backoffBase(Duration.ofMillis(100)).build();

    assertEquals(Duration.ofMillis(300), options.backoffFor(3));
  }

  @Test
  void testInvalidOptionsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> LockOptions.builder().retries(-1));
    assertThrows(IllegalArgumentException.class, () -> LockOptions.builder().holdTimeout(Duration.ZERO));
    assertThrows(IllegalArgumentException.class, () -> LockOptions.builder().prefix(""));
  }
}
