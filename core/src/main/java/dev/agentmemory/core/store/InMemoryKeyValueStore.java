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

package dev.agentmemory.core.store;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * InMemoryKeyValueStore is a process-local implementation of KeyValueStore.
 *
 * <p>
 * This implementation is suitable for:
 * <ul>
 * <li>Development and testing</li>
 * <li>Single-instance deployments</li>
 * </ul>
 *
 * <p>
 * Expiry is evaluated lazily against the supplied {@link Clock}, so a test can
 * advance time instead of sleeping. <b>Note:</b> data is lost when the process
 * exits and is not shared between processes; use a remote store such as Redis
 * when several workers share sessions.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

  private final Map<String, Entry> data = new HashMap<>();
  private final Clock clock;

  /**
   * Creates a new InMemoryKeyValueStore using the system clock.
   */
  public InMemoryKeyValueStore() {
    this(Clock.systemUTC());
  }

  /**
   * Creates a new InMemoryKeyValueStore.
   *
   * @param clock
   *            the clock used to evaluate expiry
   */
  public InMemoryKeyValueStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public synchronized boolean exists(String key) {
    return live(key) != null;
  }

  @Override
  public synchronized String get(String key) {
    Entry entry = live(key);
    if (entry == null) {
      return null;
    }
    return entry.as(String.class, key);
  }

  @Override
  public synchronized void set(String key, String value, Duration ttl) {
    data.put(key, new Entry(value, deadline(ttl)));
  }

  @Override
  public synchronized boolean setIfAbsent(String key, String value, Duration ttl) {
    if (live(key) != null) {
      return false;
    }
    data.put(key, new Entry(value, deadline(ttl)));
    return true;
  }

  @Override
  public synchronized boolean compareAndDelete(String key, String expectedValue) {
    Entry entry = live(key);
    if (entry == null || !entry.as(String.class, key).equals(expectedValue)) {
      return false;
    }
    data.remove(key);
    return true;
  }

  @Override
  public synchronized Map<String, String> hashGetAll(String key) {
    Entry entry = live(key);
    if (entry == null) {
      return Collections.emptyMap();
    }
    return new LinkedHashMap<>(hash(entry, key));
  }

  @Override
  public synchronized boolean hashPutIfExists(String key, Map<String, String> fields) {
    Entry entry = live(key);
    if (entry == null) {
      return false;
    }
    hash(entry, key).putAll(fields);
    return true;
  }

  @Override
  public synchronized long listPushRight(String key, List<String> values) {
    List<String> list = listForWrite(key);
    list.addAll(values);
    return list.size();
  }

  @Override
  public synchronized List<String> listRange(String key, long start, long end) {
    Entry entry = live(key);
    if (entry == null) {
      return Collections.emptyList();
    }
    List<String> list = list(entry, key);
    int size = list.size();
    long from = start < 0 ? Math.max(0, size + start) : start;
    long to = end < 0 ? size + end : Math.min(end, size - 1L);
    if (from > to || from >= size) {
      return Collections.emptyList();
    }
    return new ArrayList<>(list.subList((int) from, (int) to + 1));
  }

  @Override
  public synchronized String listPopRight(String key) {
    Entry entry = live(key);
    if (entry == null) {
      return null;
    }
    List<String> list = list(entry, key);
    String last = list.remove(list.size() - 1);
    if (list.isEmpty()) {
      data.remove(key);
    }
    return last;
  }

  @Override
  public synchronized long listLength(String key) {
    Entry entry = live(key);
    return entry == null ? 0 : list(entry, key).size();
  }

  @Override
  public synchronized long delete(String... keys) {
    long deleted = 0;
    for (String key : keys) {
      if (live(key) != null) {
        data.remove(key);
        deleted++;
      }
    }
    return deleted;
  }

  @Override
  public synchronized boolean expire(String key, Duration ttl) {
    Entry entry = live(key);
    if (entry == null) {
      return false;
    }
    entry.expiresAtMillis = deadline(requirePositive(ttl));
    return true;
  }

  @Override
  public synchronized long ttlSeconds(String key) {
    Entry entry = live(key);
    if (entry == null) {
      return TTL_MISSING;
    }
    if (entry.expiresAtMillis == 0) {
      return TTL_NONE;
    }
    return (entry.expiresAtMillis - clock.millis() + 500) / 1000;
  }

  @Override
  public synchronized Set<String> scanKeys(String pattern) {
    Pattern regex = globToRegex(pattern);
    Set<String> keys = new TreeSet<>();
    Iterator<Map.Entry<String, Entry>> it = data.entrySet().iterator();
    while (it.hasNext()) {
      Map.Entry<String, Entry> e = it.next();
      if (e.getValue().isExpired(clock.millis())) {
        it.remove();
      } else if (regex.matcher(e.getKey()).matches()) {
        keys.add(e.getKey());
      }
    }
    return keys;
  }

  @Override
  public void atomically(Consumer<StoreBatch> operations) {
    InMemoryBatch batch = new InMemoryBatch();
    operations.accept(batch);
    synchronized (this) {
      for (Runnable op : batch.ops) {
        op.run();
      }
    }
  }

  /**
   * Returns the number of live keys currently stored.
   *
   * @return the key count
   */
  public synchronized int size() {
    data.values().removeIf(e -> e.isExpired(clock.millis()));
    return data.size();
  }

  @Override
  public void close() {
    // Nothing to release
  }

  private Entry live(String key) {
    Entry entry = data.get(key);
    if (entry == null) {
      return null;
    }
    if (entry.isExpired(clock.millis())) {
      data.remove(key);
      return null;
    }
    return entry;
  }

  private long deadline(Duration ttl) {
    return ttl == null ? 0 : clock.millis() + requirePositive(ttl).toMillis();
  }

  private static Duration requirePositive(Duration ttl) {
    if (ttl == null || ttl.isZero() || ttl.isNegative()) {
      throw new IllegalArgumentException("ttl must be positive: " + ttl);
    }
    return ttl;
  }

  @SuppressWarnings("unchecked")
  private static Map<String, String> hash(Entry entry, String key) {
    return entry.as(Map.class, key);
  }

  @SuppressWarnings("unchecked")
  private static List<String> list(Entry entry, String key) {
    return entry.as(List.class, key);
  }

  private Map<String, String> hashForWrite(String key) {
    Entry entry = live(key);
    if (entry == null) {
      entry = new Entry(new LinkedHashMap<String, String>(), 0);
      data.put(key, entry);
    }
    return hash(entry, key);
  }

  private List<String> listForWrite(String key) {
    Entry entry = live(key);
    if (entry == null) {
      entry = new Entry(new ArrayList<String>(), 0);
      data.put(key, entry);
    }
    return list(entry, key);
  }

  static Pattern globToRegex(String glob) {
    StringBuilder regex = new StringBuilder();
    for (int i = 0; i < glob.length(); i++) {
      char c = glob.charAt(i);
      switch (c) {
        case '*':
          regex.append(".*");
          break;
        case '?':
          regex.append('.');
          break;
        case '[': {
          int close = glob.indexOf(']', i + 1);
          if (close < 0) {
            regex.append("\\[");
          } else {
            regex.append(glob, i, close + 1);
            i = close;
          }
          break;
        }
        case '\\':
          if (i + 1 < glob.length()) {
            regex.append(Pattern.quote(String.valueOf(glob.charAt(++i))));
          }
          break;
        default:
          regex.append(Pattern.quote(String.valueOf(c)));
      }
    }
    return Pattern.compile(regex.toString(), Pattern.DOTALL);
  }

  private final class InMemoryBatch implements StoreBatch {

    private final List<Runnable> ops = new ArrayList<>();

    @Override
    public StoreBatch hashPut(String key, Map<String, String> fields) {
      Map<String, String> copy = new LinkedHashMap<>(fields);
      ops.add(() -> hashForWrite(key).putAll(copy));
      return this;
    }

    @Override
    public StoreBatch hashPutIfAbsent(String key, String field, String value) {
      ops.add(() -> hashForWrite(key).putIfAbsent(field, value));
      return this;
    }

    @Override
    public StoreBatch listPushRight(String key, List<String> values) {
      List<String> copy = new ArrayList<>(values);
      ops.add(() -> listForWrite(key).addAll(copy));
      return this;
    }

    @Override
    public StoreBatch expire(String key, Duration ttl) {
      requirePositive(ttl);
      ops.add(() -> InMemoryKeyValueStore.this.expire(key, ttl));
      return this;
    }
  }

  private static final class Entry {

    final Object value;
    long expiresAtMillis;

    Entry(Object value, long expiresAtMillis) {
      this.value = value;
      this.expiresAtMillis = expiresAtMillis;
    }

    boolean isExpired(long nowMillis) {
      return expiresAtMillis > 0 && nowMillis >= expiresAtMillis;
    }

    <T> T as(Class<T> type, String key) {
      if (!type.isInstance(value)) {
        throw new StoreException("WRONGTYPE Operation against key '" + key + "' holding the wrong kind of value",
            null);
      }
      return type.cast(value);
    }
  }
}
