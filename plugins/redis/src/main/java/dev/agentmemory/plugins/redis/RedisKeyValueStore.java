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

package dev.agentmemory.plugins.redis;

import java.net.SocketTimeoutException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Consumer;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.agentmemory.core.store.KeyValueStore;
import dev.agentmemory.core.store.StoreBatch;
import dev.agentmemory.core.store.StoreException;
import dev.agentmemory.core.store.StoreTimeoutException;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisClientConfig;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.Transaction;
import redis.clients.jedis.exceptions.JedisConnectionException;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.params.SetParams;
import redis.clients.jedis.resps.ScanResult;
import redis.clients.jedis.util.JedisURIHelper;

/**
 * RedisKeyValueStore implements {@link KeyValueStore} on a Redis server through
 * a Jedis connection pool.
 *
 * <p>
 * Batches run inside {@code MULTI}/{@code EXEC}; compare-and-delete and
 * conditional hash writes run as Lua scripts so the check and the write are
 * one step. Expiries are set in
 * milliseconds. Client failures surface as {@link StoreException}, socket
 * timeouts as {@link StoreTimeoutException}.
 */
public class RedisKeyValueStore implements KeyValueStore {

  private static final Logger logger = LoggerFactory.getLogger(RedisKeyValueStore.class);

  static final String COMPARE_AND_DELETE_SCRIPT = "if redis.call('get', KEYS[1]) == ARGV[1] then "
      + "return redis.call('del', KEYS[1]) else return 0 end";
  static final String HASH_PUT_IF_EXISTS_SCRIPT = "if redis.call('exists', KEYS[1]) == 0 then return 0 end "
      + "redis.call('hset', KEYS[1], unpack(ARGV)) return 1";
  private static final int SCAN_COUNT = 200;
  private static final int DEFAULT_PORT = 6379;

  private final JedisPool pool;

  /**
   * Creates a store connected as described by {@code options}.
   *
   * @param options
   *            the connection settings
   */
  public RedisKeyValueStore(RedisStoreOptions options) {
    this(createPool(options));
    logger.info("Connected Redis store to {} (max connections: {})", redact(options.getUrl()),
        options.getMaxConnections());
  }

  RedisKeyValueStore(JedisPool pool) {
    this.pool = pool;
  }

  static JedisPool createPool(RedisStoreOptions options) {
    URI uri = URI.create(options.getUrl());
    if (!JedisURIHelper.isValid(uri)) {
      throw new IllegalArgumentException("Invalid Redis URL: " + redact(options.getUrl()));
    }
    HostAndPort address = new HostAndPort(uri.getHost(), uri.getPort() > 0 ? uri.getPort() : DEFAULT_PORT);
    JedisClientConfig clientConfig = clientConfig(uri, options);

    JedisPoolConfig poolConfig = new JedisPoolConfig();
    poolConfig.setMaxTotal(options.getMaxConnections());
    poolConfig.setMaxIdle(options.getMaxConnections());
    poolConfig.setMaxWait(options.getTimeout());
    return new JedisPool(poolConfig, address, clientConfig);
  }

  static JedisClientConfig clientConfig(URI uri, RedisStoreOptions options) {
    int timeoutMillis = (int) options.getTimeout().toMillis();
    String path = uri.getPath();
    int database = path != null && path.length() > 1 ? JedisURIHelper.getDBIndex(uri) : options.getDatabase();
    return DefaultJedisClientConfig.builder().connectionTimeoutMillis(timeoutMillis).socketTimeoutMillis(timeoutMillis)
        .database(database).user(JedisURIHelper.getUser(uri)).password(JedisURIHelper.getPassword(uri))
        .ssl(JedisURIHelper.isRedisSSLScheme(uri)).build();
  }

  @Override
  public boolean exists(String key) {
    return call("EXISTS", jedis -> jedis.exists(key));
  }

  @Override
  public String get(String key) {
    return call("GET", jedis -> jedis.get(key));
  }

  @Override
  public void set(String key, String value, Duration ttl) {
    if (ttl == null) {
      call("SET", jedis -> jedis.set(key, value));
    } else {
      SetParams params = SetParams.setParams().px(millis(ttl));
      call("SET", jedis -> jedis.set(key, value, params));
    }
  }

  @Override
  public boolean setIfAbsent(String key, String value, Duration ttl) {
    SetParams params = SetParams.setParams().nx();
    if (ttl != null) {
      params.px(millis(ttl));
    }
    return "OK".equals(call("SET NX", jedis -> jedis.set(key, value, params)));
  }

  @Override
  public boolean compareAndDelete(String key, String expectedValue) {
    Object deleted = call("EVAL", jedis -> jedis.eval(COMPARE_AND_DELETE_SCRIPT, Collections.singletonList(key),
        Collections.singletonList(expectedValue)));
    return deleted instanceof Long && (Long) deleted > 0;
  }

  @Override
  public Map<String, String> hashGetAll(String key) {
    return call("HGETALL", jedis -> jedis.hgetAll(key));
  }

  @Override
  public boolean hashPutIfExists(String key, Map<String, String> fields) {
    if (fields.isEmpty()) {
      return exists(key);
    }
    List<String> args = new ArrayList<>(fields.size() * 2);
    for (Map.Entry<String, String> field : fields.entrySet()) {
      args.add(field.getKey());
      args.add(field.getValue());
    }
    Object updated = call("EVAL",
        jedis -> jedis.eval(HASH_PUT_IF_EXISTS_SCRIPT, Collections.singletonList(key), args));
    return updated instanceof Long && (Long) updated > 0;
  }

  @Override
  public long listPushRight(String key, List<String> values) {
    if (values.isEmpty()) {
      return listLength(key);
    }
    return call("RPUSH", jedis -> jedis.rpush(key, values.toArray(new String[0])));
  }

  @Override
  public List<String> listRange(String key, long start, long end) {
    return call("LRANGE", jedis -> jedis.lrange(key, start, end));
  }

  @Override
  public String listPopRight(String key) {
    return call("RPOP", jedis -> jedis.rpop(key));
  }

  @Override
  public long listLength(String key) {
    return call("LLEN", jedis -> jedis.llen(key));
  }

  @Override
  public long delete(String... keys) {
    if (keys.length == 0) {
      return 0;
    }
    return call("DEL", jedis -> jedis.del(keys));
  }

  @Override
  public boolean expire(String key, Duration ttl) {
    long ttlMillis = millis(ttl);
    return call("PEXPIRE", jedis -> jedis.pexpire(key, ttlMillis)) == 1L;
  }

  @Override
  public long ttlSeconds(String key) {
    return call("TTL", jedis -> jedis.ttl(key));
  }

  @Override
  public Set<String> scanKeys(String pattern) {
    return call("SCAN", jedis -> {
      Set<String> keys = new TreeSet<>();
      ScanParams params = new ScanParams().match(pattern).count(SCAN_COUNT);
      String cursor = ScanParams.SCAN_POINTER_START;
      do {
        ScanResult<String> page = jedis.scan(cursor, params);
        keys.addAll(page.getResult());
        cursor = page.getCursor();
      } while (!ScanParams.SCAN_POINTER_START.equals(cursor));
      return keys;
    });
  }

  @Override
  public void atomically(Consumer<StoreBatch> operations) {
    TransactionBatch batch = new TransactionBatch();
    operations.accept(batch);
    if (batch.commands.isEmpty()) {
      return;
    }
    List<Object> replies = call("MULTI/EXEC", jedis -> {
      Transaction transaction = jedis.multi();
      boolean executed = false;
      try {
        for (Consumer<Transaction> command : batch.commands) {
          command.accept(transaction);
        }
        List<Object> results = transaction.exec();
        executed = true;
        return results;
      } finally {
        if (!executed) {
          discardQuietly(transaction);
        }
      }
    });
    if (replies == null) {
      throw new StoreException("Redis transaction was aborted", null);
    }
    for (Object reply : replies) {
      if (reply instanceof Exception) {
        throw new StoreException("Redis transaction command failed: " + ((Exception) reply).getMessage(),
            (Exception) reply);
      }
    }
  }

  @Override
  public void close() {
    pool.close();
    logger.info("Closed Redis store");
  }

  private <R> R call(String command, Function<Jedis, R> action) {
    try (Jedis jedis = pool.getResource()) {
      return action.apply(jedis);
    } catch (JedisConnectionException e) {
      if (isTimeout(e)) {
        throw new StoreTimeoutException("Redis " + command + " timed out", e);
      }
      throw new StoreException("Redis " + command + " failed: " + e.getMessage(), e);
    } catch (JedisException e) {
      throw new StoreException("Redis " + command + " failed: " + e.getMessage(), e);
    }
  }

  private static void discardQuietly(Transaction transaction) {
    try {
      transaction.discard();
    } catch (JedisException e) {
      logger.debug("Failed to discard Redis transaction: {}", e.getMessage());
    }
  }

  static boolean isTimeout(Throwable error) {
    for (Throwable cause = error; cause != null; cause = cause.getCause()) {
      if (cause instanceof SocketTimeoutException) {
        return true;
      }
    }
    return false;
  }

  static String redact(String url) {
    int at = url.lastIndexOf('@');
    int scheme = url.indexOf("://");
    if (at < 0 || scheme < 0 || at < scheme) {
      return url;
    }
    return url.substring(0, scheme + 3) + "***" + url.substring(at);
  }

  private static long millis(Duration ttl) {
    long value = ttl.toMillis();
    if (value <= 0) {
      throw new IllegalArgumentException("ttl must be positive: " + ttl);
    }
    return value;
  }

  /** Queues commands for one MULTI/EXEC block. */
  private static final class TransactionBatch implements StoreBatch {
    private final List<Consumer<Transaction>> commands = new ArrayList<>();

    @Override
    public StoreBatch hashPut(String key, Map<String, String> fields) {
      if (!fields.isEmpty()) {
        Map<String, String> copy = Map.copyOf(fields);
        commands.add(tx -> tx.hset(key, copy));
      }
      return this;
    }

    @Override
    public StoreBatch hashPutIfAbsent(String key, String field, String value) {
      commands.add(tx -> tx.hsetnx(key, field, value));
      return this;
    }

    @Override
    public StoreBatch listPushRight(String key, List<String> values) {
      if (!values.isEmpty()) {
        String[] copy = values.toArray(new String[0]);
        commands.add(tx -> tx.rpush(key, copy));
      }
      return this;
    }

    @Override
    public StoreBatch expire(String key, Duration ttl) {
      long ttlMillis = millis(ttl);
      commands.add(tx -> tx.pexpire(key, ttlMillis));
      return this;
    }
  }
}
