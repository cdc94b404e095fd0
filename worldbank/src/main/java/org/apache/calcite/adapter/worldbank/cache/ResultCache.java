/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.worldbank.cache;

import org.apache.calcite.adapter.worldbank.FetchException;
import org.apache.calcite.adapter.worldbank.WorldBankException;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * In-memory cache of load results with a time-to-live.
 *
 * <p>An entry is fresh while {@code now - fetchedAt <= ttl}. On a miss the
 * loader runs in the calling thread; other threads asking for the same key
 * meanwhile wait for that load instead of starting their own. Waiting is
 * interruptible.
 *
 * <p>Failed loads are not cached and leave any earlier entry in place, so
 * {@link #peek(CacheKey)} can still serve it. Invalidation removes entries
 * and detaches in-flight loads: their results are handed to the callers
 * already waiting but are not stored.
 */
public class ResultCache {
  private static final Logger LOGGER = LoggerFactory.getLogger(ResultCache.class);

  private final Clock clock;
  private final Object lock = new Object();
  /** Guarded by {@link #lock}. */
  private final Map<CacheKey, Entry> entries = new HashMap<>();
  /** Guarded by {@link #lock}. */
  private final Map<CacheKey, CompletableFuture<Object>> inFlight = new HashMap<>();

  public ResultCache() {
    this(Clock.systemUTC());
  }

  public ResultCache(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Returns the cached payload for {@code key} if it is younger than
   * {@code ttl}, otherwise runs {@code loader}, stores and returns its result.
   *
   * <p>The caller is responsible for using each key with a single payload
   * type.
   *
   * @throws RuntimeException whatever the loader threw; nothing is stored
   */
  public <T> T getOrLoad(CacheKey key, Duration ttl, Supplier<? extends T> loader) {
    CompletableFuture<Object> pending;
    boolean owner = false;
    synchronized (lock) {
      Entry entry = entries.get(key);
      if (entry != null && entry.isFresh(clock.instant(), ttl)) {
        LOGGER.debug("Cache hit for {}", key);
        return cast(entry.payload);
      }
      pending = inFlight.get(key);
      if (pending == null) {
        pending = new CompletableFuture<>();
        inFlight.put(key, pending);
        owner = true;
      }
    }

    if (!owner) {
      LOGGER.debug("Waiting for in-flight load of {}", key);
      return cast(await(key, pending));
    }
    return cast(load(key, loader, pending));
  }

  private Object load(CacheKey key, Supplier<?> loader, CompletableFuture<Object> pending) {
    LOGGER.debug("Cache miss for {}, loading", key);
    Object payload;
    try {
      payload = Objects.requireNonNull(loader.get(), () -> "loader returned null for " + key);
    } catch (RuntimeException | Error e) {
      synchronized (lock) {
        inFlight.remove(key, pending);
      }
      pending.completeExceptionally(e);
      throw e;
    }

    synchronized (lock) {
      if (inFlight.remove(key, pending)) {
        entries.put(key, new Entry(payload, clock.instant()));
      } else {
        LOGGER.debug("{} was invalidated while loading; result not stored", key);
      }
    }
    pending.complete(payload);
    return payload;
  }

  private static Object await(CacheKey key, CompletableFuture<Object> pending) {
    try {
      return pending.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw FetchException.transport("Interrupted while waiting for " + key, e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new WorldBankException("Load of " + key + " failed", cause);
    }
  }

  /**
   * Returns the stored payload for {@code key} regardless of its age.
   */
  public <T> Optional<T> peek(CacheKey key) {
    synchronized (lock) {
      Entry entry = entries.get(key);
      return entry == null ? Optional.empty() : Optional.of(cast(entry.payload));
    }
  }

  /**
   * Returns when the payload for {@code key} was stored, or null if none is.
   */
  public @Nullable Instant fetchedAt(CacheKey key) {
    synchronized (lock) {
      Entry entry = entries.get(key);
      return entry == null ? null : entry.fetchedAt;
    }
  }

  /** Removes the entry for {@code key}; the next lookup will load. */
  public void invalidate(CacheKey key) {
    synchronized (lock) {
      boolean removed = entries.remove(key) != null;
      boolean detached = inFlight.remove(key) != null;
      LOGGER.info("Invalidated {} (entry removed: {}, in-flight load detached: {})",
          key, removed, detached);
    }
  }

  /** Removes every entry; the next lookup of any key will load. */
  public void invalidateAll() {
    synchronized (lock) {
      int count = entries.size();
      entries.clear();
      inFlight.clear();
      LOGGER.info("Invalidated all {} cache entries", count);
    }
  }

  public boolean contains(CacheKey key) {
    synchronized (lock) {
      return entries.containsKey(key);
    }
  }

  public int size() {
    synchronized (lock) {
      return entries.size();
    }
  }

  @SuppressWarnings("unchecked")
  private static <T> T cast(Object payload) {
    return (T) payload;
  }

  /** A stored payload. */
  private static final class Entry {
    final Object payload;
    final Instant fetchedAt;

    Entry(Object payload, Instant fetchedAt) {
      this.payload = payload;
      this.fetchedAt = fetchedAt;
    }

    boolean isFresh(Instant now, Duration ttl) {
      return !now.isAfter(fetchedAt.plus(ttl));
    }
  }
}
