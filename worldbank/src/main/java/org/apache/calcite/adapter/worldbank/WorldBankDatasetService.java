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
package org.apache.calcite.adapter.worldbank;

import org.apache.calcite.adapter.worldbank.cache.CacheKey;
import org.apache.calcite.adapter.worldbank.cache.ResultCache;
import org.apache.calcite.adapter.worldbank.catalog.EntityCatalog;
import org.apache.calcite.adapter.worldbank.catalog.EntityCatalogLoader;
import org.apache.calcite.adapter.worldbank.http.HttpClientTransport;
import org.apache.calcite.adapter.worldbank.http.PageTransport;
import org.apache.calcite.adapter.worldbank.http.Paginator;
import org.apache.calcite.adapter.worldbank.join.DatasetJoiner;
import org.apache.calcite.adapter.worldbank.join.JoinedRow;
import org.apache.calcite.adapter.worldbank.series.ReducedSeriesRow;
import org.apache.calcite.adapter.worldbank.series.SeriesReducer;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Builds the "latest value per country" dataset for an indicator.
 *
 * <p>The country catalog and the reduced indicator series are loaded
 * concurrently, each through the shared {@link ResultCache}, and joined once
 * both are available. The whole build is bounded by
 * {@link WorldBankConfig#getDatasetDeadline()}; loads still running at the
 * deadline are cancelled and their fetch threads interrupted, so they do
 * not hold the pool for later builds.
 *
 * <p>Transport failures and timeouts of a single load are retried with
 * exponential backoff up to {@link WorldBankConfig#getMaxRetries()} times;
 * malformed responses are not. A failed build never returns partial rows.
 *
 * <pre>{@code
 * try (WorldBankDatasetService service =
 *          new WorldBankDatasetService(WorldBankConfig.loadDefaults())) {
 *   List<JoinedRow> rows = service.buildDataset("NY.GDP.MKTP.CD");
 *   service.invalidateAll();   // manual refresh
 * }
 * }</pre>
 */
public class WorldBankDatasetService implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(WorldBankDatasetService.class);

  static final String CATALOG = "catalog";
  static final String INDICATOR_LATEST = "indicator_latest";

  private final WorldBankConfig config;
  private final EntityCatalogLoader catalogLoader;
  private final SeriesReducer seriesReducer;
  private final ResultCache cache;
  private final ExecutorService executor;

  public WorldBankDatasetService(WorldBankConfig config) {
    this(config, new HttpClientTransport(config.getUserAgent()), Clock.systemUTC());
  }

  public WorldBankDatasetService(WorldBankConfig config, PageTransport transport, Clock clock) {
    this.config = config;
    Paginator paginator = new Paginator(config.getBaseUrl(), transport, config.getMaxPages());
    this.catalogLoader = new EntityCatalogLoader(paginator, config.getCatalogPageSize(),
        config.getCatalogTimeout(), config.getSentinelGroupId());
    this.seriesReducer = new SeriesReducer(paginator, config.getSeriesPageSize(),
        config.getSeriesTimeout());
    this.cache = new ResultCache(clock);
    this.executor = Executors.newFixedThreadPool(config.getFetchThreads(),
        new ThreadFactoryBuilder()
            .setNameFormat("worldbank-fetch-%d")
            .setDaemon(true)
            .build());
  }

  public WorldBankConfig getConfig() {
    return config;
  }

  ResultCache getCache() {
    return cache;
  }

  public static CacheKey catalogKey() {
    return CacheKey.of(CATALOG);
  }

  public static CacheKey latestKey(String indicator, int start, int end) {
    return new CacheKey(INDICATOR_LATEST, ImmutableMap.of(
        "indicator", indicator,
        "start", String.valueOf(start),
        "end", String.valueOf(end)));
  }

  /**
   * Returns the country catalog, from the cache when fresh.
   */
  public EntityCatalog loadCatalog() {
    return cache.getOrLoad(catalogKey(), config.getCacheTtl(),
        () -> withRetry(CATALOG, catalogLoader::loadCatalog));
  }

  /**
   * Returns the latest valued observation per country for the configured
   * period range.
   */
  public ImmutableSortedMap<String, ReducedSeriesRow> loadLatest(String indicator) {
    return loadLatest(indicator, config.getStartPeriod(), config.getEndPeriod());
  }

  /**
   * Returns the latest valued observation per country within
   * {@code [start, end]}, from the cache when fresh.
   *
   * @param indicator Indicator code or registered short name
   */
  public ImmutableSortedMap<String, ReducedSeriesRow> loadLatest(String indicator,
      int start, int end) {
    String code = WorldBankIndicators.resolveCode(indicator);
    CacheKey key = latestKey(code, start, end);
    return cache.getOrLoad(key, config.getCacheTtl(),
        () -> withRetry(key.asString(), () -> seriesReducer.loadLatest(code, start, end)));
  }

  /**
   * Builds the dataset for the configured period range.
   */
  public ImmutableList<JoinedRow> buildDataset(String indicator) {
    return buildDataset(indicator, config.getStartPeriod(), config.getEndPeriod());
  }

  /**
   * Builds the dataset: one row per catalog country with its latest value
   * of {@code indicator} in {@code [start, end]}, or null period and value
   * when it has none.
   *
   * @throws FetchException if either load fails or the deadline passes
   */
  public ImmutableList<JoinedRow> buildDataset(String indicator, int start, int end) {
    String code = WorldBankIndicators.resolveCode(indicator);
    long begin = System.nanoTime();
    long deadline = begin + config.getDatasetDeadline().toNanos();

    Future<EntityCatalog> catalogFuture = executor.submit(this::loadCatalog);
    Future<ImmutableSortedMap<String, ReducedSeriesRow>> latestFuture =
        executor.submit(() -> loadLatest(code, start, end));

    EntityCatalog catalog;
    ImmutableSortedMap<String, ReducedSeriesRow> latest;
    try {
      catalog = catalogFuture.get(remaining(deadline), TimeUnit.NANOSECONDS);
      latest = latestFuture.get(remaining(deadline), TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      cancel(catalogFuture, latestFuture);
      throw FetchException.timeout("Dataset for " + code + " not built within "
          + config.getDatasetDeadline(), e);
    } catch (ExecutionException e) {
      cancel(catalogFuture, latestFuture);
      throw unwrapFailure(e.getCause(), code);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      cancel(catalogFuture, latestFuture);
      throw FetchException.transport("Interrupted while building dataset for " + code, e);
    }

    ImmutableList<JoinedRow> rows = DatasetJoiner.join(catalog, latest);
    LOGGER.info("Built dataset for {} ({}:{}): {} rows in {} ms", code, start, end, rows.size(),
        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - begin));
    return rows;
  }

  /** Sorted region names of the catalog, for filter controls. */
  public ImmutableSortedSet<String> groupNames() {
    return loadCatalog().groupNames();
  }

  /** Sorted income levels of the catalog, for filter controls. */
  public ImmutableSortedSet<String> tiers() {
    return loadCatalog().tiers();
  }

  public void invalidate(CacheKey key) {
    cache.invalidate(key);
  }

  public void invalidateCatalog() {
    cache.invalidate(catalogKey());
  }

  public void invalidateLatest(String indicator, int start, int end) {
    cache.invalidate(latestKey(WorldBankIndicators.resolveCode(indicator), start, end));
  }

  /** Drops every cached catalog and series; the next build fetches afresh. */
  public void invalidateAll() {
    cache.invalidateAll();
  }

  @Override public void close() {
    executor.shutdownNow();
  }

  /** Runs {@code load}, retrying retryable failures with exponential backoff. */
  <T> T withRetry(String what, Supplier<T> load) {
    int attempt = 0;
    while (true) {
      try {
        return load.get();
      } catch (FetchException e) {
        if (!e.getKind().isRetryable() || attempt >= config.getMaxRetries()
            || Thread.currentThread().isInterrupted()) {
          throw e;
        }
        long delay = config.getRetryDelayMs() * (1L << attempt);
        attempt++;
        LOGGER.warn("Loading {} failed ({}): {} - retrying in {} ms (attempt {}/{})",
            what, e.getKind(), e.getMessage(), delay, attempt, config.getMaxRetries());
        try {
          Thread.sleep(delay);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw FetchException.transport("Interrupted while waiting to retry " + what, ie);
        }
      }
    }
  }

  private static RuntimeException unwrapFailure(Throwable cause, String indicator) {
    if (cause instanceof RuntimeException) {
      return (RuntimeException) cause;
    }
    if (cause instanceof Error) {
      throw (Error) cause;
    }
    return FetchException.transport("Building dataset for " + indicator + " failed", cause);
  }

  private static long remaining(long deadline) {
    return Math.max(0L, deadline - System.nanoTime());
  }

  /** Cancels loads still running; their worker threads are interrupted. */
  private static void cancel(Future<?>... futures) {
    for (Future<?> future : futures) {
      future.cancel(true);
    }
  }
}
