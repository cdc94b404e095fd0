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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration for the World Bank dataset pipeline.
 *
 * <p>Defaults live in the classpath resource {@value #DEFAULTS_RESOURCE};
 * model operands can override any key:
 * <pre>{@code
 * {
 *   "baseUrl": "https://api.worldbank.org/v2/",
 *   "catalogPageSize": 300,
 *   "seriesPageSize": 20000,
 *   "cacheTtlSeconds": 86400,
 *   "startPeriod": 2010,
 *   "endPeriod": 2028,
 *   "sentinelGroupId": "NA"
 * }
 * }</pre>
 */
public class WorldBankConfig {
  public static final String DEFAULTS_RESOURCE = "/worldbank/worldbank-pipeline.json";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final String baseUrl;
  private final int catalogPageSize;
  private final int seriesPageSize;
  private final Duration catalogTimeout;
  private final Duration seriesTimeout;
  private final Duration cacheTtl;
  private final int startPeriod;
  private final int endPeriod;
  private final String sentinelGroupId;
  private final int maxPages;
  private final int maxRetries;
  private final long retryDelayMs;
  private final Duration datasetDeadline;
  private final int fetchThreads;
  private final String userAgent;

  private WorldBankConfig(Builder builder) {
    if (builder.baseUrl == null || builder.baseUrl.isEmpty()) {
      throw new IllegalArgumentException("baseUrl is required");
    }
    if (builder.catalogPageSize <= 0 || builder.seriesPageSize <= 0) {
      throw new IllegalArgumentException("page sizes must be positive");
    }
    if (builder.startPeriod > builder.endPeriod) {
      throw new IllegalArgumentException("startPeriod " + builder.startPeriod
          + " is after endPeriod " + builder.endPeriod);
    }
    if (builder.maxPages <= 0) {
      throw new IllegalArgumentException("maxPages must be positive");
    }
    if (builder.maxRetries < 0 || builder.retryDelayMs < 0) {
      throw new IllegalArgumentException("retry settings must not be negative");
    }
    if (builder.fetchThreads <= 0) {
      throw new IllegalArgumentException("fetchThreads must be positive");
    }
    requirePositive("catalogTimeout", builder.catalogTimeout);
    requirePositive("seriesTimeout", builder.seriesTimeout);
    requirePositive("datasetDeadline", builder.datasetDeadline);
    if (builder.cacheTtl == null || builder.cacheTtl.isNegative()) {
      throw new IllegalArgumentException("cacheTtl must not be negative, got "
          + builder.cacheTtl);
    }
    if (builder.sentinelGroupId == null || builder.userAgent == null) {
      throw new IllegalArgumentException("sentinelGroupId and userAgent are required");
    }
    this.baseUrl = builder.baseUrl.endsWith("/") ? builder.baseUrl : builder.baseUrl + "/";
    this.catalogPageSize = builder.catalogPageSize;
    this.seriesPageSize = builder.seriesPageSize;
    this.catalogTimeout = builder.catalogTimeout;
    this.seriesTimeout = builder.seriesTimeout;
    this.cacheTtl = builder.cacheTtl;
    this.startPeriod = builder.startPeriod;
    this.endPeriod = builder.endPeriod;
    this.sentinelGroupId = builder.sentinelGroupId;
    this.maxPages = builder.maxPages;
    this.maxRetries = builder.maxRetries;
    this.retryDelayMs = builder.retryDelayMs;
    this.datasetDeadline = builder.datasetDeadline;
    this.fetchThreads = builder.fetchThreads;
    this.userAgent = builder.userAgent;
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  public int getCatalogPageSize() {
    return catalogPageSize;
  }

  public int getSeriesPageSize() {
    return seriesPageSize;
  }

  public Duration getCatalogTimeout() {
    return catalogTimeout;
  }

  public Duration getSeriesTimeout() {
    return seriesTimeout;
  }

  public Duration getCacheTtl() {
    return cacheTtl;
  }

  public int getStartPeriod() {
    return startPeriod;
  }

  public int getEndPeriod() {
    return endPeriod;
  }

  public String getSentinelGroupId() {
    return sentinelGroupId;
  }

  public int getMaxPages() {
    return maxPages;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public long getRetryDelayMs() {
    return retryDelayMs;
  }

  public Duration getDatasetDeadline() {
    return datasetDeadline;
  }

  public int getFetchThreads() {
    return fetchThreads;
  }

  public String getUserAgent() {
    return userAgent;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Loads the defaults resource.
   */
  public static WorldBankConfig loadDefaults() {
    return load(null);
  }

  /**
   * Loads the defaults resource and layers {@code overrides} on top of it.
   *
   * @param overrides Operand values, may be null
   */
  public static WorldBankConfig load(@Nullable Map<String, Object> overrides) {
    Map<String, Object> merged = new LinkedHashMap<>(readDefaults());
    if (overrides != null) {
      merged.putAll(overrides);
    }
    return fromMap(merged);
  }

  private static Map<String, Object> readDefaults() {
    try (InputStream is = WorldBankConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
      if (is == null) {
        throw new WorldBankException("Could not find " + DEFAULTS_RESOURCE);
      }
      return MAPPER.readValue(is, new TypeReference<Map<String, Object>>() { });
    } catch (IOException e) {
      throw new WorldBankException("Failed to read " + DEFAULTS_RESOURCE, e);
    }
  }

  /**
   * Builds a configuration from an operand map. Absent keys keep the
   * builder defaults.
   */
  public static WorldBankConfig fromMap(Map<String, Object> map) {
    Builder builder = builder();
    builder.baseUrl(stringValue(map, "baseUrl", builder.baseUrl));
    builder.catalogPageSize(intValue(map, "catalogPageSize", builder.catalogPageSize));
    builder.seriesPageSize(intValue(map, "seriesPageSize", builder.seriesPageSize));
    builder.catalogTimeout(
        Duration.ofSeconds(longValue(map, "catalogTimeoutSeconds",
            builder.catalogTimeout.getSeconds())));
    builder.seriesTimeout(
        Duration.ofSeconds(longValue(map, "seriesTimeoutSeconds",
            builder.seriesTimeout.getSeconds())));
    builder.cacheTtl(
        Duration.ofSeconds(longValue(map, "cacheTtlSeconds", builder.cacheTtl.getSeconds())));
    builder.periods(intValue(map, "startPeriod", builder.startPeriod),
        intValue(map, "endPeriod", builder.endPeriod));
    builder.sentinelGroupId(stringValue(map, "sentinelGroupId", builder.sentinelGroupId));
    builder.maxPages(intValue(map, "maxPages", builder.maxPages));
    builder.maxRetries(intValue(map, "maxRetries", builder.maxRetries));
    builder.retryDelayMs(longValue(map, "retryDelayMs", builder.retryDelayMs));
    builder.datasetDeadline(
        Duration.ofSeconds(longValue(map, "datasetDeadlineSeconds",
            builder.datasetDeadline.getSeconds())));
    builder.fetchThreads(intValue(map, "fetchThreads", builder.fetchThreads));
    builder.userAgent(stringValue(map, "userAgent", builder.userAgent));
    return builder.build();
  }

  private static String stringValue(Map<String, Object> map, String key, String defaultValue) {
    Object value = map.get(key);
    if (value == null) {
      return defaultValue;
    }
    if (!(value instanceof String)) {
      throw new IllegalArgumentException("'" + key + "' must be a string, got: " + value);
    }
    return (String) value;
  }

  private static int intValue(Map<String, Object> map, String key, int defaultValue) {
    long value = longValue(map, key, defaultValue);
    if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("'" + key + "' is out of range: " + value);
    }
    return (int) value;
  }

  private static long longValue(Map<String, Object> map, String key, long defaultValue) {
    Object value = map.get(key);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Number) {
      return ((Number) value).longValue();
    }
    try {
      return Long.parseLong(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("'" + key + "' must be a number, got: " + value, e);
    }
  }

  private static void requirePositive(String name, Duration duration) {
    if (duration == null || duration.isNegative() || duration.isZero()) {
      throw new IllegalArgumentException(name + " must be positive, got " + duration);
    }
  }

  @Override public String toString() {
    return "WorldBankConfig{baseUrl=" + baseUrl
        + ", periods=" + startPeriod + ":" + endPeriod
        + ", cacheTtl=" + cacheTtl
        + ", sentinelGroupId=" + sentinelGroupId + "}";
  }

  /**
   * Builder for {@link WorldBankConfig}.
   */
  public static class Builder {
    private String baseUrl = "https://api.worldbank.org/v2/";
    private int catalogPageSize = 300;
    private int seriesPageSize = 20000;
    private Duration catalogTimeout = Duration.ofSeconds(120);
    private Duration seriesTimeout = Duration.ofSeconds(180);
    private Duration cacheTtl = Duration.ofHours(24);
    private int startPeriod = 2010;
    private int endPeriod = 2028;
    private String sentinelGroupId = "NA";
    private int maxPages = 1000;
    private int maxRetries = 2;
    private long retryDelayMs = 1000;
    private Duration datasetDeadline = Duration.ofMinutes(10);
    private int fetchThreads = 2;
    private String userAgent = "Calcite-WorldBank/1.0";

    public Builder baseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
      return this;
    }

    public Builder catalogPageSize(int catalogPageSize) {
      this.catalogPageSize = catalogPageSize;
      return this;
    }

    public Builder seriesPageSize(int seriesPageSize) {
      this.seriesPageSize = seriesPageSize;
      return this;
    }

    public Builder catalogTimeout(Duration catalogTimeout) {
      this.catalogTimeout = catalogTimeout;
      return this;
    }

    public Builder seriesTimeout(Duration seriesTimeout) {
      this.seriesTimeout = seriesTimeout;
      return this;
    }

    public Builder cacheTtl(Duration cacheTtl) {
      this.cacheTtl = cacheTtl;
      return this;
    }

    public Builder periods(int startPeriod, int endPeriod) {
      this.startPeriod = startPeriod;
      this.endPeriod = endPeriod;
      return this;
    }

    public Builder sentinelGroupId(String sentinelGroupId) {
      this.sentinelGroupId = sentinelGroupId;
      return this;
    }

    public Builder maxPages(int maxPages) {
      this.maxPages = maxPages;
      return this;
    }

    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    public Builder retryDelayMs(long retryDelayMs) {
      this.retryDelayMs = retryDelayMs;
      return this;
    }

    public Builder datasetDeadline(Duration datasetDeadline) {
      this.datasetDeadline = datasetDeadline;
      return this;
    }

    public Builder fetchThreads(int fetchThreads) {
      this.fetchThreads = fetchThreads;
      return this;
    }

    public Builder userAgent(String userAgent) {
      this.userAgent = userAgent;
      return this;
    }

    public WorldBankConfig build() {
      return new WorldBankConfig(this);
    }
  }
}
