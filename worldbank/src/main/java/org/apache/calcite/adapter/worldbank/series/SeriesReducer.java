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
package org.apache.calcite.adapter.worldbank.series;

import org.apache.calcite.adapter.worldbank.FetchException;
import org.apache.calcite.adapter.worldbank.http.PageRequest;
import org.apache.calcite.adapter.worldbank.http.Paginator;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableSortedMap;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads an indicator series for all countries and keeps, per country, the
 * most recent period that has a value.
 *
 * <p>Observation records look like
 * {@code {"countryiso3code": "ABW", "date": "2021", "value": 3126019385.47}}.
 * Records without a country code (the API emits some for aggregates) or
 * without a date are skipped.
 *
 * <p>When two observations of a country share the latest period that has a
 * value, the one that came first in the response is kept.
 */
public class SeriesReducer {
  private static final Logger LOGGER = LoggerFactory.getLogger(SeriesReducer.class);

  private final Paginator paginator;
  private final int pageSize;
  private final Duration timeout;

  public SeriesReducer(Paginator paginator, int pageSize, Duration timeout) {
    this.paginator = paginator;
    this.pageSize = pageSize;
    this.timeout = timeout;
  }

  static String endpoint(String indicator) {
    return "country/all/indicator/" + indicator;
  }

  /**
   * Fetches {@code indicator} for periods {@code [start, end]} and reduces it.
   *
   * @return Latest valued observation per entity key, ordered by key
   * @throws FetchException on fetch failure or an unparseable record
   */
  public ImmutableSortedMap<String, ReducedSeriesRow> loadLatest(String indicator,
      int start, int end) {
    if (indicator == null || indicator.isEmpty()) {
      throw new IllegalArgumentException("indicator cannot be null or empty");
    }
    if (start > end) {
      throw new IllegalArgumentException("start " + start + " is after end " + end);
    }
    PageRequest request = PageRequest.builder()
        .endpoint(endpoint(indicator))
        .parameter("date", start + ":" + end)
        .pageSize(pageSize)
        .timeout(timeout)
        .build();

    List<JsonNode> records = paginator.fetchAll(request);
    List<Observation> observations = new ArrayList<>(records.size());
    for (JsonNode record : records) {
      Observation observation = parseObservation(record);
      if (observation != null) {
        observations.add(observation);
      }
    }

    ImmutableSortedMap<String, ReducedSeriesRow> latest = reduce(observations);
    LOGGER.info("Reduced {} observations of {} ({}:{}) to {} entities",
        observations.size(), indicator, start, end, latest.size());
    return latest;
  }

  /**
   * Keeps, per entity, the observation with the greatest period among those
   * with a value. Entities without any value are absent from the result.
   */
  public static ImmutableSortedMap<String, ReducedSeriesRow> reduce(
      Iterable<Observation> observations) {
    Map<String, Observation> best = new HashMap<>();
    for (Observation observation : observations) {
      if (!observation.hasValue()) {
        continue;
      }
      Observation current = best.get(observation.getEntityKey());
      if (current == null || observation.getPeriod() > current.getPeriod()) {
        best.put(observation.getEntityKey(), observation);
      }
    }

    ImmutableSortedMap.Builder<String, ReducedSeriesRow> result =
        ImmutableSortedMap.naturalOrder();
    best.forEach((key, observation) -> result.put(key, ReducedSeriesRow.of(observation)));
    return result.build();
  }

  /**
   * Parses one observation record.
   *
   * @return the observation, or null if the record has no entity key or date
   * @throws FetchException if the record is not an object, or its date or
   *     value is not numeric
   */
  static @Nullable Observation parseObservation(@Nullable JsonNode record) {
    if (record == null || !record.isObject()) {
      throw FetchException.malformed("Observation record is not an object: " + record);
    }
    JsonNode keyNode = record.get("countryiso3code");
    if (keyNode == null || keyNode.isNull() || keyNode.asText().trim().isEmpty()) {
      return null;
    }
    String key = keyNode.asText().trim();

    JsonNode dateNode = record.get("date");
    if (dateNode == null || dateNode.isNull() || dateNode.asText().trim().isEmpty()) {
      LOGGER.debug("Skipping observation of {} without a date", key);
      return null;
    }
    int period;
    try {
      period = Integer.parseInt(dateNode.asText().trim());
    } catch (NumberFormatException e) {
      throw FetchException.malformed("Observation of " + key + " has non-numeric date '"
          + dateNode.asText() + "'", e);
    }

    return new Observation(key, period, parseValue(key, record.get("value")));
  }

  private static @Nullable Double parseValue(String key, @Nullable JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    if (node.isNumber()) {
      return node.doubleValue();
    }
    if (node.isTextual()) {
      String text = node.asText().trim();
      if (text.isEmpty()) {
        return null;
      }
      try {
        return Double.valueOf(text);
      } catch (NumberFormatException e) {
        throw FetchException.malformed("Observation of " + key + " has non-numeric value '"
            + text + "'", e);
      }
    }
    throw FetchException.malformed("Observation of " + key + " has value of type "
        + node.getNodeType());
  }
}
