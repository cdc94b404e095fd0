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
package org.apache.calcite.adapter.worldbank.catalog;

import org.apache.calcite.adapter.worldbank.FetchException;
import org.apache.calcite.adapter.worldbank.http.PageRequest;
import org.apache.calcite.adapter.worldbank.http.Paginator;

import com.fasterxml.jackson.databind.JsonNode;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the country catalog from the {@code country} endpoint.
 *
 * <p>Each record has the shape
 * {@code {"id": "ABW", "name": "Aruba", "region": {"id": "LCN", "value": "..."},
 * "incomeLevel": {"value": "High income"}}}. Records whose region id equals
 * the sentinel (World Bank uses {@code NA} for aggregates such as
 * "World" or "Euro area") are not countries and are dropped.
 */
public class EntityCatalogLoader {
  private static final Logger LOGGER = LoggerFactory.getLogger(EntityCatalogLoader.class);
  static final String ENDPOINT = "country";

  private final Paginator paginator;
  private final int pageSize;
  private final Duration timeout;
  private final String sentinelGroupId;

  public EntityCatalogLoader(Paginator paginator, int pageSize, Duration timeout,
      String sentinelGroupId) {
    this.paginator = paginator;
    this.pageSize = pageSize;
    this.timeout = timeout;
    this.sentinelGroupId = sentinelGroupId;
  }

  public String getSentinelGroupId() {
    return sentinelGroupId;
  }

  /**
   * Fetches and filters the catalog.
   *
   * @throws FetchException on fetch failure or a record without an id
   */
  public EntityCatalog loadCatalog() {
    PageRequest request = PageRequest.builder()
        .endpoint(ENDPOINT)
        .pageSize(pageSize)
        .timeout(timeout)
        .build();

    List<Entity> entities = new ArrayList<>();
    int aggregates = 0;
    for (JsonNode record : paginator.fetchAll(request)) {
      Entity entity = parseEntity(record);
      if (sentinelGroupId.equals(entity.getGroupId())) {
        aggregates++;
        continue;
      }
      entities.add(entity);
    }

    EntityCatalog catalog = EntityCatalog.of(entities);
    if (catalog.size() < entities.size()) {
      LOGGER.warn("Catalog contained {} duplicate keys, kept the last occurrence of each",
          entities.size() - catalog.size());
    }
    LOGGER.info("Loaded {} entities ({} aggregates excluded)", catalog.size(), aggregates);
    return catalog;
  }

  static Entity parseEntity(JsonNode record) {
    if (record == null || !record.isObject()) {
      throw FetchException.malformed("Country record is not an object: " + record);
    }
    String key = text(record.get("id"));
    if (key == null) {
      throw FetchException.malformed("Country record without id: " + record);
    }
    JsonNode region = record.path("region");
    return new Entity(key,
        text(record.get("name")),
        text(region.get("id")),
        text(region.get("value")),
        text(record.path("incomeLevel").get("value")));
  }

  private static @Nullable String text(@Nullable JsonNode node) {
    if (node == null || node.isNull() || !node.isValueNode()) {
      return null;
    }
    String value = node.asText().trim();
    return value.isEmpty() ? null : value;
  }
}
