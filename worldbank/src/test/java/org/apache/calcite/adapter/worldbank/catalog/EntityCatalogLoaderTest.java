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
import org.apache.calcite.adapter.worldbank.http.Paginator;
import org.apache.calcite.adapter.worldbank.http.ScriptedTransport;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;

import static org.apache.calcite.adapter.worldbank.WorldBankJson.country;
import static org.apache.calcite.adapter.worldbank.WorldBankJson.page;
import static org.apache.calcite.adapter.worldbank.WorldBankJson.pages;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link EntityCatalogLoader} and {@link EntityCatalog}.
 */
@Tag("unit")
class EntityCatalogLoaderTest {
  private ScriptedTransport transport;
  private EntityCatalogLoader loader;

  @BeforeEach
  void setUp() {
    transport = new ScriptedTransport();
    Paginator paginator = new Paginator(ScriptedTransport.BASE_URL, transport, 100);
    loader = new EntityCatalogLoader(paginator, 2, Duration.ofSeconds(5), "NA");
  }

  @Test void testExcludesSentinelGroup() {
    transport.on("country", pages(2,
        country("ABC", "Aland", "R1", "Region One", "High income"),
        country("XYZ", "Xland", "NA", "Aggregates", "Aggregates"),
        country("DEF", "Dland", "R2", "Region Two", "Low income")));

    EntityCatalog catalog = loader.loadCatalog();

    assertEquals(2, catalog.size());
    assertEquals(Arrays.asList("ABC", "DEF"),
        catalog.entities().stream().map(Entity::getKey).collect(
            ImmutableList.toImmutableList()));
    for (Entity entity : catalog.entities()) {
      assertNotEquals("NA", entity.getGroupId());
    }
    assertFalse(catalog.contains("XYZ"));
  }

  @Test void testMapsRecordFields() {
    transport.on("country", 1,
        page(1, 2, 1, country("ABW", "Aruba", "LCN", "Latin America & Caribbean",
            "High income")));

    Entity aruba = loader.loadCatalog().get("ABW");

    assertEquals(new Entity("ABW", "Aruba", "LCN", "Latin America & Caribbean", "High income"),
        aruba);
  }

  @Test void testMissingRegionAndIncomeAreNull() {
    transport.on("country", 1, page(1, 2, 1, "{\"id\":\"QQQ\",\"name\":\"Q\"}"));

    Entity entity = loader.loadCatalog().get("QQQ");

    assertNull(entity.getGroupId());
    assertNull(entity.getGroupName());
    assertNull(entity.getTier());
  }

  @Test void testRecordWithoutIdIsMalformed() {
    transport.on("country", 1, page(1, 2, 1, "{\"name\":\"Nowhere\"}"));

    FetchException e = assertThrows(FetchException.class, () -> loader.loadCatalog());
    assertEquals(FetchException.Kind.MALFORMED_RESPONSE, e.getKind());
  }

  @Test void testDuplicateKeysLastSeenWins() {
    transport.on("country", pages(5,
        country("ABC", "Old name", "R1", "Region One", "Low income"),
        country("DEF", "Dland", "R2", "Region Two", "Low income"),
        country("ABC", "New name", "R1", "Region One", "High income")));

    EntityCatalog catalog = loader.loadCatalog();

    assertEquals(2, catalog.size());
    assertEquals("New name", catalog.get("ABC").getDisplayName());
    assertEquals("ABC", catalog.entities().get(0).getKey());
  }

  @Test void testFacetsAreSortedAndDistinct() {
    transport.on("country", pages(10,
        country("AAA", "A", "R2", "South Asia", "Low income"),
        country("BBB", "B", "R1", "East Asia & Pacific", "High income"),
        country("CCC", "C", "R2", "South Asia", "Low income"),
        country("WLD", "World", "NA", "Aggregates", "Aggregates")));

    EntityCatalog catalog = loader.loadCatalog();

    assertEquals(Arrays.asList("East Asia & Pacific", "South Asia"),
        catalog.groupNames().asList());
    assertEquals(Arrays.asList("High income", "Low income"), catalog.tiers().asList());
  }

  @Test void testTransportFailurePropagates() {
    assertThrows(FetchException.class, () -> loader.loadCatalog());
    assertTrue(transport.requestCount("country") > 0);
  }
}
