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
package org.apache.calcite.adapter.worldbank.join;

import org.apache.calcite.adapter.worldbank.catalog.Entity;
import org.apache.calcite.adapter.worldbank.catalog.EntityCatalog;
import org.apache.calcite.adapter.worldbank.series.ReducedSeriesRow;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link DatasetJoiner}.
 */
@Tag("unit")
class DatasetJoinerTest {
  private static final EntityCatalog CATALOG = EntityCatalog.of(ImmutableList.of(
      new Entity("ABC", "Aland", "R1", "Region One", "High income"),
      new Entity("DEF", "Dland", "R2", "Region Two", "Low income"),
      new Entity("GHI", "Gland", "R1", "Region One", "Upper middle income")));

  @Test void testOneRowPerCatalogEntity() {
    List<JoinedRow> rows = DatasetJoiner.join(CATALOG, ImmutableMap.of(
        "ABC", new ReducedSeriesRow("ABC", 2021, 100.0),
        "GHI", new ReducedSeriesRow("GHI", 2019, 7.5)));

    assertEquals(3, rows.size());
    assertEquals(new JoinedRow("ABC", "Aland", "R1", "Region One", "High income", 2021, 100.0),
        rows.get(0));
    assertEquals(new JoinedRow("GHI", "Gland", "R1", "Region One", "Upper middle income",
        2019, 7.5), rows.get(2));
  }

  @Test void testUnmatchedEntityHasNullPeriodAndValue() {
    JoinedRow row = DatasetJoiner.join(CATALOG, ImmutableMap.of()).get(1);

    assertEquals("DEF", row.getEntityKey());
    assertNull(row.getPeriod());
    assertNull(row.getValue());
    assertFalse(row.hasObservation());
  }

  @Test void testSeriesRowsOutsideCatalogAreIgnored() {
    List<JoinedRow> rows = DatasetJoiner.join(CATALOG, ImmutableMap.of(
        "XYZ", new ReducedSeriesRow("XYZ", 2021, 1.0)));

    assertEquals(3, rows.size());
    assertTrue(rows.stream().noneMatch(JoinedRow::hasObservation));
  }

  @Test void testEmptyCatalogGivesNoRows() {
    assertTrue(DatasetJoiner.join(EntityCatalog.of(ImmutableList.of()),
        ImmutableMap.of("ABC", new ReducedSeriesRow("ABC", 2021, 1.0))).isEmpty());
  }

  @Test void testValuesFollowExportColumnOrder() {
    JoinedRow row = new JoinedRow("ABC", "Aland", "R1", "Region One", "High income", 2021,
        100.0);

    assertEquals(Arrays.asList("entity_key", "display_name", "group_id", "group_name", "tier",
        "period", "value"), JoinedRow.COLUMN_NAMES);
    assertEquals(Arrays.<Object>asList("ABC", "Aland", "R1", "Region One", "High income", 2021,
        100.0), row.toValues());
  }
}
