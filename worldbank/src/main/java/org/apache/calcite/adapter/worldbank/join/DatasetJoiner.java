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

import java.util.Map;

/**
 * Left-joins the entity catalog with a reduced series on the entity key.
 */
public final class DatasetJoiner {
  private DatasetJoiner() {
  }

  /**
   * Produces one row per catalog entity, in catalog order. Entities with no
   * reduced row get a null period and value; series rows for keys outside
   * the catalog are ignored.
   */
  public static ImmutableList<JoinedRow> join(EntityCatalog catalog,
      Map<String, ReducedSeriesRow> latest) {
    ImmutableList.Builder<JoinedRow> rows = ImmutableList.builderWithExpectedSize(catalog.size());
    for (Entity entity : catalog.entities()) {
      rows.add(JoinedRow.of(entity, latest.get(entity.getKey())));
    }
    return rows.build();
  }
}
