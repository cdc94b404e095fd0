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

/**
 * World Bank adapter: country catalog, latest-value indicator series and the
 * dataset that joins them.
 *
 * <h2>Pipeline</h2>
 * <ul>
 *   <li>{@link org.apache.calcite.adapter.worldbank.http.Paginator} - walks
 *       every page of an API endpoint</li>
 *   <li>{@link org.apache.calcite.adapter.worldbank.catalog.EntityCatalogLoader} -
 *       countries, without regional aggregates</li>
 *   <li>{@link org.apache.calcite.adapter.worldbank.series.SeriesReducer} -
 *       latest non-null value per country</li>
 *   <li>{@link org.apache.calcite.adapter.worldbank.join.DatasetJoiner} -
 *       left join of the two on the country code</li>
 *   <li>{@link org.apache.calcite.adapter.worldbank.cache.ResultCache} -
 *       time-bounded memoization with manual invalidation</li>
 * </ul>
 *
 * <p>{@link org.apache.calcite.adapter.worldbank.WorldBankDatasetService}
 * wires these together.
 */
package org.apache.calcite.adapter.worldbank;
