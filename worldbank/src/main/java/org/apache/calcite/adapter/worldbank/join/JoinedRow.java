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
import org.apache.calcite.adapter.worldbank.series.ReducedSeriesRow;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A row of the final dataset: an entity and its latest observation, if any.
 *
 * <p>{@link #COLUMN_NAMES} is the column order export writers receive.
 */
public final class JoinedRow {
  public static final ImmutableList<String> COLUMN_NAMES = ImmutableList.of(
      "entity_key", "display_name", "group_id", "group_name", "tier", "period", "value");

  private final String entityKey;
  private final @Nullable String displayName;
  private final @Nullable String groupId;
  private final @Nullable String groupName;
  private final @Nullable String tier;
  private final @Nullable Integer period;
  private final @Nullable Double value;

  public JoinedRow(String entityKey, @Nullable String displayName, @Nullable String groupId,
      @Nullable String groupName, @Nullable String tier, @Nullable Integer period,
      @Nullable Double value) {
    this.entityKey = Objects.requireNonNull(entityKey, "entityKey");
    this.displayName = displayName;
    this.groupId = groupId;
    this.groupName = groupName;
    this.tier = tier;
    this.period = period;
    this.value = value;
  }

  static JoinedRow of(Entity entity, @Nullable ReducedSeriesRow latest) {
    return new JoinedRow(entity.getKey(), entity.getDisplayName(), entity.getGroupId(),
        entity.getGroupName(), entity.getTier(),
        latest == null ? null : latest.getPeriod(),
        latest == null ? null : latest.getValue());
  }

  public String getEntityKey() {
    return entityKey;
  }

  public @Nullable String getDisplayName() {
    return displayName;
  }

  public @Nullable String getGroupId() {
    return groupId;
  }

  public @Nullable String getGroupName() {
    return groupName;
  }

  public @Nullable String getTier() {
    return tier;
  }

  public @Nullable Integer getPeriod() {
    return period;
  }

  public @Nullable Double getValue() {
    return value;
  }

  public boolean hasObservation() {
    return value != null;
  }

  /** Values in {@link #COLUMN_NAMES} order; absent values are null. */
  public List<@Nullable Object> toValues() {
    return Collections.unmodifiableList(
        Arrays.asList(entityKey, displayName, groupId, groupName, tier, period, value));
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    JoinedRow that = (JoinedRow) o;
    return entityKey.equals(that.entityKey)
        && Objects.equals(displayName, that.displayName)
        && Objects.equals(groupId, that.groupId)
        && Objects.equals(groupName, that.groupName)
        && Objects.equals(tier, that.tier)
        && Objects.equals(period, that.period)
        && Objects.equals(value, that.value);
  }

  @Override public int hashCode() {
    return Objects.hash(entityKey, displayName, groupId, groupName, tier, period, value);
  }

  @Override public String toString() {
    return "JoinedRow" + toValues();
  }
}
