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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * A reference entity (a country) from the World Bank country endpoint.
 *
 * <p>{@code groupId}/{@code groupName} are the region classification and
 * {@code tier} the income level.
 */
public final class Entity {
  private final String key;
  private final @Nullable String displayName;
  private final @Nullable String groupId;
  private final @Nullable String groupName;
  private final @Nullable String tier;

  public Entity(String key, @Nullable String displayName, @Nullable String groupId,
      @Nullable String groupName, @Nullable String tier) {
    if (key == null || key.isEmpty()) {
      throw new IllegalArgumentException("key cannot be null or empty");
    }
    this.key = key;
    this.displayName = displayName;
    this.groupId = groupId;
    this.groupName = groupName;
    this.tier = tier;
  }

  public String getKey() {
    return key;
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

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Entity entity = (Entity) o;
    return key.equals(entity.key)
        && Objects.equals(displayName, entity.displayName)
        && Objects.equals(groupId, entity.groupId)
        && Objects.equals(groupName, entity.groupName)
        && Objects.equals(tier, entity.tier);
  }

  @Override public int hashCode() {
    return Objects.hash(key, displayName, groupId, groupName, tier);
  }

  @Override public String toString() {
    return "Entity{" + key + ", " + displayName + ", group=" + groupId + "/" + groupName
        + ", tier=" + tier + "}";
  }
}
