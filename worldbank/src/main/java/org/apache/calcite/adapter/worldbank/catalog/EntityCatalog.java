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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable set of entities, unique by key, in the order the API listed
 * them.
 *
 * <p>When the same key occurs more than once the last occurrence wins; it
 * keeps the position of the first.
 */
public final class EntityCatalog {
  private final ImmutableMap<String, Entity> byKey;

  private EntityCatalog(ImmutableMap<String, Entity> byKey) {
    this.byKey = byKey;
  }

  public static EntityCatalog of(Iterable<Entity> entities) {
    Map<String, Entity> byKey = new LinkedHashMap<>();
    for (Entity entity : entities) {
      byKey.put(entity.getKey(), entity);
    }
    return new EntityCatalog(ImmutableMap.copyOf(byKey));
  }

  public ImmutableList<Entity> entities() {
    return byKey.values().asList();
  }

  public @Nullable Entity get(String key) {
    return byKey.get(key);
  }

  public boolean contains(String key) {
    return byKey.containsKey(key);
  }

  public int size() {
    return byKey.size();
  }

  /** Distinct region names, sorted. */
  public ImmutableSortedSet<String> groupNames() {
    return byKey.values().stream()
        .map(Entity::getGroupName)
        .filter(Objects::nonNull)
        .collect(ImmutableSortedSet.toImmutableSortedSet(String::compareTo));
  }

  /** Distinct income levels, sorted. */
  public ImmutableSortedSet<String> tiers() {
    return byKey.values().stream()
        .map(Entity::getTier)
        .filter(Objects::nonNull)
        .collect(ImmutableSortedSet.toImmutableSortedSet(String::compareTo));
  }

  @Override public String toString() {
    return "EntityCatalog{" + byKey.size() + " entities}";
  }
}
