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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * An indicator known to the registry: the API code plus a stable short
 * name that configurations may use instead.
 */
public final class WorldBankIndicator {
  private final String name;
  private final String code;
  private final @Nullable String description;
  private final @Nullable String unit;

  @JsonCreator
  public WorldBankIndicator(@JsonProperty("name") String name,
      @JsonProperty("code") String code,
      @JsonProperty("description") @Nullable String description,
      @JsonProperty("unit") @Nullable String unit) {
    this.name = Objects.requireNonNull(name, "name");
    this.code = Objects.requireNonNull(code, "code");
    this.description = description;
    this.unit = unit;
  }

  public String getName() {
    return name;
  }

  public String getCode() {
    return code;
  }

  public @Nullable String getDescription() {
    return description;
  }

  public @Nullable String getUnit() {
    return unit;
  }

  /** Code followed by the description, as shown in indicator pickers. */
  public String getLabel() {
    return description == null ? code : code + " — " + description;
  }

  @Override public String toString() {
    return getLabel();
  }

  /** A named group of indicators in the registry file. */
  static final class Category {
    final String category;
    final ImmutableList<WorldBankIndicator> items;

    @JsonCreator
    Category(@JsonProperty("category") String category,
        @JsonProperty("items") @Nullable List<WorldBankIndicator> items) {
      this.category = category;
      this.items = items == null ? ImmutableList.of() : ImmutableList.copyOf(items);
    }
  }

  /** Root of the registry file. */
  static final class Registry {
    final ImmutableList<Category> indicators;

    @JsonCreator
    Registry(@JsonProperty("indicators") @Nullable List<Category> indicators) {
      this.indicators = indicators == null ? ImmutableList.of() : ImmutableList.copyOf(indicators);
    }
  }
}
