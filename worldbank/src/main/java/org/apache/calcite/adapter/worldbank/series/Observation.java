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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * One data point of an indicator series: an entity's value for a period.
 * The value is null when the API has no figure for that period.
 */
public final class Observation {
  private final String entityKey;
  private final int period;
  private final @Nullable Double value;

  public Observation(String entityKey, int period, @Nullable Double value) {
    this.entityKey = Objects.requireNonNull(entityKey, "entityKey");
    this.period = period;
    this.value = value;
  }

  public String getEntityKey() {
    return entityKey;
  }

  public int getPeriod() {
    return period;
  }

  public @Nullable Double getValue() {
    return value;
  }

  public boolean hasValue() {
    return value != null;
  }

  @Override public String toString() {
    return "Observation{" + entityKey + ", " + period + ", " + value + "}";
  }
}
