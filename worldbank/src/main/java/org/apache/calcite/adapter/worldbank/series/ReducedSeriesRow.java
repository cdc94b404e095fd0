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

import java.util.Objects;

/**
 * The latest non-null observation of one entity.
 */
public final class ReducedSeriesRow {
  private final String entityKey;
  private final int period;
  private final double value;

  public ReducedSeriesRow(String entityKey, int period, double value) {
    this.entityKey = Objects.requireNonNull(entityKey, "entityKey");
    this.period = period;
    this.value = value;
  }

  static ReducedSeriesRow of(Observation observation) {
    Double value = observation.getValue();
    if (value == null) {
      throw new IllegalArgumentException("observation has no value: " + observation);
    }
    return new ReducedSeriesRow(observation.getEntityKey(), observation.getPeriod(), value);
  }

  public String getEntityKey() {
    return entityKey;
  }

  public int getPeriod() {
    return period;
  }

  public double getValue() {
    return value;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ReducedSeriesRow that = (ReducedSeriesRow) o;
    return period == that.period
        && Double.compare(value, that.value) == 0
        && entityKey.equals(that.entityKey);
  }

  @Override public int hashCode() {
    return Objects.hash(entityKey, period, value);
  }

  @Override public String toString() {
    return "ReducedSeriesRow{" + entityKey + ", " + period + ", " + value + "}";
  }
}
