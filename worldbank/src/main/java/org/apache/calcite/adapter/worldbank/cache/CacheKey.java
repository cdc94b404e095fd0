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
package org.apache.calcite.adapter.worldbank.cache;

import com.google.common.collect.ImmutableSortedMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;
import java.util.Objects;

/**
 * Signature of a cacheable load: a load name plus every parameter the load
 * depends on.
 *
 * <p>Two keys are equal when their names and parameter maps are equal; the
 * order parameters were supplied in does not matter. The string form
 * {@code name:param1=value1:param2=value2}, parameters sorted by name, is for
 * display only, since values may themselves contain {@code :} or {@code =}.
 */
public final class CacheKey {
  private final String name;
  private final ImmutableSortedMap<String, String> parameters;
  private final String keyString;

  /**
   * Creates a cache key.
   *
   * @param name The load name (e.g., "catalog", "indicator_latest")
   * @param parameters The load parameters (may be empty, never null)
   */
  public CacheKey(String name, Map<String, String> parameters) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("name cannot be null or empty");
    }
    if (parameters == null) {
      throw new IllegalArgumentException("parameters of " + name + " must not be null");
    }

    this.name = name;
    this.parameters = ImmutableSortedMap.copyOf(parameters);
    this.keyString = buildKeyString(name, this.parameters);
  }

  /** Creates a key for a load without parameters. */
  public static CacheKey of(String name) {
    return new CacheKey(name, ImmutableSortedMap.of());
  }

  /** Readable {@code name:k=v:...} form, for logging. */
  public String asString() {
    return keyString;
  }

  public String getName() {
    return name;
  }

  /**
   * Get an immutable view of the parameters, sorted by name.
   */
  public ImmutableSortedMap<String, String> getParameters() {
    return parameters;
  }

  public @Nullable String getParameter(String name) {
    return parameters.get(name);
  }

  private static String buildKeyString(String name, Map<String, String> sortedParameters) {
    StringBuilder key = new StringBuilder();
    key.append(name);
    sortedParameters.forEach((k, v) -> key.append(":").append(k).append("=").append(v));
    return key.toString();
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CacheKey)) {
      return false;
    }
    CacheKey that = (CacheKey) o;
    return name.equals(that.name) && parameters.equals(that.parameters);
  }

  @Override public int hashCode() {
    return Objects.hash(name, parameters);
  }

  @Override public String toString() {
    return "CacheKey{" + keyString + "}";
  }
}
