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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Registry of known indicators, read once from
 * {@value #INDICATORS_RESOURCE}.
 *
 * <p>Lookups accept either the indicator code ({@code NY.GDP.MKTP.CD}) or
 * its short name ({@code GDP_CURRENT_USD}).
 */
public final class WorldBankIndicators {
  private static final Logger LOGGER = LoggerFactory.getLogger(WorldBankIndicators.class);
  static final String INDICATORS_RESOURCE = "/worldbank/worldbank-indicators.json";

  private static final ImmutableList<WorldBankIndicator> ALL;
  private static final ImmutableMap<String, WorldBankIndicator> BY_CODE;
  private static final ImmutableMap<String, WorldBankIndicator> BY_NAME;

  static {
    WorldBankIndicator.Registry registry = read();
    ImmutableList.Builder<WorldBankIndicator> all = ImmutableList.builder();
    Map<String, WorldBankIndicator> byCode = new LinkedHashMap<>();
    Map<String, WorldBankIndicator> byName = new LinkedHashMap<>();
    for (WorldBankIndicator.Category category : registry.indicators) {
      for (WorldBankIndicator indicator : category.items) {
        all.add(indicator);
        byCode.put(indicator.getCode(), indicator);
        byName.put(indicator.getName(), indicator);
      }
    }
    ALL = all.build();
    BY_CODE = ImmutableMap.copyOf(byCode);
    BY_NAME = ImmutableMap.copyOf(byName);
    LOGGER.debug("Loaded {} indicators in {} categories", ALL.size(),
        registry.indicators.size());
  }

  private WorldBankIndicators() {
  }

  private static WorldBankIndicator.Registry read() {
    try (InputStream is = WorldBankIndicators.class.getResourceAsStream(INDICATORS_RESOURCE)) {
      if (is == null) {
        throw new WorldBankException("Could not find " + INDICATORS_RESOURCE);
      }
      return new ObjectMapper().readValue(is, WorldBankIndicator.Registry.class);
    } catch (IOException e) {
      throw new WorldBankException("Failed to read " + INDICATORS_RESOURCE, e);
    }
  }

  public static ImmutableList<WorldBankIndicator> getAll() {
    return ALL;
  }

  public static ImmutableList<String> getAllIndicatorCodes() {
    return BY_CODE.keySet().asList();
  }

  /**
   * Finds an indicator by code or short name.
   *
   * @return the indicator, or null if it is not registered
   */
  public static @Nullable WorldBankIndicator find(String codeOrName) {
    WorldBankIndicator indicator = BY_CODE.get(codeOrName);
    return indicator != null ? indicator : BY_NAME.get(codeOrName);
  }

  /**
   * Resolves a code or short name to the code sent to the API. Values that
   * are not registered pass through unchanged.
   */
  public static String resolveCode(String codeOrName) {
    WorldBankIndicator indicator = find(codeOrName);
    return indicator != null ? indicator.getCode() : codeOrName;
  }
}
