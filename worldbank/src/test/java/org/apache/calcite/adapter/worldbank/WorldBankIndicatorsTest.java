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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link WorldBankIndicators}.
 */
class WorldBankIndicatorsTest {

  @Test void testRegistryLoads() {
    assertEquals(2, WorldBankIndicators.getAll().size());
    assertTrue(WorldBankIndicators.getAllIndicatorCodes().contains("NY.GDP.MKTP.CD"));
  }

  @Test void testFindByCodeOrName() {
    WorldBankIndicator byCode = WorldBankIndicators.find("NY.GDP.MKTP.CD");
    assertNotNull(byCode);
    assertSame(byCode, WorldBankIndicators.find("GDP_CURRENT_USD"));
    assertEquals("USD", byCode.getUnit());
    assertNull(WorldBankIndicators.find("SP.POP.TOTL"));
  }

  @Test void testResolveCode() {
    assertEquals("NY.GDP.PCAP.CD", WorldBankIndicators.resolveCode("GDP_PER_CAPITA_CURRENT_USD"));
    assertEquals("NY.GDP.PCAP.CD", WorldBankIndicators.resolveCode("NY.GDP.PCAP.CD"));
    assertEquals("SP.POP.TOTL", WorldBankIndicators.resolveCode("SP.POP.TOTL"));
  }

  @Test void testLabel() {
    WorldBankIndicator indicator = WorldBankIndicators.find("GDP_CURRENT_USD");
    assertNotNull(indicator);
    assertEquals("NY.GDP.MKTP.CD — GDP (current US$)", indicator.getLabel());
  }
}
