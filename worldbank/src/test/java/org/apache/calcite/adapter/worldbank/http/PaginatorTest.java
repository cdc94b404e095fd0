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
package org.apache.calcite.adapter.worldbank.http;

import org.apache.calcite.adapter.worldbank.FetchException;
import org.apache.calcite.adapter.worldbank.WorldBankJson;

import com.fasterxml.jackson.databind.JsonNode;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link Paginator}.
 */
@Tag("unit")
class PaginatorTest {
  private static final String ENDPOINT = "country";

  private ScriptedTransport transport;
  private Paginator paginator;

  @BeforeEach
  void setUp() {
    transport = new ScriptedTransport();
    paginator = new Paginator(ScriptedTransport.BASE_URL, transport, 50);
  }

  private static PageRequest request(int pageSize) {
    return PageRequest.builder()
        .endpoint(ENDPOINT)
        .pageSize(pageSize)
        .timeout(Duration.ofSeconds(5))
        .build();
  }

  private static String[] records(int count) {
    String[] records = new String[count];
    for (int i = 0; i < count; i++) {
      records[i] = "{\"id\":\"R" + i + "\"}";
    }
    return records;
  }

  private static List<String> ids(List<JsonNode> nodes) {
    List<String> ids = new ArrayList<>();
    for (JsonNode node : nodes) {
      ids.add(node.get("id").asText());
    }
    return ids;
  }

  @Test void testReturnsAllRecordsAcrossPagesInOrder() {
    for (int pageSize : new int[] {1, 3, 7, 10, 25}) {
      transport = new ScriptedTransport();
      paginator = new Paginator(ScriptedTransport.BASE_URL, transport, 50);
      transport.on(ENDPOINT, WorldBankJson.pages(pageSize, records(10)));

      List<JsonNode> result = paginator.fetchAll(request(pageSize));

      List<String> expected = new ArrayList<>();
      for (int i = 0; i < 10; i++) {
        expected.add("R" + i);
      }
      assertEquals(expected, ids(result), "page size " + pageSize);
      assertEquals((10 + pageSize - 1) / pageSize, transport.getRequests().size(),
          "page size " + pageSize);
    }
  }

  @Test void testStopsOnceTotalIsReached() {
    transport.on(ENDPOINT, 1, WorldBankJson.page(1, 2, 3, records(2)))
        .on(ENDPOINT, 2, WorldBankJson.page(2, 2, 3, "{\"id\":\"R2\"}"))
        .on(ENDPOINT, 3, WorldBankJson.page(3, 2, 3, "{\"id\":\"EXTRA\"}"));

    List<JsonNode> result = paginator.fetchAll(request(2));

    assertEquals(3, result.size());
    assertEquals(2, transport.getRequests().size());
  }

  @Test void testRequestCarriesFormatPageSizeAndParameters() {
    transport.on("country/all/indicator/NY.GDP.MKTP.CD", 1, WorldBankJson.page(1, 20000, 0));

    paginator.fetchAll(PageRequest.builder()
        .endpoint("country/all/indicator/NY.GDP.MKTP.CD")
        .parameter("date", "2010:2028")
        .pageSize(20000)
        .build());

    URI uri = transport.getRequests().get(0);
    assertEquals("http://worldbank.test/v2/country/all/indicator/NY.GDP.MKTP.CD"
        + "?format=json&per_page=20000&date=2010:2028&page=1", uri.toString());
  }

  @Test void testMissingEnvelopeAfterFirstPageEndsWithoutError() {
    transport.on(ENDPOINT, 1, WorldBankJson.page(1, 2, 5, records(2)))
        .on(ENDPOINT, 2, "[{\"page\":2,\"pages\":3,\"total\":5}]");

    List<JsonNode> result = paginator.fetchAll(request(2));

    assertEquals(2, result.size());
    assertEquals(2, transport.getRequests().size());
  }

  @Test void testNullRecordsEndsPagination() {
    transport.on(ENDPOINT, 1, "[{\"page\":1,\"pages\":0,\"per_page\":50,\"total\":0},null]");

    assertTrue(paginator.fetchAll(request(50)).isEmpty());
  }

  @Test void testNonArrayBodyOnFirstPageYieldsNoRecords() {
    transport.on(ENDPOINT, 1, "{\"unexpected\":true}");

    assertTrue(paginator.fetchAll(request(50)).isEmpty());
  }

  @Test void testApiErrorMessageIsMalformedResponse() {
    transport.on(ENDPOINT, 1,
        WorldBankJson.apiError("Invalid value", "The provided parameter value is not valid"));

    FetchException e = assertThrows(FetchException.class,
        () -> paginator.fetchAll(request(50)));
    assertEquals(FetchException.Kind.MALFORMED_RESPONSE, e.getKind());
    assertTrue(e.getMessage().contains("The provided parameter value is not valid"));
  }

  @Test void testInvalidJsonIsMalformedResponse() {
    transport.on(ENDPOINT, 1, "<html>Service unavailable</html>");

    FetchException e = assertThrows(FetchException.class,
        () -> paginator.fetchAll(request(50)));
    assertEquals(FetchException.Kind.MALFORMED_RESPONSE, e.getKind());
  }

  @Test void testRecordsThatAreNotAnArrayIsMalformedResponse() {
    transport.on(ENDPOINT, 1, "[{\"total\":1},{\"id\":\"R0\"}]");

    FetchException e = assertThrows(FetchException.class,
        () -> paginator.fetchAll(request(50)));
    assertEquals(FetchException.Kind.MALFORMED_RESPONSE, e.getKind());
  }

  @Test void testEmptyPageBeforeTotalEndsPagination() {
    transport.on(ENDPOINT, 1, WorldBankJson.page(1, 2, 10, records(2)))
        .on(ENDPOINT, 2, WorldBankJson.page(2, 2, 10));

    List<JsonNode> result = paginator.fetchAll(request(2));

    assertEquals(2, result.size());
    assertEquals(2, transport.getRequests().size());
  }

  @Test void testPageCeilingFailsInsteadOfReturningPartialData() {
    // total is overstated and every page keeps returning records
    paginator = new Paginator(ScriptedTransport.BASE_URL, transport, 3);
    for (int page = 1; page <= 10; page++) {
      transport.on(ENDPOINT, page, WorldBankJson.page(page, 1, 1000, "{\"id\":\"R\"}"));
    }

    FetchException e = assertThrows(FetchException.class,
        () -> paginator.fetchAll(request(1)));
    assertEquals(FetchException.Kind.MALFORMED_RESPONSE, e.getKind());
    assertEquals(3, transport.getRequests().size());
  }

  @Test void testUnderfilledPagesStopAtDeclaredPageCount() {
    // 20 records at 10 per page is two pages, but each page carries only one
    for (int page = 1; page <= 20; page++) {
      transport.on(ENDPOINT, page,
          WorldBankJson.page(page, 10, 20, "{\"id\":\"R" + page + "\"}"));
    }

    FetchException e = assertThrows(FetchException.class,
        () -> paginator.fetchAll(request(10)));
    assertEquals(FetchException.Kind.MALFORMED_RESPONSE, e.getKind());
    assertEquals(2, transport.getRequests().size());
  }

  @Test void testPageCeiling() {
    assertEquals(2, Paginator.pageCeiling(20, 10, 1000));
    assertEquals(3, Paginator.pageCeiling(21, 10, 1000));
    assertEquals(1, Paginator.pageCeiling(0, 10, 1000));
    assertEquals(5, Paginator.pageCeiling(1000, 1, 5));
    assertEquals(1000, Paginator.pageCeiling(Integer.MAX_VALUE, 1, 1000));
  }

  @Test void testTransportFailurePropagates() {
    FetchException failure = FetchException.transport("HTTP 503", null);
    transport.on(ENDPOINT, 1, WorldBankJson.page(1, 1, 2, records(1)))
        .failOnce(ENDPOINT, 2, failure);

    FetchException e = assertThrows(FetchException.class,
        () -> paginator.fetchAll(request(1)));
    assertSame(failure, e);
  }

  @Test void testRejectsNonPositiveMaxPages() {
    assertThrows(IllegalArgumentException.class,
        () -> new Paginator(ScriptedTransport.BASE_URL, transport, 0));
  }
}
