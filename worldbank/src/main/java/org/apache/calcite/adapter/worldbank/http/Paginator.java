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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Retrieves every record of a page-based World Bank endpoint.
 *
 * <p>The API wraps each page in a two-element array {@code [metadata, records]}
 * where {@code metadata.total} is the record count across all pages. Pages
 * are requested in order starting at 1 until the accumulated record count
 * reaches the total declared by the first page, and never beyond
 * {@code ceil(total / pageSize)} pages.
 *
 * <p>A response without the two-element shape means there is no more data
 * and ends pagination quietly; the one-element {@code [{"message": [...]}]}
 * form is the API's error report and is raised instead. A page with no
 * records also ends pagination. Pagination never runs past
 * {@code maxPages} either; reaching the page ceiling before the total is an
 * error, so a truncated result is never returned as complete.
 *
 * <p>Records are returned as raw {@link JsonNode}s; interpreting them is up
 * to the caller. Nothing is retried or cached here.
 */
public class Paginator {
  private static final Logger LOGGER = LoggerFactory.getLogger(Paginator.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final String baseUrl;
  private final PageTransport transport;
  private final int maxPages;

  public Paginator(String baseUrl, PageTransport transport, int maxPages) {
    if (maxPages <= 0) {
      throw new IllegalArgumentException("maxPages must be positive, got " + maxPages);
    }
    this.baseUrl = baseUrl;
    this.transport = transport;
    this.maxPages = maxPages;
  }

  /**
   * Fetches all pages of {@code request}.
   *
   * @return Records of all pages in page order
   * @throws FetchException if a page cannot be fetched or parsed, or if the
   *     page ceiling is reached before the declared total
   */
  public ImmutableList<JsonNode> fetchAll(PageRequest request) {
    List<JsonNode> records = new ArrayList<>();
    int total = 0;
    int ceiling = maxPages;
    int page = 1;

    while (true) {
      URI uri = request.toUri(baseUrl, page);
      Envelope envelope = parseEnvelope(transport.get(uri, request.getTimeout()), uri);
      if (envelope == null) {
        LOGGER.debug("Page {} of {} is not a [metadata, records] envelope, no more data",
            page, request.getEndpoint());
        break;
      }
      if (page == 1) {
        total = envelope.total;
        ceiling = pageCeiling(total, request.getPageSize(), maxPages);
      }

      int received = envelope.records.size();
      envelope.records.forEach(records::add);
      LOGGER.debug("Page {} of {}: {} records ({} of {})",
          page, request.getEndpoint(), received, records.size(), total);

      if (records.size() >= total) {
        break;
      }
      if (received == 0) {
        LOGGER.warn("{} returned an empty page {} after {} of {} declared records",
            request.getEndpoint(), page, records.size(), total);
        break;
      }
      if (page >= ceiling) {
        throw FetchException.malformed("Pagination of " + request.getEndpoint()
            + " reached the limit of " + ceiling + " pages with " + records.size()
            + " of " + total + " declared records");
      }
      page++;
    }

    LOGGER.info("Fetched {} records from {} in {} page(s)",
        records.size(), request.getEndpoint(), page);
    return ImmutableList.copyOf(records);
  }

  /**
   * Number of pages that may be requested for {@code total} records:
   * {@code ceil(total / pageSize)}, at least 1 and at most {@code maxPages}.
   */
  static int pageCeiling(int total, int pageSize, int maxPages) {
    long pages = ((long) total + pageSize - 1) / pageSize;
    return (int) Math.max(1, Math.min(maxPages, pages));
  }

  /**
   * Parses a page body.
   *
   * @return the envelope, or null when the body signals there are no more pages
   */
  static @Nullable Envelope parseEnvelope(String body, URI uri) {
    JsonNode root;
    try {
      root = MAPPER.readTree(body);
    } catch (JsonProcessingException e) {
      throw FetchException.malformed("Response from " + uri + " is not JSON", e);
    }
    if (root == null || root.isMissingNode()) {
      throw FetchException.malformed("Empty response from " + uri);
    }

    if (!root.isArray() || root.size() < 2) {
      String apiError = apiErrorMessage(root);
      if (apiError != null) {
        throw FetchException.malformed("World Bank API error for " + uri + ": " + apiError);
      }
      return null;
    }

    JsonNode records = root.get(1);
    if (records == null || records.isNull()) {
      return null;
    }
    if (!records.isArray()) {
      throw FetchException.malformed("Records element of " + uri + " is "
          + records.getNodeType() + ", expected an array");
    }
    int total = root.get(0).path("total").asInt(0);
    return new Envelope(total, records);
  }

  /** Extracts the text of a {@code [{"message": [{"value": ...}]}]} error body. */
  private static @Nullable String apiErrorMessage(JsonNode root) {
    if (!root.isArray() || root.size() != 1) {
      return null;
    }
    JsonNode messages = root.get(0).path("message");
    if (!messages.isArray() || messages.isEmpty()) {
      return null;
    }
    StringBuilder text = new StringBuilder();
    for (JsonNode message : messages) {
      if (text.length() > 0) {
        text.append("; ");
      }
      text.append(message.path("key").asText("error"))
          .append(": ")
          .append(message.path("value").asText(""));
    }
    return text.toString();
  }

  /** A parsed page. */
  static final class Envelope {
    final int total;
    final JsonNode records;

    Envelope(int total, JsonNode records) {
      this.total = total;
      this.records = records;
    }
  }
}
