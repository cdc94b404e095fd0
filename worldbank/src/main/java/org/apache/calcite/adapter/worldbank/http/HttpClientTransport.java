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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * {@link PageTransport} backed by {@link HttpClient}.
 */
public class HttpClientTransport implements PageTransport {
  private static final Logger LOGGER = LoggerFactory.getLogger(HttpClientTransport.class);

  private final HttpClient httpClient;
  private final String userAgent;

  public HttpClientTransport(String userAgent) {
    this(HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(30))
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build(), userAgent);
  }

  public HttpClientTransport(HttpClient httpClient, String userAgent) {
    this.httpClient = httpClient;
    this.userAgent = userAgent;
  }

  @Override public String get(URI uri, Duration timeout) {
    HttpRequest request = HttpRequest.newBuilder()
        .uri(uri)
        .timeout(timeout)
        .header("User-Agent", userAgent)
        .header("Accept", "application/json")
        .GET()
        .build();

    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (HttpTimeoutException e) {
      throw FetchException.timeout("Request to " + uri + " timed out after " + timeout, e);
    } catch (IOException e) {
      throw FetchException.transport("Request to " + uri + " failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw FetchException.transport("Interrupted while requesting " + uri, e);
    }

    LOGGER.debug("GET {} -> {}", uri, response.statusCode());
    if (response.statusCode() < 200 || response.statusCode() >= 300) {
      throw FetchException.transport("HTTP " + response.statusCode() + " from " + uri, null);
    }
    return response.body();
  }
}
