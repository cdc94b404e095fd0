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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Assembles a request URL from the API root, an endpoint path and query
 * parameters.
 *
 * <p>Parameters are appended in the order given. Names and values are
 * form-encoded, but {@code :} is left as is because the API expects date
 * ranges such as {@code 2010:2028} unescaped.
 */
public final class ApiUrlBuilder {
  private final StringBuilder url;
  private boolean hasQuery;

  private ApiUrlBuilder(String path) {
    this.url = new StringBuilder(path);
  }

  /**
   * Starts a URL for {@code endpoint} under {@code baseUrl}; a single
   * {@code /} separates them whatever either side carries.
   */
  public static ApiUrlBuilder forEndpoint(String baseUrl, String endpoint) {
    String root = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    String path = endpoint.startsWith("/") ? endpoint : "/" + endpoint;
    return new ApiUrlBuilder(root + path);
  }

  /** Appends {@code name=value}; a null or empty value is skipped. */
  public ApiUrlBuilder param(String name, @Nullable String value) {
    if (value == null || value.isEmpty()) {
      return this;
    }
    url.append(hasQuery ? '&' : '?')
        .append(encode(name))
        .append('=')
        .append(encode(value));
    hasQuery = true;
    return this;
  }

  public ApiUrlBuilder params(Map<String, String> parameters) {
    parameters.forEach(this::param);
    return this;
  }

  public String build() {
    return url.toString();
  }

  public URI buildUri() {
    return URI.create(build());
  }

  private static String encode(String text) {
    return URLEncoder.encode(text, StandardCharsets.UTF_8).replace("%3A", ":");
  }
}
