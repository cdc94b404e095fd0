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

import com.google.common.collect.ImmutableMap;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Describes a paginated request: the endpoint, the query parameters that stay
 * fixed across pages, and the page size.
 *
 * <pre>{@code
 * PageRequest request = PageRequest.builder()
 *     .endpoint("country/all/indicator/NY.GDP.MKTP.CD")
 *     .parameter("date", "2010:2028")
 *     .pageSize(20000)
 *     .timeout(Duration.ofSeconds(180))
 *     .build();
 * }</pre>
 *
 * <p>{@code format}, {@code per_page} and {@code page} are added by
 * {@link #toUri(String, int)}.
 */
public class PageRequest {
  private final String endpoint;
  private final ImmutableMap<String, String> parameters;
  private final int pageSize;
  private final Duration timeout;

  private PageRequest(Builder builder) {
    if (builder.endpoint == null || builder.endpoint.isEmpty()) {
      throw new IllegalArgumentException("endpoint is required");
    }
    if (builder.pageSize <= 0) {
      throw new IllegalArgumentException("pageSize must be positive, got " + builder.pageSize);
    }
    this.endpoint = builder.endpoint;
    this.parameters = ImmutableMap.copyOf(builder.parameters);
    this.pageSize = builder.pageSize;
    this.timeout = builder.timeout;
  }

  public String getEndpoint() {
    return endpoint;
  }

  public ImmutableMap<String, String> getParameters() {
    return parameters;
  }

  public int getPageSize() {
    return pageSize;
  }

  public Duration getTimeout() {
    return timeout;
  }

  /**
   * Builds the URI of one page.
   *
   * @param baseUrl API root
   * @param page 1-based page number
   */
  public URI toUri(String baseUrl, int page) {
    return ApiUrlBuilder.forEndpoint(baseUrl, endpoint)
        .param("format", "json")
        .param("per_page", String.valueOf(pageSize))
        .params(parameters)
        .param("page", String.valueOf(page))
        .buildUri();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override public String toString() {
    return "PageRequest{" + endpoint + ", params=" + parameters + ", pageSize=" + pageSize + "}";
  }

  /**
   * Builder for {@link PageRequest}.
   */
  public static class Builder {
    private String endpoint;
    private final Map<String, String> parameters = new LinkedHashMap<>();
    private int pageSize = 1000;
    private Duration timeout = Duration.ofSeconds(60);

    public Builder endpoint(String endpoint) {
      this.endpoint = endpoint;
      return this;
    }

    public Builder parameter(String name, String value) {
      this.parameters.put(name, value);
      return this;
    }

    public Builder pageSize(int pageSize) {
      this.pageSize = pageSize;
      return this;
    }

    public Builder timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    public PageRequest build() {
      return new PageRequest(this);
    }
  }
}
