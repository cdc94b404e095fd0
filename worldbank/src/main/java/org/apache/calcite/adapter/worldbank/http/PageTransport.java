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

import java.net.URI;
import java.time.Duration;

/**
 * Issues a single GET and returns the response body.
 *
 * <p>Implementations report failures as {@link FetchException} with kind
 * {@link FetchException.Kind#TRANSPORT} or {@link FetchException.Kind#TIMEOUT}.
 */
@FunctionalInterface
public interface PageTransport {

  /**
   * Fetches one page.
   *
   * @param uri Fully built page URI
   * @param timeout Per-request timeout
   * @return Response body
   * @throws FetchException on network failure, non-success status or timeout
   */
  String get(URI uri, Duration timeout);
}
