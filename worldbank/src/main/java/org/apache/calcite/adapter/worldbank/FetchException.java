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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Raised when data cannot be retrieved from the World Bank API.
 *
 * <p>The {@link Kind} tells callers whether a retry can help:
 * {@link Kind#TRANSPORT} and {@link Kind#TIMEOUT} are transient,
 * {@link Kind#MALFORMED_RESPONSE} is not.
 */
public class FetchException extends WorldBankException {

  /** Failure category. */
  public enum Kind {
    /** Network failure or non-success HTTP status. */
    TRANSPORT,
    /** Response body is not the JSON shape the API documents. */
    MALFORMED_RESPONSE,
    /** A request or the overall dataset deadline was exceeded. */
    TIMEOUT;

    /** Whether a failure of this kind may succeed on a later attempt. */
    public boolean isRetryable() {
      return this != MALFORMED_RESPONSE;
    }
  }

  private final Kind kind;

  public FetchException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public FetchException(Kind kind, String message, @Nullable Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public Kind getKind() {
    return kind;
  }

  public static FetchException transport(String message, @Nullable Throwable cause) {
    return new FetchException(Kind.TRANSPORT, message, cause);
  }

  public static FetchException malformed(String message) {
    return new FetchException(Kind.MALFORMED_RESPONSE, message);
  }

  public static FetchException malformed(String message, @Nullable Throwable cause) {
    return new FetchException(Kind.MALFORMED_RESPONSE, message, cause);
  }

  public static FetchException timeout(String message, @Nullable Throwable cause) {
    return new FetchException(Kind.TIMEOUT, message, cause);
  }

  @Override public String toString() {
    return "FetchException{kind=" + kind + ", message=" + getMessage() + "}";
  }
}
