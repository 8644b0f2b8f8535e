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
package org.pharmapapers.pubmed.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * {@link PubMedTransport} backed by the JDK {@link HttpClient}.
 *
 * <p>Any status outside 2xx is reported as an {@link IOException} whose
 * message starts with {@code "HTTP <status>"}.
 */
public class HttpClientTransport implements PubMedTransport {
  private static final Logger LOGGER = LoggerFactory.getLogger(HttpClientTransport.class);

  /** Longest error body quoted in an exception message. */
  private static final int MAX_ERROR_BODY = 500;

  private final HttpClient httpClient;

  public HttpClientTransport(Duration connectTimeout) {
    this(HttpClient.newBuilder()
        .connectTimeout(connectTimeout)
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build());
  }

  public HttpClientTransport(HttpClient httpClient) {
    this.httpClient = httpClient;
  }

  @Override public String get(String url, Map<String, String> headers, Duration timeout)
      throws IOException, InterruptedException {
    HttpRequest request = buildRequest(url, headers, timeout);
    HttpResponse<String> response =
        httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    int status = response.statusCode();
    LOGGER.debug("HTTP GET {} -> {}", url, status);

    if (status >= 200 && status < 300) {
      return response.body();
    }
    String body = response.body() != null ? response.body() : "";
    if (body.length() > MAX_ERROR_BODY) {
      body = body.substring(0, MAX_ERROR_BODY) + "...";
    }
    throw new IOException("HTTP " + status + ": " + body);
  }

  /** Builds the GET request; a malformed URL or header is an I/O failure. */
  private static HttpRequest buildRequest(String url, Map<String, String> headers,
      Duration timeout) throws IOException {
    try {
      HttpRequest.Builder request = HttpRequest.newBuilder()
          .uri(URI.create(url))
          .timeout(timeout)
          .GET();
      for (Map.Entry<String, String> e : headers.entrySet()) {
        request.header(e.getKey(), e.getValue());
      }
      return request.build();
    } catch (IllegalArgumentException e) {
      throw new IOException("Invalid request for " + url + ": " + e.getMessage(), e);
    }
  }
}
