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

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * Performs a single HTTP GET against the E-utilities service.
 *
 * <p>Implementations make exactly one attempt. Throttling and retries are
 * the job of {@link PubMedRequester}.
 */
@FunctionalInterface
public interface PubMedTransport {

  /**
   * Fetches a URL and returns the response body.
   *
   * @param url absolute URL, already encoded
   * @param headers request headers
   * @param timeout maximum time to wait for the response
   * @return response body
   * @throws IOException on network failure or a non-2xx status
   * @throws InterruptedException if interrupted while waiting
   */
  String get(String url, Map<String, String> headers, Duration timeout)
      throws IOException, InterruptedException;
}
