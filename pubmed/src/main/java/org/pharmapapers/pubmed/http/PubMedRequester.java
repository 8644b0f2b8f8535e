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

import org.pharmapapers.pubmed.PubMedClientConfig;
import org.pharmapapers.pubmed.RequestException;

import com.google.common.collect.ImmutableMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * Sends E-utilities requests with throttling and retries.
 *
 * <p>Each attempt first waits on the {@link RateLimiter}. An attempt that
 * fails with an {@link IOException} (network error or non-2xx status) is
 * retried after {@code retryBackoffMs * 2^attempt} milliseconds, up to the
 * configured number of attempts. When the last attempt fails a
 * {@link RequestException} is thrown with the last cause and the attempt
 * count.
 */
public class PubMedRequester {
  private static final Logger LOGGER = LoggerFactory.getLogger(PubMedRequester.class);

  private final PubMedClientConfig config;
  private final PubMedTransport transport;
  private final RateLimiter rateLimiter;
  private final Map<String, String> headers;

  public PubMedRequester(PubMedClientConfig config, PubMedTransport transport,
      RateLimiter rateLimiter) {
    this.config = config;
    this.transport = transport;
    this.rateLimiter = rateLimiter;
    this.headers = ImmutableMap.of("User-Agent", userAgent(config));
  }

  /**
   * Fetches a URL, throttled and retried.
   *
   * @param url E-utilities URL
   * @return response body
   * @throws RequestException if every attempt failed or the thread was interrupted
   */
  public String send(String url) {
    int maxAttempts = config.getMaxRetries();
    long minInterval = config.getMinRequestIntervalMs();
    Duration timeout = Duration.ofMillis(config.getTimeoutMs());
    IOException lastException = null;

    for (int attempt = 0; attempt < maxAttempts; attempt++) {
      try {
        rateLimiter.acquire(minInterval);
        LOGGER.debug("Making request to: {}", url);
        String body = transport.get(url, headers, timeout);
        rateLimiter.recordSuccess();
        LOGGER.debug("Response received: {} characters", body.length());
        return body;
      } catch (IOException e) {
        lastException = e;
        LOGGER.warn("Request failed (attempt {}/{}): {}", attempt + 1, maxAttempts,
            e.getMessage());
        if (attempt < maxAttempts - 1) {
          backoff(attempt, maxAttempts);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new RequestException("Interrupted while requesting " + url, attempt + 1, e);
      }
    }

    throw new RequestException("Request failed after " + maxAttempts + " attempts: "
        + (lastException != null ? lastException.getMessage() : "unknown error"),
        maxAttempts, lastException);
  }

  private void backoff(int attempt, int maxAttempts) {
    long delay = config.getRetryBackoffMs() * (1L << attempt);
    LOGGER.debug("Retrying in {} ms", delay);
    try {
      Thread.sleep(delay);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new RequestException("Interrupted during retry backoff", attempt + 1, ie);
    }
  }

  static String userAgent(PubMedClientConfig config) {
    String contact = config.getEmail() != null ? config.getEmail() : "unknown@example.com";
    return config.getToolName() + "/1.0 (mailto:" + contact + ")";
  }
}
