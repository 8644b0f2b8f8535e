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
package org.pharmapapers.pubmed;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Configuration for {@link PubMedClient}.
 *
 * <p>Covers the E-utilities endpoint, the identification NCBI asks clients to
 * send, throttling and retry settings, and fetch pagination.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * pubmed:
 *   baseUrl: "https://eutils.ncbi.nlm.nih.gov/entrez/eutils"
 *   tool: "get-papers-list"
 *   email: "someone@example.org"
 *   apiKey: "0123456789abcdef"
 *   timeoutMs: 30000
 *   rateLimit:
 *     requestsPerSecond: 10
 *     maxRetries: 3
 *     retryBackoffMs: 1000
 *   fetch:
 *     batchSize: 100
 *     directFetchThreshold: 50
 * }</pre>
 *
 * <p>When {@code requestsPerSecond} is not set it is derived from the API
 * key: NCBI allows 3 requests per second without a key and 10 with one.
 */
public class PubMedClientConfig {
  private static final Logger LOGGER = LoggerFactory.getLogger(PubMedClientConfig.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  public static final String DEFAULT_BASE_URL = "https://eutils.ncbi.nlm.nih.gov/entrez/eutils";
  public static final String DEFAULT_TOOL_NAME = "get-papers-list";
  public static final int DEFAULT_REQUESTS_PER_SECOND = 3;
  public static final int API_KEY_REQUESTS_PER_SECOND = 10;
  public static final int DEFAULT_MAX_RETRIES = 3;
  public static final long DEFAULT_RETRY_BACKOFF_MS = 1000;
  public static final long DEFAULT_TIMEOUT_MS = 30000;
  public static final int DEFAULT_BATCH_SIZE = 100;
  public static final int DEFAULT_DIRECT_FETCH_THRESHOLD = 50;

  /** Environment variable holding the contact e-mail. */
  public static final String ENV_EMAIL = "NCBI_EMAIL";
  /** Environment variable holding the NCBI API key. */
  public static final String ENV_API_KEY = "NCBI_API_KEY";

  private final String baseUrl;
  private final String toolName;
  private final @Nullable String email;
  private final @Nullable String apiKey;
  private final @Nullable Integer requestsPerSecond;
  private final int maxRetries;
  private final long retryBackoffMs;
  private final long timeoutMs;
  private final int batchSize;
  private final int directFetchThreshold;

  private PubMedClientConfig(Builder builder) {
    this.baseUrl = trimTrailingSlash(builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL);
    this.toolName = builder.toolName != null ? builder.toolName : DEFAULT_TOOL_NAME;
    this.email = emptyToNull(builder.email);
    this.apiKey = emptyToNull(builder.apiKey);
    this.requestsPerSecond = builder.requestsPerSecond;
    this.maxRetries = builder.maxRetries;
    this.retryBackoffMs = builder.retryBackoffMs;
    this.timeoutMs = builder.timeoutMs;
    this.batchSize = builder.batchSize;
    this.directFetchThreshold = builder.directFetchThreshold;

    if (requestsPerSecond != null && requestsPerSecond <= 0) {
      throw new IllegalArgumentException("requestsPerSecond must be positive: " + requestsPerSecond);
    }
    if (maxRetries < 1) {
      throw new IllegalArgumentException("maxRetries must be at least 1: " + maxRetries);
    }
    if (batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be at least 1: " + batchSize);
    }
    if (retryBackoffMs < 0 || timeoutMs <= 0 || directFetchThreshold < 0) {
      throw new IllegalArgumentException("retryBackoffMs, timeoutMs and directFetchThreshold"
          + " must not be negative, and timeoutMs must be positive");
    }
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  public String getToolName() {
    return toolName;
  }

  public @Nullable String getEmail() {
    return email;
  }

  public @Nullable String getApiKey() {
    return apiKey;
  }

  /**
   * Returns the request rate to throttle to: the configured value, or 10
   * when an API key is present and 3 otherwise.
   */
  public int getRequestsPerSecond() {
    if (requestsPerSecond != null) {
      return requestsPerSecond;
    }
    return apiKey != null ? API_KEY_REQUESTS_PER_SECOND : DEFAULT_REQUESTS_PER_SECOND;
  }

  /**
   * Minimum interval between requests, derived from the request rate and
   * rounded up so that the rate is never exceeded.
   */
  public long getMinRequestIntervalMs() {
    int rps = getRequestsPerSecond();
    return (1000L + rps - 1) / rps;
  }

  /** Total number of attempts per request, including the first. */
  public int getMaxRetries() {
    return maxRetries;
  }

  /** Backoff unit; attempt {@code n} (from 0) waits {@code retryBackoffMs * 2^n}. */
  public long getRetryBackoffMs() {
    return retryBackoffMs;
  }

  public long getTimeoutMs() {
    return timeoutMs;
  }

  public int getBatchSize() {
    return batchSize;
  }

  /** Largest result set that is fetched by explicit IDs in one request. */
  public int getDirectFetchThreshold() {
    return directFetchThreshold;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    Builder builder = new Builder()
        .baseUrl(baseUrl)
        .toolName(toolName)
        .email(email)
        .apiKey(apiKey)
        .maxRetries(maxRetries)
        .retryBackoffMs(retryBackoffMs)
        .timeoutMs(timeoutMs)
        .batchSize(batchSize)
        .directFetchThreshold(directFetchThreshold);
    builder.requestsPerSecond = requestsPerSecond;
    return builder;
  }

  /** Returns the default configuration. */
  public static PubMedClientConfig defaults() {
    return builder().build();
  }

  /**
   * Creates a configuration from a map, as produced by parsing YAML or JSON.
   * A top-level {@code pubmed} key, if present, is descended into.
   */
  public static PubMedClientConfig fromMap(@Nullable Map<String, Object> map) {
    if (map == null) {
      return defaults();
    }
    return builder().apply(MAPPER.valueToTree(map)).build();
  }

  /**
   * Loads a configuration from a YAML (or JSON) file.
   *
   * @param path configuration file
   * @return the configuration
   * @throws IOException if the file cannot be read or parsed
   */
  public static PubMedClientConfig fromYaml(Path path) throws IOException {
    return builder().apply(loadYaml(path)).build();
  }

  /**
   * Reads a YAML or JSON configuration file into a tree.
   *
   * @param path configuration file
   * @return parsed tree
   * @throws IOException if the file cannot be read or parsed
   */
  public static JsonNode loadYaml(Path path) throws IOException {
    try (InputStream in = Files.newInputStream(path)) {
      return YamlSupport.parseYamlOrJson(in, path.getFileName().toString());
    }
  }

  @Override public String toString() {
    return "PubMedClientConfig{baseUrl='" + baseUrl + "', tool='" + toolName + "'"
        + ", email=" + email + ", apiKey=" + (apiKey != null ? "****" : "null")
        + ", requestsPerSecond=" + getRequestsPerSecond()
        + ", maxRetries=" + maxRetries + ", retryBackoffMs=" + retryBackoffMs
        + ", timeoutMs=" + timeoutMs + ", batchSize=" + batchSize
        + ", directFetchThreshold=" + directFetchThreshold + "}";
  }

  private static @Nullable String emptyToNull(@Nullable String value) {
    return value == null || value.trim().isEmpty() ? null : value.trim();
  }

  private static String trimTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }

  /**
   * Builder for PubMedClientConfig.
   */
  public static class Builder {
    private @Nullable String baseUrl;
    private @Nullable String toolName;
    private @Nullable String email;
    private @Nullable String apiKey;
    private @Nullable Integer requestsPerSecond;
    private int maxRetries = DEFAULT_MAX_RETRIES;
    private long retryBackoffMs = DEFAULT_RETRY_BACKOFF_MS;
    private long timeoutMs = DEFAULT_TIMEOUT_MS;
    private int batchSize = DEFAULT_BATCH_SIZE;
    private int directFetchThreshold = DEFAULT_DIRECT_FETCH_THRESHOLD;

    public Builder baseUrl(@Nullable String baseUrl) {
      this.baseUrl = baseUrl;
      return this;
    }

    public Builder toolName(@Nullable String toolName) {
      this.toolName = toolName;
      return this;
    }

    public Builder email(@Nullable String email) {
      this.email = email;
      return this;
    }

    public Builder apiKey(@Nullable String apiKey) {
      this.apiKey = apiKey;
      return this;
    }

    public Builder requestsPerSecond(int requestsPerSecond) {
      this.requestsPerSecond = requestsPerSecond;
      return this;
    }

    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    public Builder retryBackoffMs(long retryBackoffMs) {
      this.retryBackoffMs = retryBackoffMs;
      return this;
    }

    public Builder timeoutMs(long timeoutMs) {
      this.timeoutMs = timeoutMs;
      return this;
    }

    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    public Builder directFetchThreshold(int directFetchThreshold) {
      this.directFetchThreshold = directFetchThreshold;
      return this;
    }

    /**
     * Fills in the contact e-mail and API key from {@code NCBI_EMAIL} and
     * {@code NCBI_API_KEY} when they are set.
     *
     * @param env environment variables, usually {@link System#getenv()}
     * @return this builder
     */
    public Builder environment(Map<String, String> env) {
      String envEmail = env.get(ENV_EMAIL);
      if (envEmail != null && !envEmail.isEmpty()) {
        this.email = envEmail;
      }
      String envKey = env.get(ENV_API_KEY);
      if (envKey != null && !envKey.isEmpty()) {
        this.apiKey = envKey;
      }
      return this;
    }

    /**
     * Overlays the values present in a parsed configuration tree. Keys that
     * are absent leave the current value unchanged.
     *
     * @param root parsed YAML or JSON configuration
     * @return this builder
     */
    public Builder apply(@Nullable JsonNode root) {
      if (root == null || root.isMissingNode() || root.isNull()) {
        return this;
      }
      JsonNode node = root.has("pubmed") ? root.path("pubmed") : root;

      baseUrl = text(node, "baseUrl", baseUrl);
      toolName = text(node, "tool", toolName);
      email = text(node, "email", email);
      apiKey = text(node, "apiKey", apiKey);
      timeoutMs = node.path("timeoutMs").asLong(timeoutMs);

      JsonNode rateLimit = node.path("rateLimit");
      if (rateLimit.has("requestsPerSecond")) {
        requestsPerSecond = rateLimit.path("requestsPerSecond").asInt();
      }
      maxRetries = rateLimit.path("maxRetries").asInt(maxRetries);
      retryBackoffMs = rateLimit.path("retryBackoffMs").asLong(retryBackoffMs);

      JsonNode fetch = node.path("fetch");
      batchSize = fetch.path("batchSize").asInt(batchSize);
      directFetchThreshold = fetch.path("directFetchThreshold").asInt(directFetchThreshold);

      for (String key : new String[] {"requestsPerSecond", "maxRetries", "batchSize"}) {
        if (node.has(key)) {
          LOGGER.warn("Ignoring top-level '{}'; it belongs under 'rateLimit' or 'fetch'", key);
        }
      }
      return this;
    }

    public PubMedClientConfig build() {
      return new PubMedClientConfig(this);
    }

    private static @Nullable String text(JsonNode node, String field,
        @Nullable String current) {
      JsonNode value = node.get(field);
      if (value == null || value.isNull()) {
        return current;
      }
      return value.asText();
    }
  }
}
