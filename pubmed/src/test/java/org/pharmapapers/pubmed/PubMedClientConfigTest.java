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

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link PubMedClientConfig}.
 */
@Tag("unit")
public class PubMedClientConfigTest {

  @Test void testDefaults() {
    PubMedClientConfig config = PubMedClientConfig.defaults();

    assertEquals("https://eutils.ncbi.nlm.nih.gov/entrez/eutils", config.getBaseUrl());
    assertEquals("get-papers-list", config.getToolName());
    assertNull(config.getEmail());
    assertNull(config.getApiKey());
    assertEquals(3, config.getRequestsPerSecond());
    assertEquals(334, config.getMinRequestIntervalMs());
    assertEquals(3, config.getMaxRetries());
    assertEquals(1000, config.getRetryBackoffMs());
    assertEquals(30000, config.getTimeoutMs());
    assertEquals(100, config.getBatchSize());
    assertEquals(50, config.getDirectFetchThreshold());
  }

  @Test void testApiKeyRaisesRate() {
    PubMedClientConfig config = PubMedClientConfig.builder().apiKey("abc").build();

    assertEquals(10, config.getRequestsPerSecond());
    assertEquals(100, config.getMinRequestIntervalMs());
  }

  @Test void testExplicitRateWins() {
    PubMedClientConfig config = PubMedClientConfig.builder()
        .apiKey("abc")
        .requestsPerSecond(5)
        .build();

    assertEquals(5, config.getRequestsPerSecond());
    assertEquals(200, config.getMinRequestIntervalMs());
  }

  @Test void testValidation() {
    assertThrows(IllegalArgumentException.class,
        () -> PubMedClientConfig.builder().maxRetries(0).build());
    assertThrows(IllegalArgumentException.class,
        () -> PubMedClientConfig.builder().batchSize(0).build());
    assertThrows(IllegalArgumentException.class,
        () -> PubMedClientConfig.builder().requestsPerSecond(0).build());
    assertThrows(IllegalArgumentException.class,
        () -> PubMedClientConfig.builder().timeoutMs(0).build());
  }

  @Test void testFromMap() {
    Map<String, Object> rateLimit = new HashMap<>();
    rateLimit.put("requestsPerSecond", 2);
    rateLimit.put("maxRetries", 5);
    rateLimit.put("retryBackoffMs", 250);

    Map<String, Object> fetch = new HashMap<>();
    fetch.put("batchSize", 200);
    fetch.put("directFetchThreshold", 20);

    Map<String, Object> pubmed = new LinkedHashMap<>();
    pubmed.put("email", "me@example.org");
    pubmed.put("tool", "my-tool");
    pubmed.put("timeoutMs", 10000);
    pubmed.put("rateLimit", rateLimit);
    pubmed.put("fetch", fetch);

    Map<String, Object> map = new HashMap<>();
    map.put("pubmed", pubmed);

    PubMedClientConfig config = PubMedClientConfig.fromMap(map);

    assertEquals("me@example.org", config.getEmail());
    assertEquals("my-tool", config.getToolName());
    assertEquals(10000, config.getTimeoutMs());
    assertEquals(2, config.getRequestsPerSecond());
    assertEquals(5, config.getMaxRetries());
    assertEquals(250, config.getRetryBackoffMs());
    assertEquals(200, config.getBatchSize());
    assertEquals(20, config.getDirectFetchThreshold());
  }

  @Test void testFromMapNull() {
    assertEquals(100, PubMedClientConfig.fromMap(null).getBatchSize());
  }

  @Test void testFromYaml(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("pubmed.yaml");
    Files.write(file, ("pubmed:\n"
        + "  email: lab@example.org\n"
        + "  apiKey: key-123\n"
        + "  baseUrl: http://localhost:9999/eutils/\n"
        + "  fetch:\n"
        + "    batchSize: 25\n").getBytes(StandardCharsets.UTF_8));

    PubMedClientConfig config = PubMedClientConfig.fromYaml(file);

    assertEquals("lab@example.org", config.getEmail());
    assertEquals("key-123", config.getApiKey());
    assertEquals("http://localhost:9999/eutils", config.getBaseUrl());
    assertEquals(25, config.getBatchSize());
    assertEquals(10, config.getRequestsPerSecond());
    assertEquals(3, config.getMaxRetries());
  }

  @Test void testEmptyYamlGivesDefaults(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("empty.yaml");
    Files.write(file, new byte[0]);

    PubMedClientConfig config = PubMedClientConfig.fromYaml(file);

    assertEquals(PubMedClientConfig.DEFAULT_BATCH_SIZE, config.getBatchSize());
  }

  @Test void testInvalidYaml(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("broken.yaml");
    Files.write(file, "pubmed: [unclosed\n".getBytes(StandardCharsets.UTF_8));

    assertThrows(IOException.class, () -> PubMedClientConfig.fromYaml(file));
  }

  @Test void testEnvironmentFallback() {
    PubMedClientConfig config = PubMedClientConfig.builder()
        .environment(ImmutableMap.of("NCBI_EMAIL", "env@example.org", "NCBI_API_KEY", "env-key"))
        .build();

    assertEquals("env@example.org", config.getEmail());
    assertEquals("env-key", config.getApiKey());
  }

  @Test void testExplicitValuesOverrideEnvironment() {
    PubMedClientConfig config = PubMedClientConfig.builder()
        .environment(ImmutableMap.of("NCBI_EMAIL", "env@example.org"))
        .email("cli@example.org")
        .build();

    assertEquals("cli@example.org", config.getEmail());
  }

  @Test void testToStringMasksApiKey() {
    String text = PubMedClientConfig.builder().apiKey("super-secret").build().toString();

    assertFalse(text.contains("super-secret"));
    assertTrue(text.contains("****"));
  }
}
