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
package org.pharmapapers.cli;

import org.pharmapapers.pubmed.PubMedClientConfig;

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link CliOptions}.
 */
@Tag("unit")
public class CliOptionsTest {

  @Test void testQueryOnly() {
    CliOptions options = CliOptions.parse(new String[] {"cancer drug development"});

    assertEquals("cancer drug development", options.getQuery());
    assertEquals(10000, options.getMaxResults());
    assertFalse(options.isDebug());
    assertFalse(options.isStats());
    assertNull(options.getFile());
    assertNull(options.getBatchSize());
  }

  @Test void testAllOptions() {
    CliOptions options = CliOptions.parse(new String[] {
        "--debug", "vaccine", "-f", "out.csv", "--max-results", "250",
        "--batch-size", "50", "--email", "me@example.org", "--api-key", "k",
        "--config", "conf.yaml", "--stats"});

    assertEquals("vaccine", options.getQuery());
    assertTrue(options.isDebug());
    assertEquals(Paths.get("out.csv"), options.getFile());
    assertEquals(250, options.getMaxResults());
    assertEquals(Integer.valueOf(50), options.getBatchSize());
    assertEquals("me@example.org", options.getEmail());
    assertEquals("k", options.getApiKey());
    assertEquals(Paths.get("conf.yaml"), options.getConfigFile());
    assertTrue(options.isStats());
  }

  @Test void testShortFlags() {
    CliOptions options = CliOptions.parse(new String[] {"-d", "q", "--file", "x.csv"});

    assertTrue(options.isDebug());
    assertEquals(Paths.get("x.csv"), options.getFile());
  }

  @Test void testHelpNeedsNoQuery() {
    assertTrue(CliOptions.parse(new String[] {"-h"}).isHelp());
    assertTrue(CliOptions.parse(new String[] {"--help"}).isHelp());
  }

  @Test void testUsageErrors() {
    assertThrows(CliOptions.UsageException.class, () -> CliOptions.parse(new String[0]));
    assertThrows(CliOptions.UsageException.class,
        () -> CliOptions.parse(new String[] {"q", "--bogus"}));
    assertThrows(CliOptions.UsageException.class,
        () -> CliOptions.parse(new String[] {"q", "--file"}));
    assertThrows(CliOptions.UsageException.class,
        () -> CliOptions.parse(new String[] {"q", "--max-results", "lots"}));
    assertThrows(CliOptions.UsageException.class,
        () -> CliOptions.parse(new String[] {"q", "--max-results", "0"}));
    assertThrows(CliOptions.UsageException.class,
        () -> CliOptions.parse(new String[] {"q", "extra"}));
  }

  @Test void testConfigPrecedence(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("pubmed.yml");
    Files.write(file, ("pubmed:\n"
        + "  email: file@example.org\n"
        + "  apiKey: file-key\n"
        + "  fetch:\n"
        + "    batchSize: 40\n").getBytes(StandardCharsets.UTF_8));

    CliOptions options = CliOptions.parse(new String[] {
        "q", "--config", file.toString(), "--email", "cli@example.org"});
    PubMedClientConfig config = options.toClientConfig(
        ImmutableMap.of("NCBI_EMAIL", "env@example.org", "NCBI_API_KEY", "env-key"));

    assertEquals("cli@example.org", config.getEmail());
    assertEquals("file-key", config.getApiKey());
    assertEquals(40, config.getBatchSize());
  }

  @Test void testEnvironmentFallback() throws IOException {
    PubMedClientConfig config = CliOptions.parse(new String[] {"q", "--batch-size", "7"})
        .toClientConfig(ImmutableMap.of("NCBI_API_KEY", "env-key"));

    assertEquals("env-key", config.getApiKey());
    assertEquals(10, config.getRequestsPerSecond());
    assertEquals(7, config.getBatchSize());
  }
}
