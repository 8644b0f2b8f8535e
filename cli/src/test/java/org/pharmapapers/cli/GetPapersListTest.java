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

import org.pharmapapers.pubmed.PubMedClient;
import org.pharmapapers.pubmed.PubMedClientConfig;
import org.pharmapapers.pubmed.http.PubMedTransport;
import org.pharmapapers.pubmed.http.RateLimiter;

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link GetPapersList} with an in-memory transport.
 */
@Tag("unit")
public class GetPapersListTest {
  private static final String ESEARCH = "<eSearchResult><Count>2</Count>"
      + "<QueryKey>1</QueryKey><WebEnv>MCID_cli</WebEnv>"
      + "<IdList><Id>101</Id><Id>102</Id></IdList></eSearchResult>";

  private static final String EFETCH = "<PubmedArticleSet>"
      + "<PubmedArticle><MedlineCitation><PMID>101</PMID>"
      + "<DateCompleted><Year>2024</Year><Month>2</Month><Day>9</Day></DateCompleted>"
      + "<Article><ArticleTitle>Industry paper</ArticleTitle><AuthorList>"
      + "<Author><LastName>Smith</LastName><ForeName>Jane</ForeName>"
      + "<AffiliationInfo><Affiliation>Pfizer Inc, New York, NY</Affiliation></AffiliationInfo>"
      + "</Author>"
      + "<Author><LastName>Doe</LastName><ForeName>John</ForeName>"
      + "<AffiliationInfo><Affiliation>Harvard Medical School</Affiliation></AffiliationInfo>"
      + "</Author></AuthorList></Article></MedlineCitation></PubmedArticle>"
      + "<PubmedArticle><MedlineCitation><PMID>102</PMID>"
      + "<Article><ArticleTitle>Academic paper</ArticleTitle><AuthorList>"
      + "<Author><LastName>Lee</LastName>"
      + "<AffiliationInfo><Affiliation>University of Tokyo</Affiliation></AffiliationInfo>"
      + "</Author></AuthorList></Article></MedlineCitation></PubmedArticle>"
      + "</PubmedArticleSet>";

  private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
  private final PrintStream out = new PrintStream(stdout, true);

  private static GetPapersList app(PubMedTransport transport) {
    PubMedClientConfig config = PubMedClientConfig.builder()
        .requestsPerSecond(1000)
        .maxRetries(1)
        .retryBackoffMs(0)
        .build();
    return new GetPapersList(new PubMedClient(config, transport, new RateLimiter()));
  }

  private static PubMedTransport serving(String esearch, String efetch) {
    return (url, headers, timeout) -> url.contains("/esearch.fcgi") ? esearch : efetch;
  }

  private String output() {
    return new String(stdout.toByteArray(), StandardCharsets.UTF_8);
  }

  @Test void testPrintsMatchingPapers() throws IOException {
    int status = app(serving(ESEARCH, EFETCH))
        .execute(CliOptions.parse(new String[] {"kras"}), out);

    assertEquals(0, status);
    String[] lines = output().split("\n");
    assertEquals(2, lines.length);
    assertEquals(PaperCsvFormatterTest.HEADER_LINE, lines[0]);
    assertEquals("101,Industry paper,2024-02-09,Jane Smith,Pfizer,", lines[1]);
  }

  @Test void testStatsFollowCsv() throws IOException {
    int status = app(serving(ESEARCH, EFETCH))
        .execute(CliOptions.parse(new String[] {"kras", "--stats"}), out);

    assertEquals(0, status);
    String text = output();
    assertTrue(text.indexOf("101,Industry paper") < text.indexOf("STATISTICS"), text);
    assertTrue(text.contains("Total papers retrieved: 2\n"), text);
    assertTrue(text.contains("  Total authors: 3\n"), text);
  }

  @Test void testWritesFile(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("out.csv");
    int status = app(serving(ESEARCH, EFETCH))
        .execute(CliOptions.parse(new String[] {"kras", "-f", file.toString()}), out);

    assertEquals(0, status);
    assertEquals("", output());
    List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    assertEquals(2, lines.size());
  }

  @Test void testFetchFailureExitsWithOne() throws IOException {
    PubMedTransport transport = (url, headers, timeout) -> {
      if (url.contains("/esearch.fcgi")) {
        return ESEARCH;
      }
      throw new IOException("HTTP 500: down");
    };

    assertEquals(1, app(transport).execute(CliOptions.parse(new String[] {"kras"}), out));
    assertEquals("", output());
  }

  @Test void testNoResultsExitsWithZero() throws IOException {
    int status = app(serving("<eSearchResult><Count>0</Count><IdList/></eSearchResult>", ""))
        .execute(CliOptions.parse(new String[] {"nothing"}), out);

    assertEquals(0, status);
    assertEquals("", output());
  }

  @Test void testNoMatchingPapersExitsWithZero() throws IOException {
    String efetch = "<PubmedArticleSet><PubmedArticle><MedlineCitation><PMID>102</PMID>"
        + "<Article><AuthorList><Author><LastName>Lee</LastName><AffiliationInfo>"
        + "<Affiliation>University of Tokyo</Affiliation></AffiliationInfo></Author>"
        + "</AuthorList></Article></MedlineCitation></PubmedArticle></PubmedArticleSet>";
    int status = app(serving(ESEARCH, efetch))
        .execute(CliOptions.parse(new String[] {"q"}), out);

    assertEquals(0, status);
    assertEquals("", output());
  }

  @Test void testUsageErrorExitsWithOne() {
    ByteArrayOutputStream stderr = new ByteArrayOutputStream();
    int status = GetPapersList.run(new String[] {"--bogus"}, out,
        new PrintStream(stderr, true), ImmutableMap.<String, String>of());

    assertEquals(1, status);
    String err = new String(stderr.toByteArray(), StandardCharsets.UTF_8);
    assertTrue(err.contains("Unknown option: --bogus"), err);
    assertTrue(err.contains("Usage: get-papers-list"), err);
  }

  @Test void testHelp() {
    int status = GetPapersList.run(new String[] {"--help"}, out, out,
        ImmutableMap.<String, String>of());

    assertEquals(0, status);
    assertTrue(output().startsWith("Usage: get-papers-list"));
  }

  @Test void testMissingConfigFileExitsWithOne(@TempDir Path dir) {
    int status = GetPapersList.run(
        new String[] {"q", "--config", dir.resolve("missing.yaml").toString()}, out, out,
        ImmutableMap.<String, String>of());

    assertEquals(1, status);
  }
}
