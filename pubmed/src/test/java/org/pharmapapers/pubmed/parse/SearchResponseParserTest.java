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
package org.pharmapapers.pubmed.parse;

import org.pharmapapers.pubmed.PubMedException;
import org.pharmapapers.pubmed.model.SearchResult;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Resources;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link SearchResponseParser}.
 */
@Tag("unit")
public class SearchResponseParserTest {
  private final SearchResponseParser parser = new SearchResponseParser();

  @Test void testParseSample() throws IOException {
    String xml = Resources.toString(Resources.getResource("esearch-sample.xml"),
        StandardCharsets.UTF_8);
    SearchResult result = parser.parse(xml, "cancer");

    assertEquals("cancer", result.getQuery());
    assertEquals(251, result.getTotalResults());
    assertEquals(ImmutableList.of("39000003", "39000002", "39000001"), result.getPubmedIds());
    assertEquals("MCID_6543210abcdef", result.getWebEnv());
    assertEquals("1", result.getQueryKey());
    assertTrue(result.hasSession());
    assertFalse(result.isFailed());
  }

  @Test void testNoSession() {
    SearchResult result = parser.parse(
        "<eSearchResult><Count>2</Count><IdList><Id>1</Id><Id>2</Id></IdList></eSearchResult>",
        "q");

    assertEquals(2, result.getPubmedIds().size());
    assertNull(result.getWebEnv());
    assertFalse(result.hasSession());
  }

  @Test void testMissingCountIsZero() {
    SearchResult result = parser.parse("<eSearchResult><IdList/></eSearchResult>", "q");

    assertEquals(0, result.getTotalResults());
    assertTrue(result.getPubmedIds().isEmpty());
  }

  @Test void testServerError() {
    PubMedException e = assertThrows(PubMedException.class,
        () -> parser.parse("<eSearchResult><ERROR>Invalid query syntax</ERROR></eSearchResult>",
            "((("));
    assertTrue(e.getMessage().contains("Invalid query syntax"), e.getMessage());
  }

  @Test void testMalformedXml() {
    assertThrows(PubMedException.class, () -> parser.parse("<eSearchResult><Count>", "q"));
    assertThrows(PubMedException.class, () -> parser.parse("", "q"));
  }

  @Test void testInvalidCount() {
    assertThrows(PubMedException.class,
        () -> parser.parse("<eSearchResult><Count>many</Count></eSearchResult>", "q"));
  }
}
