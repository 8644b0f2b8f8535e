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

import org.pharmapapers.pubmed.classify.AffiliationClassifier;
import org.pharmapapers.pubmed.model.Author;
import org.pharmapapers.pubmed.model.Paper;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link PaperStatistics} and {@link StatisticsReport}.
 */
@Tag("unit")
public class PaperStatisticsTest {

  @Test void testStatistics() {
    List<Paper> papers = ImmutableList.of(
        PaperCsvFormatterTest.pharmaPaper(), PaperCsvFormatterTest.academicPaper());
    PaperStatistics stats = PaperStatistics.of(papers);

    assertEquals(2, stats.getTotalPapers());
    assertEquals(1, stats.getPapersWithNonAcademicAuthors());
    assertEquals(ImmutableList.of("Pfizer", "Roche"), ImmutableList.copyOf(stats.getCompanies()));
    assertEquals(ImmutableList.of("Jane Smith", "Kumar"),
        ImmutableList.copyOf(stats.getNonAcademicAuthors()));
    assertEquals(0.5, stats.getFilterRate(), 1e-9);
  }

  @Test void testNoPapers() {
    PaperStatistics stats = PaperStatistics.of(ImmutableList.<Paper>of());

    assertEquals(0, stats.getTotalPapers());
    assertEquals(0.0, stats.getFilterRate(), 0.0);
  }

  @Test void testReport() {
    String report = new StatisticsReport().render(ImmutableList.of(
        PaperCsvFormatterTest.pharmaPaper(), PaperCsvFormatterTest.academicPaper()));

    assertTrue(report.contains("SEARCH AND CLASSIFICATION STATISTICS"), report);
    assertTrue(report.contains("Total papers retrieved: 2\n"), report);
    assertTrue(report.contains("Papers with pharma/biotech authors: 1\n"), report);
    assertTrue(report.contains("Filter rate: 50.0%\n"), report);
    assertTrue(report.contains("Unique companies identified: 2\n"), report);
    assertTrue(report.contains("  1. Pfizer\n  2. Roche\n"), report);
    assertTrue(report.contains("  Total authors: 4\n"), report);
    assertTrue(report.contains("  Non-academic authors: 2\n"), report);
    assertTrue(report.contains("  Authors with company affiliations: 2\n"), report);
  }

  @Test void testReportListsTopTenCompanies() {
    AffiliationClassifier classifier = new AffiliationClassifier();
    String[] affiliations = {
        "Pfizer Inc", "Roche, Basel", "Novartis AG", "Amgen", "Gilead Sciences",
        "Biogen", "Bayer AG", "Sanofi", "Takeda", "Moderna", "Regeneron", "Illumina"};
    ImmutableList.Builder<Author> authors = ImmutableList.builder();
    for (String affiliation : affiliations) {
      authors.add(Author.builder()
          .lastName("X").affiliation(affiliation).build());
    }
    Paper paper = classifier.classify(
        Paper.builder().pubmedId("1").authors(authors.build()).build());

    String report = new StatisticsReport().render(ImmutableList.of(paper));

    assertTrue(report.contains("  10. "), report);
    assertTrue(report.contains("  ... and 2 more\n"), report);
  }
}
