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

import org.pharmapapers.pubmed.classify.ClassificationStatistics;
import org.pharmapapers.pubmed.model.Author;
import org.pharmapapers.pubmed.model.Paper;

import com.google.common.base.Strings;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders the statistics printed by {@code --stats}.
 */
public class StatisticsReport {
  static final int TOP_COMPANIES = 10;

  private static final String RULE = Strings.repeat("=", 50);

  /**
   * Renders the report for a retrieval.
   *
   * @param papers all retrieved papers, with classified authors
   * @return the report text
   */
  public String render(List<Paper> papers) {
    PaperStatistics stats = PaperStatistics.of(papers);
    StringBuilder sb = new StringBuilder();
    sb.append('\n').append(RULE).append('\n');
    sb.append("SEARCH AND CLASSIFICATION STATISTICS\n");
    sb.append(RULE).append('\n');
    sb.append("Total papers retrieved: ").append(stats.getTotalPapers()).append('\n');
    sb.append("Papers with pharma/biotech authors: ")
        .append(stats.getPapersWithNonAcademicAuthors()).append('\n');
    sb.append(String.format(Locale.ROOT, "Filter rate: %.1f%%\n", stats.getFilterRate() * 100));
    sb.append("Unique companies identified: ").append(stats.getUniqueCompanyCount()).append('\n');
    sb.append("Unique non-academic authors: ")
        .append(stats.getUniqueNonAcademicAuthorCount()).append('\n');

    if (!stats.getCompanies().isEmpty()) {
      sb.append("\nTop companies found:\n");
      int i = 0;
      for (String company : stats.getCompanies()) {
        if (i == TOP_COMPANIES) {
          break;
        }
        sb.append("  ").append(++i).append(". ").append(company).append('\n');
      }
      if (stats.getUniqueCompanyCount() > TOP_COMPANIES) {
        sb.append("  ... and ").append(stats.getUniqueCompanyCount() - TOP_COMPANIES)
            .append(" more\n");
      }
    }

    List<Author> authors = new ArrayList<>();
    for (Paper paper : papers) {
      authors.addAll(paper.getAuthors());
    }
    if (!authors.isEmpty()) {
      ClassificationStatistics authorStats = ClassificationStatistics.of(authors);
      sb.append("\nAuthor classification:\n");
      sb.append("  Total authors: ").append(authorStats.getTotalAuthors()).append('\n');
      sb.append("  Non-academic authors: ").append(authorStats.getNonAcademicAuthors())
          .append('\n');
      sb.append("  Authors with company affiliations: ")
          .append(authorStats.getAuthorsWithCompanies()).append('\n');
    }
    sb.append(RULE).append('\n');
    return sb.toString();
  }
}
