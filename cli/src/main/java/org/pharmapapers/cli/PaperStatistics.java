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

import org.pharmapapers.pubmed.model.Author;
import org.pharmapapers.pubmed.model.Paper;

import com.google.common.collect.ImmutableSortedSet;

import java.util.List;
import java.util.Set;

/**
 * Paper-level statistics over a retrieval: how many papers had non-academic
 * authors, and which companies and authors were found in them.
 */
public final class PaperStatistics {
  private final int totalPapers;
  private final int papersWithNonAcademicAuthors;
  private final ImmutableSortedSet<String> companies;
  private final ImmutableSortedSet<String> nonAcademicAuthors;

  private PaperStatistics(int totalPapers, int papersWithNonAcademicAuthors,
      ImmutableSortedSet<String> companies, ImmutableSortedSet<String> nonAcademicAuthors) {
    this.totalPapers = totalPapers;
    this.papersWithNonAcademicAuthors = papersWithNonAcademicAuthors;
    this.companies = companies;
    this.nonAcademicAuthors = nonAcademicAuthors;
  }

  /**
   * Computes statistics over all retrieved papers, whose authors must
   * already be classified.
   */
  public static PaperStatistics of(List<Paper> papers) {
    int matching = 0;
    ImmutableSortedSet.Builder<String> companies = ImmutableSortedSet.naturalOrder();
    ImmutableSortedSet.Builder<String> authors = ImmutableSortedSet.naturalOrder();
    for (Paper paper : papers) {
      List<Author> nonAcademic = paper.getNonAcademicAuthors();
      if (nonAcademic.isEmpty()) {
        continue;
      }
      matching++;
      companies.addAll(paper.getCompanyAffiliations());
      for (Author author : nonAcademic) {
        String first = author.getFirstName() == null ? "" : author.getFirstName();
        authors.add((first + " " + author.getLastName()).trim());
      }
    }
    return new PaperStatistics(papers.size(), matching, companies.build(), authors.build());
  }

  public int getTotalPapers() {
    return totalPapers;
  }

  public int getPapersWithNonAcademicAuthors() {
    return papersWithNonAcademicAuthors;
  }

  public Set<String> getCompanies() {
    return companies;
  }

  public int getUniqueCompanyCount() {
    return companies.size();
  }

  public Set<String> getNonAcademicAuthors() {
    return nonAcademicAuthors;
  }

  public int getUniqueNonAcademicAuthorCount() {
    return nonAcademicAuthors.size();
  }

  /** Fraction of papers with a non-academic author, 0 when there are no papers. */
  public double getFilterRate() {
    return totalPapers == 0 ? 0 : (double) papersWithNonAcademicAuthors / totalPapers;
  }
}
