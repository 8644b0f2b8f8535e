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
package org.pharmapapers.pubmed.classify;

import org.pharmapapers.pubmed.model.Author;

import com.google.common.collect.ImmutableSortedSet;

import java.util.List;
import java.util.Set;

/** Counts over a list of classified authors. */
public final class ClassificationStatistics {
  private final int totalAuthors;
  private final int nonAcademicAuthors;
  private final int authorsWithCompanies;
  private final ImmutableSortedSet<String> companies;

  private ClassificationStatistics(int totalAuthors, int nonAcademicAuthors,
      int authorsWithCompanies, ImmutableSortedSet<String> companies) {
    this.totalAuthors = totalAuthors;
    this.nonAcademicAuthors = nonAcademicAuthors;
    this.authorsWithCompanies = authorsWithCompanies;
    this.companies = companies;
  }

  public static ClassificationStatistics of(List<Author> authors) {
    int nonAcademic = 0;
    int withCompanies = 0;
    ImmutableSortedSet.Builder<String> companies = ImmutableSortedSet.naturalOrder();
    for (Author author : authors) {
      if (author.isNonAcademic()) {
        nonAcademic++;
      }
      if (!author.getCompanyAffiliations().isEmpty()) {
        withCompanies++;
        companies.addAll(author.getCompanyAffiliations());
      }
    }
    return new ClassificationStatistics(authors.size(), nonAcademic, withCompanies,
        companies.build());
  }

  public int getTotalAuthors() {
    return totalAuthors;
  }

  public int getNonAcademicAuthors() {
    return nonAcademicAuthors;
  }

  public int getAuthorsWithCompanies() {
    return authorsWithCompanies;
  }

  public int getUniqueCompanyCount() {
    return companies.size();
  }

  /** Unique company names in natural order. */
  public Set<String> getCompanies() {
    return companies;
  }

  @Override public String toString() {
    return "ClassificationStatistics{authors=" + totalAuthors
        + ", nonAcademic=" + nonAcademicAuthors
        + ", withCompanies=" + authorsWithCompanies
        + ", uniqueCompanies=" + companies.size() + "}";
  }
}
