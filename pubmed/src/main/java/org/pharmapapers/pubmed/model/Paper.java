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
package org.pharmapapers.pubmed.model;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A PubMed citation.
 *
 * <p>The publication date keeps only what PubMed reported: a year is required,
 * and a missing month or day is taken as 1, so a paper dated "2021" has the
 * date 2021-01-01.
 */
public final class Paper {
  private final String pubmedId;
  private final String title;
  private final @Nullable LocalDate publicationDate;
  private final ImmutableList<Author> authors;
  private final Journal journal;
  private final @Nullable String abstractText;
  private final @Nullable String doi;
  private final @Nullable String pmcId;

  private Paper(Builder builder) {
    this.pubmedId = builder.pubmedId != null ? builder.pubmedId : "";
    this.title = builder.title != null ? builder.title : "";
    this.publicationDate = builder.publicationDate;
    this.authors = builder.authors != null
        ? ImmutableList.copyOf(builder.authors)
        : ImmutableList.<Author>of();
    this.journal = builder.journal != null ? builder.journal : Journal.empty();
    this.abstractText = builder.abstractText;
    this.doi = builder.doi;
    this.pmcId = builder.pmcId;
  }

  public String getPubmedId() {
    return pubmedId;
  }

  public String getTitle() {
    return title;
  }

  public @Nullable LocalDate getPublicationDate() {
    return publicationDate;
  }

  /** Authors in the order PubMed lists them. */
  public List<Author> getAuthors() {
    return authors;
  }

  public Journal getJournal() {
    return journal;
  }

  public @Nullable String getAbstractText() {
    return abstractText;
  }

  public @Nullable String getDoi() {
    return doi;
  }

  public @Nullable String getPmcId() {
    return pmcId;
  }

  /** Returns the authors classified as non-academic. */
  public List<Author> getNonAcademicAuthors() {
    List<Author> result = new ArrayList<>();
    for (Author author : authors) {
      if (author.isNonAcademic()) {
        result.add(author);
      }
    }
    return result;
  }

  /** Returns the distinct company names of all authors, in order of first appearance. */
  public List<String> getCompanyAffiliations() {
    Set<String> companies = new LinkedHashSet<>();
    for (Author author : authors) {
      companies.addAll(author.getCompanyAffiliations());
    }
    return new ArrayList<>(companies);
  }

  /**
   * Returns the e-mail of the first corresponding author that has one, or null.
   *
   * <p>Parsed papers never flag a corresponding author, so this is null for
   * them.
   */
  public @Nullable String getCorrespondingAuthorEmail() {
    for (Author author : authors) {
      if (author.isCorresponding() && author.getEmail() != null) {
        return author.getEmail();
      }
    }
    return null;
  }

  /** Returns a copy of this paper with a different author list. */
  public Paper withAuthors(List<Author> newAuthors) {
    return toBuilder().authors(newAuthors).build();
  }

  public Builder toBuilder() {
    return new Builder()
        .pubmedId(pubmedId)
        .title(title)
        .publicationDate(publicationDate)
        .authors(authors)
        .journal(journal)
        .abstractText(abstractText)
        .doi(doi)
        .pmcId(pmcId);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Paper)) {
      return false;
    }
    Paper that = (Paper) o;
    return pubmedId.equals(that.pubmedId)
        && title.equals(that.title)
        && Objects.equals(publicationDate, that.publicationDate)
        && authors.equals(that.authors)
        && journal.equals(that.journal)
        && Objects.equals(abstractText, that.abstractText)
        && Objects.equals(doi, that.doi)
        && Objects.equals(pmcId, that.pmcId);
  }

  @Override public int hashCode() {
    return Objects.hash(pubmedId, title, publicationDate, authors, journal,
        abstractText, doi, pmcId);
  }

  @Override public String toString() {
    return "Paper{pubmedId='" + pubmedId + "', title='" + title + "', date="
        + publicationDate + ", authors=" + authors.size() + "}";
  }

  /**
   * Builder for Paper.
   */
  public static class Builder {
    private @Nullable String pubmedId;
    private @Nullable String title;
    private @Nullable LocalDate publicationDate;
    private @Nullable List<Author> authors;
    private @Nullable Journal journal;
    private @Nullable String abstractText;
    private @Nullable String doi;
    private @Nullable String pmcId;

    public Builder pubmedId(@Nullable String pubmedId) {
      this.pubmedId = pubmedId;
      return this;
    }

    public Builder title(@Nullable String title) {
      this.title = title;
      return this;
    }

    public Builder publicationDate(@Nullable LocalDate publicationDate) {
      this.publicationDate = publicationDate;
      return this;
    }

    public Builder authors(@Nullable List<Author> authors) {
      this.authors = authors;
      return this;
    }

    public Builder journal(@Nullable Journal journal) {
      this.journal = journal;
      return this;
    }

    public Builder abstractText(@Nullable String abstractText) {
      this.abstractText = abstractText;
      return this;
    }

    public Builder doi(@Nullable String doi) {
      this.doi = doi;
      return this;
    }

    public Builder pmcId(@Nullable String pmcId) {
      this.pmcId = pmcId;
      return this;
    }

    public Paper build() {
      return new Paper(this);
    }
  }
}
