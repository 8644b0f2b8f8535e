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
import org.pharmapapers.pubmed.model.Paper;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides whether an author's affiliation is academic and, for non-academic
 * authors, which companies it names.
 *
 * <p>An affiliation is academic when it contains an academic term, an
 * academic e-mail domain ({@code .edu}, {@code .ac.*}) or a structural
 * phrase such as "department of". Everything else is non-academic.
 *
 * <p>For non-academic affiliations every known company contained in the text
 * is reported. When the text also belongs to the pharma/biotech domain, the
 * extraction strategies run in order and the first name found is added
 * unless it is already present. Names are returned title-cased.
 *
 * <p>This is a keyword heuristic. Names it extracts are approximate.
 */
public class AffiliationClassifier {
  private static final Logger LOGGER = LoggerFactory.getLogger(AffiliationClassifier.class);

  private final ImmutableList<CompanyNameExtractor> extractors;

  /** Creates a classifier with the default extraction strategies. */
  public AffiliationClassifier() {
    this(defaultExtractors());
  }

  public AffiliationClassifier(List<CompanyNameExtractor> extractors) {
    this.extractors = ImmutableList.copyOf(extractors);
  }

  /** Suffix strategy first, then the generic suffix, domain and product-line patterns. */
  public static List<CompanyNameExtractor> defaultExtractors() {
    ImmutableList.Builder<CompanyNameExtractor> builder = ImmutableList.builder();
    builder.add(new SuffixCompanyNameExtractor(AffiliationVocabulary.COMPANY_SUFFIXES));
    for (Pattern pattern : AffiliationVocabulary.FALLBACK_PATTERNS) {
      builder.add(new PatternCompanyNameExtractor(pattern));
    }
    return builder.build();
  }

  /**
   * Classifies one author.
   *
   * @return a copy with the non-academic flag and company names set; the
   *     same author if it has no affiliation
   */
  public Author classify(Author author) {
    String affiliation = author.getAffiliation();
    if (affiliation == null || affiliation.trim().isEmpty()) {
      return author;
    }
    String lower = affiliation.toLowerCase(Locale.ROOT);
    if (isAcademic(lower)) {
      return author.withClassification(false, ImmutableList.<String>of());
    }
    List<String> companies = extractCompanies(lower);
    LOGGER.debug("Non-academic affiliation '{}' -> {}", affiliation, companies);
    return author.withClassification(true, companies);
  }

  public List<Author> classifyAll(List<Author> authors) {
    ImmutableList.Builder<Author> result = ImmutableList.builder();
    for (Author author : authors) {
      result.add(classify(author));
    }
    return result.build();
  }

  /** Returns a copy of the paper with every author classified. */
  public Paper classify(Paper paper) {
    return paper.withAuthors(classifyAll(paper.getAuthors()));
  }

  /**
   * Whether an affiliation is academic.
   *
   * @param affiliation affiliation text, any case
   */
  public boolean isAcademic(@Nullable String affiliation) {
    if (affiliation == null) {
      return true;
    }
    String lower = affiliation.toLowerCase(Locale.ROOT);
    for (String term : AffiliationVocabulary.ACADEMIC_TERMS) {
      if (lower.contains(term)) {
        return true;
      }
    }
    if (AffiliationVocabulary.ACADEMIC_EMAIL.matcher(lower).find()) {
      return true;
    }
    for (Pattern pattern : AffiliationVocabulary.ACADEMIC_PATTERNS) {
      if (pattern.matcher(lower).find()) {
        return true;
      }
    }
    return false;
  }

  List<String> extractCompanies(String lowerAffiliation) {
    List<String> companies = new ArrayList<>();
    for (String company : AffiliationVocabulary.KNOWN_COMPANIES) {
      if (lowerAffiliation.contains(company)) {
        companies.add(titleCase(company));
      }
    }

    if (hasPharmaBiotechTerm(lowerAffiliation)) {
      String name = extractCompanyName(lowerAffiliation);
      if (name != null && !containsIgnoreCase(companies, name)) {
        companies.add(titleCase(name));
      }
    }
    return ImmutableList.copyOf(companies);
  }

  private @Nullable String extractCompanyName(String lowerAffiliation) {
    for (CompanyNameExtractor extractor : extractors) {
      String name = extractor.extract(lowerAffiliation);
      if (name != null) {
        return name;
      }
    }
    return null;
  }

  private static boolean hasPharmaBiotechTerm(String lowerAffiliation) {
    for (String term : AffiliationVocabulary.PHARMA_BIOTECH_TERMS) {
      if (lowerAffiliation.contains(term)) {
        return true;
      }
    }
    return false;
  }

  private static boolean containsIgnoreCase(List<String> names, String name) {
    for (String existing : names) {
      if (existing.equalsIgnoreCase(name)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Upper-cases the first letter of every run of letters and lower-cases the
   * rest: "johnson & johnson" becomes "Johnson & Johnson", "3m" becomes "3M".
   */
  static String titleCase(String text) {
    StringBuilder sb = new StringBuilder(text.length());
    boolean previousLetter = false;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (Character.isLetter(c)) {
        sb.append(previousLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
        previousLetter = true;
      } else {
        sb.append(c);
        previousLetter = false;
      }
    }
    return sb.toString();
  }
}
