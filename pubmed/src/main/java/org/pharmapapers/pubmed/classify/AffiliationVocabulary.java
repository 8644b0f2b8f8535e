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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.regex.Pattern;

/**
 * Lookup tables used to classify affiliations. All terms are lower case and
 * matched against the lower-cased affiliation.
 */
final class AffiliationVocabulary {
  private AffiliationVocabulary() {
  }

  /** Substrings that mark an affiliation as academic, governmental or non-profit. */
  static final ImmutableSet<String> ACADEMIC_TERMS = ImmutableSet.of(
      "university", "university of", "college", "institute", "institut",
      "school", "medical school", "hospital", "medical center", "clinic",
      "research center", "research centre", "laboratory", "lab", "department",
      "faculty", "academy", "academia", "national institutes", "nih",
      "national institute", "center for", "centre for", "medical college",
      "graduate school", "postgraduate", "doctoral", "phd", "research institute",
      "government", "federal", "public health", "ministry", "department of health",
      "national health", "veterans affairs", "va medical", "cancer center",
      "memorial", "children's hospital", "foundation", "nonprofit", "non-profit");

  static final Pattern ACADEMIC_EMAIL = Pattern.compile("\\S+@\\S+\\.edu|\\S+@\\S+\\.ac\\.\\w+");

  static final ImmutableList<Pattern> ACADEMIC_PATTERNS = ImmutableList.of(
      Pattern.compile("\\b(dept|department)\\s+of\\b"),
      Pattern.compile("\\b(division|div)\\s+of\\b"),
      Pattern.compile("\\b(center|centre)\\s+for\\b"),
      Pattern.compile("\\b(school|college)\\s+of\\b"),
      Pattern.compile("\\buniversity\\s+of\\b"),
      Pattern.compile("\\b(research|medical)\\s+(center|centre)\\b"),
      Pattern.compile("\\b(teaching|university)\\s+hospital\\b"),
      Pattern.compile("\\bmedical\\s+school\\b"));

  /** Substrings that put a non-academic affiliation in the pharma/biotech domain. */
  static final ImmutableSet<String> PHARMA_BIOTECH_TERMS = ImmutableSet.of(
      "pharmaceutical", "pharmaceuticals", "pharma", "biotech", "biotechnology",
      "biopharmaceutical", "drug", "drugs", "therapeutics", "bioscience",
      "biosciences", "life sciences", "medicine", "medical devices",
      "diagnostics", "genomics", "proteomics", "clinical research",
      "contract research", "cro", "clinical trials", "drug development",
      "vaccine", "vaccines", "biologics", "biosimilar", "biosimilars",
      "medical technology", "medtech", "healthcare", "health care");

  /** Legal-entity and company-name suffixes, tried in this order. */
  static final ImmutableList<String> COMPANY_SUFFIXES = ImmutableList.of(
      "inc", "inc.", "incorporated", "corp", "corp.", "corporation",
      "ltd", "ltd.", "limited", "llc", "l.l.c.", "company", "co.",
      "plc", "p.l.c.", "gmbh", "ag", "sa", "s.a.", "nv", "b.v.",
      "pty", "pty.", "proprietary", "enterprises", "holdings",
      "international", "global", "worldwide", "group", "solutions",
      "technologies", "systems", "services", "consulting");

  /** Pharmaceutical, biotech and medical technology companies recognized by name. */
  static final ImmutableSet<String> KNOWN_COMPANIES = ImmutableSet.of(
      "pfizer", "roche", "novartis", "johnson & johnson", "j&j",
      "merck", "bristol myers squibb", "abbvie", "amgen", "gilead",
      "biogen", "genentech", "bayer", "sanofi", "glaxosmithkline",
      "gsk", "astrazeneca", "eli lilly", "takeda", "boehringer ingelheim",
      "vertex", "celgene", "illumina", "thermo fisher", "agilent",
      "waters", "perkinelmer", "danaher", "beckman coulter",
      "bd", "becton dickinson", "abbott", "medtronic", "boston scientific",
      "stryker", "zimmer biomet", "intuitive surgical", "edwards lifesciences",
      "baxter", "fresenius", "hospira", "regeneron", "moderna",
      "biontech", "curevac", "novavax", "ionis", "alnylam",
      "bluebird bio", "spark therapeutics", "kite pharma", "car-t",
      "chimeric antigen receptor", "crispr", "editas", "intellia",
      "sangamo", "precision biosciences", "beam therapeutics");

  /** Generic fallbacks used when no listed suffix yields a name. */
  static final ImmutableList<Pattern> FALLBACK_PATTERNS = ImmutableList.of(
      Pattern.compile("([^,;.]+?)\\s+(?:inc\\.?|corp\\.?|ltd\\.?|llc\\.?|plc\\.?)"),
      Pattern.compile("([^,;.]+?)\\s+(?:pharmaceutical|pharma|biotech|biotechnology)"),
      Pattern.compile("([^,;.]+?)\\s+(?:therapeutics|bioscience|life sciences)"));
}
