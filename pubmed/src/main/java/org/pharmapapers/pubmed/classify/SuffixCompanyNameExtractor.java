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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Finds a company name by the legal-entity or business suffix that follows
 * it, e.g. "acme biologics" in "acme biologics gmbh, berlin".
 *
 * <p>Suffixes are tried in list order. A suffix only counts when it is not
 * followed by another letter or digit, so "ag" does not match "agency".
 */
public class SuffixCompanyNameExtractor implements CompanyNameExtractor {
  private final ImmutableList<PatternCompanyNameExtractor> extractors;

  public SuffixCompanyNameExtractor(List<String> suffixes) {
    ImmutableList.Builder<PatternCompanyNameExtractor> builder = ImmutableList.builder();
    for (String suffix : suffixes) {
      builder.add(
          new PatternCompanyNameExtractor(
              Pattern.compile("([^,;.]+?)\\s+" + Pattern.quote(suffix) + "(?!\\w)")));
    }
    this.extractors = builder.build();
  }

  @Override public @Nullable String extract(String affiliation) {
    for (PatternCompanyNameExtractor extractor : extractors) {
      String name = extractor.extract(affiliation);
      if (name != null) {
        return name;
      }
    }
    return null;
  }
}
