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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the text captured by group 1 of a regular expression, such as
 * the words in front of "therapeutics".
 */
public class PatternCompanyNameExtractor implements CompanyNameExtractor {
  private static final Pattern EDGE_NON_WORD =
      Pattern.compile("^\\W+|\\W+$", Pattern.UNICODE_CHARACTER_CLASS);
  private static final int MIN_NAME_LENGTH = 4;

  private final Pattern pattern;

  public PatternCompanyNameExtractor(Pattern pattern) {
    this.pattern = pattern;
  }

  @Override public @Nullable String extract(String affiliation) {
    Matcher matcher = pattern.matcher(affiliation);
    return matcher.find() ? clean(matcher.group(1)) : null;
  }

  /** Trims surrounding punctuation; names shorter than four characters are rejected. */
  static @Nullable String clean(@Nullable String candidate) {
    if (candidate == null) {
      return null;
    }
    String name = EDGE_NON_WORD.matcher(candidate.trim()).replaceAll("");
    return name.length() >= MIN_NAME_LENGTH ? name : null;
  }

  @Override public String toString() {
    return "PatternCompanyNameExtractor{" + pattern.pattern() + "}";
  }
}
