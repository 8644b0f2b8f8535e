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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * Journal in which a paper appeared. Every field is optional.
 */
public final class Journal {
  private static final Journal EMPTY = new Journal(null, null, null, null, null);

  private final @Nullable String title;
  private final @Nullable String issn;
  private final @Nullable String volume;
  private final @Nullable String issue;
  private final @Nullable String pages;

  public Journal(@Nullable String title, @Nullable String issn, @Nullable String volume,
      @Nullable String issue, @Nullable String pages) {
    this.title = title;
    this.issn = issn;
    this.volume = volume;
    this.issue = issue;
    this.pages = pages;
  }

  /** Journal with no known fields. */
  public static Journal empty() {
    return EMPTY;
  }

  public @Nullable String getTitle() {
    return title;
  }

  public @Nullable String getIssn() {
    return issn;
  }

  public @Nullable String getVolume() {
    return volume;
  }

  public @Nullable String getIssue() {
    return issue;
  }

  public @Nullable String getPages() {
    return pages;
  }

  @Override public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Journal)) {
      return false;
    }
    Journal that = (Journal) o;
    return Objects.equals(title, that.title)
        && Objects.equals(issn, that.issn)
        && Objects.equals(volume, that.volume)
        && Objects.equals(issue, that.issue)
        && Objects.equals(pages, that.pages);
  }

  @Override public int hashCode() {
    return Objects.hash(title, issn, volume, issue, pages);
  }

  @Override public String toString() {
    return "Journal{title='" + title + "', issn=" + issn + ", volume=" + volume
        + ", issue=" + issue + ", pages=" + pages + "}";
  }
}
