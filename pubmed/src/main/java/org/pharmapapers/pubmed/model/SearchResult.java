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

import java.util.List;
import java.util.Objects;

/**
 * Outcome of an {@code esearch} call.
 *
 * <p>A search either succeeded, in which case the total count, the retrieved
 * identifiers and (when the server kept the result set) the session handle
 * are available, or it failed. A failed result has a zero count, no
 * identifiers, and {@link #isFailed()} returns true with the reason in
 * {@link #getFailureMessage()}, so that callers can tell an empty result from
 * a degraded one.
 *
 * <p>The total count is what the server reports and may be larger than the
 * number of identifiers returned.
 */
public final class SearchResult {
  private final String query;
  private final int totalResults;
  private final ImmutableList<String> pubmedIds;
  private final @Nullable String webEnv;
  private final @Nullable String queryKey;
  private final @Nullable String failureMessage;

  public SearchResult(String query, int totalResults, List<String> pubmedIds,
      @Nullable String webEnv, @Nullable String queryKey) {
    this(query, totalResults, pubmedIds, webEnv, queryKey, null);
  }

  private SearchResult(String query, int totalResults, List<String> pubmedIds,
      @Nullable String webEnv, @Nullable String queryKey, @Nullable String failureMessage) {
    this.query = query;
    this.totalResults = totalResults;
    this.pubmedIds = ImmutableList.copyOf(pubmedIds);
    this.webEnv = webEnv;
    this.queryKey = queryKey;
    this.failureMessage = failureMessage;
  }

  /**
   * Creates the result of a search that could not be completed.
   *
   * @param query the query that was submitted
   * @param reason why the search failed
   * @return a failed, empty search result
   */
  public static SearchResult failed(String query, String reason) {
    return new SearchResult(query, 0, ImmutableList.<String>of(), null, null, reason);
  }

  public String getQuery() {
    return query;
  }

  public int getTotalResults() {
    return totalResults;
  }

  public List<String> getPubmedIds() {
    return pubmedIds;
  }

  public @Nullable String getWebEnv() {
    return webEnv;
  }

  public @Nullable String getQueryKey() {
    return queryKey;
  }

  /** Whether the server returned both parts of a session handle. */
  public boolean hasSession() {
    return webEnv != null && !webEnv.isEmpty()
        && queryKey != null && !queryKey.isEmpty();
  }

  public boolean isFailed() {
    return failureMessage != null;
  }

  public @Nullable String getFailureMessage() {
    return failureMessage;
  }

  /**
   * Returns a copy that keeps at most {@code maxIds} identifiers. The total
   * count is left as the server reported it.
   */
  public SearchResult limitTo(int maxIds) {
    if (maxIds < 0 || pubmedIds.size() <= maxIds) {
      return this;
    }
    return new SearchResult(query, totalResults, pubmedIds.subList(0, maxIds),
        webEnv, queryKey, failureMessage);
  }

  @Override public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SearchResult)) {
      return false;
    }
    SearchResult that = (SearchResult) o;
    return totalResults == that.totalResults
        && query.equals(that.query)
        && pubmedIds.equals(that.pubmedIds)
        && Objects.equals(webEnv, that.webEnv)
        && Objects.equals(queryKey, that.queryKey)
        && Objects.equals(failureMessage, that.failureMessage);
  }

  @Override public int hashCode() {
    return Objects.hash(query, totalResults, pubmedIds, webEnv, queryKey, failureMessage);
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("SearchResult{query='").append(query).append("'");
    sb.append(", total=").append(totalResults);
    sb.append(", ids=").append(pubmedIds.size());
    if (hasSession()) {
      sb.append(", queryKey=").append(queryKey);
    }
    if (failureMessage != null) {
      sb.append(", failure='").append(failureMessage).append("'");
    }
    sb.append("}");
    return sb.toString();
  }
}
