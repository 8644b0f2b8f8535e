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
 * Result of a search-and-fetch operation.
 *
 * <p>A failed response never carries papers, and the number of retrieved
 * papers never exceeds the number requested. A successful response may still
 * be incomplete: batches that failed during pagination are skipped and only
 * show up as a retrieved count below the total.
 */
public final class RetrievalResponse {
  private final boolean success;
  private final ImmutableList<Paper> papers;
  private final @Nullable String errorMessage;
  private final int totalCount;
  private final int retrievedCount;

  private RetrievalResponse(boolean success, List<Paper> papers,
      @Nullable String errorMessage, int totalCount) {
    if (!success && !papers.isEmpty()) {
      throw new IllegalArgumentException("failed response cannot carry papers");
    }
    if (papers.size() > totalCount) {
      throw new IllegalArgumentException("retrieved " + papers.size()
          + " papers but only " + totalCount + " were requested");
    }
    this.success = success;
    this.papers = ImmutableList.copyOf(papers);
    this.errorMessage = errorMessage;
    this.totalCount = totalCount;
    this.retrievedCount = papers.size();
  }

  /**
   * Creates a successful response.
   *
   * @param papers papers that were retrieved and parsed
   * @param totalCount number of papers that were requested
   */
  public static RetrievalResponse success(List<Paper> papers, int totalCount) {
    return new RetrievalResponse(true, papers, null, totalCount);
  }

  /** Creates a successful response with no papers. */
  public static RetrievalResponse empty() {
    return new RetrievalResponse(true, ImmutableList.<Paper>of(), null, 0);
  }

  /**
   * Creates a successful, empty response that records why nothing was
   * retrieved, such as a search that failed and was downgraded.
   */
  public static RetrievalResponse empty(String note) {
    return new RetrievalResponse(true, ImmutableList.<Paper>of(), note, 0);
  }

  /** Creates a failed response. */
  public static RetrievalResponse failure(String errorMessage) {
    return new RetrievalResponse(false, ImmutableList.<Paper>of(), errorMessage, 0);
  }

  public boolean isSuccess() {
    return success;
  }

  public List<Paper> getPapers() {
    return papers;
  }

  public @Nullable String getErrorMessage() {
    return errorMessage;
  }

  public int getTotalCount() {
    return totalCount;
  }

  public int getRetrievedCount() {
    return retrievedCount;
  }

  @Override public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RetrievalResponse)) {
      return false;
    }
    RetrievalResponse that = (RetrievalResponse) o;
    return success == that.success
        && totalCount == that.totalCount
        && papers.equals(that.papers)
        && Objects.equals(errorMessage, that.errorMessage);
  }

  @Override public int hashCode() {
    return Objects.hash(success, papers, errorMessage, totalCount);
  }

  @Override public String toString() {
    return "RetrievalResponse{success=" + success + ", retrieved=" + retrievedCount
        + "/" + totalCount + (errorMessage != null ? ", error='" + errorMessage + "'" : "")
        + "}";
  }
}
