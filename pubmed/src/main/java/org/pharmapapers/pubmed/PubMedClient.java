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
package org.pharmapapers.pubmed;

import org.pharmapapers.pubmed.http.EutilsUrlBuilder;
import org.pharmapapers.pubmed.http.HttpClientTransport;
import org.pharmapapers.pubmed.http.PubMedRequester;
import org.pharmapapers.pubmed.http.PubMedTransport;
import org.pharmapapers.pubmed.http.RateLimiter;
import org.pharmapapers.pubmed.model.Paper;
import org.pharmapapers.pubmed.model.RetrievalResponse;
import org.pharmapapers.pubmed.model.SearchResult;
import org.pharmapapers.pubmed.parse.PubMedArticleParser;
import org.pharmapapers.pubmed.parse.SearchResponseParser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Retrieves papers from PubMed by combining a search with one or more fetch
 * requests.
 *
 * <p>Small result sets are fetched in one request by explicit identifier
 * list. Larger ones are paged through the server-side result set kept by the
 * search ({@code WebEnv} and {@code query_key}) in batches. A batch that
 * fails is logged and skipped, so a successful response may hold fewer
 * papers than were requested.
 *
 * <p>Instances are not thread-safe, but all instances throttle through the
 * same {@link RateLimiter} unless one is supplied.
 */
public class PubMedClient {
  private static final Logger LOGGER = LoggerFactory.getLogger(PubMedClient.class);

  static final String MISSING_SESSION_MESSAGE =
      "Invalid search result: missing session handle (WebEnv/query_key)";

  private final PubMedClientConfig config;
  private final PubMedRequester requester;
  private final EutilsUrlBuilder urlBuilder;
  private final SearchResponseParser searchParser = new SearchResponseParser();
  private final PubMedArticleParser articleParser = new PubMedArticleParser();

  public PubMedClient(PubMedClientConfig config) {
    this(config, new HttpClientTransport(Duration.ofMillis(config.getTimeoutMs())),
        RateLimiter.shared());
  }

  public PubMedClient(PubMedClientConfig config, PubMedTransport transport,
      RateLimiter rateLimiter) {
    this.config = config;
    this.requester = new PubMedRequester(config, transport, rateLimiter);
    this.urlBuilder = new EutilsUrlBuilder(config);
  }

  public PubMedClientConfig getConfig() {
    return config;
  }

  /**
   * Searches PubMed. Failures are not thrown: they produce a
   * {@link SearchResult#failed failed} result with no identifiers.
   *
   * @param query PubMed query, passed to the server verbatim
   * @param maxResults maximum number of identifiers to keep
   * @return the search result
   */
  public SearchResult search(String query, int maxResults) {
    if (maxResults <= 0) {
      throw new IllegalArgumentException("maxResults must be positive: " + maxResults);
    }
    LOGGER.info("Searching PubMed for: {}", query);
    SearchResult result;
    try {
      String xml = requester.send(urlBuilder.searchUrl(query, maxResults, 0));
      result = searchParser.parse(xml, query);
    } catch (PubMedException e) {
      LOGGER.error("Error searching PubMed: {}", e.getMessage());
      return SearchResult.failed(query, "Search failed: " + e.getMessage());
    }

    if (result.getPubmedIds().size() > maxResults) {
      LOGGER.debug("Server returned {} IDs, keeping {}", result.getPubmedIds().size(),
          maxResults);
      result = result.limitTo(maxResults);
    }
    LOGGER.info("Found {} total results, retrieved {} IDs", result.getTotalResults(),
        result.getPubmedIds().size());
    return result;
  }

  /**
   * Fetches the papers behind a search result.
   *
   * @param searchResult result of {@link #search}
   * @param batchSize number of records per request when paging
   * @return the retrieval outcome; unsuccessful only if the whole fetch failed
   */
  public RetrievalResponse fetchPapers(SearchResult searchResult, int batchSize) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
    }
    List<String> ids = searchResult.getPubmedIds();
    if (ids.isEmpty()) {
      return RetrievalResponse.empty();
    }

    List<Paper> papers;
    if (ids.size() <= config.getDirectFetchThreshold()) {
      try {
        papers = fetchByIds(ids);
      } catch (PubMedException e) {
        LOGGER.error("Failed to fetch papers: {}", e.getMessage());
        return RetrievalResponse.failure("Failed to fetch papers: " + e.getMessage());
      }
    } else {
      try {
        papers = fetchInBatches(searchResult, batchSize);
      } catch (RetrievalException e) {
        LOGGER.error(e.getMessage());
        return RetrievalResponse.failure(e.getMessage());
      }
    }

    if (papers.size() > ids.size()) {
      LOGGER.warn("Server returned {} papers for {} requested IDs, discarding the extra",
          papers.size(), ids.size());
      papers = papers.subList(0, ids.size());
    }
    LOGGER.info("Retrieved {} of {} papers", papers.size(), ids.size());
    return RetrievalResponse.success(papers, ids.size());
  }

  /**
   * Searches and fetches in one call using the configured batch size.
   *
   * <p>A failed search is reported as a successful, empty response whose
   * error message carries the failure.
   */
  public RetrievalResponse searchAndFetch(String query, int maxResults) {
    SearchResult searchResult = search(query, maxResults);
    if (searchResult.isFailed()) {
      return RetrievalResponse.empty(searchResult.getFailureMessage());
    }
    if (searchResult.getPubmedIds().isEmpty()) {
      LOGGER.info("No papers found for query: {}", query);
      return RetrievalResponse.empty();
    }
    return fetchPapers(searchResult, config.getBatchSize());
  }

  private List<Paper> fetchByIds(List<String> ids) {
    LOGGER.debug("Fetching {} papers by ID", ids.size());
    String xml = requester.send(urlBuilder.fetchByIdsUrl(ids));
    return articleParser.parse(xml);
  }

  private List<Paper> fetchInBatches(SearchResult searchResult, int batchSize) {
    if (!searchResult.hasSession()) {
      throw new RetrievalException(MISSING_SESSION_MESSAGE);
    }
    int total = searchResult.getPubmedIds().size();
    List<Paper> papers = new ArrayList<>(total);

    for (int start = 0; start < total; start += batchSize) {
      if (Thread.currentThread().isInterrupted()) {
        LOGGER.warn("Interrupted, stopping after {} of {} papers", papers.size(), total);
        break;
      }
      int size = Math.min(batchSize, total - start);
      LOGGER.debug("Fetching batch: {} to {}", start, start + size);
      try {
        String xml = requester.send(
            urlBuilder.fetchUrl(searchResult.getWebEnv(), searchResult.getQueryKey(), size, start));
        papers.addAll(articleParser.parse(xml));
      } catch (PubMedException e) {
        LOGGER.error("Failed to fetch batch starting at {}: {}", start, e.getMessage());
      }
    }
    return papers;
  }
}
