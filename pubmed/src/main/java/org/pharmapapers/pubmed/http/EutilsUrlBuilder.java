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
package org.pharmapapers.pubmed.http;

import org.pharmapapers.pubmed.PubMedClientConfig;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds E-utilities URLs for {@code esearch} and {@code efetch}.
 *
 * <p>Every URL names the {@code pubmed} database and carries the tool name,
 * plus the contact e-mail and API key when configured. Fetch URLs always ask
 * for XML.
 */
public class EutilsUrlBuilder {
  private static final String DB = "pubmed";

  private final PubMedClientConfig config;

  public EutilsUrlBuilder(PubMedClientConfig config) {
    this.config = config;
  }

  /**
   * URL of a search that keeps the result set on the server
   * ({@code usehistory=y}).
   *
   * @param query PubMed query, passed verbatim
   * @param retmax maximum number of IDs to return
   * @param retstart offset of the first ID
   */
  public String searchUrl(String query, int retmax, int retstart) {
    return new QueryString(config.getBaseUrl() + "/esearch.fcgi")
        .param("db", DB)
        .param("term", query)
        .param("retmax", String.valueOf(retmax))
        .param("retstart", String.valueOf(retstart))
        .param("usehistory", "y")
        .identification(config)
        .build();
  }

  /**
   * URL of a fetch that pages through a stored result set.
   *
   * @param webEnv WebEnv returned by the search
   * @param queryKey query key returned by the search
   * @param retmax batch size
   * @param retstart offset of the batch
   */
  public String fetchUrl(String webEnv, String queryKey, int retmax, int retstart) {
    return new QueryString(config.getBaseUrl() + "/efetch.fcgi")
        .param("db", DB)
        .param("WebEnv", webEnv)
        .param("query_key", queryKey)
        .param("retmax", String.valueOf(retmax))
        .param("retstart", String.valueOf(retstart))
        .param("retmode", "xml")
        .identification(config)
        .build();
  }

  /**
   * URL of a fetch for explicit PubMed IDs, which needs no session.
   *
   * @param pubmedIds IDs to fetch
   */
  public String fetchByIdsUrl(List<String> pubmedIds) {
    return new QueryString(config.getBaseUrl() + "/efetch.fcgi")
        .param("db", DB)
        .param("id", String.join(",", pubmedIds))
        .param("retmode", "xml")
        .identification(config)
        .build();
  }

  /** Ordered query parameters; null or empty values are dropped. */
  private static class QueryString {
    private final String baseUrl;
    private final Map<String, String> params = new LinkedHashMap<>();

    QueryString(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    QueryString param(String key, @Nullable String value) {
      if (value != null && !value.isEmpty()) {
        params.put(key, value);
      }
      return this;
    }

    QueryString identification(PubMedClientConfig config) {
      return param("tool", config.getToolName())
          .param("email", config.getEmail())
          .param("api_key", config.getApiKey());
    }

    String build() {
      if (params.isEmpty()) {
        return baseUrl;
      }
      return baseUrl + "?" + params.entrySet().stream()
          .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
          .collect(Collectors.joining("&"));
    }

    private static String encode(String value) {
      return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
  }
}
