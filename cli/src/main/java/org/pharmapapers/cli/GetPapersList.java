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
package org.pharmapapers.cli;

import org.pharmapapers.pubmed.PubMedClient;
import org.pharmapapers.pubmed.PubMedClientConfig;
import org.pharmapapers.pubmed.classify.AffiliationClassifier;
import org.pharmapapers.pubmed.model.Paper;
import org.pharmapapers.pubmed.model.RetrievalResponse;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Command-line entry point: searches PubMed, classifies every author and
 * prints the papers that have at least one non-academic author as CSV.
 *
 * <p>Exit status is 0 on success, including when nothing matched, and 1 when
 * retrieval fails, the arguments are invalid, or an unexpected error occurs.
 */
public final class GetPapersList {
  private static final Logger LOGGER = LoggerFactory.getLogger(GetPapersList.class);

  private final PubMedClient client;
  private final AffiliationClassifier classifier = new AffiliationClassifier();
  private final PaperCsvFormatter formatter = new PaperCsvFormatter();
  private final StatisticsReport report = new StatisticsReport();

  GetPapersList(PubMedClient client) {
    this.client = client;
  }

  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err, System.getenv()));
  }

  static int run(String[] args, PrintStream out, PrintStream err, Map<String, String> env) {
    CliOptions options;
    try {
      options = CliOptions.parse(args);
    } catch (CliOptions.UsageException e) {
      err.println("Error: " + e.getMessage());
      err.println();
      err.print(CliOptions.USAGE);
      return 1;
    }
    if (options.isHelp()) {
      out.print(CliOptions.USAGE);
      return 0;
    }
    if (options.isDebug()) {
      Configurator.setRootLevel(Level.DEBUG);
    }

    PubMedClientConfig config;
    try {
      config = options.toClientConfig(env);
    } catch (IOException | IllegalArgumentException e) {
      LOGGER.error("Invalid configuration: {}", e.getMessage());
      return 1;
    }
    LOGGER.debug("Using {}", config);

    try {
      return new GetPapersList(new PubMedClient(config)).execute(options, out);
    } catch (IOException e) {
      LOGGER.error("Failed to write results: {}", e.getMessage());
      return 1;
    } catch (RuntimeException e) {
      LOGGER.error("An error occurred: {}", e.getMessage(), e);
      return 1;
    }
  }

  /**
   * Runs the pipeline for parsed options.
   *
   * @return process exit status
   * @throws IOException if the CSV file cannot be written
   */
  int execute(CliOptions options, PrintStream out) throws IOException {
    LOGGER.info("Searching for papers with query: {}", options.getQuery());
    RetrievalResponse response =
        client.searchAndFetch(options.getQuery(), options.getMaxResults());
    if (!response.isSuccess()) {
      LOGGER.error("Failed to fetch papers: {}", response.getErrorMessage());
      return 1;
    }
    if (response.getErrorMessage() != null) {
      LOGGER.warn(response.getErrorMessage());
    }
    if (response.getPapers().isEmpty()) {
      LOGGER.info("No papers found matching the query.");
      return 0;
    }
    LOGGER.info("Retrieved {} papers (max requested: {})", response.getRetrievedCount(),
        options.getMaxResults());

    List<Paper> classified = classify(response.getPapers());
    List<Paper> matching = formatter.filter(classified);
    LOGGER.info("Found {} papers with non-academic authors", matching.size());
    if (matching.isEmpty()) {
      LOGGER.info("No papers found with pharmaceutical/biotech company affiliations.");
      return 0;
    }

    if (options.getFile() != null) {
      formatter.save(matching, options.getFile());
    } else {
      out.print(formatter.format(matching));
      out.flush();
    }
    if (options.isStats()) {
      out.print(report.render(classified));
      out.flush();
    }
    return 0;
  }

  private List<Paper> classify(List<Paper> papers) {
    List<Paper> result = new ArrayList<>(papers.size());
    for (int i = 0; i < papers.size(); i++) {
      if (i % 100 == 0) {
        LOGGER.debug("Classifying paper {}/{}", i + 1, papers.size());
      }
      result.add(classifier.classify(papers.get(i)));
    }
    return result;
  }
}
