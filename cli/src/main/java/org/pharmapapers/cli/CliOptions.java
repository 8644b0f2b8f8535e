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

import org.pharmapapers.pubmed.PubMedClientConfig;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Parsed command line of {@code get-papers-list}.
 */
public final class CliOptions {
  static final int DEFAULT_MAX_RESULTS = 10000;

  static final String USAGE = ""
      + "Usage: get-papers-list <query> [options]\n"
      + "\n"
      + "Fetch research papers from PubMed and list those with authors affiliated\n"
      + "with pharmaceutical or biotech companies.\n"
      + "\n"
      + "Options:\n"
      + "  -h, --help              Show this help and exit\n"
      + "  -d, --debug             Print debug information during execution\n"
      + "  -f, --file <path>       Save results as CSV to this file instead of stdout\n"
      + "      --max-results <n>   Maximum number of results to retrieve (default: 10000)\n"
      + "      --batch-size <n>    Records per fetch request (default: 100)\n"
      + "      --email <address>   Contact e-mail sent to NCBI (or NCBI_EMAIL)\n"
      + "      --api-key <key>     NCBI API key for higher rate limits (or NCBI_API_KEY)\n"
      + "      --config <path>     YAML configuration file\n"
      + "      --stats             Print statistics after the results\n"
      + "\n"
      + "Examples:\n"
      + "  get-papers-list \"cancer drug development\"\n"
      + "  get-papers-list \"SARS-CoV-2 vaccine\" --file results.csv --debug\n"
      + "  get-papers-list \"(cancer OR tumor) AND (pharmaceutical OR biotech)\" --stats\n";

  private final @Nullable String query;
  private final boolean help;
  private final boolean debug;
  private final @Nullable Path file;
  private final int maxResults;
  private final @Nullable Integer batchSize;
  private final @Nullable String email;
  private final @Nullable String apiKey;
  private final @Nullable Path configFile;
  private final boolean stats;

  private CliOptions(Parser parser) {
    this.query = parser.query;
    this.help = parser.help;
    this.debug = parser.debug;
    this.file = parser.file;
    this.maxResults = parser.maxResults;
    this.batchSize = parser.batchSize;
    this.email = parser.email;
    this.apiKey = parser.apiKey;
    this.configFile = parser.configFile;
    this.stats = parser.stats;
  }

  /**
   * Parses command-line arguments.
   *
   * @throws UsageException if an option is unknown, lacks its value or has
   *     an invalid value, or if no query is given
   */
  public static CliOptions parse(String[] args) {
    Parser parser = new Parser();
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      switch (arg) {
      case "-h":
      case "--help":
        parser.help = true;
        break;
      case "-d":
      case "--debug":
        parser.debug = true;
        break;
      case "--stats":
        parser.stats = true;
        break;
      case "-f":
      case "--file":
        parser.file = Paths.get(value(args, ++i, arg));
        break;
      case "--max-results":
        parser.maxResults = positiveInt(value(args, ++i, arg), arg);
        break;
      case "--batch-size":
        parser.batchSize = positiveInt(value(args, ++i, arg), arg);
        break;
      case "--email":
        parser.email = value(args, ++i, arg);
        break;
      case "--api-key":
        parser.apiKey = value(args, ++i, arg);
        break;
      case "--config":
        parser.configFile = Paths.get(value(args, ++i, arg));
        break;
      default:
        if (arg.startsWith("-") && arg.length() > 1) {
          throw new UsageException("Unknown option: " + arg);
        }
        if (parser.query != null) {
          throw new UsageException("Unexpected argument: " + arg);
        }
        parser.query = arg;
      }
    }
    if (!parser.help && (parser.query == null || parser.query.trim().isEmpty())) {
      throw new UsageException("A search query is required");
    }
    return new CliOptions(parser);
  }

  private static String value(String[] args, int index, String option) {
    if (index >= args.length) {
      throw new UsageException("Option " + option + " requires a value");
    }
    return args[index];
  }

  private static int positiveInt(String value, String option) {
    try {
      int n = Integer.parseInt(value);
      if (n > 0) {
        return n;
      }
    } catch (NumberFormatException e) {
      throw new UsageException("Option " + option + " expects a number, got '" + value + "'");
    }
    throw new UsageException("Option " + option + " must be positive, got " + value);
  }

  /**
   * Builds the client configuration. Command-line values override the
   * configuration file, which overrides the environment.
   *
   * @param env environment variables
   * @throws IOException if the configuration file cannot be read
   */
  public PubMedClientConfig toClientConfig(Map<String, String> env) throws IOException {
    PubMedClientConfig.Builder builder = PubMedClientConfig.builder().environment(env);
    if (configFile != null) {
      builder.apply(PubMedClientConfig.loadYaml(configFile));
    }
    if (email != null) {
      builder.email(email);
    }
    if (apiKey != null) {
      builder.apiKey(apiKey);
    }
    if (batchSize != null) {
      builder.batchSize(batchSize);
    }
    return builder.build();
  }

  public @Nullable String getQuery() {
    return query;
  }

  public boolean isHelp() {
    return help;
  }

  public boolean isDebug() {
    return debug;
  }

  public @Nullable Path getFile() {
    return file;
  }

  public int getMaxResults() {
    return maxResults;
  }

  public @Nullable Integer getBatchSize() {
    return batchSize;
  }

  public @Nullable String getEmail() {
    return email;
  }

  public @Nullable String getApiKey() {
    return apiKey;
  }

  public @Nullable Path getConfigFile() {
    return configFile;
  }

  public boolean isStats() {
    return stats;
  }

  /** Mutable state while parsing. */
  private static class Parser {
    @Nullable String query;
    boolean help;
    boolean debug;
    @Nullable Path file;
    int maxResults = DEFAULT_MAX_RESULTS;
    @Nullable Integer batchSize;
    @Nullable String email;
    @Nullable String apiKey;
    @Nullable Path configFile;
    boolean stats;
  }

  /** Thrown when the command line is invalid. */
  public static class UsageException extends IllegalArgumentException {
    public UsageException(String message) {
      super(message);
    }
  }
}
