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

import org.pharmapapers.pubmed.model.Author;
import org.pharmapapers.pubmed.model.Paper;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.opencsv.CSVWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes papers as CSV, one row per paper that has at least one
 * non-academic author. Papers without one are skipped.
 */
public class PaperCsvFormatter {
  private static final Logger LOGGER = LoggerFactory.getLogger(PaperCsvFormatter.class);

  static final String[] HEADER = {
      "PubmedID",
      "Title",
      "Publication Date",
      "Non-academic Author(s)",
      "Company Affiliation(s)",
      "Corresponding Author Email"
  };

  private static final Joiner LIST_JOINER = Joiner.on("; ");

  /** Formats papers as a CSV string, header included. */
  public String format(List<Paper> papers) {
    StringWriter out = new StringWriter();
    try {
      write(papers, out);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return out.toString();
  }

  /**
   * Writes papers as CSV. The writer is flushed but not closed.
   *
   * @throws IOException if writing fails
   */
  public void write(List<Paper> papers, Writer out) throws IOException {
    CSVWriter csv = new CSVWriter(out);
    csv.writeNext(HEADER, false);
    int rows = 0;
    for (Paper paper : papers) {
      List<Author> nonAcademic = paper.getNonAcademicAuthors();
      if (nonAcademic.isEmpty()) {
        continue;
      }
      csv.writeNext(toRow(paper, nonAcademic), false);
      rows++;
    }
    csv.flush();
    if (csv.checkError()) {
      throw new IOException("Failed to write CSV output", csv.getException());
    }
    LOGGER.debug("Wrote {} CSV rows", rows);
  }

  /** Writes papers to a UTF-8 CSV file, replacing any existing content. */
  public void save(List<Paper> papers, Path path) throws IOException {
    try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      write(papers, out);
    }
    LOGGER.info("Results saved to {}", path);
  }

  /** Papers that have at least one non-academic author. */
  public List<Paper> filter(List<Paper> papers) {
    List<Paper> result = new ArrayList<>();
    for (Paper paper : papers) {
      if (!paper.getNonAcademicAuthors().isEmpty()) {
        result.add(paper);
      }
    }
    return ImmutableList.copyOf(result);
  }

  private static String[] toRow(Paper paper, List<Author> nonAcademic) {
    List<String> names = new ArrayList<>();
    for (Author author : nonAcademic) {
      String name = author.getDisplayName();
      if (!name.isEmpty()) {
        names.add(name);
      }
    }
    String email = paper.getCorrespondingAuthorEmail();
    return new String[] {
        paper.getPubmedId(),
        paper.getTitle(),
        paper.getPublicationDate() == null
            ? "" : paper.getPublicationDate().format(DateTimeFormatter.ISO_LOCAL_DATE),
        LIST_JOINER.join(names),
        LIST_JOINER.join(paper.getCompanyAffiliations()),
        email == null ? "" : email
    };
  }
}
