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
package org.pharmapapers.pubmed.parse;

import org.pharmapapers.pubmed.PubMedException;
import org.pharmapapers.pubmed.model.Author;
import org.pharmapapers.pubmed.model.Journal;
import org.pharmapapers.pubmed.model.Paper;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts an {@code efetch} response in PubMed XML format into {@link Paper}
 * records.
 *
 * <p>Parsing is lenient. Missing substructures leave the corresponding field
 * empty, a record that cannot be read is dropped, and a document that is not
 * XML at all produces an empty list. Nothing is thrown to the caller.
 */
public class PubMedArticleParser {
  private static final Logger LOGGER = LoggerFactory.getLogger(PubMedArticleParser.class);

  private static final Pattern EMAIL_PATTERN =
      Pattern.compile("[\\w.-]+@[\\w.-]+\\.\\w+");

  private static final String[] DATE_ELEMENTS = {"DateCompleted", "DateCreated", "PubDate"};

  private static final ImmutableMap<String, Integer> MONTHS = ImmutableMap.<String, Integer>builder()
      .put("jan", 1).put("feb", 2).put("mar", 3).put("apr", 4)
      .put("may", 5).put("jun", 6).put("jul", 7).put("aug", 8)
      .put("sep", 9).put("oct", 10).put("nov", 11).put("dec", 12)
      .build();

  /**
   * Parses every {@code PubmedArticle} in the document.
   *
   * @param xml raw efetch response
   * @return parsed papers in document order, possibly empty
   */
  public List<Paper> parse(String xml) {
    Document document;
    try {
      document = XmlSupport.parse(xml);
    } catch (PubMedException e) {
      LOGGER.error("Failed to parse PubMed document: {}", e.getMessage());
      return ImmutableList.of();
    }

    List<Element> articles = XmlSupport.all(document.getDocumentElement(), "PubmedArticle");
    List<Paper> papers = new ArrayList<>(articles.size());
    for (Element article : articles) {
      try {
        Paper paper = parseArticle(article);
        if (paper != null) {
          papers.add(paper);
        }
      } catch (RuntimeException e) {
        LOGGER.warn("Skipping article that could not be parsed: {}", e.getMessage(), e);
      }
    }
    LOGGER.debug("Parsed {} of {} articles", papers.size(), articles.size());
    return papers;
  }

  private @Nullable Paper parseArticle(Element article) {
    Element citation = XmlSupport.first(article, "MedlineCitation");
    if (citation == null) {
      LOGGER.warn("Skipping article without MedlineCitation");
      return null;
    }

    String pmid = XmlSupport.text(XmlSupport.first(citation, "PMID"));
    return Paper.builder()
        .pubmedId(pmid)
        .title(XmlSupport.text(XmlSupport.first(citation, "ArticleTitle")))
        .abstractText(XmlSupport.text(XmlSupport.firstPath(citation, "Abstract", "AbstractText")))
        .publicationDate(parseDate(citation, pmid))
        .journal(parseJournal(citation))
        .authors(parseAuthors(citation))
        .doi(findDoi(article, citation))
        .pmcId(findPmcId(article, citation))
        .build();
  }

  private static @Nullable LocalDate parseDate(Element citation, @Nullable String pmid) {
    Element dateElement = null;
    for (String name : DATE_ELEMENTS) {
      dateElement = XmlSupport.first(citation, name);
      if (dateElement != null) {
        break;
      }
    }
    if (dateElement == null) {
      return null;
    }

    String year = XmlSupport.optionalText(XmlSupport.first(dateElement, "Year"));
    if (year == null) {
      return null;
    }
    try {
      int month = parseMonth(XmlSupport.optionalText(XmlSupport.first(dateElement, "Month")));
      String day = XmlSupport.optionalText(XmlSupport.first(dateElement, "Day"));
      return LocalDate.of(Integer.parseInt(year), month,
          day == null ? 1 : Integer.parseInt(day));
    } catch (NumberFormatException | DateTimeException e) {
      LOGGER.debug("Invalid publication date for PMID {}: {}", pmid, e.getMessage());
      return null;
    }
  }

  /** Accepts "3", "03", "Mar" or "March"; absent means January. */
  static int parseMonth(@Nullable String month) {
    if (month == null) {
      return 1;
    }
    if (Character.isDigit(month.charAt(0))) {
      return Integer.parseInt(month);
    }
    if (month.length() >= 3) {
      Integer value = MONTHS.get(month.substring(0, 3).toLowerCase(Locale.ROOT));
      if (value != null) {
        return value;
      }
    }
    throw new DateTimeException("Unrecognized month '" + month + "'");
  }

  private static Journal parseJournal(Element citation) {
    Element journal = XmlSupport.first(citation, "Journal");
    String pages = XmlSupport.optionalText(XmlSupport.firstPath(citation, "Pagination", "MedlinePgn"));
    if (journal == null) {
      return pages == null ? Journal.empty() : new Journal(null, null, null, null, pages);
    }
    return new Journal(
        XmlSupport.optionalText(XmlSupport.first(journal, "Title")),
        XmlSupport.optionalText(XmlSupport.first(journal, "ISSN")),
        XmlSupport.optionalText(XmlSupport.first(journal, "Volume")),
        XmlSupport.optionalText(XmlSupport.first(journal, "Issue")),
        pages);
  }

  private static List<Author> parseAuthors(Element citation) {
    Element authorList = XmlSupport.first(citation, "AuthorList");
    if (authorList == null) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<Author> authors = ImmutableList.builder();
    for (Element element : XmlSupport.all(authorList, "Author")) {
      String affiliation = XmlSupport.optionalText(
          XmlSupport.firstPath(element, "AffiliationInfo", "Affiliation"));
      authors.add(Author.builder()
          .lastName(XmlSupport.text(XmlSupport.first(element, "LastName")))
          .firstName(XmlSupport.optionalText(XmlSupport.first(element, "ForeName")))
          .initials(XmlSupport.optionalText(XmlSupport.first(element, "Initials")))
          .affiliation(affiliation)
          .email(extractEmail(affiliation))
          .build());
    }
    return authors.build();
  }

  /** First e-mail address found in an affiliation string. */
  static @Nullable String extractEmail(@Nullable String affiliation) {
    if (affiliation == null) {
      return null;
    }
    Matcher matcher = EMAIL_PATTERN.matcher(affiliation);
    return matcher.find() ? matcher.group() : null;
  }

  private static @Nullable String findDoi(Element article, Element citation) {
    for (Element location : XmlSupport.all(citation, "ELocationID")) {
      if ("doi".equals(location.getAttribute("EIdType"))) {
        return XmlSupport.optionalText(location);
      }
    }
    for (Element id : articleIds(article)) {
      if ("doi".equals(id.getAttribute("IdType"))) {
        return XmlSupport.optionalText(id);
      }
    }
    return null;
  }

  private static @Nullable String findPmcId(Element article, Element citation) {
    for (Element other : XmlSupport.all(citation, "OtherID")) {
      String value = XmlSupport.text(other);
      if ("NLM".equals(other.getAttribute("Source")) && value.startsWith("PMC")) {
        return value;
      }
    }
    for (Element id : articleIds(article)) {
      String value = XmlSupport.text(id);
      if ("pmc".equals(id.getAttribute("IdType")) && value.startsWith("PMC")) {
        return value;
      }
    }
    return null;
  }

  private static List<Element> articleIds(Element article) {
    Element idList = XmlSupport.firstPath(article, "PubmedData", "ArticleIdList");
    return idList == null ? ImmutableList.<Element>of() : XmlSupport.children(idList, "ArticleId");
  }
}
