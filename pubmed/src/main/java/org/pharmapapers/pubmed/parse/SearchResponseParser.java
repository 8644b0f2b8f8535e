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
import org.pharmapapers.pubmed.model.SearchResult;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads an {@code esearch} response: the total count, the returned
 * identifiers and the session handle.
 */
public class SearchResponseParser {

  /**
   * Parses a search response.
   *
   * @param xml raw esearch response
   * @param query the query that produced it
   * @return the search result
   * @throws PubMedException if the document is not XML or the server
   *     reported an error
   */
  public SearchResult parse(String xml, String query) {
    Element root = XmlSupport.parse(xml).getDocumentElement();

    List<Element> errors = XmlSupport.children(root, "ERROR");
    if (!errors.isEmpty()) {
      throw new PubMedException("PubMed search error: " + XmlSupport.text(errors.get(0)));
    }

    int count = parseCount(firstChildOrDescendant(root, "Count"));
    List<String> ids = new ArrayList<>();
    Element idList = firstChildOrDescendant(root, "IdList");
    if (idList != null) {
      for (Element id : XmlSupport.children(idList, "Id")) {
        String value = XmlSupport.optionalText(id);
        if (value != null) {
          ids.add(value);
        }
      }
    }
    return new SearchResult(query, count, ids,
        XmlSupport.optionalText(firstChildOrDescendant(root, "WebEnv")),
        XmlSupport.optionalText(firstChildOrDescendant(root, "QueryKey")));
  }

  // The top-level Count precedes the per-term counts in TranslationStack.
  private static @Nullable Element firstChildOrDescendant(Element root, String tag) {
    List<Element> children = XmlSupport.children(root, tag);
    return children.isEmpty() ? XmlSupport.first(root, tag) : children.get(0);
  }

  private static int parseCount(@Nullable Element element) {
    String text = XmlSupport.optionalText(element);
    if (text == null) {
      return 0;
    }
    try {
      return Integer.parseInt(text);
    } catch (NumberFormatException e) {
      throw new PubMedException("Invalid result count '" + text + "'", e);
    }
  }
}
