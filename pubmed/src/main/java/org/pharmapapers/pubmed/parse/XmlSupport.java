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

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

/**
 * DOM helpers shared by the E-utilities response parsers.
 *
 * <p>E-utilities documents declare an external DTD. The DTD is never loaded
 * and external entities are not resolved, so parsing works offline and
 * cannot be used to read local files.
 */
final class XmlSupport {
  private static final Logger LOGGER = LoggerFactory.getLogger(XmlSupport.class);

  private static final ErrorHandler ERROR_HANDLER = new ErrorHandler() {
    @Override public void warning(SAXParseException e) {
      LOGGER.debug("XML warning at line {}: {}", e.getLineNumber(), e.getMessage());
    }

    @Override public void error(SAXParseException e) throws SAXException {
      throw e;
    }

    @Override public void fatalError(SAXParseException e) throws SAXException {
      throw e;
    }
  };

  private XmlSupport() {
  }

  /**
   * Parses an XML string into a DOM document.
   *
   * @throws PubMedException if the content is not well-formed XML
   */
  static Document parse(String xml) {
    if (xml == null || xml.trim().isEmpty()) {
      throw new PubMedException("Empty XML document");
    }
    try {
      DocumentBuilder builder = newFactory().newDocumentBuilder();
      builder.setErrorHandler(ERROR_HANDLER);
      return builder.parse(new InputSource(new StringReader(xml)));
    } catch (ParserConfigurationException e) {
      throw new IllegalStateException("XML parser is not available", e);
    } catch (SAXException | IOException e) {
      throw new PubMedException("XML parsing error: " + e.getMessage(), e);
    }
  }

  private static DocumentBuilderFactory newFactory() throws ParserConfigurationException {
    DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
    factory.setNamespaceAware(false);
    factory.setValidating(false);
    factory.setExpandEntityReferences(false);
    factory.setXIncludeAware(false);
    factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
    factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
    factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
    factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
    return factory;
  }

  /** First descendant element with the given tag, in document order. */
  static @Nullable Element first(Element parent, String tag) {
    NodeList nodes = parent.getElementsByTagName(tag);
    return nodes.getLength() > 0 ? (Element) nodes.item(0) : null;
  }

  /** All descendant elements with the given tag, in document order. */
  static List<Element> all(Element parent, String tag) {
    NodeList nodes = parent.getElementsByTagName(tag);
    List<Element> result = new ArrayList<>(nodes.getLength());
    for (int i = 0; i < nodes.getLength(); i++) {
      result.add((Element) nodes.item(i));
    }
    return result;
  }

  /** Direct child elements with the given tag. */
  static List<Element> children(Element parent, String tag) {
    List<Element> result = new ArrayList<>();
    for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
      if (n.getNodeType() == Node.ELEMENT_NODE && tag.equals(n.getNodeName())) {
        result.add((Element) n);
      }
    }
    return result;
  }

  /**
   * Finds the first element reached by a descendant with tag {@code path[0]}
   * followed by direct children {@code path[1..]}, like the XPath
   * {@code .//A/B/C}.
   */
  static @Nullable Element firstPath(Element parent, String... path) {
    for (Element start : all(parent, path[0])) {
      Element found = descend(start, path, 1);
      if (found != null) {
        return found;
      }
    }
    return null;
  }

  private static @Nullable Element descend(Element current, String[] path, int index) {
    if (index == path.length) {
      return current;
    }
    for (Element child : children(current, path[index])) {
      Element found = descend(child, path, index + 1);
      if (found != null) {
        return found;
      }
    }
    return null;
  }

  /** Trimmed text content of an element, or null if the element is null. */
  static @Nullable String text(@Nullable Element element) {
    if (element == null) {
      return null;
    }
    return element.getTextContent().trim();
  }

  /** Like {@link #text(Element)}, but an empty result becomes null. */
  static @Nullable String optionalText(@Nullable Element element) {
    String text = text(element);
    return text == null || text.isEmpty() ? null : text;
  }
}
