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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads configuration files into Jackson trees.
 *
 * <p>YAML is parsed with SnakeYAML so that anchors and aliases are resolved,
 * then converted to a {@link JsonNode}. JSON files go straight to Jackson.
 */
final class YamlSupport {
  private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

  private YamlSupport() {
  }

  /**
   * Parses YAML or JSON, choosing the format from the resource name.
   *
   * @param stream configuration content
   * @param resourceName file name, used only for its extension
   * @return parsed tree; a missing node for an empty document
   * @throws IOException if the content cannot be parsed
   */
  static JsonNode parseYamlOrJson(InputStream stream, String resourceName) throws IOException {
    if (resourceName.endsWith(".yaml") || resourceName.endsWith(".yml")) {
      Object parsed;
      try {
        parsed = new Yaml(new LoaderOptions()).load(stream);
      } catch (YAMLException e) {
        throw new IOException("Invalid YAML in " + resourceName + ": " + e.getMessage(), e);
      }
      if (parsed == null) {
        return MissingNode.getInstance();
      }
      return JSON_MAPPER.convertValue(parsed, JsonNode.class);
    }
    return JSON_MAPPER.readTree(stream);
  }
}
