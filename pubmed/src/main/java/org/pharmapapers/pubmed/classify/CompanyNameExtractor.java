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
package org.pharmapapers.pubmed.classify;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * One strategy for pulling a company name out of an affiliation string.
 * Strategies are tried in order until one returns a name.
 */
@FunctionalInterface
public interface CompanyNameExtractor {
  /**
   * Extracts a candidate company name.
   *
   * @param affiliation lower-cased affiliation text
   * @return the candidate in lower case, or null if this strategy found nothing
   */
  @Nullable String extract(String affiliation);
}
