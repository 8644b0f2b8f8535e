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

/**
 * PubMed retrieval through the NCBI E-utilities.
 *
 * <p>{@link org.pharmapapers.pubmed.PubMedClient} searches with
 * {@code esearch} and fetches the matching records with {@code efetch},
 * either by explicit ID list or in batches through the server-side result
 * set. Requests are throttled and retried by
 * {@link org.pharmapapers.pubmed.http.PubMedRequester}.</p>
 *
 * <p>Key components:</p>
 * <ul>
 *   <li>{@link org.pharmapapers.pubmed.PubMedClientConfig} - Endpoint, identification, rate and batch settings</li>
 *   <li>{@link org.pharmapapers.pubmed.http} - Throttling, retries and URL construction</li>
 *   <li>{@link org.pharmapapers.pubmed.parse} - PubMed XML parsing</li>
 *   <li>{@link org.pharmapapers.pubmed.classify} - Academic versus commercial affiliation heuristics</li>
 * </ul>
 */
package org.pharmapapers.pubmed;
