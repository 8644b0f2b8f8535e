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
package org.pharmapapers.pubmed.model;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * An author of a paper, with the affiliation text PubMed reports for them.
 *
 * <p>Name, affiliation and e-mail are fixed when the record is parsed. The
 * classification fields ({@link #isNonAcademic()} and
 * {@link #getCompanyAffiliations()}) start out empty and are filled in by
 * {@link #withClassification(boolean, List)}, which returns a new instance.
 *
 * <p>The last name is never null; it is the empty string when PubMed omits it
 * (for example for collective names).
 */
public final class Author {
  private final @Nullable String firstName;
  private final String lastName;
  private final @Nullable String initials;
  private final @Nullable String affiliation;
  private final @Nullable String email;
  private final boolean corresponding;
  private final boolean nonAcademic;
  private final ImmutableList<String> companyAffiliations;

  private Author(Builder builder) {
    this.firstName = builder.firstName;
    this.lastName = builder.lastName != null ? builder.lastName : "";
    this.initials = builder.initials;
    this.affiliation = builder.affiliation;
    this.email = builder.email;
    this.corresponding = builder.corresponding;
    this.nonAcademic = builder.nonAcademic;
    this.companyAffiliations = builder.companyAffiliations != null
        ? ImmutableList.copyOf(builder.companyAffiliations)
        : ImmutableList.<String>of();
  }

  public @Nullable String getFirstName() {
    return firstName;
  }

  public String getLastName() {
    return lastName;
  }

  public @Nullable String getInitials() {
    return initials;
  }

  public @Nullable String getAffiliation() {
    return affiliation;
  }

  public @Nullable String getEmail() {
    return email;
  }

  /** Always false for parsed records; PubMed does not mark corresponding authors. */
  public boolean isCorresponding() {
    return corresponding;
  }

  public boolean isNonAcademic() {
    return nonAcademic;
  }

  public List<String> getCompanyAffiliations() {
    return companyAffiliations;
  }

  /**
   * Returns a copy of this author carrying the given classification.
   *
   * @param nonAcademic whether the affiliation failed the academic test
   * @param companies company names extracted from the affiliation
   * @return new author value
   */
  public Author withClassification(boolean nonAcademic, List<String> companies) {
    return toBuilder()
        .nonAcademic(nonAcademic)
        .companyAffiliations(companies)
        .build();
  }

  /**
   * Returns the display name: first and last name, or last name and
   * initials when no first name is known.
   */
  public String getDisplayName() {
    StringBuilder sb = new StringBuilder();
    if (firstName != null && !firstName.isEmpty()) {
      sb.append(firstName);
    }
    if (!lastName.isEmpty()) {
      if (sb.length() > 0) {
        sb.append(' ');
      }
      sb.append(lastName);
    }
    if ((firstName == null || firstName.isEmpty())
        && initials != null && !initials.isEmpty()) {
      if (sb.length() > 0) {
        sb.append(' ');
      }
      sb.append(initials);
    }
    return sb.toString();
  }

  public Builder toBuilder() {
    return new Builder()
        .firstName(firstName)
        .lastName(lastName)
        .initials(initials)
        .affiliation(affiliation)
        .email(email)
        .corresponding(corresponding)
        .nonAcademic(nonAcademic)
        .companyAffiliations(companyAffiliations);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Author)) {
      return false;
    }
    Author that = (Author) o;
    return corresponding == that.corresponding
        && nonAcademic == that.nonAcademic
        && Objects.equals(firstName, that.firstName)
        && lastName.equals(that.lastName)
        && Objects.equals(initials, that.initials)
        && Objects.equals(affiliation, that.affiliation)
        && Objects.equals(email, that.email)
        && companyAffiliations.equals(that.companyAffiliations);
  }

  @Override public int hashCode() {
    return Objects.hash(firstName, lastName, initials, affiliation, email,
        corresponding, nonAcademic, companyAffiliations);
  }

  @Override public String toString() {
    return "Author{name='" + getDisplayName() + "'"
        + (nonAcademic ? ", nonAcademic" : "")
        + (companyAffiliations.isEmpty() ? "" : ", companies=" + companyAffiliations)
        + "}";
  }

  /**
   * Builder for Author.
   */
  public static class Builder {
    private @Nullable String firstName;
    private @Nullable String lastName;
    private @Nullable String initials;
    private @Nullable String affiliation;
    private @Nullable String email;
    private boolean corresponding;
    private boolean nonAcademic;
    private @Nullable List<String> companyAffiliations;

    public Builder firstName(@Nullable String firstName) {
      this.firstName = firstName;
      return this;
    }

    public Builder lastName(@Nullable String lastName) {
      this.lastName = lastName;
      return this;
    }

    public Builder initials(@Nullable String initials) {
      this.initials = initials;
      return this;
    }

    public Builder affiliation(@Nullable String affiliation) {
      this.affiliation = affiliation;
      return this;
    }

    public Builder email(@Nullable String email) {
      this.email = email;
      return this;
    }

    public Builder corresponding(boolean corresponding) {
      this.corresponding = corresponding;
      return this;
    }

    public Builder nonAcademic(boolean nonAcademic) {
      this.nonAcademic = nonAcademic;
      return this;
    }

    public Builder companyAffiliations(@Nullable List<String> companyAffiliations) {
      this.companyAffiliations = companyAffiliations;
      return this;
    }

    public Author build() {
      return new Author(this);
    }
  }
}
