// Copyright (C) 2026 The mcp-github-owners Authors
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package io.github.mcpowners.backend;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.auto.value.AutoValue;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A reference that defines a code owner in a code owners file.
 *
 * <p>Code owners are either individuals, referenced by GitHub login ({@code @alice}) or by email
 * ({@code alice@example.com}), or teams, referenced by organization and team slug ({@code
 * @org/team}).
 */
@AutoValue
public abstract class CodeOwnerReference implements Comparable<CodeOwnerReference> {
  private static final Pattern PAT_LOGIN = Pattern.compile("@([A-Za-z0-9](?:[A-Za-z0-9-]*))");
  private static final Pattern PAT_TEAM =
      Pattern.compile("@([A-Za-z0-9](?:[A-Za-z0-9-]*))/([A-Za-z0-9_.-]+)");
  private static final Pattern PAT_EMAIL =
      Pattern.compile("[^\\s<>@,#]+@[^\\s<>@#,]+\\.[^\\s<>@#,]+");

  /** Gets the kind of the code owner. */
  public abstract CodeOwnerKind kind();

  /**
   * Gets the identity of the code owner as written in the code owners file, e.g. {@code @alice},
   * {@code alice@example.com} or {@code @org/team}.
   */
  public abstract String identity();

  /** Whether this reference denotes a team. */
  public boolean isTeam() {
    return kind() == CodeOwnerKind.TEAM;
  }

  /** Returns the organization of a team reference. Fails for individuals. */
  public String organization() {
    return teamMatcher().group(1);
  }

  /** Returns the team slug of a team reference. Fails for individuals. */
  public String teamSlug() {
    return teamMatcher().group(2);
  }

  private Matcher teamMatcher() {
    checkState(isTeam(), "%s is not a team", identity());
    Matcher matcher = PAT_TEAM.matcher(identity());
    checkState(matcher.matches(), "invalid team identity: %s", identity());
    return matcher;
  }

  @Override
  public int compareTo(CodeOwnerReference other) {
    int result = identity().compareTo(other.identity());
    return result != 0 ? result : kind().compareTo(other.kind());
  }

  @Override
  public final String toString() {
    return identity();
  }

  /**
   * Classifies an owner token from a code owners file.
   *
   * @param token the owner token
   * @return the code owner reference, {@link Optional#empty()} if the token is neither a login, a
   *     team nor an email
   */
  public static Optional<CodeOwnerReference> parse(String token) {
    requireNonNull(token, "token");
    if (PAT_TEAM.matcher(token).matches()) {
      return Optional.of(team(token));
    }
    if (PAT_LOGIN.matcher(token).matches() || PAT_EMAIL.matcher(token).matches()) {
      return Optional.of(individual(token));
    }
    return Optional.empty();
  }

  /**
   * Creates a reference to an individual.
   *
   * @param identity the login (including the leading '@') or email of the individual
   */
  public static CodeOwnerReference individual(String identity) {
    return new AutoValue_CodeOwnerReference(
        CodeOwnerKind.INDIVIDUAL, requireNonNull(identity, "identity"));
  }

  /**
   * Creates a reference to a team.
   *
   * @param identity the team in the form {@code @org/team}
   */
  public static CodeOwnerReference team(String identity) {
    return new AutoValue_CodeOwnerReference(
        CodeOwnerKind.TEAM, requireNonNull(identity, "identity"));
  }
}
