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
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import io.github.mcpowners.util.RepoPath;
import java.util.List;

/**
 * A compiled path pattern of a code owners rule.
 *
 * <p>The syntax follows the CODEOWNERS files on GitHub:
 *
 * <ul>
 *   <li>'*': matches any string that does not include slashes
 *   <li>'?': matches any single character except a slash
 *   <li>'**' (as a whole segment): matches zero or more path segments
 *   <li>'\': escapes the next character
 *   <li>a leading '/' anchors the pattern at the root of its scope, patterns without leading '/'
 *       match at any depth below the scope
 *   <li>a trailing '/' restricts the pattern to directories, it then matches everything beneath
 *       the matching directories
 * </ul>
 *
 * <p>A pattern matches the paths it names and everything beneath the directories it names. So
 * {@code build} and {@code /src/main} match directories with that path and their contents, and a
 * pattern without '/' such as {@code *.go} or {@code test*} matches the basename at any depth,
 * including directories with a matching name and all their contents. The exceptions are patterns
 * whose last segment is a wildcard following an explicit '/' (e.g. {@code docs/*} or {@code /*}):
 * they only match the path itself, so {@code docs/*} matches {@code docs/README.md}, but not {@code
 * docs/api/README.md}.
 *
 * <p>Matching is done on the compiled segments with a table over (pattern segment, path segment),
 * which makes it linear in the product of both lengths and independent of how wildcards could be
 * distributed.
 */
@AutoValue
public abstract class CodeOwnersPattern {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final Splitter SEGMENT_SPLITTER = Splitter.on('/').omitEmptyStrings();

  /** The pattern as it was written in the code owners file. */
  public abstract String expression();

  /** Whether the pattern starts with '/' and hence only matches from the root of its scope. */
  public abstract boolean anchored();

  /** Whether the pattern ends with '/' and hence only matches directories. */
  public abstract boolean directoryOnly();

  /**
   * Whether the pattern also matches everything beneath a directory that it matches. This is the
   * case unless the last segment is a wildcard that follows an explicit '/'.
   */
  public abstract boolean matchesContents();

  /**
   * The compiled segments, including the segments of the scope directory and the implicit leading
   * '**' of unanchored patterns.
   */
  public abstract ImmutableList<PatternSegment> segments();

  /**
   * Compiles a pattern that is scoped to the repository root.
   *
   * @param expression the pattern as it is written in the code owners file
   * @return the compiled pattern
   * @throws InvalidPatternException if the pattern is empty or cannot be compiled
   */
  public static CodeOwnersPattern parse(String expression) throws InvalidPatternException {
    return parse(expression, ImmutableList.of());
  }

  /**
   * Compiles a pattern that is scoped to the given directory.
   *
   * <p>Anchored patterns match from the scope directory, unanchored patterns match at any depth
   * beneath it.
   *
   * @param expression the pattern as it is written in the code owners file
   * @param scope segments of the directory that contains the code owners file which declares the
   *     pattern, empty for the repository root
   * @return the compiled pattern
   * @throws InvalidPatternException if the pattern is empty or cannot be compiled
   */
  public static CodeOwnersPattern parse(String expression, List<String> scope)
      throws InvalidPatternException {
    requireNonNull(expression, "expression");
    requireNonNull(scope, "scope");

    if (expression.isEmpty()) {
      throw new InvalidPatternException(expression, "pattern is empty");
    }

    boolean anchored = expression.startsWith("/");
    boolean directoryOnly = expression.endsWith("/") && !expression.endsWith("\\/");

    ImmutableList.Builder<PatternSegment> segments = ImmutableList.builder();
    scope.forEach(scopeSegment -> segments.add(PatternSegment.literal(scopeSegment)));
    if (!anchored) {
      segments.add(PatternSegment.doubleWildcard());
    }

    boolean hasPathSegment = false;
    int writtenSegments = 0;
    PatternSegment.Kind lastKind = PatternSegment.Kind.LITERAL;
    for (String rawSegment : SEGMENT_SPLITTER.split(expression)) {
      writtenSegments++;
      if (rawSegment.equals(".")) {
        continue;
      }
      if (rawSegment.equals("..")) {
        throw new InvalidPatternException(expression, "pattern must not contain '..'");
      }
      hasPathSegment = true;
      PatternSegment segment =
          rawSegment.equals("**")
              ? PatternSegment.doubleWildcard()
              : PatternSegment.compile(rawSegment);
      segments.add(segment);
      lastKind = segment.kind();
    }
    if (!hasPathSegment) {
      throw new InvalidPatternException(expression, "pattern has no path segments");
    }

    boolean followsSlash = anchored || writtenSegments > 1;
    boolean matchesContents = lastKind == PatternSegment.Kind.LITERAL || !followsSlash;
    CodeOwnersPattern pattern =
        new AutoValue_CodeOwnersPattern(
            expression,
            anchored,
            directoryOnly,
            matchesContents,
            collapseDoubleWildcards(segments.build()));
    logger.atFinest().log("compiled pattern %s", pattern);
    return pattern;
  }

  private static ImmutableList<PatternSegment> collapseDoubleWildcards(
      ImmutableList<PatternSegment> segments) {
    ImmutableList.Builder<PatternSegment> collapsed = ImmutableList.builder();
    PatternSegment previous = null;
    for (PatternSegment segment : segments) {
      if (previous != null
          && previous.kind() == PatternSegment.Kind.DOUBLE_WILDCARD
          && segment.kind() == PatternSegment.Kind.DOUBLE_WILDCARD) {
        continue;
      }
      collapsed.add(segment);
      previous = segment;
    }
    return collapsed.build();
  }

  /**
   * Whether this pattern matches the given path.
   *
   * @param path the normalized repository path, may denote a file or a directory
   * @return {@code true} if the pattern matches the path itself, or (if {@link
   *     #matchesContents()}) a directory that contains the path
   */
  public boolean matches(RepoPath path) {
    requireNonNull(path, "path");
    ImmutableList<String> pathSegments = path.segments();
    boolean[] matchingPrefixes = matchingPrefixLengths(pathSegments);

    if (directoryOnly()) {
      // Only directories can match, these are all proper prefixes of the path and the path itself
      // if it denotes a directory.
      int longestDirectory = path.isDirectory() ? pathSegments.size() : pathSegments.size() - 1;
      return anyMatch(matchingPrefixes, longestDirectory);
    }

    if (matchingPrefixes[pathSegments.size()]) {
      return true;
    }
    return matchesContents() && anyMatch(matchingPrefixes, pathSegments.size() - 1);
  }

  private static boolean anyMatch(boolean[] matchingPrefixes, int maxPrefixLength) {
    for (int length = 1; length <= maxPrefixLength; length++) {
      if (matchingPrefixes[length]) {
        return true;
      }
    }
    return false;
  }

  /**
   * Computes for each prefix length of the path whether the whole pattern matches the prefix.
   *
   * <p>{@code table[i][j]} is {@code true} if the first {@code i} pattern segments match the first
   * {@code j} path segments. A trailing '**' must match at least one segment, so that {@code
   * docs/**} matches the contents of {@code docs}, but not {@code docs} itself.
   */
  private boolean[] matchingPrefixLengths(List<String> pathSegments) {
    ImmutableList<PatternSegment> segments = segments();
    int patternLength = segments.size();
    int pathLength = pathSegments.size();
    checkState(patternLength > 0, "pattern %s has no segments", expression());

    boolean[][] table = new boolean[patternLength + 1][pathLength + 1];
    table[0][0] = true;
    for (int i = 1; i <= patternLength; i++) {
      PatternSegment segment = segments.get(i - 1);
      boolean trailing = i == patternLength;
      for (int j = 0; j <= pathLength; j++) {
        if (segment.kind() == PatternSegment.Kind.DOUBLE_WILDCARD) {
          boolean matchesMore = j > 0 && table[i][j - 1];
          boolean matchesNone = table[i - 1][j];
          boolean matchesOne = j > 0 && table[i - 1][j - 1];
          table[i][j] = matchesMore || (trailing ? matchesOne : matchesNone);
        } else {
          table[i][j] = j > 0 && table[i - 1][j - 1] && segment.matches(pathSegments.get(j - 1));
        }
      }
    }
    return table[patternLength];
  }

  @Override
  public final String toString() {
    return expression();
  }
}
