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

import static java.util.Objects.requireNonNull;

import java.util.Arrays;
import java.util.Objects;

/**
 * One compiled segment of a {@link CodeOwnersPattern}.
 *
 * <p>A segment matches exactly one path segment, except for {@link Kind#DOUBLE_WILDCARD} segments
 * which match any number of path segments.
 */
public final class PatternSegment {
  /** Kind of a pattern segment. */
  public enum Kind {
    /** A plain name that must be equal to the path segment. */
    LITERAL,

    /** A name containing '*' or '?' wildcards, which never match '/'. */
    WILDCARD,

    /** A '**' segment, matching zero or more path segments. */
    DOUBLE_WILDCARD;
  }

  private static final int ANY_CHAR = -1;
  private static final int ANY_STRING = -2;

  private static final PatternSegment DOUBLE_WILDCARD_SEGMENT =
      new PatternSegment(Kind.DOUBLE_WILDCARD, "**", new int[0]);

  private final Kind kind;
  private final String text;

  // Compiled form of WILDCARD segments: chars, ANY_CHAR or ANY_STRING.
  private final int[] tokens;

  /** Returns the '**' segment. */
  public static PatternSegment doubleWildcard() {
    return DOUBLE_WILDCARD_SEGMENT;
  }

  /**
   * Creates a segment that only matches the given name.
   *
   * @param name the unescaped name, must not contain '/'
   */
  public static PatternSegment literal(String name) {
    requireNonNull(name, "name");
    return new PatternSegment(Kind.LITERAL, name, new int[0]);
  }

  /**
   * Compiles a single glob segment.
   *
   * <p>'\' escapes the following character, '*' matches any string without '/', '?' matches any
   * single character except '/'. Consecutive '*' are collapsed.
   *
   * @param glob the glob segment as written in the code owners file, without '/'
   * @return a {@link Kind#LITERAL} segment if the glob contains no unescaped wildcard, otherwise a
   *     {@link Kind#WILDCARD} segment
   * @throws InvalidPatternException if the glob ends with a dangling escape character
   */
  static PatternSegment compile(String glob) throws InvalidPatternException {
    requireNonNull(glob, "glob");

    int[] tokens = new int[glob.length()];
    int tokenCount = 0;
    boolean hasWildcard = false;
    StringBuilder literal = new StringBuilder();
    for (int i = 0; i < glob.length(); i++) {
      char c = glob.charAt(i);
      if (c == '\\') {
        if (i + 1 >= glob.length()) {
          throw new InvalidPatternException(glob, "dangling escape character");
        }
        char escaped = glob.charAt(++i);
        tokens[tokenCount++] = escaped;
        literal.append(escaped);
      } else if (c == '*') {
        hasWildcard = true;
        if (tokenCount == 0 || tokens[tokenCount - 1] != ANY_STRING) {
          tokens[tokenCount++] = ANY_STRING;
        }
      } else if (c == '?') {
        hasWildcard = true;
        tokens[tokenCount++] = ANY_CHAR;
      } else {
        tokens[tokenCount++] = c;
        literal.append(c);
      }
    }

    if (!hasWildcard) {
      return literal(literal.toString());
    }
    int[] compiled = Arrays.copyOf(tokens, tokenCount);
    return new PatternSegment(Kind.WILDCARD, canonicalGlob(compiled), compiled);
  }

  private PatternSegment(Kind kind, String text, int[] tokens) {
    this.kind = kind;
    this.text = text;
    this.tokens = tokens;
  }

  public Kind kind() {
    return kind;
  }

  /** Returns the name for literal segments, the canonical glob otherwise. */
  public String text() {
    return text;
  }

  /**
   * Whether this segment matches the given path segment.
   *
   * <p>Must not be called for {@link Kind#DOUBLE_WILDCARD} segments, which match across segments
   * and are handled by {@link CodeOwnersPattern}.
   */
  boolean matches(String pathSegment) {
    switch (kind) {
      case LITERAL:
        return text.equals(pathSegment);
      case WILDCARD:
        return matchesTokens(pathSegment);
      case DOUBLE_WILDCARD:
        throw new IllegalStateException("'**' does not match single segments");
    }
    throw new IllegalStateException("unknown kind: " + kind);
  }

  /**
   * Single pass matching with one backtrack point. On a mismatch after a '*' the '*' absorbs one
   * more character, so each position is retried at most once per '*'.
   */
  private boolean matchesTokens(String name) {
    int t = 0;
    int n = 0;
    int starToken = -1;
    int starName = 0;
    while (n < name.length()) {
      if (t < tokens.length
          && tokens[t] != ANY_STRING
          && (tokens[t] == ANY_CHAR || tokens[t] == name.charAt(n))) {
        t++;
        n++;
      } else if (t < tokens.length && tokens[t] == ANY_STRING) {
        starToken = t++;
        starName = n;
      } else if (starToken >= 0) {
        t = starToken + 1;
        n = ++starName;
      } else {
        return false;
      }
    }
    while (t < tokens.length && tokens[t] == ANY_STRING) {
      t++;
    }
    return t == tokens.length;
  }

  private static String canonicalGlob(int[] tokens) {
    StringBuilder sb = new StringBuilder();
    for (int token : tokens) {
      if (token == ANY_STRING) {
        sb.append('*');
      } else if (token == ANY_CHAR) {
        sb.append('?');
      } else {
        char c = (char) token;
        if (c == '*' || c == '?' || c == '\\') {
          sb.append('\\');
        }
        sb.append(c);
      }
    }
    return sb.toString();
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof PatternSegment)) {
      return false;
    }
    PatternSegment other = (PatternSegment) o;
    return kind == other.kind && text.equals(other.text);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, text);
  }

  @Override
  public String toString() {
    return kind + "(" + text + ")";
  }
}
