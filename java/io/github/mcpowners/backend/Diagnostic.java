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

import com.google.auto.value.AutoValue;

/**
 * A problem that was found while parsing a code owners file or while resolving the code owners of
 * a path.
 *
 * <p>Diagnostics never abort the whole operation, they are scoped to one line, one owner or one
 * path and are returned next to the best-effort result.
 */
@AutoValue
public abstract class Diagnostic {
  /** Kind of problem. */
  public enum Kind {
    /** A line of a code owners file could not be parsed (fully). */
    MALFORMED_DECLARATION,

    /** A team transitively contains itself. */
    MEMBERSHIP_CYCLE,

    /** Teams are nested deeper than the configured maximum depth. */
    MEMBERSHIP_DEPTH_EXCEEDED,

    /** The members of a team could not be looked up. */
    MEMBERSHIP_LOOKUP_FAILED,

    /** A queried path could not be normalized. */
    INVALID_PATH;
  }

  public abstract Kind kind();

  public abstract String message();

  public static Diagnostic create(Kind kind, String message) {
    return new AutoValue_Diagnostic(
        requireNonNull(kind, "kind"), requireNonNull(message, "message"));
  }

  public static Diagnostic malformedDeclaration(String sourcePath, int lineNumber, String message) {
    return create(
        Kind.MALFORMED_DECLARATION, String.format("%s:%d: %s", sourcePath, lineNumber, message));
  }
}
