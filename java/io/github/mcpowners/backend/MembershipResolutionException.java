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

/**
 * Exception that is thrown if a team that is referenced as code owner cannot be expanded to its
 * members.
 *
 * <p>These exceptions never abort a resolution. They are converted into a {@link Diagnostic} and
 * the failing code owner contributes no individuals.
 */
public abstract class MembershipResolutionException extends Exception {
  private static final long serialVersionUID = 1L;

  MembershipResolutionException(String message) {
    super(message);
  }

  MembershipResolutionException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Returns the kind of diagnostic that this exception is reported as. */
  public abstract Diagnostic.Kind getDiagnosticKind();

  /** Converts this exception into a diagnostic for the given code owner. */
  public Diagnostic toDiagnostic(CodeOwnerReference owner) {
    return Diagnostic.create(
        getDiagnosticKind(), String.format("cannot resolve %s: %s", owner, getMessage()));
  }
}
