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

/** Exception that is thrown if teams are nested deeper than allowed. */
public class MembershipDepthExceededException extends MembershipResolutionException {
  private static final long serialVersionUID = 1L;

  public MembershipDepthExceededException(CodeOwnerReference team, int maxDepth) {
    super(
        String.format(
            "team %s is nested deeper than the maximum depth of %d", team.identity(), maxDepth));
  }

  @Override
  public Diagnostic.Kind getDiagnosticKind() {
    return Diagnostic.Kind.MEMBERSHIP_DEPTH_EXCEEDED;
  }
}
