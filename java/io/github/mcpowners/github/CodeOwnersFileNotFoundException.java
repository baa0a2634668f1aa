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

package io.github.mcpowners.github;

/** Exception that is thrown if a branch of a repository contains no CODEOWNERS file. */
public class CodeOwnersFileNotFoundException extends Exception {
  private static final long serialVersionUID = 1L;

  public CodeOwnersFileNotFoundException(String owner, String repo, String branch) {
    super(
        String.format(
            "no CODEOWNERS file found in %s/%s on branch %s", owner, repo, branch));
  }
}
