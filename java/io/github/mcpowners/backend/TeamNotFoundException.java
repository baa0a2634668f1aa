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

/** Exception that is thrown if a team that is referenced as code owner doesn't exist. */
public class TeamNotFoundException extends Exception {
  private static final long serialVersionUID = 1L;

  public TeamNotFoundException(String team) {
    super(String.format("team %s not found", team));
  }
}
