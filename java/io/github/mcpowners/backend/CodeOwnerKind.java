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

/** Kind of a code owner reference, describing how the owner is identified. */
public enum CodeOwnerKind {
  /** A single user, referenced by '@login' or by email. */
  INDIVIDUAL,

  /** A team of an organization, referenced by '@org/team'. Teams expand to their members. */
  TEAM;
}
