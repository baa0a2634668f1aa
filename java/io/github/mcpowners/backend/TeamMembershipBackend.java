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

import com.google.common.collect.ImmutableSet;
import java.util.concurrent.CompletableFuture;

/**
 * Backend to look up the members of teams.
 *
 * <p>Lookups are asynchronous since they usually require a network call. Implementations should
 * abort the lookup if the returned future is cancelled.
 */
public interface TeamMembershipBackend {
  /**
   * Looks up the direct members of a team.
   *
   * @param team reference to the team, {@link CodeOwnerReference#isTeam()} is {@code true}
   * @return future that provides the direct members of the team: individuals and nested teams
   *     (which are not expanded); the future fails with a {@link TeamNotFoundException} if the
   *     team doesn't exist, or with any other exception if the lookup failed
   */
  CompletableFuture<ImmutableSet<CodeOwnerReference>> getDirectMembers(CodeOwnerReference team);
}
