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

package io.github.mcpowners.testing;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ConcurrentHashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Multiset;
import io.github.mcpowners.backend.CodeOwnerReference;
import io.github.mcpowners.backend.TeamMembershipBackend;
import io.github.mcpowners.backend.TeamNotFoundException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;

/**
 * In-memory {@link TeamMembershipBackend} for tests.
 *
 * <p>Teams that were not added fail with {@link TeamNotFoundException}. Blocked teams return
 * lookups that never complete, unless they are cancelled.
 */
public class FakeTeamMembershipBackend implements TeamMembershipBackend {
  private final Map<CodeOwnerReference, ImmutableSet<CodeOwnerReference>> members =
      new ConcurrentHashMap<>();
  private final Map<CodeOwnerReference, RuntimeException> failures = new ConcurrentHashMap<>();
  private final Multiset<CodeOwnerReference> blockedTeams = ConcurrentHashMultiset.create();
  private final Multiset<CodeOwnerReference> lookups = ConcurrentHashMultiset.create();
  private final List<CompletableFuture<ImmutableSet<CodeOwnerReference>>> pendingLookups =
      new CopyOnWriteArrayList<>();
  private Optional<Executor> executor = Optional.empty();

  /**
   * Adds a team.
   *
   * @param team the team, e.g. {@code @org/team}
   * @param directMembers logins, emails or teams that are direct members of the team
   */
  public FakeTeamMembershipBackend addTeam(String team, String... directMembers) {
    ImmutableSet.Builder<CodeOwnerReference> memberReferences = ImmutableSet.builder();
    for (String member : directMembers) {
      memberReferences.add(
          CodeOwnerReference.parse(member)
              .orElseThrow(() -> new IllegalArgumentException("invalid member: " + member)));
    }
    members.put(CodeOwnerReference.team(team), memberReferences.build());
    return this;
  }

  /** Lets lookups of the team fail with the given exception. */
  public FakeTeamMembershipBackend failTeam(String team, RuntimeException exception) {
    failures.put(CodeOwnerReference.team(team), requireNonNull(exception, "exception"));
    return this;
  }

  /** Lets lookups of the team never complete. */
  public FakeTeamMembershipBackend blockTeam(String team) {
    blockedTeams.add(CodeOwnerReference.team(team));
    return this;
  }

  /** Completes successful lookups on the given executor instead of the calling thread. */
  public FakeTeamMembershipBackend completeAsync(Executor executor) {
    this.executor = Optional.of(executor);
    return this;
  }

  @Override
  public CompletableFuture<ImmutableSet<CodeOwnerReference>> getDirectMembers(
      CodeOwnerReference team) {
    lookups.add(team);
    if (blockedTeams.contains(team)) {
      CompletableFuture<ImmutableSet<CodeOwnerReference>> pendingLookup = new CompletableFuture<>();
      pendingLookups.add(pendingLookup);
      return pendingLookup;
    }
    RuntimeException failure = failures.get(team);
    if (failure != null) {
      throw failure;
    }
    ImmutableSet<CodeOwnerReference> directMembers = members.get(team);
    if (directMembers == null) {
      return CompletableFuture.failedFuture(new TeamNotFoundException(team.identity()));
    }
    if (executor.isPresent()) {
      return CompletableFuture.supplyAsync(() -> directMembers, executor.get());
    }
    return CompletableFuture.completedFuture(directMembers);
  }

  /** Returns how often the members of the team were looked up. */
  public int getLookupCount(String team) {
    return lookups.count(CodeOwnerReference.team(team));
  }

  /** Returns the lookups of blocked teams. */
  public ImmutableList<CompletableFuture<ImmutableSet<CodeOwnerReference>>> getPendingLookups() {
    return ImmutableList.copyOf(pendingLookups);
  }
}
