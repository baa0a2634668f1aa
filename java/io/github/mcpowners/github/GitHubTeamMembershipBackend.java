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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import io.github.mcpowners.backend.CodeOwnerReference;
import io.github.mcpowners.backend.TeamMembershipBackend;
import io.github.mcpowners.backend.TeamNotFoundException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * {@link TeamMembershipBackend} that looks up team members via the GitHub API.
 *
 * <p>The direct members of a team are the users that are listed as team members and the child
 * teams of the team. Users are returned as {@code @login} individuals, child teams as {@code
 * @org/slug} teams.
 */
@Singleton
public class GitHubTeamMembershipBackend implements TeamMembershipBackend {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final GitHubClient gitHubClient;

  @Inject
  GitHubTeamMembershipBackend(GitHubClient gitHubClient) {
    this.gitHubClient = gitHubClient;
  }

  @Override
  public CompletableFuture<ImmutableSet<CodeOwnerReference>> getDirectMembers(
      CodeOwnerReference team) {
    requireNonNull(team, "team");
    checkArgument(team.isTeam(), "%s is not a team", team);

    String org = team.organization();
    String teamSlug = team.teamSlug();
    CompletableFuture<ImmutableList<JsonNode>> users = gitHubClient.listTeamMembers(org, teamSlug);
    CompletableFuture<ImmutableList<JsonNode>> childTeams =
        gitHubClient.listChildTeams(org, teamSlug);

    CompletableFuture<ImmutableSet<CodeOwnerReference>> members =
        users
            .thenCombine(childTeams, (u, t) -> toMembers(org, u, t))
            .handle(
                (result, error) -> {
                  if (error == null) {
                    logger.atFine().log("direct members of %s: %s", team, result);
                    return result;
                  }
                  throw new CompletionException(mapError(team, error));
                });
    // Stops the other listing if one listing failed or the lookup was cancelled.
    members.whenComplete(
        (result, error) -> {
          if (error != null) {
            users.cancel(true);
            childTeams.cancel(true);
          }
        });
    return members;
  }

  private static ImmutableSet<CodeOwnerReference> toMembers(
      String org, ImmutableList<JsonNode> users, ImmutableList<JsonNode> childTeams) {
    ImmutableSet.Builder<CodeOwnerReference> members = ImmutableSet.builder();
    for (JsonNode user : users) {
      String login = user.path("login").asText("");
      if (login.isEmpty()) {
        logger.atWarning().log("ignoring team member without login: %s", user);
        continue;
      }
      members.add(CodeOwnerReference.individual("@" + login));
    }
    for (JsonNode childTeam : childTeams) {
      String slug = childTeam.path("slug").asText("");
      if (slug.isEmpty()) {
        logger.atWarning().log("ignoring child team without slug: %s", childTeam);
        continue;
      }
      members.add(CodeOwnerReference.team(String.format("@%s/%s", org, slug)));
    }
    return members.build();
  }

  private static Throwable mapError(CodeOwnerReference team, Throwable error) {
    Throwable cause = error instanceof CompletionException ? error.getCause() : error;
    if (cause instanceof GitHubApiException && ((GitHubApiException) cause).isNotFound()) {
      return new TeamNotFoundException(team.identity());
    }
    return cause;
  }
}
