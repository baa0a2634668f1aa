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

import static com.google.common.collect.ImmutableMap.toImmutableMap;
import static java.util.Objects.requireNonNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import io.github.mcpowners.config.McpOwnersConfig;
import io.github.mcpowners.util.InvalidRepoPathException;
import io.github.mcpowners.util.RepoPath;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Class to resolve the code owners of paths from a {@link CodeOwnersRuleSet}.
 *
 * <p>The code owners of a path are defined by the last rule whose pattern matches the path (last
 * match wins). If no rule matches, the path has no code owners. If the winning rule has no owners,
 * the path is explicitly unowned, which only differs from the former case in the reported winning
 * rule.
 *
 * <p>The owners of the winning rule are expanded to individuals by a {@link
 * TeamMembershipResolver}. All paths of one call share the same {@link TeamMembershipResolver}, so
 * that each team is looked up at most once per call. Lookups of different teams run concurrently.
 *
 * <p>Problems never fail the whole call, they are reported as {@link Diagnostic}s of the path for
 * which they occurred.
 */
@Singleton
public class CodeOwnersResolver {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final TeamMembershipResolver.Factory teamMembershipResolverFactory;
  private final Duration requestTimeout;

  @Inject
  CodeOwnersResolver(
      TeamMembershipResolver.Factory teamMembershipResolverFactory, McpOwnersConfig config) {
    this(teamMembershipResolverFactory, config.getRequestTimeout());
  }

  @VisibleForTesting
  public CodeOwnersResolver(
      TeamMembershipResolver.Factory teamMembershipResolverFactory, Duration requestTimeout) {
    this.teamMembershipResolverFactory =
        requireNonNull(teamMembershipResolverFactory, "teamMembershipResolverFactory");
    this.requestTimeout = requireNonNull(requestTimeout, "requestTimeout");
  }

  /**
   * Resolves the code owners of a single path.
   *
   * @see #resolveOwners(CodeOwnersRuleSet, List)
   */
  public ResolvedOwnership resolveOwners(CodeOwnersRuleSet ruleSet, String path)
      throws InterruptedException, TimeoutException {
    requireNonNull(path, "path");
    return resolveOwners(ruleSet, ImmutableList.of(path)).get(path);
  }

  /**
   * Resolves the code owners of the given paths and waits for the result.
   *
   * <p>If the result is not available within the configured request timeout, all pending team
   * lookups are cancelled and no result is returned.
   *
   * @param ruleSet the rules from which the code owners should be resolved
   * @param paths the paths for which the code owners should be resolved
   * @return the resolved code owners by path, in the order of the given paths (duplicate paths are
   *     only contained once)
   * @throws TimeoutException if resolving the code owners took longer than the request timeout
   * @throws InterruptedException if the calling thread was interrupted while waiting
   */
  public ImmutableMap<String, ResolvedOwnership> resolveOwners(
      CodeOwnersRuleSet ruleSet, List<String> paths)
      throws InterruptedException, TimeoutException {
    CompletableFuture<ImmutableMap<String, ResolvedOwnership>> result =
        resolveOwnersAsync(ruleSet, paths);
    try {
      return result.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      logger.atWarning().log(
          "resolving code owners of %d paths timed out after %s", paths.size(), requestTimeout);
      result.cancel(true);
      throw e;
    } catch (InterruptedException e) {
      result.cancel(true);
      throw e;
    } catch (ExecutionException e) {
      throw CodeOwnersInternalServerErrorException.newInternalServerError(
          "failed to resolve code owners", e);
    }
  }

  /**
   * Resolves the code owners of the given paths asynchronously.
   *
   * <p>Cancelling the returned future cancels all team lookups that are still in flight.
   *
   * @param ruleSet the rules from which the code owners should be resolved
   * @param paths the paths for which the code owners should be resolved
   * @return future providing the resolved code owners by path, in the order of the given paths
   *     (duplicate paths are only contained once)
   */
  public CompletableFuture<ImmutableMap<String, ResolvedOwnership>> resolveOwnersAsync(
      CodeOwnersRuleSet ruleSet, List<String> paths) {
    requireNonNull(ruleSet, "ruleSet");
    requireNonNull(paths, "paths");

    TeamMembershipResolver teamMembershipResolver = teamMembershipResolverFactory.create();
    List<CompletableFuture<ResolvedOwnership>> resolvedPaths = new ArrayList<>();
    for (String path : ImmutableSet.copyOf(paths)) {
      resolvedPaths.add(resolvePath(ruleSet, path, teamMembershipResolver));
    }

    CompletableFuture<ImmutableMap<String, ResolvedOwnership>> result =
        CompletableFuture.allOf(resolvedPaths.toArray(new CompletableFuture<?>[0]))
            .thenApply(
                unused ->
                    resolvedPaths.stream()
                        .map(CompletableFuture::join)
                        .collect(toImmutableMap(ResolvedOwnership::path, r -> r)));
    result.whenComplete(
        (resolvedOwnerships, error) -> {
          if (result.isCancelled()) {
            teamMembershipResolver.cancel();
            return;
          }
          TeamMembershipResolver.Counters counters = teamMembershipResolver.getCounters();
          logger.atFine().log(
              "resolved code owners of %d paths (team lookups = %d, cached team lookups = %d)",
              resolvedPaths.size(), counters.getLookupCount(), counters.getCacheReadCount());
        });
    return result;
  }

  private CompletableFuture<ResolvedOwnership> resolvePath(
      CodeOwnersRuleSet ruleSet, String path, TeamMembershipResolver teamMembershipResolver) {
    RepoPath repoPath;
    try {
      repoPath = RepoPath.parse(path);
    } catch (InvalidRepoPathException e) {
      logger.atFine().log("%s", e.getMessage());
      return CompletableFuture.completedFuture(
          ResolvedOwnership.createInvalidPath(path, e.getMessage()));
    }

    Optional<CodeOwnersRule> winningRule = ruleSet.findWinningRule(repoPath);
    if (!winningRule.isPresent()) {
      logger.atFine().log("no rule matches %s", repoPath);
      return CompletableFuture.completedFuture(ResolvedOwnership.createUnowned(path));
    }

    CodeOwnersRule rule = winningRule.get();
    logger.atFine().log(
        "rule %d (%s:%d, pattern = %s) wins for %s",
        rule.index(), rule.sourcePath(), rule.lineNumber(), rule.pattern(), repoPath);

    List<CompletableFuture<OwnerExpansion>> expansions = new ArrayList<>();
    for (CodeOwnerReference owner : ImmutableSet.copyOf(rule.owners())) {
      expansions.add(teamMembershipResolver.resolve(owner));
    }
    return CompletableFuture.allOf(expansions.toArray(new CompletableFuture<?>[0]))
        .thenApply(
            unused -> {
              ImmutableSortedSet.Builder<String> individuals = ImmutableSortedSet.naturalOrder();
              ImmutableList.Builder<Diagnostic> diagnostics = ImmutableList.builder();
              for (CompletableFuture<OwnerExpansion> expansion : expansions) {
                OwnerExpansion ownerExpansion = expansion.join();
                individuals.addAll(ownerExpansion.individuals());
                ownerExpansion.diagnostic().ifPresent(diagnostics::add);
              }
              return ResolvedOwnership.create(
                  path, individuals.build(), rule.owners(), winningRule, diagnostics.build());
            });
  }
}
