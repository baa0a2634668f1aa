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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import io.github.mcpowners.config.McpOwnersConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Class to expand {@link CodeOwnerReference}s to the individuals that they denote.
 *
 * <p>Individuals expand to themselves. Teams expand to the union of the expansions of their direct
 * members, which are looked up via the {@link TeamMembershipBackend}. Nested teams are expanded
 * recursively.
 *
 * <p>Expanding a code owner fails (and the code owner contributes no individuals) if:
 *
 * <ul>
 *   <li>a team transitively contains itself ({@link MembershipCycleException})
 *   <li>teams are nested deeper than the configured maximum depth ({@link
 *       MembershipDepthExceededException})
 *   <li>the members of a team cannot be looked up ({@link MembershipLookupFailedException})
 * </ul>
 *
 * <p>An instance is meant to be used for a single resolution call. Within its lifetime each team
 * is looked up at most once, also while the lookup is still in flight, and the expansion of each
 * code owner is computed at most once. Nothing is shared between instances.
 *
 * <p>This class is thread-safe.
 */
public class TeamMembershipResolver {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Creates {@link TeamMembershipResolver}s that share the backend and the maximum depth. */
  public static class Factory {
    private final TeamMembershipBackend teamMembershipBackend;
    private final int maxDepth;

    @Inject
    Factory(TeamMembershipBackend teamMembershipBackend, McpOwnersConfig config) {
      this(teamMembershipBackend, config.getMaxTeamDepth());
    }

    @VisibleForTesting
    public Factory(TeamMembershipBackend teamMembershipBackend, int maxDepth) {
      checkArgument(maxDepth > 0, "maxDepth must be positive: %s", maxDepth);
      this.teamMembershipBackend = requireNonNull(teamMembershipBackend, "teamMembershipBackend");
      this.maxDepth = maxDepth;
    }

    public TeamMembershipResolver create() {
      return new TeamMembershipResolver(teamMembershipBackend, maxDepth);
    }
  }

  private final TeamMembershipBackend teamMembershipBackend;
  private final int maxDepth;
  private final Counters counters = new Counters();
  private final ConcurrentMap<
          CodeOwnerReference, CompletableFuture<ImmutableSet<CodeOwnerReference>>>
      lookups = new ConcurrentHashMap<>();
  private final ConcurrentMap<CodeOwnerReference, CompletableFuture<OwnerExpansion>> expansions =
      new ConcurrentHashMap<>();

  private TeamMembershipResolver(TeamMembershipBackend teamMembershipBackend, int maxDepth) {
    this.teamMembershipBackend = teamMembershipBackend;
    this.maxDepth = maxDepth;
  }

  /**
   * Expands the given code owner to individuals.
   *
   * <p>The returned future never fails because of membership problems, those are reported by
   * {@link OwnerExpansion#diagnostic()}. It only fails if the resolution was cancelled (see {@link
   * #cancel()}).
   *
   * @param owner the code owner that should be expanded
   * @return future providing the expansion of the code owner
   */
  public CompletableFuture<OwnerExpansion> resolve(CodeOwnerReference owner) {
    requireNonNull(owner, "owner");
    if (!owner.isTeam()) {
      return CompletableFuture.completedFuture(
          OwnerExpansion.resolved(owner, ImmutableSortedSet.of(owner.identity())));
    }

    CompletableFuture<OwnerExpansion> expansion = new CompletableFuture<>();
    CompletableFuture<OwnerExpansion> existingExpansion = expansions.putIfAbsent(owner, expansion);
    if (existingExpansion != null) {
      return existingExpansion;
    }

    expand(owner, ImmutableList.of())
        .whenComplete(
            (individuals, error) -> {
              if (error == null) {
                logger.atFine().log("%s expands to %s", owner, individuals);
                expansion.complete(OwnerExpansion.resolved(owner, individuals));
                return;
              }
              Throwable cause = unwrap(error);
              if (cause instanceof MembershipResolutionException) {
                Diagnostic diagnostic =
                    ((MembershipResolutionException) cause).toDiagnostic(owner);
                logger.atFine().log("%s", diagnostic.message());
                expansion.complete(OwnerExpansion.failed(owner, diagnostic));
              } else {
                expansion.completeExceptionally(cause);
              }
            });
    return expansion;
  }

  /**
   * Expands a team recursively.
   *
   * @param team the team that should be expanded
   * @param expansionPath the teams through which this team was reached, empty for the team that was
   *     referenced as code owner
   */
  private CompletableFuture<ImmutableSortedSet<String>> expand(
      CodeOwnerReference team, ImmutableList<CodeOwnerReference> expansionPath) {
    if (expansionPath.contains(team)) {
      List<CodeOwnerReference> cycle =
          new ArrayList<>(expansionPath.subList(expansionPath.indexOf(team), expansionPath.size()));
      cycle.add(team);
      return CompletableFuture.failedFuture(new MembershipCycleException(cycle));
    }
    if (expansionPath.size() >= maxDepth) {
      return CompletableFuture.failedFuture(new MembershipDepthExceededException(team, maxDepth));
    }

    ImmutableList<CodeOwnerReference> memberPath =
        ImmutableList.<CodeOwnerReference>builder().addAll(expansionPath).add(team).build();
    return lookup(team)
        .thenCompose(
            members -> {
              List<CompletableFuture<ImmutableSortedSet<String>>> memberExpansions =
                  new ArrayList<>();
              for (CodeOwnerReference member : members) {
                memberExpansions.add(
                    member.isTeam()
                        ? expand(member, memberPath)
                        : CompletableFuture.completedFuture(
                            ImmutableSortedSet.of(member.identity())));
              }
              return CompletableFuture.allOf(
                      memberExpansions.toArray(new CompletableFuture<?>[0]))
                  .thenApply(
                      unused -> {
                        ImmutableSortedSet.Builder<String> individuals =
                            ImmutableSortedSet.naturalOrder();
                        memberExpansions.forEach(f -> individuals.addAll(f.join()));
                        return individuals.build();
                      });
            });
  }

  /** Looks up the direct members of a team, at most once per team. */
  private CompletableFuture<ImmutableSet<CodeOwnerReference>> lookup(CodeOwnerReference team) {
    CompletableFuture<ImmutableSet<CodeOwnerReference>> lookup = new CompletableFuture<>();
    CompletableFuture<ImmutableSet<CodeOwnerReference>> existingLookup =
        lookups.putIfAbsent(team, lookup);
    if (existingLookup != null) {
      counters.incrementCacheReads();
      return existingLookup;
    }

    counters.incrementLookups();
    logger.atFine().log("looking up members of %s", team);
    CompletableFuture<ImmutableSet<CodeOwnerReference>> backendLookup;
    try {
      backendLookup = teamMembershipBackend.getDirectMembers(team);
    } catch (RuntimeException e) {
      backendLookup = CompletableFuture.failedFuture(e);
    }

    CompletableFuture<ImmutableSet<CodeOwnerReference>> pendingBackendLookup = backendLookup;
    lookup.whenComplete(
        (members, error) -> {
          if (lookup.isCancelled()) {
            pendingBackendLookup.cancel(true);
          }
        });
    backendLookup.whenComplete(
        (members, error) -> {
          if (error == null) {
            lookup.complete(members);
            return;
          }
          Throwable cause = unwrap(error);
          if (cause instanceof CancellationException) {
            lookup.completeExceptionally(cause);
          } else {
            logger.atWarning().withCause(cause).log("failed to look up members of %s", team);
            lookup.completeExceptionally(new MembershipLookupFailedException(team, cause));
          }
        });
    return lookup;
  }

  /**
   * Cancels all lookups that are still in flight.
   *
   * <p>Pending expansions fail with a {@link CancellationException}.
   */
  public void cancel() {
    logger.atFine().log("cancelling %d lookups", lookups.size());
    lookups.values().forEach(lookup -> lookup.cancel(true));
  }

  public Counters getCounters() {
    return counters;
  }

  private static Throwable unwrap(Throwable throwable) {
    Throwable cause = throwable;
    while ((cause instanceof CompletionException || cause instanceof ExecutionException)
        && cause.getCause() != null) {
      cause = cause.getCause();
    }
    return cause;
  }

  /** Counts the membership lookups of a {@link TeamMembershipResolver}. */
  public static class Counters {
    private final AtomicInteger lookupCount = new AtomicInteger();
    private final AtomicInteger cacheReadCount = new AtomicInteger();

    private void incrementLookups() {
      lookupCount.incrementAndGet();
    }

    private void incrementCacheReads() {
      cacheReadCount.incrementAndGet();
    }

    /** Number of lookups that were sent to the {@link TeamMembershipBackend}. */
    public int getLookupCount() {
      return lookupCount.get();
    }

    /** Number of lookups that were answered from the lookups of this resolver. */
    public int getCacheReadCount() {
      return cacheReadCount.get();
    }
  }
}
