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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.github.mcpowners.testing.FakeTeamMembershipBackend;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.After;
import org.junit.Test;

/** Tests for {@link TeamMembershipResolver}. */
public class TeamMembershipResolverTest {
  private static final int MAX_DEPTH = 3;

  private final FakeTeamMembershipBackend backend = new FakeTeamMembershipBackend();
  private final List<ExecutorService> executors = new ArrayList<>();

  @After
  public void shutDownExecutors() {
    executors.forEach(ExecutorService::shutdownNow);
  }

  @Test
  public void individualExpandsToItself() throws Exception {
    OwnerExpansion expansion = resolve("@alice");
    assertThat(expansion.individuals()).containsExactly("@alice");
    assertThat(expansion.diagnostic()).isEmpty();
  }

  @Test
  public void emailExpandsToItself() throws Exception {
    assertThat(resolve("alice@example.com").individuals()).containsExactly("alice@example.com");
  }

  @Test
  public void teamExpandsToMembers() throws Exception {
    backend.addTeam("@org/team", "@carol", "@alice", "bob@example.com");
    OwnerExpansion expansion = resolve("@org/team");
    assertThat(expansion.individuals())
        .containsExactly("@alice", "@carol", "bob@example.com")
        .inOrder();
    assertThat(expansion.diagnostic()).isEmpty();
  }

  @Test
  public void nestedTeamsAreExpanded() throws Exception {
    backend
        .addTeam("@org/eng", "@alice", "@org/frontend")
        .addTeam("@org/frontend", "@bob", "@org/design")
        .addTeam("@org/design", "@carol", "@alice");
    assertThat(resolve("@org/eng").individuals()).containsExactly("@alice", "@bob", "@carol");
  }

  @Test
  public void emptyTeamExpandsToNobody() throws Exception {
    backend.addTeam("@org/empty");
    OwnerExpansion expansion = resolve("@org/empty");
    assertThat(expansion.individuals()).isEmpty();
    assertThat(expansion.diagnostic()).isEmpty();
  }

  @Test
  public void cycleIsReported() throws Exception {
    backend.addTeam("@org/a", "@alice", "@org/b").addTeam("@org/b", "@bob", "@org/a");
    OwnerExpansion expansion = resolve("@org/a");
    assertThat(expansion.individuals()).isEmpty();
    Diagnostic diagnostic = expansion.diagnostic().get();
    assertThat(diagnostic.kind()).isEqualTo(Diagnostic.Kind.MEMBERSHIP_CYCLE);
    assertThat(diagnostic.message())
        .isEqualTo("cannot resolve @org/a: membership cycle @org/a -> @org/b -> @org/a");
  }

  @Test
  public void teamContainingItselfIsReported() throws Exception {
    backend.addTeam("@org/a", "@alice", "@org/a");
    Diagnostic diagnostic = resolve("@org/a").diagnostic().get();
    assertThat(diagnostic.kind()).isEqualTo(Diagnostic.Kind.MEMBERSHIP_CYCLE);
    assertThat(diagnostic.message()).endsWith("membership cycle @org/a -> @org/a");
  }

  @Test
  public void nestingUpToMaxDepthIsExpanded() throws Exception {
    backend
        .addTeam("@org/l1", "@org/l2")
        .addTeam("@org/l2", "@org/l3")
        .addTeam("@org/l3", "@alice");
    assertThat(resolve("@org/l1").individuals()).containsExactly("@alice");
  }

  @Test
  public void nestingDeeperThanMaxDepthIsReported() throws Exception {
    backend
        .addTeam("@org/l1", "@org/l2")
        .addTeam("@org/l2", "@org/l3")
        .addTeam("@org/l3", "@org/l4")
        .addTeam("@org/l4", "@alice");
    OwnerExpansion expansion = resolve("@org/l1");
    assertThat(expansion.individuals()).isEmpty();
    Diagnostic diagnostic = expansion.diagnostic().get();
    assertThat(diagnostic.kind()).isEqualTo(Diagnostic.Kind.MEMBERSHIP_DEPTH_EXCEEDED);
    assertThat(diagnostic.message())
        .isEqualTo(
            "cannot resolve @org/l1: team @org/l4 is nested deeper than the maximum depth of 3");
    assertThat(backend.getLookupCount("@org/l4")).isEqualTo(0);
  }

  @Test
  public void unknownTeamIsReported() throws Exception {
    Diagnostic diagnostic = resolve("@org/missing").diagnostic().get();
    assertThat(diagnostic.kind()).isEqualTo(Diagnostic.Kind.MEMBERSHIP_LOOKUP_FAILED);
    assertThat(diagnostic.message()).contains("team @org/missing not found");
  }

  @Test
  public void backendExceptionIsReported() throws Exception {
    backend.failTeam("@org/broken", new IllegalStateException("rate limit exceeded"));
    Diagnostic diagnostic = resolve("@org/broken").diagnostic().get();
    assertThat(diagnostic.kind()).isEqualTo(Diagnostic.Kind.MEMBERSHIP_LOOKUP_FAILED);
    assertThat(diagnostic.message()).contains("rate limit exceeded");
  }

  @Test
  public void failingNestedTeamFailsTopLevelTeam() throws Exception {
    backend.addTeam("@org/eng", "@alice", "@org/missing");
    OwnerExpansion expansion = resolve("@org/eng");
    assertThat(expansion.individuals()).isEmpty();
    assertThat(expansion.diagnostic().get().kind())
        .isEqualTo(Diagnostic.Kind.MEMBERSHIP_LOOKUP_FAILED);
    assertThat(expansion.diagnostic().get().message()).startsWith("cannot resolve @org/eng: ");
  }

  @Test
  public void eachTeamIsLookedUpOnce() throws Exception {
    backend
        .addTeam("@org/a", "@org/b", "@org/c")
        .addTeam("@org/b", "@org/c")
        .addTeam("@org/c", "@carol");
    TeamMembershipResolver resolver = newResolver();

    assertThat(resolver.resolve(team("@org/a")).get().individuals()).containsExactly("@carol");
    assertThat(resolver.getCounters().getLookupCount()).isEqualTo(3);
    assertThat(resolver.getCounters().getCacheReadCount()).isEqualTo(1);

    assertThat(resolver.resolve(team("@org/b")).get().individuals()).containsExactly("@carol");
    assertThat(resolver.getCounters().getLookupCount()).isEqualTo(3);
    assertThat(resolver.getCounters().getCacheReadCount()).isEqualTo(3);

    assertThat(backend.getLookupCount("@org/a")).isEqualTo(1);
    assertThat(backend.getLookupCount("@org/b")).isEqualTo(1);
    assertThat(backend.getLookupCount("@org/c")).isEqualTo(1);
  }

  @Test
  public void expansionIsComputedOnce() throws Exception {
    backend.addTeam("@org/a", "@alice");
    TeamMembershipResolver resolver = newResolver();
    assertThat(resolver.resolve(team("@org/a"))).isSameInstanceAs(resolver.resolve(team("@org/a")));
  }

  @Test
  public void resolversDoNotShareLookups() throws Exception {
    backend.addTeam("@org/a", "@alice");
    newResolver().resolve(team("@org/a")).get();
    newResolver().resolve(team("@org/a")).get();
    assertThat(backend.getLookupCount("@org/a")).isEqualTo(2);
  }

  @Test
  public void concurrentExpansionsShareInFlightLookups() throws Exception {
    ExecutorService executor = newExecutor();
    backend
        .completeAsync(executor)
        .addTeam("@org/x", "@org/shared", "@xavier")
        .addTeam("@org/y", "@org/shared", "@yvonne")
        .addTeam("@org/shared", "@sam");
    TeamMembershipResolver resolver = newResolver();

    CompletableFuture<OwnerExpansion> x = resolver.resolve(team("@org/x"));
    CompletableFuture<OwnerExpansion> y = resolver.resolve(team("@org/y"));

    assertThat(x.get(10, TimeUnit.SECONDS).individuals()).containsExactly("@sam", "@xavier");
    assertThat(y.get(10, TimeUnit.SECONDS).individuals()).containsExactly("@sam", "@yvonne");
    assertThat(backend.getLookupCount("@org/shared")).isEqualTo(1);
  }

  @Test
  public void cancelCancelsPendingLookups() throws Exception {
    backend.addTeam("@org/a", "@alice", "@org/slow").blockTeam("@org/slow");
    TeamMembershipResolver resolver = newResolver();

    CompletableFuture<OwnerExpansion> expansion = resolver.resolve(team("@org/a"));
    assertThat(expansion.isDone()).isFalse();
    ImmutableList<CompletableFuture<ImmutableSet<CodeOwnerReference>>> pendingLookups =
        backend.getPendingLookups();
    assertThat(pendingLookups).hasSize(1);

    resolver.cancel();

    assertThat(pendingLookups.get(0).isCancelled()).isTrue();
    assertThat(expansion.isCompletedExceptionally()).isTrue();
    assertThrows(CancellationException.class, () -> expansion.join());
  }

  @Test
  public void cannotCreateFactoryWithNonPositiveDepth() throws Exception {
    IllegalArgumentException exception =
        assertThrows(
            IllegalArgumentException.class, () -> new TeamMembershipResolver.Factory(backend, 0));
    assertThat(exception).hasMessageThat().isEqualTo("maxDepth must be positive: 0");
  }

  private OwnerExpansion resolve(String owner) throws Exception {
    return newResolver()
        .resolve(CodeOwnerReference.parse(owner).get())
        .get(10, TimeUnit.SECONDS);
  }

  private TeamMembershipResolver newResolver() {
    return new TeamMembershipResolver.Factory(backend, MAX_DEPTH).create();
  }

  private ExecutorService newExecutor() {
    ExecutorService executor = Executors.newFixedThreadPool(4);
    executors.add(executor);
    return executor;
  }

  private static CodeOwnerReference team(String team) {
    return CodeOwnerReference.team(team);
  }
}
