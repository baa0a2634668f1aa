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

import static java.util.Objects.requireNonNull;

import com.google.auto.value.AutoValue;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.List;
import java.util.Optional;

/** The result of resolving the code owners of a path via {@link CodeOwnersResolver}. */
@AutoValue
public abstract class ResolvedOwnership {
  /** The path as it was queried. */
  public abstract String path();

  /** The individuals owning the path, with all teams expanded. */
  public abstract ImmutableSortedSet<String> individuals();

  /** The owners of the winning rule as they are written in the code owners file. */
  public abstract ImmutableList<CodeOwnerReference> codeOwners();

  /** The last rule that matches the path, {@link Optional#empty()} if no rule matches. */
  public abstract Optional<CodeOwnersRule> winningRule();

  /** Problems that were found while resolving the code owners of the path. */
  public abstract ImmutableList<Diagnostic> diagnostics();

  /** Returns the index of the winning rule, {@link Optional#empty()} if no rule matches. */
  public Optional<Integer> winningRuleIndex() {
    return winningRule().map(CodeOwnersRule::index);
  }

  /** Whether the path could not be resolved because it is not a valid repository path. */
  public boolean hasInvalidPath() {
    return diagnostics().stream().anyMatch(d -> d.kind() == Diagnostic.Kind.INVALID_PATH);
  }

  @Override
  public final String toString() {
    return MoreObjects.toStringHelper(this)
        .add("path", path())
        .add("individuals", individuals())
        .add("codeOwners", codeOwners())
        .add("winningRuleIndex", winningRuleIndex())
        .add("diagnostics", diagnostics())
        .toString();
  }

  /** Creates a {@link ResolvedOwnership} for a path that no rule matches. */
  public static ResolvedOwnership createUnowned(String path) {
    return create(
        path,
        ImmutableSortedSet.of(),
        ImmutableList.of(),
        Optional.empty(),
        ImmutableList.of());
  }

  /** Creates a {@link ResolvedOwnership} for a path that couldn't be normalized. */
  public static ResolvedOwnership createInvalidPath(String path, String message) {
    return create(
        path,
        ImmutableSortedSet.of(),
        ImmutableList.of(),
        Optional.empty(),
        ImmutableList.of(Diagnostic.create(Diagnostic.Kind.INVALID_PATH, message)));
  }

  /** Creates a {@link ResolvedOwnership} instance. */
  public static ResolvedOwnership create(
      String path,
      ImmutableSortedSet<String> individuals,
      List<CodeOwnerReference> codeOwners,
      Optional<CodeOwnersRule> winningRule,
      List<Diagnostic> diagnostics) {
    return new AutoValue_ResolvedOwnership(
        requireNonNull(path, "path"),
        requireNonNull(individuals, "individuals"),
        ImmutableList.copyOf(codeOwners),
        requireNonNull(winningRule, "winningRule"),
        ImmutableList.copyOf(diagnostics));
  }
}
