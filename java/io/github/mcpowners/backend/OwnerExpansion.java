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
import com.google.common.collect.ImmutableSortedSet;
import java.util.Optional;

/** The individuals to which a single code owner reference expands. */
@AutoValue
public abstract class OwnerExpansion {
  /** The code owner reference that was expanded. */
  public abstract CodeOwnerReference owner();

  /** The individuals, empty if the expansion failed. */
  public abstract ImmutableSortedSet<String> individuals();

  /** The reason why the expansion failed, {@link Optional#empty()} if it succeeded. */
  public abstract Optional<Diagnostic> diagnostic();

  public static OwnerExpansion resolved(
      CodeOwnerReference owner, ImmutableSortedSet<String> individuals) {
    return new AutoValue_OwnerExpansion(
        requireNonNull(owner, "owner"),
        requireNonNull(individuals, "individuals"),
        Optional.empty());
  }

  public static OwnerExpansion failed(CodeOwnerReference owner, Diagnostic diagnostic) {
    return new AutoValue_OwnerExpansion(
        requireNonNull(owner, "owner"),
        ImmutableSortedSet.of(),
        Optional.of(requireNonNull(diagnostic, "diagnostic")));
  }
}
