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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import io.github.mcpowners.util.RepoPath;
import java.util.List;
import java.util.Optional;

/**
 * The ordered rules of one or more code owners files.
 *
 * <p>Rules are ordered by precedence: later rules override earlier rules (last match wins). A rule
 * set is never modified, changed code owners files must be parsed again.
 */
@AutoValue
public abstract class CodeOwnersRuleSet {
  /** Paths of the code owners files from which the rules were parsed, in precedence order. */
  public abstract ImmutableList<String> sourcePaths();

  /** The rules, the rule at index {@code i} has {@link CodeOwnersRule#index()} {@code i}. */
  public abstract ImmutableList<CodeOwnersRule> rules();

  /** Problems that were found while parsing the code owners files. */
  public abstract ImmutableList<Diagnostic> diagnostics();

  /**
   * Finds the rule that determines the code owners of the given path.
   *
   * @param path the path for which the winning rule should be found
   * @return the last rule that matches the path, {@link Optional#empty()} if no rule matches
   */
  public Optional<CodeOwnersRule> findWinningRule(RepoPath path) {
    requireNonNull(path, "path");
    ImmutableList<CodeOwnersRule> rules = rules();
    for (int i = rules.size() - 1; i >= 0; i--) {
      if (rules.get(i).pattern().matches(path)) {
        return Optional.of(rules.get(i));
      }
    }
    return Optional.empty();
  }

  public static CodeOwnersRuleSet empty() {
    return create(ImmutableList.of(), ImmutableList.of(), ImmutableList.of());
  }

  public static CodeOwnersRuleSet create(
      List<String> sourcePaths, List<CodeOwnersRule> rules, List<Diagnostic> diagnostics) {
    for (int i = 0; i < rules.size(); i++) {
      checkArgument(
          rules.get(i).index() == i, "rule at position %s has index %s", i, rules.get(i).index());
    }
    return new AutoValue_CodeOwnersRuleSet(
        ImmutableList.copyOf(sourcePaths),
        ImmutableList.copyOf(rules),
        ImmutableList.copyOf(diagnostics));
  }
}
