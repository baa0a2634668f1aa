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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * A single declaration of a code owners file: a path pattern and the owners of the matching paths.
 *
 * <p>The {@link #index()} is the position of the rule in its {@link CodeOwnersRuleSet} and defines
 * its precedence: if several rules match a path, the rule with the highest index wins.
 */
@AutoValue
public abstract class CodeOwnersRule {
  /** Position of the rule in the rule set. */
  public abstract int index();

  public abstract CodeOwnersPattern pattern();

  /**
   * The owners in declaration order, may be empty which means that matching paths are explicitly
   * unowned.
   */
  public abstract ImmutableList<CodeOwnerReference> owners();

  /** Path of the code owners file that declares this rule. */
  public abstract String sourcePath();

  /** 1-based line number of the rule in its code owners file. */
  public abstract int lineNumber();

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_CodeOwnersRule.Builder().setIndex(0).setOwners(ImmutableList.of());
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setIndex(int index);

    public abstract Builder setPattern(CodeOwnersPattern pattern);

    public abstract Builder setOwners(ImmutableList<CodeOwnerReference> owners);

    public abstract Builder setSourcePath(String sourcePath);

    public abstract Builder setLineNumber(int lineNumber);

    public abstract CodeOwnersRule build();
  }
}
