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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.github.mcpowners.util.InvalidRepoPathException;
import io.github.mcpowners.util.RepoPath;

/**
 * The content of a code owners file together with the path from which it was read.
 *
 * <p>Code owners files at the locations that GitHub reads ({@code CODEOWNERS}, {@code
 * .github/CODEOWNERS} and {@code docs/CODEOWNERS}) apply to the whole repository. Code owners
 * files at any other location are scoped to the directory that contains them.
 */
@AutoValue
public abstract class CodeOwnersFile {
  /** The locations of repository-wide code owners files, in the order GitHub reads them. */
  public static final ImmutableList<String> ROOT_LOCATIONS =
      ImmutableList.of(".github/CODEOWNERS", "CODEOWNERS", "docs/CODEOWNERS");

  private static final ImmutableSet<String> ROOT_LOCATION_SET =
      ImmutableSet.copyOf(ROOT_LOCATIONS);

  /** The repository path of the file, e.g. {@code .github/CODEOWNERS}. */
  public abstract String path();

  /** The raw content of the file. */
  public abstract String content();

  /**
   * Returns the segments of the directory to which the rules in this file apply.
   *
   * @return empty list for repository-wide files, otherwise the segments of the parent directory
   */
  public ImmutableList<String> scope() {
    RepoPath repoPath = repoPath();
    if (ROOT_LOCATION_SET.contains(repoPath.get())) {
      return ImmutableList.of();
    }
    ImmutableList<String> segments = repoPath.segments();
    return segments.subList(0, segments.size() - 1);
  }

  private RepoPath repoPath() {
    try {
      return RepoPath.parse(path());
    } catch (InvalidRepoPathException e) {
      throw new IllegalStateException(e);
    }
  }

  /**
   * Creates a code owners file.
   *
   * @param path the repository path of the file
   * @param content the content of the file
   * @throws IllegalArgumentException if the path is not a valid repository path
   */
  public static CodeOwnersFile create(String path, String content) {
    requireNonNull(path, "path");
    requireNonNull(content, "content");
    try {
      RepoPath.parse(path);
    } catch (InvalidRepoPathException e) {
      throw new IllegalArgumentException(e.getMessage(), e);
    }
    return new AutoValue_CodeOwnersFile(path, content);
  }
}
