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

package io.github.mcpowners.util;

import static java.util.Objects.requireNonNull;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.Objects;

/**
 * A normalized, repository-relative path.
 *
 * <p>Paths are forward-slash separated and never start with '/'. Repeated slashes and '.' segments
 * are dropped. A trailing '/' marks the path as a directory. Any other character, including
 * backslashes and leading or trailing spaces, is part of the file name and kept as it is.
 *
 * <p>Paths that are blank or empty after normalization, that contain '..' segments or that contain
 * control characters are rejected with an {@link InvalidRepoPathException}.
 */
public class RepoPath {
  private static final Splitter SEGMENT_SPLITTER = Splitter.on('/').omitEmptyStrings();
  private static final Joiner SEGMENT_JOINER = Joiner.on('/');

  private final ImmutableList<String> segments;
  private final boolean directory;

  /**
   * Normalizes the given path.
   *
   * @param path repository path, may start with '/', may end with '/' to denote a directory
   * @return the normalized path
   * @throws InvalidRepoPathException if the path cannot be normalized
   */
  public static RepoPath parse(String path) throws InvalidRepoPathException {
    requireNonNull(path, "path");
    if (CharMatcher.javaIsoControl().matchesAnyOf(path)) {
      throw new InvalidRepoPathException(path, "path contains control characters");
    }

    if (CharMatcher.whitespace().matchesAllOf(path)) {
      throw new InvalidRepoPathException(path, "path is empty");
    }

    ImmutableList.Builder<String> segments = ImmutableList.builder();
    for (String segment : SEGMENT_SPLITTER.split(path)) {
      if (segment.equals(".")) {
        continue;
      }
      if (segment.equals("..")) {
        throw new InvalidRepoPathException(path, "path must not contain '..'");
      }
      segments.add(segment);
    }

    ImmutableList<String> normalizedSegments = segments.build();
    if (normalizedSegments.isEmpty()) {
      throw new InvalidRepoPathException(path, "path is empty");
    }
    return new RepoPath(normalizedSegments, path.endsWith("/"));
  }

  private RepoPath(ImmutableList<String> segments, boolean directory) {
    this.segments = segments;
    this.directory = directory;
  }

  /** Returns the path segments, never empty. */
  public ImmutableList<String> segments() {
    return segments;
  }

  /** Whether the path was given with a trailing '/' and hence denotes a directory. */
  public boolean isDirectory() {
    return directory;
  }

  /** Returns the path as string, without leading and without trailing '/'. */
  public String get() {
    return SEGMENT_JOINER.join(segments);
  }

  @Override
  public int hashCode() {
    return Objects.hash(segments, directory);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof RepoPath)) {
      return false;
    }
    RepoPath other = (RepoPath) o;
    return directory == other.directory && Objects.equals(segments, other.segments);
  }

  @Override
  public String toString() {
    return directory ? get() + "/" : get();
  }
}
