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

import com.google.auto.value.AutoValue;
import java.util.Optional;

/** Result of fetching a file from a repository. */
@AutoValue
public abstract class FileFetchResult {
  public enum Status {
    /** The file was fetched, its content is available. */
    FOUND,

    /** The file didn't change since it was fetched with the ETag that was sent. */
    NOT_MODIFIED,

    /** The file doesn't exist. */
    NOT_FOUND;
  }

  public abstract Status status();

  /** The raw file content, only set for {@link Status#FOUND}. */
  public abstract Optional<String> content();

  /** The ETag of the file version, if GitHub returned one. */
  public abstract Optional<String> etag();

  public static FileFetchResult found(String content, Optional<String> etag) {
    return new AutoValue_FileFetchResult(Status.FOUND, Optional.of(content), etag);
  }

  public static FileFetchResult notModified(Optional<String> etag) {
    return new AutoValue_FileFetchResult(Status.NOT_MODIFIED, Optional.empty(), etag);
  }

  public static FileFetchResult notFound() {
    return new AutoValue_FileFetchResult(Status.NOT_FOUND, Optional.empty(), Optional.empty());
  }
}
