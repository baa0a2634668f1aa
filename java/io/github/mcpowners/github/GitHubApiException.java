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

import java.util.OptionalInt;

/** Exception that is thrown if a request to the GitHub API failed. */
public class GitHubApiException extends Exception {
  private static final long serialVersionUID = 1L;

  private final OptionalInt statusCode;

  public GitHubApiException(String message, int statusCode) {
    super(message);
    this.statusCode = OptionalInt.of(statusCode);
  }

  public GitHubApiException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = OptionalInt.empty();
  }

  /**
   * The HTTP status code of the failed response, {@link OptionalInt#empty()} if no response was
   * received.
   */
  public OptionalInt getStatusCode() {
    return statusCode;
  }

  /** Whether the requested resource does not exist. */
  public boolean isNotFound() {
    return statusCode.isPresent() && statusCode.getAsInt() == 404;
  }
}
