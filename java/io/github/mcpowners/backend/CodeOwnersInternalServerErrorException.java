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

import com.google.common.base.Throwables;

/** Exception signaling an unexpected failure while resolving code owners. */
public class CodeOwnersInternalServerErrorException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private static final String USER_MESSAGE = "Internal server error in mcp-github-owners";

  /**
   * Creates a {@link CodeOwnersInternalServerErrorException} to signal an unexpected failure.
   *
   * @param message the exception message
   * @param cause the exception cause
   * @return the created exception
   */
  public static CodeOwnersInternalServerErrorException newInternalServerError(
      String message, Throwable cause) {
    return new CodeOwnersInternalServerErrorException(
        requireNonNull(message, "message"), Throwables.getRootCause(cause));
  }

  private CodeOwnersInternalServerErrorException(String message, Throwable cause) {
    super(message, cause);
  }

  public String getUserVisibleMessage() {
    return USER_MESSAGE;
  }
}
