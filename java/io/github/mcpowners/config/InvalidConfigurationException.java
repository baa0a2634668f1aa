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

package io.github.mcpowners.config;

/** Exception that is thrown if a configuration parameter has an invalid value. */
public class InvalidConfigurationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /**
   * Constructor.
   *
   * @param message message explaining which configuration parameter has an invalid value
   */
  public InvalidConfigurationException(String message) {
    super(String.format("Invalid configuration of mcp-github-owners. %s", message));
  }

  public InvalidConfigurationException(String message, Throwable cause) {
    super(String.format("Invalid configuration of mcp-github-owners. %s", message), cause);
  }
}
