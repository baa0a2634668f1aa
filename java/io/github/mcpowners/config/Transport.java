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

import static java.util.Objects.requireNonNull;

import java.util.Arrays;
import java.util.Optional;

/** Transport over which the MCP server talks to its clients. */
public enum Transport {
  /** JSON-RPC messages over stdin/stdout. */
  STDIO("stdio"),

  /** HTTP with server-sent events. */
  SSE("sse"),

  /** Streamable HTTP. */
  STREAMABLE_HTTP("streamable-http");

  private final String configValue;

  private Transport(String configValue) {
    this.configValue = configValue;
  }

  /** The value that selects this transport in the configuration. */
  public String getConfigValue() {
    return configValue;
  }

  /** Whether this transport serves clients over HTTP. */
  public boolean isHttp() {
    return this != STDIO;
  }

  /**
   * Finds the transport for a configuration value.
   *
   * @param configValue the configured value, e.g. {@code streamable-http}
   * @return the transport, {@link Optional#empty()} if the value is unknown
   */
  public static Optional<Transport> fromConfigValue(String configValue) {
    requireNonNull(configValue, "configValue");
    return Arrays.stream(values())
        .filter(transport -> transport.configValue.equalsIgnoreCase(configValue.trim()))
        .findFirst();
  }
}
