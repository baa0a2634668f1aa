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

package io.github.mcpowners.module;

import static java.util.Objects.requireNonNull;

import com.google.inject.AbstractModule;
import io.github.mcpowners.config.ConfigModule;
import io.github.mcpowners.config.McpOwnersConfig;
import io.github.mcpowners.github.GitHubModule;

/** Guice module that wires the mcp-github-owners server. */
public class Module extends AbstractModule {
  private final McpOwnersConfig config;

  public Module(McpOwnersConfig config) {
    this.config = requireNonNull(config, "config");
  }

  @Override
  protected void configure() {
    install(new ConfigModule(config));
    install(new GitHubModule());
  }
}
