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

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.github.mcpowners.backend.TeamMembershipBackend;
import io.github.mcpowners.config.McpOwnersConfig;
import java.time.Duration;
import okhttp3.OkHttpClient;

/** Guice module that binds the GitHub integration. */
public class GitHubModule extends AbstractModule {
  private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

  @Override
  protected void configure() {
    bind(TeamMembershipBackend.class).to(GitHubTeamMembershipBackend.class);
  }

  @Provides
  @Singleton
  OkHttpClient provideOkHttpClient(McpOwnersConfig config) {
    return new OkHttpClient.Builder()
        .connectTimeout(CONNECT_TIMEOUT)
        .readTimeout(config.getRequestTimeout())
        .build();
  }
}
