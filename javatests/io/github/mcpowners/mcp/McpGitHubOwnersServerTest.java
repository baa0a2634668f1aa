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


package io.github.mcpowners.mcp;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableMap;
import com.google.inject.Guice;
import io.github.mcpowners.config.McpOwnersConfig;
import io.github.mcpowners.module.Module;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.eclipse.jgit.lib.Config;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

/** Tests for {@link McpGitHubOwnersServer}. */
public class McpGitHubOwnersServerTest {
  private Handler[] originalHandlers;
  private Level originalLevel;

  @Before
  public void saveLogging() {
    Logger rootLogger = Logger.getLogger("");
    originalHandlers = rootLogger.getHandlers();
    originalLevel = rootLogger.getLevel();
  }

  @After
  public void restoreLogging() {
    Logger rootLogger = Logger.getLogger("");
    for (Handler handler : rootLogger.getHandlers()) {
      rootLogger.removeHandler(handler);
    }
    for (Handler handler : originalHandlers) {
      rootLogger.addHandler(handler);
    }
    rootLogger.setLevel(originalLevel);
  }

  @Test
  public void serverCanBeCreated() {
    McpOwnersConfig config =
        McpOwnersConfig.create(new Config(), ImmutableMap.of("TRANSPORT", "streamable-http"));
    assertThat(Guice.createInjector(new Module(config)).getInstance(McpGitHubOwnersServer.class))
        .isNotNull();
  }

  @Test
  public void debugLogging() {
    McpGitHubOwnersServer.configureLogging(/* debug= */ true);

    Logger rootLogger = Logger.getLogger("");
    assertThat(rootLogger.getLevel()).isEqualTo(Level.FINE);
    assertThat(rootLogger.getHandlers()).hasLength(1);
    assertThat(rootLogger.getHandlers()[0]).isInstanceOf(ConsoleHandler.class);
    assertThat(rootLogger.getHandlers()[0].getLevel()).isEqualTo(Level.FINE);
  }

  @Test
  public void infoLogging() {
    McpGitHubOwnersServer.configureLogging(/* debug= */ false);

    Logger rootLogger = Logger.getLogger("");
    assertThat(rootLogger.getLevel()).isEqualTo(Level.INFO);
    assertThat(rootLogger.getHandlers()).hasLength(1);
  }
}
