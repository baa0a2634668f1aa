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

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.Injector;
import io.github.mcpowners.config.InvalidConfigurationException;
import io.github.mcpowners.config.McpOwnersConfig;
import io.github.mcpowners.module.Module;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.HttpServletSseServerTransportProvider;
import io.modelcontextprotocol.server.transport.HttpServletStreamableServerTransportProvider;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema.ServerCapabilities;
import jakarta.servlet.http.HttpServlet;
import java.util.concurrent.CountDownLatch;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;

/**
 * Entry point of the MCP server that exposes code ownership information of GitHub repositories.
 *
 * <p>The transport is selected by the configuration: stdio, SSE or streamable HTTP. The HTTP
 * transports are served by an embedded Jetty.
 */
public final class McpGitHubOwnersServer {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  @VisibleForTesting static final String SERVER_NAME = "github-codeowners";
  @VisibleForTesting static final String SERVER_VERSION = "1.0.0";

  @VisibleForTesting
  static final String INSTRUCTIONS =
      "This MCP server exposes ownership information for files contained in GitHub"
          + " repositories. Owners are read from the CODEOWNERS file of the requested branch,"
          + " resolve_owners expands teams to their members.";

  @VisibleForTesting static final String SSE_MESSAGE_ENDPOINT = "/messages/";
  @VisibleForTesting static final String MCP_ENDPOINT = "/mcp";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final McpOwnersConfig config;
  private final CodeOwnersTools codeOwnersTools;

  @Inject
  McpGitHubOwnersServer(McpOwnersConfig config, CodeOwnersTools codeOwnersTools) {
    this.config = requireNonNull(config, "config");
    this.codeOwnersTools = requireNonNull(codeOwnersTools, "codeOwnersTools");
  }

  public static void main(String[] args) {
    McpOwnersConfig config;
    try {
      config = McpOwnersConfig.load(System.getenv());
    } catch (InvalidConfigurationException e) {
      logger.atSevere().log("%s", e.getMessage());
      System.exit(1);
      return;
    }
    configureLogging(config.isDebug());

    Injector injector = Guice.createInjector(new Module(config));
    try {
      injector.getInstance(McpGitHubOwnersServer.class).run();
    } catch (InterruptedException e) {
      logger.atInfo().log("server interrupted, shutting down");
      Thread.currentThread().interrupt();
    } catch (Exception e) {
      logger.atSevere().withCause(e).log("failed to start server");
      System.exit(1);
    }
  }

  /**
   * Sends all log output to stderr, stdout carries the protocol messages of the stdio transport.
   */
  @VisibleForTesting
  static void configureLogging(boolean debug) {
    Level level = debug ? Level.FINE : Level.INFO;
    Logger rootLogger = Logger.getLogger("");
    for (Handler handler : rootLogger.getHandlers()) {
      rootLogger.removeHandler(handler);
    }
    ConsoleHandler handler = new ConsoleHandler();
    handler.setLevel(level);
    rootLogger.addHandler(handler);
    rootLogger.setLevel(level);
  }

  /** Runs the server with the configured transport until it is shut down. */
  public void run() throws Exception {
    logger.atInfo().log(
        "starting %s %s (transport = %s)",
        SERVER_NAME, SERVER_VERSION, config.getTransport().getConfigValue());
    switch (config.getTransport()) {
      case STDIO:
        runStdio();
        return;
      case SSE:
        runSse();
        return;
      case STREAMABLE_HTTP:
        runStreamableHttp();
        return;
    }
    throw new IllegalStateException("unsupported transport: " + config.getTransport());
  }

  private void runStdio() throws InterruptedException {
    McpSyncServer mcpServer =
        McpServer.sync(new StdioServerTransportProvider(MAPPER))
            .serverInfo(SERVER_NAME, SERVER_VERSION)
            .instructions(INSTRUCTIONS)
            .capabilities(ServerCapabilities.builder().tools(true).logging().build())
            .tools(codeOwnersTools.getToolSpecifications())
            .build();
    logger.atInfo().log("%s ready on stdio", SERVER_NAME);

    // The transport reads stdin on its own threads, the main thread only waits for shutdown.
    CountDownLatch shutdown = new CountDownLatch(1);
    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  logger.atInfo().log("shutting down");
                  mcpServer.close();
                  shutdown.countDown();
                }));
    shutdown.await();
  }

  private void runSse() throws Exception {
    HttpServletSseServerTransportProvider transportProvider =
        HttpServletSseServerTransportProvider.builder()
            .objectMapper(MAPPER)
            .messageEndpoint(SSE_MESSAGE_ENDPOINT)
            .build();
    McpSyncServer mcpServer =
        McpServer.sync(transportProvider)
            .serverInfo(SERVER_NAME, SERVER_VERSION)
            .instructions(INSTRUCTIONS)
            .capabilities(ServerCapabilities.builder().tools(true).logging().build())
            .tools(codeOwnersTools.getToolSpecifications())
            .build();
    serveHttp(transportProvider, mcpServer);
  }

  private void runStreamableHttp() throws Exception {
    HttpServletStreamableServerTransportProvider transportProvider =
        HttpServletStreamableServerTransportProvider.builder()
            .objectMapper(MAPPER)
            .mcpEndpoint(MCP_ENDPOINT)
            .build();
    McpSyncServer mcpServer =
        McpServer.sync(transportProvider)
            .serverInfo(SERVER_NAME, SERVER_VERSION)
            .instructions(INSTRUCTIONS)
            .capabilities(ServerCapabilities.builder().tools(true).logging().build())
            .tools(codeOwnersTools.getToolSpecifications())
            .build();
    serveHttp(transportProvider, mcpServer);
  }

  private void serveHttp(HttpServlet transportServlet, McpSyncServer mcpServer) throws Exception {
    Server jettyServer = new Server();
    ServerConnector connector = new ServerConnector(jettyServer);
    connector.setHost(config.getHost());
    connector.setPort(config.getPort());
    jettyServer.addConnector(connector);

    ServletContextHandler context = new ServletContextHandler(ServletContextHandler.SESSIONS);
    context.setContextPath("/");
    context.addServlet(new ServletHolder(transportServlet), "/*");
    jettyServer.setHandler(context);

    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  logger.atInfo().log("shutting down");
                  mcpServer.close();
                  try {
                    jettyServer.stop();
                  } catch (Exception e) {
                    logger.atWarning().withCause(e).log("failed to stop Jetty");
                  }
                }));

    jettyServer.start();
    logger.atInfo().log(
        "%s listening on http://%s:%d", SERVER_NAME, config.getHost(), config.getPort());
    jettyServer.join();
  }
}
