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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.eclipse.jgit.errors.ConfigInvalidException;
import org.eclipse.jgit.lib.Config;
import org.eclipse.jgit.storage.file.FileBasedConfig;
import org.eclipse.jgit.util.FS;

/**
 * The configuration of mcp-github-owners.
 *
 * <p>The configuration is read from a git-config style file (location given by the {@code
 * MCP_OWNERS_CONFIG} environment variable, optional). Environment variables override the values
 * from the file:
 *
 * <pre>
 * [github]
 *   token = ...                    # GITHUB_TOKEN
 *   apiUrl = https://api.github.com  # GITHUB_API_URL
 * [server]
 *   debug = false                  # DEBUG
 *   transport = stdio              # TRANSPORT: stdio, sse or streamable-http
 *   host = 127.0.0.1               # HOST
 *   port = 8000                    # PORT
 * [cache]
 *   ttl = 300 s                    # CACHE_TTL_SECS
 * [resolution]
 *   maxTeamDepth = 10              # MAX_TEAM_DEPTH
 *   requestTimeout = 30 s          # REQUEST_TIMEOUT_SECS
 * </pre>
 *
 * <p>All values are read and validated when the configuration is created, invalid values fail with
 * an {@link InvalidConfigurationException}.
 */
public class McpOwnersConfig {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public static final String ENV_CONFIG_FILE = "MCP_OWNERS_CONFIG";

  public static final String SECTION_GITHUB = "github";
  public static final String SECTION_SERVER = "server";
  public static final String SECTION_CACHE = "cache";
  public static final String SECTION_RESOLUTION = "resolution";

  public static final String KEY_TOKEN = "token";
  public static final String KEY_API_URL = "apiUrl";
  public static final String KEY_DEBUG = "debug";
  public static final String KEY_TRANSPORT = "transport";
  public static final String KEY_HOST = "host";
  public static final String KEY_PORT = "port";
  public static final String KEY_TTL = "ttl";
  public static final String KEY_MAX_TEAM_DEPTH = "maxTeamDepth";
  public static final String KEY_REQUEST_TIMEOUT = "requestTimeout";

  public static final String DEFAULT_API_URL = "https://api.github.com";
  public static final String DEFAULT_HOST = "127.0.0.1";
  public static final int DEFAULT_PORT = 8000;
  public static final long DEFAULT_CACHE_TTL_SECS = 300;
  public static final int DEFAULT_MAX_TEAM_DEPTH = 10;
  public static final long DEFAULT_REQUEST_TIMEOUT_SECS = 30;

  /** Environment variables by the config parameter (section.key) that they override. */
  private static final ImmutableMap<String, String> ENV_OVERRIDES =
      ImmutableMap.<String, String>builder()
          .put(SECTION_GITHUB + "." + KEY_TOKEN, "GITHUB_TOKEN")
          .put(SECTION_GITHUB + "." + KEY_API_URL, "GITHUB_API_URL")
          .put(SECTION_SERVER + "." + KEY_DEBUG, "DEBUG")
          .put(SECTION_SERVER + "." + KEY_TRANSPORT, "TRANSPORT")
          .put(SECTION_SERVER + "." + KEY_HOST, "HOST")
          .put(SECTION_SERVER + "." + KEY_PORT, "PORT")
          .put(SECTION_CACHE + "." + KEY_TTL, "CACHE_TTL_SECS")
          .put(SECTION_RESOLUTION + "." + KEY_MAX_TEAM_DEPTH, "MAX_TEAM_DEPTH")
          .put(SECTION_RESOLUTION + "." + KEY_REQUEST_TIMEOUT, "REQUEST_TIMEOUT_SECS")
          .build();

  private final Optional<String> gitHubToken;
  private final String gitHubApiUrl;
  private final boolean debug;
  private final Transport transport;
  private final String host;
  private final int port;
  private final Duration cacheTtl;
  private final int maxTeamDepth;
  private final Duration requestTimeout;

  /**
   * Loads the configuration from the config file that is referenced by the environment and applies
   * the overrides from the environment.
   *
   * @param env the environment variables
   * @return the configuration
   * @throws InvalidConfigurationException if the config file cannot be read or contains invalid
   *     values
   */
  public static McpOwnersConfig load(Map<String, String> env) {
    requireNonNull(env, "env");
    String configFile = env.get(ENV_CONFIG_FILE);
    if (Strings.isNullOrEmpty(configFile)) {
      return create(new Config(), env);
    }

    FileBasedConfig fileBasedConfig = new FileBasedConfig(new File(configFile), FS.DETECTED);
    try {
      fileBasedConfig.load();
    } catch (IOException | ConfigInvalidException e) {
      throw new InvalidConfigurationException(
          String.format("Cannot read config file %s: %s", configFile, e.getMessage()), e);
    }
    logger.atFine().log("loaded config file %s", configFile);
    return create(fileBasedConfig, env);
  }

  /**
   * Creates the configuration from the given config and applies the overrides from the
   * environment.
   *
   * @param config the config, e.g. as read from the config file
   * @param env the environment variables
   * @return the configuration
   * @throws InvalidConfigurationException if a parameter has an invalid value
   */
  public static McpOwnersConfig create(Config config, Map<String, String> env) {
    requireNonNull(config, "config");
    requireNonNull(env, "env");

    Config effectiveConfig = new Config(config);
    ENV_OVERRIDES.forEach(
        (parameter, envVar) -> {
          String value = env.get(envVar);
          if (value != null) {
            String[] sectionAndKey = parameter.split("\\.", 2);
            effectiveConfig.setString(
                sectionAndKey[0], /* subsection= */ null, sectionAndKey[1], value);
          }
        });
    return new McpOwnersConfig(effectiveConfig);
  }

  private McpOwnersConfig(Config config) {
    this.gitHubToken =
        Optional.ofNullable(
                Strings.emptyToNull(
                    config.getString(SECTION_GITHUB, /* subsection= */ null, KEY_TOKEN)))
            .map(String::trim);
    this.gitHubApiUrl =
        readString(config, SECTION_GITHUB, KEY_API_URL, DEFAULT_API_URL).replaceAll("/+$", "");
    this.debug = readBoolean(config, SECTION_SERVER, KEY_DEBUG, false);
    this.transport = readTransport(config);
    this.host = readString(config, SECTION_SERVER, KEY_HOST, DEFAULT_HOST);
    this.port = readInt(config, SECTION_SERVER, KEY_PORT, DEFAULT_PORT);
    if (port < 1 || port > 65535) {
      throw invalidValue(SECTION_SERVER, KEY_PORT, String.valueOf(port));
    }
    this.cacheTtl = readDuration(config, SECTION_CACHE, KEY_TTL, DEFAULT_CACHE_TTL_SECS);
    this.maxTeamDepth =
        readInt(config, SECTION_RESOLUTION, KEY_MAX_TEAM_DEPTH, DEFAULT_MAX_TEAM_DEPTH);
    if (maxTeamDepth < 1) {
      throw invalidValue(SECTION_RESOLUTION, KEY_MAX_TEAM_DEPTH, String.valueOf(maxTeamDepth));
    }
    this.requestTimeout =
        readDuration(
            config, SECTION_RESOLUTION, KEY_REQUEST_TIMEOUT, DEFAULT_REQUEST_TIMEOUT_SECS);
    if (requestTimeout.isZero()) {
      throw invalidValue(SECTION_RESOLUTION, KEY_REQUEST_TIMEOUT, "0");
    }
  }

  private static String readString(Config config, String section, String key, String defaultValue) {
    String value = config.getString(section, /* subsection= */ null, key);
    return Strings.isNullOrEmpty(value) ? defaultValue : value.trim();
  }

  private static boolean readBoolean(
      Config config, String section, String key, boolean defaultValue) {
    try {
      return config.getBoolean(section, /* subsection= */ null, key, defaultValue);
    } catch (IllegalArgumentException e) {
      throw invalidValue(section, key, config.getString(section, /* subsection= */ null, key));
    }
  }

  private static int readInt(Config config, String section, String key, int defaultValue) {
    try {
      return config.getInt(section, /* subsection= */ null, key, defaultValue);
    } catch (IllegalArgumentException e) {
      throw invalidValue(section, key, config.getString(section, /* subsection= */ null, key));
    }
  }

  private static Duration readDuration(
      Config config, String section, String key, long defaultSeconds) {
    long seconds;
    try {
      seconds =
          config.getTimeUnit(
              section, /* subsection= */ null, key, defaultSeconds, TimeUnit.SECONDS);
    } catch (IllegalArgumentException e) {
      throw invalidValue(section, key, config.getString(section, /* subsection= */ null, key));
    }
    if (seconds < 0) {
      throw invalidValue(section, key, String.valueOf(seconds));
    }
    return Duration.ofSeconds(seconds);
  }

  private static Transport readTransport(Config config) {
    String value = config.getString(SECTION_SERVER, /* subsection= */ null, KEY_TRANSPORT);
    if (Strings.isNullOrEmpty(value)) {
      return Transport.STDIO;
    }
    return Transport.fromConfigValue(value)
        .orElseThrow(
            () ->
                new InvalidConfigurationException(
                    String.format(
                        "Transport '%s' that is configured in %s.%s is invalid (allowed values:"
                            + " %s).",
                        value,
                        SECTION_SERVER,
                        KEY_TRANSPORT,
                        Arrays.stream(Transport.values())
                            .map(Transport::getConfigValue)
                            .collect(Collectors.joining(", ")))));
  }

  private static InvalidConfigurationException invalidValue(
      String section, String key, String value) {
    String parameter = section + "." + key;
    return new InvalidConfigurationException(
        String.format(
            "The value '%s' that is configured for %s (env %s) is invalid.",
            value, parameter, ENV_OVERRIDES.get(parameter)));
  }

  /** The token that is used to authenticate against the GitHub API, if configured. */
  public Optional<String> getGitHubToken() {
    return gitHubToken;
  }

  /** The base URL of the GitHub REST API, without trailing '/'. */
  public String getGitHubApiUrl() {
    return gitHubApiUrl;
  }

  /** Whether debug logging is enabled. */
  public boolean isDebug() {
    return debug;
  }

  public Transport getTransport() {
    return transport;
  }

  /** The host on which HTTP transports listen. */
  public String getHost() {
    return host;
  }

  /** The port on which HTTP transports listen. */
  public int getPort() {
    return port;
  }

  /** How long parsed code owners files are served from the cache without revalidation. */
  public Duration getCacheTtl() {
    return cacheTtl;
  }

  /** How deep teams may be nested when they are expanded to their members. */
  public int getMaxTeamDepth() {
    return maxTeamDepth;
  }

  /** How long resolving the code owners of a request may take. */
  public Duration getRequestTimeout() {
    return requestTimeout;
  }
}
