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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import io.github.mcpowners.backend.CodeOwnerReference;
import io.github.mcpowners.backend.CodeOwnersInternalServerErrorException;
import io.github.mcpowners.backend.CodeOwnersResolver;
import io.github.mcpowners.backend.CodeOwnersRule;
import io.github.mcpowners.backend.CodeOwnersRuleSet;
import io.github.mcpowners.backend.Diagnostic;
import io.github.mcpowners.backend.ResolvedOwnership;
import io.github.mcpowners.github.CodeOwnersFileCache;
import io.github.mcpowners.github.CodeOwnersFileNotFoundException;
import io.github.mcpowners.github.GitHubApiException;
import io.github.mcpowners.github.GitHubClient;
import io.github.mcpowners.util.InvalidRepoPathException;
import io.github.mcpowners.util.RepoPath;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema.CallToolResult;
import io.modelcontextprotocol.spec.McpSchema.TextContent;
import io.modelcontextprotocol.spec.McpSchema.Tool;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * The MCP tools that expose code ownership information.
 *
 * <ul>
 *   <li>{@code get_file_owner}: the owners of a file as they are written in the CODEOWNERS file
 *   <li>{@code resolve_owners}: the owners of several paths, with teams expanded to individuals
 *   <li>{@code check_codeowners}: the parse result of the CODEOWNERS file of a branch
 * </ul>
 *
 * <p>Tool results are JSON documents. Failures are returned as error results that carry a message,
 * they never fail the MCP request.
 */
@Singleton
public class CodeOwnersTools {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final String GET_FILE_OWNER = "get_file_owner";
  static final String RESOLVE_OWNERS = "resolve_owners";
  static final String CHECK_CODEOWNERS = "check_codeowners";

  static final String DEFAULT_BRANCH = "main";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static final String REPO_PROPERTIES =
      "\"owner\": {\"type\": \"string\", \"description\": \"Owner of the repository\"},"
          + "\"repo\": {\"type\": \"string\", \"description\": \"Name of the repository\"},"
          + "\"branch\": {\"type\": \"string\", \"description\": \"Branch, defaults to main\"}";

  private final CodeOwnersFileCache codeOwnersFileCache;
  private final CodeOwnersResolver codeOwnersResolver;
  private final GitHubClient gitHubClient;

  @Inject
  CodeOwnersTools(
      CodeOwnersFileCache codeOwnersFileCache,
      CodeOwnersResolver codeOwnersResolver,
      GitHubClient gitHubClient) {
    this.codeOwnersFileCache = requireNonNull(codeOwnersFileCache, "codeOwnersFileCache");
    this.codeOwnersResolver = requireNonNull(codeOwnersResolver, "codeOwnersResolver");
    this.gitHubClient = requireNonNull(gitHubClient, "gitHubClient");
  }

  /** The specifications of all tools, to be registered with the MCP server. */
  public ImmutableList<McpServerFeatures.SyncToolSpecification> getToolSpecifications() {
    return ImmutableList.of(
        new McpServerFeatures.SyncToolSpecification(
            new Tool(
                GET_FILE_OWNER,
                "Returns the code owners of a file in a GitHub repository, as they are listed in"
                    + " the CODEOWNERS file of the branch. Teams are not expanded.",
                schema(
                    "\"path\": {\"type\": \"string\", \"description\": \"Path of the file\"}",
                    "\"path\"")),
            (exchange, args) -> getFileOwner(args)),
        new McpServerFeatures.SyncToolSpecification(
            new Tool(
                RESOLVE_OWNERS,
                "Resolves the code owners of several paths in a GitHub repository. Teams are"
                    + " expanded to their members. For each path the individuals, the owners as"
                    + " listed in the CODEOWNERS file, the winning rule and diagnostics are"
                    + " returned.",
                schema(
                    "\"paths\": {\"type\": \"array\", \"items\": {\"type\": \"string\"},"
                        + " \"description\": \"Paths of files or directories (directories end"
                        + " with '/')\"}",
                    "\"paths\"")),
            (exchange, args) -> resolveOwners(args)),
        new McpServerFeatures.SyncToolSpecification(
            new Tool(
                CHECK_CODEOWNERS,
                "Parses the CODEOWNERS file of a branch and reports the number of rules, the"
                    + " source file and the problems that were found.",
                schema(/* extraProperties= */ null, /* extraRequired= */ null)),
            (exchange, args) -> checkCodeOwners(args)));
  }

  private static String schema(String extraProperties, String extraRequired) {
    return "{\"type\": \"object\", \"properties\": {"
        + REPO_PROPERTIES
        + (extraProperties != null ? "," + extraProperties : "")
        + "}, \"required\": [\"owner\", \"repo\""
        + (extraRequired != null ? "," + extraRequired : "")
        + "]}";
  }

  @VisibleForTesting
  CallToolResult getFileOwner(Map<String, Object> args) {
    try {
      String owner = requireString(args, "owner");
      String repo = requireString(args, "repo");
      String path = requirePath(args, "path");
      String branch = getBranch(args);

      RepoPath repoPath = RepoPath.parse(path);
      CodeOwnersRuleSet ruleSet = codeOwnersFileCache.get(owner, repo, branch);
      Optional<CodeOwnersRule> winningRule = ruleSet.findWinningRule(repoPath);
      ImmutableList<CodeOwnerReference> codeOwners =
          winningRule.map(CodeOwnersRule::owners).orElse(ImmutableList.of());
      if (codeOwners.isEmpty()
          && !gitHubClient.fileExists(owner, repo, repoPath.get(), branch)) {
        return errorResult(
            String.format("file %s not found in %s/%s on branch %s", path, owner, repo, branch));
      }

      ObjectNode result = MAPPER.createObjectNode();
      result.put("owner", owner).put("repo", repo).put("branch", branch).put("path", path);
      ArrayNode owners = result.putArray("owners");
      codeOwners.forEach(codeOwner -> owners.add(codeOwner.identity()));
      return successResult(result);
    } catch (InvalidToolArgumentException
        | InvalidRepoPathException
        | CodeOwnersFileNotFoundException e) {
      return errorResult(e.getMessage());
    } catch (GitHubApiException e) {
      return gitHubErrorResult(e);
    } catch (RuntimeException e) {
      return internalErrorResult(GET_FILE_OWNER, e);
    }
  }

  @VisibleForTesting
  CallToolResult resolveOwners(Map<String, Object> args) {
    try {
      String owner = requireString(args, "owner");
      String repo = requireString(args, "repo");
      ImmutableList<String> paths = requireStringList(args, "paths");
      String branch = getBranch(args);

      CodeOwnersRuleSet ruleSet = codeOwnersFileCache.get(owner, repo, branch);
      ImmutableMap<String, ResolvedOwnership> resolvedOwnerships =
          codeOwnersResolver.resolveOwners(ruleSet, paths);

      ObjectNode result = MAPPER.createObjectNode();
      result.put("owner", owner).put("repo", repo).put("branch", branch);
      ArrayNode results = result.putArray("results");
      resolvedOwnerships.values().forEach(r -> results.add(toJson(r)));
      return successResult(result);
    } catch (InvalidToolArgumentException | CodeOwnersFileNotFoundException e) {
      return errorResult(e.getMessage());
    } catch (GitHubApiException e) {
      return gitHubErrorResult(e);
    } catch (TimeoutException e) {
      return errorResult("resolving the code owners timed out");
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return errorResult("resolving the code owners was interrupted");
    } catch (CodeOwnersInternalServerErrorException e) {
      logger.atSevere().withCause(e).log("%s failed", RESOLVE_OWNERS);
      return errorResult(e.getUserVisibleMessage());
    } catch (RuntimeException e) {
      return internalErrorResult(RESOLVE_OWNERS, e);
    }
  }

  @VisibleForTesting
  CallToolResult checkCodeOwners(Map<String, Object> args) {
    try {
      String owner = requireString(args, "owner");
      String repo = requireString(args, "repo");
      String branch = getBranch(args);

      CodeOwnersRuleSet ruleSet = codeOwnersFileCache.get(owner, repo, branch);

      ObjectNode result = MAPPER.createObjectNode();
      result.put("owner", owner).put("repo", repo).put("branch", branch);
      result.put("rules", ruleSet.rules().size());
      ArrayNode sources = result.putArray("sources");
      ruleSet.sourcePaths().forEach(sources::add);
      result.set("diagnostics", toJson(ruleSet.diagnostics()));
      return successResult(result);
    } catch (InvalidToolArgumentException | CodeOwnersFileNotFoundException e) {
      return errorResult(e.getMessage());
    } catch (GitHubApiException e) {
      return gitHubErrorResult(e);
    } catch (RuntimeException e) {
      return internalErrorResult(CHECK_CODEOWNERS, e);
    }
  }

  private static ObjectNode toJson(ResolvedOwnership resolvedOwnership) {
    ObjectNode json = MAPPER.createObjectNode();
    json.put("path", resolvedOwnership.path());
    ArrayNode individuals = json.putArray("individuals");
    resolvedOwnership.individuals().forEach(individuals::add);
    ArrayNode codeOwners = json.putArray("codeOwners");
    resolvedOwnership.codeOwners().forEach(codeOwner -> codeOwners.add(codeOwner.identity()));
    if (resolvedOwnership.winningRule().isPresent()) {
      CodeOwnersRule rule = resolvedOwnership.winningRule().get();
      json.putObject("winningRule")
          .put("index", rule.index())
          .put("pattern", rule.pattern().expression())
          .put("source", rule.sourcePath())
          .put("line", rule.lineNumber());
    } else {
      json.putNull("winningRule");
    }
    json.set("diagnostics", toJson(resolvedOwnership.diagnostics()));
    return json;
  }

  private static ArrayNode toJson(List<Diagnostic> diagnostics) {
    ArrayNode json = MAPPER.createArrayNode();
    for (Diagnostic diagnostic : diagnostics) {
      json.addObject()
          .put("kind", diagnostic.kind().name())
          .put("message", diagnostic.message());
    }
    return json;
  }

  private static String requireString(Map<String, Object> args, String name)
      throws InvalidToolArgumentException {
    Object value = args.get(name);
    if (!(value instanceof String) || ((String) value).trim().isEmpty()) {
      throw new InvalidToolArgumentException(String.format("%s is required", name));
    }
    return ((String) value).trim();
  }

  /** Like {@link #requireString}, but keeps surrounding whitespace, which is part of file names. */
  private static String requirePath(Map<String, Object> args, String name)
      throws InvalidToolArgumentException {
    requireString(args, name);
    return (String) args.get(name);
  }

  private static ImmutableList<String> requireStringList(Map<String, Object> args, String name)
      throws InvalidToolArgumentException {
    Object value = args.get(name);
    if (!(value instanceof List)) {
      throw new InvalidToolArgumentException(String.format("%s must be a list of paths", name));
    }
    ImmutableList.Builder<String> values = ImmutableList.builder();
    for (Object element : (List<?>) value) {
      if (!(element instanceof String)) {
        throw new InvalidToolArgumentException(
            String.format("%s must only contain strings, found: %s", name, element));
      }
      values.add((String) element);
    }
    return values.build();
  }

  private static String getBranch(Map<String, Object> args) throws InvalidToolArgumentException {
    return args.get("branch") == null ? DEFAULT_BRANCH : requireString(args, "branch");
  }

  private static CallToolResult successResult(ObjectNode result) {
    try {
      return new CallToolResult(
          ImmutableList.of(new TextContent(MAPPER.writeValueAsString(result))), false);
    } catch (JsonProcessingException e) {
      return internalErrorResult("serializing the result", e);
    }
  }

  private static CallToolResult gitHubErrorResult(GitHubApiException e) {
    logger.atWarning().withCause(e).log("GitHub API request failed");
    return errorResult("GitHub API request failed: " + e.getMessage());
  }

  private static CallToolResult internalErrorResult(String operation, Exception e) {
    logger.atSevere().withCause(e).log("%s failed", operation);
    return errorResult("internal error: " + e.getMessage());
  }

  @VisibleForTesting
  static CallToolResult errorResult(String message) {
    ObjectNode error = MAPPER.createObjectNode().put("error", message);
    String text;
    try {
      text = MAPPER.writeValueAsString(error);
    } catch (JsonProcessingException e) {
      text = message;
    }
    return new CallToolResult(ImmutableList.of(new TextContent(text)), true);
  }
}
