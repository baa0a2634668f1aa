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

import static java.util.Objects.requireNonNull;

import com.google.auto.value.AutoValue;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import io.github.mcpowners.backend.CodeOwnersFile;
import io.github.mcpowners.backend.CodeOwnersParser;
import io.github.mcpowners.backend.CodeOwnersRuleSet;
import io.github.mcpowners.config.McpOwnersConfig;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Cache for the parsed CODEOWNERS files of repository branches.
 *
 * <p>Entries are keyed by {@code owner/repo@branch}. Within the configured TTL an entry is served
 * without contacting GitHub. Once the TTL has expired the entry is revalidated with its ETag, so
 * that an unchanged file is neither downloaded nor parsed again.
 *
 * <p>The CODEOWNERS file of a branch is the first file that exists in {@link
 * CodeOwnersFile#ROOT_LOCATIONS}.
 */
@Singleton
public class CodeOwnersFileCache {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final GitHubClient gitHubClient;
  private final CodeOwnersParser codeOwnersParser;
  private final Ticker ticker;
  private final Duration ttl;

  // guarded by this
  private final Map<String, Entry> entries = new HashMap<>();

  @Inject
  CodeOwnersFileCache(
      GitHubClient gitHubClient, CodeOwnersParser codeOwnersParser, McpOwnersConfig config) {
    this(gitHubClient, codeOwnersParser, Ticker.systemTicker(), config.getCacheTtl());
  }

  @VisibleForTesting
  public CodeOwnersFileCache(
      GitHubClient gitHubClient, CodeOwnersParser codeOwnersParser, Ticker ticker, Duration ttl) {
    this.gitHubClient = requireNonNull(gitHubClient, "gitHubClient");
    this.codeOwnersParser = requireNonNull(codeOwnersParser, "codeOwnersParser");
    this.ticker = requireNonNull(ticker, "ticker");
    this.ttl = requireNonNull(ttl, "ttl");
  }

  /** The cache key for the CODEOWNERS file of a branch. */
  public static String key(String owner, String repo, String branch) {
    return String.format("%s/%s@%s", owner, repo, branch);
  }

  /**
   * Returns the parsed CODEOWNERS file of a branch.
   *
   * @param owner the owner of the repository
   * @param repo the name of the repository
   * @param branch the branch
   * @return the rules of the CODEOWNERS file
   * @throws CodeOwnersFileNotFoundException if the branch contains no CODEOWNERS file
   * @throws GitHubApiException if fetching the CODEOWNERS file failed
   */
  public synchronized CodeOwnersRuleSet get(String owner, String repo, String branch)
      throws CodeOwnersFileNotFoundException, GitHubApiException {
    String key = key(owner, repo, branch);
    Entry entry = entries.get(key);
    long now = ticker.read();

    if (entry != null) {
      if (now - entry.fetchedAtNanos() < ttl.toNanos()) {
        logger.atFine().log("serving CODEOWNERS of %s from cache", key);
        return entry.ruleSet();
      }

      logger.atFine().log("revalidating CODEOWNERS of %s", key);
      FileFetchResult result =
          gitHubClient.fetchFile(owner, repo, entry.sourcePath(), branch, entry.etag());
      switch (result.status()) {
        case NOT_MODIFIED:
          entries.put(key, entry.refresh(now));
          return entry.ruleSet();
        case FOUND:
          return store(key, entry.sourcePath(), result, now);
        case NOT_FOUND:
          // The file was moved or deleted, look it up again.
          entries.remove(key);
          break;
      }
    }

    for (String location : CodeOwnersFile.ROOT_LOCATIONS) {
      FileFetchResult result =
          gitHubClient.fetchFile(owner, repo, location, branch, Optional.empty());
      if (result.status() == FileFetchResult.Status.FOUND) {
        return store(key, location, result, now);
      }
    }
    logger.atFine().log("no CODEOWNERS file found for %s", key);
    throw new CodeOwnersFileNotFoundException(owner, repo, branch);
  }

  private CodeOwnersRuleSet store(String key, String location, FileFetchResult result, long now) {
    CodeOwnersRuleSet ruleSet =
        codeOwnersParser.parse(CodeOwnersFile.create(location, result.content().get()));
    logger.atFine().log(
        "cached %s of %s (%d rules, etag = %s)",
        location, key, ruleSet.rules().size(), result.etag().orElse(null));
    entries.put(key, Entry.create(location, ruleSet, result.etag(), now));
    return ruleSet;
  }

  /** Removes the entry with the given key, so that the next access fetches the file again. */
  public synchronized void invalidate(String key) {
    requireNonNull(key, "key");
    if (entries.remove(key) != null) {
      logger.atFine().log("invalidated %s", key);
    }
  }

  /** Removes all entries. */
  public synchronized void invalidateAll() {
    logger.atFine().log("invalidating %d entries", entries.size());
    entries.clear();
  }

  @VisibleForTesting
  synchronized int size() {
    return entries.size();
  }

  @AutoValue
  abstract static class Entry {
    /** The location of the CODEOWNERS file in the repository. */
    abstract String sourcePath();

    abstract CodeOwnersRuleSet ruleSet();

    abstract Optional<String> etag();

    /** Ticker value at which the entry was fetched or last revalidated. */
    abstract long fetchedAtNanos();

    Entry refresh(long now) {
      return create(sourcePath(), ruleSet(), etag(), now);
    }

    static Entry create(
        String sourcePath, CodeOwnersRuleSet ruleSet, Optional<String> etag, long fetchedAtNanos) {
      return new AutoValue_CodeOwnersFileCache_Entry(sourcePath, ruleSet, etag, fetchedAtNanos);
    }
  }
}
