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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import io.github.mcpowners.config.InvalidConfigurationException;
import io.github.mcpowners.config.McpOwnersConfig;
import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

/**
 * Client for the parts of the GitHub REST API that are needed to resolve code owners.
 *
 * <p>File contents are fetched synchronously, team listings are fetched asynchronously so that the
 * members of different teams can be looked up concurrently.
 */
@Singleton
public class GitHubClient {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  @VisibleForTesting static final String ACCEPT_RAW = "application/vnd.github.v3.raw";
  @VisibleForTesting static final String ACCEPT_JSON = "application/vnd.github.v3+json";

  private static final String USER_AGENT = "mcp-github-owners";
  private static final int PAGE_SIZE = 100;

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final Splitter LINK_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();
  private static final Pattern NEXT_LINK = Pattern.compile("<([^>]+)>\\s*;\\s*rel=\"next\"");

  private final OkHttpClient httpClient;
  private final HttpUrl apiUrl;
  private final Optional<String> token;

  @Inject
  GitHubClient(OkHttpClient httpClient, McpOwnersConfig config) {
    this(httpClient, parseApiUrl(config.getGitHubApiUrl()), config.getGitHubToken());
  }

  @VisibleForTesting
  public GitHubClient(OkHttpClient httpClient, HttpUrl apiUrl, Optional<String> token) {
    this.httpClient = requireNonNull(httpClient, "httpClient");
    this.apiUrl = requireNonNull(apiUrl, "apiUrl");
    this.token = requireNonNull(token, "token");
  }

  private static HttpUrl parseApiUrl(String apiUrl) {
    try {
      return HttpUrl.get(apiUrl);
    } catch (IllegalArgumentException e) {
      throw new InvalidConfigurationException(
          String.format("GitHub API URL '%s' is invalid.", apiUrl), e);
    }
  }

  /**
   * Fetches the raw content of a file.
   *
   * @param owner the owner of the repository
   * @param repo the name of the repository
   * @param path the path of the file in the repository
   * @param branch the branch from which the file should be fetched
   * @param etag the ETag of the version of the file that the caller already has, if any
   * @return the fetched file, {@link FileFetchResult.Status#NOT_MODIFIED} if the file still has
   *     the given ETag, {@link FileFetchResult.Status#NOT_FOUND} if the file doesn't exist
   * @throws GitHubApiException if the request failed
   */
  public FileFetchResult fetchFile(
      String owner, String repo, String path, String branch, Optional<String> etag)
      throws GitHubApiException {
    requireNonNull(etag, "etag");
    Request request = newRequest(contentsUrl(owner, repo, path, branch), ACCEPT_RAW, etag);
    logger.atFine().log("fetching %s (etag = %s)", request.url(), etag.orElse(null));
    try (Response response = httpClient.newCall(request).execute()) {
      switch (response.code()) {
        case 200:
          return FileFetchResult.found(
              response.body().string(), Optional.ofNullable(response.header("ETag")));
        case 304:
          return FileFetchResult.notModified(etag);
        case 404:
          return FileFetchResult.notFound();
        default:
          throw newStatusException(request, response);
      }
    } catch (IOException e) {
      throw newRequestException(request, e);
    }
  }

  /**
   * Checks whether a file exists.
   *
   * @return {@code true} if the file exists on the branch, {@code false} if it doesn't exist
   * @throws GitHubApiException if the request failed
   */
  public boolean fileExists(String owner, String repo, String path, String branch)
      throws GitHubApiException {
    Request request =
        newRequest(contentsUrl(owner, repo, path, branch), ACCEPT_JSON, Optional.empty());
    try (Response response = httpClient.newCall(request).execute()) {
      switch (response.code()) {
        case 200:
          return true;
        case 404:
          return false;
        default:
          throw newStatusException(request, response);
      }
    } catch (IOException e) {
      throw newRequestException(request, e);
    }
  }

  /**
   * Lists the users that are members of a team.
   *
   * <p>The returned future fails with a {@link GitHubApiException} if a request failed. Cancelling
   * it cancels the request that is in flight.
   *
   * @param org the organization that owns the team
   * @param teamSlug the slug of the team
   * @return future providing the user objects from all result pages
   */
  public CompletableFuture<ImmutableList<JsonNode>> listTeamMembers(String org, String teamSlug) {
    return listAllPages(
        teamUrl(org, teamSlug)
            .addPathSegment("members")
            .addQueryParameter("role", "all")
            .addQueryParameter("per_page", Integer.toString(PAGE_SIZE))
            .build());
  }

  /**
   * Lists the teams that are direct children of a team.
   *
   * @param org the organization that owns the team
   * @param teamSlug the slug of the team
   * @return future providing the team objects from all result pages
   * @see #listTeamMembers(String, String)
   */
  public CompletableFuture<ImmutableList<JsonNode>> listChildTeams(String org, String teamSlug) {
    return listAllPages(
        teamUrl(org, teamSlug)
            .addPathSegment("teams")
            .addQueryParameter("per_page", Integer.toString(PAGE_SIZE))
            .build());
  }

  private HttpUrl contentsUrl(String owner, String repo, String path, String branch) {
    requireNonNull(owner, "owner");
    requireNonNull(repo, "repo");
    requireNonNull(path, "path");
    requireNonNull(branch, "branch");
    return apiUrl
        .newBuilder()
        .addPathSegment("repos")
        .addPathSegment(owner)
        .addPathSegment(repo)
        .addPathSegment("contents")
        .addPathSegments(path)
        .addQueryParameter("ref", branch)
        .build();
  }

  private HttpUrl.Builder teamUrl(String org, String teamSlug) {
    requireNonNull(org, "org");
    requireNonNull(teamSlug, "teamSlug");
    return apiUrl
        .newBuilder()
        .addPathSegment("orgs")
        .addPathSegment(org)
        .addPathSegment("teams")
        .addPathSegment(teamSlug);
  }

  private Request newRequest(HttpUrl url, String accept, Optional<String> etag) {
    Request.Builder request =
        new Request.Builder().url(url).header("Accept", accept).header("User-Agent", USER_AGENT);
    token.ifPresent(t -> request.header("Authorization", "token " + t));
    etag.ifPresent(e -> request.header("If-None-Match", e));
    return request.get().build();
  }

  private CompletableFuture<ImmutableList<JsonNode>> listAllPages(HttpUrl firstPage) {
    CompletableFuture<ImmutableList<JsonNode>> result = new CompletableFuture<>();
    AtomicReference<Call> currentCall = new AtomicReference<>();
    result.whenComplete(
        (items, error) -> {
          Call call = currentCall.get();
          if (result.isCancelled() && call != null) {
            logger.atFine().log("cancelling %s", call.request().url());
            call.cancel();
          }
        });
    fetchPage(firstPage, ImmutableList.builder(), currentCall, result);
    return result;
  }

  private void fetchPage(
      HttpUrl url,
      ImmutableList.Builder<JsonNode> items,
      AtomicReference<Call> currentCall,
      CompletableFuture<ImmutableList<JsonNode>> result) {
    Request request = newRequest(url, ACCEPT_JSON, Optional.empty());
    Call call = httpClient.newCall(request);
    currentCall.set(call);
    if (result.isDone()) {
      return;
    }

    logger.atFine().log("fetching %s", url);
    call.enqueue(
        new Callback() {
          @Override
          public void onFailure(Call call, IOException e) {
            result.completeExceptionally(newRequestException(request, e));
          }

          @Override
          public void onResponse(Call call, Response response) {
            try (Response r = response) {
              if (!r.isSuccessful()) {
                result.completeExceptionally(newStatusException(request, r));
                return;
              }
              JsonNode page = MAPPER.readTree(r.body().string());
              if (!page.isArray()) {
                result.completeExceptionally(
                    new GitHubApiException(
                        String.format("GET %s didn't return a list", request.url()), r.code()));
                return;
              }
              page.forEach(items::add);
              Optional<HttpUrl> nextPage = getNextPage(r.header("Link"));
              if (nextPage.isPresent()) {
                fetchPage(nextPage.get(), items, currentCall, result);
              } else {
                result.complete(items.build());
              }
            } catch (IOException | RuntimeException e) {
              result.completeExceptionally(newRequestException(request, e));
            }
          }
        });
  }

  /** Extracts the URL of the next result page from a {@code Link} header. */
  @VisibleForTesting
  static Optional<HttpUrl> getNextPage(String linkHeader) {
    if (linkHeader == null) {
      return Optional.empty();
    }
    for (String link : LINK_SPLITTER.split(linkHeader)) {
      Matcher matcher = NEXT_LINK.matcher(link);
      if (matcher.matches()) {
        return Optional.ofNullable(HttpUrl.parse(matcher.group(1)));
      }
    }
    return Optional.empty();
  }

  private static GitHubApiException newStatusException(Request request, Response response) {
    logger.atWarning().log(
        "%s %s failed with status %d", request.method(), request.url(), response.code());
    return new GitHubApiException(
        String.format(
            "%s %s failed with status %d %s",
            request.method(), request.url().encodedPath(), response.code(), response.message()),
        response.code());
  }

  private static GitHubApiException newRequestException(Request request, Exception e) {
    return new GitHubApiException(
        String.format(
            "%s %s failed: %s", request.method(), request.url().encodedPath(), e.getMessage()),
        e);
  }
}
