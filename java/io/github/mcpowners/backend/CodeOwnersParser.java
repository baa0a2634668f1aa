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

package io.github.mcpowners.backend;

import static java.util.Comparator.comparingInt;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Singleton;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parser for the CODEOWNERS syntax that is used by GitHub.
 *
 * <p>Each non-blank line that is not a comment declares a rule: a path pattern followed by zero or
 * more owners, separated by whitespace. Whitespace in patterns must be escaped with '\'. A token
 * starting with '#' starts a comment that runs until the end of the line.
 *
 * <p>Parsing never fails as a whole:
 *
 * <ul>
 *   <li>Lines with an invalid pattern are dropped.
 *   <li>Owner tokens that are neither a login, a team nor an email are dropped, the rule keeps the
 *       valid owners (if no valid owner remains, matching paths are unowned).
 * </ul>
 *
 * <p>Both cases are reported as {@link Diagnostic.Kind#MALFORMED_DECLARATION} diagnostics in the
 * returned {@link CodeOwnersRuleSet}.
 */
@Singleton
public class CodeOwnersParser {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Any Unicode linebreak sequence. */
  private static final String LINEBREAK_MATCHER = "\\R";

  private static final char BYTE_ORDER_MARK = '\uFEFF';

  /**
   * Parses a single code owners file.
   *
   * @param codeOwnersFile the code owners file
   * @return the rules of the file in declaration order
   */
  public CodeOwnersRuleSet parse(CodeOwnersFile codeOwnersFile) {
    return parse(ImmutableList.of(requireNonNull(codeOwnersFile, "codeOwnersFile")));
  }

  /**
   * Parses multiple code owners files into a single rule set.
   *
   * <p>The rules of broader files come first so that the rules of more specific files win: files
   * are ordered by the depth of the directory they apply to, files with the same depth keep the
   * given order.
   *
   * @param codeOwnersFiles the code owners files
   * @return the merged rules
   */
  public CodeOwnersRuleSet parse(List<CodeOwnersFile> codeOwnersFiles) {
    requireNonNull(codeOwnersFiles, "codeOwnersFiles");

    List<CodeOwnersFile> orderedFiles = new ArrayList<>(codeOwnersFiles);
    orderedFiles.sort(comparingInt(codeOwnersFile -> codeOwnersFile.scope().size()));

    ImmutableList.Builder<String> sourcePaths = ImmutableList.builder();
    List<CodeOwnersRule> rules = new ArrayList<>();
    List<Diagnostic> diagnostics = new ArrayList<>();
    for (CodeOwnersFile codeOwnersFile : orderedFiles) {
      sourcePaths.add(codeOwnersFile.path());
      parseFile(codeOwnersFile, rules, diagnostics);
    }

    CodeOwnersRuleSet ruleSet = CodeOwnersRuleSet.create(sourcePaths.build(), rules, diagnostics);
    logger.atFine().log(
        "parsed %d rules from %s (%d diagnostics)",
        rules.size(), ruleSet.sourcePaths(), diagnostics.size());
    return ruleSet;
  }

  private static void parseFile(
      CodeOwnersFile codeOwnersFile, List<CodeOwnersRule> rules, List<Diagnostic> diagnostics) {
    String content = codeOwnersFile.content();
    if (!content.isEmpty() && content.charAt(0) == BYTE_ORDER_MARK) {
      content = content.substring(1);
    }

    int lineNumber = 0;
    for (String line : Splitter.onPattern(LINEBREAK_MATCHER).split(content)) {
      lineNumber++;
      parseLine(codeOwnersFile, lineNumber, line, rules.size(), diagnostics)
          .ifPresent(rules::add);
    }
  }

  private static Optional<CodeOwnersRule> parseLine(
      CodeOwnersFile codeOwnersFile,
      int lineNumber,
      String line,
      int index,
      List<Diagnostic> diagnostics) {
    ImmutableList<String> tokens = tokenize(line);
    if (tokens.isEmpty()) {
      // ignore comment lines and empty lines
      return Optional.empty();
    }

    String sourcePath = codeOwnersFile.path();
    CodeOwnersPattern pattern;
    try {
      pattern = CodeOwnersPattern.parse(tokens.get(0), codeOwnersFile.scope());
    } catch (InvalidPatternException e) {
      logger.atFine().log("%s:%d: %s", sourcePath, lineNumber, e.getMessage());
      diagnostics.add(Diagnostic.malformedDeclaration(sourcePath, lineNumber, e.getMessage()));
      return Optional.empty();
    }

    ImmutableList.Builder<CodeOwnerReference> owners = ImmutableList.builder();
    for (String token : tokens.subList(1, tokens.size())) {
      Optional<CodeOwnerReference> owner = CodeOwnerReference.parse(token);
      if (owner.isPresent()) {
        owners.add(owner.get());
      } else {
        logger.atFine().log("%s:%d: invalid owner %s", sourcePath, lineNumber, token);
        diagnostics.add(
            Diagnostic.malformedDeclaration(
                sourcePath, lineNumber, String.format("invalid owner '%s'", token)));
      }
    }

    return Optional.of(
        CodeOwnersRule.builder()
            .setIndex(index)
            .setPattern(pattern)
            .setOwners(owners.build())
            .setSourcePath(sourcePath)
            .setLineNumber(lineNumber)
            .build());
  }

  /**
   * Splits a line at unescaped whitespace, dropping the comment part of the line.
   *
   * <p>Escape characters are kept in the tokens, they are interpreted when the pattern is compiled.
   *
   * @param line the line
   * @return the tokens of the line, empty for blank and comment lines
   */
  static ImmutableList<String> tokenize(String line) {
    ImmutableList.Builder<String> tokens = ImmutableList.builder();
    StringBuilder token = new StringBuilder();
    for (int i = 0; i < line.length(); i++) {
      char c = line.charAt(i);
      if (c == '\\' && i + 1 < line.length()) {
        token.append(c).append(line.charAt(++i));
      } else if (Character.isWhitespace(c)) {
        if (token.length() > 0) {
          tokens.add(token.toString());
          token = new StringBuilder();
        }
      } else if (c == '#' && token.length() == 0) {
        // the rest of the line is a comment
        break;
      } else {
        token.append(c);
      }
    }
    if (token.length() > 0) {
      tokens.add(token.toString());
    }
    return tokens.build();
  }
}
