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

import static com.google.common.truth.Truth.assertThat;
import static io.github.mcpowners.testing.CodeOwnersRuleSetSubject.assertThat;

import com.google.common.collect.ImmutableList;
import io.github.mcpowners.util.RepoPath;
import org.junit.Test;

/** Tests for {@link CodeOwnersParser}. */
public class CodeOwnersParserTest {
  private static final String ROOT_FILE = ".github/CODEOWNERS";

  private final CodeOwnersParser codeOwnersParser = new CodeOwnersParser();

  @Test
  public void parseEmptyFile() throws Exception {
    CodeOwnersRuleSet ruleSet = parse("");
    assertThat(ruleSet).hasRuleCountThat().isEqualTo(0);
    assertThat(ruleSet).hasDiagnosticMessagesThat().isEmpty();
    assertThat(ruleSet.sourcePaths()).containsExactly(ROOT_FILE);
  }

  @Test
  public void commentsAndBlankLinesAreIgnored() throws Exception {
    CodeOwnersRuleSet ruleSet = parse("# comment\n\n   \n\t# indented comment\n*.js @alice\n");
    assertThat(ruleSet).hasPatternsThat().containsExactly("*.js");
    assertThat(ruleSet.rules().get(0).lineNumber()).isEqualTo(5);
    assertThat(ruleSet).hasDiagnosticMessagesThat().isEmpty();
  }

  @Test
  public void rulesAreKeptInDeclarationOrder() throws Exception {
    CodeOwnersRuleSet ruleSet = parse("* @default\n*.js @js-owner\n/docs/ @org/docs\n");
    assertThat(ruleSet).hasPatternsThat().containsExactly("*", "*.js", "/docs/").inOrder();
    for (int i = 0; i < ruleSet.rules().size(); i++) {
      CodeOwnersRule rule = ruleSet.rules().get(i);
      assertThat(rule.index()).isEqualTo(i);
      assertThat(rule.lineNumber()).isEqualTo(i + 1);
      assertThat(rule.sourcePath()).isEqualTo(ROOT_FILE);
    }
  }

  @Test
  public void ownersAreClassified() throws Exception {
    CodeOwnersRuleSet ruleSet = parse("*.md @alice @my-org/docs-team bob@example.com\n");
    assertThat(ruleSet).hasOwnersOfRuleThat(0)
        .containsExactly("@alice", "@my-org/docs-team", "bob@example.com")
        .inOrder();
    ImmutableList<CodeOwnerReference> owners = ruleSet.rules().get(0).owners();
    assertThat(owners.get(0).kind()).isEqualTo(CodeOwnerKind.INDIVIDUAL);
    assertThat(owners.get(1).kind()).isEqualTo(CodeOwnerKind.TEAM);
    assertThat(owners.get(2).kind()).isEqualTo(CodeOwnerKind.INDIVIDUAL);
  }

  @Test
  public void ruleWithoutOwnersIsKept() throws Exception {
    CodeOwnersRuleSet ruleSet = parse("* @alice\n/generated/\n");
    assertThat(ruleSet).hasRuleCountThat().isEqualTo(2);
    assertThat(ruleSet).hasOwnersOfRuleThat(1).isEmpty();
    assertThat(ruleSet).hasDiagnosticMessagesThat().isEmpty();
  }

  @Test
  public void trailingCommentIsIgnored() throws Exception {
    CodeOwnersRuleSet ruleSet = parse("*.go @gopher # Go files\n");
    assertThat(ruleSet).hasOwnersOfRuleThat(0).containsExactly("@gopher");
  }

  @Test
  public void invalidOwnerIsDroppedWithDiagnostic() throws Exception {
    CodeOwnersRuleSet ruleSet = parse("*.js @alice not-an-owner @org/\n");
    assertThat(ruleSet).hasOwnersOfRuleThat(0).containsExactly("@alice");
    assertThat(ruleSet)
        .hasDiagnosticMessagesThat()
        .containsExactly(
            ".github/CODEOWNERS:1: invalid owner 'not-an-owner'",
            ".github/CODEOWNERS:1: invalid owner '@org/'")
        .inOrder();
    assertThat(ruleSet.diagnostics().get(0).kind())
        .isEqualTo(Diagnostic.Kind.MALFORMED_DECLARATION);
  }

  @Test
  public void lineWithInvalidPatternIsDroppedWithDiagnostic() throws Exception {
    CodeOwnersRuleSet ruleSet = parse("* @alice\na/../b @bob\n*.js @carol\n");
    assertThat(ruleSet).hasPatternsThat().containsExactly("*", "*.js").inOrder();
    assertThat(ruleSet.rules().get(1).index()).isEqualTo(1);
    assertThat(ruleSet.rules().get(1).lineNumber()).isEqualTo(3);
    assertThat(ruleSet).hasDiagnosticMessagesThat().hasSize(1);
    assertThat(ruleSet.diagnostics().get(0).message()).startsWith(".github/CODEOWNERS:2: ");
  }

  @Test
  public void escapedWhitespaceIsPartOfPattern() throws Exception {
    CodeOwnersRuleSet ruleSet = parse("my\\ file.txt @alice\n");
    assertThat(ruleSet).hasPatternsThat().containsExactly("my\\ file.txt");
    assertThat(ruleSet.findWinningRule(RepoPath.parse("my file.txt"))).isPresent();
  }

  @Test
  public void escapedHashIsNotAComment() throws Exception {
    CodeOwnersRuleSet ruleSet = parse("\\#notes @alice\n");
    assertThat(ruleSet).hasPatternsThat().containsExactly("\\#notes");
  }

  @Test
  public void byteOrderMarkAndWindowsLineEndingsAreHandled() throws Exception {
    CodeOwnersRuleSet ruleSet = parse("\uFEFF* @alice\r\n*.js @bob\r\n");
    assertThat(ruleSet).hasPatternsThat().containsExactly("*", "*.js").inOrder();
    assertThat(ruleSet).hasOwnersOfRuleThat(1).containsExactly("@bob");
  }

  @Test
  public void tokenize() throws Exception {
    assertThat(CodeOwnersParser.tokenize("  *.js   @a\t@b  ")).containsExactly("*.js", "@a", "@b");
    assertThat(CodeOwnersParser.tokenize("a\\ b @c")).containsExactly("a\\ b", "@c");
    assertThat(CodeOwnersParser.tokenize("a @b #c @d")).containsExactly("a", "@b");
    assertThat(CodeOwnersParser.tokenize("a@b#c")).containsExactly("a@b#c");
    assertThat(CodeOwnersParser.tokenize("# only a comment")).isEmpty();
    assertThat(CodeOwnersParser.tokenize("")).isEmpty();
  }

  @Test
  public void nestedFileIsScopedToItsDirectory() throws Exception {
    CodeOwnersRuleSet ruleSet =
        codeOwnersParser.parse(CodeOwnersFile.create("src/web/CODEOWNERS", "*.css @designer\n"));
    assertThat(ruleSet.findWinningRule(RepoPath.parse("src/web/app.css"))).isPresent();
    assertThat(ruleSet.findWinningRule(RepoPath.parse("src/web/styles/app.css"))).isPresent();
    assertThat(ruleSet.findWinningRule(RepoPath.parse("src/app.css"))).isEmpty();
  }

  @Test
  public void filesAreMergedFromBroadToSpecific() throws Exception {
    CodeOwnersRuleSet ruleSet =
        codeOwnersParser.parse(
            ImmutableList.of(
                CodeOwnersFile.create("src/CODEOWNERS", "*.java @java-owner\n"),
                CodeOwnersFile.create(".github/CODEOWNERS", "* @default\n*.java @root-java\n")));
    assertThat(ruleSet.sourcePaths())
        .containsExactly(".github/CODEOWNERS", "src/CODEOWNERS")
        .inOrder();
    assertThat(ruleSet).hasPatternsThat().containsExactly("*", "*.java", "*.java").inOrder();
    assertThat(ruleSet.rules().get(2).index()).isEqualTo(2);

    CodeOwnersRule winningRule = ruleSet.findWinningRule(RepoPath.parse("src/Main.java")).get();
    assertThat(winningRule.sourcePath()).isEqualTo("src/CODEOWNERS");
    winningRule = ruleSet.findWinningRule(RepoPath.parse("lib/Util.java")).get();
    assertThat(winningRule.sourcePath()).isEqualTo(".github/CODEOWNERS");
  }

  @Test
  public void rootLocationsApplyToWholeRepository() throws Exception {
    for (String location : CodeOwnersFile.ROOT_LOCATIONS) {
      assertThat(CodeOwnersFile.create(location, "").scope()).isEmpty();
    }
    assertThat(CodeOwnersFile.create("a/b/CODEOWNERS", "").scope())
        .containsExactly("a", "b")
        .inOrder();
  }

  private CodeOwnersRuleSet parse(String content) {
    return codeOwnersParser.parse(CodeOwnersFile.create(ROOT_FILE, content));
  }
}
