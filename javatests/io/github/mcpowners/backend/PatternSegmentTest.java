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
import static org.junit.Assert.assertThrows;

import com.google.common.base.Strings;
import org.junit.Test;

/** Tests for {@link PatternSegment}. */
public class PatternSegmentTest {
  @Test
  public void segmentWithoutWildcardIsLiteral() throws Exception {
    PatternSegment segment = PatternSegment.compile("BUILD");
    assertThat(segment.kind()).isEqualTo(PatternSegment.Kind.LITERAL);
    assertThat(segment.text()).isEqualTo("BUILD");
    assertThat(segment.matches("BUILD")).isTrue();
    assertThat(segment.matches("build")).isFalse();
    assertThat(segment.matches("BUILD2")).isFalse();
  }

  @Test
  public void escapedWildcardsAreLiteral() throws Exception {
    PatternSegment segment = PatternSegment.compile("foo\\*bar\\?");
    assertThat(segment.kind()).isEqualTo(PatternSegment.Kind.LITERAL);
    assertThat(segment.text()).isEqualTo("foo*bar?");
    assertThat(segment.matches("foo*bar?")).isTrue();
    assertThat(segment.matches("fooXbarY")).isFalse();
  }

  @Test
  public void escapedHashIsLiteral() throws Exception {
    PatternSegment segment = PatternSegment.compile("\\#notes");
    assertThat(segment).isEqualTo(PatternSegment.literal("#notes"));
  }

  @Test
  public void starMatchesAnyString() throws Exception {
    PatternSegment segment = PatternSegment.compile("*.md");
    assertThat(segment.kind()).isEqualTo(PatternSegment.Kind.WILDCARD);
    assertThat(segment.matches("README.md")).isTrue();
    assertThat(segment.matches(".md")).isTrue();
    assertThat(segment.matches("README.md5")).isFalse();
    assertThat(segment.matches("README")).isFalse();
  }

  @Test
  public void questionMarkMatchesSingleCharacter() throws Exception {
    PatternSegment segment = PatternSegment.compile("v?.txt");
    assertThat(segment.matches("v1.txt")).isTrue();
    assertThat(segment.matches("v.txt")).isFalse();
    assertThat(segment.matches("v12.txt")).isFalse();
  }

  @Test
  public void multipleStarsRequireBacktracking() throws Exception {
    PatternSegment segment = PatternSegment.compile("a*b*c");
    assertThat(segment.matches("abc")).isTrue();
    assertThat(segment.matches("aXbYc")).isTrue();
    assertThat(segment.matches("abbbcbc")).isTrue();
    assertThat(segment.matches("abcb")).isFalse();
    assertThat(segment.matches("acb")).isFalse();
  }

  @Test
  public void consecutiveStarsAreCollapsed() throws Exception {
    assertThat(PatternSegment.compile("a**b")).isEqualTo(PatternSegment.compile("a*b"));
    assertThat(PatternSegment.compile("a**b").text()).isEqualTo("a*b");
  }

  @Test
  public void longSegmentWithManyStarsIsMatchedQuickly() throws Exception {
    PatternSegment segment = PatternSegment.compile("*a*a*a*a*a*a*a*a*b");
    assertThat(segment.matches(Strings.repeat("a", 5000))).isFalse();
    assertThat(segment.matches(Strings.repeat("a", 5000) + "b")).isTrue();
  }

  @Test
  public void cannotCompileDanglingEscape() throws Exception {
    InvalidPatternException exception =
        assertThrows(InvalidPatternException.class, () -> PatternSegment.compile("foo\\"));
    assertThat(exception).hasMessageThat().contains("dangling escape character");
  }

  @Test
  public void doubleWildcardCannotMatchSingleSegment() throws Exception {
    assertThrows(IllegalStateException.class, () -> PatternSegment.doubleWildcard().matches("a"));
  }
}
