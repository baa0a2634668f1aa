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

import org.junit.Test;

/** Tests for {@link CodeOwnerReference}. */
public class CodeOwnerReferenceTest {
  @Test
  public void parseLogin() throws Exception {
    CodeOwnerReference owner = CodeOwnerReference.parse("@octo-cat").get();
    assertThat(owner.kind()).isEqualTo(CodeOwnerKind.INDIVIDUAL);
    assertThat(owner.identity()).isEqualTo("@octo-cat");
    assertThat(owner.isTeam()).isFalse();
  }

  @Test
  public void parseEmail() throws Exception {
    CodeOwnerReference owner = CodeOwnerReference.parse("jane.doe@example.com").get();
    assertThat(owner.kind()).isEqualTo(CodeOwnerKind.INDIVIDUAL);
    assertThat(owner.identity()).isEqualTo("jane.doe@example.com");
  }

  @Test
  public void parseTeam() throws Exception {
    CodeOwnerReference owner = CodeOwnerReference.parse("@my-org/platform.core_team").get();
    assertThat(owner.kind()).isEqualTo(CodeOwnerKind.TEAM);
    assertThat(owner.isTeam()).isTrue();
    assertThat(owner.organization()).isEqualTo("my-org");
    assertThat(owner.teamSlug()).isEqualTo("platform.core_team");
  }

  @Test
  public void parseInvalidTokens() throws Exception {
    assertThat(CodeOwnerReference.parse("alice")).isEmpty();
    assertThat(CodeOwnerReference.parse("@")).isEmpty();
    assertThat(CodeOwnerReference.parse("@-alice")).isEmpty();
    assertThat(CodeOwnerReference.parse("@org/")).isEmpty();
    assertThat(CodeOwnerReference.parse("@org/team/sub")).isEmpty();
    assertThat(CodeOwnerReference.parse("alice@localhost")).isEmpty();
    assertThat(CodeOwnerReference.parse("")).isEmpty();
  }

  @Test
  public void cannotGetOrganizationOfIndividual() throws Exception {
    CodeOwnerReference owner = CodeOwnerReference.individual("@alice");
    IllegalStateException exception =
        assertThrows(IllegalStateException.class, () -> owner.organization());
    assertThat(exception).hasMessageThat().isEqualTo("@alice is not a team");
  }

  @Test
  public void referencesAreOrderedByIdentity() throws Exception {
    assertThat(CodeOwnerReference.individual("@bob"))
        .isGreaterThan(CodeOwnerReference.individual("@alice"));
    assertThat(CodeOwnerReference.team("@org/a"))
        .isLessThan(CodeOwnerReference.team("@org/b"));
  }

  @Test
  public void toStringReturnsIdentity() throws Exception {
    assertThat(CodeOwnerReference.team("@org/team").toString()).isEqualTo("@org/team");
  }
}
