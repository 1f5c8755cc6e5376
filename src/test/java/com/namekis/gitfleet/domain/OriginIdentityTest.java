package com.namekis.gitfleet.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class OriginIdentityTest {
  @Test
  void normalizesScpLikeAndHttpsToTheSameIdentity() {
    assertThat(OriginIdentity.normalize("git@github.com:Acme/Tool.git")).isEqualTo("github.com/acme/tool");
    assertThat(OriginIdentity.normalize("https://GitHub.com/acme/tool/")).isEqualTo("github.com/acme/tool");
    assertThat(OriginIdentity.normalize("ssh://git@github.com/acme/tool.git")).isEqualTo("github.com/acme/tool");
  }

  @Test
  void normalizesLocalPaths() {
    assertThat(OriginIdentity.normalize("/srv/git/tool.git")).isEqualTo("file/srv/git/tool");
    assertThat(OriginIdentity.normalize("file:///srv/git/tool.git")).isEqualTo("file/srv/git/tool");
  }

  @Test
  void rejectsEmptyOrSchemeless() {
    assertThatThrownBy(() -> OriginIdentity.normalize("  ")).isInstanceOf(IllegalArgumentException.class).hasMessage("empty origin");
    assertThatThrownBy(() -> OriginIdentity.normalize("tool")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void sameRepositoryIsFalseForUnparseable() {
    assertThat(OriginIdentity.sameRepository("git@github.com:acme/tool.git", "https://github.com/acme/tool")).isTrue();
    assertThat(OriginIdentity.sameRepository("git@github.com:acme/tool.git", "https://github.com/other/tool")).isFalse();
    assertThat(OriginIdentity.sameRepository("", "")).isFalse();
  }
}
