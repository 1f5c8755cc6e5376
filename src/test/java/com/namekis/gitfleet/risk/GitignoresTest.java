package com.namekis.gitfleet.risk;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GitignoresTest {
  @TempDir
  Path repo;

  @Test
  void cleanTrimsDedupesAndSorts() {
    assertThat(Gitignores.clean(List.of(" target/ ", "", "dist/", "target/"))).containsExactly("dist/", "target/");
  }

  @Test
  void generatesFileWhenMissing() throws IOException {
    Gitignores.writeOrAppend(repo, List.of("target/", "node_modules/"));

    assertThat(Files.readString(repo.resolve(".gitignore")))
      .isEqualTo("# Generated by gitfleet fix\nnode_modules/\ntarget/\n");
  }

  @Test
  void appendsOnlyMissingPatterns() throws IOException {
    Files.writeString(repo.resolve(".gitignore"), "*.log\ntarget/");

    Gitignores.writeOrAppend(repo, List.of("target/", "dist/"));

    assertThat(Files.readString(repo.resolve(".gitignore"))).isEqualTo("*.log\ntarget/\n# Added by gitfleet fix\ndist/\n");
  }

  @Test
  void leavesFileAloneWhenNothingIsMissing() throws IOException {
    Files.writeString(repo.resolve(".gitignore"), "dist/\n");

    Gitignores.writeOrAppend(repo, List.of("dist/"));

    assertThat(Files.readString(repo.resolve(".gitignore"))).isEqualTo("dist/\n");
    assertThat(Gitignores.missingPatterns(repo, List.of("dist/", "build/"))).containsExactly("build/");
  }
}
