package com.namekis.gitfleet.risk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.namekis.gitfleet.git.FakeGitClient;

class GitRiskCollectorTest {
  @TempDir
  Path repo;

  @Test
  void classifiesPorcelainStatusCodes() {
    var entries = GitRiskCollector.parseStatusPorcelain("""
         M src/App.java
        A  src/New.java
         D old.txt
        R  a.txt -> b.txt
        ?? notes.md
        """);

    assertThat(entries).extracting(GitRiskCollector.StatusEntry::path, GitRiskCollector.StatusEntry::status)
      .containsExactly(
        tuple("src/App.java", "modified"),
        tuple("src/New.java", "added"),
        tuple("old.txt", "deleted"),
        tuple("b.txt", "renamed"),
        tuple("notes.md", "untracked"));
  }

  @Test
  void numstatSkipsBinaryAndSumsStagedWithUnstaged() {
    Map<String, GitRiskCollector.Counts> stats = new HashMap<>();
    GitRiskCollector.mergeNumstat(stats, "3\t1\tsrc/App.java\n-\t-\tlogo.png\n");
    GitRiskCollector.mergeNumstat(stats, "2\t0\tsrc/App.java\n");

    assertThat(stats).containsOnlyKeys("src/App.java");
    assertThat(stats.get("src/App.java")).isEqualTo(new GitRiskCollector.Counts(5, 1));
  }

  @Test
  void detectsSecretLikePaths() {
    assertThat(GitRiskCollector.isSecretLike("config/.env")).isTrue();
    assertThat(GitRiskCollector.isSecretLike("keys/ID_RSA")).isTrue();
    assertThat(GitRiskCollector.isSecretLike("certs/server.pem")).isTrue();
    assertThat(GitRiskCollector.isSecretLike("release.keystore")).isTrue();
    assertThat(GitRiskCollector.isSecretLike("docs/keys.md")).isFalse();
    assertThat(GitRiskCollector.isSecretLike(".pem")).isFalse();
  }

  @Test
  void noisyPatternUsesFirstNoisySegment() {
    assertThat(GitRiskCollector.noisyPattern("web/node_modules/x/build/y.js")).isEqualTo("node_modules/");
    assertThat(GitRiskCollector.noisyPattern("Target/classes/A.class")).isEqualTo("target/");
    assertThat(GitRiskCollector.noisyPattern("src/main/A.java")).isEmpty();
  }

  @Test
  void collectsSnapshotOfWorkingTree() throws IOException {
    Files.createDirectories(repo.resolve("dist"));
    Files.writeString(repo.resolve("notes.md"), "one\ntwo\nthree");
    FakeGitClient git = new FakeGitClient();
    git.status = " M src/App.java\n?? notes.md\n?? .env\n?? node_modules/lib/index.js\n";
    git.numstat = "4\t2\tsrc/App.java\n";

    RiskSnapshot risk = new GitRiskCollector(git).collect(repo);

    assertThat(risk.changedFiles()).extracting(ChangedFile::path)
      .containsExactly(".env", "node_modules/lib/index.js", "notes.md", "src/App.java");
    assertThat(risk.changedFiles()).contains(new ChangedFile("notes.md", "untracked", 3, 0),
      new ChangedFile("src/App.java", "modified", 4, 2));
    assertThat(risk.secretLikeChangedPaths()).containsExactly(".env");
    assertThat(risk.noisyChangedPaths()).containsExactly("node_modules/lib/index.js");
    assertThat(risk.missingRootGitignore()).isTrue();
    assertThat(risk.suggestedGitignorePatterns()).containsExactly("dist/", "node_modules/");
    assertThat(risk.missingGitignorePatterns()).containsExactly("dist/", "node_modules/");
    assertThat(risk.hasSecretLikeChanges()).isTrue();
    assertThat(risk.hasNoisyChangesWithoutGitignore()).isTrue();
  }

  @Test
  void existingIgnoreFileHidesCoveredPatterns() throws IOException {
    Files.writeString(repo.resolve(".gitignore"), "node_modules/\n");
    FakeGitClient git = new FakeGitClient();
    git.status = "?? node_modules/a.js\n?? build/out.txt\n";

    RiskSnapshot risk = new GitRiskCollector(git).collect(repo);

    assertThat(risk.missingRootGitignore()).isFalse();
    assertThat(risk.hasNoisyChangesWithoutGitignore()).isFalse();
    assertThat(risk.suggestedGitignorePatterns()).containsExactly("build/", "node_modules/");
    assertThat(risk.missingGitignorePatterns()).containsExactly("build/");
  }
}
