package com.namekis.gitfleet.github;

import java.nio.file.Path;

import com.namekis.gitfleet.domain.RepoMetadata;
import com.namekis.gitfleet.domain.Visibility;

/** Remote repository hosting operations used by fixes. */
public interface GitHubRemotes {
  /**
   * Creates {@code owner/name} with the given visibility.
   *
   * @return the clone URL for the configured protocol
   */
  String createRepository(String owner, String name, Visibility visibility, String protocol, Path workDir);

  /**
   * Forks the repository behind {@code originUrl} under {@code owner}, reusing an existing fork.
   *
   * @return the clone URL of the fork
   */
  String ensureFork(String originUrl, String owner, String protocol, Path workDir);

  /**
   * Probes whether the current credentials can push {@code repo} to its preferred remote and records the classification, the
   * probed remote and the probe time in {@code metadata}.
   *
   * @return true when the classification or the probed remote changed
   */
  boolean refreshPushAccess(Path repo, RepoMetadata metadata);
}
