package com.namekis.gitfleet.github;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.namekis.gitfleet.domain.RepoMetadata;
import com.namekis.gitfleet.domain.Visibility;
import com.namekis.gitfleet.exec.CommandRunner;
import com.namekis.gitfleet.git.GitClient;
import com.namekis.gitfleet.git.PushAccessProbe;

/** {@link GitHubRemotes} driving the {@code gh} command line client. Requires {@code gh auth login}. */
public class GhCliRemotes implements GitHubRemotes {
  private static final Logger log = LoggerFactory.getLogger(GhCliRemotes.class);

  private final CommandRunner runner;
  private final GitClient git;
  private final Clock clock;

  public GhCliRemotes(CommandRunner runner, GitClient git, Clock clock) {
    this.runner = runner;
    this.git = git;
    this.clock = clock;
  }

  @Override
  public String createRepository(String owner, String name, Visibility visibility, String protocol, Path workDir) {
    String fullName = owner + "/" + name;
    String visibilityFlag = visibility == Visibility.PUBLIC ? "--public" : "--private";
    log.info("[{}] creating github repository {} {}", workDir.getFileName(), fullName, visibilityFlag);
    runner.runChecked("gh-repo-create", workDir, List.of("gh", "repo", "create", fullName, visibilityFlag));
    return GitHubUrls.remoteUrl(owner, name, protocol);
  }

  @Override
  public String ensureFork(String originUrl, String owner, String protocol, Path workDir) {
    GitHubUrls.OwnerRepo source = GitHubUrls.sourceRepo(originUrl)
      .orElseThrow(() -> new IllegalArgumentException("origin %s is not a GitHub repository".formatted(originUrl)));
    log.info("[{}] forking {} under {}", workDir.getFileName(), source, owner);
    // gh exits 0 and reuses the fork when it already exists
    runner.runChecked("gh-repo-fork", workDir, List.of("gh", "repo", "fork", source.toString(), "--remote=false", "--clone=false"));
    return GitHubUrls.remoteUrl(owner, source.repo(), protocol);
  }

  @Override
  public boolean refreshPushAccess(Path repo, RepoMetadata metadata) {
    PushAccessProbe probe = git.probePushAccess(repo, metadata.preferredRemote);
    boolean changed = metadata.pushAccess != probe.access() || !Objects.equals(metadata.pushAccessCheckedRemote, probe.remote());
    log.debug("[{}] push access {} via {}", metadata.repoKey, probe.access(), probe.remote());
    metadata.pushAccess = probe.access();
    metadata.pushAccessCheckedRemote = probe.remote();
    metadata.pushAccessCheckedAt = clock.instant();
    metadata.pushAccessManualOverride = false;
    return changed;
  }
}
