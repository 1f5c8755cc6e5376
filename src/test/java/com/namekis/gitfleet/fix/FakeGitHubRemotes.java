package com.namekis.gitfleet.fix;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import com.namekis.gitfleet.domain.PushAccess;
import com.namekis.gitfleet.domain.RepoMetadata;
import com.namekis.gitfleet.domain.Visibility;
import com.namekis.gitfleet.github.GitHubRemotes;
import com.namekis.gitfleet.github.GitHubUrls;

public class FakeGitHubRemotes implements GitHubRemotes {
  public final List<String> calls = new ArrayList<>();
  public PushAccess probedAccess = PushAccess.READ_WRITE;
  private final Clock clock;

  public FakeGitHubRemotes(Clock clock) {
    this.clock = clock;
  }

  @Override
  public String createRepository(String owner, String name, Visibility visibility, String protocol, Path workDir) {
    calls.add("create %s/%s %s".formatted(owner, name, visibility));
    return GitHubUrls.remoteUrl(owner, name, protocol);
  }

  @Override
  public String ensureFork(String originUrl, String owner, String protocol, Path workDir) {
    GitHubUrls.OwnerRepo source = GitHubUrls.sourceRepo(originUrl).orElseThrow();
    calls.add("fork %s as %s".formatted(source, owner));
    return GitHubUrls.remoteUrl(owner, source.repo(), protocol);
  }

  @Override
  public boolean refreshPushAccess(Path repo, RepoMetadata metadata) {
    calls.add("probe " + metadata.repoKey);
    String remote = metadata.preferredRemote == null || metadata.preferredRemote.isBlank() ? "origin" : metadata.preferredRemote;
    boolean changed = metadata.pushAccess != probedAccess || !remote.equals(metadata.pushAccessCheckedRemote);
    metadata.pushAccess = probedAccess;
    metadata.pushAccessCheckedRemote = remote;
    metadata.pushAccessCheckedAt = clock.instant();
    return changed;
  }
}
