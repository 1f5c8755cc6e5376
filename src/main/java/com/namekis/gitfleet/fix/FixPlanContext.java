package com.namekis.gitfleet.fix;

import java.util.List;

import com.namekis.gitfleet.domain.Operation;
import com.namekis.gitfleet.domain.RepositoryRecord;
import com.namekis.gitfleet.domain.Visibility;
import com.namekis.gitfleet.git.SyncStrategy;
import com.namekis.gitfleet.state.FleetConfig;

/** Everything needed to render the steps of an action without running anything. */
public class FixPlanContext {
  public Operation operation = Operation.NONE;
  public String branch = "";
  public String upstream = "";
  public String headSha = "";
  public String originUrl = "";
  public boolean hasDirtyTracked;
  public boolean hasUntracked;
  public SyncStrategy syncStrategy = SyncStrategy.DEFAULT;
  public String preferredRemote = "";
  public String githubOwner = "";
  public String remoteProtocol = "";
  public boolean forkRemoteExists;
  public String repoName = "";
  public String commitMessage = "";
  public String createProjectName = "";
  public Visibility createProjectVisibility = Visibility.PRIVATE;
  public boolean generateGitignore;
  public List<String> gitignorePatterns = List.of();
  public boolean missingRootGitignore;
  public boolean fetchPrune = true;

  /**
   * @param forkRemoteExists whether the repository already has a remote named after the GitHub owner
   */
  public static FixPlanContext of(FleetConfig config, FixRepoState target, FixApplyOptions options, boolean forkRemoteExists) {
    RepositoryRecord r = target.record();
    FixPlanContext c = new FixPlanContext();
    c.operation = r.operationInProgress == null ? Operation.NONE : r.operationInProgress;
    c.branch = trim(r.branch);
    c.upstream = trim(r.upstream);
    c.headSha = trim(r.headSha);
    c.originUrl = trim(r.originUrl);
    c.hasDirtyTracked = r.hasDirtyTracked;
    c.hasUntracked = r.hasUntracked;
    c.syncStrategy = options.syncStrategy();
    c.preferredRemote = target.preferredRemote();
    c.githubOwner = config.owner();
    c.remoteProtocol = trim(config.github.remoteProtocol);
    c.forkRemoteExists = forkRemoteExists;
    c.repoName = trim(r.name);
    c.commitMessage = options.commitMessage();
    c.createProjectName = options.createProjectName();
    c.createProjectVisibility = resolveVisibility(config, options.createProjectVisibility());
    c.generateGitignore = options.generateGitignore();
    c.gitignorePatterns = options.gitignorePatterns();
    c.missingRootGitignore = target.risk().missingRootGitignore();
    c.fetchPrune = config.sync.fetchPrune;
    return c;
  }

  /** An explicit private or public choice wins over {@code github.default_visibility}. */
  public static Visibility resolveVisibility(FleetConfig config, Visibility override) {
    if (override == Visibility.PRIVATE || override == Visibility.PUBLIC) {
      return override;
    }
    return config.github.visibility();
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
