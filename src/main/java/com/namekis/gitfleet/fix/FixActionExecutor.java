package com.namekis.gitfleet.fix;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.namekis.gitfleet.domain.AutoPushMode;
import com.namekis.gitfleet.domain.Operation;
import com.namekis.gitfleet.domain.OriginIdentity;
import com.namekis.gitfleet.domain.RepoMetadata;
import com.namekis.gitfleet.domain.RepositoryRecord;
import com.namekis.gitfleet.domain.Visibility;
import com.namekis.gitfleet.git.GitClient;
import com.namekis.gitfleet.github.GitHubRemotes;
import com.namekis.gitfleet.github.GitHubUrls;
import com.namekis.gitfleet.github.RepositoryNames;
import com.namekis.gitfleet.risk.Gitignores;
import com.namekis.gitfleet.state.FleetConfig;
import com.namekis.gitfleet.state.StateStore;

/**
 * Runs the steps of one fix action against a repository. Does not check eligibility against the table, only the conditions that
 * may have shifted since the caller looked; does not revalidate. Steps already applied are never rolled back.
 */
public class FixActionExecutor {
  private static final Logger log = LoggerFactory.getLogger(FixActionExecutor.class);

  private final GitClient git;
  private final GitHubRemotes github;
  private final StateStore store;

  public FixActionExecutor(GitClient git, GitHubRemotes github, StateStore store) {
    this.git = git;
    this.github = github;
    this.store = store;
  }

  /** The preview of {@code action}, ending with the revalidation step. */
  public List<FixPlanEntry> executionPlan(FleetConfig config, FixRepoState target, FixAction action, FixApplyOptions options) {
    return FixPlanBuilder.executionPlanFor(action, planContext(config, target, options));
  }

  FixPlanContext planContext(FleetConfig config, FixRepoState target, FixApplyOptions options) {
    return FixPlanContext.of(config, target, options, forkRemoteExists(config, target.record()));
  }

  private boolean forkRemoteExists(FleetConfig config, RepositoryRecord record) {
    String owner = config.owner();
    if (owner.isEmpty() || record.path == null || record.path.isBlank()) {
      return false;
    }
    return git.remoteNames(record.location()).contains(owner);
  }

  /** Rejects options that make no sense for the action. */
  public static void validateOptions(FixAction action, FixApplyOptions options) {
    if (action != FixAction.STAGE_COMMIT_PUSH) {
      if (!options.commitMessage().isEmpty()) {
        throw new IllegalArgumentException("a commit message is only supported for stage-commit-push");
      }
      if (options.writesGitignore()) {
        throw new IllegalArgumentException("gitignore patterns are only supported for stage-commit-push");
      }
    }
    if (action != FixAction.CREATE_PROJECT) {
      if (!options.createProjectName().isEmpty()) {
        throw new IllegalArgumentException("a project name is only supported for create-project");
      }
      if (options.createProjectVisibility() != Visibility.UNKNOWN) {
        throw new IllegalArgumentException("a project visibility is only supported for create-project");
      }
    }
    if (action == FixAction.CREATE_PROJECT && !options.createProjectName().isEmpty()) {
      validatedProjectName(options.createProjectName());
    }
  }

  private static String validatedProjectName(String raw) {
    String sanitized = RepositoryNames.sanitize(raw);
    try {
      RepositoryNames.validate(sanitized);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("invalid repository name: " + e.getMessage(), e);
    }
    return sanitized;
  }

  public void execute(FleetConfig config, FixRepoState target, FixAction action, FixApplyOptions options, StepObserver observer) {
    validateOptions(action, options);
    StepRunner steps = new StepRunner(executionPlan(config, target, action, options), observer);
    log.debug("[{}] executing {}", target.record().name, action);
    switch (action) {
      case IGNORE -> steps.run("ignore-session", FixPlanEntry.effect("ignore-session", "Ignore this repository for this session."),
        () -> log.info("[{}] ignored for this session", target.record().name));
      case ABORT_OPERATION -> abortOperation(target, steps);
      case CREATE_PROJECT -> createProject(config, target, options, steps);
      case FORK_AND_RETARGET -> forkAndRetarget(config, target, steps);
      case SYNC_WITH_UPSTREAM -> syncWithUpstream(config, target, options, steps);
      case PUSH -> push(target, steps);
      case STAGE_COMMIT_PUSH -> stageCommitPush(target, options, steps);
      case PULL_FF_ONLY -> pullFastForwardOnly(config, target, steps);
      case SET_UPSTREAM_PUSH -> setUpstreamPush(target, steps);
      case ENABLE_AUTO_PUSH -> enableAutoPush(target, steps);
    }
  }

  private void abortOperation(FixRepoState target, StepRunner steps) {
    Path path = target.record().location();
    Operation operation = target.record().operationInProgress == null ? Operation.NONE : target.record().operationInProgress;
    switch (operation) {
      case MERGE -> steps.run("abort-merge", FixPlanEntry.command("abort-merge", "git merge --abort"), () -> git.abortMerge(path));
      case REBASE -> steps.run("abort-rebase", FixPlanEntry.command("abort-rebase", "git rebase --abort"), () -> git.abortRebase(path));
      case CHERRY_PICK -> steps.run("abort-cherry-pick", FixPlanEntry.command("abort-cherry-pick", "git cherry-pick --abort"),
        () -> git.abortCherryPick(path));
      case BISECT -> steps.run("abort-bisect", FixPlanEntry.command("abort-bisect", "git bisect reset"), () -> git.bisectReset(path));
      case NONE -> throw new FixException("no operation in progress for %s".formatted(target.record().name));
    }
  }

  private void push(FixRepoState target, StepRunner steps) {
    RepositoryRecord r = target.record();
    if (r.hasUpstream() && (r.diverged || r.behind > 0)) {
      throw new FixIneligibleException(FixAction.PUSH, "push is blocked: branch is behind upstream; run sync-with-upstream first");
    }
    steps.run("push-main", FixPlanEntry.command("push-main", "git push"), () -> git.push(r.location()));
  }

  private void syncWithUpstream(FleetConfig config, FixRepoState target, FixApplyOptions options, StepRunner steps) {
    RepositoryRecord r = target.record();
    String label = FixAction.SYNC_WITH_UPSTREAM.id();
    if (!r.hasUpstream()) {
      throw new FixIneligibleException(FixAction.SYNC_WITH_UPSTREAM, label + " is blocked: upstream is required");
    }
    String blocked = FixEligibility.syncStrategyBlock(label, target.syncFeasibility(),
      EligibilityContext.of(target, options.interactive(), options.syncStrategy()));
    if (!blocked.isEmpty()) {
      throw new FixIneligibleException(FixAction.SYNC_WITH_UPSTREAM, blocked);
    }
    fetchPrune(config, "sync-fetch-prune", r.location(), steps);
    String upstream = r.upstream.trim();
    switch (options.syncStrategy()) {
      case MERGE -> steps.run("sync-merge", FixPlanEntry.command("sync-merge", "git merge --no-edit " + upstream),
        () -> git.mergeNoEdit(r.location(), upstream));
      case REBASE -> steps.run("sync-rebase", FixPlanEntry.command("sync-rebase", "git rebase " + upstream),
        () -> git.rebase(r.location(), upstream));
    }
  }

  private void pullFastForwardOnly(FleetConfig config, FixRepoState target, StepRunner steps) {
    Path path = target.record().location();
    fetchPrune(config, "pull-fetch-prune", path, steps);
    steps.run("pull-ff-only", FixPlanEntry.command("pull-ff-only", "git pull --ff-only"), () -> git.pullFastForwardOnly(path));
  }

  private void fetchPrune(FleetConfig config, String id, Path path, StepRunner steps) {
    FixPlanEntry fallback = FixPlanEntry.command(id, "git fetch --prune");
    if (config.sync.fetchPrune) {
      steps.run(id, fallback, () -> git.fetchPrune(path));
    } else {
      steps.skip(id, fallback);
    }
  }

  private void stageCommitPush(FixRepoState target, FixApplyOptions options, StepRunner steps) {
    RepositoryRecord r = target.record();
    Path path = r.location();
    if (r.hasOrigin() && r.hasUpstream() && (r.diverged || r.behind > 0)) {
      throw new FixIneligibleException(FixAction.STAGE_COMMIT_PUSH,
        "stage-commit-push is blocked: branch is behind upstream, so push would be rejected; run sync-with-upstream first");
    }
    if (options.writesGitignore()) {
      FixPlanEntry entry = FixPlanBuilder.gitignoreEntry(target.risk().missingRootGitignore(), options.gitignorePatterns().size());
      steps.run(entry.id(), entry, () -> Gitignores.writeOrAppend(path, options.gitignorePatterns()));
    }
    steps.run("stage-git-add", FixPlanEntry.command("stage-git-add", "git add -A"), () -> git.addAll(path));
    String message = FixPlanBuilder.plannedCommitMessage(options.commitMessage());
    steps.run("stage-git-commit", FixPlanBuilder.commitEntry(message), () -> git.commit(path, message));

    if (!r.hasOrigin()) {
      steps.skip("stage-skip-push-no-origin",
        FixPlanEntry.effect("stage-skip-push-no-origin", "Skip push because no origin remote is configured."));
      return;
    }
    String branch = currentBranch(r, "cannot determine branch for upstream push");
    if (!r.hasUpstream()) {
      String remote = pushRemote(target);
      steps.run("stage-push-set-upstream",
        FixPlanEntry.command("stage-push-set-upstream", "git push -u %s %s".formatted(remote, FixPlanBuilder.plannedBranch(branch))),
        () -> git.pushUpstream(path, branch, remote, false));
      return;
    }
    steps.run("stage-push", FixPlanEntry.command("stage-push", "git push"), () -> git.push(path));
  }

  private void setUpstreamPush(FixRepoState target, StepRunner steps) {
    RepositoryRecord r = target.record();
    String branch = currentBranch(r, "cannot determine branch for upstream push");
    String remote = pushRemote(target);
    steps.run("upstream-push",
      FixPlanEntry.command("upstream-push", "git push -u %s %s".formatted(remote, FixPlanBuilder.plannedBranch(branch))),
      () -> git.pushUpstream(r.location(), branch, remote, false));
  }

  private void enableAutoPush(FixRepoState target, StepRunner steps) {
    RepositoryRecord r = target.record();
    if (!r.hasRepoKey()) {
      throw new FixException("repo_key is required for enable-auto-push");
    }
    String defaultBranch = git.defaultBranch(r.location(), target.preferredRemote());
    AutoPushMode mode = isDefaultBranch(r.branch, defaultBranch) ? AutoPushMode.INCLUDE_DEFAULT_BRANCH : AutoPushMode.ENABLED;
    steps.run("enable-auto-push", FixPlanEntry.effect("enable-auto-push", "Write repo metadata: set auto_push=\"%s\".".formatted(mode)),
      () -> {
        RepoMetadata metadata = requireMetadata(r.repoKey);
        metadata.autoPush = mode;
        store.saveRepoMetadata(metadata);
      });
  }

  /** Without a known default branch, {@code main} and {@code master} count as default. */
  static boolean isDefaultBranch(String branch, String defaultBranch) {
    String b = branch == null ? "" : branch.trim();
    if (b.isEmpty()) {
      return false;
    }
    String d = defaultBranch == null ? "" : defaultBranch.trim();
    if (!d.isEmpty()) {
      return b.equals(d);
    }
    return b.equals("main") || b.equals("master");
  }

  private void createProject(FleetConfig config, FixRepoState target, FixApplyOptions options, StepRunner steps) {
    RepositoryRecord r = target.record();
    Path path = r.location();
    String owner = config.owner();
    if (owner.isEmpty()) {
      throw new FixException("github.owner is required; set github.owner in config.yaml");
    }
    if (r.catalog == null || r.catalog.isBlank()) {
      throw new FixException("catalog is required for create-project");
    }
    String rawName = !options.createProjectName().isEmpty() ? options.createProjectName()
        : (r.name != null && !r.name.isBlank()) ? r.name : path.getFileName().toString();
    if (RepositoryNames.sanitize(rawName).isEmpty()) {
      throw new FixException("project name is required for create-project");
    }
    String projectName = validatedProjectName(rawName);
    Visibility visibility = FixPlanContext.resolveVisibility(config, options.createProjectVisibility());
    String protocol = config.github.remoteProtocol;
    String expectedOrigin = GitHubUrls.remoteUrl(owner, projectName, protocol);
    FixPlanEntry createEntry = FixPlanEntry.command("create-gh-repo",
      "gh repo create %s/%s %s".formatted(owner, projectName, FixPlanBuilder.plannedVisibilityFlag(visibility)));

    String existingOrigin = git.origin(path, "");
    String origin;
    if (!existingOrigin.isEmpty()) {
      steps.skip("create-gh-repo", createEntry);
      steps.run("create-validate-origin",
        FixPlanEntry.effect("create-validate-origin", "Validate existing origin URL matches the expected repository identity."),
        () -> validateOrigin(existingOrigin, expectedOrigin));
      origin = existingOrigin;
    } else {
      String[] created = new String[1];
      steps.run("create-gh-repo", createEntry,
        () -> created[0] = github.createRepository(owner, projectName, visibility, protocol, path));
      steps.run("create-add-origin", FixPlanEntry.command("create-add-origin", "git remote add origin " + expectedOrigin),
        () -> git.addRemote(path, "origin", created[0]));
      origin = created[0];
    }

    if (!r.hasRepoKey()) {
      throw new FixException("repo_key is required for create-project");
    }
    RepoMetadata[] metadata = new RepoMetadata[1];
    steps.run("create-write-metadata",
      FixPlanEntry.effect("create-write-metadata", "Write/update repo metadata (origin URL, visibility, default auto-push policy)."),
      () -> metadata[0] = ensureMetadata(config, r.repoKey, projectName, origin, visibility, r.catalog));

    String branch = git.currentBranch(path);
    String headSha = git.headSha(path);
    String upstream = git.upstream(path);
    String preferredRemote = metadata[0].preferredRemote;
    String pushBranch = branch.isEmpty() ? "main" : branch;
    FixPlanEntry pushEntry = FixPlanEntry.command("create-initial-push",
      "git push -u %s %s".formatted(FixPlanBuilder.plannedRemote(preferredRemote, r.upstream), FixPlanBuilder.plannedBranch(branch)));
    if (!headSha.isEmpty() && upstream.isEmpty()) {
      steps.run("create-initial-push", pushEntry, () -> git.pushUpstream(path, pushBranch, preferredRemote, false));
    } else {
      steps.skip("create-initial-push", pushEntry);
    }
  }

  private static void validateOrigin(String existing, String expected) {
    try {
      OriginIdentity.normalize(existing);
    } catch (IllegalArgumentException e) {
      throw new FixException("invalid existing origin: " + e.getMessage(), e);
    }
    if (!OriginIdentity.sameRepository(existing, expected)) {
      throw new FixException("conflicting origin: existing \"%s\" does not match expected \"%s\"".formatted(existing, expected));
    }
  }

  /**
   * Creates the metadata with the default auto-push policy of its visibility, or fills the blank fields of the stored one. Saves
   * only when something changed.
   */
  RepoMetadata ensureMetadata(FleetConfig config, String repoKey, String name, String origin, Visibility visibility,
      String catalog) {
    Optional<RepoMetadata> stored = store.loadRepoMetadata(repoKey);
    RepoMetadata m;
    if (stored.isEmpty()) {
      m = new RepoMetadata();
      m.repoKey = repoKey;
      m.name = name;
      m.originUrl = origin;
      m.visibility = visibility;
      m.preferredCatalog = catalog;
      m.autoPush = AutoPushMode.fromEnabled(config.defaultAutoPushFor(visibility));
    } else {
      m = stored.get().copy();
      boolean changed = false;
      if (blank(m.repoKey)) {
        m.repoKey = repoKey;
        changed = true;
      }
      if (blank(m.name)) {
        m.name = name;
        changed = true;
      }
      if (blank(m.originUrl)) {
        m.originUrl = origin;
        changed = true;
      }
      if (m.visibility == null || m.visibility == Visibility.UNKNOWN) {
        m.visibility = visibility;
        changed = true;
      }
      if (blank(m.preferredCatalog)) {
        m.preferredCatalog = catalog;
        changed = true;
      }
      if (!changed) {
        return m;
      }
    }
    store.saveRepoMetadata(m);
    return m;
  }

  private void forkAndRetarget(FleetConfig config, FixRepoState target, StepRunner steps) {
    RepositoryRecord r = target.record();
    Path path = r.location();
    if (target.metadata() == null) {
      throw new FixException("repo metadata is required for fork-and-retarget");
    }
    String owner = config.owner();
    if (owner.isEmpty()) {
      throw new FixException("github.owner is required; set github.owner in config.yaml");
    }
    if (!r.hasOrigin()) {
      throw new FixException("origin URL is required for fork-and-retarget");
    }
    String originUrl = r.originUrl.trim();
    String source = GitHubUrls.sourceRepo(originUrl).map(GitHubUrls.OwnerRepo::toString).orElse(originUrl);
    String protocol = config.github.remoteProtocol;

    String[] forkUrl = new String[1];
    steps.run("fork-gh-fork", FixPlanEntry.command("fork-gh-fork", "gh repo fork %s --remote=false --clone=false".formatted(source)),
      () -> forkUrl[0] = github.ensureFork(originUrl, owner, protocol, path));

    boolean remoteExists = git.remoteNames(path).contains(owner);
    String setRemote = remoteExists ? "git remote set-url %s %s" : "git remote add %s %s";
    steps.run("fork-set-remote", FixPlanEntry.command("fork-set-remote", setRemote.formatted(owner, forkUrl[0])), () -> {
      if (remoteExists) {
        git.setRemoteUrl(path, owner, forkUrl[0]);
      } else {
        git.addRemote(path, owner, forkUrl[0]);
      }
    });

    steps.run("fork-write-metadata", FixPlanEntry.effect("fork-write-metadata",
      "Update repo metadata immediately after retargeting remote (preferred remote and push-access probe state reset)."), () -> {
        RepoMetadata m = target.metadata().copy();
        m.preferredRemote = owner;
        m.resetPushAccessProbe();
        store.saveRepoMetadata(m);
      });

    String branch = currentBranch(r, "cannot determine branch for fork-and-retarget");
    steps.run("fork-push-upstream",
      FixPlanEntry.command("fork-push-upstream", "git push -u --force %s %s".formatted(owner, FixPlanBuilder.plannedBranch(branch))),
      () -> git.pushUpstream(path, branch, owner, true));

    steps.run("fork-refresh-metadata",
      FixPlanEntry.effect("fork-refresh-metadata", "Refresh repo metadata push-access probe state after retarget push."), () -> {
        RepoMetadata m = requireMetadata(target.metadata().repoKey);
        github.refreshPushAccess(path, m);
        store.saveRepoMetadata(m);
      });
  }

  /** The recorded branch, else the one git reports now. */
  private String currentBranch(RepositoryRecord r, String failure) {
    String branch = r.hasBranch() ? r.branch.trim() : git.currentBranch(r.location()).trim();
    if (branch.isEmpty()) {
      throw new FixException(failure);
    }
    return branch;
  }

  /** The remote a {@code push -u} goes to: the planned one when the repository has it, else whatever git would pick. */
  private String pushRemote(FixRepoState target) {
    RepositoryRecord r = target.record();
    String remote = FixPlanBuilder.plannedRemote(target.preferredRemote(), r.upstream);
    if (git.remoteNames(r.location()).contains(remote)) {
      return remote;
    }
    String fallback = git.effectiveRemote(r.location(), "");
    return fallback.isEmpty() ? remote : fallback;
  }

  private RepoMetadata requireMetadata(String repoKey) {
    return store.loadRepoMetadata(repoKey)
      .orElseThrow(() -> new FixException("repo metadata for %s not found".formatted(repoKey)));
  }

  private static boolean blank(String value) {
    return value == null || value.isBlank();
  }
}
