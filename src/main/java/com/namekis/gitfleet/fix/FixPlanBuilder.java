package com.namekis.gitfleet.fix;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.namekis.gitfleet.domain.Visibility;
import com.namekis.gitfleet.git.SyncStrategy;
import com.namekis.gitfleet.github.GitHubUrls;
import com.namekis.gitfleet.github.RepositoryNames;

/**
 * Renders the ordered steps of an action. Pure: used for previews before anything runs, and by the executor to label the steps it
 * reports.
 */
public final class FixPlanBuilder {
  public static final String DEFAULT_COMMIT_MESSAGE = "gitfleet: checkpoint local changes before sync";
  static final String SKIP_FETCH_PRUNE = "Skip fetch prune because sync.fetch_prune is disabled.";

  private FixPlanBuilder() {
  }

  public static List<FixPlanEntry> planFor(FixAction action, FixPlanContext ctx) {
    return switch (action) {
      case IGNORE -> List.of(FixPlanEntry.effect("ignore-session",
        "Ignore this repository in the current interactive session only (no file changes)."));
      case ABORT_OPERATION -> planAbortOperation(ctx);
      case CREATE_PROJECT -> planCreateProject(ctx);
      case FORK_AND_RETARGET -> planForkAndRetarget(ctx);
      case SYNC_WITH_UPSTREAM -> planSyncWithUpstream(ctx);
      case PUSH -> List.of(FixPlanEntry.command("push-main", "git push"));
      case STAGE_COMMIT_PUSH -> planStageCommitPush(ctx);
      case PULL_FF_ONLY -> List.of(fetchPrune("pull-fetch-prune", ctx), FixPlanEntry.command("pull-ff-only", "git pull --ff-only"));
      case SET_UPSTREAM_PUSH -> List.of(FixPlanEntry.command("upstream-push",
        "git push -u %s %s".formatted(plannedRemote(ctx.preferredRemote, ctx.upstream), plannedBranch(ctx.branch))));
      case ENABLE_AUTO_PUSH -> List.of(FixPlanEntry.effect("enable-auto-push",
        "Write repo metadata: set auto_push to the enabled mode for this branch."));
    };
  }

  /** The plan followed by the trailing {@link FixPlanEntry#REVALIDATE_STATE} step. */
  public static List<FixPlanEntry> executionPlanFor(FixAction action, FixPlanContext ctx) {
    List<FixPlanEntry> entries = new ArrayList<>(planFor(action, ctx));
    entries.add(FixPlanEntry.REVALIDATE_STATE);
    return List.copyOf(entries);
  }

  static List<FixPlanEntry> planAbortOperation(FixPlanContext ctx) {
    return switch (ctx.operation) {
      case MERGE -> List.of(FixPlanEntry.command("abort-merge", "git merge --abort"));
      case REBASE -> List.of(FixPlanEntry.command("abort-rebase", "git rebase --abort"));
      case CHERRY_PICK -> List.of(FixPlanEntry.command("abort-cherry-pick", "git cherry-pick --abort"));
      case BISECT -> List.of(FixPlanEntry.command("abort-bisect", "git bisect reset"));
      case NONE -> List.of(FixPlanEntry.effect("abort-noop", "No merge/rebase/cherry-pick/bisect operation is currently active."));
    };
  }

  static List<FixPlanEntry> planSyncWithUpstream(FixPlanContext ctx) {
    String upstream = plannedUpstream(ctx.upstream);
    FixPlanEntry integrate = ctx.syncStrategy == SyncStrategy.MERGE
        ? FixPlanEntry.command("sync-merge", "git merge --no-edit " + upstream)
        : FixPlanEntry.command("sync-rebase", "git rebase " + upstream);
    return List.of(fetchPrune("sync-fetch-prune", ctx), integrate);
  }

  static List<FixPlanEntry> planStageCommitPush(FixPlanContext ctx) {
    List<FixPlanEntry> entries = new ArrayList<>(5);
    if (ctx.generateGitignore && !ctx.gitignorePatterns.isEmpty()) {
      entries.add(gitignoreEntry(ctx.missingRootGitignore, ctx.gitignorePatterns.size()));
    }
    entries.add(FixPlanEntry.command("stage-git-add", "git add -A"));
    entries.add(commitEntry(plannedCommitMessage(ctx.commitMessage)));
    if (ctx.originUrl.isBlank()) {
      entries.add(FixPlanEntry.effect("stage-skip-push-no-origin", "Skip push because no origin remote is configured."));
    } else if (ctx.upstream.isBlank()) {
      entries.add(FixPlanEntry.command("stage-push-set-upstream",
        "git push -u %s %s".formatted(plannedRemote(ctx.preferredRemote, ctx.upstream), plannedBranch(ctx.branch))));
    } else {
      entries.add(FixPlanEntry.command("stage-push", "git push"));
    }
    return entries;
  }

  static List<FixPlanEntry> planCreateProject(FixPlanContext ctx) {
    if (ctx.githubOwner.isBlank()) {
      return List.of(FixPlanEntry.effect("create-requires-owner", "Configure github.owner before creating a GitHub project."));
    }
    String projectName = plannedProjectName(ctx.createProjectName, ctx.repoName);
    List<FixPlanEntry> entries = new ArrayList<>(4);
    entries.add(FixPlanEntry.command("create-gh-repo",
      "gh repo create %s/%s %s".formatted(ctx.githubOwner, projectName, plannedVisibilityFlag(ctx.createProjectVisibility))));
    if (ctx.originUrl.isBlank()) {
      entries.add(FixPlanEntry.command("create-add-origin",
        "git remote add origin " + GitHubUrls.remoteUrl(ctx.githubOwner, projectName, ctx.remoteProtocol)));
    } else {
      entries.add(FixPlanEntry.effect("create-validate-origin",
        "Validate existing origin URL matches the expected repository identity."));
    }
    entries.add(FixPlanEntry.effect("create-write-metadata",
      "Write/update repo metadata (origin URL, visibility, default auto-push policy)."));
    if (ctx.upstream.isBlank()) {
      if (ctx.headSha.isBlank()) {
        entries.add(FixPlanEntry.effect("create-initial-push", "Skip initial push because HEAD has no commits."));
      } else {
        entries.add(FixPlanEntry.command("create-initial-push",
          "git push -u %s %s".formatted(plannedRemote(ctx.preferredRemote, ctx.upstream), plannedBranch(ctx.branch))));
      }
    }
    return entries;
  }

  static List<FixPlanEntry> planForkAndRetarget(FixPlanContext ctx) {
    String owner = ctx.githubOwner.trim();
    if (owner.isEmpty()) {
      return List.of(FixPlanEntry.effect("fork-requires-owner", "Configure github.owner before forking and retargeting."));
    }
    Optional<GitHubUrls.OwnerRepo> source = GitHubUrls.sourceRepo(ctx.originUrl);
    if (source.isEmpty()) {
      return List.of(FixPlanEntry.effect("fork-source-invalid", "Cannot derive GitHub source repository from origin URL."));
    }
    String forkUrl = GitHubUrls.remoteUrl(owner, source.get().repo(), ctx.remoteProtocol);
    String setRemote = ctx.forkRemoteExists
        ? "git remote set-url %s %s".formatted(owner, forkUrl)
        : "git remote add %s %s".formatted(owner, forkUrl);
    return List.of(
      FixPlanEntry.command("fork-gh-fork", "gh repo fork %s --remote=false --clone=false".formatted(source.get())),
      FixPlanEntry.command("fork-set-remote", setRemote),
      FixPlanEntry.effect("fork-write-metadata",
        "Update repo metadata immediately after retargeting remote (preferred remote and push-access probe state reset)."),
      FixPlanEntry.command("fork-push-upstream", "git push -u --force %s %s".formatted(owner, plannedBranch(ctx.branch))),
      FixPlanEntry.effect("fork-refresh-metadata", "Refresh repo metadata push-access probe state after retarget push."));
  }

  static FixPlanEntry fetchPrune(String id, FixPlanContext ctx) {
    if (ctx.fetchPrune) {
      return FixPlanEntry.command(id, "git fetch --prune");
    }
    return FixPlanEntry.effect(id, SKIP_FETCH_PRUNE);
  }

  static FixPlanEntry gitignoreEntry(boolean missingRootGitignore, int patterns) {
    if (missingRootGitignore) {
      return FixPlanEntry.effect("stage-gitignore-generate", "Generate root .gitignore with %d selected pattern(s).".formatted(patterns));
    }
    return FixPlanEntry.effect("stage-gitignore-append", "Append %d selected pattern(s) to root .gitignore.".formatted(patterns));
  }

  static FixPlanEntry commitEntry(String message) {
    return FixPlanEntry.command("stage-git-commit", "git commit -m \"%s\"".formatted(message.replace("\"", "\\\"")));
  }

  /** Blank and {@code auto} mean the default checkpoint message. */
  public static String plannedCommitMessage(String raw) {
    String value = raw == null ? "" : raw.trim();
    if (value.isEmpty() || value.equals("auto")) {
      return DEFAULT_COMMIT_MESSAGE;
    }
    return value;
  }

  /** The remote of the upstream ref, else the preferred remote, else {@code origin}. */
  public static String plannedRemote(String preferredRemote, String upstream) {
    String u = upstream == null ? "" : upstream.trim();
    int slash = u.indexOf('/');
    if (slash > 0) {
      return u.substring(0, slash).trim();
    }
    String preferred = preferredRemote == null ? "" : preferredRemote.trim();
    return preferred.isEmpty() ? "origin" : preferred;
  }

  public static String plannedBranch(String branch) {
    String value = branch == null ? "" : branch.trim();
    return value.isEmpty() ? "HEAD" : value;
  }

  public static String plannedUpstream(String upstream) {
    String value = upstream == null ? "" : upstream.trim();
    return value.isEmpty() ? "@{u}" : value;
  }

  /** The sanitized explicit name, else the sanitized repository name, else {@code repo}. */
  public static String plannedProjectName(String name, String repoName) {
    String sanitized = RepositoryNames.sanitize(name);
    if (!sanitized.isEmpty()) {
      return sanitized;
    }
    String fallback = RepositoryNames.sanitize(repoName);
    return fallback.isEmpty() ? "repo" : fallback;
  }

  public static String plannedVisibilityFlag(Visibility visibility) {
    return visibility == Visibility.PUBLIC ? "--public" : "--private";
  }
}
