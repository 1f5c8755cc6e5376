package com.namekis.gitfleet.fix;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.namekis.gitfleet.domain.Operation;
import com.namekis.gitfleet.domain.Visibility;
import com.namekis.gitfleet.git.SyncStrategy;

class FixPlanBuilderTest {
  private static FixPlanContext context() {
    FixPlanContext c = new FixPlanContext();
    c.branch = "main";
    c.upstream = "origin/main";
    c.headSha = "abc123";
    c.originUrl = "git@github.com:acme/tool.git";
    c.repoName = "tool";
    c.remoteProtocol = "ssh";
    return c;
  }

  private static List<String> summaries(List<FixPlanEntry> plan) {
    return plan.stream().map(FixPlanEntry::summary).toList();
  }

  @Test
  void everyExecutionPlanEndsWithRevalidation() {
    for (FixAction action : FixAction.values()) {
      List<FixPlanEntry> plan = FixPlanBuilder.executionPlanFor(action, context());
      assertThat(plan).as("%s", action).isNotEmpty().last().isEqualTo(FixPlanEntry.REVALIDATE_STATE);
      assertThat(plan.stream().map(FixPlanEntry::id)).as("%s", action).doesNotHaveDuplicates();
    }
  }

  @Test
  void syncFollowsTheSelectedStrategy() {
    FixPlanContext c = context();
    assertThat(summaries(FixPlanBuilder.planFor(FixAction.SYNC_WITH_UPSTREAM, c))).containsExactly("git fetch --prune",
      "git rebase origin/main");

    c.syncStrategy = SyncStrategy.MERGE;
    c.upstream = "";
    c.fetchPrune = false;
    List<FixPlanEntry> plan = FixPlanBuilder.planFor(FixAction.SYNC_WITH_UPSTREAM, c);
    assertThat(plan).extracting(FixPlanEntry::id).containsExactly("sync-fetch-prune", "sync-merge");
    assertThat(plan.get(0).command()).isFalse();
    assertThat(plan.get(0).summary()).isEqualTo(FixPlanBuilder.SKIP_FETCH_PRUNE);
    assertThat(plan.get(1).summary()).isEqualTo("git merge --no-edit @{u}");
  }

  @Test
  void stageCommitPushPlanDependsOnRemotes() {
    FixPlanContext c = context();
    c.commitMessage = "say \"hi\"";
    assertThat(summaries(FixPlanBuilder.planFor(FixAction.STAGE_COMMIT_PUSH, c))).containsExactly("git add -A",
      "git commit -m \"say \\\"hi\\\"\"", "git push");

    c.upstream = "";
    c.preferredRemote = "fork";
    c.generateGitignore = true;
    c.gitignorePatterns = List.of("node_modules/", "dist/");
    c.missingRootGitignore = false;
    assertThat(FixPlanBuilder.planFor(FixAction.STAGE_COMMIT_PUSH, c)).extracting(FixPlanEntry::id)
      .containsExactly("stage-gitignore-append", "stage-git-add", "stage-git-commit", "stage-push-set-upstream");
    assertThat(FixPlanBuilder.planFor(FixAction.STAGE_COMMIT_PUSH, c).get(3).summary()).isEqualTo("git push -u fork main");

    c.originUrl = "";
    c.missingRootGitignore = true;
    assertThat(FixPlanBuilder.planFor(FixAction.STAGE_COMMIT_PUSH, c)).extracting(FixPlanEntry::id)
      .containsExactly("stage-gitignore-generate", "stage-git-add", "stage-git-commit", "stage-skip-push-no-origin");
  }

  @Test
  void createProjectPlan() {
    FixPlanContext c = context();
    c.originUrl = "";
    c.upstream = "";
    c.githubOwner = "acme";
    c.createProjectName = "My Tool";
    c.createProjectVisibility = Visibility.PUBLIC;
    assertThat(summaries(FixPlanBuilder.planFor(FixAction.CREATE_PROJECT, c))).containsExactly(
      "gh repo create acme/my-tool --public",
      "git remote add origin git@github.com:acme/my-tool.git",
      "Write/update repo metadata (origin URL, visibility, default auto-push policy).",
      "git push -u origin main");

    c.headSha = "";
    c.originUrl = "git@github.com:acme/my-tool.git";
    assertThat(FixPlanBuilder.planFor(FixAction.CREATE_PROJECT, c)).extracting(FixPlanEntry::id)
      .containsExactly("create-gh-repo", "create-validate-origin", "create-write-metadata", "create-initial-push");
    assertThat(FixPlanBuilder.planFor(FixAction.CREATE_PROJECT, c).get(3).command()).isFalse();

    c.githubOwner = "";
    assertThat(FixPlanBuilder.planFor(FixAction.CREATE_PROJECT, c)).extracting(FixPlanEntry::id)
      .containsExactly("create-requires-owner");
  }

  @Test
  void forkPlanAddsOrRetargetsTheOwnerRemote() {
    FixPlanContext c = context();
    c.githubOwner = "me";
    c.remoteProtocol = "https";
    assertThat(summaries(FixPlanBuilder.planFor(FixAction.FORK_AND_RETARGET, c))).containsExactly(
      "gh repo fork acme/tool --remote=false --clone=false",
      "git remote add me https://github.com/me/tool.git",
      "Update repo metadata immediately after retargeting remote (preferred remote and push-access probe state reset).",
      "git push -u --force me main",
      "Refresh repo metadata push-access probe state after retarget push.");

    c.forkRemoteExists = true;
    assertThat(FixPlanBuilder.planFor(FixAction.FORK_AND_RETARGET, c).get(1).summary())
      .isEqualTo("git remote set-url me https://github.com/me/tool.git");

    c.originUrl = "git@gitlab.com:acme/tool.git";
    assertThat(FixPlanBuilder.planFor(FixAction.FORK_AND_RETARGET, c)).extracting(FixPlanEntry::id)
      .containsExactly("fork-source-invalid");
  }

  @Test
  void abortPlanNamesTheOperation() {
    FixPlanContext c = context();
    c.operation = Operation.CHERRY_PICK;
    assertThat(summaries(FixPlanBuilder.planFor(FixAction.ABORT_OPERATION, c))).containsExactly("git cherry-pick --abort");
    c.operation = Operation.BISECT;
    assertThat(summaries(FixPlanBuilder.planFor(FixAction.ABORT_OPERATION, c))).containsExactly("git bisect reset");
    c.operation = Operation.NONE;
    assertThat(FixPlanBuilder.planFor(FixAction.ABORT_OPERATION, c)).extracting(FixPlanEntry::id).containsExactly("abort-noop");
  }

  @Test
  void plannedDefaults() {
    assertThat(FixPlanBuilder.plannedCommitMessage(" auto ")).isEqualTo(FixPlanBuilder.DEFAULT_COMMIT_MESSAGE);
    assertThat(FixPlanBuilder.plannedCommitMessage(null)).isEqualTo(FixPlanBuilder.DEFAULT_COMMIT_MESSAGE);
    assertThat(FixPlanBuilder.plannedCommitMessage("wip")).isEqualTo("wip");
    assertThat(FixPlanBuilder.plannedRemote("me", "upstream/main")).isEqualTo("upstream");
    assertThat(FixPlanBuilder.plannedRemote("me", "")).isEqualTo("me");
    assertThat(FixPlanBuilder.plannedRemote(" ", null)).isEqualTo("origin");
    assertThat(FixPlanBuilder.plannedBranch("")).isEqualTo("HEAD");
    assertThat(FixPlanBuilder.plannedUpstream(null)).isEqualTo("@{u}");
    assertThat(FixPlanBuilder.plannedProjectName("", "Some Repo!")).isEqualTo("some-repo");
    assertThat(FixPlanBuilder.plannedProjectName("", "???")).isEqualTo("repo");
    assertThat(FixPlanBuilder.plannedVisibilityFlag(Visibility.UNKNOWN)).isEqualTo("--private");
  }

  @Test
  void optionsAreValidatedPerAction() {
    FixActionExecutor.validateOptions(FixAction.STAGE_COMMIT_PUSH,
      FixApplyOptions.defaults().withCommitMessage("wip").withGitignore(List.of("dist/")));
    FixActionExecutor.validateOptions(FixAction.CREATE_PROJECT, FixApplyOptions.defaults().withCreateProject("tool", Visibility.PUBLIC));

    assertThatThrownBy(() -> FixActionExecutor.validateOptions(FixAction.PUSH, FixApplyOptions.defaults().withGitignore(List.of("dist/"))))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessage("gitignore patterns are only supported for stage-commit-push");
    assertThatThrownBy(() -> FixActionExecutor.validateOptions(FixAction.PUSH,
      FixApplyOptions.defaults().withCreateProject("", Visibility.PUBLIC)))
      .hasMessage("a project visibility is only supported for create-project");
    assertThatThrownBy(() -> FixActionExecutor.validateOptions(FixAction.CREATE_PROJECT,
      FixApplyOptions.defaults().withCreateProject("..", Visibility.UNKNOWN)))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageStartingWith("invalid repository name:");
  }

  @Test
  void defaultBranchDetection() {
    assertThat(FixActionExecutor.isDefaultBranch("main", "")).isTrue();
    assertThat(FixActionExecutor.isDefaultBranch("master", null)).isTrue();
    assertThat(FixActionExecutor.isDefaultBranch("main", "develop")).isFalse();
    assertThat(FixActionExecutor.isDefaultBranch("develop", "develop")).isTrue();
    assertThat(FixActionExecutor.isDefaultBranch("feature/x", "")).isFalse();
    assertThat(FixActionExecutor.isDefaultBranch(" ", "main")).isFalse();
  }
}
