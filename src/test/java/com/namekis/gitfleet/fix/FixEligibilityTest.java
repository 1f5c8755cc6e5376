package com.namekis.gitfleet.fix;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.EnumSet;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.namekis.gitfleet.domain.AutoPushMode;
import com.namekis.gitfleet.domain.Operation;
import com.namekis.gitfleet.domain.PushAccess;
import com.namekis.gitfleet.domain.RepoMetadata;
import com.namekis.gitfleet.domain.RepositoryRecord;
import com.namekis.gitfleet.domain.UnsyncableReason;
import com.namekis.gitfleet.git.SyncProbeOutcome;
import com.namekis.gitfleet.git.SyncStrategy;
import com.namekis.gitfleet.risk.ChangedFile;
import com.namekis.gitfleet.risk.RiskSnapshot;

class FixEligibilityTest {
  private static final EligibilityContext NONE = new EligibilityContext(false, null, null, null);

  private static RepositoryRecord tracked() {
    RepositoryRecord r = new RepositoryRecord();
    r.repoKey = "software/tool";
    r.name = "tool";
    r.catalog = "software";
    r.path = "/src/software/tool";
    r.originUrl = "git@github.com:acme/tool.git";
    r.branch = "main";
    r.upstream = "origin/main";
    return r;
  }

  private static RepoMetadata metadata(PushAccess access, AutoPushMode autoPush) {
    RepoMetadata m = new RepoMetadata();
    m.repoKey = "software/tool";
    m.pushAccess = access;
    m.autoPush = autoPush;
    return m;
  }

  private static RiskSnapshot risk(List<String> secret, List<String> noisy, boolean missingGitignore) {
    return new RiskSnapshot(List.<ChangedFile>of(), secret, noisy, missingGitignore, List.of(), List.of());
  }

  private static EligibilityContext feasible(SyncStrategy strategy, SyncProbeOutcome rebase, SyncProbeOutcome merge) {
    return new EligibilityContext(false, null, strategy, new SyncFeasibility(true, rebase, merge));
  }

  @Test
  void runningOperationOnlyAllowsAbort() {
    for (Operation operation : EnumSet.complementOf(EnumSet.of(Operation.NONE))) {
      RepositoryRecord r = tracked();
      r.operationInProgress = operation;
      r.ahead = 3;
      r.hasDirtyTracked = true;
      r.originUrl = "";
      assertThat(FixEligibility.eligibleActions(r, null, NONE)).as("%s", operation).containsExactly(FixAction.ABORT_OPERATION);
    }
  }

  @Test
  void cleanTrackedRepositoryHasNothingToDo() {
    assertThat(FixEligibility.eligibleActions(tracked(), null, NONE)).isEmpty();
  }

  @Test
  void missingOriginOffersCreateProject() {
    RepositoryRecord r = tracked();
    r.originUrl = "";
    r.upstream = "";
    assertThat(FixEligibility.eligibleActions(r, null, NONE)).containsExactly(FixAction.CREATE_PROJECT);

    r.hasUntracked = true;
    assertThat(FixEligibility.eligibleActions(r, null, NONE)).containsExactly(FixAction.CREATE_PROJECT, FixAction.STAGE_COMMIT_PUSH);
  }

  @Test
  void neverOffersPushingActionsWithoutWriteAccess() {
    for (PushAccess access : List.of(PushAccess.READ_ONLY, PushAccess.UNKNOWN)) {
      RepoMetadata m = metadata(access, AutoPushMode.DISABLED);
      for (int variant = 0; variant < 4; variant++) {
        RepositoryRecord r = tracked();
        r.ahead = variant == 0 ? 1 : 0;
        r.hasDirtyTracked = variant == 1;
        r.upstream = variant == 2 ? "" : r.upstream;
        r.hasUntracked = variant == 3;
        assertThat(FixEligibility.eligibleActions(r, m, NONE))
          .as("%s variant %d", access, variant)
          .doesNotContain(FixAction.PUSH, FixAction.STAGE_COMMIT_PUSH, FixAction.SET_UPSTREAM_PUSH);
      }
    }
  }

  @Test
  void readOnlyAccessOffersForkAndRetarget() {
    RepositoryRecord r = tracked();
    r.ahead = 1;
    assertThat(FixEligibility.eligibleActions(r, metadata(PushAccess.READ_ONLY, AutoPushMode.DISABLED), NONE))
      .containsExactly(FixAction.FORK_AND_RETARGET);
    assertThat(FixEligibility.eligibleActions(r, metadata(PushAccess.UNKNOWN, AutoPushMode.DISABLED), NONE)).isEmpty();

    r.repoKey = "";
    assertThat(FixEligibility.eligibleActions(r, metadata(PushAccess.READ_ONLY, AutoPushMode.DISABLED), NONE)).isEmpty();
  }

  @Test
  void missingMetadataCountsAsWritable() {
    RepositoryRecord r = tracked();
    r.ahead = 2;
    assertThat(FixEligibility.eligibleActions(r, null, NONE)).containsExactly(FixAction.PUSH);

    r.upstream = "";
    assertThat(FixEligibility.eligibleActions(r, null, NONE)).containsExactly(FixAction.SET_UPSTREAM_PUSH);

    r.branch = "";
    assertThat(FixEligibility.eligibleActions(r, null, NONE)).isEmpty();
  }

  @Test
  void enableAutoPushNeedsWritableMetadata() {
    RepositoryRecord r = tracked();
    assertThat(FixEligibility.eligibleActions(r, metadata(PushAccess.READ_WRITE, AutoPushMode.DISABLED), NONE))
      .containsExactly(FixAction.ENABLE_AUTO_PUSH);
    assertThat(FixEligibility.eligibleActions(r, metadata(PushAccess.READ_WRITE, AutoPushMode.ENABLED), NONE)).isEmpty();
    assertThat(FixEligibility.eligibleActions(r, metadata(PushAccess.READ_WRITE, AutoPushMode.INCLUDE_DEFAULT_BRANCH), NONE)).isEmpty();

    r.unsyncableReasons.add(UnsyncableReason.PUSH_POLICY_BLOCKED);
    assertThat(FixEligibility.eligibleActions(r, metadata(PushAccess.READ_WRITE, AutoPushMode.ENABLED), NONE))
      .containsExactly(FixAction.ENABLE_AUTO_PUSH);
    assertThat(FixEligibility.eligibleActions(r, metadata(PushAccess.READ_WRITE, AutoPushMode.INCLUDE_DEFAULT_BRANCH), NONE)).isEmpty();
  }

  @Test
  void behindCleanRepositoryPullsFastForward() {
    RepositoryRecord r = tracked();
    r.behind = 2;
    assertThat(FixEligibility.eligibleActions(r, null, NONE)).containsExactly(FixAction.PULL_FF_ONLY);

    r.hasDirtyTracked = true;
    assertThat(FixEligibility.eligibleActions(r, null, NONE)).isEmpty();
    assertThat(FixEligibility.ineligibleReason(FixAction.STAGE_COMMIT_PUSH, r, NONE))
      .isEqualTo("stage-commit-push is blocked: branch is behind upstream, so push would be rejected; run sync-with-upstream first");
  }

  @Test
  void divergedRepositoryNeedsACleanProbeToSync() {
    RepositoryRecord r = tracked();
    r.ahead = 1;
    r.behind = 1;
    r.diverged = true;

    assertThat(FixEligibility.eligibleActions(r, null, NONE)).isEmpty();
    assertThat(FixEligibility.ineligibleReason(FixAction.SYNC_WITH_UPSTREAM, r, NONE))
      .isEqualTo("sync-with-upstream is blocked: sync feasibility has not been validated");

    EligibilityContext clean = feasible(SyncStrategy.REBASE, SyncProbeOutcome.CLEAN, SyncProbeOutcome.CONFLICT);
    assertThat(FixEligibility.eligibleActions(r, null, clean)).containsExactly(FixAction.SYNC_WITH_UPSTREAM);
    assertThat(FixEligibility.ineligibleReason(FixAction.SYNC_WITH_UPSTREAM, r, clean)).isEmpty();

    EligibilityContext mergeConflict = feasible(SyncStrategy.MERGE, SyncProbeOutcome.CLEAN, SyncProbeOutcome.CONFLICT);
    assertThat(FixEligibility.eligibleActions(r, null, mergeConflict)).isEmpty();
    assertThat(FixEligibility.ineligibleReason(FixAction.SYNC_WITH_UPSTREAM, r, mergeConflict))
      .isEqualTo("sync-with-upstream is blocked: sync_conflict (selected strategy: merge)");

    r.hasUntracked = true;
    assertThat(FixEligibility.eligibleActions(r, null, clean)).isEmpty();
  }

  @Test
  void unknownProbeOutcomeIsNotAttempted() {
    SyncFeasibility feasibility = new SyncFeasibility(true, SyncProbeOutcome.UNKNOWN, SyncProbeOutcome.PROBE_FAILED);

    assertThat(feasibility.canAttemptFor(SyncStrategy.REBASE)).isFalse();
    assertThat(feasibility.canAttemptFor(SyncStrategy.MERGE)).isTrue();
    assertThat(feasibility.cleanFor(SyncStrategy.MERGE)).isFalse();
    assertThat(feasibility.canAttemptFor(null)).isFalse();
    assertThat(SyncFeasibility.UNCHECKED.canAttemptFor(SyncStrategy.REBASE)).isFalse();

    RepositoryRecord r = tracked();
    r.diverged = true;
    EligibilityContext unknown = new EligibilityContext(false, null, SyncStrategy.REBASE, feasibility);
    assertThat(FixEligibility.ineligibleReason(FixAction.SYNC_WITH_UPSTREAM, r, unknown))
      .isEqualTo("sync-with-upstream is blocked: sync strategy rebase is not marked clean by feasibility validation");
  }

  @Test
  void noisyChangesNeedAnInteractiveReview() {
    RepositoryRecord r = tracked();
    r.hasUntracked = true;
    RiskSnapshot noisy = risk(List.of(), List.of("node_modules/a.js"), true);

    EligibilityContext batch = new EligibilityContext(false, noisy, null, null);
    assertThat(FixEligibility.eligibleActions(r, null, batch)).doesNotContain(FixAction.STAGE_COMMIT_PUSH);
    assertThat(FixEligibility.ineligibleReason(FixAction.STAGE_COMMIT_PUSH, r, batch))
      .startsWith("stage-commit-push is blocked: root .gitignore is missing and noisy uncommitted paths were detected");

    EligibilityContext interactive = new EligibilityContext(true, noisy, null, null);
    assertThat(FixEligibility.eligibleActions(r, null, interactive)).contains(FixAction.STAGE_COMMIT_PUSH);
    assertThat(FixEligibility.ineligibleReason(FixAction.STAGE_COMMIT_PUSH, r, interactive)).isEmpty();

    EligibilityContext withGitignore = new EligibilityContext(false, risk(List.of(), List.of("node_modules/a.js"), false), null, null);
    assertThat(FixEligibility.eligibleActions(r, null, withGitignore)).contains(FixAction.STAGE_COMMIT_PUSH);
  }

  @Test
  void secretsBlockCommitsEvenInteractively() {
    RepositoryRecord r = tracked();
    r.hasUntracked = true;
    EligibilityContext ctx = new EligibilityContext(true, risk(List.of("certs/server.pem", ".env"), List.of(), false), null, null);

    assertThat(FixEligibility.eligibleActions(r, null, ctx)).doesNotContain(FixAction.STAGE_COMMIT_PUSH);
    assertThat(FixEligibility.ineligibleReason(FixAction.STAGE_COMMIT_PUSH, r, ctx))
      .isEqualTo("stage-commit-push is blocked: secret-like uncommitted files detected (certs/server.pem, .env)");
  }

  @Test
  void selfExplanatoryActionsHaveNoReason() {
    RepositoryRecord r = tracked();
    for (FixAction action : EnumSet.complementOf(EnumSet.of(FixAction.STAGE_COMMIT_PUSH, FixAction.SYNC_WITH_UPSTREAM))) {
      assertThat(FixEligibility.ineligibleReason(action, r, NONE)).as("%s", action).isEmpty();
    }
  }

  @Test
  void eligibleActionsNeverRepeat() {
    RepositoryRecord r = tracked();
    r.originUrl = "";
    r.upstream = "";
    r.hasDirtyTracked = true;
    r.hasUntracked = true;
    List<FixAction> actions = FixEligibility.eligibleActions(r, null, NONE);
    assertThat(actions).doesNotHaveDuplicates().doesNotContain(FixAction.IGNORE);
    for (FixAction action : actions) {
      assertThat(FixEligibility.isEligible(action, r, null, NONE)).isTrue();
    }
  }
}
