package com.namekis.gitfleet.fix;

import java.util.ArrayList;
import java.util.List;

import com.namekis.gitfleet.domain.AutoPushMode;
import com.namekis.gitfleet.domain.PushAccess;
import com.namekis.gitfleet.domain.RepoMetadata;
import com.namekis.gitfleet.domain.RepositoryRecord;
import com.namekis.gitfleet.domain.UnsyncableReason;

/**
 * Which fix actions are safe for a repository right now. Pure functions of the observed record, its metadata and the caller
 * context; the returned order is the priority in which callers present the actions.
 */
public final class FixEligibility {
  private FixEligibility() {
  }

  public static List<FixAction> eligibleActions(RepositoryRecord r, RepoMetadata metadata, EligibilityContext ctx) {
    if (r.operationRunning()) {
      return List.of(FixAction.ABORT_OPERATION);
    }
    PushAccess access = metadata == null ? PushAccess.READ_WRITE : (metadata.pushAccess == null ? PushAccess.UNKNOWN : metadata.pushAccess);
    boolean pushAllowed = metadata == null || !r.hasOrigin() || access.permitsPush();
    boolean clean = !r.dirty();

    List<FixAction> actions = new ArrayList<>(5);
    if (!r.hasOrigin()) {
      actions.add(FixAction.CREATE_PROJECT);
    }
    if (r.hasOrigin() && r.hasUpstream() && r.diverged && clean && ctx.syncFeasibility().canAttemptFor(ctx.syncStrategy())) {
      actions.add(FixAction.SYNC_WITH_UPSTREAM);
    }
    if (r.hasOrigin() && r.hasUpstream() && r.ahead > 0 && !r.diverged && pushAllowed) {
      actions.add(FixAction.PUSH);
    }
    if (r.dirty() && !r.diverged && pushBeforeCommitAllowed(r) && (!r.hasOrigin() || pushAllowed) && !riskBlocksCommit(ctx)) {
      actions.add(FixAction.STAGE_COMMIT_PUSH);
    }
    if (r.hasUpstream() && r.behind > 0 && r.ahead == 0 && !r.diverged && clean) {
      actions.add(FixAction.PULL_FF_ONLY);
    }
    if (r.hasOrigin() && !r.hasUpstream() && r.hasBranch() && !r.diverged && pushAllowed) {
      actions.add(FixAction.SET_UPSTREAM_PUSH);
    }
    if (r.hasOrigin() && access == PushAccess.READ_ONLY && r.hasRepoKey()) {
      actions.add(FixAction.FORK_AND_RETARGET);
    }
    if (metadata != null && r.hasRepoKey() && access == PushAccess.READ_WRITE) {
      AutoPushMode mode = metadata.autoPush == null ? AutoPushMode.DISABLED : metadata.autoPush;
      if (mode == AutoPushMode.DISABLED
        || (mode == AutoPushMode.ENABLED && r.unsyncableReasons.contains(UnsyncableReason.PUSH_POLICY_BLOCKED))) {
        actions.add(FixAction.ENABLE_AUTO_PUSH);
      }
    }
    return List.copyOf(actions);
  }

  public static boolean isEligible(FixAction action, RepositoryRecord r, RepoMetadata metadata, EligibilityContext ctx) {
    return eligibleActions(r, metadata, ctx).contains(action);
  }

  /**
   * Explains why {@code stage-commit-push} or {@code sync-with-upstream} is blocked. Every other action is self explanatory from the
   * eligibility table and gets an empty string.
   */
  public static String ineligibleReason(FixAction action, RepositoryRecord r, EligibilityContext ctx) {
    return switch (action) {
      case STAGE_COMMIT_PUSH -> stageCommitPushReason(r, ctx);
      case SYNC_WITH_UPSTREAM -> syncWithUpstreamReason(ctx);
      case IGNORE, ABORT_OPERATION, CREATE_PROJECT, FORK_AND_RETARGET, PUSH, PULL_FF_ONLY, SET_UPSTREAM_PUSH, ENABLE_AUTO_PUSH -> "";
    };
  }

  /** Without an upstream relationship a push cannot be rejected for being behind. */
  static boolean pushBeforeCommitAllowed(RepositoryRecord r) {
    return !r.hasOrigin() || !r.hasUpstream() || (!r.diverged && r.behind == 0);
  }

  static boolean riskBlocksCommit(EligibilityContext ctx) {
    return ctx.risk().hasSecretLikeChanges() || (ctx.risk().hasNoisyChangesWithoutGitignore() && !ctx.interactive());
  }

  static String stageCommitPushReason(RepositoryRecord r, EligibilityContext ctx) {
    String label = FixAction.STAGE_COMMIT_PUSH.id();
    if (r.hasOrigin() && r.hasUpstream() && (r.diverged || r.behind > 0)) {
      return label + " is blocked: branch is behind upstream, so push would be rejected; run sync-with-upstream first";
    }
    if (ctx.risk().hasSecretLikeChanges()) {
      return "%s is blocked: secret-like uncommitted files detected (%s)".formatted(label,
        String.join(", ", ctx.risk().secretLikeChangedPaths()));
    }
    if (ctx.risk().hasNoisyChangesWithoutGitignore() && !ctx.interactive()) {
      return label + " is blocked: root .gitignore is missing and noisy uncommitted paths were detected;"
        + " run an interactive fix to review/generate .gitignore or add it manually";
    }
    return "";
  }

  static String syncWithUpstreamReason(EligibilityContext ctx) {
    String label = FixAction.SYNC_WITH_UPSTREAM.id();
    SyncFeasibility feasibility = ctx.syncFeasibility();
    if (!feasibility.checked()) {
      return label + " is blocked: sync feasibility has not been validated";
    }
    return syncStrategyBlock(label, feasibility, ctx);
  }

  /** Shared by the explainer and by the execution time re-check. Empty when the selected strategy probed clean. */
  static String syncStrategyBlock(String label, SyncFeasibility feasibility, EligibilityContext ctx) {
    if (feasibility.conflictFor(ctx.syncStrategy())) {
      return "%s is blocked: %s (selected strategy: %s)".formatted(label, UnsyncableReason.SYNC_CONFLICT.code(), ctx.syncStrategy());
    }
    if (feasibility.probeFailedFor(ctx.syncStrategy())) {
      return "%s is blocked: %s (selected strategy: %s)".formatted(label, UnsyncableReason.SYNC_PROBE_FAILED.code(),
        ctx.syncStrategy());
    }
    if (!feasibility.cleanFor(ctx.syncStrategy())) {
      return "%s is blocked: sync strategy %s is not marked clean by feasibility validation".formatted(label, ctx.syncStrategy());
    }
    return "";
  }
}
