package com.namekis.gitfleet.fix;

import com.namekis.gitfleet.git.SyncProbeOutcome;
import com.namekis.gitfleet.git.SyncStrategy;

/**
 * Dry run results of both sync strategies for one load of a repository.
 *
 * @param checked whether the probes ran at all
 */
public record SyncFeasibility(boolean checked, SyncProbeOutcome rebaseOutcome, SyncProbeOutcome mergeOutcome) {
  public static final SyncFeasibility UNCHECKED = new SyncFeasibility(false, SyncProbeOutcome.UNKNOWN, SyncProbeOutcome.UNKNOWN);

  public SyncProbeOutcome outcomeFor(SyncStrategy strategy) {
    return switch (strategy == null ? SyncStrategy.DEFAULT : strategy) {
      case REBASE -> rebaseOutcome;
      case MERGE -> mergeOutcome;
    };
  }

  /** A strategy may be tried when it probed clean, or when the probe itself failed and the outcome is unknown but recoverable. */
  public boolean canAttemptFor(SyncStrategy strategy) {
    SyncProbeOutcome outcome = outcomeFor(strategy);
    return outcome == SyncProbeOutcome.CLEAN || outcome == SyncProbeOutcome.PROBE_FAILED;
  }

  public boolean cleanFor(SyncStrategy strategy) {
    return outcomeFor(strategy) == SyncProbeOutcome.CLEAN;
  }

  public boolean conflictFor(SyncStrategy strategy) {
    return outcomeFor(strategy) == SyncProbeOutcome.CONFLICT;
  }

  public boolean probeFailedFor(SyncStrategy strategy) {
    return outcomeFor(strategy) == SyncProbeOutcome.PROBE_FAILED;
  }

  public boolean anyProbeFailed() {
    return rebaseOutcome == SyncProbeOutcome.PROBE_FAILED || mergeOutcome == SyncProbeOutcome.PROBE_FAILED;
  }

  public boolean anyClean() {
    return rebaseOutcome == SyncProbeOutcome.CLEAN || mergeOutcome == SyncProbeOutcome.CLEAN;
  }

  /** The default strategy conflicts and the other one offers no clean way out. */
  public boolean defaultStrategyConflictWithoutCleanFallback() {
    return conflictFor(SyncStrategy.DEFAULT) && !anyClean();
  }
}
