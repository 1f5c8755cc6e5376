package com.namekis.gitfleet.fix;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.namekis.gitfleet.domain.RepositoryRecord;
import com.namekis.gitfleet.domain.UnsyncableReason;
import com.namekis.gitfleet.git.GitClient;
import com.namekis.gitfleet.git.SyncProbeOutcome;
import com.namekis.gitfleet.git.SyncStrategy;

/** Dry runs rebase and merge for diverged clean repositories and records the blocking reasons the results imply. */
public class SyncFeasibilityProber {
  private static final Logger log = LoggerFactory.getLogger(SyncFeasibilityProber.class);

  private final GitClient git;

  public SyncFeasibilityProber(GitClient git) {
    this.git = git;
  }

  /**
   * Probes both strategies when the record qualifies, otherwise returns {@link SyncFeasibility#UNCHECKED}. Adds
   * {@code sync_conflict} or {@code sync_probe_failed} to {@code record} when no strategy probed clean.
   */
  public SyncFeasibility probe(RepositoryRecord record) {
    if (!qualifies(record)) {
      return SyncFeasibility.UNCHECKED;
    }
    SyncFeasibility feasibility = new SyncFeasibility(true, probe(record, SyncStrategy.REBASE), probe(record, SyncStrategy.MERGE));
    if (feasibility.defaultStrategyConflictWithoutCleanFallback()) {
      record.appendUniqueUnsyncableReason(UnsyncableReason.SYNC_CONFLICT);
    }
    if (!feasibility.anyClean() && feasibility.anyProbeFailed()) {
      record.appendUniqueUnsyncableReason(UnsyncableReason.SYNC_PROBE_FAILED);
    }
    log.debug("[{}] sync feasibility rebase={} merge={}", record.name, feasibility.rebaseOutcome(), feasibility.mergeOutcome());
    return feasibility;
  }

  static boolean qualifies(RepositoryRecord record) {
    return record.hasOrigin() && record.hasUpstream() && record.diverged && !record.dirty() && !record.operationRunning();
  }

  private SyncProbeOutcome probe(RepositoryRecord record, SyncStrategy strategy) {
    try {
      SyncProbeOutcome outcome = git.probeSync(record.location(), record.upstream, strategy);
      return outcome == null ? SyncProbeOutcome.UNKNOWN : outcome;
    } catch (RuntimeException e) {
      log.warn("sync feasibility {} probe failed for {}: {}", strategy, record.path, e.getMessage());
      log.debug("probe failure", e);
      return SyncProbeOutcome.PROBE_FAILED;
    }
  }
}
