package com.namekis.gitfleet.domain;

/** Decides whether an observed repository is safe for automatic synchronization. */
public final class Syncability {
  private Syncability() {
  }

  /**
   * Recomputes {@code syncable} and the reasons of a freshly observed record from its git state, then rehashes it.
   *
   * @param autoPushAllowed whether the repository policy lets pending local commits be pushed automatically
   */
  public static void evaluate(RepositoryRecord record, boolean includeUntrackedAsDirty, boolean autoPushAllowed, PushAccess pushAccess) {
    ReasonSet reasons = new ReasonSet();
    if (!record.hasOrigin()) {
      reasons.add(UnsyncableReason.MISSING_ORIGIN);
    }
    if (record.operationRunning()) {
      reasons.add(UnsyncableReason.OPERATION_IN_PROGRESS);
    }
    if (record.hasDirtyTracked) {
      reasons.add(UnsyncableReason.DIRTY_TRACKED);
    }
    if (includeUntrackedAsDirty && record.hasUntracked) {
      reasons.add(UnsyncableReason.DIRTY_UNTRACKED);
    }
    if (!record.hasUpstream()) {
      reasons.add(UnsyncableReason.MISSING_UPSTREAM);
    }
    if (record.diverged) {
      reasons.add(UnsyncableReason.DIVERGED);
    }
    if (record.ahead > 0) {
      if (pushAccess == PushAccess.READ_ONLY) {
        reasons.add(UnsyncableReason.PUSH_ACCESS_BLOCKED);
      } else if (!autoPushAllowed) {
        reasons.add(UnsyncableReason.PUSH_POLICY_BLOCKED);
      }
    }
    record.unsyncableReasons = reasons;
    record.syncable = reasons.isEmpty();
    record.rehash();
  }

  /**
   * Whether auto-push applies to the given branch: any branch when enabled except the default one, which additionally needs
   * {@link AutoPushMode#INCLUDE_DEFAULT_BRANCH} or a catalog override.
   */
  public static boolean autoPushAllowed(AutoPushMode mode, boolean onDefaultBranch, boolean catalogAllowsDefaultBranch) {
    if (mode == null || !mode.enabled()) {
      return false;
    }
    if (!onDefaultBranch) {
      return true;
    }
    return mode == AutoPushMode.INCLUDE_DEFAULT_BRANCH || catalogAllowsDefaultBranch;
  }
}
