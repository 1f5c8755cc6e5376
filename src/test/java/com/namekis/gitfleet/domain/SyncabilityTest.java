package com.namekis.gitfleet.domain;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SyncabilityTest {
  private static RepositoryRecord clean() {
    RepositoryRecord r = new RepositoryRecord();
    r.repoKey = "software/tool";
    r.name = "tool";
    r.path = "/src/tool";
    r.originUrl = "git@github.com:acme/tool.git";
    r.branch = "main";
    r.upstream = "origin/main";
    return r;
  }

  @Test
  void cleanRecordIsSyncable() {
    RepositoryRecord r = clean();
    Syncability.evaluate(r, true, true, PushAccess.READ_WRITE);

    assertThat(r.syncable).isTrue();
    assertThat(r.unsyncableReasons.isEmpty()).isTrue();
    assertThat(r.stateHash).startsWith("sha256:");
  }

  @Test
  void collectsReasonsInEvaluationOrder() {
    RepositoryRecord r = clean();
    r.originUrl = "";
    r.upstream = "";
    r.hasDirtyTracked = true;
    r.hasUntracked = true;
    r.operationInProgress = Operation.REBASE;
    Syncability.evaluate(r, true, true, PushAccess.UNKNOWN);

    assertThat(r.syncable).isFalse();
    assertThat(r.unsyncableReasons.asList()).containsExactly(UnsyncableReason.MISSING_ORIGIN, UnsyncableReason.OPERATION_IN_PROGRESS,
      UnsyncableReason.DIRTY_TRACKED, UnsyncableReason.DIRTY_UNTRACKED, UnsyncableReason.MISSING_UPSTREAM);
  }

  @Test
  void untrackedFilesCanBeTolerated() {
    RepositoryRecord r = clean();
    r.hasUntracked = true;
    Syncability.evaluate(r, false, true, PushAccess.UNKNOWN);

    assertThat(r.syncable).isTrue();
  }

  @Test
  void aheadIsBlockedByAccessBeforePolicy() {
    RepositoryRecord readOnly = clean();
    readOnly.ahead = 2;
    Syncability.evaluate(readOnly, true, false, PushAccess.READ_ONLY);
    assertThat(readOnly.unsyncableReasons.asList()).containsExactly(UnsyncableReason.PUSH_ACCESS_BLOCKED);

    RepositoryRecord policy = clean();
    policy.ahead = 2;
    Syncability.evaluate(policy, true, false, PushAccess.UNKNOWN);
    assertThat(policy.unsyncableReasons.asList()).containsExactly(UnsyncableReason.PUSH_POLICY_BLOCKED);
  }

  @Test
  void defaultBranchNeedsExplicitAllowance() {
    assertThat(Syncability.autoPushAllowed(AutoPushMode.ENABLED, false, false)).isTrue();
    assertThat(Syncability.autoPushAllowed(AutoPushMode.ENABLED, true, false)).isFalse();
    assertThat(Syncability.autoPushAllowed(AutoPushMode.ENABLED, true, true)).isTrue();
    assertThat(Syncability.autoPushAllowed(AutoPushMode.INCLUDE_DEFAULT_BRANCH, true, false)).isTrue();
    assertThat(Syncability.autoPushAllowed(AutoPushMode.DISABLED, false, true)).isFalse();
  }

  @Test
  void appendingAReasonTwiceChangesNothing() {
    RepositoryRecord r = clean();
    Syncability.evaluate(r, true, true, PushAccess.READ_WRITE);
    String before = r.stateHash;

    assertThat(r.appendUniqueUnsyncableReason(UnsyncableReason.SYNC_CONFLICT)).isTrue();
    String after = r.stateHash;
    assertThat(r.appendUniqueUnsyncableReason(UnsyncableReason.SYNC_CONFLICT)).isFalse();

    assertThat(r.syncable).isFalse();
    assertThat(after).isNotEqualTo(before);
    assertThat(r.stateHash).isEqualTo(after);
  }
}
