package com.namekis.gitfleet.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum UnsyncableReason {
  MISSING_ORIGIN("missing_origin"),
  OPERATION_IN_PROGRESS("operation_in_progress"),
  DIRTY_TRACKED("dirty_tracked"),
  DIRTY_UNTRACKED("dirty_untracked"),
  MISSING_UPSTREAM("missing_upstream"),
  DIVERGED("diverged"),
  PUSH_POLICY_BLOCKED("push_policy_blocked"),
  PUSH_ACCESS_BLOCKED("push_access_blocked"),
  PUSH_FAILED("push_failed"),
  PULL_FAILED("pull_failed"),
  SYNC_CONFLICT("sync_conflict"),
  SYNC_PROBE_FAILED("sync_probe_failed");

  private final String code;

  UnsyncableReason(String code) {
    this.code = code;
  }

  @JsonValue
  public String code() {
    return code;
  }

  @JsonCreator
  public static UnsyncableReason of(String raw) {
    String value = raw == null ? "" : raw.trim().toLowerCase();
    for (UnsyncableReason reason : values()) {
      if (reason.code.equals(value)) {
        return reason;
      }
    }
    throw new IllegalArgumentException("invalid unsyncable reason \"%s\"".formatted(raw));
  }

  @Override
  public String toString() {
    return code;
  }
}
