package com.namekis.gitfleet.git;

/** Result of a dry run of a rebase or merge against the upstream ref. */
public enum SyncProbeOutcome {
  UNKNOWN("unknown"),
  CLEAN("clean"),
  CONFLICT("conflict"),
  /** The probe itself could not complete. Distinct from a real conflict. */
  PROBE_FAILED("probe_failed");

  private final String id;

  SyncProbeOutcome(String id) {
    this.id = id;
  }

  public String id() {
    return id;
  }

  @Override
  public String toString() {
    return id;
  }
}
