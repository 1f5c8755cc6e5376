package com.namekis.gitfleet.fix;

public enum StepStatus {
  RUNNING,
  DONE,
  FAILED,
  /** The step was planned but its condition did not hold, for example fetch prune disabled by config. */
  SKIPPED;

  public String id() {
    return name().toLowerCase();
  }
}
