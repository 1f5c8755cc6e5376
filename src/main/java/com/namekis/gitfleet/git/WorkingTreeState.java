package com.namekis.gitfleet.git;

public record WorkingTreeState(boolean dirtyTracked, boolean untracked) {
  public static final WorkingTreeState CLEAN = new WorkingTreeState(false, false);
}
