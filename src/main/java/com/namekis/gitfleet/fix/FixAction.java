package com.namekis.gitfleet.fix;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonValue;

import one.util.streamex.StreamEx;

/** The remediation actions a repository may be offered, in no particular priority. */
public enum FixAction {
  IGNORE("ignore", "Ignore for this session", "Hide this repository from the current interactive fix run without changing files.",
      false),
  ABORT_OPERATION("abort-operation", "Abort operation", "Cancel the active git operation (merge, rebase, cherry-pick or bisect).",
      true),
  CREATE_PROJECT("create-project", "Create project & push",
      "Create the GitHub project, set it as origin, register repo metadata and push the current branch.", true),
  FORK_AND_RETARGET("fork-and-retarget", "Fork & retarget remote",
      "Fork the origin under your GitHub owner, add the fork as a remote, push this branch there and update repo metadata.", true),
  SYNC_WITH_UPSTREAM("sync-with-upstream", "Sync with upstream",
      "Integrate upstream commits into the local branch with the selected strategy (rebase by default).", true),
  PUSH("push", "Push commits", "Push local commits that are ahead of upstream.", true),
  STAGE_COMMIT_PUSH("stage-commit-push", "Stage, commit & push",
      "Stage all local changes and commit them; push when a remote is configured.", true),
  PULL_FF_ONLY("pull-ff-only", "Pull (ff-only)", "Fast-forward the branch to upstream without a merge commit.", false),
  SET_UPSTREAM_PUSH("set-upstream-push", "Set upstream & push", "Push this branch and set its upstream tracking branch.", true),
  ENABLE_AUTO_PUSH("enable-auto-push", "Allow auto-push", "Let future syncs push this repository by enabling its auto-push policy.",
      false);

  private final String id;
  private final String label;
  private final String description;
  private final boolean risky;

  FixAction(String id, String label, String description, boolean risky) {
    this.id = id;
    this.label = label;
    this.description = description;
    this.risky = risky;
  }

  @JsonValue
  public String id() {
    return id;
  }

  public String label() {
    return label;
  }

  public String description() {
    return description;
  }

  /** Whether the action changes the working tree, the history or a remote. */
  public boolean risky() {
    return risky;
  }

  public static FixAction parse(String raw) {
    String value = raw == null ? "" : raw.trim();
    return Arrays.stream(values())
      .filter(a -> a.id.equals(value))
      .findFirst()
      .orElseThrow(() -> new IllegalArgumentException("unknown fix action \"%s\" (expected one of %s)".formatted(raw,
        StreamEx.of(values()).map(FixAction::id).joining(", "))));
  }

  @Override
  public String toString() {
    return id;
  }
}
