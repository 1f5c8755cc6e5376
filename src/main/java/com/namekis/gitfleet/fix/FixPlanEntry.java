package com.namekis.gitfleet.fix;

/**
 * One step of a fix action.
 *
 * @param command true when the step runs an external command, false for a side effect such as writing metadata
 * @param summary the command line or a sentence describing the side effect
 */
public record FixPlanEntry(String id, boolean command, String summary) {
  public static final String REVALIDATE_STATE_ID = "revalidate-state";
  public static final FixPlanEntry REVALIDATE_STATE = new FixPlanEntry(REVALIDATE_STATE_ID, false,
      "Revalidate repository status and syncability state.");

  public static FixPlanEntry command(String id, String summary) {
    return new FixPlanEntry(id, true, summary);
  }

  public static FixPlanEntry effect(String id, String summary) {
    return new FixPlanEntry(id, false, summary);
  }

  @Override
  public String toString() {
    return "%s: %s".formatted(id, summary);
  }
}
