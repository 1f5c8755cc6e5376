package com.namekis.gitfleet.fix;

/** A step of a fix failed. Steps that completed before it are not undone. */
public class FixStepException extends FixException {
  private final FixPlanEntry entry;

  public FixStepException(FixPlanEntry entry, Throwable cause) {
    super("Failed on %s: [%s] %s".formatted(entry.id(), entry.summary(), cause.getMessage()), cause);
    this.entry = entry;
  }

  public FixPlanEntry entry() {
    return entry;
  }
}
