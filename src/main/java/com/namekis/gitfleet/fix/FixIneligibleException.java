package com.namekis.gitfleet.fix;

/** The requested action is not safe for the repository in its current state. Re-evaluate and pick another action. */
public class FixIneligibleException extends FixException {
  private final FixAction action;
  private final String reason;

  public FixIneligibleException(FixAction action, String reason) {
    super(message(reason));
    this.action = action;
    this.reason = reason == null ? "" : reason.trim();
  }

  private static String message(String reason) {
    if (reason == null || reason.isBlank()) {
      return "fix action not eligible";
    }
    return "fix action not eligible: " + reason.trim();
  }

  public FixAction action() {
    return action;
  }

  /** Empty when there is nothing more specific to say than the eligibility table. */
  public String reason() {
    return reason;
  }
}
