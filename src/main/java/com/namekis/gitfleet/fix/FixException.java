package com.namekis.gitfleet.fix;

/** Base of the errors a fix reports to its caller. */
public class FixException extends RuntimeException {
  public FixException(String message) {
    super(message);
  }

  public FixException(String message, Throwable cause) {
    super(message, cause);
  }
}
