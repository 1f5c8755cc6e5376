package com.namekis.gitfleet.fix;

/** A project selector matched no repository, or more than one. */
public class FixTargetException extends FixException {
  public FixTargetException(String message) {
    super(message);
  }
}
