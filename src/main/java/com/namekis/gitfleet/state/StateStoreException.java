package com.namekis.gitfleet.state;

/** Persisted state could not be read, written or locked. */
public class StateStoreException extends RuntimeException {
  public StateStoreException(String message) {
    super(message);
  }

  public StateStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
