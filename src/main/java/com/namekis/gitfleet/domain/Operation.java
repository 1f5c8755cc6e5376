package com.namekis.gitfleet.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Git operation left in progress in a working tree. */
public enum Operation {
  NONE("none"),
  MERGE("merge"),
  REBASE("rebase"),
  CHERRY_PICK("cherry-pick"),
  BISECT("bisect");

  private final String id;

  Operation(String id) {
    this.id = id;
  }

  @JsonValue
  public String id() {
    return id;
  }

  public boolean inProgress() {
    return this != NONE;
  }

  @JsonCreator
  public static Operation of(String raw) {
    if (raw == null || raw.isBlank()) {
      return NONE;
    }
    String value = raw.trim().toLowerCase();
    for (Operation operation : values()) {
      if (operation.id.equals(value)) {
        return operation;
      }
    }
    throw new IllegalArgumentException("invalid operation \"%s\"".formatted(raw));
  }

  @Override
  public String toString() {
    return id;
  }
}
