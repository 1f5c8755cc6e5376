package com.namekis.gitfleet.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Cached classification of whether the current credentials may push to the preferred remote. */
public enum PushAccess {
  UNKNOWN("unknown"),
  READ_ONLY("read-only"),
  READ_WRITE("read-write");

  private final String id;

  PushAccess(String id) {
    this.id = id;
  }

  @JsonValue
  public String id() {
    return id;
  }

  public boolean permitsPush() {
    return this == READ_WRITE;
  }

  public static PushAccess parse(String raw) {
    String value = raw == null ? "" : raw.trim().toLowerCase();
    return switch (value) {
      case "", "unknown" -> UNKNOWN;
      case "read-only" -> READ_ONLY;
      case "read-write" -> READ_WRITE;
      default -> throw new IllegalArgumentException("invalid push access \"%s\"".formatted(raw));
    };
  }

  @JsonCreator
  public static PushAccess normalize(String raw) {
    try {
      return parse(raw);
    } catch (IllegalArgumentException e) {
      return UNKNOWN;
    }
  }

  @Override
  public String toString() {
    return id;
  }
}
