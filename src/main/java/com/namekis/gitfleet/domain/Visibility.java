package com.namekis.gitfleet.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Visibility {
  PRIVATE("private"),
  PUBLIC("public"),
  UNKNOWN("unknown");

  private final String id;

  Visibility(String id) {
    this.id = id;
  }

  @JsonValue
  public String id() {
    return id;
  }

  public static Visibility parse(String raw) {
    String value = raw == null ? "" : raw.trim().toLowerCase();
    return switch (value) {
      case "private" -> PRIVATE;
      case "public" -> PUBLIC;
      case "", "unknown" -> UNKNOWN;
      default -> throw new IllegalArgumentException("invalid visibility \"%s\" (expected private or public)".formatted(raw));
    };
  }

  @JsonCreator
  public static Visibility normalize(String raw) {
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
