package com.namekis.gitfleet.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Per repository policy for pushing local commits automatically. {@link #INCLUDE_DEFAULT_BRANCH} extends {@link #ENABLED} to the
 * repository default branch.
 */
public enum AutoPushMode {
  DISABLED("disabled"),
  ENABLED("enabled"),
  INCLUDE_DEFAULT_BRANCH("include-default-branch");

  private final String id;

  AutoPushMode(String id) {
    this.id = id;
  }

  @JsonValue
  public String id() {
    return id;
  }

  public boolean enabled() {
    return this != DISABLED;
  }

  /** Strict parse accepting the legacy boolean spelling. */
  public static AutoPushMode parse(String raw) {
    String value = raw == null ? "" : raw.trim().toLowerCase();
    return switch (value) {
      case "disabled", "false" -> DISABLED;
      case "enabled", "true" -> ENABLED;
      case "include-default-branch" -> INCLUDE_DEFAULT_BRANCH;
      default -> throw new IllegalArgumentException("invalid auto-push mode \"%s\"".formatted(raw));
    };
  }

  /** Lenient variant used when reading persisted metadata: anything unknown is {@link #DISABLED}. */
  @JsonCreator
  public static AutoPushMode normalize(String raw) {
    try {
      return parse(raw);
    } catch (IllegalArgumentException e) {
      return DISABLED;
    }
  }

  public static AutoPushMode fromEnabled(boolean enabled) {
    return enabled ? ENABLED : DISABLED;
  }

  @Override
  public String toString() {
    return id;
  }
}
