package com.namekis.gitfleet.git;

public enum SyncStrategy {
  REBASE("rebase"),
  MERGE("merge");

  public static final SyncStrategy DEFAULT = REBASE;

  private final String id;

  SyncStrategy(String id) {
    this.id = id;
  }

  public String id() {
    return id;
  }

  /** Blank means {@link #DEFAULT}. */
  public static SyncStrategy parse(String raw) {
    String value = raw == null ? "" : raw.trim().toLowerCase();
    return switch (value) {
      case "" -> DEFAULT;
      case "rebase" -> REBASE;
      case "merge" -> MERGE;
      default -> throw new IllegalArgumentException("unsupported sync strategy \"%s\" (expected rebase or merge)".formatted(raw));
    };
  }

  @Override
  public String toString() {
    return id;
  }
}
