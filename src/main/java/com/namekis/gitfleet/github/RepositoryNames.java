package com.namekis.gitfleet.github;

import java.util.regex.Pattern;

/** Naming rules for repositories created on GitHub. */
public final class RepositoryNames {
  public static final int MAX_LENGTH = 100;
  private static final Pattern VALID = Pattern.compile("^[a-z0-9._-]+$");

  private RepositoryNames() {
  }

  /** Lowercases and replaces every run of unsupported characters between valid ones with a single dash. */
  public static String sanitize(String raw) {
    String value = raw == null ? "" : raw.trim();
    StringBuilder b = new StringBuilder(value.length());
    boolean pendingDash = false;
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c >= 'A' && c <= 'Z') {
        c = Character.toLowerCase(c);
      } else if (!validChar(c)) {
        pendingDash = true;
        continue;
      }
      if (pendingDash && b.length() > 0) {
        b.append('-');
      }
      pendingDash = false;
      b.append(c);
    }
    return b.length() > MAX_LENGTH ? b.substring(0, MAX_LENGTH) : b.toString();
  }

  public static void validate(String name) {
    String value = name == null ? "" : name.trim();
    if (value.isEmpty()) {
      throw new IllegalArgumentException("repository name is required");
    }
    if (value.length() > MAX_LENGTH) {
      throw new IllegalArgumentException("repository name must be <= %d characters".formatted(MAX_LENGTH));
    }
    if (value.equals(".") || value.equals("..")) {
      throw new IllegalArgumentException("repository name cannot be \".\" or \"..\"");
    }
    if (!VALID.matcher(value).matches()) {
      throw new IllegalArgumentException("repository name may contain only lowercase letters, numbers, \".\", \"-\", and \"_\"");
    }
  }

  private static boolean validChar(char c) {
    return (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '.' || c == '_' || c == '-';
  }
}
