package com.namekis.gitfleet.domain;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes remote URLs to {@code host/owner/repo} so that ssh, https and scp-like spellings of the same repository compare equal.
 */
public final class OriginIdentity {
  private static final Pattern SCP_LIKE = Pattern.compile("^([^@\\s]+)@([^:\\s]+):(.+)$");

  private OriginIdentity() {
  }

  public static String normalize(String origin) {
    String value = origin == null ? "" : origin.trim();
    if (value.isEmpty()) {
      throw new IllegalArgumentException("empty origin");
    }
    Matcher scp = SCP_LIKE.matcher(value);
    if (scp.matches() && !value.contains("://")) {
      String host = scp.group(2).trim().toLowerCase();
      String repoPath = normalizeRepoPath(scp.group(3));
      if (host.isEmpty() || repoPath.isEmpty()) {
        throw new IllegalArgumentException("invalid origin \"%s\"".formatted(origin));
      }
      return host + "/" + repoPath;
    }
    if (value.startsWith("/")) {
      String repoPath = normalizeRepoPath(value);
      if (repoPath.isEmpty()) {
        throw new IllegalArgumentException("invalid origin path \"%s\"".formatted(origin));
      }
      return "file/" + repoPath;
    }
    URI uri;
    try {
      uri = new URI(value);
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("parse origin \"%s\": %s".formatted(origin, e.getMessage()), e);
    }
    if (uri.getScheme() == null) {
      throw new IllegalArgumentException("invalid origin \"%s\"".formatted(origin));
    }
    if (uri.getScheme().equalsIgnoreCase("file")) {
      return "file/" + normalizeRepoPath(value.substring("file://".length()));
    }
    String host = uri.getHost() == null ? "" : uri.getHost().toLowerCase();
    String repoPath = normalizeRepoPath(uri.getPath());
    if (host.isEmpty() || repoPath.isEmpty()) {
      throw new IllegalArgumentException("invalid origin \"%s\"".formatted(origin));
    }
    return host + "/" + repoPath;
  }

  public static boolean sameRepository(String left, String right) {
    try {
      return normalize(left).equals(normalize(right));
    } catch (IllegalArgumentException e) {
      return false;
    }
  }

  static String normalizeRepoPath(String raw) {
    String value = raw == null ? "" : raw.trim();
    while (value.startsWith("/")) {
      value = value.substring(1);
    }
    while (value.endsWith("/")) {
      value = value.substring(0, value.length() - 1);
    }
    if (value.endsWith(".git")) {
      value = value.substring(0, value.length() - ".git".length());
    }
    value = java.nio.file.Path.of(value.isEmpty() ? "." : value).normalize().toString().replace('\\', '/');
    if (value.isEmpty() || value.equals(".")) {
      return "";
    }
    return value.toLowerCase();
  }
}
