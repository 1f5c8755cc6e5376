package com.namekis.gitfleet.github;

import java.util.Optional;

import com.namekis.gitfleet.domain.OriginIdentity;

public final class GitHubUrls {
  public static final String HOST = "github.com";

  private GitHubUrls() {
  }

  public record OwnerRepo(String owner, String repo) {
    @Override
    public String toString() {
      return owner + "/" + repo;
    }
  }

  /** {@code git@github.com:owner/repo.git} or {@code https://github.com/owner/repo.git} for protocol https. */
  public static String remoteUrl(String owner, String repo, String protocol) {
    String o = owner == null ? "" : owner.trim();
    String r = repo == null ? "" : repo.trim();
    if (o.isEmpty()) {
      throw new IllegalArgumentException("github owner is required");
    }
    if (r.isEmpty()) {
      throw new IllegalArgumentException("github repository is required");
    }
    if ("https".equalsIgnoreCase(protocol == null ? "" : protocol.trim())) {
      return "https://%s/%s/%s.git".formatted(HOST, o, r);
    }
    return "git@%s:%s/%s.git".formatted(HOST, o, r);
  }

  /** Owner and repository of a GitHub hosted origin, empty for other hosts or unparsable URLs. */
  public static Optional<OwnerRepo> sourceRepo(String originUrl) {
    String identity;
    try {
      identity = OriginIdentity.normalize(originUrl);
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
    String[] parts = identity.split("/");
    if (parts.length != 3 || !parts[0].equals(HOST)) {
      return Optional.empty();
    }
    return Optional.of(new OwnerRepo(parts[1], parts[2]));
  }
}
