package com.namekis.gitfleet.domain;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Repo keys are {@code <catalog>/<relative path>}, stable while a clone stays in its catalog. */
public final class RepoKeys {
  private RepoKeys() {
  }

  public record Derived(String repoKey, String relativePath, String repoName) {
  }

  public static Optional<Derived> derive(Catalog catalog, Path repoPath) {
    Path root = Path.of(catalog.root).toAbsolutePath().normalize();
    Path path = repoPath.toAbsolutePath().normalize();
    if (!path.startsWith(root) || path.equals(root)) {
      return Optional.empty();
    }
    return deriveFromRelative(catalog, root.relativize(path).toString());
  }

  public static Optional<Derived> deriveFromRelative(Catalog catalog, String relativePath) {
    String name = catalog.name == null ? "" : catalog.name.trim();
    if (name.isEmpty()) {
      return Optional.empty();
    }
    List<String> parts = new ArrayList<>();
    for (String part : relativePath.replace('\\', '/').split("/")) {
      String trimmed = part.trim();
      if (!trimmed.isEmpty() && !trimmed.equals(".")) {
        parts.add(trimmed);
      }
    }
    if (parts.size() != catalog.effectiveRepoPathDepth()) {
      return Optional.empty();
    }
    String normalized = String.join("/", parts);
    return Optional.of(new Derived(name + "/" + normalized, normalized, parts.get(parts.size() - 1)));
  }
}
