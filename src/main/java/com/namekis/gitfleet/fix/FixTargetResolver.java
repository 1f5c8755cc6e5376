package com.namekis.gitfleet.fix;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;

import one.util.streamex.StreamEx;

/** Narrows a user supplied project selector to exactly one loaded repository. */
public final class FixTargetResolver {
  private FixTargetResolver() {
  }

  /**
   * Tries an exact path, then a case insensitive repo key, then an exact short name. Two or more matches at the same stage are an
   * error listing the matching paths.
   */
  public static FixRepoState resolve(String selector, List<FixRepoState> repos) {
    if (repos == null || repos.isEmpty()) {
      throw new FixTargetException("no repositories found for selected catalogs");
    }
    String wanted = selector == null ? "" : selector.trim();
    if (wanted.isEmpty()) {
      throw new FixTargetException("project is required");
    }

    Path wantedPath = cleanPath(wanted);
    if (wantedPath != null) {
      for (FixRepoState repo : repos) {
        if (wantedPath.equals(cleanPath(repo.record().path))) {
          return repo;
        }
      }
    }

    List<FixRepoState> byKey = StreamEx.of(repos)
      .filter(r -> r.record().repoKey != null && r.record().repoKey.trim().equalsIgnoreCase(wanted))
      .toList();
    if (!byKey.isEmpty()) {
      return unique(wanted, byKey);
    }
    List<FixRepoState> byName = StreamEx.of(repos).filter(r -> wanted.equals(r.record().name)).toList();
    if (!byName.isEmpty()) {
      return unique(wanted, byName);
    }
    throw new FixTargetException("project \"%s\" not found".formatted(wanted));
  }

  private static FixRepoState unique(String selector, List<FixRepoState> matches) {
    if (matches.size() == 1) {
      return matches.get(0);
    }
    String paths = StreamEx.of(matches).map(m -> m.record().path).sorted().joining(", ");
    throw new FixTargetException("project selector \"%s\" is ambiguous; matches: %s".formatted(selector, paths));
  }

  /** Null for blank or unparsable paths, which then match nothing. */
  private static Path cleanPath(String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    try {
      return Path.of(raw).normalize();
    } catch (InvalidPathException e) {
      return null;
    }
  }
}
