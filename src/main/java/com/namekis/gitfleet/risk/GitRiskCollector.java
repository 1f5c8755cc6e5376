package com.namekis.gitfleet.risk;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.namekis.gitfleet.git.GitClient;

import one.util.streamex.StreamEx;

/** Builds a {@link RiskSnapshot} from {@code git status --porcelain} and {@code git diff --numstat}. */
public class GitRiskCollector implements RiskCollector {
  private static final Logger log = LoggerFactory.getLogger(GitRiskCollector.class);
  static final List<String> NOISY_DIRS = List.of("node_modules", ".venv", "venv", "dist", "build", "target", "coverage", ".next",
    ".turbo");
  private static final Set<String> SECRET_FILE_NAMES = Set.of(".env", "id_rsa", "id_dsa", "id_ecdsa", "id_ed25519");
  private static final Set<String> SECRET_EXTENSIONS = Set.of(".pem", ".key", ".p12", ".pfx", ".jks", ".keystore");

  private final GitClient git;

  public GitRiskCollector(GitClient git) {
    this.git = git;
  }

  record StatusEntry(String path, String status) {
  }

  record Counts(int added, int deleted) {
  }

  @Override
  public RiskSnapshot collect(Path repo) {
    boolean missingRootGitignore = !Files.exists(repo.resolve(Gitignores.FILE_NAME));
    Map<String, Counts> stats = new HashMap<>();
    mergeNumstat(stats, git.diffNumstat(repo, false));
    mergeNumstat(stats, git.diffNumstat(repo, true));

    List<ChangedFile> changed = new ArrayList<>();
    Set<String> secret = new TreeSet<>();
    Set<String> noisy = new TreeSet<>();
    for (StatusEntry entry : parseStatusPorcelain(git.statusPorcelain(repo))) {
      Counts counts = stats.get(entry.path());
      if (counts == null && entry.status().equals("untracked")) {
        counts = new Counts(countFileLines(repo.resolve(entry.path())), 0);
      }
      changed.add(new ChangedFile(entry.path(), entry.status(), counts == null ? 0 : counts.added(), counts == null ? 0 : counts.deleted()));
      if (isSecretLike(entry.path())) {
        secret.add(entry.path());
      }
      if (!noisyPattern(entry.path()).isEmpty()) {
        noisy.add(entry.path());
      }
    }
    changed.sort((a, b) -> a.path().compareTo(b.path()));
    List<String> suggested = suggestedPatterns(repo, changed);
    return new RiskSnapshot(changed, List.copyOf(secret), List.copyOf(noisy), missingRootGitignore, suggested,
      Gitignores.missingPatterns(repo, suggested));
  }

  static List<StatusEntry> parseStatusPorcelain(String raw) {
    List<StatusEntry> out = new ArrayList<>();
    for (String line : raw.split("\n")) {
      line = line.replace("\r", "");
      if (line.isBlank() || line.length() < 4) {
        continue;
      }
      String code = line.substring(0, 2);
      String path = line.substring(3).trim();
      if (path.isEmpty()) {
        continue;
      }
      int arrow = path.lastIndexOf(" -> ");
      if (arrow >= 0) {
        path = path.substring(arrow + " -> ".length());
      }
      String status;
      if (code.equals("??")) {
        status = "untracked";
      } else if (code.contains("D")) {
        status = "deleted";
      } else if (code.contains("A")) {
        status = "added";
      } else if (code.contains("R")) {
        status = "renamed";
      } else {
        status = "modified";
      }
      out.add(new StatusEntry(path.replace('\\', '/'), status));
    }
    return out;
  }

  static void mergeNumstat(Map<String, Counts> into, String raw) {
    for (String line : raw.split("\n")) {
      String[] parts = line.split("\t");
      if (line.isBlank() || parts.length < 3) {
        continue;
      }
      Integer added = parseCount(parts[0]);
      Integer deleted = parseCount(parts[1]);
      if (added == null || deleted == null) {
        // binary files report "-"
        continue;
      }
      String path = parts[parts.length - 1].replace('\\', '/');
      into.merge(path, new Counts(added, deleted), (a, b) -> new Counts(a.added() + b.added(), a.deleted() + b.deleted()));
    }
  }

  private static Integer parseCount(String raw) {
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }

  static boolean isSecretLike(String path) {
    String normalized = path.replace('\\', '/');
    String base = normalized.substring(normalized.lastIndexOf('/') + 1).toLowerCase(Locale.ROOT);
    if (SECRET_FILE_NAMES.contains(base)) {
      return true;
    }
    int dot = base.lastIndexOf('.');
    return dot > 0 && SECRET_EXTENSIONS.contains(base.substring(dot));
  }

  /** The ignore pattern covering the first noisy directory segment of the path, or empty. */
  static String noisyPattern(String path) {
    for (String segment : path.replace('\\', '/').toLowerCase(Locale.ROOT).split("/")) {
      if (NOISY_DIRS.contains(segment)) {
        return segment + "/";
      }
    }
    return "";
  }

  static List<String> suggestedPatterns(Path repo, List<ChangedFile> changed) {
    Set<String> patterns = new TreeSet<>();
    StreamEx.of(changed).map(f -> noisyPattern(f.path())).remove(String::isEmpty).forEach(patterns::add);
    for (String dir : NOISY_DIRS) {
      if (Files.isDirectory(repo.resolve(dir))) {
        patterns.add(dir + "/");
      }
    }
    return List.copyOf(patterns);
  }

  private static int countFileLines(Path file) {
    if (!Files.isRegularFile(file)) {
      return 0;
    }
    try {
      byte[] data = Files.readAllBytes(file);
      if (data.length == 0) {
        return 0;
      }
      int lines = 1;
      for (byte b : data) {
        if (b == '\n') {
          lines++;
        }
      }
      return lines;
    } catch (IOException e) {
      log.debug("cannot count lines of {}: {}", file, e.getMessage());
      return 0;
    }
  }
}
