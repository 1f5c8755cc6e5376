package com.namekis.gitfleet.risk;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import one.util.streamex.StreamEx;

/** Root {@code .gitignore} maintenance for the stage-commit-push fix. */
public final class Gitignores {
  public static final String FILE_NAME = ".gitignore";
  static final String GENERATED_HEADER = "# Generated by gitfleet fix";
  static final String ADDED_HEADER = "# Added by gitfleet fix";

  private Gitignores() {
  }

  /** Trimmed, non blank, unique and sorted. */
  public static List<String> clean(List<String> patterns) {
    return StreamEx.of(patterns == null ? List.<String>of() : patterns).nonNull().map(String::trim).remove(String::isEmpty).distinct()
      .sorted().toList();
  }

  /** Patterns not already present as a line of the root ignore file. All of them when the file does not exist. */
  public static List<String> missingPatterns(Path repo, List<String> patterns) {
    Path file = repo.resolve(FILE_NAME);
    if (!Files.exists(file)) {
      return clean(patterns);
    }
    Set<String> existing = new HashSet<>();
    try {
      for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
        existing.add(line.trim());
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed reading %s: %s".formatted(file, e.getMessage()), e);
    }
    return StreamEx.of(clean(patterns)).remove(existing::contains).toList();
  }

  /** Creates the root ignore file with the patterns. Does nothing when it already exists or there is nothing to write. */
  public static void writeGenerated(Path repo, List<String> patterns) {
    Path file = repo.resolve(FILE_NAME);
    List<String> cleaned = clean(patterns);
    if (cleaned.isEmpty() || Files.exists(file)) {
      return;
    }
    write(file, GENERATED_HEADER + "\n" + String.join("\n", cleaned) + "\n");
  }

  /** Appends the patterns the root ignore file lacks, creating it when missing. */
  public static void writeOrAppend(Path repo, List<String> patterns) {
    Path file = repo.resolve(FILE_NAME);
    if (!Files.exists(file)) {
      writeGenerated(repo, patterns);
      return;
    }
    List<String> missing = missingPatterns(repo, patterns);
    if (missing.isEmpty()) {
      return;
    }
    try {
      String content = Files.readString(file, StandardCharsets.UTF_8);
      if (!content.isEmpty() && !content.endsWith("\n")) {
        content += "\n";
      }
      write(file, content + ADDED_HEADER + "\n" + String.join("\n", missing) + "\n");
    } catch (IOException e) {
      throw new UncheckedIOException("Failed reading %s: %s".formatted(file, e.getMessage()), e);
    }
  }

  private static void write(Path file, String content) {
    try {
      Files.writeString(file, content, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed writing %s: %s".formatted(file, e.getMessage()), e);
    }
  }
}
