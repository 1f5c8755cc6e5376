package com.namekis.gitfleet.state;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cross process lock implemented as a file created with create-new semantics. The file holds {@code pid}, {@code hostname} and
 * {@code created_at}; a lock older than {@link #MAX_AGE} or owned by a dead process on this host is stale and replaced once.
 */
public final class LockFile implements StateLock {
  private static final Logger log = LoggerFactory.getLogger(LockFile.class);
  static final Duration MAX_AGE = Duration.ofHours(24);

  private final Path path;
  private boolean released;

  private LockFile(Path path) {
    this.path = path;
  }

  record Owner(long pid, String hostname, Instant createdAt) {
  }

  public static LockFile acquire(Path path, String hostname, Clock clock) {
    try {
      Files.createDirectories(path.getParent());
      try {
        return create(path, hostname, clock);
      } catch (FileAlreadyExistsException e) {
        if (!isStale(path, hostname, clock.instant())) {
          throw new StateStoreException("another gitfleet process holds the lock %s (%s)".formatted(path, describe(path)));
        }
        log.warn("removing stale lock {} ({})", path, describe(path));
        Files.deleteIfExists(path);
        try {
          return create(path, hostname, clock);
        } catch (FileAlreadyExistsException again) {
          throw new StateStoreException("another gitfleet process holds the lock " + path, again);
        }
      }
    } catch (IOException e) {
      throw new StateStoreException("Failed to acquire lock %s: %s".formatted(path, e.getMessage()), e);
    }
  }

  private static LockFile create(Path path, String hostname, Clock clock) throws IOException {
    String payload = "pid=%d\nhostname=%s\ncreated_at=%s\n".formatted(ProcessHandle.current().pid(), hostname,
      clock.instant().truncatedTo(ChronoUnit.SECONDS));
    Files.writeString(path, payload, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
    log.debug("acquired lock {}", path);
    return new LockFile(path);
  }

  static boolean isStale(Path path, String hostname, Instant now) throws IOException {
    Instant modified;
    String content;
    try {
      modified = Files.getLastModifiedTime(path).toInstant();
      content = Files.readString(path, StandardCharsets.UTF_8);
    } catch (NoSuchFileException e) {
      return true;
    }
    Duration fileAge = nonNegative(Duration.between(modified, now));
    Owner owner;
    try {
      owner = parse(content);
    } catch (IllegalArgumentException e) {
      return fileAge.compareTo(MAX_AGE) >= 0;
    }
    Duration createdAge = nonNegative(Duration.between(owner.createdAt(), now));
    if (createdAge.compareTo(MAX_AGE) >= 0 || fileAge.compareTo(MAX_AGE) >= 0) {
      return true;
    }
    return owner.hostname().equalsIgnoreCase(hostname) && !processAlive(owner.pid());
  }

  static Owner parse(String content) {
    Map<String, String> values = new HashMap<>();
    for (String line : content.trim().split("\n")) {
      if (line.isBlank()) {
        continue;
      }
      int eq = line.indexOf('=');
      if (eq < 0) {
        throw new IllegalArgumentException("invalid lock line \"%s\"".formatted(line));
      }
      values.put(line.substring(0, eq).trim(), line.substring(eq + 1).trim());
    }
    String pid = values.getOrDefault("pid", "");
    String hostname = values.getOrDefault("hostname", "");
    String createdAt = values.getOrDefault("created_at", "");
    if (pid.isEmpty() || hostname.isEmpty() || createdAt.isEmpty()) {
      throw new IllegalArgumentException("incomplete lock payload");
    }
    try {
      return new Owner(Long.parseLong(pid), hostname, Instant.parse(createdAt));
    } catch (NumberFormatException | DateTimeParseException e) {
      throw new IllegalArgumentException("invalid lock payload: " + e.getMessage(), e);
    }
  }

  private static boolean processAlive(long pid) {
    return pid > 0 && ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
  }

  private static Duration nonNegative(Duration d) {
    return d.isNegative() ? Duration.ZERO : d;
  }

  private static String describe(Path path) {
    try {
      return Files.readString(path, StandardCharsets.UTF_8).trim().replace('\n', ' ');
    } catch (IOException e) {
      return "unreadable: " + e.getMessage();
    }
  }

  public Path path() {
    return path;
  }

  @Override
  public void close() {
    if (released) {
      return;
    }
    released = true;
    try {
      Files.deleteIfExists(path);
      log.debug("released lock {}", path);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to release lock %s: %s".formatted(path, e.getMessage()), e);
    }
  }
}
