package com.namekis.gitfleet.domain;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;

/**
 * One observed git working copy as stored in the machine snapshot. Written by the scanner, patched by fixes after revalidation.
 */
public class RepositoryRecord {
  /** Unsyncable records first, then by name, then by path. */
  public static final Comparator<RepositoryRecord> FIX_ORDER = Comparator
    .comparing((RepositoryRecord r) -> r.syncable)
    .thenComparing(r -> nullToEmpty(r.name))
    .thenComparing(r -> nullToEmpty(r.path));

  public String repoKey = "";
  public String name = "";
  public String catalog = "";
  public String path = "";
  public String originUrl = "";
  public String branch = "";
  public String headSha = "";
  public String upstream = "";
  public String remoteHeadSha = "";
  public int ahead;
  public int behind;
  public boolean diverged;
  public boolean hasDirtyTracked;
  public boolean hasUntracked;
  public Operation operationInProgress = Operation.NONE;
  public boolean syncable;
  public ReasonSet unsyncableReasons = new ReasonSet();
  public String stateHash = "";
  public Instant observedAt;

  public boolean hasOrigin() {
    return !nullToEmpty(originUrl).isBlank();
  }

  public boolean hasUpstream() {
    return !nullToEmpty(upstream).isBlank();
  }

  public boolean hasRepoKey() {
    return !nullToEmpty(repoKey).isBlank();
  }

  public boolean hasBranch() {
    return !nullToEmpty(branch).isBlank();
  }

  public boolean dirty() {
    return hasDirtyTracked || hasUntracked;
  }

  public boolean operationRunning() {
    return operationInProgress != null && operationInProgress.inProgress();
  }

  public Path location() {
    return Path.of(path);
  }

  /**
   * Adds the reason, marks the record unsyncable and recomputes the state hash. Adding a reason already present changes nothing.
   *
   * @return true when the record changed
   */
  public boolean appendUniqueUnsyncableReason(UnsyncableReason reason) {
    if (!unsyncableReasons.add(reason)) {
      return false;
    }
    syncable = false;
    rehash();
    return true;
  }

  public void rehash() {
    stateHash = StateHash.compute(this);
  }

  /** Keeps the previous observation time when nothing observable changed. */
  public void carryObservedAt(RepositoryRecord previous, Instant now) {
    if (previous != null && previous.observedAt != null && nullToEmpty(previous.stateHash).equals(stateHash)) {
      observedAt = previous.observedAt;
    } else {
      observedAt = now;
    }
  }

  public RepositoryRecord copy() {
    RepositoryRecord r = new RepositoryRecord();
    r.repoKey = repoKey;
    r.name = name;
    r.catalog = catalog;
    r.path = path;
    r.originUrl = originUrl;
    r.branch = branch;
    r.headSha = headSha;
    r.upstream = upstream;
    r.remoteHeadSha = remoteHeadSha;
    r.ahead = ahead;
    r.behind = behind;
    r.diverged = diverged;
    r.hasDirtyTracked = hasDirtyTracked;
    r.hasUntracked = hasUntracked;
    r.operationInProgress = operationInProgress;
    r.syncable = syncable;
    r.unsyncableReasons = unsyncableReasons.copy();
    r.stateHash = stateHash;
    r.observedAt = observedAt;
    return r;
  }

  @Override
  public String toString() {
    return "RepositoryRecord[%s at %s, syncable=%s %s]".formatted(repoKey, path, syncable, unsyncableReasons);
  }

  static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
