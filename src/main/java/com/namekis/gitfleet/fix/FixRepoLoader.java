package com.namekis.gitfleet.fix;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.namekis.gitfleet.domain.Catalog;
import com.namekis.gitfleet.domain.MachineSnapshot;
import com.namekis.gitfleet.domain.PushAccess;
import com.namekis.gitfleet.domain.RepoMetadata;
import com.namekis.gitfleet.domain.RepositoryRecord;
import com.namekis.gitfleet.github.GitHubRemotes;
import com.namekis.gitfleet.risk.RiskCollector;
import com.namekis.gitfleet.risk.RiskSnapshot;
import com.namekis.gitfleet.scan.RepoScanner;
import com.namekis.gitfleet.state.FleetConfig;
import com.namekis.gitfleet.state.RefreshMode;
import com.namekis.gitfleet.state.StateLock;
import com.namekis.gitfleet.state.StateStore;

import one.util.streamex.StreamEx;

/** Builds {@link FixRepoState}s: observed record, stored metadata, risk and sync feasibility. */
public class FixRepoLoader {
  private static final Logger log = LoggerFactory.getLogger(FixRepoLoader.class);

  /** Same order as {@link RepositoryRecord#FIX_ORDER}, applied to the joined states. */
  static final Comparator<FixRepoState> ORDER = Comparator.comparing(FixRepoState::record, RepositoryRecord.FIX_ORDER);

  private final StateStore store;
  private final RepoScanner scanner;
  private final RiskCollector risk;
  private final SyncFeasibilityProber prober;
  private final GitHubRemotes github;
  private final Clock clock;

  public FixRepoLoader(StateStore store, RepoScanner scanner, RiskCollector risk, SyncFeasibilityProber prober, GitHubRemotes github,
      Clock clock) {
    this.store = store;
    this.scanner = scanner;
    this.risk = risk;
    this.prober = prober;
    this.github = github;
    this.clock = clock;
  }

  /** Loads every repository of the selected catalogs under the machine lock, rescanning first according to {@code mode}. */
  public List<FixRepoState> load(List<String> catalogs, RefreshMode mode) {
    try (StateLock lock = store.acquireLock()) {
      FleetConfig config = store.loadConfig();
      MachineSnapshot machine = store.loadMachine();
      refresh(config, machine, catalogs, mode);
      if (mode == RefreshMode.NEVER) {
        log.debug("fix: using existing machine snapshot without refresh");
      }
      Map<String, RepoMetadata> metadataByKey = metadataByKey();
      List<FixRepoState> out = new ArrayList<>(machine.repos.size());
      for (RepositoryRecord record : machine.repos) {
        out.add(stateFor(record, metadataByKey.get(record.repoKey), machine.defaultCatalog));
      }
      out.sort(ORDER);
      if (refreshUnknownPushAccess(out)) {
        Map<String, RepoMetadata> refreshed = metadataByKey();
        out = StreamEx.of(out).map(s -> s.withMetadata(refreshed.get(s.record().repoKey))).toMutableList();
      }
      return out;
    }
  }

  /** Rescans the selected catalogs and saves the snapshot when {@code mode} asks for it. Caller holds the lock. */
  public void refresh(FleetConfig config, MachineSnapshot machine, List<String> catalogs, RefreshMode mode) {
    if (mode == null || mode == RefreshMode.NEVER) {
      return;
    }
    if (mode == RefreshMode.IF_STALE) {
      Duration window = Duration.ofSeconds(Math.max(0, config.sync.scanFreshnessSeconds));
      if (!shouldRefresh(machine, machine.selectCatalogs(catalogs), clock.instant(), window)) {
        log.debug("scan: snapshot is fresh (<= {}), skipping refresh", window);
        return;
      }
      log.info("scan: snapshot is stale, refreshing");
    }
    scanner.scan(config, machine, catalogs);
    machine.updatedAt = clock.instant();
    store.saveMachine(machine);
  }

  static boolean shouldRefresh(MachineSnapshot machine, List<Catalog> selected, Instant now, Duration window) {
    if (window.isZero() || window.isNegative()) {
      return true;
    }
    if (machine.lastScanAt == null) {
      return true;
    }
    if (!lastScanCovers(machine.lastScanCatalogs, selected)) {
      return true;
    }
    Duration age = Duration.between(machine.lastScanAt, now);
    if (age.isNegative()) {
      age = Duration.ZERO;
    }
    return age.compareTo(window) > 0;
  }

  static boolean lastScanCovers(List<String> lastScanCatalogs, List<Catalog> selected) {
    if (selected.isEmpty()) {
      return true;
    }
    if (lastScanCatalogs == null || lastScanCatalogs.isEmpty()) {
      return false;
    }
    Set<String> covered = new HashSet<>(StreamEx.of(lastScanCatalogs).map(String::trim).remove(String::isEmpty).toList());
    return StreamEx.of(selected).allMatch(c -> covered.contains(c.name));
  }

  /** The joined state of the record at {@code path}. Caller holds the lock. */
  public FixRepoState loadByPath(MachineSnapshot machine, String path) {
    int index = machine.indexOfPath(path);
    if (index < 0) {
      throw new FixTargetException("project \"%s\" not found".formatted(path));
    }
    RepositoryRecord record = machine.repos.get(index);
    RepoMetadata metadata = record.hasRepoKey() ? store.loadRepoMetadata(record.repoKey).orElse(null) : null;
    return stateFor(record, metadata, machine.defaultCatalog);
  }

  /** Probing may add reasons; it works on a copy so the snapshot record stays as scanned. */
  FixRepoState stateFor(RepositoryRecord stored, RepoMetadata metadata, String defaultCatalog) {
    RepositoryRecord record = stored.copy();
    SyncFeasibility feasibility = prober.probe(record);
    return new FixRepoState(record, metadata, collectRisk(record), feasibility,
      record.catalog != null && record.catalog.equals(defaultCatalog));
  }

  RiskSnapshot collectRisk(RepositoryRecord record) {
    Path path = record.location();
    if (!Files.isDirectory(path)) {
      return RiskSnapshot.EMPTY;
    }
    try {
      return risk.collect(path);
    } catch (RuntimeException e) {
      log.warn("fix: risk scan failed for {}: {}", record.path, e.getMessage());
      log.debug("risk scan failure", e);
      return RiskSnapshot.EMPTY;
    }
  }

  /**
   * Probes push access of repositories whose metadata says {@code unknown} and saves the metadata that changed. Caller holds the
   * lock.
   *
   * @return true when any metadata was saved
   */
  boolean refreshUnknownPushAccess(List<FixRepoState> repos) {
    Map<String, Path> targets = new TreeMap<>();
    for (FixRepoState repo : repos) {
      RepositoryRecord r = repo.record();
      if (repo.metadata() == null || repo.metadata().pushAccess != PushAccess.UNKNOWN) {
        continue;
      }
      if (!r.hasRepoKey() || r.path == null || r.path.isBlank() || !r.hasOrigin()) {
        continue;
      }
      targets.put(r.repoKey.trim(), r.location());
    }
    boolean changed = false;
    for (Map.Entry<String, Path> target : targets.entrySet()) {
      Optional<RepoMetadata> stored = store.loadRepoMetadata(target.getKey());
      if (stored.isEmpty() || stored.get().pushAccess != PushAccess.UNKNOWN) {
        continue;
      }
      RepoMetadata metadata = stored.get();
      if (!github.refreshPushAccess(target.getValue(), metadata)) {
        continue;
      }
      log.info("[{}] push access is {}", metadata.repoKey, metadata.pushAccess);
      store.saveRepoMetadata(metadata);
      changed = true;
    }
    return changed;
  }

  private Map<String, RepoMetadata> metadataByKey() {
    return StreamEx.of(store.loadAllRepoMetadata()).toMap(m -> m.repoKey, m -> m, (a, b) -> b);
  }
}
