package com.namekis.gitfleet.scan;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.namekis.gitfleet.domain.AutoPushMode;
import com.namekis.gitfleet.domain.Catalog;
import com.namekis.gitfleet.domain.MachineSnapshot;
import com.namekis.gitfleet.domain.PushAccess;
import com.namekis.gitfleet.domain.RepoKeys;
import com.namekis.gitfleet.domain.RepoMetadata;
import com.namekis.gitfleet.domain.RepositoryRecord;
import com.namekis.gitfleet.domain.Syncability;
import com.namekis.gitfleet.domain.Visibility;
import com.namekis.gitfleet.git.AheadBehind;
import com.namekis.gitfleet.git.GitClient;
import com.namekis.gitfleet.git.WorkingTreeState;
import com.namekis.gitfleet.state.FleetConfig;
import com.namekis.gitfleet.state.StateStore;

import one.util.streamex.StreamEx;

/** Walks catalog roots for git working copies and observes them with {@link GitClient}. */
public class GitRepoScanner implements RepoScanner {
  private static final Logger log = LoggerFactory.getLogger(GitRepoScanner.class);

  private final GitClient git;
  private final StateStore store;
  private final Clock clock;

  public GitRepoScanner(GitClient git, StateStore store, Clock clock) {
    this.git = git;
    this.store = store;
    this.clock = clock;
  }

  @Override
  public RepositoryRecord observe(FleetConfig config, Catalog catalog, Path repoPath, RepositoryRecord previous) {
    if (!git.isGitRepo(repoPath)) {
      throw new IllegalStateException("%s is not a git repository".formatted(repoPath));
    }
    Optional<RepoKeys.Derived> derived = RepoKeys.derive(catalog, repoPath);
    RepositoryRecord r = new RepositoryRecord();
    r.catalog = catalog.name;
    r.path = repoPath.toAbsolutePath().normalize().toString();
    r.repoKey = derived.map(RepoKeys.Derived::repoKey).orElse("");
    r.name = derived.map(RepoKeys.Derived::repoName).orElse(repoPath.getFileName().toString());

    Optional<RepoMetadata> metadata = r.repoKey.isEmpty() ? Optional.empty() : store.loadRepoMetadata(r.repoKey);
    String preferredRemote = metadata.map(m -> m.preferredRemote).filter(remote -> git.remoteNames(repoPath).contains(remote))
      .orElse("");

    r.originUrl = git.origin(repoPath, preferredRemote);
    r.branch = git.currentBranch(repoPath);
    r.headSha = git.headSha(repoPath);
    r.upstream = git.upstream(repoPath);
    r.remoteHeadSha = git.remoteHeadSha(repoPath);
    AheadBehind counts = git.aheadBehind(repoPath);
    r.ahead = counts.ahead();
    r.behind = counts.behind();
    r.diverged = counts.diverged();
    WorkingTreeState tree = git.workingTree(repoPath);
    r.hasDirtyTracked = tree.dirtyTracked();
    r.hasUntracked = tree.untracked();
    r.operationInProgress = git.operationInProgress(repoPath);

    AutoPushMode mode = metadata.map(m -> m.autoPush).orElse(AutoPushMode.DISABLED);
    PushAccess access = metadata.map(m -> m.pushAccess).orElse(PushAccess.UNKNOWN);
    Visibility visibility = metadata.map(m -> m.visibility).orElse(Visibility.UNKNOWN);
    boolean onDefaultBranch = mode.enabled() && r.hasOrigin() && isDefaultBranch(repoPath, preferredRemote, r.branch);
    boolean autoPush = Syncability.autoPushAllowed(mode, onDefaultBranch, catalog.allowsDefaultBranchAutoPush(visibility));
    Syncability.evaluate(r, config.sync.includeUntrackedAsDirty, autoPush, access);
    r.carryObservedAt(previous, clock.instant());
    return r;
  }

  private boolean isDefaultBranch(Path repoPath, String preferredRemote, String branch) {
    String defaultBranch = git.defaultBranch(repoPath, preferredRemote);
    if (defaultBranch.isEmpty()) {
      return branch.equals("main") || branch.equals("master");
    }
    return defaultBranch.equals(branch);
  }

  @Override
  public void scan(FleetConfig config, MachineSnapshot machine, List<String> catalogs) {
    List<Catalog> selected = machine.selectCatalogs(catalogs);
    Set<String> names = StreamEx.of(selected).map(c -> c.name).toSet();
    Map<String, RepositoryRecord> previousByPath = new HashMap<>();
    List<RepositoryRecord> kept = new ArrayList<>();
    for (RepositoryRecord record : machine.repos) {
      if (names.contains(record.catalog)) {
        previousByPath.put(record.path, record);
      } else {
        kept.add(record);
      }
    }
    for (Catalog catalog : selected) {
      for (Path repo : discover(catalog)) {
        String key = repo.toAbsolutePath().normalize().toString();
        kept.add(observe(config, catalog, repo, previousByPath.get(key)));
      }
    }
    kept.sort(RepositoryRecord.FIX_ORDER);
    machine.repos = kept;
    machine.lastScanAt = clock.instant();
    machine.lastScanCatalogs = StreamEx.of(names).sorted().toList();
    log.info("scanned {} catalogs, {} repositories", names.size(), kept.size());
  }

  /** Working copies exactly {@link Catalog#effectiveRepoPathDepth()} levels below the catalog root. */
  List<Path> discover(Catalog catalog) {
    Path root = Path.of(catalog.root);
    if (!Files.isDirectory(root)) {
      log.warn("catalog {} root {} does not exist", catalog.name, root);
      return List.of();
    }
    int depth = catalog.effectiveRepoPathDepth();
    try (Stream<Path> s = Files.walk(root, depth)) {
      return s.filter(Files::isDirectory)
        .filter(p -> root.relativize(p).getNameCount() == depth && !p.equals(root))
        .filter(p -> Files.exists(p.resolve(".git")))
        .sorted()
        .toList();
    } catch (IOException | UncheckedIOException e) {
      throw new RuntimeException("Failed to find repos in %s: %s".formatted(root, e.getMessage()), e);
    }
  }
}
