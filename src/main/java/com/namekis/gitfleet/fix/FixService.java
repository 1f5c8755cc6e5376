package com.namekis.gitfleet.fix;

import java.time.Clock;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.namekis.gitfleet.domain.Catalog;
import com.namekis.gitfleet.domain.MachineSnapshot;
import com.namekis.gitfleet.domain.RepoMetadata;
import com.namekis.gitfleet.domain.RepositoryRecord;
import com.namekis.gitfleet.git.GitClient;
import com.namekis.gitfleet.github.GitHubRemotes;
import com.namekis.gitfleet.risk.RiskCollector;
import com.namekis.gitfleet.scan.RepoScanner;
import com.namekis.gitfleet.state.FleetConfig;
import com.namekis.gitfleet.state.RefreshMode;
import com.namekis.gitfleet.state.StateLock;
import com.namekis.gitfleet.state.StateStore;

/**
 * Entry point of the fix engine: load repositories, pick one, ask what can be done about it and do it. Every operation that touches
 * the snapshot holds the machine lock for its whole duration.
 */
public class FixService {
  private static final Logger log = LoggerFactory.getLogger(FixService.class);

  private final StateStore store;
  private final RepoScanner scanner;
  private final FixRepoLoader loader;
  private final FixActionExecutor executor;
  private final Clock clock;

  public FixService(StateStore store, GitClient git, GitHubRemotes github, RiskCollector risk, RepoScanner scanner, Clock clock) {
    this.store = store;
    this.scanner = scanner;
    this.clock = clock;
    this.loader = new FixRepoLoader(store, scanner, risk, new SyncFeasibilityProber(git), github, clock);
    this.executor = new FixActionExecutor(git, github, store);
  }

  /** Repositories of the selected catalogs (all when empty), unsyncable first, then by name and path. */
  public List<FixRepoState> loadFixRepos(List<String> catalogs, RefreshMode mode) {
    return loader.load(catalogs, mode);
  }

  public FixRepoState resolveFixTarget(String selector, List<FixRepoState> repos) {
    return FixTargetResolver.resolve(selector, repos);
  }

  public List<FixAction> eligibleFixActions(RepositoryRecord record, RepoMetadata metadata, EligibilityContext context) {
    return FixEligibility.eligibleActions(record, metadata, context);
  }

  public String ineligibleFixReason(FixAction action, RepositoryRecord record, EligibilityContext context) {
    return FixEligibility.ineligibleReason(action, record, context);
  }

  /** What {@link #applyFixAction} would run for the target, without running it. */
  public List<FixPlanEntry> previewFixAction(FixRepoState target, FixAction action, FixApplyOptions options) {
    FixActionExecutor.validateOptions(action, options);
    return executor.executionPlan(store.loadConfig(), target, action, options);
  }

  /**
   * Re-observes the repository at {@code path}, checks the action is still eligible, runs it and revalidates the repository.
   *
   * @param catalogs the catalogs rescanned when the targeted revalidation fails
   * @return the repository state after revalidation
   * @throws FixIneligibleException when the action is not eligible for the fresh state
   * @throws FixStepException when a step fails; the steps before it stay applied
   */
  public FixRepoState applyFixAction(List<String> catalogs, String path, FixAction action, FixApplyOptions options,
      StepObserver observer) {
    StepObserver events = observer == null ? StepObserver.NONE : observer;
    try (StateLock lock = store.acquireLock()) {
      FleetConfig config = store.loadConfig();
      MachineSnapshot machine = store.loadMachine();
      if (machine.indexOfPath(path) >= 0) {
        observeTarget(config, machine, path);
      }
      FixRepoState target = loader.loadByPath(machine, path);
      checkEligible(target, action, options);

      executor.execute(config, target, action, options, events);

      String targetPath = target.record().path;
      new StepRunner(List.of(FixPlanEntry.REVALIDATE_STATE), events).run(FixPlanEntry.REVALIDATE_STATE,
        () -> revalidate(config, machine, catalogs, targetPath));
      FixRepoState updated = loader.loadByPath(machine, targetPath);
      log.info("[{}] applied {}, syncable={}", updated.record().name, action, updated.record().syncable);
      return updated;
    }
  }

  private void checkEligible(FixRepoState target, FixAction action, FixApplyOptions options) {
    if (action == FixAction.IGNORE) {
      if (!options.interactive()) {
        throw new FixIneligibleException(action, "ignore action is interactive-only");
      }
      return;
    }
    EligibilityContext context = EligibilityContext.of(target, options.interactive(), options.syncStrategy());
    if (!FixEligibility.isEligible(action, target.record(), target.metadata(), context)) {
      throw new FixIneligibleException(action, FixEligibility.ineligibleReason(action, target.record(), context));
    }
  }

  /** Observes only the target; a full rescan of the catalogs when that fails. The snapshot is saved either way. */
  void revalidate(FleetConfig config, MachineSnapshot machine, List<String> catalogs, String path) {
    try {
      observeTarget(config, machine, path);
    } catch (RuntimeException e) {
      log.warn("fix: revalidating {} failed, rescanning catalogs: {}", path, e.getMessage());
      log.debug("revalidation failure", e);
      scanner.scan(config, machine, catalogs);
      machine.updatedAt = clock.instant();
      store.saveMachine(machine);
    }
  }

  private void observeTarget(FleetConfig config, MachineSnapshot machine, String path) {
    int index = machine.indexOfPath(path);
    if (index < 0) {
      throw new FixTargetException("project \"%s\" not found in machine snapshot".formatted(path));
    }
    RepositoryRecord previous = machine.repos.get(index);
    Catalog catalog = machine.findCatalog(previous.catalog)
      .orElseThrow(() -> new FixException("catalog \"%s\" of %s is not configured".formatted(previous.catalog, path)));
    RepositoryRecord observed = scanner.observe(config, catalog, previous.location(), previous);
    machine.upsertRecord(observed);
    machine.updatedAt = clock.instant();
    store.saveMachine(machine);
  }
}
