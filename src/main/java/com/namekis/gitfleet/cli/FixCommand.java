package com.namekis.gitfleet.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.namekis.gitfleet.domain.RepositoryRecord;
import com.namekis.gitfleet.domain.Visibility;
import com.namekis.gitfleet.fix.EligibilityContext;
import com.namekis.gitfleet.fix.FixAction;
import com.namekis.gitfleet.fix.FixApplyOptions;
import com.namekis.gitfleet.fix.FixIneligibleException;
import com.namekis.gitfleet.fix.FixPlanEntry;
import com.namekis.gitfleet.fix.FixRepoState;
import com.namekis.gitfleet.fix.FixService;
import com.namekis.gitfleet.fix.StepEvent;
import com.namekis.gitfleet.git.SyncStrategy;
import com.namekis.gitfleet.state.RefreshMode;

import one.util.streamex.StreamEx;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "fix", mixinStandardHelpOptions = true, sortOptions = false, description = {
    "Show why a repository is not syncable and apply one fix action to it.",
    "Without an ACTION prints the repository status and the eligible actions.",
    "Exit codes: 0 syncable, 1 unsyncable or action not eligible, 2 error." })
public class FixCommand extends CommonOptions implements Callable<Integer> {
  private static final Logger log = LoggerFactory.getLogger(FixCommand.class);

  public static final int EXIT_SYNCABLE = 0;
  public static final int EXIT_UNSYNCABLE = 1;
  public static final int EXIT_ERROR = 2;

  @Parameters(index = "0", arity = "0..1", paramLabel = "PROJECT", description = "Repository path, repo key or name.")
  String project;

  @Parameters(index = "1", arity = "0..1", paramLabel = "ACTION", description = "Fix action id, for example push or sync-with-upstream.")
  String action;

  @Option(names = "--catalog", description = "Catalog to load; repeat for several (default: the configured default catalog).")
  List<String> catalogs = new ArrayList<>();

  @Option(names = "--no-refresh", description = "Use the saved machine snapshot without rescanning.")
  boolean noRefresh;

  @Option(names = "--sync-strategy", description = "rebase or merge (default: rebase).", defaultValue = "rebase")
  String syncStrategy;

  @Option(names = { "-m", "--message" }, description = "Commit message for stage-commit-push (default: auto).")
  String message;

  @Option(names = "--project-name", description = "Repository name for create-project (default: the folder name).")
  String projectName;

  @Option(names = "--visibility", description = "private or public for create-project (default: from config).")
  String visibility;

  @Option(names = "--dry-run", description = "Print the steps the action would run without running them.")
  boolean dryRun;

  Function<Path, FixService> services = FleetServices::fixService;

  @Override
  public Integer call() {
    configureLogging();
    try {
      return fix(services.apply(homeDir()));
    } catch (FixIneligibleException e) {
      log.error("{}", e.getMessage());
      return EXIT_UNSYNCABLE;
    } catch (RuntimeException e) {
      log.error("{}", e.getMessage());
      log.debug("fix failed", e);
      return EXIT_ERROR;
    }
  }

  int fix(FixService service) {
    if (project == null || project.isBlank()) {
      throw new IllegalArgumentException("project is required");
    }
    SyncStrategy strategy = SyncStrategy.parse(syncStrategy);
    List<FixRepoState> repos = service.loadFixRepos(catalogs, noRefresh ? RefreshMode.NEVER : RefreshMode.IF_STALE);
    FixRepoState target = service.resolveFixTarget(project, repos);
    List<FixAction> eligible = eligible(service, target, strategy);

    if (action == null || action.isBlank()) {
      printStatus(target, eligible);
      return exitCode(target);
    }

    FixAction fixAction = FixAction.parse(action);
    if (fixAction == FixAction.IGNORE) {
      throw new IllegalArgumentException("ignore action is interactive-only; it only hides a repository within one interactive session");
    }
    if (!eligible.contains(fixAction)) {
      printStatus(target, eligible);
      String reason = service.ineligibleFixReason(fixAction, target.record(), EligibilityContext.of(target, false, strategy));
      stdoutf("@|red action %s is not eligible for %s|@%s", fixAction, target.record().name,
        reason.isEmpty() ? "" : ": " + reason);
      return EXIT_UNSYNCABLE;
    }

    FixApplyOptions options = FixApplyOptions.defaults()
      .withSyncStrategy(strategy)
      .withCommitMessage(message)
      .withCreateProject(projectName, Visibility.parse(visibility));

    if (dryRun) {
      List<FixPlanEntry> plan = service.previewFixAction(target, fixAction, options);
      stdoutf("@|cyan # %s on %s (dry run)|@", fixAction.label(), target.record().name);
      for (FixPlanEntry entry : plan) {
        stdoutf(entry.command() ? "  $ %s" : "  - %s", entry.summary());
      }
      return exitCode(target);
    }

    FixRepoState updated = service.applyFixAction(catalogs, target.record().path, fixAction, options, this::printStep);
    stdoutf("@|green [%s] applied %s|@", updated.record().name, fixAction);
    printStatus(updated, eligible(service, updated, strategy));
    return exitCode(updated);
  }

  private static List<FixAction> eligible(FixService service, FixRepoState state, SyncStrategy strategy) {
    return service.eligibleFixActions(state.record(), state.metadata(), EligibilityContext.of(state, false, strategy));
  }

  private void printStep(StepEvent event) {
    switch (event.status()) {
      case RUNNING -> log.debug("running {}", event.entry());
      case DONE -> stdoutf("  @|green done|@    %s", event.entry().summary());
      case SKIPPED -> stdoutf("  @|yellow skipped|@ %s", event.entry().summary());
      case FAILED -> stdoutf("  @|red failed|@  %s", event.entry().summary());
    }
  }

  void printStatus(FixRepoState state, List<FixAction> eligible) {
    RepositoryRecord record = state.record();
    stdoutf("repo:     %s", record.name);
    stdoutf("path:     %s", record.path);
    stdoutf("catalog:  %s", record.catalog);
    stdoutf(record.syncable ? "syncable: @|green yes|@" : "syncable: @|red no|@");
    if (!record.unsyncableReasons.isEmpty()) {
      stdoutf("reasons:  @|yellow %s|@", String.join(", ", record.unsyncableReasons.sortedCodes()));
    }
    List<FixAction> offered = StreamEx.of(eligible).remove(a -> a == FixAction.IGNORE).toList();
    stdoutf("actions:  %s", offered.isEmpty() ? "none" : StreamEx.of(offered).map(FixAction::id).joining(", "));
  }

  private static int exitCode(FixRepoState state) {
    return state.record().syncable ? EXIT_SYNCABLE : EXIT_UNSYNCABLE;
  }
}
