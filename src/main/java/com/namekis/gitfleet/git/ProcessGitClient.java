package com.namekis.gitfleet.git;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.namekis.gitfleet.domain.Operation;
import com.namekis.gitfleet.domain.PushAccess;
import com.namekis.gitfleet.exec.CommandException;
import com.namekis.gitfleet.exec.CommandResult;
import com.namekis.gitfleet.exec.CommandRunner;

import one.util.streamex.StreamEx;

/** {@link GitClient} backed by the {@code git} binary. */
public class ProcessGitClient implements GitClient {
  private static final Logger log = LoggerFactory.getLogger(ProcessGitClient.class);

  static final List<String> SYNC_CONFLICT_MARKERS = List.of("conflict", "automatic merge failed", "could not apply",
    "resolve all conflicts manually", "merge conflict");
  static final List<String> PUSH_DENIED_MARKERS = List.of("permission denied", "access denied", "not permitted",
    "write access to repository not granted", "insufficient permission", "forbidden", "authentication failed",
    "could not read from remote repository");

  private static final String DEV_NULL = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows") ? "NUL"
      : "/dev/null";

  private final CommandRunner runner;

  public ProcessGitClient() {
    this(new CommandRunner(Map.of("GIT_TERMINAL_PROMPT", "0", "GCM_INTERACTIVE", "never", "HUSKY", "0")));
  }

  public ProcessGitClient(CommandRunner runner) {
    this.runner = runner;
  }

  String git(String operation, Path repo, String... args) {
    return runner.runChecked(operation, null, command(repo, false, args));
  }

  CommandResult gitResult(String operation, Path repo, String... args) {
    return runner.run(operation, null, command(repo, false, args));
  }

  CommandResult gitNoHooks(String operation, Path repo, String... args) {
    return runner.run(operation, null, command(repo, true, args));
  }

  /** Output of a query, or empty when git reports an error (no upstream, unborn HEAD). */
  String query(String operation, Path repo, String... args) {
    CommandResult r = gitResult(operation, repo, args);
    return r.success() ? r.stdout().trim() : "";
  }

  private static List<String> command(Path repo, boolean noHooks, String... args) {
    List<String> cmdList = new ArrayList<>();
    cmdList.add("git");
    cmdList.add("-C");
    cmdList.add(repo.toAbsolutePath().toString());
    if (noHooks) {
      cmdList.add("-c");
      cmdList.add("core.hooksPath=" + DEV_NULL);
    }
    for (String s : args) {
      cmdList.add(s);
    }
    return cmdList;
  }

  @Override
  public boolean isGitRepo(Path repo) {
    return Files.isDirectory(repo) && gitResult("is-repo", repo, "rev-parse", "--is-inside-work-tree").success();
  }

  @Override
  public String origin(Path repo, String preferredRemote) {
    String remote = effectiveRemote(repo, preferredRemote);
    if (remote.isEmpty()) {
      return "";
    }
    return query("remote-url", repo, "remote", "get-url", remote);
  }

  @Override
  public List<String> remoteNames(Path repo) {
    return StreamEx.split(git("remotes", repo, "remote"), "\n").map(String::trim).remove(String::isEmpty).sorted().toList();
  }

  @Override
  public String effectiveRemote(Path repo, String preferredRemote) {
    String preferred = preferredRemote == null ? "" : preferredRemote.trim();
    List<String> names = remoteNames(repo);
    if (!preferred.isEmpty()) {
      if (!names.contains(preferred)) {
        throw new IllegalStateException("preferred remote \"%s\" not found in %s".formatted(preferred, repo));
      }
      return preferred;
    }
    String fromUpstream = remoteOf(upstream(repo));
    if (!fromUpstream.isEmpty()) {
      return fromUpstream;
    }
    if (names.isEmpty()) {
      return "";
    }
    return names.contains("origin") ? "origin" : names.get(0);
  }

  /** {@code origin/main -> origin}; empty when the ref has no remote part. */
  public static String remoteOf(String upstream) {
    String value = upstream == null ? "" : upstream.trim();
    int slash = value.indexOf('/');
    return slash <= 0 ? "" : value.substring(0, slash);
  }

  @Override
  public String currentBranch(Path repo) {
    return query("branch", repo, "rev-parse", "--abbrev-ref", "HEAD");
  }

  @Override
  public String headSha(Path repo) {
    return query("head", repo, "rev-parse", "HEAD");
  }

  @Override
  public String upstream(Path repo) {
    return query("upstream", repo, "rev-parse", "--abbrev-ref", "--symbolic-full-name", "@{u}");
  }

  @Override
  public String remoteHeadSha(Path repo) {
    return query("remote-head", repo, "rev-parse", "@{u}");
  }

  @Override
  public String defaultBranch(Path repo, String preferredRemote) {
    String remote = effectiveRemote(repo, preferredRemote);
    if (remote.isEmpty()) {
      return "";
    }
    String out = query("default-branch", repo, "symbolic-ref", "--quiet", "--short", "refs/remotes/" + remote + "/HEAD");
    if (out.startsWith(remote + "/")) {
      return out.substring(remote.length() + 1);
    }
    int slash = out.indexOf('/');
    return slash < 0 ? out : out.substring(slash + 1);
  }

  @Override
  public AheadBehind aheadBehind(Path repo) {
    String out = query("ahead-behind", repo, "rev-list", "--left-right", "--count", "@{u}...HEAD");
    if (out.isEmpty()) {
      return AheadBehind.NONE;
    }
    String[] parts = out.split("\\s+");
    if (parts.length != 2) {
      throw new IllegalStateException("unexpected rev-list output \"%s\" in %s".formatted(out, repo));
    }
    return new AheadBehind(Integer.parseInt(parts[1]), Integer.parseInt(parts[0]));
  }

  @Override
  public WorkingTreeState workingTree(Path repo) {
    boolean tracked = false;
    boolean untracked = false;
    for (String line : statusPorcelain(repo).split("\n")) {
      if (line.isEmpty()) {
        continue;
      }
      if (line.startsWith("??")) {
        untracked = true;
      } else {
        tracked = true;
      }
    }
    return new WorkingTreeState(tracked, untracked);
  }

  @Override
  public Operation operationInProgress(Path repo) {
    Path gitDir = repo.resolve(".git");
    if (Files.isRegularFile(gitDir.resolve("MERGE_HEAD"))) {
      return Operation.MERGE;
    }
    if (Files.isDirectory(gitDir.resolve("rebase-apply")) || Files.isDirectory(gitDir.resolve("rebase-merge"))) {
      return Operation.REBASE;
    }
    if (Files.isRegularFile(gitDir.resolve("CHERRY_PICK_HEAD"))) {
      return Operation.CHERRY_PICK;
    }
    if (Files.exists(gitDir.resolve("BISECT_LOG"))) {
      return Operation.BISECT;
    }
    return Operation.NONE;
  }

  @Override
  public String statusPorcelain(Path repo) {
    // leading blanks are significant: " M file" is an unstaged change
    return git("status", repo, "status", "--porcelain", "--untracked-files=all");
  }

  @Override
  public String diffNumstat(Path repo, boolean cached) {
    return cached ? git("numstat-cached", repo, "diff", "--numstat", "--cached") : git("numstat", repo, "diff", "--numstat");
  }

  @Override
  public void init(Path repo) {
    git("init", repo, "init", "-b", "main");
  }

  @Override
  public void clone(String originUrl, Path target) {
    runner.runChecked("clone", null, List.of("git", "clone", originUrl, target.toAbsolutePath().toString()));
  }

  @Override
  public void addRemote(Path repo, String name, String url) {
    git("remote-add", repo, "remote", "add", name, url);
  }

  @Override
  public void setRemoteUrl(Path repo, String name, String url) {
    git("remote-set-url", repo, "remote", "set-url", name, url);
  }

  @Override
  public void fetchPrune(Path repo) {
    git("fetch", repo, "fetch", "--prune");
  }

  @Override
  public void pullFastForwardOnly(Path repo) {
    git("pull", repo, "pull", "--ff-only");
  }

  @Override
  public void mergeNoEdit(Path repo, String upstream) {
    git("merge", repo, "merge", "--no-edit", orUpstreamShorthand(upstream));
  }

  @Override
  public void rebase(Path repo, String upstream) {
    git("rebase", repo, "rebase", orUpstreamShorthand(upstream));
  }

  private static String orUpstreamShorthand(String upstream) {
    return upstream == null || upstream.isBlank() ? "@{u}" : upstream.trim();
  }

  @Override
  public void push(Path repo) {
    git("push", repo, "push");
  }

  @Override
  public void pushUpstream(Path repo, String branch, String preferredRemote, boolean force) {
    String remote = effectiveRemote(repo, preferredRemote);
    if (remote.isEmpty()) {
      remote = "origin";
    }
    List<String> args = new ArrayList<>(List.of("push", "-u"));
    if (force) {
      args.add("--force");
    }
    args.add(remote);
    args.add(branch);
    git("push-upstream", repo, args.toArray(new String[0]));
  }

  @Override
  public void addAll(Path repo) {
    git("add", repo, "add", "-A");
  }

  @Override
  public void commit(Path repo, String message) {
    git("commit", repo, "commit", "-m", message);
  }

  @Override
  public void abortMerge(Path repo) {
    git("merge-abort", repo, "merge", "--abort");
  }

  @Override
  public void abortRebase(Path repo) {
    git("rebase-abort", repo, "rebase", "--abort");
  }

  @Override
  public void abortCherryPick(Path repo) {
    git("cherry-pick-abort", repo, "cherry-pick", "--abort");
  }

  @Override
  public void bisectReset(Path repo) {
    git("bisect-reset", repo, "bisect", "reset");
  }

  @Override
  public SyncProbeOutcome probeSync(Path repo, String upstream, SyncStrategy strategy) {
    if (upstream == null || upstream.isBlank()) {
      return SyncProbeOutcome.UNKNOWN;
    }
    Path tmpRoot;
    try {
      tmpRoot = Files.createTempDirectory("gitfleet-sync-probe-");
    } catch (IOException e) {
      throw new CommandException("sync-probe", "create temp worktree dir", e);
    }
    Path worktree = tmpRoot.resolve("worktree");
    try {
      CommandResult added = gitNoHooks("probe-worktree-add", repo, "worktree", "add", "--detach", worktree.toString(), "HEAD");
      if (!added.success()) {
        log.debug("could not create probe worktree for {}: {}", repo, added.combinedOutput());
        return SyncProbeOutcome.PROBE_FAILED;
      }
      try {
        return probeInWorktree(worktree, upstream.trim(), strategy);
      } finally {
        CommandResult removed = gitNoHooks("probe-worktree-remove", repo, "worktree", "remove", "--force", worktree.toString());
        if (!removed.success()) {
          log.warn("could not remove probe worktree {} of {}: {}", worktree, repo, removed.combinedOutput());
        }
      }
    } finally {
      deleteRecursively(tmpRoot);
    }
  }

  private SyncProbeOutcome probeInWorktree(Path worktree, String upstream, SyncStrategy strategy) {
    CommandResult result;
    switch (strategy) {
      case MERGE -> {
        result = gitNoHooks("probe-merge", worktree, "merge", "--no-commit", "--no-ff", upstream);
        gitNoHooks("probe-merge-abort", worktree, "merge", "--abort");
      }
      case REBASE -> {
        result = gitNoHooks("probe-rebase", worktree, "rebase", upstream);
        if (!result.success()) {
          gitNoHooks("probe-rebase-abort", worktree, "rebase", "--abort");
        }
      }
      default -> throw new IllegalArgumentException("unsupported sync strategy " + strategy);
    }
    if (result.success()) {
      return SyncProbeOutcome.CLEAN;
    }
    return looksLikeSyncConflict(result.combinedOutput()) ? SyncProbeOutcome.CONFLICT : SyncProbeOutcome.PROBE_FAILED;
  }

  @Override
  public PushAccessProbe probePushAccess(Path repo, String preferredRemote) {
    String remote = effectiveRemote(repo, preferredRemote);
    if (remote.isEmpty()) {
      return new PushAccessProbe(PushAccess.UNKNOWN, "");
    }
    String branch = currentBranch(repo);
    if (branch.isEmpty() || branch.equals("HEAD")) {
      return new PushAccessProbe(PushAccess.UNKNOWN, remote);
    }
    CommandResult r = gitNoHooks("probe-push", repo, "push", "--dry-run", "--porcelain", remote, "HEAD:refs/heads/" + branch);
    if (r.success()) {
      return new PushAccessProbe(PushAccess.READ_WRITE, remote);
    }
    if (looksLikePushAccessDenied(r.combinedOutput())) {
      return new PushAccessProbe(PushAccess.READ_ONLY, remote);
    }
    throw new CommandException("probe-push", "git push --dry-run " + remote, r.exitCode(), r.combinedOutput());
  }

  static boolean looksLikeSyncConflict(String output) {
    return containsAny(output, SYNC_CONFLICT_MARKERS);
  }

  static boolean looksLikePushAccessDenied(String output) {
    return containsAny(output, PUSH_DENIED_MARKERS);
  }

  private static boolean containsAny(String output, List<String> markers) {
    if (output == null || output.isBlank()) {
      return false;
    }
    String lower = output.toLowerCase(Locale.ROOT);
    return markers.stream().anyMatch(lower::contains);
  }

  private static void deleteRecursively(Path root) {
    if (!Files.exists(root)) {
      return;
    }
    try (Stream<Path> paths = Files.walk(root)) {
      paths.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
    } catch (IOException e) {
      log.warn("could not delete {}: {}", root, e.getMessage());
    }
  }
}
