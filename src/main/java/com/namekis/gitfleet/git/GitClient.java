package com.namekis.gitfleet.git;

import java.nio.file.Path;
import java.util.List;

import com.namekis.gitfleet.domain.Operation;

/**
 * High level git operations on one working tree. Query methods return an empty string when git has no answer (no origin, detached
 * head, no upstream); mutating methods throw {@link com.namekis.gitfleet.exec.CommandException} on failure.
 */
public interface GitClient {
  boolean isGitRepo(Path repo);

  /** URL of the preferred remote or, when none is given, of the effective remote. Empty when the repo has no remote. */
  String origin(Path repo, String preferredRemote);

  /** Sorted remote names. */
  List<String> remoteNames(Path repo);

  /**
   * The preferred remote when it exists (fails when it does not), otherwise the remote of the upstream, then {@code origin}, then
   * the first remote. Empty when the repo has no remotes.
   */
  String effectiveRemote(Path repo, String preferredRemote);

  String currentBranch(Path repo);

  String headSha(Path repo);

  String upstream(Path repo);

  String remoteHeadSha(Path repo);

  /** Default branch as advertised by {@code refs/remotes/<remote>/HEAD}; empty when unknown. */
  String defaultBranch(Path repo, String preferredRemote);

  AheadBehind aheadBehind(Path repo);

  WorkingTreeState workingTree(Path repo);

  Operation operationInProgress(Path repo);

  String statusPorcelain(Path repo);

  String diffNumstat(Path repo, boolean cached);

  void init(Path repo);

  void clone(String originUrl, Path target);

  void addRemote(Path repo, String name, String url);

  void setRemoteUrl(Path repo, String name, String url);

  void fetchPrune(Path repo);

  void pullFastForwardOnly(Path repo);

  void mergeNoEdit(Path repo, String upstream);

  void rebase(Path repo, String upstream);

  void push(Path repo);

  /** {@code git push -u [--force] <remote> <branch>} where the remote is resolved with {@link #effectiveRemote}. */
  void pushUpstream(Path repo, String branch, String preferredRemote, boolean force);

  void addAll(Path repo);

  void commit(Path repo, String message);

  void abortMerge(Path repo);

  void abortRebase(Path repo);

  void abortCherryPick(Path repo);

  void bisectReset(Path repo);

  /** Dry runs the strategy against the upstream without touching the working tree or the branch of {@code repo}. */
  SyncProbeOutcome probeSync(Path repo, String upstream, SyncStrategy strategy);

  PushAccessProbe probePushAccess(Path repo, String preferredRemote);
}
