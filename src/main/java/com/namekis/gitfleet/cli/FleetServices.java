package com.namekis.gitfleet.cli;

import java.nio.file.Path;
import java.time.Clock;

import com.namekis.gitfleet.exec.CommandRunner;
import com.namekis.gitfleet.fix.FixService;
import com.namekis.gitfleet.git.GitClient;
import com.namekis.gitfleet.git.ProcessGitClient;
import com.namekis.gitfleet.github.GhCliRemotes;
import com.namekis.gitfleet.risk.GitRiskCollector;
import com.namekis.gitfleet.scan.GitRepoScanner;
import com.namekis.gitfleet.state.FileStateStore;

/** Wires the process-backed collaborators for a home directory. */
public final class FleetServices {
  private FleetServices() {
  }

  public static FixService fixService(Path home) {
    Clock clock = Clock.systemUTC();
    FileStateStore store = new FileStateStore(home, clock);
    GitClient git = new ProcessGitClient();
    GhCliRemotes github = new GhCliRemotes(new CommandRunner(), git, clock);
    GitRepoScanner scanner = new GitRepoScanner(git, store, clock);
    return new FixService(store, git, github, new GitRiskCollector(git), scanner, clock);
  }
}
