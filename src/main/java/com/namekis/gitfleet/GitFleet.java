package com.namekis.gitfleet;

import org.fusesource.jansi.AnsiConsole;

import com.namekis.gitfleet.cli.CommonOptions;
import com.namekis.gitfleet.cli.FixCommand;

import picocli.CommandLine;
import picocli.CommandLine.Command;

public class GitFleet {
  private static final String description = """
      Keep a fleet of local git clones syncable.

      Repositories are grouped into catalogs and observed into a machine snapshot under
      ~/.config/gitfleet. `fix` explains why one repository is not syncable and applies
      one remediation action (push, sync-with-upstream, stage-commit-push, ...) to it.
      """;

  public static void main(String... args) {
    AnsiConsole.systemInstall();
    try {
      int exitCode = new CommandLine(new GitFleetRoot()).execute(args);
      System.exit(exitCode);
    } finally {
      AnsiConsole.systemUninstall();
    }
  }

  @Command(name = "gitfleet", mixinStandardHelpOptions = true, version = "gitfleet 0.1", description = description, subcommands = {
      FixCommand.class }, sortOptions = false)
  public static class GitFleetRoot extends CommonOptions implements Runnable {
    @Override
    public void run() {
      configureLogging();
      spec.commandLine().usage(spec.commandLine().getOut());
    }
  }
}
