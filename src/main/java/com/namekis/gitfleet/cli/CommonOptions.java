package com.namekis.gitfleet.cli;

import java.io.PrintWriter;
import java.nio.file.Path;

import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Help.Visibility;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/** Options shared by every gitfleet command. */
public abstract class CommonOptions {
  @Option(names = { "-v", "--verbose" }, description = "Increase verbosity. Specify multiple times to increase (-vvv).")
  boolean[] verbosity = new boolean[0];

  @Option(names = { "-q", "--quiet" }, description = "Suppress all output except errors.")
  boolean quiet = false;

  @Option(names = { "-c",
      "--color" }, negatable = true, description = "Enable colored output (default: true).", defaultValue = "true", showDefaultValue = Visibility.ALWAYS)
  public boolean color = true;

  @Option(names = { "-d", "--debug" }, description = "Enable debug (default: false).", defaultValue = "false", showDefaultValue = Visibility.ALWAYS)
  public boolean debug = false;

  @Option(names = "--home", description = "Home directory holding .config/gitfleet and .local/state/gitfleet (default: $GITFLEET_HOME or the user home).", defaultValue = "${env:GITFLEET_HOME}")
  public Path home;

  @Spec
  protected CommandSpec spec;

  protected void configureLogging() {
    FleetLogging.configureByVerbosity(null, verbosity != null ? verbosity.length : 0, quiet, color, debug);
  }

  public Path homeDir() {
    if (home != null && !home.toString().isBlank()) {
      return home;
    }
    return Path.of(System.getProperty("user.home"));
  }

  protected void stdout(String msg) {
    PrintWriter out = out();
    out.println((color ? Ansi.AUTO : Ansi.OFF).string(msg));
    out.flush();
  }

  protected void stdoutf(String format, Object... args) {
    stdout(format.formatted(args));
  }

  private PrintWriter out() {
    return spec != null ? spec.commandLine().getOut() : new PrintWriter(System.out, true);
  }
}
