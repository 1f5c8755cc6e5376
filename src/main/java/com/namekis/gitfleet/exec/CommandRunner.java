package com.namekis.gitfleet.exec;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zeroturnaround.exec.ProcessExecutor;
import org.zeroturnaround.exec.ProcessResult;

/**
 * Runs external programs (git, gh) through zt-exec. Commands block until the program exits; there is no timeout.
 */
public class CommandRunner {
  private static final Logger log = LoggerFactory.getLogger(CommandRunner.class);

  private final Map<String, String> environment;

  public CommandRunner() {
    this(Map.of());
  }

  public CommandRunner(Map<String, String> environment) {
    this.environment = new LinkedHashMap<>(environment);
  }

  /** Runs the command and reports its exit code instead of failing on it. */
  public CommandResult run(String operation, Path workDir, List<String> command) {
    String printableCmd = printable(workDir, command);
    log.debug("run {}: {}", operation, printableCmd);
    ByteArrayOutputStream err = new ByteArrayOutputStream();
    try {
      ProcessExecutor executor = new ProcessExecutor().command(new ArrayList<>(command))
        .environment(environment)
        .readOutput(true)
        .redirectError(err);
      if (workDir != null) {
        executor.directory(workDir.toFile());
      }
      ProcessResult r = executor.execute();
      CommandResult result = new CommandResult(r.getExitValue(), r.outputUTF8().stripTrailing(), err.toString(StandardCharsets.UTF_8).trim());
      if (!result.combinedOutput().isEmpty()) {
        log.debug("output {} (exit {}):\n{}", operation, result.exitCode(), result.combinedOutput());
      }
      return result;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CommandException(operation, printableCmd, e);
    } catch (Exception e) {
      // git/gh missing or an IO failure, never a plain non zero exit
      throw new CommandException(operation, printableCmd, e);
    }
  }

  /** Runs the command and returns its stdout without trailing blanks, failing on a non zero exit code. */
  public String runChecked(String operation, Path workDir, List<String> command) {
    CommandResult result = run(operation, workDir, command);
    if (!result.success()) {
      throw new CommandException(operation, printable(workDir, command), result.exitCode(), result.combinedOutput());
    }
    return result.stdout();
  }

  static String printable(Path workDir, List<String> command) {
    String cmd = String.join(" ", command);
    return workDir == null ? cmd : "(" + workDir + ") " + cmd;
  }
}
