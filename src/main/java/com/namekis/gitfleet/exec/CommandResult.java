package com.namekis.gitfleet.exec;

public record CommandResult(int exitCode, String stdout, String stderr) {
  public boolean success() {
    return exitCode == 0;
  }

  /** stdout and stderr joined, as a user would have seen them in a terminal. */
  public String combinedOutput() {
    if (stderr.isEmpty()) {
      return stdout;
    }
    if (stdout.isEmpty()) {
      return stderr;
    }
    return stdout + "\n" + stderr;
  }
}
