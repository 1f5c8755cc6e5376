package com.namekis.gitfleet.exec;

/** An external command could not be started or finished with a non zero exit code. */
public class CommandException extends RuntimeException {
  private final String operation;
  private final String command;
  private final int exitCode;
  private final String output;

  public CommandException(String operation, String command, int exitCode, String output) {
    super("Failed on %s: [%s] exit %d%s".formatted(operation, command, exitCode, output.isBlank() ? "" : ": " + output.trim()));
    this.operation = operation;
    this.command = command;
    this.exitCode = exitCode;
    this.output = output;
  }

  public CommandException(String operation, String command, Throwable cause) {
    super("Failed exec on %s: [%s] %s".formatted(operation, command, cause.getMessage()), cause);
    this.operation = operation;
    this.command = command;
    this.exitCode = -1;
    this.output = "";
  }

  public String operation() {
    return operation;
  }

  public String command() {
    return command;
  }

  public int exitCode() {
    return exitCode;
  }

  public String output() {
    return output;
  }
}
