package com.scholary.transcriber.exception;

/**
 * Thrown when an external tool could not be launched at all (missing binary, permissions).
 */
public class ProcessSpawnException extends TranscriptionException {

  private final String command;

  public ProcessSpawnException(String label, String command, Throwable cause) {
    super(String.format("%s: could not start '%s' (%s)", label, command, cause.getMessage()), cause);
    this.command = command;
  }

  public String getCommand() {
    return command;
  }
}
