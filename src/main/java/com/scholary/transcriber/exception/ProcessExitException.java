package com.scholary.transcriber.exception;

/**
 * Thrown when an external tool ran but exited with a non-zero status.
 *
 * <p>Carries the exit code and whatever the tool wrote to its error stream.
 */
public class ProcessExitException extends TranscriptionException {

  private final int exitCode;
  private final String stderr;

  public ProcessExitException(String label, int exitCode, String stderr) {
    super(buildMessage(label, exitCode, stderr));
    this.exitCode = exitCode;
    this.stderr = stderr;
  }

  protected ProcessExitException(String message, int exitCode, String stderr, Throwable cause) {
    super(message, cause);
    this.exitCode = exitCode;
    this.stderr = stderr;
  }

  public int getExitCode() {
    return exitCode;
  }

  public String getStderr() {
    return stderr;
  }

  private static String buildMessage(String label, int exitCode, String stderr) {
    String message = String.format("%s: exit code %d.", label, exitCode);
    if (stderr == null || stderr.isBlank()) {
      return message;
    }
    return message + " " + stderr.trim();
  }
}
