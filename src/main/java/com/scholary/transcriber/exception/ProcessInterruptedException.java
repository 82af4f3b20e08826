package com.scholary.transcriber.exception;

/**
 * Thrown when the thread waiting on an external tool is interrupted. The child process is
 * destroyed before this is raised.
 */
public class ProcessInterruptedException extends ProcessExitException {

  public ProcessInterruptedException(String label, String stderr, InterruptedException cause) {
    super(label + ": interrupted while waiting for process exit", -1, stderr, cause);
  }
}
