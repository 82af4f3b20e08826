package com.scholary.transcriber.exception;

import java.nio.file.Path;

/**
 * Thrown when a tool exited successfully but did not write the artifact we expected.
 */
public class OutputMissingException extends TranscriptionException {

  private final Path expectedPath;

  public OutputMissingException(String message, Path expectedPath) {
    super(message);
    this.expectedPath = expectedPath;
  }

  public Path getExpectedPath() {
    return expectedPath;
  }
}
