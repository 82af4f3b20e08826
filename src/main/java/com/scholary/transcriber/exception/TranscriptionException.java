package com.scholary.transcriber.exception;

/**
 * Base type for every failure raised by the transcription pipeline.
 *
 * <p>The message is what ends up in a failed job's {@code error} field, so subclasses build it
 * from the failing step's diagnostics rather than from stack traces.
 */
public class TranscriptionException extends RuntimeException {

  public TranscriptionException(String message) {
    super(message);
  }

  public TranscriptionException(String message, Throwable cause) {
    super(message, cause);
  }
}
