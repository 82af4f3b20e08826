package com.scholary.transcriber.job;

import java.util.Locale;

/** Lifecycle states of a transcription job. */
public enum JobStatus {
  QUEUED,
  PROCESSING,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  /** Lower-case name used on the wire ({@code "queued"}, {@code "processing"}, ...). */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
