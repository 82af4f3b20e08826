package com.scholary.transcriber.job;

import java.time.Instant;

/**
 * Immutable, point-in-time view of a job.
 *
 * <p>{@code transcript} and {@code downloadUrl} are only set once the job completed; {@code error}
 * only once it failed. Timestamps are null until the matching transition happened.
 */
public record JobSnapshot(
    String jobId,
    JobStatus status,
    int progress,
    String stage,
    String transcript,
    String downloadUrl,
    String error,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt) {

  public boolean isTerminal() {
    return status.isTerminal();
  }
}
