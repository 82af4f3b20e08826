package com.scholary.transcriber.api;

import com.scholary.transcriber.job.JobSnapshot;
import java.time.Instant;

/**
 * Response for job status query.
 *
 * <p>{@code transcription} and {@code downloadUrl} are present once the job completed,
 * {@code error} once it failed.
 */
public record JobStatusResponse(
    String jobId,
    String status,
    int progress,
    String stage,
    String transcription,
    String downloadUrl,
    String error,
    String startedAt,
    String completedAt) {

  public static JobStatusResponse from(JobSnapshot snapshot) {
    return new JobStatusResponse(
        snapshot.jobId(),
        snapshot.status().wireName(),
        snapshot.progress(),
        snapshot.stage(),
        snapshot.transcript(),
        snapshot.downloadUrl(),
        snapshot.error(),
        format(snapshot.startedAt()),
        format(snapshot.completedAt()));
  }

  private static String format(Instant instant) {
    return instant == null ? null : instant.toString();
  }
}
