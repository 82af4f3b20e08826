package com.scholary.transcriber.job;

import com.scholary.transcriber.progress.PipelineStage;
import com.scholary.transcriber.progress.ProgressTracker;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;

/**
 * Mutable record of one transcription job.
 *
 * <p>State machine: {@code QUEUED -> PROCESSING -> COMPLETED | FAILED}. Terminal states are
 * reached exactly once and never left. Every mutator and {@link #snapshot()} synchronize on the
 * job, so a status poll never observes a half-applied transition.
 */
public class TranscriptionJob {

  private final String jobId;
  private final Path sourceFile;
  private final boolean fullAudio;
  private final Clock clock;
  private final Instant createdAt;

  private JobStatus status;
  private int progress;
  private String stage;
  private Instant startedAt;
  private Instant completedAt;
  private String transcript;
  private String downloadUrl;
  private String error;

  public TranscriptionJob(String jobId, Path sourceFile, boolean fullAudio, Clock clock) {
    this.jobId = jobId;
    this.sourceFile = sourceFile;
    this.fullAudio = fullAudio;
    this.clock = clock;
    this.createdAt = clock.instant();
    this.status = JobStatus.QUEUED;
    this.progress = PipelineStage.QUEUED.checkpoint();
    this.stage = PipelineStage.QUEUED.label();
  }

  public String getJobId() {
    return jobId;
  }

  public Path getSourceFile() {
    return sourceFile;
  }

  public boolean isFullAudio() {
    return fullAudio;
  }

  public synchronized JobStatus getStatus() {
    return status;
  }

  public synchronized boolean isTerminal() {
    return status.isTerminal();
  }

  /** {@code QUEUED -> PROCESSING}. */
  public synchronized void start() {
    requireStatus(JobStatus.QUEUED, "start");
    status = JobStatus.PROCESSING;
    startedAt = clock.instant();
    stage = PipelineStage.STARTING.label();
    progress = PipelineStage.STARTING.checkpoint();
  }

  /**
   * Apply a pipeline progress update. Lower percentages than already reported are ignored, and
   * the value is capped below 100 until the job is terminal.
   *
   * @return false if the job is not processing and the update was dropped
   */
  public synchronized boolean updateProgress(String newStage, int percent) {
    if (status != JobStatus.PROCESSING) {
      return false;
    }
    progress = Math.max(progress, Math.min(percent, ProgressTracker.MAX_ACTIVE_PERCENT));
    stage = newStage;
    return true;
  }

  /** {@code PROCESSING -> COMPLETED}. */
  public synchronized void complete(String transcript, String downloadUrl) {
    requireStatus(JobStatus.PROCESSING, "complete");
    this.status = JobStatus.COMPLETED;
    this.completedAt = clock.instant();
    this.progress = 100;
    this.stage = PipelineStage.COMPLETED.label();
    this.transcript = transcript;
    this.downloadUrl = downloadUrl;
  }

  /** {@code PROCESSING -> FAILED}. */
  public synchronized void fail(String error) {
    requireStatus(JobStatus.PROCESSING, "fail");
    this.status = JobStatus.FAILED;
    this.completedAt = clock.instant();
    this.progress = 100;
    this.stage = PipelineStage.FAILED.label();
    this.error = error;
  }

  public synchronized JobSnapshot snapshot() {
    return new JobSnapshot(
        jobId,
        status,
        progress,
        stage,
        transcript,
        downloadUrl,
        error,
        createdAt,
        startedAt,
        completedAt);
  }

  private void requireStatus(JobStatus expected, String transition) {
    if (status != expected) {
      throw new IllegalStateException(
          String.format("Cannot %s job %s in state %s", transition, jobId, status));
    }
  }
}
