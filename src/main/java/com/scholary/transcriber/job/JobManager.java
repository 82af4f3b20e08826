package com.scholary.transcriber.job;

import com.scholary.transcriber.config.TranscriptionProperties;
import com.scholary.transcriber.exception.JobNotFoundException;
import com.scholary.transcriber.logging.StructuredLogger;
import com.scholary.transcriber.progress.ProgressListener;
import com.scholary.transcriber.service.TranscriptionResult;
import com.scholary.transcriber.service.TranscriptionService;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Accepts transcription jobs and answers status queries.
 *
 * <p>{@link #submit} registers a {@code QUEUED} job and hands the pipeline to the background
 * executor, returning the id immediately. The pipeline thread owns the job record until it is
 * terminal; {@link #getStatus} may run concurrently and always sees a consistent snapshot.
 *
 * <p>There is no cancellation: once dispatched, a job runs to completion or failure.
 */
@Service
public class JobManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobManager.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final JobRepository jobRepository;
  private final TranscriptionService transcriptionService;
  private final Executor executor;
  private final Clock clock;
  private final boolean deleteSourceAfterProcessing;

  public JobManager(
      JobRepository jobRepository,
      TranscriptionService transcriptionService,
      @Qualifier("taskExecutor") Executor executor,
      Clock clock,
      TranscriptionProperties properties) {
    this.jobRepository = jobRepository;
    this.transcriptionService = transcriptionService;
    this.executor = executor;
    this.clock = clock;
    this.deleteSourceAfterProcessing = properties.deleteSourceAfterProcessing();
  }

  /**
   * Accept a job for {@code sourceFile}. Never waits for transcription.
   *
   * @param fullAudio transcribe the whole file instead of the capped duration
   * @return the new job's id
   * @throws RejectedExecutionException if the job queue is full; no job is registered then
   */
  public String submit(Path sourceFile, boolean fullAudio) {
    String jobId = UUID.randomUUID().toString();
    TranscriptionJob job = new TranscriptionJob(jobId, sourceFile, fullAudio, clock);
    jobRepository.save(job);
    LOGGER.info("Created transcription job: jobId={}, source={}", jobId, sourceFile.getFileName());

    try {
      executor.execute(() -> run(job));
    } catch (RejectedExecutionException e) {
      LOGGER.warn("Job queue is full, rejecting job {}", jobId);
      jobRepository.delete(jobId);
      throw e;
    }
    return jobId;
  }

  /**
   * Current snapshot of a job.
   *
   * @throws JobNotFoundException if the id is unknown or its record has expired
   */
  public JobSnapshot getStatus(String jobId) {
    return jobRepository
        .findById(jobId)
        .map(TranscriptionJob::snapshot)
        .orElseThrow(() -> new JobNotFoundException(jobId));
  }

  void run(TranscriptionJob job) {
    String jobId = job.getJobId();
    StructuredLogger.setJobContext(jobId, String.valueOf(job.getSourceFile().getFileName()));
    try {
      job.start();
      LOGGER.info("Starting processing for job: {}", jobId);

      ProgressListener listener =
          (stage, percent) -> {
            if (job.updateProgress(stage, percent)) {
              structuredLogger.logJobProgress(jobId, stage, percent);
            }
          };
      TranscriptionResult result =
          transcriptionService.transcribe(jobId, job.getSourceFile(), job.isFullAudio(), listener);

      job.complete(result.transcript(), result.downloadUrl());
      LOGGER.info("Completed job {}: {} chunks", jobId, result.chunkCount());
    } catch (RuntimeException e) {
      LOGGER.error("Processing failed for job: {}", jobId, e);
      failIfActive(job, describe(e));
    } finally {
      failIfActive(job, "Transcription ended unexpectedly");
      jobRepository.save(job);
      deleteSource(job.getSourceFile());
      StructuredLogger.clearJobContext();
    }
  }

  private static void failIfActive(TranscriptionJob job, String message) {
    synchronized (job) {
      if (job.getStatus() == JobStatus.PROCESSING) {
        job.fail(message);
      }
    }
  }

  private static String describe(RuntimeException e) {
    String message = e.getMessage();
    return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
  }

  private void deleteSource(Path sourceFile) {
    if (!deleteSourceAfterProcessing) {
      return;
    }
    try {
      Files.deleteIfExists(sourceFile);
    } catch (IOException e) {
      LOGGER.warn("Could not delete source file {}: {}", sourceFile, e.toString());
    }
  }
}
