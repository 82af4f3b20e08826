package com.scholary.transcriber.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event sets an {@code event_type} plus its fields for exactly one log line. The job
 * context ({@code jobId}, {@code sourceFile}) lives for the whole pipeline run and is copied into
 * worker threads by the dispatcher.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log chunk started event. */
  public void logChunkStarted(int chunkIndex, int totalChunks, int worker) {
    try {
      MDC.put("event_type", "chunk_started");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("totalChunks", String.valueOf(totalChunks));
      MDC.put("worker", String.valueOf(worker));

      logger.debug("Chunk started: index={}/{}, worker={}", chunkIndex + 1, totalChunks, worker);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk finished event. */
  public void logChunkFinished(int chunkIndex, int totalChunks, long transcribeMs, int chars) {
    try {
      MDC.put("event_type", "chunk_finished");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("totalChunks", String.valueOf(totalChunks));
      MDC.put("transcribeMs", String.valueOf(transcribeMs));
      MDC.put("chars", String.valueOf(chars));

      logger.info(
          "Chunk finished: index={}/{}, transcribe={}ms, chars={}",
          chunkIndex + 1,
          totalChunks,
          transcribeMs,
          chars);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk failure event. */
  public void logChunkFailed(int chunkIndex, String errorType, String message) {
    try {
      MDC.put("event_type", "chunk_failed");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("errorType", errorType);

      logger.error(
          "Chunk failed: index={}, error={}, message={}", chunkIndex + 1, errorType, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log job progress event. */
  public void logJobProgress(String jobId, String stage, int percentComplete) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("percentComplete", String.valueOf(percentComplete));
      MDC.put("phase", stage);

      logger.info("Job progress: jobId={}, phase={}, progress={}%", jobId, stage, percentComplete);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String sourceFile) {
    MDC.put("jobId", jobId);
    MDC.put("sourceFile", sourceFile);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("sourceFile");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("chunk_index");
    MDC.remove("totalChunks");
    MDC.remove("worker");
    MDC.remove("transcribeMs");
    MDC.remove("chars");
    MDC.remove("errorType");
    MDC.remove("percentComplete");
    MDC.remove("phase");
  }
}
