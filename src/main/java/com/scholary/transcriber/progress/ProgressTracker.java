package com.scholary.transcriber.progress;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Maps pipeline events onto a single caller-visible (stage, percent) pair.
 *
 * <p>Percent never goes backwards and stays below 100 while the job is active; only the job's
 * terminal transition reports 100. Chunk completions arrive from several worker threads at once.
 */
public class ProgressTracker {

  public static final int DISPATCH_CEILING = 95;
  public static final int MAX_ACTIVE_PERCENT = 99;

  private final ProgressListener listener;
  private final AtomicInteger completedChunks = new AtomicInteger();
  private volatile int totalChunks;
  private int reported; // guarded by this

  public ProgressTracker(ProgressListener listener) {
    this.listener = listener;
  }

  /** Enter a non-terminal stage at its checkpoint percentage. */
  public void enter(PipelineStage stage) {
    if (stage.isTerminal()) {
      throw new IllegalArgumentException("Terminal stages are reported by the job, not the tracker");
    }
    report(stage.label(), stage.checkpoint());
  }

  /** Dispatch is about to begin over {@code total} chunks. */
  public void dispatchStarted(int total) {
    this.totalChunks = total;
    completedChunks.set(0);
    report(transcribingLabel(0, total), PipelineStage.TRANSCRIBING.checkpoint());
  }

  /**
   * Record one finished chunk. Safe to call from any worker thread.
   *
   * @return the number of chunks finished so far
   */
  public int chunkCompleted() {
    int total = totalChunks;
    int completed = completedChunks.incrementAndGet();
    report(transcribingLabel(completed, total), dispatchPercent(completed, total));
    return completed;
  }

  public int completedChunks() {
    return completedChunks.get();
  }

  public synchronized int percent() {
    return reported;
  }

  /** Linear interpolation between the transcribing checkpoint and the dispatch ceiling. */
  static int dispatchPercent(int completed, int total) {
    int floor = PipelineStage.TRANSCRIBING.checkpoint();
    if (total <= 0) {
      return floor;
    }
    int bounded = Math.min(completed, total);
    return floor + (DISPATCH_CEILING - floor) * bounded / total;
  }

  private static String transcribingLabel(int completed, int total) {
    return String.format("%s (%d/%d chunks)", PipelineStage.TRANSCRIBING.label(), completed, total);
  }

  private synchronized void report(String stage, int percent) {
    int next = Math.max(reported, Math.min(percent, MAX_ACTIVE_PERCENT));
    reported = next;
    listener.onProgress(stage, next);
  }
}
