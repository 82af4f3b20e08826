package com.scholary.transcriber.dispatch;

import com.scholary.transcriber.whisper.WhisperProperties;

/**
 * How many recognizer processes run side by side for one job, and how many CPU threads each
 * process gets.
 *
 * <p>Each whisper process is itself multi-threaded, and several heavy processes at once saturate
 * memory and disk, so the worker count stays small (at most {@code maxWorkers}) and the CPU budget
 * is split between them with a per-worker floor.
 */
public record WorkerAllocation(int workers, int threadsPerWorker) {

  public WorkerAllocation {
    if (workers < 1 || threadsPerWorker < 1) {
      throw new IllegalArgumentException(
          "workers and threadsPerWorker must be positive: " + workers + ", " + threadsPerWorker);
    }
  }

  /**
   * @param chunkCount number of chunks to transcribe; no more workers than chunks are started
   * @param availableProcessors CPUs visible to the JVM
   */
  public static WorkerAllocation compute(
      int chunkCount, int availableProcessors, WhisperProperties properties) {
    int cpus = Math.max(1, availableProcessors);
    int requested = properties.workers() > 0 ? properties.workers() : Math.max(1, cpus / 4);
    int workers = Math.min(requested, properties.maxWorkers());
    workers = Math.max(1, Math.min(workers, Math.max(1, chunkCount)));

    int threads = Math.max(properties.minThreadsPerWorker(), cpus / workers);
    return new WorkerAllocation(workers, threads);
  }
}
