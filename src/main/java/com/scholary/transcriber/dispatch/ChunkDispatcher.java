package com.scholary.transcriber.dispatch;

import com.scholary.transcriber.chunking.AudioChunk;
import com.scholary.transcriber.exception.TranscriptionException;
import com.scholary.transcriber.logging.StructuredLogger;
import com.scholary.transcriber.progress.ProgressTracker;
import com.scholary.transcriber.whisper.WhisperProperties;
import com.scholary.transcriber.whisper.WhisperService;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.IntFunction;
import java.util.function.IntSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Transcribes an ordered chunk list with a small pool of workers.
 *
 * <p>Workers drain a shared queue, so a slow chunk never holds up the others. Each result is
 * written into a pre-sized slot at the chunk's index, which keeps the output in chronological
 * order however the completions interleave.
 *
 * <p>The first failing chunk fails the whole dispatch: workers stop taking new chunks, chunks
 * already running finish, and that first failure is rethrown. There is no partial transcript.
 */
@Component
public class ChunkDispatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkDispatcher.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final WhisperService whisperService;
  private final WhisperProperties properties;
  private final Executor executor;
  private final IntSupplier availableProcessors;

  @Autowired
  public ChunkDispatcher(
      WhisperService whisperService,
      WhisperProperties properties,
      @Qualifier("chunkExecutor") Executor executor) {
    this(whisperService, properties, executor, () -> Runtime.getRuntime().availableProcessors());
  }

  ChunkDispatcher(
      WhisperService whisperService,
      WhisperProperties properties,
      Executor executor,
      IntSupplier availableProcessors) {
    this.whisperService = whisperService;
    this.properties = properties;
    this.executor = executor;
    this.availableProcessors = availableProcessors;
  }

  /**
   * Transcribe every chunk and return the texts in chunk order.
   *
   * @param chunks chunks in sequence order; {@code chunks.get(i).index() == i}
   * @param outputBaseFor recognizer output base path for a chunk index
   * @param tracker receives one completion per finished chunk
   * @return list of size {@code chunks.size()}, element {@code i} being chunk {@code i}'s text
   */
  public List<String> dispatch(
      List<AudioChunk> chunks, IntFunction<Path> outputBaseFor, ProgressTracker tracker) {
    int total = chunks.size();
    if (total == 0) {
      return List.of();
    }

    WorkerAllocation allocation =
        WorkerAllocation.compute(total, availableProcessors.getAsInt(), properties);
    LOGGER.info(
        "Dispatching {} chunks to {} workers ({} threads each)",
        total,
        allocation.workers(),
        allocation.threadsPerWorker());

    Queue<AudioChunk> queue = new ConcurrentLinkedQueue<>(chunks);
    String[] results = new String[total];
    AtomicReference<RuntimeException> failure = new AtomicReference<>();
    Map<String, String> context = MDC.getCopyOfContextMap();

    tracker.dispatchStarted(total);

    List<CompletableFuture<Void>> workers = new ArrayList<>(allocation.workers());
    for (int w = 0; w < allocation.workers(); w++) {
      int workerId = w;
      try {
        workers.add(
            CompletableFuture.runAsync(
                () ->
                    drain(
                        workerId,
                        queue,
                        results,
                        failure,
                        context,
                        outputBaseFor,
                        tracker,
                        allocation.threadsPerWorker()),
                executor));
      } catch (RejectedExecutionException e) {
        failure.compareAndSet(
            null, new TranscriptionException("Chunk worker pool rejected worker " + workerId, e));
        break;
      }
    }

    awaitWorkers(workers, failure);

    RuntimeException error = failure.get();
    if (error != null) {
      throw error;
    }
    return Arrays.asList(results);
  }

  private void drain(
      int workerId,
      Queue<AudioChunk> queue,
      String[] results,
      AtomicReference<RuntimeException> failure,
      Map<String, String> context,
      IntFunction<Path> outputBaseFor,
      ProgressTracker tracker,
      int threads) {
    if (context != null) {
      MDC.setContextMap(context);
    }
    try {
      AudioChunk chunk;
      while (failure.get() == null && (chunk = queue.poll()) != null) {
        structuredLogger.logChunkStarted(chunk.index(), results.length, workerId);
        long startMs = System.currentTimeMillis();
        try {
          String text =
              whisperService.transcribe(chunk, outputBaseFor.apply(chunk.index()), threads);
          results[chunk.index()] = text == null ? "" : text;
          tracker.chunkCompleted();
          structuredLogger.logChunkFinished(
              chunk.index(),
              results.length,
              System.currentTimeMillis() - startMs,
              results[chunk.index()].length());
        } catch (RuntimeException e) {
          structuredLogger.logChunkFailed(
              chunk.index(), e.getClass().getSimpleName(), e.getMessage());
          failure.compareAndSet(null, e);
        } catch (Error e) {
          structuredLogger.logChunkFailed(
              chunk.index(), e.getClass().getSimpleName(), e.getMessage());
          failure.compareAndSet(
              null,
              new TranscriptionException("Chunk worker failed on chunk " + (chunk.index() + 1), e));
          throw e;
        }
      }
    } finally {
      MDC.clear();
    }
  }

  private void awaitWorkers(
      List<CompletableFuture<Void>> workers, AtomicReference<RuntimeException> failure) {
    try {
      CompletableFuture.allOf(workers.toArray(new CompletableFuture[0])).get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      failure.compareAndSet(null, new TranscriptionException("Interrupted while transcribing", e));
    } catch (ExecutionException e) {
      // drain() captures its own failures; anything here escaped the worker loop
      Throwable cause = e.getCause();
      failure.compareAndSet(
          null,
          cause instanceof RuntimeException
              ? (RuntimeException) cause
              : new TranscriptionException("Chunk worker failed", cause));
    }
  }
}
