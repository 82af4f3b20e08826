package com.scholary.transcriber.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.transcriber.chunking.AudioChunk;
import com.scholary.transcriber.exception.ProcessExitException;
import com.scholary.transcriber.exception.TranscriptionException;
import com.scholary.transcriber.progress.ProgressTracker;
import com.scholary.transcriber.testutil.TestProperties;
import com.scholary.transcriber.whisper.WhisperService;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class ChunkDispatcherTest {

  private static final Path PARTIAL_DIR = Path.of("/scratch/partial");

  private final ExecutorService pool = Executors.newFixedThreadPool(4);

  @AfterEach
  void tearDown() {
    pool.shutdownNow();
    MDC.clear();
  }

  @Test
  void dispatch_shouldKeepChunkOrderWhenLaterChunksFinishFirst() {
    int total = 8;
    WhisperService whisper =
        (chunk, outputBase, threads) -> {
          sleep((total - chunk.index()) * 15L);
          return "text-" + chunk.index();
        };

    List<String> results = dispatcher(whisper, 4).dispatch(chunks(total), this::outputBase, tracker());

    List<String> expected = new ArrayList<>();
    for (int i = 0; i < total; i++) {
      expected.add("text-" + i);
    }
    assertThat(results).containsExactlyElementsOf(expected);
  }

  @Test
  void dispatch_shouldJoinIntoChronologicalTranscript() {
    WhisperService whisper =
        (chunk, outputBase, threads) -> {
          if (chunk.index() == 0) {
            sleep(100);
          }
          return new String[] {"A", "B", "C"}[chunk.index()];
        };

    List<String> results = dispatcher(whisper, 3).dispatch(chunks(3), this::outputBase, tracker());

    assertThat(String.join("\n", results)).isEqualTo("A\nB\nC");
  }

  @Test
  void dispatch_shouldKeepEmptyLineForSilentChunk() {
    WhisperService whisper =
        (chunk, outputBase, threads) -> {
          if (chunk.index() == 0) {
            return "A";
          }
          return chunk.index() == 1 ? "" : null;
        };

    List<String> results = dispatcher(whisper, 2).dispatch(chunks(3), this::outputBase, tracker());

    assertThat(results).containsExactly("A", "", "");
    assertThat(String.join("\n", results)).isEqualTo("A\n\n");
  }

  @Test
  void dispatch_shouldReturnEmptyListWithoutChunks() {
    AtomicInteger calls = new AtomicInteger();
    WhisperService whisper =
        (chunk, outputBase, threads) -> {
          calls.incrementAndGet();
          return "x";
        };

    assertThat(dispatcher(whisper, 2).dispatch(List.of(), this::outputBase, tracker())).isEmpty();
    assertThat(calls).hasValue(0);
  }

  @Test
  void dispatch_shouldFailWholeBatchWhenOneChunkFails() {
    ProcessExitException failure =
        new ProcessExitException("Failed to run whisper-cli on chunk 2", 1, "bad chunk");
    WhisperService whisper =
        (chunk, outputBase, threads) -> {
          if (chunk.index() == 1) {
            throw failure;
          }
          return "ok";
        };

    assertThatThrownBy(() -> dispatcher(whisper, 2).dispatch(chunks(4), this::outputBase, tracker()))
        .isSameAs(failure);
  }

  @Test
  void dispatch_shouldStopHandingOutChunksAfterFailure() {
    AtomicInteger calls = new AtomicInteger();
    WhisperService whisper =
        (chunk, outputBase, threads) -> {
          calls.incrementAndGet();
          throw new ProcessExitException("Failed to run whisper-cli on chunk 1", 1, "");
        };

    assertThatThrownBy(() -> dispatcher(whisper, 1).dispatch(chunks(5), this::outputBase, tracker()))
        .isInstanceOf(ProcessExitException.class);
    assertThat(calls).hasValue(1);
  }

  @Test
  void dispatch_shouldStopHandingOutChunksAfterWorkerError() {
    AtomicInteger calls = new AtomicInteger();
    WhisperService whisper =
        (chunk, outputBase, threads) -> {
          calls.incrementAndGet();
          throw new NoClassDefFoundError("broken classpath");
        };

    assertThatThrownBy(() -> dispatcher(whisper, 1).dispatch(chunks(5), this::outputBase, tracker()))
        .isInstanceOf(TranscriptionException.class)
        .hasMessage("Chunk worker failed on chunk 1")
        .hasCauseInstanceOf(NoClassDefFoundError.class);
    assertThat(calls).hasValue(1);
  }

  @Test
  void dispatch_shouldNeverRunMoreChunksThanWorkers() {
    AtomicInteger running = new AtomicInteger();
    AtomicInteger peak = new AtomicInteger();
    WhisperService whisper =
        (chunk, outputBase, threads) -> {
          int now = running.incrementAndGet();
          peak.accumulateAndGet(now, Math::max);
          sleep(20);
          running.decrementAndGet();
          return "t";
        };

    dispatcher(whisper, 2).dispatch(chunks(10), this::outputBase, tracker());

    assertThat(peak.get()).isBetween(1, 2);
  }

  @Test
  void dispatch_shouldPassThreadBudgetAndOutputBasePerChunk() {
    Set<Integer> threadCounts = ConcurrentHashMap.newKeySet();
    Set<Path> bases = ConcurrentHashMap.newKeySet();
    WhisperService whisper =
        (chunk, outputBase, threads) -> {
          threadCounts.add(threads);
          bases.add(outputBase);
          return "t";
        };

    dispatcher(whisper, 2).dispatch(chunks(3), this::outputBase, tracker());

    // 16 cpus split between 2 workers
    assertThat(threadCounts).containsExactly(8);
    assertThat(bases)
        .containsExactlyInAnyOrder(outputBase(0), outputBase(1), outputBase(2));
  }

  @Test
  void dispatch_shouldReportMonotonicProgressForEveryChunk() {
    List<Integer> percents = Collections.synchronizedList(new ArrayList<>());
    ProgressTracker tracker = new ProgressTracker((stage, percent) -> percents.add(percent));
    WhisperService whisper = (chunk, outputBase, threads) -> "t";

    dispatcher(whisper, 4).dispatch(chunks(6), this::outputBase, tracker);

    assertThat(tracker.completedChunks()).isEqualTo(6);
    assertThat(percents).isSorted();
    assertThat(percents).first().isEqualTo(20);
    assertThat(percents).last().isEqualTo(ProgressTracker.DISPATCH_CEILING);
  }

  @Test
  void dispatch_shouldCarryLoggingContextIntoWorkers() {
    Set<String> seen = ConcurrentHashMap.newKeySet();
    WhisperService whisper =
        (chunk, outputBase, threads) -> {
          seen.add(String.valueOf(MDC.get("jobId")));
          return "t";
        };
    MDC.put("jobId", "job-42");

    dispatcher(whisper, 3).dispatch(chunks(6), this::outputBase, tracker());

    assertThat(seen).containsExactly("job-42");
  }

  @Test
  void dispatch_shouldFailWhenWorkerPoolRejects() {
    ChunkDispatcher dispatcher =
        new ChunkDispatcher(
            (chunk, outputBase, threads) -> "t",
            TestProperties.whisperWithWorkers(2),
            command -> {
              throw new RejectedExecutionException("saturated");
            },
            () -> 16);

    assertThatThrownBy(() -> dispatcher.dispatch(chunks(2), this::outputBase, tracker()))
        .isInstanceOf(TranscriptionException.class)
        .hasCauseInstanceOf(RejectedExecutionException.class);
  }

  private ChunkDispatcher dispatcher(WhisperService whisper, int workers) {
    return new ChunkDispatcher(whisper, TestProperties.whisperWithWorkers(workers), pool, () -> 16);
  }

  private static ProgressTracker tracker() {
    return new ProgressTracker((stage, percent) -> {});
  }

  private static List<AudioChunk> chunks(int count) {
    List<AudioChunk> chunks = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      chunks.add(new AudioChunk(i, Path.of(String.format("/scratch/chunks/chunk_%03d.wav", i))));
    }
    return chunks;
  }

  private Path outputBase(int index) {
    return PARTIAL_DIR.resolve(String.format("part_%03d", index));
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(e);
    }
  }
}
