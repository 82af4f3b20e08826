package com.scholary.transcriber.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.scholary.transcriber.exception.JobNotFoundException;
import com.scholary.transcriber.exception.ProcessSpawnException;
import com.scholary.transcriber.progress.ProgressListener;
import com.scholary.transcriber.service.TranscriptionResult;
import com.scholary.transcriber.service.TranscriptionService;
import com.scholary.transcriber.testutil.SyncExecutor;
import com.scholary.transcriber.testutil.TestProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JobManagerTest {

  @TempDir Path tempDir;

  private TranscriptionService transcriptionService;
  private JobRepository jobRepository;
  private Path source;

  @BeforeEach
  void setUp() throws IOException {
    transcriptionService = mock(TranscriptionService.class);
    jobRepository = new JobRepository(100, Duration.ofMinutes(60), System::nanoTime);
    source = Files.writeString(tempDir.resolve("upload.mp3"), "audio");
  }

  @Test
  void submit_shouldRunPipelineAndCompleteJob() {
    when(transcriptionService.transcribe(anyString(), eq(source), eq(true), any()))
        .thenAnswer(
            invocation -> {
              String jobId = invocation.getArgument(0);
              ProgressListener listener = invocation.getArgument(3);
              listener.onProgress("Transcribing (1/2 chunks)", 57);
              return new TranscriptionResult(
                  "A\nB", tempDir.resolve(jobId + ".txt"), "/downloads/" + jobId + ".txt", 2);
            });
    JobManager manager = manager(new SyncExecutor(), true);

    String jobId = manager.submit(source, true);

    JobSnapshot snapshot = manager.getStatus(jobId);
    assertThat(snapshot.status()).isEqualTo(JobStatus.COMPLETED);
    assertThat(snapshot.progress()).isEqualTo(100);
    assertThat(snapshot.transcript()).isEqualTo("A\nB");
    assertThat(snapshot.downloadUrl()).isEqualTo("/downloads/" + jobId + ".txt");
    assertThat(snapshot.error()).isNull();
  }

  @Test
  void submit_shouldReturnBeforeProcessingStarts() {
    List<Runnable> pending = new ArrayList<>();
    when(transcriptionService.transcribe(anyString(), any(), anyBoolean(), any()))
        .thenAnswer(
            invocation ->
                new TranscriptionResult("text", tempDir.resolve("x.txt"), "/downloads/x.txt", 1));
    JobManager manager = manager(pending::add, true);

    String jobId = manager.submit(source, false);

    assertThat(manager.getStatus(jobId).status()).isEqualTo(JobStatus.QUEUED);
    assertThat(manager.getStatus(jobId).progress()).isZero();
    assertThat(pending).hasSize(1);

    pending.get(0).run();

    assertThat(manager.getStatus(jobId).status()).isEqualTo(JobStatus.COMPLETED);
  }

  @Test
  void submit_shouldMarkJobFailedWithErrorMessage() {
    when(transcriptionService.transcribe(anyString(), any(), anyBoolean(), any()))
        .thenThrow(
            new ProcessSpawnException(
                "Failed to run whisper-cli on chunk 1",
                "whisper-cli",
                new IOException("No such file or directory")));
    JobManager manager = manager(new SyncExecutor(), true);

    String jobId = manager.submit(source, false);

    JobSnapshot snapshot = manager.getStatus(jobId);
    assertThat(snapshot.status()).isEqualTo(JobStatus.FAILED);
    assertThat(snapshot.progress()).isEqualTo(100);
    assertThat(snapshot.stage()).isEqualTo("Failed");
    assertThat(snapshot.error())
        .contains("could not start 'whisper-cli'")
        .contains("No such file or directory");
    assertThat(snapshot.transcript()).isNull();
  }

  @Test
  void submit_shouldFallBackToExceptionTypeWhenMessageIsMissing() {
    when(transcriptionService.transcribe(anyString(), any(), anyBoolean(), any()))
        .thenThrow(new IllegalStateException());
    JobManager manager = manager(new SyncExecutor(), true);

    String jobId = manager.submit(source, false);

    assertThat(manager.getStatus(jobId).error()).isEqualTo("IllegalStateException");
  }

  @Test
  void progress_shouldBeMonotonicAcrossPolls() {
    List<Integer> observed = new ArrayList<>();
    JobManager[] holder = new JobManager[1];
    when(transcriptionService.transcribe(anyString(), any(), anyBoolean(), any()))
        .thenAnswer(
            invocation -> {
              String jobId = invocation.getArgument(0);
              ProgressListener listener = invocation.getArgument(3);
              for (int percent : new int[] {10, 5, 40, 20, 100}) {
                listener.onProgress("step", percent);
                observed.add(holder[0].getStatus(jobId).progress());
              }
              return new TranscriptionResult("t", tempDir.resolve("t.txt"), "/downloads/t.txt", 1);
            });
    holder[0] = manager(new SyncExecutor(), true);

    holder[0].submit(source, false);

    assertThat(observed).containsExactly(10, 10, 40, 40, 99);
  }

  @Test
  void run_shouldDeleteSourceAfterSuccessAndFailure() throws IOException {
    Path other = Files.writeString(tempDir.resolve("second.wav"), "audio");
    when(transcriptionService.transcribe(anyString(), eq(source), anyBoolean(), any()))
        .thenAnswer(
            invocation ->
                new TranscriptionResult("t", tempDir.resolve("t.txt"), "/downloads/t.txt", 1));
    when(transcriptionService.transcribe(anyString(), eq(other), anyBoolean(), any()))
        .thenThrow(new IllegalStateException("boom"));
    JobManager manager = manager(new SyncExecutor(), true);

    manager.submit(source, false);
    manager.submit(other, false);

    assertThat(source).doesNotExist();
    assertThat(other).doesNotExist();
  }

  @Test
  void run_shouldKeepSourceWhenDeletionDisabled() {
    when(transcriptionService.transcribe(anyString(), any(), anyBoolean(), any()))
        .thenAnswer(
            invocation ->
                new TranscriptionResult("t", tempDir.resolve("t.txt"), "/downloads/t.txt", 1));
    JobManager manager = manager(new SyncExecutor(), false);

    manager.submit(source, false);

    assertThat(source).exists();
  }

  @Test
  void submit_shouldPropagateRejectionWithoutRunningPipeline() {
    JobManager manager =
        manager(
            command -> {
              throw new RejectedExecutionException("queue full");
            },
            true);

    assertThatThrownBy(() -> manager.submit(source, false))
        .isInstanceOf(RejectedExecutionException.class);
    verifyNoInteractions(transcriptionService);
    assertThat(source).exists();
  }

  @Test
  void getStatus_shouldRejectUnknownJob() {
    JobManager manager = manager(new SyncExecutor(), true);

    assertThatThrownBy(() -> manager.getStatus("does-not-exist"))
        .isInstanceOf(JobNotFoundException.class)
        .hasMessage("Job not found: does-not-exist");
  }

  @Test
  void submit_shouldPassFullAudioFlagThrough() {
    when(transcriptionService.transcribe(anyString(), any(), anyBoolean(), any()))
        .thenAnswer(
            invocation ->
                new TranscriptionResult("t", tempDir.resolve("t.txt"), "/downloads/t.txt", 1));
    JobManager manager = manager(new SyncExecutor(), false);

    manager.submit(source, true);

    verify(transcriptionService).transcribe(anyString(), eq(source), eq(true), any());
  }

  private JobManager manager(Executor executor, boolean deleteSource) {
    return new JobManager(
        jobRepository,
        transcriptionService,
        executor,
        Clock.systemUTC(),
        TestProperties.transcription(tempDir, deleteSource));
  }
}
