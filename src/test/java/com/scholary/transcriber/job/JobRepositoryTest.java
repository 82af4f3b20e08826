package com.scholary.transcriber.job;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.benmanes.caffeine.cache.Ticker;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class JobRepositoryTest {

  private final FakeTicker ticker = new FakeTicker();
  private final JobRepository repository =
      new JobRepository(100, Duration.ofMinutes(120), ticker);

  @Test
  void findById_shouldReturnSavedJob() {
    TranscriptionJob job = newJob("job-1");
    repository.save(job);

    assertThat(repository.findById("job-1")).containsSame(job);
    assertThat(repository.findById("missing")).isEmpty();
  }

  @Test
  void activeJobs_shouldNeverExpire() {
    TranscriptionJob queued = newJob("queued");
    TranscriptionJob processing = newJob("processing");
    processing.start();
    repository.save(queued);
    repository.save(processing);

    ticker.advance(Duration.ofDays(2));

    assertThat(repository.findById("queued")).isPresent();
    assertThat(repository.findById("processing")).isPresent();
  }

  @Test
  void terminalJobs_shouldExpireAfterRetention() {
    TranscriptionJob job = newJob("done");
    repository.save(job);
    job.start();
    ticker.advance(Duration.ofHours(5));
    job.complete("text", "/downloads/done.txt");
    repository.save(job);

    ticker.advance(Duration.ofMinutes(119));
    assertThat(repository.findById("done")).isPresent();

    ticker.advance(Duration.ofMinutes(2));
    assertThat(repository.findById("done")).isEmpty();
  }

  @Test
  void delete_shouldRemoveJob() {
    repository.save(newJob("job-1"));

    repository.delete("job-1");

    assertThat(repository.findById("job-1")).isEmpty();
  }

  private static TranscriptionJob newJob(String id) {
    return new TranscriptionJob(id, Path.of("uploads", id + ".wav"), false, Clock.systemUTC());
  }

  private static final class FakeTicker implements Ticker {
    private final AtomicLong nanos = new AtomicLong();

    @Override
    public long read() {
      return nanos.get();
    }

    void advance(Duration duration) {
      nanos.addAndGet(duration.toNanos());
    }
  }
}
