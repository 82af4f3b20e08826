package com.scholary.transcriber.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory registry of transcription jobs.
 *
 * <p>Uses a Caffeine cache so lookups, inserts and replacements are safe from any thread. Active
 * jobs never expire; a job becomes eligible for eviction {@code expireAfterMinutes} after the
 * write that made it terminal. Callers must {@link #save} a job after its terminal transition.
 * Nothing survives a restart.
 */
@Repository
public class JobRepository {

  private final Cache<String, TranscriptionJob> cache;

  @Autowired
  public JobRepository(
      @Value("${jobstore.maxSize}") int maxSize,
      @Value("${jobstore.expireAfterMinutes}") int expireAfterMinutes) {
    this(maxSize, Duration.ofMinutes(expireAfterMinutes), Ticker.systemTicker());
  }

  JobRepository(int maxSize, Duration retention, Ticker ticker) {
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfter(new TerminalJobExpiry(retention.toNanos()))
            .ticker(ticker)
            .executor(Runnable::run)
            .build();
  }

  public void save(TranscriptionJob job) {
    cache.put(job.getJobId(), job);
  }

  public Optional<TranscriptionJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }

  public void delete(String jobId) {
    cache.invalidate(jobId);
  }

  private static final class TerminalJobExpiry implements Expiry<String, TranscriptionJob> {

    private final long retentionNanos;

    TerminalJobExpiry(long retentionNanos) {
      this.retentionNanos = retentionNanos;
    }

    @Override
    public long expireAfterCreate(String key, TranscriptionJob job, long currentTime) {
      return job.isTerminal() ? retentionNanos : Long.MAX_VALUE;
    }

    @Override
    public long expireAfterUpdate(
        String key, TranscriptionJob job, long currentTime, long currentDuration) {
      return job.isTerminal() ? retentionNanos : Long.MAX_VALUE;
    }

    @Override
    public long expireAfterRead(
        String key, TranscriptionJob job, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}
