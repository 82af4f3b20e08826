package com.scholary.transcriber.chunking;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for ffmpeg operations.
 *
 * <p>These control how audio is normalized and cut into chunks. The silence settings feed the
 * {@code silenceremove} filter applied before segmentation; the defaults are tuned for speech.
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(
    @NotBlank String binaryPath,
    @Positive int sampleRate,
    @Positive int channels,
    @Positive int segmentSeconds,
    @Positive int maxDurationSeconds,
    @NotBlank String silenceThreshold,
    @Positive double silenceMinDuration) {

  /** Filter expression that drops long pauses so segment cuts tend to land between words. */
  public String silenceFilter() {
    return String.format(
        java.util.Locale.ROOT,
        "silenceremove=stop_periods=-1:stop_duration=%s:stop_threshold=%s",
        silenceMinDuration,
        silenceThreshold);
  }
}
