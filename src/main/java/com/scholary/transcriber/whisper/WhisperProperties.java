package com.scholary.transcriber.whisper;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the whisper.cpp command-line recognizer.
 *
 * <p>{@code workers = 0} means "derive from the number of CPUs". The decoding knobs are passed
 * straight through to the CLI.
 */
@ConfigurationProperties(prefix = "whisper")
@Validated
public record WhisperProperties(
    @NotBlank String binaryPath,
    @NotBlank String modelPath,
    @NotBlank String language,
    String prompt,
    @Min(0) int workers,
    @Positive int maxWorkers,
    @Positive int minThreadsPerWorker,
    @Positive int bestOf,
    @Positive int beamSize,
    double noSpeechThreshold,
    double entropyThreshold,
    double logprobThreshold) {

  public boolean hasPrompt() {
    return prompt != null && !prompt.isBlank();
  }
}
