package com.scholary.transcriber.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for transcription processing.
 *
 * <p>Controls where files live and how much concurrency the service allows.
 */
@ConfigurationProperties(prefix = "transcription")
@Validated
public record TranscriptionProperties(
    @NotBlank String tempDir,
    @NotBlank String uploadDir,
    @NotBlank String outputDir,
    @Positive int asyncExecutorThreads,
    @Positive int asyncExecutorQueueSize,
    @Positive int chunkExecutorThreads,
    boolean deleteSourceAfterProcessing) {}
