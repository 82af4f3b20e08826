package com.scholary.transcriber.service;

import java.nio.file.Path;

/**
 * Outcome of a successful pipeline run.
 *
 * @param transcript chunk texts joined by newlines, in chunk order
 * @param outputFile persisted plain-text transcript
 * @param downloadUrl path under which {@code outputFile} is served
 * @param chunkCount number of chunks transcribed
 */
public record TranscriptionResult(
    String transcript, Path outputFile, String downloadUrl, int chunkCount) {}
