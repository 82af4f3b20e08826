package com.scholary.transcriber.service;

import com.scholary.transcriber.config.TranscriptionProperties;
import com.scholary.transcriber.exception.TranscriptionException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.springframework.stereotype.Component;

/**
 * Persists final transcripts as {@code <outputDir>/<jobId>.txt}.
 *
 * <p>The file outlives the in-memory job record and is served under {@link #DOWNLOAD_PATH}.
 */
@Component
public class TranscriptWriter {

  public static final String DOWNLOAD_PATH = "/downloads/";

  private final Path outputDir;

  public TranscriptWriter(TranscriptionProperties properties) {
    this(Paths.get(properties.outputDir()));
  }

  TranscriptWriter(Path outputDir) {
    this.outputDir = outputDir;
    try {
      Files.createDirectories(outputDir);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
    }
  }

  /**
   * Write the transcript for a job, replacing any previous file.
   *
   * @return absolute path of the written file
   */
  public Path write(String jobId, String transcript) {
    Path target = outputDir.resolve(fileName(jobId)).toAbsolutePath();
    try {
      Files.writeString(target, transcript, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new TranscriptionException("Could not write transcript file " + target.getFileName(), e);
    }
    return target;
  }

  public String downloadUrl(String jobId) {
    return DOWNLOAD_PATH + fileName(jobId);
  }

  private static String fileName(String jobId) {
    return jobId + ".txt";
  }
}
