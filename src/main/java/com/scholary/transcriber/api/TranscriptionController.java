package com.scholary.transcriber.api;

import com.scholary.transcriber.config.TranscriptionProperties;
import com.scholary.transcriber.job.JobManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST API for audio transcription.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Uploading audio (returns a job ID immediately)
 *   <li>Job status polling
 *   <li>Health check
 * </ul>
 *
 * <p>Finished transcripts are downloadable from {@code /downloads/<jobId>.txt}.
 */
@RestController
@Tag(name = "Transcription", description = "Audio upload and job status API")
public class TranscriptionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionController.class);

  private final JobManager jobManager;
  private final Path uploadDir;

  public TranscriptionController(JobManager jobManager, TranscriptionProperties properties) {
    this.jobManager = jobManager;
    this.uploadDir = Paths.get(properties.uploadDir());

    try {
      Files.createDirectories(this.uploadDir);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to create upload directory: " + uploadDir, e);
    }
  }

  /** Start asynchronous transcription of an uploaded file. */
  @PostMapping(path = "/api/transcribe", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Start transcription",
      description = "Upload an audio file and return a job ID for status polling")
  public ResponseEntity<AsyncJobResponse> transcribe(
      @RequestParam("audio") MultipartFile audio,
      @RequestParam(name = "fullAudio", defaultValue = "false") boolean fullAudio)
      throws IOException {
    if (audio.isEmpty()) {
      throw new InvalidUploadException("Audio file is required in the 'audio' field");
    }

    Path stored = uploadDir.resolve(UUID.randomUUID() + extensionOf(audio.getOriginalFilename()));
    audio.transferTo(stored.toAbsolutePath());
    LOGGER.info(
        "Stored upload: name={}, size={} bytes, as={}",
        audio.getOriginalFilename(),
        audio.getSize(),
        stored.getFileName());

    String jobId;
    try {
      jobId = jobManager.submit(stored, fullAudio);
    } catch (RuntimeException e) {
      // the job never ran, so nothing else will remove the upload
      Files.deleteIfExists(stored);
      throw e;
    }
    return ResponseEntity.accepted().body(new AsyncJobResponse(jobId, "/api/jobs/" + jobId));
  }

  /**
   * Get job status.
   *
   * <p>Returns the current state of a job, including the transcript once completed.
   */
  @GetMapping("/api/jobs/{id}")
  @Operation(summary = "Get job status", description = "Check the status of a transcription job")
  public JobStatusResponse getJobStatus(@PathVariable String id) {
    return JobStatusResponse.from(jobManager.getStatus(id));
  }

  @GetMapping("/api/health")
  @Operation(summary = "Health check")
  public Map<String, Boolean> health() {
    return Map.of("ok", true);
  }

  /** Extension of the original file name, {@code .wav} when there is none. */
  static String extensionOf(String originalFilename) {
    if (originalFilename == null) {
      return ".wav";
    }
    String name = Paths.get(originalFilename).getFileName().toString();
    int dot = name.lastIndexOf('.');
    if (dot <= 0 || dot == name.length() - 1) {
      return ".wav";
    }
    String extension = name.substring(dot);
    return extension.matches("\\.[A-Za-z0-9]{1,8}") ? extension : ".wav";
  }
}
