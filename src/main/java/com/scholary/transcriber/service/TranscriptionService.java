package com.scholary.transcriber.service;

import com.scholary.transcriber.chunking.AudioChunk;
import com.scholary.transcriber.chunking.AudioPreprocessor;
import com.scholary.transcriber.config.TranscriptionProperties;
import com.scholary.transcriber.dispatch.ChunkDispatcher;
import com.scholary.transcriber.exception.TranscriptionException;
import com.scholary.transcriber.progress.PipelineStage;
import com.scholary.transcriber.progress.ProgressListener;
import com.scholary.transcriber.progress.ProgressTracker;
import com.scholary.transcriber.workspace.ScratchWorkspace;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the full pipeline for one job: normalize, segment, transcribe chunks in parallel, join and
 * persist.
 *
 * <p>All intermediate files live in a {@link ScratchWorkspace} that is removed on every exit
 * path. Any failure propagates unchanged; turning it into job state is the caller's concern.
 */
@Service
public class TranscriptionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionService.class);

  private final AudioPreprocessor preprocessor;
  private final ChunkDispatcher dispatcher;
  private final TranscriptWriter transcriptWriter;
  private final Path tempDir;

  public TranscriptionService(
      AudioPreprocessor preprocessor,
      ChunkDispatcher dispatcher,
      TranscriptWriter transcriptWriter,
      TranscriptionProperties properties) {
    this(preprocessor, dispatcher, transcriptWriter, Paths.get(properties.tempDir()));
  }

  TranscriptionService(
      AudioPreprocessor preprocessor,
      ChunkDispatcher dispatcher,
      TranscriptWriter transcriptWriter,
      Path tempDir) {
    this.preprocessor = preprocessor;
    this.dispatcher = dispatcher;
    this.transcriptWriter = transcriptWriter;
    this.tempDir = tempDir;
  }

  /**
   * Transcribe {@code source} for {@code jobId}.
   *
   * @param fullAudio disable the duration cap applied during normalization
   * @param listener receives monotonic (stage, percent) updates, never 100
   */
  public TranscriptionResult transcribe(
      String jobId, Path source, boolean fullAudio, ProgressListener listener) {
    ProgressTracker tracker = new ProgressTracker(listener);

    ScratchWorkspace workspace;
    try {
      workspace = ScratchWorkspace.create(tempDir);
    } catch (IOException e) {
      throw new TranscriptionException("Could not create scratch workspace in " + tempDir, e);
    }

    try (workspace) {
      tracker.enter(PipelineStage.NORMALIZING);
      preprocessor.normalize(source, workspace.normalizedAudio(), fullAudio);

      tracker.enter(PipelineStage.SEGMENTING);
      List<AudioChunk> chunks = preprocessor.segment(workspace.normalizedAudio(), workspace.chunksDir());

      List<String> parts = dispatcher.dispatch(chunks, workspace::partialOutputBase, tracker);

      tracker.enter(PipelineStage.FINALIZING);
      String transcript = String.join("\n", parts);
      Path outputFile = transcriptWriter.write(jobId, transcript);

      LOGGER.info(
          "Transcription finished: chunks={}, chars={}, output={}",
          chunks.size(),
          transcript.length(),
          outputFile.getFileName());
      return new TranscriptionResult(
          transcript, outputFile, transcriptWriter.downloadUrl(jobId), chunks.size());
    }
  }
}
