package com.scholary.transcriber.exception;

import java.nio.file.Path;

/** Thrown when segmentation yields zero chunk files (empty or corrupt input). */
public class NoChunksProducedException extends TranscriptionException {

  public NoChunksProducedException(Path chunksDir) {
    super(message(chunksDir));
  }

  public NoChunksProducedException(Path chunksDir, Throwable cause) {
    super(message(chunksDir), cause);
  }

  private static String message(Path chunksDir) {
    return "No audio chunks were produced for transcription (" + chunksDir.getFileName() + ")";
  }
}
