package com.scholary.transcriber.whisper;

import com.scholary.transcriber.chunking.AudioChunk;
import java.nio.file.Path;

/**
 * Recognizes the speech in one audio chunk.
 */
public interface WhisperService {

  /**
   * Transcribe a single chunk.
   *
   * @param chunk the chunk to transcribe
   * @param outputBase path (without extension) the recognizer writes its text output to
   * @param threads CPU threads the recognizer may use
   * @return the chunk's text, trimmed; empty for silence-only chunks
   */
  String transcribe(AudioChunk chunk, Path outputBase, int threads);
}
