package com.scholary.transcriber.chunking;

import java.nio.file.Path;

/**
 * One slice of the normalized audio.
 *
 * @param index 0-based position in the chunk sequence; contiguous, no gaps
 * @param file the chunk's WAV file inside the job workspace
 */
public record AudioChunk(int index, Path file) {}
