package com.scholary.transcriber.chunking;

import com.scholary.transcriber.exception.NoChunksProducedException;
import com.scholary.transcriber.process.ProcessRunner;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns an arbitrary input file into an ordered list of fixed-length WAV chunks using ffmpeg.
 *
 * <p>Two ffmpeg passes, strictly sequential:
 *
 * <ol>
 *   <li>Normalize: downmix to mono and resample to 16 kHz, optionally capping the duration
 *   <li>Segment: trim long silences, then cut into {@code segmentSeconds} pieces named
 *       {@code chunk_000.wav}, {@code chunk_001.wav}, ...
 * </ol>
 *
 * <p>The zero-padded names make lexicographic order equal to chronological order, which is what
 * {@link #listChunks(Path)} relies on.
 */
@Component
public class AudioPreprocessor {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioPreprocessor.class);

  static final String CHUNK_PATTERN = "chunk_%03d.wav";

  private final ProcessRunner processRunner;
  private final FfmpegProperties properties;

  public AudioPreprocessor(ProcessRunner processRunner, FfmpegProperties properties) {
    this.processRunner = processRunner;
    this.properties = properties;
  }

  /**
   * Normalize {@code source} into {@code target} (mono, fixed sample rate).
   *
   * @param fullAudio when false the output is truncated to {@code maxDurationSeconds}
   */
  public void normalize(Path source, Path target, boolean fullAudio) {
    List<String> args = new ArrayList<>();
    args.add("-y");
    args.add("-i");
    args.add(source.toString());
    args.add("-ac");
    args.add(String.valueOf(properties.channels()));
    args.add("-ar");
    args.add(String.valueOf(properties.sampleRate()));
    if (!fullAudio) {
      args.add("-t");
      args.add(String.valueOf(properties.maxDurationSeconds()));
    }
    args.add(target.toString());

    LOGGER.info(
        "Normalizing audio: source={}, fullAudio={}, cap={}s",
        source.getFileName(),
        fullAudio,
        fullAudio ? "none" : properties.maxDurationSeconds());
    processRunner.run(properties.binaryPath(), args, "Failed to normalize audio with ffmpeg");
  }

  /**
   * Cut the normalized audio into chunks inside {@code chunksDir} and return them in order.
   *
   * @throws NoChunksProducedException if ffmpeg succeeded but produced no chunk files
   */
  public List<AudioChunk> segment(Path normalized, Path chunksDir) {
    List<String> args =
        List.of(
            "-y",
            "-i",
            normalized.toString(),
            "-af",
            properties.silenceFilter(),
            "-f",
            "segment",
            "-segment_time",
            String.valueOf(properties.segmentSeconds()),
            "-c:a",
            "pcm_s16le",
            "-ar",
            String.valueOf(properties.sampleRate()),
            "-ac",
            String.valueOf(properties.channels()),
            chunksDir.resolve(CHUNK_PATTERN).toString());

    LOGGER.info("Segmenting audio into {}s chunks", properties.segmentSeconds());
    processRunner.run(properties.binaryPath(), args, "Failed to segment audio with ffmpeg");

    List<AudioChunk> chunks = listChunks(chunksDir);
    LOGGER.info("Segmentation produced {} chunks", chunks.size());
    return chunks;
  }

  /**
   * List the chunk files in {@code chunksDir}, sorted by name.
   *
   * @throws NoChunksProducedException if there are none
   */
  List<AudioChunk> listChunks(Path chunksDir) {
    List<Path> files;
    try (Stream<Path> entries = Files.list(chunksDir)) {
      files =
          entries
              .filter(Files::isRegularFile)
              .filter(p -> p.getFileName().toString().endsWith(".wav"))
              .sorted((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()))
              .collect(Collectors.toList());
    } catch (IOException e) {
      throw new NoChunksProducedException(chunksDir, e);
    }

    if (files.isEmpty()) {
      throw new NoChunksProducedException(chunksDir);
    }

    List<AudioChunk> chunks = new ArrayList<>(files.size());
    for (int i = 0; i < files.size(); i++) {
      chunks.add(new AudioChunk(i, files.get(i)));
    }
    return chunks;
  }
}
