package com.scholary.transcriber.workspace;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A per-job temporary directory holding the normalized audio, the chunk set and the per-chunk
 * recognizer outputs.
 *
 * <p>Layout:
 *
 * <pre>
 * whisper-job-&lt;random&gt;/
 *   normalized.wav
 *   chunks/chunk_000.wav ...
 *   partial/part_000.txt ...
 * </pre>
 *
 * <p>Use with try-with-resources. {@link #close()} removes the whole tree and never throws;
 * deletion problems are logged so they cannot mask the job's real outcome.
 */
public final class ScratchWorkspace implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ScratchWorkspace.class);

  static final String PREFIX = "whisper-job-";

  private final Path root;
  private final Path chunksDir;
  private final Path partialDir;
  private boolean closed;

  private ScratchWorkspace(Path root) {
    this.root = root;
    this.chunksDir = root.resolve("chunks");
    this.partialDir = root.resolve("partial");
  }

  /**
   * Allocate a fresh, uniquely named workspace under {@code parent}.
   *
   * @throws IOException if the directories cannot be created (nothing is left behind)
   */
  public static ScratchWorkspace create(Path parent) throws IOException {
    Files.createDirectories(parent);
    ScratchWorkspace workspace = new ScratchWorkspace(Files.createTempDirectory(parent, PREFIX));
    try {
      Files.createDirectories(workspace.chunksDir);
      Files.createDirectories(workspace.partialDir);
    } catch (IOException e) {
      workspace.close();
      throw e;
    }
    LOGGER.debug("Allocated scratch workspace {}", workspace.root);
    return workspace;
  }

  public Path root() {
    return root;
  }

  public Path normalizedAudio() {
    return root.resolve("normalized.wav");
  }

  public Path chunksDir() {
    return chunksDir;
  }

  public Path partialDir() {
    return partialDir;
  }

  /** Base path (without extension) for the recognizer output of chunk {@code index}. */
  public Path partialOutputBase(int index) {
    return partialDir.resolve(String.format("part_%03d", index));
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;

    if (!Files.exists(root)) {
      return;
    }
    List<Path> paths;
    try (Stream<Path> walk = Files.walk(root)) {
      paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
    } catch (IOException | UncheckedIOException e) {
      LOGGER.warn("Could not list scratch workspace {} for removal: {}", root, e.toString());
      return;
    }

    int failures = 0;
    for (Path path : paths) {
      try {
        Files.deleteIfExists(path);
      } catch (IOException e) {
        failures++;
        LOGGER.warn("Could not delete {}: {}", path, e.toString());
      }
    }
    if (failures == 0) {
      LOGGER.debug("Removed scratch workspace {}", root);
    }
  }
}
