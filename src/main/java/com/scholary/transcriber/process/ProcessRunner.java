package com.scholary.transcriber.process;

import com.scholary.transcriber.exception.ProcessExitException;
import com.scholary.transcriber.exception.ProcessInterruptedException;
import com.scholary.transcriber.exception.ProcessSpawnException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs one external command to completion.
 *
 * <p>The caller blocks until the child exits. Everything the child writes to stderr is collected
 * for diagnostics; a non-zero exit turns into a {@link ProcessExitException} carrying that text,
 * and a spawn failure into a {@link ProcessSpawnException}. There is no retry here.
 */
@Component
public class ProcessRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessRunner.class);

  /** Only the tail of stderr is kept; ffmpeg in particular can be very chatty. */
  static final int STDERR_MAX_CHARS = 4000;

  private final ProcessFactory processFactory;

  public ProcessRunner() {
    this(new DefaultProcessFactory());
  }

  public ProcessRunner(ProcessFactory processFactory) {
    this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
  }

  /**
   * Execute a command and wait for it to exit.
   *
   * @param command executable name or path
   * @param args ordered argument list
   * @param label human-readable prefix for error messages (e.g. "Failed to normalize audio")
   * @throws ProcessSpawnException if the process could not be started
   * @throws ProcessExitException if the process exited with a non-zero status
   */
  public void run(String command, List<String> args, String label) {
    List<String> commandLine = new ArrayList<>(args.size() + 1);
    commandLine.add(command);
    commandLine.addAll(args);

    LOGGER.debug("Executing: {}", String.join(" ", commandLine));
    long startNanos = System.nanoTime();

    Process process;
    try {
      process = processFactory.start(commandLine);
    } catch (IOException e) {
      throw new ProcessSpawnException(label, command, e);
    }

    String stderr = "";
    try {
      stderr = readTail(process.getErrorStream());
      int exitCode = process.waitFor();
      long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;

      if (exitCode != 0) {
        LOGGER.warn("{} exited with code {} after {}ms", command, exitCode, elapsedMs);
        throw new ProcessExitException(label, exitCode, stderr);
      }
      LOGGER.debug("{} finished in {}ms", command, elapsedMs);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      process.destroyForcibly();
      throw new ProcessInterruptedException(label, stderr, e);
    } catch (IOException e) {
      // stderr pipe broke; the exit code still decides the outcome
      LOGGER.debug("Could not read stderr of {}: {}", command, e.toString());
      awaitExit(process, command, label, stderr);
    }
  }

  private void awaitExit(Process process, String command, String label, String stderr) {
    try {
      int exitCode = process.waitFor();
      if (exitCode != 0) {
        LOGGER.warn("{} exited with code {}", command, exitCode);
        throw new ProcessExitException(label, exitCode, stderr);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      process.destroyForcibly();
      throw new ProcessInterruptedException(label, stderr, e);
    }
  }

  /**
   * Drain a stream fully, keeping at most {@link #STDERR_MAX_CHARS} trailing characters.
   */
  private static String readTail(InputStream stream) throws IOException {
    StringBuilder sink = new StringBuilder();
    char[] buffer = new char[8192];
    try (Reader in = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
      int read;
      while ((read = in.read(buffer)) != -1) {
        sink.append(buffer, 0, read);
        if (sink.length() > STDERR_MAX_CHARS * 2) {
          sink.delete(0, sink.length() - STDERR_MAX_CHARS);
        }
      }
    }
    if (sink.length() > STDERR_MAX_CHARS) {
      sink.delete(0, sink.length() - STDERR_MAX_CHARS);
    }
    return sink.toString();
  }
}
