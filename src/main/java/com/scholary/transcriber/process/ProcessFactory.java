package com.scholary.transcriber.process;

import java.io.IOException;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} so the runner can be exercised without real binaries.
 */
public interface ProcessFactory {

  /**
   * Start a process.
   *
   * @param command full command line, executable first
   * @return the started process
   * @throws IOException if the process cannot be spawned
   */
  Process start(List<String> command) throws IOException;
}
