package com.scholary.transcriber.process;

import java.io.IOException;
import java.util.List;

/**
 * Production {@link ProcessFactory} backed by {@link ProcessBuilder}.
 *
 * <p>Standard output is discarded: the tools we drive write their results to files, and an
 * undrained stdout pipe would eventually block the child.
 */
public class DefaultProcessFactory implements ProcessFactory {

  @Override
  public Process start(List<String> command) throws IOException {
    ProcessBuilder pb = new ProcessBuilder(command);
    pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
    pb.redirectErrorStream(false);
    return pb.start();
  }
}
