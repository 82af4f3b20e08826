package com.scholary.transcriber.progress;

/** Receives (stage, percent) updates from a running pipeline. */
@FunctionalInterface
public interface ProgressListener {

  void onProgress(String stage, int percent);

  /** Listener that drops every update. */
  static ProgressListener noop() {
    return (stage, percent) -> {};
  }
}
