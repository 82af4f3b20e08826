package com.scholary.transcriber.progress;

/**
 * Phases a job passes through, with the percentage reported when the phase is entered.
 *
 * <p>Transcription is the only phase whose percentage moves while it runs; it interpolates from
 * {@link #TRANSCRIBING}'s checkpoint up to {@link ProgressTracker#DISPATCH_CEILING}.
 */
public enum PipelineStage {
  QUEUED("Queued", 0),
  STARTING("Starting", 5),
  NORMALIZING("Normalizing audio", 5),
  SEGMENTING("Segmenting audio", 10),
  TRANSCRIBING("Transcribing", 20),
  FINALIZING("Finalizing", 98),
  COMPLETED("Completed", 100),
  FAILED("Failed", 100);

  private final String label;
  private final int checkpoint;

  PipelineStage(String label, int checkpoint) {
    this.label = label;
    this.checkpoint = checkpoint;
  }

  public String label() {
    return label;
  }

  public int checkpoint() {
    return checkpoint;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }
}
