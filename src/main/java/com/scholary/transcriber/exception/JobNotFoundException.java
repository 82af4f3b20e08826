package com.scholary.transcriber.exception;

/** Thrown when a status query names a job id the registry does not know (or no longer keeps). */
public class JobNotFoundException extends TranscriptionException {

  private final String jobId;

  public JobNotFoundException(String jobId) {
    super("Job not found: " + jobId);
    this.jobId = jobId;
  }

  public String getJobId() {
    return jobId;
  }
}
