package com.scholary.transcriber.api;

/**
 * Response for an accepted transcription request.
 *
 * <p>Returns the job ID and the URL to poll for status.
 */
public record AsyncJobResponse(String jobId, String statusUrl) {}
