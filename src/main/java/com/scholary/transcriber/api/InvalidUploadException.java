package com.scholary.transcriber.api;

/** Thrown when a transcription request arrives without usable audio. */
public class InvalidUploadException extends RuntimeException {

  public InvalidUploadException(String message) {
    super(message);
  }
}
