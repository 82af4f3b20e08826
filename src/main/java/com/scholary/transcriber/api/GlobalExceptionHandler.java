package com.scholary.transcriber.api;

import com.scholary.transcriber.exception.JobNotFoundException;
import java.time.Instant;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/**
 * Converts exceptions escaping the controllers into small JSON error bodies.
 *
 * <p>Pipeline failures never pass through here: they end up in the job's {@code error} field.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(JobNotFoundException.class)
  ResponseEntity<ApiError> handleJobNotFound(JobNotFoundException ex) {
    LOGGER.debug("Unknown job requested: {}", ex.getJobId());
    return error(HttpStatus.NOT_FOUND, "JobNotFound", ex.getMessage());
  }

  @ExceptionHandler({InvalidUploadException.class, MissingServletRequestPartException.class})
  ResponseEntity<ApiError> handleInvalidUpload(Exception ex) {
    LOGGER.warn("Rejected upload: {}", ex.getMessage());
    return error(
        HttpStatus.BAD_REQUEST, "InvalidUpload", "Audio file is required in the 'audio' field");
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  ResponseEntity<ApiError> handleTooLarge(MaxUploadSizeExceededException ex) {
    LOGGER.warn("Upload too large: {}", ex.getMessage());
    return error(HttpStatus.PAYLOAD_TOO_LARGE, "UploadTooLarge", "Audio file is too large");
  }

  @ExceptionHandler(RejectedExecutionException.class)
  ResponseEntity<ApiError> handleQueueFull(RejectedExecutionException ex) {
    LOGGER.warn("Job queue saturated: {}", ex.getMessage());
    return error(
        HttpStatus.SERVICE_UNAVAILABLE, "QueueFull", "Too many jobs in progress, retry later");
  }

  @ExceptionHandler(Exception.class)
  ResponseEntity<ApiError> handleUnexpected(Exception ex) {
    if (ex instanceof ErrorResponse errorResponse) {
      // Spring MVC's own request errors (405, 415, ...) keep their status
      LOGGER.debug("Request error: {}", ex.getMessage());
      return ResponseEntity.status(errorResponse.getStatusCode())
          .body(new ApiError("RequestError", ex.getMessage(), Instant.now().toString()));
    }
    LOGGER.error("Unexpected error", ex);
    return error(
        HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError", "An unexpected error occurred");
  }

  private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message) {
    return ResponseEntity.status(status).body(new ApiError(code, message, Instant.now().toString()));
  }

  /** Error body returned to API clients. */
  record ApiError(String errorCode, String message, String timestamp) {}
}
