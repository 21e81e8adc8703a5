package io.intellixity.calcaudit.app.web;

import io.intellixity.calcaudit.audit.KeyRecordSourceException;
import io.intellixity.calcaudit.review.ReviewLogException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/** Maps the audit's failure modes to HTTP statuses. */
@RestControllerAdvice
public final class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(KeyRecordSourceException.class)
  public ResponseEntity<Map<String, String>> sourceUnavailable(KeyRecordSourceException e) {
    log.error("calcaudit.api source_failure message={}", e.getMessage(), e);
    return error(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
  }

  @ExceptionHandler(ReviewLogException.class)
  public ResponseEntity<Map<String, String>> reviewLogFailure(ReviewLogException e) {
    log.error("calcaudit.api review_log_failure message={}", e.getMessage(), e);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
    return error(HttpStatus.BAD_REQUEST, e.getMessage());
  }

  static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
    return ResponseEntity.status(status).body(Map.of("error", message == null ? status.getReasonPhrase() : message));
  }
}
